package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.domain.model.ToolResultContent;
import me.golemcore.agent.domain.model.ToolResultOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Sequential {@link ToolExecutorPort}.
 *
 * <p>
 * Invalid calls get an error result without running the tool. Calls executed
 * by the provider are skipped. A tool whose future fails, or that does not
 * answer within the timeout, aborts the step with a
 * {@link ToolExecutionException} after the listener has seen an error result
 * for it.
 */
public class DefaultToolExecutor implements ToolExecutorPort {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolExecutor.class);

    private final Duration timeout;

    public DefaultToolExecutor(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public List<ToolResultContent> execute(AgentContext context, List<ToolComponent> tools,
            List<ToolCallContent> calls, ToolResultListener listener) {
        List<ToolResultContent> results = new ArrayList<>();
        for (ToolCallContent call : calls) {
            if (call.isProviderExecuted()) {
                continue;
            }
            ToolResultContent result = call.isInvalid()
                    ? errorResult(call, call.getValidationError())
                    : run(context, tools, call, listener);
            results.add(result);
            if (listener != null) {
                listener.onToolResult(result);
            }
        }
        return results;
    }

    private ToolResultContent run(AgentContext context, List<ToolComponent> tools, ToolCallContent call,
            ToolResultListener listener) {
        ToolComponent tool = ToolCallValidator.findTool(tools, call.getToolName());
        if (tool == null) {
            return errorResult(call, "tool not found: " + call.getToolName());
        }

        log.debug("[Tools] Executing {} ({})", call.getToolName(), call.getToolCallId());
        ToolResponse response;
        try {
            response = context.await(tool.execute(context, call.toToolCall()), timeout);
            if (response == null) {
                throw new IllegalStateException("tool returned no response");
            }
        } catch (AgentCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[Tools] Tool {} ({}) failed: {}", call.getToolName(), call.getToolCallId(), e.getMessage());
            if (listener != null) {
                listener.onToolResult(errorResult(call, e.getMessage()));
            }
            throw new ToolExecutionException(call.getToolCallId(), call.getToolName(), e);
        }

        return ToolResultContent.builder()
                .toolCallId(call.getToolCallId())
                .toolName(call.getToolName())
                .result(response.toOutput())
                .clientMetadata(response.getMetadata())
                .build();
    }

    private static ToolResultContent errorResult(ToolCallContent call, String message) {
        return ToolResultContent.builder()
                .toolCallId(call.getToolCallId())
                .toolName(call.getToolName())
                .result(ToolResultOutput.error(message))
                .build();
    }
}
