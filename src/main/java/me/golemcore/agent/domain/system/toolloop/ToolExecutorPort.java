package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolResultContent;

import java.util.List;

/**
 * Hexagonal outbound port for running the validated tool calls of one step.
 *
 * <p>
 * ToolLoopSystem is the owner of the loop; it invokes this port once per step.
 */
public interface ToolExecutorPort {

    /**
     * Runs {@code calls} one after another, in order.
     *
     * @param listener
     *            notified after each result, may be null
     * @return one result per executed call, in call order
     * @throws me.golemcore.agent.domain.exception.ToolExecutionException
     *             if a tool could not run; remaining calls are skipped
     */
    List<ToolResultContent> execute(AgentContext context, List<ToolComponent> tools, List<ToolCallContent> calls,
            ToolResultListener listener);
}
