package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.CallWarning;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.ReasoningContent;
import me.golemcore.agent.domain.model.SourceContent;
import me.golemcore.agent.domain.model.StepResult;
import me.golemcore.agent.domain.model.StreamPart;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolResultContent;

import java.util.List;
import java.util.Map;

/**
 * Observer of a streamed run. Every method defaults to a no-op; implement the
 * ones you need.
 *
 * <p>
 * Each stream event is first passed to {@link #onChunk(StreamPart)} and then
 * to its specific method. Anything a method throws aborts the run and is
 * rethrown to the caller unchanged. If a retried step is restarted, events of
 * the failed attempt have already been delivered.
 */
public interface AgentStreamListener extends ToolResultListener {

    AgentStreamListener NOOP = new AgentStreamListener() {
    };

    default void onAgentStart() {
    }

    default void onStepStart(int stepNumber) {
    }

    default void onChunk(StreamPart part) {
    }

    default void onWarnings(List<CallWarning> warnings) {
    }

    default void onTextStart(String id) {
    }

    default void onTextDelta(String id, String delta) {
    }

    default void onTextEnd(String id) {
    }

    default void onReasoningStart(String id) {
    }

    default void onReasoningDelta(String id, String delta) {
    }

    /**
     * Called with the completed reasoning block.
     */
    default void onReasoningEnd(String id, ReasoningContent reasoning) {
    }

    default void onToolInputStart(String id, String toolName) {
    }

    default void onToolInputDelta(String id, String delta) {
    }

    default void onToolInputEnd(String id) {
    }

    /**
     * Called with the validated (possibly repaired or invalid) tool call.
     */
    default void onToolCall(ToolCallContent toolCall) {
    }

    @Override
    default void onToolResult(ToolResultContent result) {
    }

    default void onSource(SourceContent source) {
    }

    default void onStreamFinish(LlmUsage usage, FinishReason finishReason, Map<String, Object> providerMetadata) {
    }

    default void onStepFinish(StepResult step) {
    }

    default void onAgentFinish(AgentResult result) {
    }

    /**
     * Called once before a failed run rethrows {@code error}.
     */
    default void onError(Throwable error) {
    }
}
