package me.golemcore.agent.domain.model;

import java.util.List;
import java.util.Map;

/**
 * One completed step: the model response (with tool results appended to its
 * content) and the response messages it contributed to the conversation.
 */
public record StepResult(LlmResponse response, List<Message> messages) {

    public StepResult {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public ResponseContent content() {
        return response.getContent();
    }

    public FinishReason finishReason() {
        return response.getFinishReason();
    }

    public LlmUsage usage() {
        return response.getUsage();
    }

    public List<CallWarning> warnings() {
        return response.getWarnings();
    }

    public Map<String, Object> providerMetadata() {
        return response.getProviderMetadata();
    }
}
