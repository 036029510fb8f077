package me.golemcore.agent.domain.system.toolloop;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessagePart;
import me.golemcore.agent.domain.model.ToolChoice;
import me.golemcore.agent.domain.service.RetryListener;

import java.util.List;
import java.util.Map;

/**
 * One run request: the prompt, prior conversation and per-call overrides of
 * {@link AgentSettings}. Unset overrides fall back to the settings; provider
 * options are merged with call entries winning.
 */
@Data
@Builder(toBuilder = true)
public class AgentCall {

    private String prompt;

    @Singular
    private List<MessagePart.FilePart> files;

    @Singular
    private List<Message> messages;

    private Long maxOutputTokens;
    private Double temperature;
    private Double topP;
    private Integer topK;
    private Double presencePenalty;
    private Double frequencyPenalty;

    private Map<String, String> headers;
    private Map<String, Object> providerOptions;

    private ToolChoice toolChoice;

    /**
     * Names of the tools offered in every step; empty offers all tools.
     */
    @Singular
    private List<String> activeTools;

    private Integer maxRetries;
    private RetryListener onRetry;

    @Singular("stopCondition")
    private List<StopCondition> stopWhen;

    private PrepareStepFunction prepareStep;
    private RepairToolCallFunction repairToolCall;

    public static AgentCall of(String prompt) {
        return AgentCall.builder().prompt(prompt).build();
    }
}
