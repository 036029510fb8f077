package me.golemcore.agent.domain.system.toolloop;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.service.RetryListener;

import java.util.List;
import java.util.Map;

/**
 * Configuration an agent is built with. Every field except the tools can be
 * overridden per call through {@link AgentCall}.
 */
@Data
@Builder(toBuilder = true)
public class AgentSettings {

    private String systemPrompt;

    private Long maxOutputTokens;
    private Double temperature;
    private Double topP;
    private Integer topK;
    private Double presencePenalty;
    private Double frequencyPenalty;

    private Map<String, String> headers;
    private Map<String, Object> providerOptions;

    @Singular
    private List<ToolComponent> tools;

    /**
     * Retries per model call; null uses the retry defaults.
     */
    private Integer maxRetries;

    @Singular("stopCondition")
    private List<StopCondition> stopWhen;

    private PrepareStepFunction prepareStep;
    private RepairToolCallFunction repairToolCall;
    private RetryListener onRetry;

    public static AgentSettings defaults() {
        return AgentSettings.builder().build();
    }
}
