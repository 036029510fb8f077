package me.golemcore.agent.domain.system.toolloop;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolChoice;
import me.golemcore.agent.port.outbound.LlmPort;

import java.util.List;

/**
 * Overrides returned by a {@link PrepareStepFunction}. Null fields keep the
 * run's configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepPreparation {

    /**
     * Context for the rest of the run.
     */
    private AgentContext context;

    private LlmPort model;
    private List<Message> messages;

    /**
     * Replaces the system message of the step; an empty string removes it.
     */
    private String system;

    private ToolChoice toolChoice;

    /**
     * Names of the tools offered in this step. An empty list offers every tool.
     */
    private List<String> activeTools;

    private boolean disableAllTools;
}
