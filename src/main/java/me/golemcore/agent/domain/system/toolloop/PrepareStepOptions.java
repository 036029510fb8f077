package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.StepResult;
import me.golemcore.agent.port.outbound.LlmPort;

import java.util.List;

/**
 * Input of a {@link PrepareStepFunction}: the model about to be called, the
 * steps completed so far, the zero-based number of the upcoming step and the
 * messages it will send.
 */
public record PrepareStepOptions(LlmPort model, List<StepResult> steps, int stepNumber, List<Message> messages) {
}
