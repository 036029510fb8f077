package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;

/**
 * Hook called before every step. May return null to change nothing.
 */
@FunctionalInterface
public interface PrepareStepFunction {

    StepPreparation prepare(AgentContext context, PrepareStepOptions options);
}
