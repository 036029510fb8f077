package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.StepResult;

import java.util.List;

/**
 * Predicate over the steps completed so far, evaluated after every step. The
 * run ends as soon as any configured condition is met.
 */
@FunctionalInterface
public interface StopCondition {

    boolean isMet(List<StepResult> steps);
}
