package me.golemcore.agent.domain.model;

import java.util.List;

/**
 * Outcome of a run: every step in order, the last step's response and the
 * usage summed over all steps.
 */
public record AgentResult(List<StepResult> steps, LlmResponse response, LlmUsage totalUsage) {

    public AgentResult {
        steps = List.copyOf(steps);
    }

    public static AgentResult of(List<StepResult> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("a run has at least one step");
        }
        LlmUsage total = LlmUsage.empty();
        for (StepResult step : steps) {
            total = total.add(step.usage());
        }
        return new AgentResult(steps, steps.get(steps.size() - 1).response(), total);
    }

    public String text() {
        return response.getContent().getText();
    }
}
