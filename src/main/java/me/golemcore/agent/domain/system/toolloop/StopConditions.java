package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ContentType;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.StepResult;

import java.util.List;

/**
 * Standard stop conditions. All except {@link #maxTokensUsed(long)} look at
 * the last step only.
 */
public final class StopConditions {

    private StopConditions() {
    }

    /**
     * Met once at least {@code count} steps have completed.
     */
    public static StopCondition stepCountIs(int count) {
        return steps -> steps.size() >= count;
    }

    /**
     * Met when the last step contains a call to the named tool.
     */
    public static StopCondition hasToolCall(String toolName) {
        return steps -> !steps.isEmpty() && last(steps).content().getToolCalls().stream()
                .anyMatch(call -> toolName.equals(call.getToolName()));
    }

    /**
     * Met when the last step contains an item of the given type.
     */
    public static StopCondition hasContent(ContentType type) {
        return steps -> !steps.isEmpty() && last(steps).content().hasType(type);
    }

    public static StopCondition finishReasonIs(FinishReason reason) {
        return steps -> !steps.isEmpty() && last(steps).finishReason() == reason;
    }

    /**
     * Met once the total tokens of all steps reach {@code maxTokens}.
     */
    public static StopCondition maxTokensUsed(long maxTokens) {
        return steps -> {
            LlmUsage total = LlmUsage.empty();
            for (StepResult step : steps) {
                total = total.add(step.usage());
            }
            return total.getTotalTokens() >= maxTokens;
        };
    }

    /**
     * True if any of {@code conditions} is met. An empty list never stops.
     */
    public static boolean isAnyMet(List<StopCondition> conditions, List<StepResult> steps) {
        if (conditions == null) {
            return false;
        }
        for (StopCondition condition : conditions) {
            if (condition.isMet(steps)) {
                return true;
            }
        }
        return false;
    }

    private static StepResult last(List<StepResult> steps) {
        return steps.get(steps.size() - 1);
    }
}
