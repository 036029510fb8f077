package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.Content;
import me.golemcore.agent.domain.model.ContentType;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.ReasoningContent;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.StepResult;
import me.golemcore.agent.domain.model.TextContent;
import me.golemcore.agent.domain.model.ToolCallContent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StopConditionsTest {

    private static final String SEARCH = "search";

    private static StepResult step(FinishReason reason, LlmUsage usage, Content... items) {
        LlmResponse response = LlmResponse.builder()
                .content(ResponseContent.of(List.of(items)))
                .finishReason(reason)
                .usage(usage)
                .build();
        return new StepResult(response, List.of());
    }

    private static StepResult textStep(String text) {
        return step(FinishReason.STOP, LlmUsage.of(1, 1), TextContent.of(text));
    }

    private static StepResult toolStep(String toolName) {
        return step(FinishReason.TOOL_CALLS, LlmUsage.of(1, 1), ToolCallContent.builder()
                .toolCallId("call-1")
                .toolName(toolName)
                .input("{}")
                .build());
    }

    @Test
    void shouldCountSteps() {
        StopCondition condition = StopConditions.stepCountIs(2);

        assertFalse(condition.isMet(List.of()));
        assertFalse(condition.isMet(List.of(textStep("a"))));
        assertTrue(condition.isMet(List.of(textStep("a"), textStep("b"))));
        assertTrue(condition.isMet(List.of(textStep("a"), textStep("b"), textStep("c"))));
    }

    @Test
    void shouldOnlyLookAtLastStepForToolCall() {
        StopCondition condition = StopConditions.hasToolCall(SEARCH);

        assertTrue(condition.isMet(List.of(textStep("a"), toolStep(SEARCH))));
        assertFalse(condition.isMet(List.of(toolStep(SEARCH), textStep("a"))));
        assertFalse(condition.isMet(List.of(toolStep("other"))));
        assertFalse(condition.isMet(List.of()));
    }

    @Test
    void shouldOnlyLookAtLastStepForContentType() {
        StopCondition condition = StopConditions.hasContent(ContentType.REASONING);
        StepResult reasoning = step(FinishReason.STOP, LlmUsage.empty(), ReasoningContent.of("thinking"));

        assertTrue(condition.isMet(List.of(textStep("a"), reasoning)));
        assertFalse(condition.isMet(List.of(reasoning, textStep("a"))));
    }

    @Test
    void shouldMatchFinishReasonOfLastStep() {
        StopCondition condition = StopConditions.finishReasonIs(FinishReason.LENGTH);
        StepResult truncated = step(FinishReason.LENGTH, LlmUsage.empty(), TextContent.of("cut"));

        assertTrue(condition.isMet(List.of(textStep("a"), truncated)));
        assertFalse(condition.isMet(List.of(truncated, textStep("a"))));
    }

    @Test
    void shouldSumUsageAcrossAllSteps() {
        StepResult first = step(FinishReason.TOOL_CALLS, LlmUsage.of(40, 10), TextContent.of("a"));
        StepResult second = step(FinishReason.STOP, LlmUsage.of(30, 20), TextContent.of("b"));

        assertFalse(StopConditions.maxTokensUsed(101).isMet(List.of(first, second)));
        assertTrue(StopConditions.maxTokensUsed(100).isMet(List.of(first, second)));
        assertFalse(StopConditions.maxTokensUsed(100).isMet(List.of(first)));
    }

    @Test
    void shouldCombineConditionsWithOr() {
        List<StopCondition> conditions = List.of(StopConditions.stepCountIs(5),
                StopConditions.hasToolCall(SEARCH));

        assertTrue(StopConditions.isAnyMet(conditions, List.of(toolStep(SEARCH))));
        assertFalse(StopConditions.isAnyMet(conditions, List.of(textStep("a"))));
        assertFalse(StopConditions.isAnyMet(List.of(), List.of(textStep("a"))));
        assertFalse(StopConditions.isAnyMet(null, List.of(textStep("a"))));
    }
}
