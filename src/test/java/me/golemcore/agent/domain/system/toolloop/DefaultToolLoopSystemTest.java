package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.ApiCallException;
import me.golemcore.agent.domain.exception.InvalidArgumentException;
import me.golemcore.agent.domain.exception.RetryException;
import me.golemcore.agent.domain.exception.ToolExecutionException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.Content;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessagePart;
import me.golemcore.agent.domain.model.MessageRole;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.StepResult;
import me.golemcore.agent.domain.model.TextContent;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolChoice;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.domain.model.ToolResultContent;
import me.golemcore.agent.domain.model.ToolResultOutput;
import me.golemcore.agent.domain.service.RetryExecutor;
import me.golemcore.agent.domain.service.RetryOptions;
import me.golemcore.agent.domain.system.toolloop.view.DefaultConversationViewBuilder;
import me.golemcore.agent.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolLoopSystemTest {

    private static final String PROMPT = "test";
    private static final String TOOL_NAME = "tool1";
    private static final String OTHER_TOOL = "tool2";
    private static final String CALL_ID = "call-1";
    private static final String VALID_INPUT = "{\"value\":\"value\"}";
    private static final String HELLO = "Hello, world!";
    private static final String SYSTEM_PROMPT = "You are helpful.";

    @Mock
    private LlmPort llmPort;

    private RecordingTool tool;
    private RecordingTool otherTool;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        tool = new RecordingTool(TOOL_NAME, "value").respondingWith(ToolResponse.text("tool output"));
        otherTool = new RecordingTool(OTHER_TOOL);
    }

    private DefaultToolLoopSystem system(AgentSettings settings) {
        return new DefaultToolLoopSystem(llmPort, settings, new DefaultToolExecutor(Duration.ofSeconds(5)),
                new ToolCallValidator(), new DefaultResponseMessageMapper(), new DefaultConversationViewBuilder(),
                new RetryExecutor(), RetryOptions.builder().initialDelay(Duration.ZERO).build());
    }

    private DefaultToolLoopSystem systemWithTools() {
        return system(AgentSettings.builder().systemPrompt(SYSTEM_PROMPT).tool(tool).tool(otherTool).build());
    }

    private static CompletableFuture<LlmResponse> completed(LlmResponse response) {
        return CompletableFuture.completedFuture(response);
    }

    private static LlmResponse textResponse(String text, LlmUsage usage) {
        return LlmResponse.builder()
                .content(ResponseContent.of(List.of(TextContent.of(text))))
                .finishReason(FinishReason.STOP)
                .usage(usage)
                .build();
    }

    private static LlmResponse toolCallResponse(String toolName, String input, LlmUsage usage) {
        return LlmResponse.builder()
                .content(ResponseContent.of(List.of(
                        TextContent.of("let me check"),
                        ToolCallContent.builder().toolCallId(CALL_ID).toolName(toolName).input(input).build())))
                .finishReason(FinishReason.TOOL_CALLS)
                .usage(usage)
                .build();
    }

    private List<LlmRequest> capturedRequests(int calls) {
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(calls)).chat(captor.capture());
        return captor.getAllValues();
    }

    // ==================== basic flow ====================

    @Test
    void shouldRunSecondStepAfterToolCall() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(3, 10))),
                completed(textResponse(HELLO, LlmUsage.of(3, 10))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        assertEquals(2, result.steps().size());
        ResponseContent finalContent = result.response().getContent();
        assertEquals(1, finalContent.size());
        assertEquals(HELLO, finalContent.getText());
        assertEquals(6, result.totalUsage().getInputTokens());
        assertEquals(20, result.totalUsage().getOutputTokens());
        assertEquals(26, result.totalUsage().getTotalTokens());
        assertSame(result.steps().get(1).response(), result.response());

        assertEquals(1, tool.getCalls().size());
        assertEquals(VALID_INPUT, tool.getCalls().get(0).input());
    }

    @Test
    void shouldAppendToolResultsAfterModelContent() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        List<Content> items = result.steps().get(0).content().items();
        assertEquals(3, items.size());
        assertInstanceOf(TextContent.class, items.get(0));
        assertInstanceOf(ToolCallContent.class, items.get(1));
        ToolResultContent toolResult = assertInstanceOf(ToolResultContent.class, items.get(2));
        assertEquals(CALL_ID, toolResult.getToolCallId());
        assertEquals(new ToolResultOutput.Text("tool output"), toolResult.getResult());

        List<Message> stepMessages = result.steps().get(0).messages();
        assertEquals(List.of(MessageRole.ASSISTANT, MessageRole.TOOL),
                stepMessages.stream().map(Message::getRole).toList());
    }

    @Test
    void shouldFeedResponseMessagesIntoNextStep() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        systemWithTools().generate(AgentCall.of(PROMPT));

        List<LlmRequest> requests = capturedRequests(2);
        assertEquals(List.of(MessageRole.SYSTEM, MessageRole.USER),
                requests.get(0).getPrompt().stream().map(Message::getRole).toList());
        assertEquals(List.of(MessageRole.SYSTEM, MessageRole.USER, MessageRole.ASSISTANT, MessageRole.TOOL),
                requests.get(1).getPrompt().stream().map(Message::getRole).toList());
        assertEquals(SYSTEM_PROMPT, requests.get(0).getPrompt().get(0).getText());
        assertEquals(PROMPT, requests.get(0).getPrompt().get(1).getText());
        assertEquals(ToolChoice.AUTO, requests.get(0).getToolChoice());
    }

    @Test
    void shouldStopAfterSingleStepWhenModelStops() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.of(2, 3))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        assertEquals(1, result.steps().size());
        assertEquals(HELLO, result.text());
        assertEquals(5, result.totalUsage().getTotalTokens());
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldStopWhenToolCallsComeWithOtherFinishReason() {
        LlmResponse truncated = toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1)).toBuilder()
                .finishReason(FinishReason.LENGTH)
                .build();
        when(llmPort.chat(any())).thenReturn(completed(truncated));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        assertEquals(1, result.steps().size());
        assertEquals(1, tool.getCalls().size());
    }

    @Test
    void shouldRejectEmptyPromptBeforeCallingModel() {
        InvalidArgumentException error = assertThrows(InvalidArgumentException.class,
                () -> systemWithTools().generate(AgentCall.of("")));

        assertEquals("prompt", error.getArgument());
        assertTrue(error.getMessage().contains("prompt can't be empty"));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldIncludePriorMessagesAndFiles() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.empty())));
        byte[] image = new byte[] { 1, 2, 3 };

        systemWithTools().generate(AgentCall.builder()
                .prompt(PROMPT)
                .message(Message.user("earlier question"))
                .message(Message.assistant(List.of(new MessagePart.TextPart("earlier answer"))))
                .file(new MessagePart.FilePart("pic.png", image, "image/png"))
                .build());

        List<Message> prompt = capturedRequests(1).get(0).getPrompt();
        assertEquals(4, prompt.size());
        Message user = prompt.get(3);
        assertEquals(2, user.getContent().size());
        MessagePart.FilePart file = assertInstanceOf(MessagePart.FilePart.class, user.getContent().get(1));
        assertEquals("image/png", file.mediaType());
    }

    // ==================== validation and repair ====================

    @Test
    void shouldReportMissingParameterToModelWithoutRunningTool() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, "{\"other\":1}", LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        ToolCallContent call = result.steps().get(0).content().getToolCalls().get(0);
        assertTrue(call.isInvalid());
        assertTrue(call.getValidationError().contains("missing required parameter: value"));
        assertTrue(tool.getCalls().isEmpty());

        ToolResultContent toolResult = result.steps().get(0).content().getToolResults().get(0);
        assertEquals(new ToolResultOutput.Error("missing required parameter: value"), toolResult.getResult());
        assertEquals(2, result.steps().size());
    }

    @Test
    void shouldRunRepairedToolCall() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, "{}", LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));
        AgentCall call = AgentCall.builder()
                .prompt(PROMPT)
                .repairToolCall((ctx, options) -> options.originalCall().toBuilder().input(VALID_INPUT).build())
                .build();

        AgentResult result = systemWithTools().generate(call);

        ToolCallContent repaired = result.steps().get(0).content().getToolCalls().get(0);
        assertFalse(repaired.isInvalid());
        assertEquals(VALID_INPUT, repaired.getInput());
        assertEquals(VALID_INPUT, tool.getCalls().get(0).input());
    }

    @Test
    void shouldUseSettingsRepairHookWhenCallHasNone() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, "{}", LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));
        AgentSettings settings = AgentSettings.builder()
                .tool(tool)
                .repairToolCall((ctx, options) -> options.originalCall().toBuilder().input(VALID_INPUT).build())
                .build();

        system(settings).generate(AgentCall.of(PROMPT));

        assertEquals(1, tool.getCalls().size());
    }

    @Test
    void shouldRejectCallToToolOutsideActiveSet() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.builder()
                .prompt(PROMPT)
                .activeTool(OTHER_TOOL)
                .build());

        ToolCallContent call = result.steps().get(0).content().getToolCalls().get(0);
        assertTrue(call.isInvalid());
        assertEquals("tool not found: " + TOOL_NAME, call.getValidationError());
        assertTrue(tool.getCalls().isEmpty());
    }

    // ==================== tool outcomes ====================

    @Test
    void shouldContinueWhenToolReportsError() {
        tool.respondingWith(ToolResponse.error("no such city"));
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        assertEquals(2, result.steps().size());
        assertTrue(result.steps().get(0).content().getToolResults().get(0).isError());
    }

    @Test
    void shouldAbortWhenToolFails() {
        IllegalStateException failure = new IllegalStateException("connection refused");
        tool.failingWith(failure);
        when(llmPort.chat(any())).thenReturn(completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))));

        ToolExecutionException error = assertThrows(ToolExecutionException.class,
                () -> systemWithTools().generate(AgentCall.of(PROMPT)));

        assertSame(failure, error.getCause());
        verify(llmPort, times(1)).chat(any());
    }

    @Test
    void shouldSendMediaResultsAsBase64() {
        byte[] png = new byte[] { 9, 8, 7 };
        tool.respondingWith(ToolResponse.image(png, "image/png"));
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        ToolResultOutput output = result.steps().get(0).content().getToolResults().get(0).getResult();
        ToolResultOutput.Media media = assertInstanceOf(ToolResultOutput.Media.class, output);
        assertEquals(Base64.getEncoder().encodeToString(png), media.data());
        assertEquals("image/png", media.mediaType());
    }

    // ==================== stop conditions ====================

    @Test
    void shouldStopWhenStopConditionMet() {
        when(llmPort.chat(any())).thenReturn(completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.builder()
                .prompt(PROMPT)
                .stopCondition(StopConditions.stepCountIs(1))
                .build());

        assertEquals(1, result.steps().size());
        assertEquals(1, tool.getCalls().size());
    }

    @Test
    void shouldPreferCallStopConditionsOverSettings() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));
        AgentSettings settings = AgentSettings.builder()
                .tool(tool)
                .stopCondition(StopConditions.stepCountIs(1))
                .build();

        AgentResult result = system(settings).generate(AgentCall.builder()
                .prompt(PROMPT)
                .stopCondition(StopConditions.stepCountIs(2))
                .build());

        assertEquals(2, result.steps().size());
    }

    // ==================== tools and step preparation ====================

    @Test
    void shouldOfferOnlyActiveTools() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.empty())));

        systemWithTools().generate(AgentCall.builder().prompt(PROMPT).activeTool(OTHER_TOOL).build());

        List<ToolDefinition> tools = capturedRequests(1).get(0).getTools();
        assertEquals(List.of(OTHER_TOOL), tools.stream().map(ToolDefinition::getName).toList());
    }

    @Test
    void shouldDescribeToolInputAsObjectSchema() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.empty())));

        systemWithTools().generate(AgentCall.of(PROMPT));

        ToolDefinition definition = capturedRequests(1).get(0).getTools().get(0);
        assertEquals(TOOL_NAME, definition.getName());
        assertEquals("object", definition.getInputSchema().get("type"));
        assertEquals(List.of("value"), definition.getInputSchema().get("required"));
        assertTrue(((Map<?, ?>) definition.getInputSchema().get("properties")).containsKey("value"));
    }

    @Test
    void shouldNotOfferDisabledTools() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.empty())));
        AgentSettings settings = AgentSettings.builder().tool(tool).tool(otherTool.disabled()).build();

        system(settings).generate(AgentCall.of(PROMPT));

        assertEquals(List.of(TOOL_NAME),
                capturedRequests(1).get(0).getTools().stream().map(ToolDefinition::getName).toList());
    }

    @Test
    void shouldApplyStepPreparationOverrides() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 1))),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));
        List<PrepareStepOptions> seen = new ArrayList<>();
        AgentCall call = AgentCall.builder()
                .prompt(PROMPT)
                .prepareStep((ctx, options) -> {
                    seen.add(options);
                    if (options.stepNumber() == 0) {
                        return StepPreparation.builder()
                                .system("Step zero system")
                                .toolChoice(ToolChoice.specific(TOOL_NAME))
                                .activeTools(List.of(TOOL_NAME))
                                .build();
                    }
                    return StepPreparation.builder().disableAllTools(true).system("").build();
                })
                .build();

        systemWithTools().generate(call);

        assertEquals(List.of(0, 1), seen.stream().map(PrepareStepOptions::stepNumber).toList());
        assertEquals(1, seen.get(1).steps().size());
        assertSame(llmPort, seen.get(0).model());

        List<LlmRequest> requests = capturedRequests(2);
        LlmRequest first = requests.get(0);
        assertEquals("Step zero system", first.getPrompt().get(0).getText());
        assertEquals(2, first.getPrompt().size());
        assertEquals(ToolChoice.specific(TOOL_NAME), first.getToolChoice());
        assertEquals(List.of(TOOL_NAME), first.getTools().stream().map(ToolDefinition::getName).toList());

        LlmRequest second = requests.get(1);
        assertTrue(second.getTools().isEmpty());
        assertEquals(MessageRole.USER, second.getPrompt().get(0).getRole());
    }

    @Test
    void shouldTreatEmptyActiveToolsFromPreparerAsAllTools() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.empty())));
        AgentCall call = AgentCall.builder()
                .prompt(PROMPT)
                .activeTool(OTHER_TOOL)
                .prepareStep((ctx, options) -> StepPreparation.builder().activeTools(List.of()).build())
                .build();

        systemWithTools().generate(call);

        assertEquals(2, capturedRequests(1).get(0).getTools().size());
    }

    @Test
    void shouldCallModelReturnedByPreparer() {
        LlmPort other = mock(LlmPort.class);
        when(other.chat(any())).thenReturn(completed(textResponse("from other", LlmUsage.empty())));
        AgentCall call = AgentCall.builder()
                .prompt(PROMPT)
                .prepareStep((ctx, options) -> StepPreparation.builder().model(other).build())
                .build();

        AgentResult result = systemWithTools().generate(call);

        assertEquals("from other", result.text());
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldPropagatePreparerFailure() {
        IllegalStateException failure = new IllegalStateException("bad hook");
        AgentCall call = AgentCall.builder()
                .prompt(PROMPT)
                .prepareStep((ctx, options) -> {
                    throw failure;
                })
                .build();

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> systemWithTools().generate(call));

        assertSame(failure, thrown);
    }

    // ==================== settings merge ====================

    @Test
    void shouldLetCallOverrideSettings() {
        when(llmPort.chat(any())).thenReturn(completed(textResponse(HELLO, LlmUsage.empty())));
        AgentSettings settings = AgentSettings.builder()
                .temperature(0.2)
                .maxOutputTokens(100L)
                .topP(0.9)
                .providerOptions(Map.of("a", 1, "b", 2))
                .headers(Map.of("x-team", "core"))
                .build();

        system(settings).generate(AgentCall.builder()
                .prompt(PROMPT)
                .temperature(0.7)
                .providerOptions(Map.of("b", 3))
                .build());

        LlmRequest request = capturedRequests(1).get(0);
        assertEquals(0.7, request.getTemperature());
        assertEquals(100L, request.getMaxOutputTokens());
        assertEquals(0.9, request.getTopP());
        assertNull(request.getTopK());
        assertEquals(Map.of("a", 1, "b", 3), request.getProviderOptions());
        assertEquals(Map.of("x-team", "core"), request.getHeaders());
        assertTrue(request.getTools().isEmpty());
    }

    // ==================== retries and cancellation ====================

    @Test
    void shouldRetryRetryableModelFailure() {
        List<Duration> retries = new ArrayList<>();
        when(llmPort.chat(any())).thenReturn(
                CompletableFuture.failedFuture(new ApiCallException("overloaded", 529, Map.of(), null)),
                completed(textResponse(HELLO, LlmUsage.of(1, 1))));

        AgentResult result = systemWithTools().generate(AgentCall.builder()
                .prompt(PROMPT)
                .onRetry((error, delay) -> retries.add(delay))
                .build());

        assertEquals(HELLO, result.text());
        assertEquals(1, retries.size());
        verify(llmPort, times(2)).chat(any());
    }

    @Test
    void shouldSurfaceModelFailureAfterRetriesExhausted() {
        when(llmPort.chat(any())).thenReturn(
                CompletableFuture.failedFuture(new ApiCallException("busy", 503, Map.of(), null)));

        RetryException error = assertThrows(RetryException.class,
                () -> systemWithTools().generate(AgentCall.builder().prompt(PROMPT).maxRetries(1).build()));

        assertEquals(RetryException.Reason.MAX_RETRIES_EXCEEDED, error.getReason());
        assertEquals(2, error.getErrors().size());
    }

    @Test
    void shouldFailWhenContextCancelled() {
        AgentContext context = AgentContext.create();
        context.cancel();

        assertThrows(AgentCancelledException.class, () -> systemWithTools().generate(context, AgentCall.of(PROMPT)));
        verify(llmPort, never()).chat(any());
    }

    @Test
    void shouldKeepEveryStepInOrder() {
        when(llmPort.chat(any())).thenReturn(
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(1, 0))),
                completed(toolCallResponse(TOOL_NAME, VALID_INPUT, LlmUsage.of(2, 0))),
                completed(textResponse(HELLO, LlmUsage.of(4, 0))));

        AgentResult result = systemWithTools().generate(AgentCall.of(PROMPT));

        assertEquals(List.of(1L, 2L, 4L), result.steps().stream()
                .map(StepResult::usage)
                .map(LlmUsage::getInputTokens)
                .toList());
        assertEquals(7, result.totalUsage().getInputTokens());
    }

    @Test
    void shouldShareContinuationRule() {
        assertTrue(DefaultToolLoopSystem.shouldContinue(1, FinishReason.TOOL_CALLS));
        assertFalse(DefaultToolLoopSystem.shouldContinue(0, FinishReason.TOOL_CALLS));
        assertFalse(DefaultToolLoopSystem.shouldContinue(2, FinishReason.STOP));
    }
}
