package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.StreamProtocolException;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.CallWarning;
import me.golemcore.agent.domain.model.Content;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ReasoningContent;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.SourceContent;
import me.golemcore.agent.domain.model.StreamPart;
import me.golemcore.agent.domain.model.TextContent;
import me.golemcore.agent.domain.model.ToolCallContent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the content of one streamed step from its events.
 *
 * <p>
 * Text and reasoning blocks are buffered per block id between start and end
 * and become one content item at their end event. Tool input deltas are only
 * buffered for observers: the {@code tool-call} event carries the complete call,
 * which is validated on arrival and replaces any buffered input. Sources are
 * appended as they come. An {@code error} event aborts the step.
 *
 * <p>
 * One instance handles one attempt of one step and is not thread-safe.
 */
public class StepStreamReconstructor {

    private final AgentContext context;
    private final AgentStreamListener listener;
    private final ToolCallValidator validator;
    private final List<ToolComponent> tools;
    private final String systemPrompt;
    private final List<Message> messages;
    private final RepairToolCallFunction repair;

    private final List<Content> content = new ArrayList<>();
    private final List<ToolCallContent> toolCalls = new ArrayList<>();
    private final List<CallWarning> warnings = new ArrayList<>();
    private final Map<String, StringBuilder> textBlocks = new LinkedHashMap<>();
    private final Map<String, ReasoningContent> reasoningBlocks = new LinkedHashMap<>();
    private final Map<String, ToolCallContent> toolInputs = new LinkedHashMap<>();

    private LlmUsage usage = LlmUsage.empty();
    private FinishReason finishReason = FinishReason.UNKNOWN;
    private Map<String, Object> providerMetadata;

    public StepStreamReconstructor(AgentContext context, AgentStreamListener listener, ToolCallValidator validator,
            List<ToolComponent> tools, String systemPrompt, List<Message> messages, RepairToolCallFunction repair) {
        this.context = context;
        this.listener = listener;
        this.validator = validator;
        this.tools = tools;
        this.systemPrompt = systemPrompt;
        this.messages = messages;
        this.repair = repair;
    }

    public void accept(StreamPart part) {
        listener.onChunk(part);

        switch (part.getType()) {
        case TEXT_START -> {
            textBlocks.put(part.getId(), new StringBuilder());
            listener.onTextStart(part.getId());
        }
        case TEXT_DELTA -> {
            StringBuilder text = textBlocks.get(part.getId());
            if (text != null) {
                text.append(nullToEmpty(part.getDelta()));
            }
            listener.onTextDelta(part.getId(), part.getDelta());
        }
        case TEXT_END -> {
            StringBuilder text = textBlocks.remove(part.getId());
            if (text != null) {
                content.add(TextContent.builder()
                        .text(text.toString())
                        .providerMetadata(part.getProviderMetadata())
                        .build());
            }
            listener.onTextEnd(part.getId());
        }
        case REASONING_START -> {
            reasoningBlocks.put(part.getId(), ReasoningContent.builder()
                    .text("")
                    .providerMetadata(part.getProviderMetadata())
                    .build());
            listener.onReasoningStart(part.getId());
        }
        case REASONING_DELTA -> {
            ReasoningContent reasoning = reasoningBlocks.get(part.getId());
            if (reasoning != null) {
                reasoning.setText(reasoning.getText() + nullToEmpty(part.getDelta()));
                if (part.getProviderMetadata() != null) {
                    reasoning.setProviderMetadata(part.getProviderMetadata());
                }
            }
            listener.onReasoningDelta(part.getId(), part.getDelta());
        }
        case REASONING_END -> {
            ReasoningContent reasoning = reasoningBlocks.remove(part.getId());
            if (reasoning != null) {
                if (part.getProviderMetadata() != null) {
                    reasoning.setProviderMetadata(part.getProviderMetadata());
                }
                content.add(reasoning);
            }
            listener.onReasoningEnd(part.getId(), reasoning);
        }
        case TOOL_INPUT_START -> {
            toolInputs.put(part.getId(), ToolCallContent.builder()
                    .toolCallId(part.getId())
                    .toolName(part.getToolCallName())
                    .input("")
                    .providerExecuted(part.isProviderExecuted())
                    .build());
            listener.onToolInputStart(part.getId(), part.getToolCallName());
        }
        case TOOL_INPUT_DELTA -> {
            ToolCallContent pending = toolInputs.get(part.getId());
            if (pending != null) {
                pending.setInput(pending.getInput() + nullToEmpty(part.getDelta()));
            }
            listener.onToolInputDelta(part.getId(), part.getDelta());
        }
        case TOOL_INPUT_END -> listener.onToolInputEnd(part.getId());
        case TOOL_CALL -> {
            toolInputs.remove(part.getId());
            ToolCallContent call = ToolCallContent.builder()
                    .toolCallId(part.getId())
                    .toolName(part.getToolCallName())
                    .input(part.getDelta())
                    .providerExecuted(part.isProviderExecuted())
                    .providerMetadata(part.getProviderMetadata())
                    .build();
            ToolCallContent validated = validator.validateAndRepair(context, call, tools, systemPrompt, messages,
                    repair);
            content.add(validated);
            toolCalls.add(validated);
            listener.onToolCall(validated);
        }
        case SOURCE -> {
            SourceContent source = SourceContent.builder()
                    .sourceType(part.getSourceType())
                    .id(part.getId())
                    .url(part.getUrl())
                    .title(part.getTitle())
                    .providerMetadata(part.getProviderMetadata())
                    .build();
            content.add(source);
            listener.onSource(source);
        }
        case FINISH -> {
            usage = part.getUsage() != null ? part.getUsage() : LlmUsage.empty();
            finishReason = part.getFinishReason() != null ? part.getFinishReason() : FinishReason.UNKNOWN;
            providerMetadata = part.getProviderMetadata();
            listener.onStreamFinish(usage, finishReason, providerMetadata);
        }
        case WARNINGS -> {
            if (part.getWarnings() != null) {
                warnings.addAll(part.getWarnings());
            }
            listener.onWarnings(part.getWarnings());
        }
        case ERROR -> throw toException(part.getError());
        default -> throw new StreamProtocolException("unknown stream part type: " + part.getType());
        }
    }

    /**
     * The step's response as reconstructed so far. Unfinished text and
     * reasoning blocks are left out.
     */
    public LlmResponse toResponse() {
        return LlmResponse.builder()
                .content(ResponseContent.of(content))
                .finishReason(finishReason)
                .usage(usage)
                .warnings(new ArrayList<>(warnings))
                .providerMetadata(providerMetadata)
                .build();
    }

    public List<ToolCallContent> getToolCalls() {
        return List.copyOf(toolCalls);
    }

    private static RuntimeException toException(Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        if (error == null) {
            return new StreamProtocolException("stream reported an error without details");
        }
        return new StreamProtocolException(error.getMessage(), error);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
