package me.golemcore.agent.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.ApiCallException;
import me.golemcore.agent.domain.model.CallWarning;
import me.golemcore.agent.domain.model.Content;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.MessagePart;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.StreamPart;
import me.golemcore.agent.domain.model.TextContent;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolChoice;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResultOutput;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link LlmPort} on top of a langchain4j {@link ChatModel}.
 *
 * <p>
 * Supports OpenAI (and any OpenAI-compatible endpoint) and Anthropic models.
 * Retries are left to the agent loop: the wrapped model must be built with
 * {@code maxRetries(0)}, and failures are reported as
 * {@link ApiCallException}s, rate limits and timeouts being retryable. A
 * {@code reset_seconds} hint in a rate limit error becomes a
 * {@code retry-after} header.
 *
 * <p>
 * langchain4j has no incremental tool call events, so {@link #chatStream}
 * performs a complete call and replays the response as stream events.
 */
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_ANTHROPIC = "anthropic";

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final Pattern RESET_SECONDS_PATTERN = Pattern.compile("\"reset_seconds\"\\s*:\\s*(\\d+)");

    private final ChatModel chatModel;
    private final String providerId;
    private final String modelName;

    public Langchain4jAdapter(ChatModel chatModel, String providerId, String modelName) {
        this.chatModel = chatModel;
        this.providerId = providerId;
        this.modelName = modelName;
    }

    @Override
    public String getProviderId() {
        return providerId;
    }

    @Override
    public String getModel() {
        return modelName;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            List<CallWarning> warnings = new ArrayList<>();
            ChatRequest chatRequest = convertRequest(request, warnings);
            try {
                log.trace("[LLM] Calling {} with {} messages", modelName, chatRequest.messages().size());
                ChatResponse response = chatModel.chat(chatRequest);
                return convertResponse(response, warnings);
            } catch (Exception e) {
                throw toApiCallException(e);
            }
        });
    }

    @Override
    public Flux<StreamPart> chatStream(LlmRequest request) {
        return Flux.create(sink -> {
            CompletableFuture<LlmResponse> pending = chat(request);
            sink.onDispose(() -> pending.cancel(true));
            pending.whenComplete((response, error) -> {
                if (error instanceof CancellationException) {
                    log.trace("[LLM] Stream call to {} cancelled", modelName);
                } else if (error != null) {
                    sink.error(error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error);
                } else {
                    toStreamParts(response).forEach(sink::next);
                    sink.complete();
                }
            });
        });
    }

    // ==================== request ====================

    ChatRequest convertRequest(LlmRequest request, List<CallWarning> warnings) {
        ChatRequest.Builder builder = ChatRequest.builder().messages(convertMessages(request.getPrompt()));

        List<ToolSpecification> tools = convertTools(request);
        if (!tools.isEmpty()) {
            builder.toolSpecifications(tools);
            ToolChoice choice = request.getToolChoice();
            boolean required = choice != null
                    && (choice.mode() == ToolChoice.Mode.REQUIRED || choice.mode() == ToolChoice.Mode.SPECIFIC);
            builder.toolChoice(required
                    ? dev.langchain4j.model.chat.request.ToolChoice.REQUIRED
                    : dev.langchain4j.model.chat.request.ToolChoice.AUTO);
        }

        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.getTopP() != null) {
            builder.topP(request.getTopP());
        }
        if (request.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(request.getMaxOutputTokens().intValue());
        }
        if (request.getTopK() != null) {
            if (PROVIDER_ANTHROPIC.equals(providerId)) {
                builder.topK(request.getTopK());
            } else {
                warnings.add(unsupportedSetting("topK"));
            }
        }
        if (request.getPresencePenalty() != null) {
            if (PROVIDER_ANTHROPIC.equals(providerId)) {
                warnings.add(unsupportedSetting("presencePenalty"));
            } else {
                builder.presencePenalty(request.getPresencePenalty());
            }
        }
        if (request.getFrequencyPenalty() != null) {
            if (PROVIDER_ANTHROPIC.equals(providerId)) {
                warnings.add(unsupportedSetting("frequencyPenalty"));
            } else {
                builder.frequencyPenalty(request.getFrequencyPenalty());
            }
        }
        return builder.build();
    }

    private static CallWarning unsupportedSetting(String setting) {
        return CallWarning.builder().type(CallWarning.UNSUPPORTED_SETTING).setting(setting).build();
    }

    List<ChatMessage> convertMessages(List<Message> prompt) {
        List<ChatMessage> messages = new ArrayList<>();
        Map<String, String> toolNames = new HashMap<>();

        for (Message msg : prompt) {
            switch (msg.getRole()) {
            case SYSTEM -> messages.add(SystemMessage.from(msg.getText()));
            case USER -> messages.add(convertUserMessage(msg));
            case ASSISTANT -> {
                List<ToolExecutionRequest> toolRequests = new ArrayList<>();
                for (MessagePart part : msg.getContent()) {
                    part.as(MessagePart.ToolCallPart.class).ifPresent(call -> {
                        toolNames.put(call.toolCallId(), call.toolName());
                        toolRequests.add(ToolExecutionRequest.builder()
                                .id(call.toolCallId())
                                .name(call.toolName())
                                .arguments(call.input() == null || call.input().isBlank() ? "{}" : call.input())
                                .build());
                    });
                }
                String text = msg.getText();
                if (toolRequests.isEmpty()) {
                    messages.add(AiMessage.from(text));
                } else if (text.isEmpty()) {
                    messages.add(AiMessage.from(toolRequests));
                } else {
                    messages.add(AiMessage.from(text, toolRequests));
                }
            }
            case TOOL -> {
                for (MessagePart part : msg.getContent()) {
                    part.as(MessagePart.ToolResultPart.class).ifPresent(result -> messages.add(
                            ToolExecutionResultMessage.from(result.toolCallId(),
                                    toolNames.getOrDefault(result.toolCallId(), ""),
                                    outputText(result.output()))));
                }
            }
            default -> log.warn("[LLM] Unknown message role: {}, skipping", msg.getRole());
            }
        }
        return messages;
    }

    private UserMessage convertUserMessage(Message msg) {
        List<dev.langchain4j.data.message.Content> contents = new ArrayList<>();
        for (MessagePart part : msg.getContent()) {
            if (part instanceof MessagePart.TextPart text) {
                contents.add(dev.langchain4j.data.message.TextContent.from(text.text()));
            } else if (part instanceof MessagePart.FilePart file) {
                if (file.mediaType() != null && file.mediaType().startsWith("image/")) {
                    contents.add(ImageContent.from(Base64.getEncoder().encodeToString(file.data()),
                            file.mediaType()));
                } else {
                    log.warn("[LLM] Skipping unsupported file attachment: {} ({})", file.filename(),
                            file.mediaType());
                }
            }
        }
        return UserMessage.from(contents);
    }

    private static String outputText(ToolResultOutput output) {
        if (output instanceof ToolResultOutput.Text text) {
            return text.text();
        }
        if (output instanceof ToolResultOutput.Error error) {
            return "Error: " + error.error();
        }
        if (output instanceof ToolResultOutput.Media media) {
            return media.text() != null ? media.text() : "[" + media.mediaType() + " output]";
        }
        return "";
    }

    private List<ToolSpecification> convertTools(LlmRequest request) {
        if (!request.hasTools()) {
            return List.of();
        }
        ToolChoice choice = request.getToolChoice();
        if (choice != null && choice.mode() == ToolChoice.Mode.NONE) {
            return List.of();
        }
        return request.getTools().stream()
                .filter(tool -> choice == null || !choice.isSpecific() || choice.toolName().equals(tool.getName()))
                .map(this::convertToolDefinition)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null) {
            Map<String, Object> properties = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
            List<String> required = (List<String>) schema.get("required");

            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            if (properties != null) {
                for (Map.Entry<String, Object> entry : properties.entrySet()) {
                    schemaBuilder.addProperty(entry.getKey(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            if (required != null && !required.isEmpty()) {
                schemaBuilder.required(required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.getOrDefault("type", "string");
        String description = (String) paramSchema.get("description");
        List<String> enumValues = (List<String>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder().enumValues(enumValues).description(description).build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                builder.items(toJsonSchemaElement((Map<String, Object>) items));
            }
            yield builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<String, Object> entry : ((Map<String, Object>) nested).entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield builder.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }

    // ==================== response ====================

    LlmResponse convertResponse(ChatResponse response, List<CallWarning> warnings) {
        AiMessage aiMessage = response.aiMessage();
        List<Content> content = new ArrayList<>();

        if (aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            content.add(TextContent.of(aiMessage.text()));
        }
        if (aiMessage.hasToolExecutionRequests()) {
            for (ToolExecutionRequest request : aiMessage.toolExecutionRequests()) {
                content.add(ToolCallContent.builder()
                        .toolCallId(request.id())
                        .toolName(request.name())
                        .input(request.arguments())
                        .build());
            }
            log.trace("[LLM] Parsed {} tool calls from response", aiMessage.toolExecutionRequests().size());
        }

        return LlmResponse.builder()
                .content(ResponseContent.of(content))
                .finishReason(convertFinishReason(response.finishReason()))
                .usage(convertUsage(response.tokenUsage()))
                .warnings(warnings)
                .build();
    }

    private static FinishReason convertFinishReason(dev.langchain4j.model.output.FinishReason reason) {
        if (reason == null) {
            return FinishReason.UNKNOWN;
        }
        return switch (reason) {
        case STOP -> FinishReason.STOP;
        case LENGTH -> FinishReason.LENGTH;
        case TOOL_EXECUTION -> FinishReason.TOOL_CALLS;
        case CONTENT_FILTER -> FinishReason.CONTENT_FILTER;
        default -> FinishReason.OTHER;
        };
    }

    private static LlmUsage convertUsage(TokenUsage tokenUsage) {
        if (tokenUsage == null) {
            return LlmUsage.empty();
        }
        long input = tokenUsage.inputTokenCount() != null ? tokenUsage.inputTokenCount() : 0;
        long output = tokenUsage.outputTokenCount() != null ? tokenUsage.outputTokenCount() : 0;
        long total = tokenUsage.totalTokenCount() != null ? tokenUsage.totalTokenCount() : input + output;
        return LlmUsage.builder().inputTokens(input).outputTokens(output).totalTokens(total).build();
    }

    /**
     * Replays a complete response as a well-formed event sequence.
     */
    List<StreamPart> toStreamParts(LlmResponse response) {
        List<StreamPart> parts = new ArrayList<>();
        if (response.getWarnings() != null && !response.getWarnings().isEmpty()) {
            parts.add(StreamPart.warnings(response.getWarnings()));
        }
        int index = 0;
        for (Content item : response.getContent().items()) {
            if (item instanceof TextContent text) {
                String id = "text-" + index++;
                parts.add(StreamPart.textStart(id));
                parts.add(StreamPart.textDelta(id, text.getText()));
                parts.add(StreamPart.textEnd(id));
            } else if (item instanceof ToolCallContent call) {
                parts.add(StreamPart.toolInputStart(call.getToolCallId(), call.getToolName()));
                parts.add(StreamPart.toolInputDelta(call.getToolCallId(), call.getInput()));
                parts.add(StreamPart.toolInputEnd(call.getToolCallId()));
                parts.add(StreamPart.toolCall(call.getToolCallId(), call.getToolName(), call.getInput()));
            }
        }
        parts.add(StreamPart.finish(response.getFinishReason(), response.getUsage()));
        return parts;
    }

    // ==================== errors ====================

    ApiCallException toApiCallException(Exception e) {
        if (e instanceof ApiCallException apiError) {
            return apiError;
        }
        if (isRateLimitError(e)) {
            long resetSeconds = extractResetSeconds(e);
            Map<String, String> headers = resetSeconds > 0
                    ? Map.of("retry-after", String.valueOf(resetSeconds))
                    : Map.of();
            log.warn("[LLM] Rate limit hit on {}{}", modelName,
                    resetSeconds > 0 ? " (server requested " + resetSeconds + "s)" : "");
            return new ApiCallException("rate limited: " + e.getMessage(), 429, headers, e);
        }
        if (isTimeout(e)) {
            log.warn("[LLM] Call to {} timed out", modelName);
            return new ApiCallException("timeout: " + e.getMessage(), 408, Map.of(), e);
        }
        log.error("[LLM] Call to {} failed", modelName, e);
        return new ApiCallException("LLM chat failed: " + e.getMessage(), 0, Map.of(), false, e);
    }

    private static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException regardless of body content
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("token_quota_exceeded")
                    || msg.contains("too_many_tokens") || msg.contains("Too Many Requests")
                    || msg.contains("429") || msg.contains("model_cooldown")
                    || msg.contains("cooling down"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static boolean isTimeout(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof java.util.concurrent.TimeoutException
                    || current instanceof java.net.SocketTimeoutException
                    || current instanceof java.net.http.HttpTimeoutException
                    || current.getClass().getSimpleName().equals("TimeoutException")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Extracts reset_seconds from a rate limit error body. Returns -1 if absent.
     */
    private static long extractResetSeconds(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null && msg.contains("reset_seconds")) {
                Matcher matcher = RESET_SECONDS_PATTERN.matcher(msg);
                if (matcher.find()) {
                    return Long.parseLong(matcher.group(1));
                }
            }
            current = current.getCause();
        }
        return -1;
    }
}
