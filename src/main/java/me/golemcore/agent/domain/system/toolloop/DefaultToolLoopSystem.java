package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.AgentResult;
import me.golemcore.agent.domain.model.Content;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.StepResult;
import me.golemcore.agent.domain.model.StreamPart;
import me.golemcore.agent.domain.model.ToolCallContent;
import me.golemcore.agent.domain.model.ToolChoice;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResultContent;
import me.golemcore.agent.domain.service.RetryExecutor;
import me.golemcore.agent.domain.service.RetryOptions;
import me.golemcore.agent.domain.exception.StreamProtocolException;
import me.golemcore.agent.domain.system.toolloop.view.ConversationView;
import me.golemcore.agent.domain.system.toolloop.view.ConversationViewBuilder;
import me.golemcore.agent.domain.system.toolloop.view.DefaultConversationViewBuilder;
import me.golemcore.agent.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Each step: build the step input, let the step preparer override it, call the
 * model (with retries), validate and repair the tool calls, run them, and turn
 * the step content into response messages for the next step. The loop ends
 * when a stop condition is met or the step did not ask for more tool calls.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(30);

    private final LlmPort model;
    private final AgentSettings settings;
    private final ToolExecutorPort toolExecutor;
    private final ToolCallValidator validator;
    private final ResponseMessageMapper messageMapper;
    private final ConversationViewBuilder viewBuilder;
    private final RetryExecutor retryExecutor;
    private final RetryOptions retryDefaults;

    public DefaultToolLoopSystem(LlmPort model, AgentSettings settings) {
        this(model, settings, new DefaultToolExecutor(DEFAULT_TOOL_TIMEOUT), new ToolCallValidator(),
                new DefaultResponseMessageMapper(), new DefaultConversationViewBuilder(), new RetryExecutor(),
                RetryOptions.defaults());
    }

    public DefaultToolLoopSystem(LlmPort model, AgentSettings settings, ToolExecutorPort toolExecutor,
            ToolCallValidator validator, ResponseMessageMapper messageMapper, ConversationViewBuilder viewBuilder,
            RetryExecutor retryExecutor, RetryOptions retryDefaults) {
        this.model = model;
        this.settings = settings != null ? settings : AgentSettings.defaults();
        this.toolExecutor = toolExecutor;
        this.validator = validator;
        this.messageMapper = messageMapper;
        this.viewBuilder = viewBuilder;
        this.retryExecutor = retryExecutor;
        this.retryDefaults = retryDefaults;
    }

    @Override
    public AgentResult generate(AgentContext context, AgentCall call) {
        AgentCall merged = merge(call);
        ConversationView initial = viewBuilder.buildInitialView(settings.getSystemPrompt(), merged.getMessages(),
                merged.getPrompt(), merged.getFiles());

        List<StepResult> steps = new ArrayList<>();
        List<Message> responseMessages = new ArrayList<>();
        AgentContext ctx = context;

        while (true) {
            ctx.throwIfCancelled();
            PreparedStep step = prepareStep(ctx, merged, initial, steps, responseMessages);
            ctx = step.context();
            log.debug("[ToolLoop] Step {} with {} messages, {} tools", steps.size(), step.messages().size(),
                    step.tools().size());

            LlmRequest request = buildRequest(merged, step);
            AgentContext stepContext = ctx;
            LlmResponse response = retryExecutor.execute(ctx, retryOptions(merged),
                    () -> stepContext.await(step.model().chat(request), null));

            List<Content> content = new ArrayList<>();
            List<ToolCallContent> toolCalls = new ArrayList<>();
            for (Content item : response.getContent().items()) {
                if (item instanceof ToolCallContent toolCall) {
                    ToolCallContent validated = validator.validateAndRepair(ctx, toolCall, step.tools(),
                            step.systemPrompt(), step.messages(), merged.getRepairToolCall());
                    content.add(validated);
                    toolCalls.add(validated);
                } else {
                    content.add(item);
                }
            }

            StepResult result = finishStep(ctx, step, response, content, toolCalls, null);
            steps.add(result);
            responseMessages.addAll(result.messages());

            if (shouldStop(merged, steps, toolCalls.size(), result.finishReason())) {
                break;
            }
        }

        return AgentResult.of(steps);
    }

    @Override
    public AgentResult stream(AgentContext context, AgentCall call, AgentStreamListener listener) {
        AgentStreamListener events = listener != null ? listener : AgentStreamListener.NOOP;
        try {
            AgentResult result = runStream(context, call, events);
            events.onAgentFinish(result);
            return result;
        } catch (RuntimeException e) {
            events.onError(e);
            throw e;
        }
    }

    private AgentResult runStream(AgentContext context, AgentCall call, AgentStreamListener events) {
        AgentCall merged = merge(call);
        ConversationView initial = viewBuilder.buildInitialView(settings.getSystemPrompt(), merged.getMessages(),
                merged.getPrompt(), merged.getFiles());

        events.onAgentStart();

        List<StepResult> steps = new ArrayList<>();
        List<Message> responseMessages = new ArrayList<>();
        AgentContext ctx = context;

        while (true) {
            ctx.throwIfCancelled();
            PreparedStep step = prepareStep(ctx, merged, initial, steps, responseMessages);
            ctx = step.context();
            events.onStepStart(steps.size());

            LlmRequest request = buildRequest(merged, step);
            AgentContext stepContext = ctx;
            StepStreamReconstructor reconstructed = retryExecutor.execute(ctx, retryOptions(merged), () -> {
                StepStreamReconstructor reconstructor = new StepStreamReconstructor(stepContext, events, validator,
                        step.tools(), step.systemPrompt(), step.messages(), merged.getRepairToolCall());
                consume(stepContext, step.model().chatStream(request), reconstructor);
                return reconstructor;
            });

            LlmResponse response = reconstructed.toResponse();
            List<ToolCallContent> toolCalls = reconstructed.getToolCalls();
            StepResult result = finishStep(ctx, step, response, new ArrayList<>(response.getContent().items()),
                    toolCalls, events);
            steps.add(result);
            responseMessages.addAll(result.messages());
            events.onStepFinish(result);

            if (shouldStop(merged, steps, toolCalls.size(), result.finishReason())) {
                break;
            }
        }

        return AgentResult.of(steps);
    }

    /**
     * Pulls the stream one event at a time. The subscription is cancelled when
     * the context is cancelled or consumption stops early.
     */
    private void consume(AgentContext context, Flux<StreamPart> parts, StepStreamReconstructor reconstructor) {
        Mono<Boolean> cancelled = Mono.create(sink -> {
            AgentContext.Registration registration = context.onCancel(() -> sink.success(Boolean.TRUE));
            sink.onDispose(registration::close);
        });
        try (Stream<StreamPart> stream = parts.takeUntilOther(cancelled).toStream(1)) {
            Iterator<StreamPart> iterator = stream.iterator();
            while (iterator.hasNext()) {
                reconstructor.accept(iterator.next());
            }
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new StreamProtocolException(cause.getMessage(), cause);
        }
        context.throwIfCancelled();
    }

    /**
     * Runs the step's tool calls and assembles the step result. {@code content}
     * holds the model output with validated calls in place; tool results are
     * appended in call order.
     */
    private StepResult finishStep(AgentContext ctx, PreparedStep step, LlmResponse response, List<Content> content,
            List<ToolCallContent> toolCalls, ToolResultListener listener) {
        List<ToolResultContent> toolResults = toolExecutor.execute(ctx, step.tools(), toolCalls, listener);
        content.addAll(toolResults);

        LlmResponse stepResponse = response.toBuilder().content(ResponseContent.of(content)).build();
        List<Message> stepMessages = messageMapper.toResponseMessages(stepResponse.getContent());
        log.debug("[ToolLoop] Step finished: reason={}, toolCalls={}, toolResults={}",
                stepResponse.getFinishReason(), toolCalls.size(), toolResults.size());
        return new StepResult(stepResponse, stepMessages);
    }

    private boolean shouldStop(AgentCall merged, List<StepResult> steps, int toolCallCount, FinishReason reason) {
        if (StopConditions.isAnyMet(merged.getStopWhen(), steps)) {
            log.debug("[ToolLoop] Stop condition met after {} steps", steps.size());
            return true;
        }
        return !shouldContinue(toolCallCount, reason);
    }

    /**
     * A step asks for another step iff it produced tool calls and the model
     * finished because of them. Shared by both loops.
     */
    static boolean shouldContinue(int toolCallCount, FinishReason finishReason) {
        return toolCallCount > 0 && finishReason == FinishReason.TOOL_CALLS;
    }

    private PreparedStep prepareStep(AgentContext context, AgentCall merged, ConversationView initial,
            List<StepResult> steps, List<Message> responseMessages) {
        ConversationView view = viewBuilder.buildStepView(initial, responseMessages);
        AgentContext ctx = context;
        LlmPort stepModel = model;
        ToolChoice toolChoice = merged.getToolChoice();
        List<String> activeTools = merged.getActiveTools();
        boolean disableAllTools = false;

        PrepareStepFunction preparer = merged.getPrepareStep();
        if (preparer != null) {
            StepPreparation preparation = preparer.prepare(ctx,
                    new PrepareStepOptions(stepModel, List.copyOf(steps), steps.size(), view.messages()));
            if (preparation != null) {
                if (preparation.getContext() != null) {
                    ctx = preparation.getContext();
                }
                if (preparation.getModel() != null) {
                    stepModel = preparation.getModel();
                }
                if (preparation.getMessages() != null) {
                    view = ConversationView.ofMessages(preparation.getMessages());
                }
                if (preparation.getSystem() != null) {
                    view = view.withSystemPrompt(preparation.getSystem());
                }
                if (preparation.getToolChoice() != null) {
                    toolChoice = preparation.getToolChoice();
                }
                if (preparation.getActiveTools() != null) {
                    activeTools = preparation.getActiveTools();
                }
                disableAllTools = preparation.isDisableAllTools();
            }
        }

        List<ToolComponent> tools = selectTools(activeTools, disableAllTools);
        return new PreparedStep(ctx, stepModel, view.messages(), view.systemPrompt(), tools, toolChoice);
    }

    private List<ToolComponent> selectTools(List<String> activeTools, boolean disableAllTools) {
        List<ToolComponent> selected = new ArrayList<>();
        if (disableAllTools || settings.getTools() == null) {
            return selected;
        }
        for (ToolComponent tool : settings.getTools()) {
            if (!tool.isEnabled()) {
                continue;
            }
            if (activeTools == null || activeTools.isEmpty() || activeTools.contains(tool.getToolName())) {
                selected.add(tool);
            }
        }
        return selected;
    }

    private LlmRequest buildRequest(AgentCall merged, PreparedStep step) {
        List<ToolDefinition> tools = step.tools().stream()
                .map(tool -> ToolDefinition.builder()
                        .name(tool.getToolName())
                        .description(tool.getInfo().getDescription())
                        .inputSchema(tool.getInfo().toInputSchema())
                        .providerOptions(tool.getProviderOptions())
                        .build())
                .toList();

        return LlmRequest.builder()
                .prompt(step.messages())
                .maxOutputTokens(merged.getMaxOutputTokens())
                .temperature(merged.getTemperature())
                .topP(merged.getTopP())
                .topK(merged.getTopK())
                .presencePenalty(merged.getPresencePenalty())
                .frequencyPenalty(merged.getFrequencyPenalty())
                .tools(new ArrayList<>(tools))
                .toolChoice(step.toolChoice() != null ? step.toolChoice() : ToolChoice.AUTO)
                .providerOptions(merged.getProviderOptions())
                .headers(merged.getHeaders())
                .build();
    }

    private RetryOptions retryOptions(AgentCall merged) {
        RetryOptions.RetryOptionsBuilder builder = retryDefaults.toBuilder();
        if (merged.getMaxRetries() != null) {
            builder.maxRetries(merged.getMaxRetries());
        }
        if (merged.getOnRetry() != null) {
            builder.listener(merged.getOnRetry());
        }
        return builder.build();
    }

    /**
     * Applies the agent settings to every field the call leaves unset.
     */
    private AgentCall merge(AgentCall call) {
        AgentCall.AgentCallBuilder builder = call.toBuilder();
        if (call.getMaxOutputTokens() == null) {
            builder.maxOutputTokens(settings.getMaxOutputTokens());
        }
        if (call.getTemperature() == null) {
            builder.temperature(settings.getTemperature());
        }
        if (call.getTopP() == null) {
            builder.topP(settings.getTopP());
        }
        if (call.getTopK() == null) {
            builder.topK(settings.getTopK());
        }
        if (call.getPresencePenalty() == null) {
            builder.presencePenalty(settings.getPresencePenalty());
        }
        if (call.getFrequencyPenalty() == null) {
            builder.frequencyPenalty(settings.getFrequencyPenalty());
        }
        if (call.getMaxRetries() == null) {
            builder.maxRetries(settings.getMaxRetries());
        }
        if (call.getOnRetry() == null) {
            builder.onRetry(settings.getOnRetry());
        }
        if (call.getStopWhen().isEmpty() && settings.getStopWhen() != null) {
            builder.stopWhen(settings.getStopWhen());
        }
        if (call.getPrepareStep() == null) {
            builder.prepareStep(settings.getPrepareStep());
        }
        if (call.getRepairToolCall() == null) {
            builder.repairToolCall(settings.getRepairToolCall());
        }
        builder.headers(mergeMaps(settings.getHeaders(), call.getHeaders()));
        builder.providerOptions(mergeMaps(settings.getProviderOptions(), call.getProviderOptions()));
        return builder.build();
    }

    private static <V> Map<String, V> mergeMaps(Map<String, V> base, Map<String, V> overrides) {
        if (base == null && overrides == null) {
            return null;
        }
        Map<String, V> merged = new HashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }

    private record PreparedStep(AgentContext context, LlmPort model, List<Message> messages, String systemPrompt,
            List<ToolComponent> tools, ToolChoice toolChoice) {
    }
}
