package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.service.RetryExecutor;
import me.golemcore.agent.domain.service.RetryOptions;
import me.golemcore.agent.domain.system.toolloop.view.ConversationViewBuilder;
import me.golemcore.agent.domain.system.toolloop.view.DefaultConversationViewBuilder;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Spring wiring for ToolLoopSystem (domain orchestrator + ports). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ToolExecutorPort toolExecutorPort(AgentProperties properties) {
        return new DefaultToolExecutor(properties.getTools().getExecutionTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolCallValidator toolCallValidator() {
        return new ToolCallValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseMessageMapper responseMessageMapper() {
        return new DefaultResponseMessageMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConversationViewBuilder conversationViewBuilder() {
        return new DefaultConversationViewBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor() {
        return new RetryExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryOptions retryOptions(AgentProperties properties) {
        AgentProperties.RetryProperties retry = properties.getRetry();
        return RetryOptions.builder()
                .maxRetries(retry.getMaxRetries())
                .initialDelay(retry.getInitialDelay())
                .backoffFactor(retry.getBackoffFactor())
                .maxHeaderDelay(retry.getMaxHeaderDelay())
                .build();
    }

    /**
     * Settings from {@code agent.*}; every {@link ToolComponent} bean becomes a
     * tool of the agent.
     */
    @Bean
    @ConditionalOnMissingBean
    public AgentSettings agentSettings(AgentProperties properties, ObjectProvider<ToolComponent> tools) {
        AgentSettings.AgentSettingsBuilder builder = AgentSettings.builder()
                .systemPrompt(properties.getSystemPrompt())
                .temperature(properties.getTemperature())
                .maxOutputTokens(properties.getMaxOutputTokens())
                .topP(properties.getTopP())
                .tools(tools.orderedStream().toList());
        int maxSteps = properties.getToolLoop().getMaxSteps();
        if (maxSteps > 0) {
            builder.stopCondition(StopConditions.stepCountIs(maxSteps));
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, AgentSettings agentSettings,
            ToolExecutorPort toolExecutorPort, ToolCallValidator toolCallValidator,
            ResponseMessageMapper responseMessageMapper, ConversationViewBuilder conversationViewBuilder,
            RetryExecutor retryExecutor, RetryOptions retryOptions) {
        return new DefaultToolLoopSystem(llmPort, agentSettings, toolExecutorPort, toolCallValidator,
                responseMessageMapper, conversationViewBuilder, retryExecutor, retryOptions);
    }
}
