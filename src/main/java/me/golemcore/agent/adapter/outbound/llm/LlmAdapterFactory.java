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

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;

/**
 * Selects the LLM adapter from {@code agent.llm.*}.
 *
 * <ul>
 * <li>openai - OpenAI or any OpenAI-compatible endpoint via langchain4j
 * <li>anthropic - Anthropic via langchain4j
 * <li>none - {@link NoOpLlmAdapter}
 * </ul>
 *
 * An unknown provider, or a provider without API key, falls back to the no-op
 * adapter.
 */
@Slf4j
public final class LlmAdapterFactory {

    private static final String PROVIDER_NONE = "none";

    private LlmAdapterFactory() {
    }

    public static LlmPort create(AgentProperties.LlmProperties config) {
        String provider = config.getProvider() != null ? config.getProvider() : PROVIDER_NONE;
        if (PROVIDER_NONE.equals(provider)) {
            log.info("[LLM] No provider configured, using: {}", PROVIDER_NONE);
            return new NoOpLlmAdapter();
        }
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[LLM] Provider '{}' has no api key, using: {}", provider, PROVIDER_NONE);
            return new NoOpLlmAdapter();
        }

        ChatModel chatModel;
        switch (provider) {
        case Langchain4jAdapter.PROVIDER_ANTHROPIC -> chatModel = createAnthropicModel(config);
        case Langchain4jAdapter.PROVIDER_OPENAI -> chatModel = createOpenAiModel(config);
        default -> {
            log.warn("[LLM] Provider '{}' not found, using: {}", provider, PROVIDER_NONE);
            return new NoOpLlmAdapter();
        }
        }
        log.info("[LLM] Active provider: {}, model: {}", provider, config.getModel());
        return new Langchain4jAdapter(chatModel, provider, config.getModel());
    }

    private static ChatModel createAnthropicModel(AgentProperties.LlmProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by the agent loop
                .maxTokens(4096)
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private static ChatModel createOpenAiModel(AgentProperties.LlmProperties config) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by the agent loop
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }
}
