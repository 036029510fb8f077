package me.golemcore.agent.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties of the agent, bound from {@code agent.*}.
 *
 * <p>
 * Nested groups:
 * <ul>
 * <li>{@link ToolLoopProperties} - step limit of a run</li>
 * <li>{@link RetryProperties} - backoff of model calls</li>
 * <li>{@link ToolsProperties} - tool execution</li>
 * <li>{@link LlmProperties} - model provider</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private String systemPrompt;
    private Double temperature;
    private Long maxOutputTokens;
    private Double topP;

    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private RetryProperties retry = new RetryProperties();
    private ToolsProperties tools = new ToolsProperties();
    private LlmProperties llm = new LlmProperties();

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {
        /** Max number of steps per run. 0 means unlimited. */
        private int maxSteps = 20;
    }

    // ==================== RETRY ====================

    @Data
    public static class RetryProperties {
        private int maxRetries = 2;
        private Duration initialDelay = Duration.ofSeconds(2);
        private double backoffFactor = 2.0;

        /** Provider-requested delays longer than this are capped by the backoff. */
        private Duration maxHeaderDelay = Duration.ofSeconds(60);
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private Duration executionTimeout = Duration.ofSeconds(30);
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** openai, anthropic or none. */
        private String provider = "none";
        private String apiKey;
        private String baseUrl;
        private String model;
        private Duration timeout = Duration.ofSeconds(60);
    }
}
