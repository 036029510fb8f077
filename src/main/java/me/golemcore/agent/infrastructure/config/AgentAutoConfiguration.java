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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.adapter.outbound.llm.LlmAdapterFactory;
import me.golemcore.agent.domain.system.toolloop.ToolLoopConfiguration;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Spring Boot auto-configuration of the agent.
 *
 * <p>
 * Binds {@link AgentProperties}, creates the {@link LlmPort} for the
 * configured provider unless the application defines its own, and imports the
 * tool loop wiring. Tools are picked up from the application's
 * {@link me.golemcore.agent.domain.component.ToolComponent} beans.
 */
@AutoConfiguration
@EnableConfigurationProperties(AgentProperties.class)
@Import(ToolLoopConfiguration.class)
@Slf4j
public class AgentAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LlmPort llmPort(AgentProperties properties) {
        LlmPort port = LlmAdapterFactory.create(properties.getLlm());
        if (port.isAvailable()) {
            log.debug("Agent LLM port: {} ({})", port.getProviderId(), port.getModel());
        } else {
            log.warn("No usable LLM provider configured, agent answers with a placeholder."
                    + " Set agent.llm.provider and agent.llm.api-key");
        }
        return port;
    }
}
