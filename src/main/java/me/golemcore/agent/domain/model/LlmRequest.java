package me.golemcore.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One model call: the prompt messages, sampling parameters, offered tools and
 * the tool choice. Unset sampling parameters are left to the provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmRequest {

    @Builder.Default
    private List<Message> prompt = new ArrayList<>();

    private Long maxOutputTokens;
    private Double temperature;
    private Double topP;
    private Integer topK;
    private Double presencePenalty;
    private Double frequencyPenalty;

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    private ToolChoice toolChoice;

    private Map<String, Object> providerOptions;
    private Map<String, String> headers;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }
}
