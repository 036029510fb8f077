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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one tool call, correlated by {@code toolCallId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolResultContent implements Content {

    private String toolCallId;
    private String toolName;
    private ToolResultOutput result;

    /**
     * Metadata set by the tool for the caller; never sent to the model.
     */
    private String clientMetadata;

    private boolean providerExecuted;
    private Map<String, Object> providerMetadata;

    @JsonIgnore
    public boolean isError() {
        return result instanceof ToolResultOutput.Error;
    }

    @Override
    public ContentType getType() {
        return ContentType.TOOL_RESULT;
    }
}
