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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A tool invocation requested by the model.
 *
 * <p>
 * {@code input} is the raw JSON argument string. After validation a call is
 * either valid (possibly with repaired input) or flagged {@code invalid} with
 * the reason in {@code validationError}; invalid calls are never executed.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCallContent implements Content {

    private String toolCallId;
    private String toolName;
    private String input;
    private boolean providerExecuted;
    private Map<String, Object> providerMetadata;
    private boolean invalid;
    private String validationError;

    public ToolCall toToolCall() {
        return new ToolCall(toolCallId, toolName, input);
    }

    @Override
    public ContentType getType() {
        return ContentType.TOOL_CALL;
    }
}
