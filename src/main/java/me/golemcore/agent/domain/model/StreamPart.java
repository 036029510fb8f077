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

import java.util.List;
import java.util.Map;

/**
 * One event of a streamed model response.
 *
 * <p>
 * Block events ({@code *-start}, {@code *-delta}, {@code *-end}) share the
 * block {@code id}; for tool events the id is the tool call id. Only the fields
 * relevant to the event type are set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamPart {

    private StreamPartType type;
    private String id;
    private String toolCallName;
    private String delta;
    private boolean providerExecuted;

    private LlmUsage usage;
    private FinishReason finishReason;
    private Throwable error;
    private List<CallWarning> warnings;

    private SourceType sourceType;
    private String url;
    private String title;

    private Map<String, Object> providerMetadata;

    public static StreamPart textStart(String id) {
        return StreamPart.builder().type(StreamPartType.TEXT_START).id(id).build();
    }

    public static StreamPart textDelta(String id, String delta) {
        return StreamPart.builder().type(StreamPartType.TEXT_DELTA).id(id).delta(delta).build();
    }

    public static StreamPart textEnd(String id) {
        return StreamPart.builder().type(StreamPartType.TEXT_END).id(id).build();
    }

    public static StreamPart reasoningStart(String id, Map<String, Object> providerMetadata) {
        return StreamPart.builder().type(StreamPartType.REASONING_START).id(id)
                .providerMetadata(providerMetadata).build();
    }

    public static StreamPart reasoningDelta(String id, String delta) {
        return StreamPart.builder().type(StreamPartType.REASONING_DELTA).id(id).delta(delta).build();
    }

    public static StreamPart reasoningEnd(String id, Map<String, Object> providerMetadata) {
        return StreamPart.builder().type(StreamPartType.REASONING_END).id(id)
                .providerMetadata(providerMetadata).build();
    }

    public static StreamPart toolInputStart(String id, String toolName) {
        return StreamPart.builder().type(StreamPartType.TOOL_INPUT_START).id(id).toolCallName(toolName).build();
    }

    public static StreamPart toolInputDelta(String id, String delta) {
        return StreamPart.builder().type(StreamPartType.TOOL_INPUT_DELTA).id(id).delta(delta).build();
    }

    public static StreamPart toolInputEnd(String id) {
        return StreamPart.builder().type(StreamPartType.TOOL_INPUT_END).id(id).build();
    }

    /**
     * Complete tool call; {@code input} is the full JSON argument string.
     */
    public static StreamPart toolCall(String id, String toolName, String input) {
        return StreamPart.builder().type(StreamPartType.TOOL_CALL).id(id).toolCallName(toolName).delta(input)
                .build();
    }

    public static StreamPart source(SourceType sourceType, String id, String url, String title) {
        return StreamPart.builder().type(StreamPartType.SOURCE).sourceType(sourceType).id(id).url(url)
                .title(title).build();
    }

    public static StreamPart finish(FinishReason finishReason, LlmUsage usage) {
        return StreamPart.builder().type(StreamPartType.FINISH).finishReason(finishReason).usage(usage).build();
    }

    public static StreamPart warnings(List<CallWarning> warnings) {
        return StreamPart.builder().type(StreamPartType.WARNINGS).warnings(warnings).build();
    }

    public static StreamPart error(Throwable error) {
        return StreamPart.builder().type(StreamPartType.ERROR).error(error).build();
    }
}
