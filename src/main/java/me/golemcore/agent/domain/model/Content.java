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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Optional;

/**
 * One item of model output. Items form an ordered sequence where text,
 * reasoning, files, sources, tool calls and tool results may be interleaved.
 *
 * <p>
 * The set of variants is fixed and registered below by their string tag, so
 * the sequence round-trips through JSON without any runtime registry.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextContent.class, name = "text"),
        @JsonSubTypes.Type(value = ReasoningContent.class, name = "reasoning"),
        @JsonSubTypes.Type(value = FileContent.class, name = "file"),
        @JsonSubTypes.Type(value = SourceContent.class, name = "source"),
        @JsonSubTypes.Type(value = ToolCallContent.class, name = "tool-call"),
        @JsonSubTypes.Type(value = ToolResultContent.class, name = "tool-result")
})
public interface Content {

    ContentType getType();

    /**
     * Narrows this item to the given variant.
     *
     * @return the item as {@code type}, or empty when it is another variant
     */
    default <T extends Content> Optional<T> as(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }
}
