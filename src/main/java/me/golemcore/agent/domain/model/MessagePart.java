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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;
import java.util.Optional;

/**
 * One part of a prompt {@link Message}. Parts mirror the {@link Content}
 * variants that can be sent back to a model; sources have no part.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessagePart.TextPart.class, name = "text"),
        @JsonSubTypes.Type(value = MessagePart.ReasoningPart.class, name = "reasoning"),
        @JsonSubTypes.Type(value = MessagePart.FilePart.class, name = "file"),
        @JsonSubTypes.Type(value = MessagePart.ToolCallPart.class, name = "tool-call"),
        @JsonSubTypes.Type(value = MessagePart.ToolResultPart.class, name = "tool-result")
})
public interface MessagePart {

    @JsonIgnore
    ContentType getType();

    default <T extends MessagePart> Optional<T> as(Class<T> type) {
        return type.isInstance(this) ? Optional.of(type.cast(this)) : Optional.empty();
    }

    record TextPart(String text, Map<String, Object> providerOptions) implements MessagePart {

        public TextPart(String text) {
            this(text, null);
        }

        @Override
        public ContentType getType() {
            return ContentType.TEXT;
        }
    }

    record ReasoningPart(String text, Map<String, Object> providerOptions) implements MessagePart {

        @Override
        public ContentType getType() {
            return ContentType.REASONING;
        }
    }

    record FilePart(String filename, byte[] data, String mediaType, Map<String, Object> providerOptions)
            implements MessagePart {

        public FilePart(String filename, byte[] data, String mediaType) {
            this(filename, data, mediaType, null);
        }

        @Override
        public ContentType getType() {
            return ContentType.FILE;
        }
    }

    record ToolCallPart(String toolCallId, String toolName, String input, boolean providerExecuted,
            Map<String, Object> providerOptions) implements MessagePart {

        @Override
        public ContentType getType() {
            return ContentType.TOOL_CALL;
        }
    }

    record ToolResultPart(String toolCallId, ToolResultOutput output, Map<String, Object> providerOptions)
            implements MessagePart {

        @Override
        public ContentType getType() {
            return ContentType.TOOL_RESULT;
        }
    }
}
