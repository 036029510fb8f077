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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Base64;

/**
 * What a tool returns for one call: text, an image or other media, or a
 * business-level error. An error response is reported back to the model and
 * does not stop the run; a tool that cannot run at all fails its future
 * instead.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolResponse {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public enum Type {
        TEXT, IMAGE, MEDIA
    }

    @Builder.Default
    private Type type = Type.TEXT;

    private String content;
    private byte[] data;
    private String mediaType;

    /**
     * JSON metadata for the caller. Not sent to the model.
     */
    private String metadata;

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isError()
    private boolean error;

    /**
     * Creates a text response.
     */
    public static ToolResponse text(String content) {
        return ToolResponse.builder().type(Type.TEXT).content(content).build();
    }

    /**
     * Creates an error response with the given message.
     */
    public static ToolResponse error(String message) {
        return ToolResponse.builder().type(Type.TEXT).content(message).error(true).build();
    }

    public static ToolResponse image(byte[] data, String mediaType) {
        return ToolResponse.builder().type(Type.IMAGE).data(data).mediaType(mediaType).build();
    }

    public static ToolResponse media(byte[] data, String mediaType) {
        return ToolResponse.builder().type(Type.MEDIA).data(data).mediaType(mediaType).build();
    }

    /**
     * Returns a copy carrying {@code value} as JSON metadata. If the value cannot
     * be serialized the response is returned unchanged.
     */
    public ToolResponse withMetadata(Object value) {
        try {
            return toBuilder().metadata(OBJECT_MAPPER.writeValueAsString(value)).build();
        } catch (JsonProcessingException e) {
            return this;
        }
    }

    /**
     * Maps this response to the output sent back to the model.
     */
    public ToolResultOutput toOutput() {
        if (error) {
            return ToolResultOutput.error(content);
        }
        if ((type == Type.IMAGE || type == Type.MEDIA) && data != null) {
            return ToolResultOutput.media(Base64.getEncoder().encodeToString(data), mediaType, content);
        }
        return ToolResultOutput.text(content);
    }
}
