package me.golemcore.agent.domain.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload of a tool result: plain text, an error message, or binary media.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ToolResultOutput.Text.class, name = "text"),
        @JsonSubTypes.Type(value = ToolResultOutput.Error.class, name = "error"),
        @JsonSubTypes.Type(value = ToolResultOutput.Media.class, name = "media")
})
public interface ToolResultOutput {

    static ToolResultOutput text(String text) {
        return new Text(text);
    }

    static ToolResultOutput error(String error) {
        return new Error(error);
    }

    static ToolResultOutput media(String data, String mediaType, String text) {
        return new Media(data, mediaType, text);
    }

    record Text(String text) implements ToolResultOutput {
    }

    record Error(String error) implements ToolResultOutput {
    }

    /**
     * Media output; {@code data} is base64 encoded.
     */
    record Media(String data, String mediaType, String text) implements ToolResultOutput {
    }
}
