package me.golemcore.agent.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event kinds of a streamed model response.
 */
public enum StreamPartType {

    WARNINGS("warnings"),
    TEXT_START("text-start"),
    TEXT_DELTA("text-delta"),
    TEXT_END("text-end"),
    REASONING_START("reasoning-start"),
    REASONING_DELTA("reasoning-delta"),
    REASONING_END("reasoning-end"),
    TOOL_INPUT_START("tool-input-start"),
    TOOL_INPUT_DELTA("tool-input-delta"),
    TOOL_INPUT_END("tool-input-end"),
    TOOL_CALL("tool-call"),
    SOURCE("source"),
    FINISH("finish"),
    ERROR("error");

    private final String value;

    StreamPartType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
