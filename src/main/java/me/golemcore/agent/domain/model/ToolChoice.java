package me.golemcore.agent.domain.model;

/**
 * Policy controlling whether and which tools the model may call in a step.
 */
public record ToolChoice(Mode mode, String toolName) {

    public static final ToolChoice NONE = new ToolChoice(Mode.NONE, null);
    public static final ToolChoice AUTO = new ToolChoice(Mode.AUTO, null);
    public static final ToolChoice REQUIRED = new ToolChoice(Mode.REQUIRED, null);

    public enum Mode {
        NONE, AUTO, REQUIRED, SPECIFIC
    }

    /**
     * Forces the model to call the named tool.
     */
    public static ToolChoice specific(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            throw new IllegalArgumentException("toolName must not be blank");
        }
        return new ToolChoice(Mode.SPECIFIC, toolName);
    }

    public boolean isSpecific() {
        return mode == Mode.SPECIFIC;
    }
}
