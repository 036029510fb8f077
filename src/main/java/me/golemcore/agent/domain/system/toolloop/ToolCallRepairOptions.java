package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.exception.ToolCallValidationException;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolCallContent;

import java.util.List;

/**
 * Input of a {@link RepairToolCallFunction}.
 */
public record ToolCallRepairOptions(ToolCallContent originalCall, ToolCallValidationException validationError,
        List<ToolComponent> availableTools, String systemPrompt, List<Message> messages) {
}
