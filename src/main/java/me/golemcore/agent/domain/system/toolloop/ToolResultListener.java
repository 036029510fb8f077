package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.ToolResultContent;

/**
 * Notified after each tool result, including results for invalid calls.
 */
@FunctionalInterface
public interface ToolResultListener {

    void onToolResult(ToolResultContent result);
}
