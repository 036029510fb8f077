package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.ToolCallContent;

/**
 * Hook that tries to fix a tool call which failed validation, for example by
 * asking a model to rewrite its arguments. Returning null gives up; the call is
 * then marked invalid.
 */
@FunctionalInterface
public interface RepairToolCallFunction {

    ToolCallContent repair(AgentContext context, ToolCallRepairOptions options);
}
