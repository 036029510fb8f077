package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.AgentResult;

/**
 * Runs the model -> tools -> model loop until the model stops calling tools or
 * a stop condition is met.
 */
public interface ToolLoopSystem {

    /**
     * Runs the loop with one complete model response per step.
     */
    AgentResult generate(AgentContext context, AgentCall call);

    /**
     * Runs the loop on streamed model responses, reporting progress to
     * {@code listener}.
     */
    AgentResult stream(AgentContext context, AgentCall call, AgentStreamListener listener);

    default AgentResult generate(AgentCall call) {
        return generate(AgentContext.create(), call);
    }

    default AgentResult stream(AgentCall call, AgentStreamListener listener) {
        return stream(AgentContext.create(), call, listener);
    }
}
