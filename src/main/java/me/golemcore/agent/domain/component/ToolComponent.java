package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolInfo;
import me.golemcore.agent.domain.model.ToolResponse;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Component representing a tool the model can call. A tool describes its
 * input through {@link #getInfo()} and runs validated calls through
 * {@link #execute(AgentContext, ToolCall)}.
 *
 * <p>
 * A business-level failure (bad arguments, missing data) should complete the
 * future with {@link ToolResponse#error(String)}; the model sees it and may
 * recover. Completing the future exceptionally means the tool could not run
 * and aborts the whole run.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool's name, description and input schema.
     */
    ToolInfo getInfo();

    /**
     * Runs a validated call. The input is guaranteed to be a JSON object holding
     * every required property.
     *
     * @param context
     *            the run's cancellation context
     * @param call
     *            the tool call
     * @return a future containing the tool response
     */
    CompletableFuture<ToolResponse> execute(AgentContext context, ToolCall call);

    /**
     * Provider-specific options sent along with this tool's definition.
     */
    default Map<String, Object> getProviderOptions() {
        return null;
    }

    default String getToolName() {
        return getInfo().getName();
    }
}
