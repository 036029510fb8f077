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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.model.AgentContext;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolInfo;
import me.golemcore.agent.domain.model.ToolResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * Tool backed by a function over a typed input. The JSON input is bound to
 * {@code inputType} with Jackson; input that does not bind is answered with an
 * error response so the model can correct it.
 *
 * @param <I>
 *            the input type
 */
public class FunctionToolComponent<I> implements ToolComponent {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ToolInfo info;
    private final Class<I> inputType;
    private final BiFunction<AgentContext, I, ToolResponse> handler;

    public FunctionToolComponent(ToolInfo info, Class<I> inputType,
            BiFunction<AgentContext, I, ToolResponse> handler) {
        this.info = info;
        this.inputType = inputType;
        this.handler = handler;
    }

    public static <I> FunctionToolComponent<I> of(ToolInfo info, Class<I> inputType,
            BiFunction<AgentContext, I, ToolResponse> handler) {
        return new FunctionToolComponent<>(info, inputType, handler);
    }

    @Override
    public ToolInfo getInfo() {
        return info;
    }

    @Override
    public CompletableFuture<ToolResponse> execute(AgentContext context, ToolCall call) {
        I input;
        try {
            input = OBJECT_MAPPER.readValue(call.input(), inputType);
        } catch (JsonProcessingException e) {
            return CompletableFuture.completedFuture(
                    ToolResponse.error("invalid parameters: " + e.getOriginalMessage()));
        }
        try {
            return CompletableFuture.completedFuture(handler.apply(context, input));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
