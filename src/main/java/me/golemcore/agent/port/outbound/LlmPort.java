package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.StreamPart;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Port for language model providers (OpenAI, Anthropic, etc.). Failures are
 * reported as {@link me.golemcore.agent.domain.exception.ApiCallException} so
 * the loop can decide whether to retry.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g., "openai", "anthropic").
     */
    String getProviderId();

    /**
     * Returns the model this port talks to.
     */
    String getModel();

    /**
     * Executes a model call and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Executes a streaming model call. The returned sequence is cold: the call
     * starts on subscription and is aborted when the subscription is cancelled.
     */
    Flux<StreamPart> chatStream(LlmRequest request);

    /**
     * Checks whether the provider is configured and usable.
     */
    default boolean isAvailable() {
        return true;
    }
}
