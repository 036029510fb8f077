package me.golemcore.agent.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.FinishReason;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.LlmUsage;
import me.golemcore.agent.domain.model.ResponseContent;
import me.golemcore.agent.domain.model.StreamPart;
import me.golemcore.agent.domain.model.TextContent;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * No-op LLM adapter used when no provider is configured.
 *
 * <p>
 * Always answers with a placeholder text and {@code stop}, so a run ends after
 * one step without calling any external API.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    static final String PLACEHOLDER = "[No LLM configured]";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public String getModel() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content(ResponseContent.of(List.of(TextContent.of(PLACEHOLDER))))
                .finishReason(FinishReason.STOP)
                .usage(LlmUsage.empty())
                .build());
    }

    @Override
    public Flux<StreamPart> chatStream(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chatStream() called - no LLM configured");
        return Flux.just(
                StreamPart.textStart("0"),
                StreamPart.textDelta("0", PLACEHOLDER),
                StreamPart.textEnd("0"),
                StreamPart.finish(FinishReason.STOP, LlmUsage.empty()));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
