package me.golemcore.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage of one model call, or the sum over several calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmUsage {

    private long inputTokens;
    private long outputTokens;
    private long totalTokens;
    private long reasoningTokens;
    private long cacheCreationTokens;
    private long cacheReadTokens;

    public static LlmUsage empty() {
        return new LlmUsage();
    }

    public static LlmUsage of(long inputTokens, long outputTokens) {
        return LlmUsage.builder()
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .totalTokens(inputTokens + outputTokens)
                .build();
    }

    /**
     * Field-wise sum of this usage and {@code other}. A null {@code other}
     * counts as zero.
     */
    public LlmUsage add(LlmUsage other) {
        if (other == null) {
            return copy();
        }
        return LlmUsage.builder()
                .inputTokens(inputTokens + other.inputTokens)
                .outputTokens(outputTokens + other.outputTokens)
                .totalTokens(totalTokens + other.totalTokens)
                .reasoningTokens(reasoningTokens + other.reasoningTokens)
                .cacheCreationTokens(cacheCreationTokens + other.cacheCreationTokens)
                .cacheReadTokens(cacheReadTokens + other.cacheReadTokens)
                .build();
    }

    private LlmUsage copy() {
        return new LlmUsage(inputTokens, outputTokens, totalTokens, reasoningTokens, cacheCreationTokens,
                cacheReadTokens);
    }
}
