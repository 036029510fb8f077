package me.golemcore.agent.domain.service;

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

import java.time.Duration;

/**
 * Backoff policy of {@link RetryExecutor}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RetryOptions {

    @Builder.Default
    private int maxRetries = 2;

    @Builder.Default
    private Duration initialDelay = Duration.ofSeconds(2);

    @Builder.Default
    private double backoffFactor = 2.0;

    /**
     * Server-requested delays are honored below this bound, or when shorter
     * than the computed backoff.
     */
    @Builder.Default
    private Duration maxHeaderDelay = Duration.ofSeconds(60);

    private RetryListener listener;

    public static RetryOptions defaults() {
        return RetryOptions.builder().build();
    }
}
