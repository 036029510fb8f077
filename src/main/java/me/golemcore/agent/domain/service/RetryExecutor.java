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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.ApiCallException;
import me.golemcore.agent.domain.exception.RetryException;
import me.golemcore.agent.domain.model.AgentContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Runs a model call with exponential backoff.
 *
 * <p>
 * Only {@link ApiCallException}s flagged retryable are retried. The delay
 * before each retry is the exponential backoff, unless the provider sent a
 * {@code retry-after-ms} or {@code retry-after} header whose delay is below
 * {@link RetryOptions#getMaxHeaderDelay()} or shorter than the backoff. The
 * wait is abandoned as soon as the context is cancelled.
 */
@Slf4j
public class RetryExecutor {

    static final String RETRY_AFTER_MS = "retry-after-ms";
    static final String RETRY_AFTER = "retry-after";

    private final Clock clock;

    public RetryExecutor() {
        this(Clock.systemUTC());
    }

    // Visible for testing
    public RetryExecutor(Clock clock) {
        this.clock = clock;
    }

    public <T> T execute(AgentContext context, RetryOptions options, Supplier<T> attempt) {
        List<Throwable> errors = new ArrayList<>();
        Duration backoff = options.getInitialDelay();

        while (true) {
            context.throwIfCancelled();
            try {
                return attempt.get();
            } catch (AgentCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                if (options.getMaxRetries() == 0) {
                    throw e;
                }
                errors.add(e);
                int tryNumber = errors.size();

                if (tryNumber > options.getMaxRetries()) {
                    throw new RetryException("Failed after " + tryNumber + " attempts. Last error: "
                            + e.getMessage(), RetryException.Reason.MAX_RETRIES_EXCEEDED, errors);
                }

                if (e instanceof ApiCallException apiError && apiError.isRetryable()) {
                    Duration delay = retryDelay(apiError, backoff, options.getMaxHeaderDelay());
                    log.warn("[Retry] Model call failed (attempt {}/{}), retrying in {}ms: {}",
                            tryNumber, options.getMaxRetries() + 1, delay.toMillis(), e.getMessage());
                    if (options.getListener() != null) {
                        options.getListener().onRetry(apiError, delay);
                    }
                    if (context.awaitCancellation(delay)) {
                        throw new AgentCancelledException("cancelled during retry backoff", e);
                    }
                    backoff = Duration.ofMillis((long) (backoff.toMillis() * options.getBackoffFactor()));
                    continue;
                }

                if (tryNumber == 1) {
                    throw e;
                }
                throw new RetryException("Failed after " + tryNumber
                        + " attempts with non-retryable error: '" + e.getMessage() + "'",
                        RetryException.Reason.ERROR_NOT_RETRYABLE, errors);
            }
        }
    }

    /**
     * Chooses between the provider's requested delay and the exponential
     * backoff.
     */
    Duration retryDelay(ApiCallException error, Duration backoff, Duration maxHeaderDelay) {
        Duration requested = headerDelay(error);
        if (requested != null && !requested.isNegative() && !requested.isZero()
                && (requested.compareTo(maxHeaderDelay) < 0 || requested.compareTo(backoff) < 0)) {
            return requested;
        }
        return backoff;
    }

    private Duration headerDelay(ApiCallException error) {
        String millis = error.getHeader(RETRY_AFTER_MS);
        if (millis != null) {
            try {
                return Duration.ofMillis((long) Double.parseDouble(millis.trim()));
            } catch (NumberFormatException e) {
                log.debug("[Retry] Ignoring malformed {} header: {}", RETRY_AFTER_MS, millis);
            }
        }

        String retryAfter = error.getHeader(RETRY_AFTER);
        if (retryAfter == null) {
            return null;
        }
        try {
            return Duration.ofMillis((long) (Double.parseDouble(retryAfter.trim()) * 1000));
        } catch (NumberFormatException e) {
            // HTTP-date form
        }
        try {
            Instant at = ZonedDateTime.parse(retryAfter.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            return Duration.between(clock.instant(), at);
        } catch (DateTimeParseException e) {
            log.debug("[Retry] Ignoring malformed {} header: {}", RETRY_AFTER, retryAfter);
            return null;
        }
    }
}
