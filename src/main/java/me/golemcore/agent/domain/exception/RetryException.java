package me.golemcore.agent.domain.exception;

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

import java.util.List;

/**
 * A retried model call failed for good. {@link #getErrors()} holds the error
 * of every attempt in order.
 */
public class RetryException extends AgentException {

    public enum Reason {
        MAX_RETRIES_EXCEEDED, ERROR_NOT_RETRYABLE
    }

    private final Reason reason;
    private final List<Throwable> errors;

    public RetryException(String message, Reason reason, List<Throwable> errors) {
        super(message, errors.isEmpty() ? null : errors.get(errors.size() - 1));
        this.reason = reason;
        this.errors = List.copyOf(errors);
    }

    public Reason getReason() {
        return reason;
    }

    public List<Throwable> getErrors() {
        return errors;
    }

    public Throwable getLastError() {
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }
}
