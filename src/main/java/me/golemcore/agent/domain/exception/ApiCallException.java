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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A model provider call failed. Carries the HTTP status and response headers
 * when known, and whether the call may be retried.
 *
 * <p>
 * Status 408, 409, 429 and any 5xx are retryable unless stated otherwise.
 * Header lookups are case-insensitive.
 */
public class ApiCallException extends AgentException {

    private final int statusCode;
    private final Map<String, String> responseHeaders;
    private final boolean retryable;

    public ApiCallException(String message, int statusCode, Map<String, String> responseHeaders, Throwable cause) {
        this(message, statusCode, responseHeaders, isRetryableStatus(statusCode), cause);
    }

    public ApiCallException(String message, int statusCode, Map<String, String> responseHeaders,
            boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (responseHeaders != null) {
            headers.putAll(responseHeaders);
        }
        this.responseHeaders = Collections.unmodifiableMap(headers);
        this.retryable = retryable;
    }

    public static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 409 || statusCode == 429 || statusCode >= 500;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Map<String, String> getResponseHeaders() {
        return responseHeaders;
    }

    public String getHeader(String name) {
        return responseHeaders.get(name);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
