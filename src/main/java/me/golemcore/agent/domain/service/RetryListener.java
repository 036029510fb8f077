package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.exception.ApiCallException;

import java.time.Duration;

/**
 * Notified before each retry of a failed model call.
 */
@FunctionalInterface
public interface RetryListener {

    void onRetry(ApiCallException error, Duration delay);
}
