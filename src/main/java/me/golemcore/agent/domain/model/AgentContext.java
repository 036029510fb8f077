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

import me.golemcore.agent.domain.exception.AgentCancelledException;
import me.golemcore.agent.domain.exception.AgentException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation context of a single run, threaded through every model call,
 * tool invocation and hook. Also carries free-form attributes that hooks and
 * tools can use to pass data along the run.
 *
 * <p>
 * Once {@link #cancel()} is called, pending awaits fail with
 * {@link AgentCancelledException} and registered callbacks run exactly once.
 */
public class AgentContext {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> cancelCallbacks = new CopyOnWriteArrayList<>();
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public static AgentContext create() {
        return new AgentContext();
    }

    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (Runnable callback : cancelCallbacks) {
            if (cancelCallbacks.remove(callback)) {
                callback.run();
            }
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new AgentCancelledException();
        }
    }

    /**
     * Blocks up to {@code timeout} waiting for cancellation.
     *
     * @return true if the context was cancelled
     */
    public boolean awaitCancellation(Duration timeout) {
        try {
            return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCancelledException("interrupted", e);
        }
    }

    /**
     * Registers a callback to run on cancellation. Runs it immediately if the
     * context is already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        cancelCallbacks.add(callback);
        if (isCancelled() && cancelCallbacks.remove(callback)) {
            callback.run();
        }
        return () -> cancelCallbacks.remove(callback);
    }

    /**
     * Waits for {@code future}, cancelling it if this context is cancelled first.
     * An unchecked failure of the future is rethrown as is.
     *
     * @param timeout
     *            maximum wait, or null to wait indefinitely
     */
    public <T> T await(CompletableFuture<T> future, Duration timeout) {
        throwIfCancelled();
        try (Registration ignored = onCancel(() -> future.cancel(true))) {
            return timeout != null
                    ? future.get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (CancellationException e) {
            throw new AgentCancelledException("cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AgentCancelledException("interrupted", e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AgentException("Timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new AgentException(cause != null ? cause.getMessage() : e.getMessage(), cause);
        }
    }

    public void setAttribute(String key, Object value) {
        if (value == null) {
            attributes.remove(key);
            return;
        }
        attributes.put(key, value);
    }

    @SuppressWarnings("unchecked")
    public <T> T getAttribute(String key) {
        return (T) attributes.get(key);
    }

    /**
     * Handle of a cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
