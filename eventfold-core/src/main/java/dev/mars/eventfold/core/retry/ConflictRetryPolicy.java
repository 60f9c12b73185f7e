package dev.mars.eventfold.core.retry;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import dev.mars.eventfold.api.error.ErrorKind;
import dev.mars.eventfold.api.error.EventStoreException;
import dev.mars.eventfold.core.util.CompletionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Non-blocking bounded retry of asynchronous operations that fail with one specific
 * {@link ErrorKind}.
 *
 * Failures of any other kind, and failures that are not an {@link EventStoreException},
 * propagate immediately. Once the attempts are exhausted the last failure propagates
 * unchanged. Waiting between attempts happens on a scheduler, so no thread blocks.
 * Closing a policy that owns its scheduler fails every retry still waiting with the error
 * that triggered it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class ConflictRetryPolicy implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConflictRetryPolicy.class);

    private final RetryConfig config;
    private final ScheduledExecutorService retryScheduler;
    private final boolean ownsScheduler;
    // Retries waiting on the scheduler, with the error that triggered them
    private final Map<CompletableFuture<?>, Throwable> pendingRetries = new ConcurrentHashMap<>();

    public ConflictRetryPolicy(RetryConfig config) {
        this(config, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "eventfold-retry-scheduler");
            t.setDaemon(true);
            return t;
        }), true);
    }

    /**
     * Creates a policy on an externally managed scheduler, which {@link #close()} leaves running.
     */
    public ConflictRetryPolicy(RetryConfig config, ScheduledExecutorService retryScheduler) {
        this(config, retryScheduler, false);
    }

    private ConflictRetryPolicy(RetryConfig config, ScheduledExecutorService retryScheduler, boolean ownsScheduler) {
        this.config = Objects.requireNonNull(config, "Retry config cannot be null");
        this.retryScheduler = Objects.requireNonNull(retryScheduler, "Retry scheduler cannot be null");
        this.ownsScheduler = ownsScheduler;
    }

    /**
     * Runs the operation, retrying it while it fails with {@code retryOnKind}.
     *
     * @param operation Produces a fresh attempt each time it is invoked
     * @param retryOnKind The only error kind that triggers a retry
     * @return A CompletableFuture with the result of the first successful attempt
     */
    public <T> CompletableFuture<T> retryIfError(Supplier<CompletableFuture<T>> operation, ErrorKind retryOnKind) {
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(retryOnKind, "Error kind cannot be null");
        return attempt(operation, retryOnKind, 1);
    }

    private <T> CompletableFuture<T> attempt(Supplier<CompletableFuture<T>> operation, ErrorKind retryOnKind,
                                             int attemptNumber) {
        return CompletionUtils.invoke(operation).handle((result, throwable) -> {
            if (throwable == null) {
                if (attemptNumber > 1) {
                    logger.debug("Operation succeeded on attempt {}", attemptNumber);
                }
                return CompletableFuture.completedFuture(result);
            }

            Throwable error = CompletionUtils.unwrap(throwable);
            if (!isRetryable(error, retryOnKind)) {
                return CompletableFuture.<T>failedFuture(error);
            }
            if (attemptNumber >= config.getMaxAttempts()) {
                logger.warn("Giving up after {} attempt(s) on {} error: {}",
                    attemptNumber, retryOnKind, error.getMessage());
                return CompletableFuture.<T>failedFuture(error);
            }
            return scheduleRetry(operation, retryOnKind, attemptNumber, error);
        }).thenCompose(future -> future);
    }

    private <T> CompletableFuture<T> scheduleRetry(Supplier<CompletableFuture<T>> operation, ErrorKind retryOnKind,
                                                   int failedAttempt, Throwable error) {
        Duration delay = config.delayAfterAttempt(failedAttempt);
        logger.debug("Attempt {} of {} failed with {} error, retrying in {}: {}",
            failedAttempt, config.getMaxAttempts(), retryOnKind, delay, error.getMessage());

        CompletableFuture<T> retryFuture = new CompletableFuture<>();
        pendingRetries.put(retryFuture, error);
        retryFuture.whenComplete((result, retryError) -> pendingRetries.remove(retryFuture));
        try {
            retryScheduler.schedule(() -> {
                attempt(operation, retryOnKind, failedAttempt + 1).whenComplete((result, retryError) -> {
                    if (retryError != null) {
                        retryFuture.completeExceptionally(CompletionUtils.unwrap(retryError));
                    } else {
                        retryFuture.complete(result);
                    }
                });
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.warn("Retry scheduler rejected attempt {}, propagating last error", failedAttempt + 1);
            retryFuture.completeExceptionally(error);
        }
        return retryFuture;
    }

    private static boolean isRetryable(Throwable error, ErrorKind retryOnKind) {
        return error instanceof EventStoreException
            && ((EventStoreException) error).kind() == retryOnKind;
    }

    public RetryConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        if (ownsScheduler) {
            retryScheduler.shutdownNow();
            logger.debug("Retry scheduler shut down");
            failPendingRetries();
        }
    }

    private void failPendingRetries() {
        if (!pendingRetries.isEmpty()) {
            logger.warn("Retry policy closed with {} pending retry attempt(s), propagating their last error",
                pendingRetries.size());
        }
        for (Map.Entry<CompletableFuture<?>, Throwable> pending : Map.copyOf(pendingRetries).entrySet()) {
            pending.getKey().completeExceptionally(pending.getValue());
        }
    }
}
