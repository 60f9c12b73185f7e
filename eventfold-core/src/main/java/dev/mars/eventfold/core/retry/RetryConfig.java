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

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the bounded retry of conflicting writes.
 *
 * {@code maxAttempts} counts every invocation, the first one included, so a value of 1
 * disables retrying.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public class RetryConfig {

    private final int maxAttempts;
    private final BackoffStrategy backoffStrategy;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.backoffStrategy = Objects.requireNonNull(builder.backoffStrategy, "Backoff strategy cannot be null");
        this.initialDelay = Objects.requireNonNull(builder.initialDelay, "Initial delay cannot be null");
        this.maxDelay = Objects.requireNonNull(builder.maxDelay, "Max delay cannot be null");
        this.multiplier = builder.multiplier;

        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1, was " + maxAttempts);
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays cannot be negative");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay must not be shorter than the initial delay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1.0, was " + multiplier);
        }
    }

    /**
     * Computes the wait before the retry that follows the given failed attempt.
     *
     * @param failedAttempt The 1-based number of the attempt that just failed
     * @return The delay to wait before the next attempt
     */
    public Duration delayAfterAttempt(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1");
        }
        if (backoffStrategy == BackoffStrategy.FIXED) {
            return initialDelay;
        }
        double delayMs = initialDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        if (delayMs >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) delayMs);
    }

    // Getters
    public int getMaxAttempts() { return maxAttempts; }
    public BackoffStrategy getBackoffStrategy() { return backoffStrategy; }
    public Duration getInitialDelay() { return initialDelay; }
    public Duration getMaxDelay() { return maxDelay; }
    public double getMultiplier() { return multiplier; }

    /**
     * Creates the default configuration: 10 attempts, exponential backoff from 10ms up to 1s.
     */
    public static RetryConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Creates a configuration for tests: no waiting between attempts.
     */
    public static RetryConfig testingConfig(int maxAttempts) {
        return builder()
            .maxAttempts(maxAttempts)
            .backoffStrategy(BackoffStrategy.FIXED)
            .initialDelay(Duration.ZERO)
            .maxDelay(Duration.ZERO)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 10;
        private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL;
        private Duration initialDelay = Duration.ofMillis(10);
        private Duration maxDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffStrategy(BackoffStrategy backoffStrategy) {
            this.backoffStrategy = backoffStrategy;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(this);
        }
    }

    @Override
    public String toString() {
        return "RetryConfig{" +
                "maxAttempts=" + maxAttempts +
                ", backoffStrategy=" + backoffStrategy +
                ", initialDelay=" + initialDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                '}';
    }
}
