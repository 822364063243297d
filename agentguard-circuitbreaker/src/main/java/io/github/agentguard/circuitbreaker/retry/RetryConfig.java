/*
 *
 *  Copyright 2025: the agentguard authors
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */
package io.github.agentguard.circuitbreaker.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@link RetryConfig} configures a {@link CircuitBreakerWithRetry}.
 */
public class RetryConfig {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);
    public static final double DEFAULT_BACKOFF_FACTOR = 2.0;

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double backoffFactor;
    private final List<Class<? extends Throwable>> retryExceptions;

    private RetryConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.initialDelay = builder.initialDelay;
        this.maxDelay = builder.maxDelay;
        this.backoffFactor = builder.backoffFactor;
        this.retryExceptions = Collections.unmodifiableList(new ArrayList<>(builder.retryExceptions));
    }

    public static Builder custom() {
        return new Builder();
    }

    /**
     * Creates a default Retry configuration: 3 attempts, waiting 100ms, then 200ms, at most 5s,
     * retrying every failure.
     *
     * @return a default Retry configuration
     */
    public static RetryConfig ofDefaults() {
        return custom().build();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getBackoffFactor() {
        return backoffFactor;
    }

    /**
     * @return the exception types worth retrying; empty means every failure is retried
     */
    public List<Class<? extends Throwable>> getRetryExceptions() {
        return retryExceptions;
    }

    /**
     * Decides whether a failure may be retried: true if no exception types were configured, or if
     * the failure or one of its causes is an instance of a configured type.
     *
     * @param failure the failure of an attempt
     * @return whether another attempt may follow
     */
    public boolean isRetryable(Throwable failure) {
        if (retryExceptions.isEmpty()) {
            return true;
        }
        Throwable current = failure;
        int depth = 0;
        // 沿 cause 链查找, 限制深度防止环
        while (current != null && depth++ < 64) {
            for (Class<? extends Throwable> retryException : retryExceptions) {
                if (retryException.isInstance(current)) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Computes the wait that follows {@code delay}.
     *
     * @param delay the wait that just happened
     * @return {@code min(delay * backoffFactor, maxDelay)}
     */
    public Duration nextDelay(Duration delay) {
        double nanos = delay.toNanos() * backoffFactor;
        if (nanos >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) nanos);
    }

    @Override
    public String toString() {
        return "RetryConfig{" +
            "maxAttempts=" + maxAttempts +
            ", initialDelay=" + initialDelay +
            ", maxDelay=" + maxDelay +
            ", backoffFactor=" + backoffFactor +
            ", retryExceptions=" + retryExceptions +
            '}';
    }

    public static class Builder {

        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private Duration initialDelay = DEFAULT_INITIAL_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private double backoffFactor = DEFAULT_BACKOFF_FACTOR;
        private List<Class<? extends Throwable>> retryExceptions = new ArrayList<>();

        /**
         * @param maxAttempts total number of attempts including the first one, must be &gt;= 1
         * @return the builder
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be greater than or equal to 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            Objects.requireNonNull(initialDelay, "initialDelay must not be null");
            if (initialDelay.isNegative()) {
                throw new IllegalArgumentException("initialDelay must not be negative");
            }
            this.initialDelay = initialDelay;
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay must not be null");
            if (maxDelay.isNegative()) {
                throw new IllegalArgumentException("maxDelay must not be negative");
            }
            this.maxDelay = maxDelay;
            return this;
        }

        /**
         * @param backoffFactor multiplier applied to the delay after each wait, must be &gt;= 1
         * @return the builder
         */
        public Builder backoffFactor(double backoffFactor) {
            if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
                throw new IllegalArgumentException("backoffFactor must be greater than or equal to 1");
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        @SafeVarargs
        public final Builder retryExceptions(Class<? extends Throwable>... retryExceptions) {
            this.retryExceptions = new ArrayList<>(Arrays.asList(retryExceptions));
            return this;
        }

        public RetryConfig build() {
            if (maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException("maxDelay must not be shorter than initialDelay");
            }
            return new RetryConfig(this);
        }
    }
}
