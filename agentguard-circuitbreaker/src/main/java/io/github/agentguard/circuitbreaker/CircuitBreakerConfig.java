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
package io.github.agentguard.circuitbreaker;

import io.github.agentguard.core.SchedulerFactory;
import io.github.agentguard.core.lang.Nullable;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * A {@link CircuitBreakerConfig} configures a {@link CircuitBreaker}.
 * <p>The builder accepts any value; {@link #validate()} is applied when a CircuitBreaker is
 * created and rejects the invalid ones.
 */
public class CircuitBreakerConfig {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final int DEFAULT_SUCCESS_THRESHOLD = 2;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 1;

    private final int failureThreshold;
    private final int successThreshold;
    private final Duration timeout;
    private final int maxConcurrentRequests;
    @Nullable
    private final StateChangeListener stateChangeListener;
    @Nullable
    private final Executor callExecutor;
    @Nullable
    private final Executor eventExecutor;

    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.successThreshold = builder.successThreshold;
        this.timeout = builder.timeout;
        this.maxConcurrentRequests = builder.maxConcurrentRequests;
        this.stateChangeListener = builder.stateChangeListener;
        this.callExecutor = builder.callExecutor;
        this.eventExecutor = builder.eventExecutor;
    }

    /**
     * Returns a builder to create a custom CircuitBreakerConfig.
     *
     * @return a {@link Builder}
     */
    public static Builder custom() {
        return new Builder();
    }

    /**
     * Returns a builder to create a custom CircuitBreakerConfig based on another config.
     *
     * @param baseConfig the config to start from
     * @return a {@link Builder}
     */
    public static Builder from(CircuitBreakerConfig baseConfig) {
        return new Builder(baseConfig);
    }

    /**
     * Creates a default CircuitBreaker configuration: 5 failures to open, 2 successes to close,
     * 30 seconds in OPEN, one trial call at a time in HALF_OPEN.
     *
     * @return a default CircuitBreaker configuration.
     */
    public static CircuitBreakerConfig ofDefaults() {
        return custom().build();
    }

    /**
     * Checks the thresholds and the timeout and normalizes {@code maxConcurrentRequests}.
     *
     * @return this config, or a copy with {@code maxConcurrentRequests} raised from 0 to 1
     * @throws IllegalArgumentException naming the first invalid field
     */
    public CircuitBreakerConfig validate() {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be greater than 0, was " + failureThreshold);
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException("successThreshold must be greater than 0, was " + successThreshold);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be greater than 0, was " + timeout);
        }
        if (maxConcurrentRequests < 0) {
            throw new IllegalArgumentException("maxConcurrentRequests must not be negative, was " + maxConcurrentRequests);
        }
        if (maxConcurrentRequests == 0) {
            return from(this).maxConcurrentRequests(DEFAULT_MAX_CONCURRENT_REQUESTS).build();
        }
        return this;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public Optional<StateChangeListener> getStateChangeListener() {
        return Optional.ofNullable(stateChangeListener);
    }

    /**
     * @return the executor running protected calls when the call context can end
     */
    public Executor getCallExecutor() {
        return callExecutor != null ? callExecutor : SchedulerFactory.getInstance().getCallExecutor();
    }

    /**
     * @return the executor delivering state change notifications and events
     */
    public Executor getEventExecutor() {
        return eventExecutor != null ? eventExecutor : SchedulerFactory.getInstance().getCallExecutor();
    }

    @Override
    public String toString() {
        return "CircuitBreakerConfig{" +
            "failureThreshold=" + failureThreshold +
            ", successThreshold=" + successThreshold +
            ", timeout=" + timeout +
            ", maxConcurrentRequests=" + maxConcurrentRequests +
            ", stateChangeListener=" + (stateChangeListener != null) +
            '}';
    }

    public static class Builder {

        private int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
        private int successThreshold = DEFAULT_SUCCESS_THRESHOLD;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
        @Nullable
        private StateChangeListener stateChangeListener;
        @Nullable
        private Executor callExecutor;
        @Nullable
        private Executor eventExecutor;

        public Builder() {
        }

        public Builder(CircuitBreakerConfig baseConfig) {
            this.failureThreshold = baseConfig.failureThreshold;
            this.successThreshold = baseConfig.successThreshold;
            this.timeout = baseConfig.timeout;
            this.maxConcurrentRequests = baseConfig.maxConcurrentRequests;
            this.stateChangeListener = baseConfig.stateChangeListener;
            this.callExecutor = baseConfig.callExecutor;
            this.eventExecutor = baseConfig.eventExecutor;
        }

        /**
         * @param failureThreshold consecutive failures in CLOSED that open the breaker, must be &gt; 0
         * @return the builder
         */
        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        /**
         * @param successThreshold consecutive successes in HALF_OPEN that close the breaker, must be &gt; 0
         * @return the builder
         */
        public Builder successThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        /**
         * @param timeout time spent in OPEN before a trial call is admitted, must be positive
         * @return the builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * @param maxConcurrentRequests trial calls allowed in flight in HALF_OPEN, 0 means 1
         * @return the builder
         */
        public Builder maxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = maxConcurrentRequests;
            return this;
        }

        public Builder onStateChange(@Nullable StateChangeListener stateChangeListener) {
            this.stateChangeListener = stateChangeListener;
            return this;
        }

        public Builder callExecutor(@Nullable Executor callExecutor) {
            this.callExecutor = callExecutor;
            return this;
        }

        public Builder eventExecutor(@Nullable Executor eventExecutor) {
            this.eventExecutor = eventExecutor;
            return this;
        }

        /**
         * Builds a CircuitBreakerConfig without validating it.
         *
         * @return the CircuitBreakerConfig
         */
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }
    }
}
