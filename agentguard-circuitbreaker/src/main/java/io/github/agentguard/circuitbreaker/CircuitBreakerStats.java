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

import io.github.agentguard.core.lang.Nullable;

import java.time.Instant;
import java.util.Optional;

/**
 * Immutable snapshot of the counters of a {@link CircuitBreaker}, taken under the breaker's lock.
 */
public final class CircuitBreakerStats {

    private final long totalRequests;
    private final long totalSuccesses;
    private final long totalFailures;
    private final int consecutiveSuccesses;
    private final int consecutiveFailures;
    @Nullable
    private final Throwable lastError;
    @Nullable
    private final Instant lastErrorTime;
    private final CircuitBreaker.State state;
    private final Instant stateChangedAt;

    public CircuitBreakerStats(long totalRequests, long totalSuccesses, long totalFailures,
                               int consecutiveSuccesses, int consecutiveFailures,
                               @Nullable Throwable lastError, @Nullable Instant lastErrorTime,
                               CircuitBreaker.State state, Instant stateChangedAt) {
        this.totalRequests = totalRequests;
        this.totalSuccesses = totalSuccesses;
        this.totalFailures = totalFailures;
        this.consecutiveSuccesses = consecutiveSuccesses;
        this.consecutiveFailures = consecutiveFailures;
        this.lastError = lastError;
        this.lastErrorTime = lastErrorTime;
        this.state = state;
        this.stateChangedAt = stateChangedAt;
    }

    /**
     * @return every admission attempt, rejected ones included
     */
    public long getTotalRequests() {
        return totalRequests;
    }

    public long getTotalSuccesses() {
        return totalSuccesses;
    }

    public long getTotalFailures() {
        return totalFailures;
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public Optional<Throwable> getLastError() {
        return Optional.ofNullable(lastError);
    }

    public Optional<Instant> getLastErrorTime() {
        return Optional.ofNullable(lastErrorTime);
    }

    public CircuitBreaker.State getState() {
        return state;
    }

    public Instant getStateChangedAt() {
        return stateChangedAt;
    }

    @Override
    public String toString() {
        return "CircuitBreakerStats{" +
            "state=" + state +
            ", totalRequests=" + totalRequests +
            ", totalSuccesses=" + totalSuccesses +
            ", totalFailures=" + totalFailures +
            ", consecutiveSuccesses=" + consecutiveSuccesses +
            ", consecutiveFailures=" + consecutiveFailures +
            ", lastError=" + lastError +
            ", stateChangedAt=" + stateChangedAt +
            '}';
    }
}
