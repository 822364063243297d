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
package io.github.agentguard.circuitbreaker.adaptive;

import io.github.agentguard.circuitbreaker.CircuitBreaker;
import io.github.agentguard.circuitbreaker.CircuitBreakerStats;
import io.github.agentguard.core.CallContext;
import io.github.agentguard.core.SchedulerFactory;
import io.vavr.CheckedRunnable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Observes the error rate of a {@link CircuitBreaker} at a fixed interval.
 * <p>The error rate is the ratio of failed to total requests since the CircuitBreaker was created.
 * It is informational only: the thresholds of the CircuitBreaker are never changed.
 */
public class AdaptiveCircuitBreaker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AdaptiveCircuitBreaker.class);

    private final CircuitBreaker circuitBreaker;
    private final ScheduledFuture<?> adjustment;
    private volatile double errorRate;

    public AdaptiveCircuitBreaker(CircuitBreaker circuitBreaker, Duration interval) {
        this(circuitBreaker, interval, SchedulerFactory.getInstance().getScheduler());
    }

    /**
     * @param circuitBreaker the observed CircuitBreaker
     * @param interval       the time between two measurements, must be positive
     * @param scheduler      the scheduler running the measurements
     */
    public AdaptiveCircuitBreaker(CircuitBreaker circuitBreaker, Duration interval, ScheduledExecutorService scheduler) {
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "CircuitBreaker must not be null");
        Objects.requireNonNull(interval, "Interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be greater than 0, was " + interval);
        }
        long nanos = interval.toNanos();
        this.adjustment = scheduler.scheduleAtFixedRate(this::adjust, nanos, nanos, TimeUnit.NANOSECONDS);
    }

    private void adjust() {
        CircuitBreakerStats stats = circuitBreaker.getStats();
        if (stats.getTotalRequests() == 0) {
            return;
        }
        errorRate = (double) stats.getTotalFailures() / stats.getTotalRequests();
        LOG.debug("CircuitBreaker '{}' error rate is {}", circuitBreaker.getName(), errorRate);
    }

    public void execute(CallContext context, CheckedRunnable call) throws Exception {
        circuitBreaker.execute(context, call);
    }

    /**
     * @return the error rate of the last measurement, 0 before the first one
     */
    public double getErrorRate() {
        return errorRate;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * Stops the measurements. The last error rate stays readable.
     */
    public void stop() {
        adjustment.cancel(false);
    }

    public boolean isStopped() {
        return adjustment.isCancelled();
    }

    @Override
    public void close() {
        stop();
    }
}
