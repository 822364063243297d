/*
 *
 *  Copyright 2016 Robert Winkler and Bohdan Storozhuk
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
package io.github.agentguard.circuitbreaker.internal;


import io.github.agentguard.circuitbreaker.CircuitBreaker;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/**
 * Collects the call outcomes, rejections, state transitions and latencies of one CircuitBreaker.
 * <p>Latency statistics are computed on demand from the last {@link #DEFAULT_LATENCY_WINDOW}
 * samples; each {@link #getMetrics()} sorts a copy of that window.
 */
class CircuitBreakerMetrics {

    static final int DEFAULT_LATENCY_WINDOW = 100;

    private final String name;

    /**
     * 最近的调用耗时, 超出容量时淘汰最旧的
     */
    private final LatencyRingBuffer latencies;

    /**
     * 状态 -> 进入该状态的次数
     */
    private final Map<CircuitBreaker.State, Long> stateTransitions = new EnumMap<>(CircuitBreaker.State.class);

    private long numberOfCalls;
    private long numberOfSuccessfulCalls;
    private long numberOfFailedCalls;

    /**
     * 拒绝数
     */
    private final LongAdder numberOfNotPermittedCalls;

    CircuitBreakerMetrics(String name) {
        this(name, DEFAULT_LATENCY_WINDOW);
    }

    CircuitBreakerMetrics(String name, int latencyWindowSize) {
        this.name = name;
        this.latencies = new LatencyRingBuffer(latencyWindowSize);
        this.numberOfNotPermittedCalls = new LongAdder();
    }

    /**
     * Records a completed call, successful or not, and its latency.
     *
     * @param success      whether the call succeeded
     * @param latencyNanos how long the call took
     */
    synchronized void onCallCompleted(boolean success, long latencyNanos) {
        numberOfCalls++;
        if (success) {
            numberOfSuccessfulCalls++;
        } else {
            numberOfFailedCalls++;
        }
        latencies.add(latencyNanos);
    }

    /**
     * Records a call which was not permitted, because the CircuitBreaker was OPEN or HALF_OPEN
     * and saturated.
     */
    void onCallNotPermitted() {
        // 拒绝数 +1
        numberOfNotPermittedCalls.increment();
    }

    /**
     * Records that the CircuitBreaker entered the given state.
     *
     * @param newState the state entered
     */
    synchronized void onStateTransition(CircuitBreaker.State newState) {
        stateTransitions.merge(newState, 1L, Long::sum);
    }

    /**
     * @return an immutable snapshot of the collected metrics
     */
    synchronized CircuitBreaker.Metrics getMetrics() {
        io.vavr.collection.Map<String, Long> transitions = io.vavr.collection.LinkedHashMap.empty();
        for (Map.Entry<CircuitBreaker.State, Long> entry : stateTransitions.entrySet()) {
            transitions = transitions.put(entry.getKey().getLabel(), entry.getValue());
        }
        return new MetricsSnapshot(name, numberOfCalls, numberOfSuccessfulCalls, numberOfFailedCalls,
            numberOfNotPermittedCalls.sum(), transitions, latencies.toArray());
    }

}
