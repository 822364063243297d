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
package io.github.agentguard.circuitbreaker.internal;

import io.github.agentguard.circuitbreaker.CircuitBreaker;
import io.vavr.collection.Map;

import java.time.Duration;
import java.util.Arrays;

/**
 * Immutable {@link CircuitBreaker.Metrics}; latency statistics are derived once, at creation.
 */
final class MetricsSnapshot implements CircuitBreaker.Metrics {

    private final String name;
    private final long numberOfCalls;
    private final long numberOfSuccessfulCalls;
    private final long numberOfFailedCalls;
    private final long numberOfNotPermittedCalls;
    private final Map<String, Long> stateTransitions;
    private final Duration averageLatency;
    private final Duration minLatency;
    private final Duration maxLatency;
    private final Duration p50Latency;
    private final Duration p95Latency;
    private final Duration p99Latency;

    MetricsSnapshot(String name, long numberOfCalls, long numberOfSuccessfulCalls, long numberOfFailedCalls,
                    long numberOfNotPermittedCalls, Map<String, Long> stateTransitions, long[] latencyNanos) {
        this.name = name;
        this.numberOfCalls = numberOfCalls;
        this.numberOfSuccessfulCalls = numberOfSuccessfulCalls;
        this.numberOfFailedCalls = numberOfFailedCalls;
        this.numberOfNotPermittedCalls = numberOfNotPermittedCalls;
        this.stateTransitions = stateTransitions;

        if (latencyNanos.length == 0) {
            this.averageLatency = Duration.ZERO;
            this.minLatency = Duration.ZERO;
            this.maxLatency = Duration.ZERO;
            this.p50Latency = Duration.ZERO;
            this.p95Latency = Duration.ZERO;
            this.p99Latency = Duration.ZERO;
            return;
        }

        // 排序副本, 窗口最多 100 个样本
        long[] sorted = Arrays.copyOf(latencyNanos, latencyNanos.length);
        Arrays.sort(sorted);
        long sum = 0;
        for (long latency : sorted) {
            sum += latency;
        }
        this.averageLatency = Duration.ofNanos(sum / sorted.length);
        this.minLatency = Duration.ofNanos(sorted[0]);
        this.maxLatency = Duration.ofNanos(sorted[sorted.length - 1]);
        this.p50Latency = percentile(sorted, 0.50);
        this.p95Latency = percentile(sorted, 0.95);
        this.p99Latency = percentile(sorted, 0.99);
    }

    /**
     * Nearest-rank below: the sample at index {@code floor((n - 1) * percentile)}.
     */
    static Duration percentile(long[] sorted, double percentile) {
        int index = (int) ((sorted.length - 1) * percentile);
        index = Math.max(0, Math.min(index, sorted.length - 1));
        return Duration.ofNanos(sorted[index]);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public long getNumberOfCalls() {
        return numberOfCalls;
    }

    @Override
    public long getNumberOfSuccessfulCalls() {
        return numberOfSuccessfulCalls;
    }

    @Override
    public long getNumberOfFailedCalls() {
        return numberOfFailedCalls;
    }

    @Override
    public long getNumberOfNotPermittedCalls() {
        return numberOfNotPermittedCalls;
    }

    @Override
    public Map<String, Long> getStateTransitions() {
        return stateTransitions;
    }

    @Override
    public Duration getAverageLatency() {
        return averageLatency;
    }

    @Override
    public Duration getMinLatency() {
        return minLatency;
    }

    @Override
    public Duration getMaxLatency() {
        return maxLatency;
    }

    @Override
    public Duration getP50Latency() {
        return p50Latency;
    }

    @Override
    public Duration getP95Latency() {
        return p95Latency;
    }

    @Override
    public Duration getP99Latency() {
        return p99Latency;
    }

    @Override
    public String toString() {
        return "Metrics{" +
            "name='" + name + '\'' +
            ", calls=" + numberOfCalls +
            ", successful=" + numberOfSuccessfulCalls +
            ", failed=" + numberOfFailedCalls +
            ", notPermitted=" + numberOfNotPermittedCalls +
            ", transitions=" + stateTransitions +
            ", avg=" + averageLatency +
            ", p95=" + p95Latency +
            '}';
    }
}
