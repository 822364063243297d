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
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerMetricsTest {

    @Test
    void emptyMetricsShouldReportZeroLatencies() {
        CircuitBreaker.Metrics metrics = new CircuitBreakerMetrics("testName").getMetrics();

        assertThat(metrics.getName()).isEqualTo("testName");
        assertThat(metrics.getNumberOfCalls()).isZero();
        assertThat(metrics.getAverageLatency()).isEqualTo(Duration.ZERO);
        assertThat(metrics.getP99Latency()).isEqualTo(Duration.ZERO);
        assertThat(metrics.getStateTransitions().isEmpty()).isTrue();
    }

    @Test
    void shouldComputeLatencyStatistics() {
        CircuitBreakerMetrics circuitBreakerMetrics = new CircuitBreakerMetrics("testName");
        // 100 ms .. 1 ms, in reverse order
        for (int i = 100; i >= 1; i--) {
            circuitBreakerMetrics.onCallCompleted(i % 10 != 0, Duration.ofMillis(i).toNanos());
        }

        CircuitBreaker.Metrics metrics = circuitBreakerMetrics.getMetrics();

        assertThat(metrics.getNumberOfCalls()).isEqualTo(100);
        assertThat(metrics.getNumberOfSuccessfulCalls()).isEqualTo(90);
        assertThat(metrics.getNumberOfFailedCalls()).isEqualTo(10);
        assertThat(metrics.getMinLatency()).isEqualTo(Duration.ofMillis(1));
        assertThat(metrics.getMaxLatency()).isEqualTo(Duration.ofMillis(100));
        assertThat(metrics.getAverageLatency()).isEqualTo(Duration.ofNanos(50_500_000));
        // floor(99 * p)
        assertThat(metrics.getP50Latency()).isEqualTo(Duration.ofMillis(50));
        assertThat(metrics.getP95Latency()).isEqualTo(Duration.ofMillis(95));
        assertThat(metrics.getP99Latency()).isEqualTo(Duration.ofMillis(99));
    }

    @Test
    void shouldKeepOnlyMostRecentLatencies() {
        CircuitBreakerMetrics circuitBreakerMetrics = new CircuitBreakerMetrics("testName");
        for (int i = 0; i < 10; i++) {
            circuitBreakerMetrics.onCallCompleted(true, Duration.ofSeconds(10).toNanos());
        }
        for (int i = 0; i < CircuitBreakerMetrics.DEFAULT_LATENCY_WINDOW; i++) {
            circuitBreakerMetrics.onCallCompleted(true, Duration.ofMillis(1).toNanos());
        }

        CircuitBreaker.Metrics metrics = circuitBreakerMetrics.getMetrics();

        assertThat(metrics.getNumberOfCalls()).isEqualTo(110);
        assertThat(metrics.getMaxLatency()).isEqualTo(Duration.ofMillis(1));
        assertThat(metrics.getAverageLatency()).isEqualTo(Duration.ofMillis(1));
    }

    @Test
    void shouldCountTransitionsAndRejectedCalls() {
        CircuitBreakerMetrics circuitBreakerMetrics = new CircuitBreakerMetrics("testName");
        circuitBreakerMetrics.onStateTransition(CircuitBreaker.State.OPEN);
        circuitBreakerMetrics.onStateTransition(CircuitBreaker.State.HALF_OPEN);
        circuitBreakerMetrics.onStateTransition(CircuitBreaker.State.OPEN);
        circuitBreakerMetrics.onCallNotPermitted();
        circuitBreakerMetrics.onCallNotPermitted();

        CircuitBreaker.Metrics metrics = circuitBreakerMetrics.getMetrics();

        assertThat(metrics.getStateTransitions().get("open").get()).isEqualTo(2L);
        assertThat(metrics.getStateTransitions().get("half-open").get()).isEqualTo(1L);
        assertThat(metrics.getStateTransitions().containsKey("closed")).isFalse();
        assertThat(metrics.getNumberOfNotPermittedCalls()).isEqualTo(2);
    }

    @Test
    void snapshotShouldNotChangeAfterwards() {
        CircuitBreakerMetrics circuitBreakerMetrics = new CircuitBreakerMetrics("testName");
        circuitBreakerMetrics.onCallCompleted(true, 1_000);
        CircuitBreaker.Metrics snapshot = circuitBreakerMetrics.getMetrics();

        circuitBreakerMetrics.onCallCompleted(false, 5_000);

        assertThat(snapshot.getNumberOfCalls()).isEqualTo(1);
        assertThat(snapshot.getMaxLatency()).isEqualTo(Duration.ofNanos(1_000));
    }

    @Test
    void percentileOfSingleSample() {
        assertThat(MetricsSnapshot.percentile(new long[]{7}, 0.99)).isEqualTo(Duration.ofNanos(7));
    }
}
