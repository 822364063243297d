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
import io.github.agentguard.circuitbreaker.CircuitBreakerConfig;
import io.github.agentguard.circuitbreaker.TooManyRequestsException;
import io.github.agentguard.circuitbreaker.test.MutableClock;
import io.github.agentguard.core.CallContext;
import io.vavr.control.Try;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static io.github.agentguard.circuitbreaker.CircuitBreaker.State.CLOSED;
import static io.github.agentguard.circuitbreaker.CircuitBreaker.State.HALF_OPEN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class CircuitBreakerConcurrencyTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void halfOpenShouldRejectCallsBeyondMaxConcurrentRequests() throws Exception {
        MutableClock clock = MutableClock.startingNow();
        CircuitBreaker circuitBreaker = new CircuitBreakerStateMachine("bulkhead", CircuitBreakerConfig.custom()
            .failureThreshold(1)
            .successThreshold(2)
            .timeout(Duration.ofMillis(100))
            .maxConcurrentRequests(2)
            .build(), clock);
        circuitBreaker.tryExecute(CallContext.background(), () -> {
            throw new IOException("BAM!");
        });
        clock.advance(Duration.ofMillis(101));

        CountDownLatch release = new CountDownLatch(1);
        Future<Try<Void>> first = executor.submit(() -> circuitBreaker.tryExecute(CallContext.background(), release::await));
        await().atMost(Duration.ofSeconds(2)).until(() -> circuitBreaker.getState() == HALF_OPEN);
        Future<Try<Void>> second = executor.submit(() -> circuitBreaker.tryExecute(CallContext.background(), release::await));
        await().atMost(Duration.ofSeconds(2)).until(() -> circuitBreaker.getStats().getTotalRequests() == 3);

        Try<Void> third = circuitBreaker.tryExecute(CallContext.background(), () -> {
        });

        assertThat(third.getCause()).isInstanceOf(TooManyRequestsException.class);
        release.countDown();
        assertThat(first.get().isSuccess()).isTrue();
        assertThat(second.get().isSuccess()).isTrue();
        assertThat(circuitBreaker.getState()).isEqualTo(CLOSED);
    }

    @Test
    void shouldCountEveryConcurrentCall() throws Exception {
        CircuitBreaker circuitBreaker = CircuitBreaker.of("busy", CircuitBreakerConfig.custom()
            .failureThreshold(Integer.MAX_VALUE)
            .build());
        int calls = 400;
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Try<Void>>> results = new ArrayList<>();

        for (int i = 0; i < calls; i++) {
            boolean fail = i % 4 == 0;
            results.add(executor.submit(() -> {
                start.await();
                return circuitBreaker.tryExecute(CallContext.background(), () -> {
                    if (fail) {
                        throw new IOException("BAM!");
                    }
                });
            }));
        }
        start.countDown();
        for (Future<Try<Void>> result : results) {
            result.get();
        }

        assertThat(circuitBreaker.getStats().getTotalRequests()).isEqualTo(calls);
        assertThat(circuitBreaker.getStats().getTotalFailures()).isEqualTo(calls / 4);
        assertThat(circuitBreaker.getStats().getTotalSuccesses()).isEqualTo(calls - calls / 4);
        assertThat(circuitBreaker.getMetrics().getNumberOfCalls()).isEqualTo(calls);
        assertThat(circuitBreaker.getState()).isEqualTo(CLOSED);
    }
}
