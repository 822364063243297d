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

import io.github.agentguard.circuitbreaker.CircuitBreaker;
import io.github.agentguard.circuitbreaker.CircuitBreakerConfig;
import io.github.agentguard.circuitbreaker.CircuitOpenException;
import io.github.agentguard.core.CallContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerWithRetryTest {

    private static final RetryConfig FAST_RETRY = RetryConfig.custom()
        .maxAttempts(3)
        .initialDelay(Duration.ofMillis(10))
        .maxDelay(Duration.ofMillis(50))
        .build();

    @Test
    void shouldReturnOnFirstSuccess() throws Exception {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(), FAST_RETRY);
        AtomicInteger attempts = new AtomicInteger();

        retry.execute(CallContext.background(), attempts::incrementAndGet);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldSucceedAfterTransientFailures() throws Exception {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(), FAST_RETRY);
        AtomicInteger attempts = new AtomicInteger();

        retry.execute(CallContext.background(), () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("transient");
            }
        });

        assertThat(attempts).hasValue(3);
        assertThat(retry.getCircuitBreaker().getStats().getTotalRequests()).isEqualTo(3);
        assertThat(retry.getCircuitBreaker().getStats().getTotalFailures()).isEqualTo(2);
    }

    @Test
    void shouldRethrowLastFailureWhenAttemptsAreExhausted() {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(), FAST_RETRY);
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute(CallContext.background(), () -> {
            throw new IOException("attempt " + attempts.incrementAndGet());
        })).isInstanceOf(IOException.class).hasMessage("attempt 3");
    }

    @Test
    void shouldNotRetryWhenCircuitIsOpen() {
        CircuitBreaker circuitBreaker = CircuitBreaker.of("open", CircuitBreakerConfig.custom().failureThreshold(2).build());
        CircuitBreakerWithRetry retry = new CircuitBreakerWithRetry(circuitBreaker, RetryConfig.custom()
            .maxAttempts(5)
            .initialDelay(Duration.ofMillis(1))
            .build());
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute(CallContext.background(), () -> {
            attempts.incrementAndGet();
            throw new IOException("BAM!");
        })).isInstanceOf(CircuitOpenException.class);

        assertThat(attempts).hasValue(2);
        assertThat(circuitBreaker.getStats().getTotalRequests()).isEqualTo(3);
    }

    @Test
    void shouldNotRetryFailuresOutsideAllowList() {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(),
            RetryConfig.custom().retryExceptions(IOException.class).initialDelay(Duration.ofMillis(1)).build());
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute(CallContext.background(), () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("permanent");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldRetryWhenCauseIsOnAllowList() throws Exception {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(),
            RetryConfig.custom().retryExceptions(IOException.class).initialDelay(Duration.ofMillis(1)).build());
        AtomicInteger attempts = new AtomicInteger();

        retry.execute(CallContext.background(), () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("wrapped", new IOException("root"));
            }
        });

        assertThat(attempts).hasValue(2);
    }

    @Test
    void shouldStopWaitingWhenContextIsCancelled() {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(),
            RetryConfig.custom().initialDelay(Duration.ofSeconds(5)).maxDelay(Duration.ofSeconds(5)).build());
        CallContext context = CallContext.withCancel();
        AtomicInteger attempts = new AtomicInteger();
        Instant start = Instant.now();

        assertThatThrownBy(() -> retry.execute(context, () -> {
            attempts.incrementAndGet();
            context.cancel();
            throw new IOException("BAM!");
        })).isInstanceOf(CancellationException.class);

        assertThat(attempts).hasValue(1);
        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void shouldThrowDeadlineCauseWhenContextExpiresDuringBackoff() {
        CircuitBreakerWithRetry retry = CircuitBreakerWithRetry.of("retry", CircuitBreakerConfig.ofDefaults(),
            RetryConfig.custom().initialDelay(Duration.ofSeconds(2)).maxDelay(Duration.ofSeconds(2)).build());
        CallContext context = CallContext.withTimeout(Duration.ofMillis(200));

        assertThatThrownBy(() -> retry.execute(context, () -> {
            throw new IOException("BAM!");
        })).isInstanceOf(TimeoutException.class);
    }
}
