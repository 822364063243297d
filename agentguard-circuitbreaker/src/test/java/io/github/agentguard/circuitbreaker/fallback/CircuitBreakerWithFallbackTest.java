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
package io.github.agentguard.circuitbreaker.fallback;

import io.github.agentguard.circuitbreaker.CircuitBreaker;
import io.github.agentguard.circuitbreaker.CircuitBreakerConfig;
import io.github.agentguard.core.CallContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerWithFallbackTest {

    @Test
    void shouldReturnValueOfSuccessfulCall() throws Throwable {
        CircuitBreakerWithFallback<String> fallback = CircuitBreakerWithFallback.of(
            CircuitBreaker.ofDefaults("fallback"), () -> "cached");

        assertThat(fallback.execute(CallContext.background(), () -> "fresh")).isEqualTo("fresh");
        assertThat(fallback.hasFallback()).isTrue();
    }

    @Test
    void shouldReturnFallbackValueWhenCallFails() throws Throwable {
        CircuitBreakerWithFallback<String> fallback = CircuitBreakerWithFallback.of(
            CircuitBreaker.ofDefaults("fallback"), () -> "cached");

        String result = fallback.execute(CallContext.background(), () -> {
            throw new IOException("BAM!");
        });

        assertThat(result).isEqualTo("cached");
        assertThat(fallback.getCircuitBreaker().getStats().getTotalFailures()).isEqualTo(1);
    }

    @Test
    void shouldReturnFallbackValueWhenCircuitIsOpen() throws Throwable {
        CircuitBreaker circuitBreaker = CircuitBreaker.of("open", CircuitBreakerConfig.custom().failureThreshold(1).build());
        CircuitBreakerWithFallback<Integer> fallback = CircuitBreakerWithFallback.of(circuitBreaker, () -> -1);
        fallback.execute(CallContext.background(), () -> {
            throw new IOException("BAM!");
        });
        AtomicInteger invocations = new AtomicInteger();

        Integer result = fallback.execute(CallContext.background(), invocations::incrementAndGet);

        assertThat(result).isEqualTo(-1);
        assertThat(invocations).hasValue(0);
    }

    @Test
    void failureOfFallbackShouldPropagate() {
        CircuitBreakerWithFallback<String> fallback = CircuitBreakerWithFallback.of(
            CircuitBreaker.ofDefaults("fallback"), () -> {
                throw new IllegalStateException("no cache");
            });

        assertThatThrownBy(() -> fallback.execute(CallContext.background(), () -> {
            throw new IOException("BAM!");
        })).isInstanceOf(IllegalStateException.class).hasMessage("no cache");
    }

    @Test
    void withoutFallbackOriginalFailureShouldPropagate() {
        CircuitBreakerWithFallback<String> fallback = new CircuitBreakerWithFallback<>(
            CircuitBreaker.ofDefaults("fallback"), null);

        assertThatThrownBy(() -> fallback.execute(CallContext.background(), () -> {
            throw new IOException("BAM!");
        })).isInstanceOf(IOException.class).hasMessage("BAM!");
        assertThat(fallback.hasFallback()).isFalse();
    }
}
