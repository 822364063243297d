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

import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryConfigTest {

    @Test
    void shouldUseDefaults() {
        RetryConfig config = RetryConfig.ofDefaults();

        assertThat(config.getMaxAttempts()).isEqualTo(3);
        assertThat(config.getInitialDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(config.getMaxDelay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getBackoffFactor()).isEqualTo(2.0);
        assertThat(config.getRetryExceptions()).isEmpty();
    }

    @Test
    void delayShouldGrowUntilMaxDelay() {
        RetryConfig config = RetryConfig.custom()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofMillis(500))
            .backoffFactor(2.0)
            .build();

        Duration second = config.nextDelay(config.getInitialDelay());
        Duration third = config.nextDelay(second);
        Duration fourth = config.nextDelay(third);

        assertThat(second).isEqualTo(Duration.ofMillis(200));
        assertThat(third).isEqualTo(Duration.ofMillis(400));
        assertThat(fourth).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> RetryConfig.custom().maxAttempts(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryConfig.custom().backoffFactor(0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryConfig.custom().initialDelay(Duration.ofMillis(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RetryConfig.custom().initialDelay(Duration.ofSeconds(10)).maxDelay(Duration.ofSeconds(1)).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyAllowListShouldRetryEverything() {
        assertThat(RetryConfig.ofDefaults().isRetryable(new IllegalStateException())).isTrue();
    }

    @Test
    void allowListShouldMatchSubclassesAndCauses() {
        RetryConfig config = RetryConfig.custom().retryExceptions(IOException.class).build();

        assertThat(config.isRetryable(new FileNotFoundException())).isTrue();
        assertThat(config.isRetryable(new RuntimeException(new RuntimeException(new IOException())))).isTrue();
        assertThat(config.isRetryable(new IllegalStateException())).isFalse();
    }
}
