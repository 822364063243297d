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
import io.vavr.CheckedRunnable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries calls that fail through a {@link CircuitBreaker}, waiting with exponential backoff
 * between attempts.
 * <p>Every attempt goes through the CircuitBreaker and is counted by it. A
 * {@link CircuitOpenException} ends the retries at once.
 */
public class CircuitBreakerWithRetry {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerWithRetry.class);

    private final CircuitBreaker circuitBreaker;
    private final RetryConfig retryConfig;

    public CircuitBreakerWithRetry(CircuitBreaker circuitBreaker, RetryConfig retryConfig) {
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "CircuitBreaker must not be null");
        this.retryConfig = Objects.requireNonNull(retryConfig, "RetryConfig must not be null");
    }

    /**
     * Creates a new CircuitBreaker and wraps it.
     *
     * @param name                 the name of the CircuitBreaker
     * @param circuitBreakerConfig the configuration of the CircuitBreaker
     * @param retryConfig          the retry policy
     * @return the retrying CircuitBreaker
     * @throws IllegalArgumentException if the CircuitBreaker configuration is invalid
     */
    public static CircuitBreakerWithRetry of(String name, CircuitBreakerConfig circuitBreakerConfig,
                                             RetryConfig retryConfig) {
        return new CircuitBreakerWithRetry(CircuitBreaker.of(name, circuitBreakerConfig), retryConfig);
    }

    /**
     * Executes the call, retrying failures as long as attempts are left.
     *
     * @param context the call context, also bounding the waits between attempts
     * @param call    the protected call
     * @throws Exception the failure of the last attempt, a non retryable failure, or the cause of
     *                   the context if it ended while waiting
     */
    public void execute(CallContext context, CheckedRunnable call) throws Exception {
        Duration delay = retryConfig.getInitialDelay();
        for (int attempt = 1; ; attempt++) {
            try {
                circuitBreaker.execute(context, call);
                return;
            } catch (CircuitOpenException e) {
                throw e;
            } catch (Exception e) {
                if (attempt >= retryConfig.getMaxAttempts() || !retryConfig.isRetryable(e)) {
                    throw e;
                }
                LOG.debug("CircuitBreaker '{}' attempt {} of {} failed, retrying in {}: {}",
                    circuitBreaker.getName(), attempt, retryConfig.getMaxAttempts(), delay, e.toString());
            }

            if (!context.sleep(delay)) {
                Exception cause = context.getCause();
                throw cause != null ? cause : new IllegalStateException("context ended without a cause");
            }
            delay = retryConfig.nextDelay(delay);
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public RetryConfig getRetryConfig() {
        return retryConfig;
    }
}
