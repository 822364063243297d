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
import io.github.agentguard.core.CallContext;
import io.github.agentguard.core.lang.Nullable;
import io.vavr.CheckedFunction0;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Runs calls through a {@link CircuitBreaker} and answers with a fallback value when they fail or
 * are rejected.
 *
 * @param <T> the result type of the protected calls
 */
public class CircuitBreakerWithFallback<T> {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerWithFallback.class);

    private final CircuitBreaker circuitBreaker;
    @Nullable
    private final CheckedFunction0<T> fallback;

    /**
     * @param circuitBreaker the CircuitBreaker protecting the calls
     * @param fallback       supplies the value used when a call fails; without one, failures propagate
     */
    public CircuitBreakerWithFallback(CircuitBreaker circuitBreaker, @Nullable CheckedFunction0<T> fallback) {
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "CircuitBreaker must not be null");
        this.fallback = fallback;
    }

    public static <T> CircuitBreakerWithFallback<T> of(CircuitBreaker circuitBreaker, CheckedFunction0<T> fallback) {
        return new CircuitBreakerWithFallback<>(circuitBreaker, Objects.requireNonNull(fallback, "Fallback must not be null"));
    }

    /**
     * Executes the callable through the CircuitBreaker.
     *
     * @param context  the call context
     * @param callable the protected call
     * @return the value of the callable, or the fallback value if the call failed or was rejected
     * @throws Throwable the failure of the fallback, or the original failure if there is no fallback
     */
    public T execute(CallContext context, Callable<T> callable) throws Throwable {
        try {
            return circuitBreaker.executeCallable(context, callable);
        } catch (Exception e) {
            if (fallback == null) {
                throw e;
            }
            LOG.debug("CircuitBreaker '{}' call failed, using fallback: {}", circuitBreaker.getName(), e.toString());
            return fallback.apply();
        }
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public boolean hasFallback() {
        return fallback != null;
    }
}
