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
package io.github.agentguard.circuitbreaker;

import io.github.agentguard.core.CallContext;

/**
 * Thrown when the {@link CallContext} of a call ended before the call returned.
 * <p>The cause is the context's cause, a {@link java.util.concurrent.CancellationException} or a
 * {@link java.util.concurrent.TimeoutException}. The call itself may still be running.
 */
public class CircuitBreakerTimeoutException extends RuntimeException {

    private final transient String circuitBreakerName;

    public CircuitBreakerTimeoutException(String circuitBreakerName, Throwable cause) {
        super(String.format("CircuitBreaker '%s' operation timeout: %s", circuitBreakerName, cause.getMessage()), cause);
        this.circuitBreakerName = circuitBreakerName;
    }

    public String getCircuitBreakerName() {
        return circuitBreakerName;
    }
}
