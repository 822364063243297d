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

/**
 * A {@link CallNotPermittedException} signals that a call was rejected by a CircuitBreaker and
 * never invoked.
 * <p>Rejections are the fast path of a failing dependency, so no stack trace is filled in.
 */
public class CallNotPermittedException extends RuntimeException {

    private final transient String causingCircuitBreakerName;

    protected CallNotPermittedException(String causingCircuitBreakerName, String message) {
        super(message, null, false, false);
        this.causingCircuitBreakerName = causingCircuitBreakerName;
    }

    /**
     * @return the name of the CircuitBreaker that rejected the call
     */
    public String getCausingCircuitBreakerName() {
        return causingCircuitBreakerName;
    }
}
