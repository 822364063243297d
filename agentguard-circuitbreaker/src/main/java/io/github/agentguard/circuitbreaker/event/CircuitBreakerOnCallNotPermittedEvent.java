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
package io.github.agentguard.circuitbreaker.event;

import io.github.agentguard.circuitbreaker.CircuitBreaker;

/**
 * A CircuitBreakerEvent which informs that a call was rejected without being invoked.
 */
public class CircuitBreakerOnCallNotPermittedEvent extends AbstractCircuitBreakerEvent {

    private final CircuitBreaker.State state;

    public CircuitBreakerOnCallNotPermittedEvent(String circuitBreakerName, CircuitBreaker.State state) {
        super(circuitBreakerName);
        this.state = state;
    }

    /**
     * @return the state that rejected the call, OPEN or HALF_OPEN
     */
    public CircuitBreaker.State getState() {
        return state;
    }

    @Override
    public Type getEventType() {
        return Type.NOT_PERMITTED;
    }

    @Override
    public String toString() {
        return String.format("%s: CircuitBreaker '%s' recorded a call which was not permitted in state %s.",
            getCreationTime(),
            getCircuitBreakerName(),
            state);
    }
}
