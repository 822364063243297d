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
 * A CircuitBreakerEvent which informs about a state transition.
 */
public class CircuitBreakerOnStateTransitionEvent extends AbstractCircuitBreakerEvent {

    private final CircuitBreaker.State fromState;
    private final CircuitBreaker.State toState;

    public CircuitBreakerOnStateTransitionEvent(String circuitBreakerName, CircuitBreaker.State fromState,
                                                CircuitBreaker.State toState) {
        super(circuitBreakerName);
        this.fromState = fromState;
        this.toState = toState;
    }

    public CircuitBreaker.State getFromState() {
        return fromState;
    }

    public CircuitBreaker.State getToState() {
        return toState;
    }

    @Override
    public Type getEventType() {
        return Type.STATE_TRANSITION;
    }

    @Override
    public String toString() {
        return String.format("%s: CircuitBreaker '%s' changed state from %s to %s",
            getCreationTime(),
            getCircuitBreakerName(),
            fromState,
            toState);
    }
}
