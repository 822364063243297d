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

/**
 * A CircuitBreakerEvent which informs that the CircuitBreaker was reset.
 */
public class CircuitBreakerOnResetEvent extends AbstractCircuitBreakerEvent {

    public CircuitBreakerOnResetEvent(String circuitBreakerName) {
        super(circuitBreakerName);
    }

    @Override
    public Type getEventType() {
        return Type.RESET;
    }

    @Override
    public String toString() {
        return String.format("%s: CircuitBreaker '%s' reset",
            getCreationTime(),
            getCircuitBreakerName());
    }
}
