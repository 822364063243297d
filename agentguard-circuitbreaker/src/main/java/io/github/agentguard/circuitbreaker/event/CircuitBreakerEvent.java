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

import java.time.ZonedDateTime;

/**
 * An event which is created by a CircuitBreaker.
 */
public interface CircuitBreakerEvent {

    /**
     * @return the name of the CircuitBreaker which has created the event
     */
    String getCircuitBreakerName();

    Type getEventType();

    ZonedDateTime getCreationTime();

    /**
     * Event types which are created by a CircuitBreaker.
     */
    enum Type {
        /**
         * A CircuitBreakerEvent which informs that a call failed
         */
        ERROR,
        /**
         * A CircuitBreakerEvent which informs that a call succeeded
         */
        SUCCESS,
        /**
         * A CircuitBreakerEvent which informs that a call was rejected
         */
        NOT_PERMITTED,
        /**
         * A CircuitBreakerEvent which informs that the state changed
         */
        STATE_TRANSITION,
        /**
         * A CircuitBreakerEvent which informs that the CircuitBreaker was reset
         */
        RESET
    }
}
