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
 * Observer notified of every state transition of a CircuitBreaker.
 * <p>Invoked asynchronously on the breaker's event executor, never while the breaker is locked.
 * Exceptions thrown by the listener are logged and otherwise ignored.
 */
@FunctionalInterface
public interface StateChangeListener {

    /**
     * @param name the name of the CircuitBreaker
     * @param from the state left
     * @param to   the state entered
     */
    void onStateChange(String name, CircuitBreaker.State from, CircuitBreaker.State to);
}
