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
 * Thrown when a call is rejected because the CircuitBreaker is OPEN and its timeout has not
 * elapsed yet.
 */
public class CircuitOpenException extends CallNotPermittedException {

    public CircuitOpenException(String circuitBreakerName) {
        super(circuitBreakerName, String.format("CircuitBreaker '%s' is open", circuitBreakerName));
    }
}
