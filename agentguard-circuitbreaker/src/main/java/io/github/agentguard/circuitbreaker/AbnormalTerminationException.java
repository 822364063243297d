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
 * Wraps a throwable that is not an {@link Exception} (typically an {@link Error}) thrown by a
 * protected call. The call is recorded as failed and the CircuitBreaker keeps operating.
 */
public class AbnormalTerminationException extends RuntimeException {

    public AbnormalTerminationException(String circuitBreakerName, Throwable cause) {
        super(String.format("Call protected by CircuitBreaker '%s' terminated abnormally: %s", circuitBreakerName, cause), cause);
    }
}
