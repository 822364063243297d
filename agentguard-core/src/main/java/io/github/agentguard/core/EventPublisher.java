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
package io.github.agentguard.core;

/**
 * An EventPublisher which subscribes consumers to every event it publishes.
 *
 * @param <T> the type of event
 */
public interface EventPublisher<T> {

    /**
     * Subscribes a consumer to all events, regardless of their type.
     *
     * @param onEventConsumer the consumer
     */
    void onEvent(EventConsumer<T> onEventConsumer);
}
