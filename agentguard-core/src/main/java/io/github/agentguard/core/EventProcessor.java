/*
 *
 *  Copyright 2017: Robert Winkler
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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatches events to consumers subscribed either to every event or to one event type.
 * <p>A consumer that throws is logged and skipped, the remaining consumers still receive the event.
 *
 * @param <T> the base type of the dispatched events
 */
public class EventProcessor<T> implements EventPublisher<T> {

    private static final Logger LOG = LoggerFactory.getLogger(EventProcessor.class);

    /**
     * 是否存在事件注册
     */
    private volatile boolean consumerRegistered;

    /**
     * 全类型-事件
     */
    final List<EventConsumer<T>> onEventConsumers = new CopyOnWriteArrayList<>();

    /**
     * 特定类型-事件, key: 事件类的全限定名
     */
    final ConcurrentMap<String, List<EventConsumer<T>>> eventConsumerMap = new ConcurrentHashMap<>();

    public boolean hasConsumers() {
        return consumerRegistered;
    }

    /**
     * 特定类型-事件, 注册入口
     *
     * @param eventType     the event class the consumer is interested in
     * @param eventConsumer the consumer
     */
    @SuppressWarnings("unchecked")
    public synchronized <E extends T> void registerConsumer(Class<E> eventType, EventConsumer<? super E> eventConsumer) {
        this.consumerRegistered = true;
        this.eventConsumerMap.compute(eventType.getName(), (k, consumers) -> {
            List<EventConsumer<T>> updated = consumers == null ? new CopyOnWriteArrayList<>() : consumers;
            updated.add((EventConsumer<T>) eventConsumer);
            return updated;
        });
    }

    /**
     * 触发事件
     *
     * @param event the event to dispatch
     * @param <E>   the concrete event type
     * @return true if at least one consumer received the event
     */
    public <E extends T> boolean processEvent(E event) {
        boolean consumed = false;
        if (!onEventConsumers.isEmpty()) {
            onEventConsumers.forEach(onEventConsumer -> deliver(onEventConsumer, event));
            consumed = true;
        }

        if (!eventConsumerMap.isEmpty()) {
            List<EventConsumer<T>> eventConsumers = this.eventConsumerMap.get(event.getClass().getName());
            if (eventConsumers != null && !eventConsumers.isEmpty()) {
                eventConsumers.forEach(consumer -> deliver(consumer, event));
                consumed = true;
            }
        }

        return consumed;
    }

    /**
     * 全类型-事件, 注册入口
     *
     * @param onEventConsumer the consumer
     */
    @Override
    public synchronized void onEvent(EventConsumer<T> onEventConsumer) {
        this.consumerRegistered = true;
        this.onEventConsumers.add(onEventConsumer);
    }

    private void deliver(EventConsumer<T> consumer, T event) {
        try {
            consumer.consumeEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Event consumer failed to handle {}", event, e);
        }
    }

}
