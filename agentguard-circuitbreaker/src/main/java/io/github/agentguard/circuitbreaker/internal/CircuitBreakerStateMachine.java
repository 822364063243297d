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
package io.github.agentguard.circuitbreaker.internal;

import io.github.agentguard.circuitbreaker.AbnormalTerminationException;
import io.github.agentguard.circuitbreaker.CircuitBreaker;
import io.github.agentguard.circuitbreaker.CircuitBreakerConfig;
import io.github.agentguard.circuitbreaker.CircuitBreakerStats;
import io.github.agentguard.circuitbreaker.CircuitBreakerTimeoutException;
import io.github.agentguard.circuitbreaker.CircuitOpenException;
import io.github.agentguard.circuitbreaker.TooManyRequestsException;
import io.github.agentguard.circuitbreaker.event.*;
import io.github.agentguard.core.CallContext;
import io.github.agentguard.core.EventConsumer;
import io.github.agentguard.core.EventProcessor;
import io.github.agentguard.core.SerialExecutor;
import io.github.agentguard.core.lang.Nullable;
import io.vavr.CheckedConsumer;
import io.vavr.CheckedFunction1;
import io.vavr.CheckedRunnable;
import io.vavr.control.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import static io.github.agentguard.circuitbreaker.CircuitBreaker.State.*;

/**
 * A CircuitBreaker finite state machine.
 * <p>One lock guards the state and every counter. Admission and outcome recording each hold it
 * briefly; the protected call itself always runs without it.
 */
public final class CircuitBreakerStateMachine implements CircuitBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(CircuitBreakerStateMachine.class);

    private final String name;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final Clock clock;
    private final CircuitBreakerMetrics metrics;
    private final CircuitBreakerEventProcessor eventProcessor;
    private final Executor callExecutor;
    /**
     * 观察者通知: 异步, 按状态变化顺序串行投递
     */
    private final Executor notificationExecutor;

    private final ReentrantLock lock = new ReentrantLock();

    // 以下字段均由 lock 保护
    private State state = CLOSED;
    private Instant stateChangedAt;
    private long totalRequests;
    private long totalSuccesses;
    private long totalFailures;
    private int consecutiveSuccesses;
    private int consecutiveFailures;
    @Nullable
    private Throwable lastError;
    @Nullable
    private Instant lastErrorTime;
    /**
     * 半开状态下正在执行的试探请求数
     */
    private int halfOpenRequests;

    /**
     * Creates a circuitBreaker.
     *
     * @param name                 the name of the CircuitBreaker
     * @param circuitBreakerConfig The CircuitBreaker configuration, validated here
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public CircuitBreakerStateMachine(String name, CircuitBreakerConfig circuitBreakerConfig) {
        this(name, circuitBreakerConfig, Clock.systemUTC());
    }

    /**
     * Creates a circuitBreaker.
     *
     * @param name                 the name of the CircuitBreaker
     * @param circuitBreakerConfig The CircuitBreaker configuration, validated here
     * @param clock                A Clock which can be mocked in tests.
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public CircuitBreakerStateMachine(String name, CircuitBreakerConfig circuitBreakerConfig, Clock clock) {
        this.name = Objects.requireNonNull(name, "Name must not be null");
        this.circuitBreakerConfig = Objects.requireNonNull(circuitBreakerConfig, "Config must not be null").validate();
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.metrics = new CircuitBreakerMetrics(name);
        this.eventProcessor = new CircuitBreakerEventProcessor();
        this.callExecutor = this.circuitBreakerConfig.getCallExecutor();
        this.notificationExecutor = new SerialExecutor(this.circuitBreakerConfig.getEventExecutor());
        this.stateChangedAt = clock.instant();
    }

    @Override
    public void execute(CallContext context, CheckedRunnable call) throws Exception {
        Objects.requireNonNull(call, "Call must not be null");
        executeInternal(context, ctx -> {
            call.run();
            return null;
        });
    }

    @Override
    public <T> T executeCallable(CallContext context, Callable<T> callable) throws Exception {
        Objects.requireNonNull(callable, "Callable must not be null");
        return executeInternal(context, ctx -> callable.call());
    }

    @Override
    public void executeWithContext(CallContext context, CheckedConsumer<CallContext> call) throws Exception {
        Objects.requireNonNull(call, "Call must not be null");
        executeInternal(context, ctx -> {
            call.accept(ctx);
            return null;
        });
    }

    private <T> T executeInternal(CallContext context, CheckedFunction1<CallContext, T> call) throws Exception {
        Objects.requireNonNull(context, "Context must not be null");
        // 获取执行权限, 被拒绝时直接抛出, 不执行调用
        acquirePermission();

        final long start = System.nanoTime();
        try {
            T result = awaitOutcome(context, call);
            onCallCompleted(null, System.nanoTime() - start);
            return result;
        } catch (Exception exception) {
            onCallCompleted(exception, System.nanoTime() - start);
            throw exception;
        }
    }

    /**
     * Runs the call and waits for its outcome or for the end of the context, whichever comes
     * first. A call outliving its context is not interrupted; its outcome is dropped.
     */
    private <T> T awaitOutcome(CallContext context, CheckedFunction1<CallContext, T> call) throws Exception {
        if (!context.isCancellable()) {
            // 上下文不会结束, 无需竞争, 直接在调用线程执行
            return invoke(context, call);
        }

        CompletableFuture<Try<T>> outcome = new CompletableFuture<>();
        callExecutor.execute(() -> {
            try {
                outcome.complete(Try.success(invoke(context, call)));
            } catch (Exception failure) {
                outcome.complete(Try.failure(failure));
            }
        });

        CompletableFuture<Boolean> callFinishedFirst = new CompletableFuture<>();
        outcome.thenRun(() -> callFinishedFirst.complete(true));
        try (CallContext.Registration ignored = context.onDone(cause -> callFinishedFirst.complete(false))) {
            if (!callFinishedFirst.get()) {
                Exception cause = Objects.requireNonNull(context.getCause());
                LOG.debug("CircuitBreaker '{}' stopped waiting for a call: {}", name, cause.getMessage());
                throw new CircuitBreakerTimeoutException(name, cause);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new CircuitBreakerTimeoutException(name, interrupted);
        }

        Try<T> result = outcome.join();
        if (result.isFailure()) {
            throw (Exception) result.getCause();
        }
        return result.get();
    }

    private <T> T invoke(CallContext context, CheckedFunction1<CallContext, T> call) throws Exception {
        try {
            return call.apply(context);
        } catch (Exception exception) {
            throw exception;
        } catch (Throwable throwable) {
            LOG.warn("CircuitBreaker '{}' recovered from a call terminating abnormally", name, throwable);
            throw new AbnormalTerminationException(name, throwable);
        }
    }

    private void acquirePermission() {
        lock.lock();
        try {
            totalRequests++;
            switch (state) {
                case CLOSED:
                    return;
                case OPEN:
                    if (openTimeoutElapsed()) {
                        // 超时已过, 放行一个试探请求
                        transitionTo(HALF_OPEN);
                        halfOpenRequests = 1;
                        return;
                    }
                    rejectCall();
                    throw new CircuitOpenException(name);
                case HALF_OPEN:
                    if (halfOpenRequests >= circuitBreakerConfig.getMaxConcurrentRequests()) {
                        rejectCall();
                        throw new TooManyRequestsException(name, circuitBreakerConfig.getMaxConcurrentRequests());
                    }
                    halfOpenRequests++;
                    return;
                default:
                    throw new IllegalStateException("Unknown CircuitBreaker state " + state);
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean openTimeoutElapsed() {
        return Duration.between(stateChangedAt, clock.instant()).compareTo(circuitBreakerConfig.getTimeout()) > 0;
    }

    private void rejectCall() {
        LOG.debug("CircuitBreaker '{}' rejected a call in state {}", name, state);
        metrics.onCallNotPermitted();
        publishEvent(new CircuitBreakerOnCallNotPermittedEvent(name, state));
    }

    private void onCallCompleted(@Nullable Exception failure, long durationNanos) {
        lock.lock();
        try {
            if (state == HALF_OPEN && halfOpenRequests > 0) {
                halfOpenRequests--;
            }
            metrics.onCallCompleted(failure == null, durationNanos);
            if (failure == null) {
                onSuccess(durationNanos);
            } else {
                onError(failure, durationNanos);
            }
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(long durationNanos) {
        LOG.debug("CircuitBreaker '{}' succeeded", name);
        totalSuccesses++;
        consecutiveSuccesses++;
        consecutiveFailures = 0;
        publishEvent(new CircuitBreakerOnSuccessEvent(name, Duration.ofNanos(durationNanos)));

        switch (state) {
            case CLOSED:
                break;
            case HALF_OPEN:
                if (consecutiveSuccesses >= circuitBreakerConfig.getSuccessThreshold()) {
                    transitionTo(CLOSED);
                    consecutiveSuccesses = 0;
                    consecutiveFailures = 0;
                    halfOpenRequests = 0;
                }
                break;
            case OPEN:
                // 打开前已放行的调用迟到的成功
                transitionTo(HALF_OPEN);
                break;
            default:
                throw new IllegalStateException("Unknown CircuitBreaker state " + state);
        }
    }

    private void onError(Exception failure, long durationNanos) {
        LOG.debug("CircuitBreaker '{}' recorded a failure: {}", name, failure.toString());
        totalFailures++;
        consecutiveFailures++;
        consecutiveSuccesses = 0;
        lastError = failure;
        lastErrorTime = clock.instant();
        publishEvent(new CircuitBreakerOnErrorEvent(name, Duration.ofNanos(durationNanos), failure));

        switch (state) {
            case CLOSED:
                if (consecutiveFailures >= circuitBreakerConfig.getFailureThreshold()) {
                    transitionTo(OPEN);
                }
                break;
            case HALF_OPEN:
                // 半开状态下任一失败立即打开
                transitionTo(OPEN);
                halfOpenRequests = 0;
                break;
            case OPEN:
                // 重新计时
                stateChangedAt = clock.instant();
                break;
            default:
                throw new IllegalStateException("Unknown CircuitBreaker state " + state);
        }
    }

    /**
     * Must be called with the lock held.
     */
    private void transitionTo(State newState) {
        if (state == newState) {
            return;
        }
        State previousState = state;
        state = newState;
        stateChangedAt = clock.instant();
        metrics.onStateTransition(newState);
        LOG.info("CircuitBreaker '{}' changed state from {} to {}", name, previousState, newState);
        notifyStateChange(previousState, newState);
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            if (state != CLOSED) {
                transitionTo(CLOSED);
            } else {
                stateChangedAt = clock.instant();
            }
            consecutiveSuccesses = 0;
            consecutiveFailures = 0;
            halfOpenRequests = 0;
            LOG.info("CircuitBreaker '{}' reset", name);
            publishEvent(new CircuitBreakerOnResetEvent(name));
        } finally {
            lock.unlock();
        }
    }

    private void notifyStateChange(State from, State to) {
        circuitBreakerConfig.getStateChangeListener()
            .ifPresent(listener -> dispatch(() -> listener.onStateChange(name, from, to)));
        publishEvent(new CircuitBreakerOnStateTransitionEvent(name, from, to));
    }

    private void publishEvent(CircuitBreakerEvent event) {
        if (!eventProcessor.hasConsumers()) {
            return;
        }
        dispatch(() -> eventProcessor.consumeEvent(event));
    }

    /**
     * Hands a notification to the serial notification executor, so a slow or failing observer
     * never blocks or breaks the caller.
     */
    private void dispatch(Runnable notification) {
        try {
            notificationExecutor.execute(() -> {
                try {
                    notification.run();
                } catch (RuntimeException e) {
                    LOG.warn("CircuitBreaker '{}' observer failed", name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("CircuitBreaker '{}' could not dispatch a notification", name, e);
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }

    @Override
    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            return new CircuitBreakerStats(totalRequests, totalSuccesses, totalFailures,
                consecutiveSuccesses, consecutiveFailures, lastError, lastErrorTime, state, stateChangedAt);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Metrics getMetrics() {
        return metrics.getMetrics();
    }

    @Override
    public EventPublisher getEventPublisher() {
        return eventProcessor;
    }

    @Override
    public String toString() {
        return String.format("CircuitBreaker '%s'", this.name);
    }

    private class CircuitBreakerEventProcessor extends EventProcessor<CircuitBreakerEvent>
        implements EventConsumer<CircuitBreakerEvent>, EventPublisher {

        @Override
        public EventPublisher onSuccess(EventConsumer<CircuitBreakerOnSuccessEvent> onSuccessEventConsumer) {
            registerConsumer(CircuitBreakerOnSuccessEvent.class, onSuccessEventConsumer);
            return this;
        }

        @Override
        public EventPublisher onError(EventConsumer<CircuitBreakerOnErrorEvent> onErrorEventConsumer) {
            registerConsumer(CircuitBreakerOnErrorEvent.class, onErrorEventConsumer);
            return this;
        }

        @Override
        public EventPublisher onStateTransition(
            EventConsumer<CircuitBreakerOnStateTransitionEvent> onStateTransitionEventConsumer) {
            registerConsumer(CircuitBreakerOnStateTransitionEvent.class, onStateTransitionEventConsumer);
            return this;
        }

        @Override
        public EventPublisher onReset(EventConsumer<CircuitBreakerOnResetEvent> onResetEventConsumer) {
            registerConsumer(CircuitBreakerOnResetEvent.class, onResetEventConsumer);
            return this;
        }

        @Override
        public EventPublisher onCallNotPermitted(
            EventConsumer<CircuitBreakerOnCallNotPermittedEvent> onCallNotPermittedEventConsumer) {
            registerConsumer(CircuitBreakerOnCallNotPermittedEvent.class, onCallNotPermittedEventConsumer);
            return this;
        }

        @Override
        public void consumeEvent(CircuitBreakerEvent event) {
            super.processEvent(event);
        }
    }
}
