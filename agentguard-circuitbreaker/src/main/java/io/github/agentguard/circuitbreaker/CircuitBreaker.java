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

import io.github.agentguard.circuitbreaker.event.*;
import io.github.agentguard.circuitbreaker.internal.CircuitBreakerStateMachine;
import io.github.agentguard.core.CallContext;
import io.github.agentguard.core.EventConsumer;
import io.vavr.CheckedConsumer;
import io.vavr.CheckedRunnable;
import io.vavr.collection.Map;
import io.vavr.control.Try;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * A CircuitBreaker manages the state of a backend system.
 * <p>It is a finite state machine with three states: CLOSED, OPEN and HALF_OPEN. It starts CLOSED
 * and counts consecutive failures. Once {@link CircuitBreakerConfig#getFailureThreshold()} failures
 * happened in a row it trips to OPEN and rejects every call with a {@link CircuitOpenException}.
 * After {@link CircuitBreakerConfig#getTimeout()} the next call is let through and the breaker
 * switches to HALF_OPEN, where at most {@link CircuitBreakerConfig#getMaxConcurrentRequests()} trial
 * calls may be in flight. {@link CircuitBreakerConfig#getSuccessThreshold()} consecutive successes
 * close the breaker again, a single failure reopens it.
 * <p>Instances are thread safe. There is no terminal state.
 */
public interface CircuitBreaker {

    /**
     * Creates a CircuitBreaker with the given configuration.
     *
     * @param name   the name of the CircuitBreaker
     * @param config the configuration, validated before use
     * @return a CircuitBreaker
     * @throws IllegalArgumentException if the configuration is invalid
     */
    static CircuitBreaker of(String name, CircuitBreakerConfig config) {
        return new CircuitBreakerStateMachine(name, config);
    }

    /**
     * Creates a CircuitBreaker, reporting an invalid configuration as a failed {@link Try}
     * instead of throwing.
     *
     * @param name   the name of the CircuitBreaker
     * @param config the configuration, validated before use
     * @return the CircuitBreaker, or the validation failure
     */
    static Try<CircuitBreaker> tryOf(String name, CircuitBreakerConfig config) {
        return Try.of(() -> of(name, config));
    }

    /**
     * Creates a CircuitBreaker with {@link CircuitBreakerConfig#ofDefaults()}.
     *
     * @param name the name of the CircuitBreaker
     * @return a CircuitBreaker
     */
    static CircuitBreaker ofDefaults(String name) {
        return of(name, CircuitBreakerConfig.ofDefaults());
    }

    /**
     * Runs the call if the breaker admits it, and records the outcome.
     * <ul>
     * <li>a rejected call is never invoked: {@link CircuitOpenException} or
     * {@link TooManyRequestsException} is thrown instead</li>
     * <li>when the context ends before the call returns, {@link CircuitBreakerTimeoutException} is
     * thrown; the call keeps running in the background and its outcome is discarded</li>
     * <li>an exception thrown by the call counts as a failure and is rethrown as is</li>
     * <li>any other throwable counts as a failure and is rethrown wrapped in an
     * {@link AbnormalTerminationException}</li>
     * </ul>
     *
     * @param context the call context
     * @param call    the protected call
     * @throws Exception the rejection, the timeout or the failure of the call
     */
    void execute(CallContext context, CheckedRunnable call) throws Exception;

    /**
     * Same as {@link #execute(CallContext, CheckedRunnable)} with {@link CallContext#background()}.
     *
     * @param call the protected call
     * @throws Exception the rejection or the failure of the call
     */
    default void execute(CheckedRunnable call) throws Exception {
        execute(CallContext.background(), call);
    }

    /**
     * Same contract as {@link #execute(CallContext, CheckedRunnable)}, returning the call's value.
     *
     * @param context  the call context
     * @param callable the protected call
     * @param <T>      the result type
     * @return the value returned by the callable
     * @throws Exception the rejection, the timeout or the failure of the call
     */
    <T> T executeCallable(CallContext context, Callable<T> callable) throws Exception;

    /**
     * Same contract as {@link #execute(CallContext, CheckedRunnable)}, but hands the context to the
     * call so it can stop its own work once the context ends.
     *
     * @param context the call context
     * @param call    the protected call
     * @throws Exception the rejection, the timeout or the failure of the call
     */
    void executeWithContext(CallContext context, CheckedConsumer<CallContext> call) throws Exception;

    /**
     * Same as {@link #execute(CallContext, CheckedRunnable)}, returning the outcome as a {@link Try}.
     *
     * @param context the call context
     * @param call    the protected call
     * @return a successful Try, or a failed one carrying what {@code execute} would have thrown
     */
    default Try<Void> tryExecute(CallContext context, CheckedRunnable call) {
        return Try.run(() -> execute(context, call));
    }

    /**
     * Returns the CircuitBreaker to CLOSED and zeroes the consecutive counters. Cumulative counters
     * and metrics are kept.
     */
    void reset();

    String getName();

    State getState();

    /**
     * @return the label of the current state: {@code closed}, {@code open} or {@code half-open}
     */
    default String getStateName() {
        return getState().toString();
    }

    /**
     * @return the validated configuration
     */
    CircuitBreakerConfig getCircuitBreakerConfig();

    /**
     * @return a consistent snapshot of the counters
     */
    CircuitBreakerStats getStats();

    /**
     * @return a snapshot of the collected metrics
     */
    Metrics getMetrics();

    /**
     * @return the publisher to subscribe to this CircuitBreaker's events
     */
    EventPublisher getEventPublisher();

    /**
     * States of the CircuitBreaker state machine.
     */
    enum State {
        /**
         * Calls pass through; consecutive failures are counted.
         */
        CLOSED("closed"),
        /**
         * Calls are rejected until the timeout elapsed.
         */
        OPEN("open"),
        /**
         * A bounded number of trial calls decide between CLOSED and OPEN.
         */
        HALF_OPEN("half-open");

        private final String label;

        State(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    /**
     * Point in time view of the metrics of one CircuitBreaker.
     */
    interface Metrics {

        String getName();

        /**
         * @return the number of calls that were executed, successfully or not
         */
        long getNumberOfCalls();

        long getNumberOfSuccessfulCalls();

        long getNumberOfFailedCalls();

        /**
         * @return the number of calls rejected by an OPEN or saturated HALF_OPEN breaker
         */
        long getNumberOfNotPermittedCalls();

        /**
         * @return how often each state was entered, keyed by state label
         */
        Map<String, Long> getStateTransitions();

        /**
         * Latency statistics cover the most recent calls only, all of them are
         * {@link Duration#ZERO} as long as no call completed.
         *
         * @return the average latency
         */
        Duration getAverageLatency();

        Duration getMinLatency();

        Duration getMaxLatency();

        Duration getP50Latency();

        Duration getP95Latency();

        Duration getP99Latency();
    }

    /**
     * An EventPublisher can be used to register event consumers.
     * <p>Events are delivered asynchronously, in the order they happened, on the event executor of
     * the CircuitBreaker.
     */
    interface EventPublisher extends io.github.agentguard.core.EventPublisher<CircuitBreakerEvent> {

        EventPublisher onSuccess(EventConsumer<CircuitBreakerOnSuccessEvent> eventConsumer);

        EventPublisher onError(EventConsumer<CircuitBreakerOnErrorEvent> eventConsumer);

        EventPublisher onStateTransition(EventConsumer<CircuitBreakerOnStateTransitionEvent> eventConsumer);

        EventPublisher onReset(EventConsumer<CircuitBreakerOnResetEvent> eventConsumer);

        EventPublisher onCallNotPermitted(EventConsumer<CircuitBreakerOnCallNotPermittedEvent> eventConsumer);
    }
}
