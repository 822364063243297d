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

import io.github.agentguard.core.CallContext;
import io.github.agentguard.core.SchedulerFactory;
import io.vavr.CheckedRunnable;
import io.vavr.control.Try;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A fixed, ordered set of CircuitBreakers that runs one call per CircuitBreaker in parallel.
 */
public class CircuitBreakerGroup {

    private final List<CircuitBreaker> circuitBreakers;
    private final Executor executor;

    public CircuitBreakerGroup(List<CircuitBreaker> circuitBreakers, Executor executor) {
        this.circuitBreakers = Collections.unmodifiableList(new ArrayList<>(circuitBreakers));
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    public static CircuitBreakerGroup of(CircuitBreaker... circuitBreakers) {
        return of(Arrays.asList(circuitBreakers));
    }

    public static CircuitBreakerGroup of(List<CircuitBreaker> circuitBreakers) {
        return new CircuitBreakerGroup(circuitBreakers, SchedulerFactory.getInstance().getCallExecutor());
    }

    /**
     * Runs {@code calls[i]} through CircuitBreaker {@code i}, all of them concurrently, and waits
     * until every call finished.
     *
     * @param context the context shared by all calls
     * @param calls   one call per CircuitBreaker, in the order of the group
     * @return the outcome of each call, in the same order
     * @throws IllegalArgumentException if the number of calls differs from the number of CircuitBreakers
     */
    public List<Try<Void>> executeAll(CallContext context, List<CheckedRunnable> calls) {
        if (calls.size() != circuitBreakers.size()) {
            throw new IllegalArgumentException(String.format(
                "number of calls (%d) must match number of circuit breakers (%d)", calls.size(), circuitBreakers.size()));
        }

        List<CompletableFuture<Try<Void>>> outcomes = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            CircuitBreaker circuitBreaker = circuitBreakers.get(i);
            CheckedRunnable call = calls.get(i);
            outcomes.add(CompletableFuture.supplyAsync(() -> circuitBreaker.tryExecute(context, call), executor));
        }

        // 等待全部完成, 结果按下标顺序返回
        List<Try<Void>> results = new ArrayList<>(outcomes.size());
        for (CompletableFuture<Try<Void>> outcome : outcomes) {
            results.add(outcome.join());
        }
        return results;
    }

    public List<Try<Void>> executeAll(CallContext context, CheckedRunnable... calls) {
        return executeAll(context, Arrays.asList(calls));
    }

    public List<CircuitBreaker> getCircuitBreakers() {
        return circuitBreakers;
    }
}
