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

import io.github.agentguard.core.lang.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Carries the cancellation signal and the optional deadline of one logical call.
 * <p>A context ends at most once, either because {@link #cancel()} was invoked, because its deadline
 * passed or because its parent ended. After that {@link #getCause()} tells why:
 * <ul>
 * <li>{@link CancellationException} - the context (or a parent) was cancelled</li>
 * <li>{@link TimeoutException} - the deadline passed</li>
 * </ul>
 * <p>{@link #background()} never ends and is the context used when a caller does not supply one.
 * <p>Ending a context only signals the parties waiting on it. Work already running is not
 * interrupted; code that wants to stop early has to observe the context itself.
 */
public final class CallContext {

    private static final Registration NO_OP_REGISTRATION = () -> {
    };

    private static final CallContext BACKGROUND = new CallContext(false, null);

    private final boolean cancellable;
    @Nullable
    private final Instant deadline;
    private final AtomicReference<Exception> cause = new AtomicReference<>();
    private final Set<Consumer<Exception>> listeners = ConcurrentHashMap.newKeySet();

    // 截止时间定时器 / 父上下文订阅, 结束时释放
    @Nullable
    private volatile ScheduledFuture<?> deadlineTimer;
    @Nullable
    private volatile Registration parentRegistration;

    private CallContext(boolean cancellable, @Nullable Instant deadline) {
        this.cancellable = cancellable;
        this.deadline = deadline;
    }

    /**
     * @return the context that is never cancelled and has no deadline
     */
    public static CallContext background() {
        return BACKGROUND;
    }

    /**
     * @return a new root context that ends when {@link #cancel()} is invoked
     */
    public static CallContext withCancel() {
        return BACKGROUND.childWithCancel();
    }

    /**
     * @param timeout the time after which the context ends with a {@link TimeoutException}
     * @return a new root context with a deadline
     */
    public static CallContext withTimeout(Duration timeout) {
        return BACKGROUND.childWithTimeout(timeout);
    }

    /**
     * Creates a context that ends when this context ends or when it is cancelled itself.
     *
     * @return the child context
     */
    public CallContext childWithCancel() {
        CallContext child = new CallContext(true, deadline);
        child.attachTo(this);
        return child;
    }

    /**
     * Creates a context that ends when this context ends, when it is cancelled itself or when
     * {@code timeout} has elapsed, whichever comes first.
     *
     * @param timeout the timeout of the child, relative to now
     * @return the child context
     */
    public CallContext childWithTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "Timeout must not be null");
        Instant requested = Instant.now().plus(timeout);
        Instant effective = deadline != null && deadline.isBefore(requested) ? deadline : requested;

        CallContext child = new CallContext(true, effective);
        child.attachTo(this);
        child.armDeadline(timeout);
        return child;
    }

    /**
     * Ends this context with a {@link CancellationException}. Has no effect on {@link #background()}
     * or on a context that already ended.
     */
    public void cancel() {
        if (cancellable) {
            finish(new CancellationException("context canceled"));
        }
    }

    public boolean isDone() {
        return cause.get() != null;
    }

    /**
     * @return whether this context can end at all; {@code false} only for {@link #background()}
     */
    public boolean isCancellable() {
        return cancellable;
    }

    /**
     * @return why the context ended, or {@code null} while it is still active
     */
    @Nullable
    public Exception getCause() {
        return cause.get();
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Registers a listener that receives the cause once this context ends. If the context already
     * ended the listener runs immediately on the calling thread. Each listener runs at most once.
     *
     * @param listener receives the cause
     * @return a registration that removes the listener when closed
     */
    public Registration onDone(Consumer<? super Exception> listener) {
        Objects.requireNonNull(listener, "Listener must not be null");
        if (!cancellable) {
            return NO_OP_REGISTRATION;
        }
        // 包装一层, 保证每次注册都是不同的对象
        Consumer<Exception> registered = listener::accept;
        listeners.add(registered);
        Exception current = cause.get();
        if (current != null && listeners.remove(registered)) {
            registered.accept(current);
        }
        return () -> listeners.remove(registered);
    }

    /**
     * Blocks for the given duration unless this context ends first.
     *
     * @param duration how long to wait
     * @return {@code true} if the full duration elapsed, {@code false} if the context ended first
     * @throws InterruptedException if the current thread is interrupted while waiting
     */
    public boolean sleep(Duration duration) throws InterruptedException {
        if (isDone()) {
            return false;
        }
        CountDownLatch ended = new CountDownLatch(1);
        try (Registration ignored = onDone(c -> ended.countDown())) {
            return !ended.await(duration.toNanos(), TimeUnit.NANOSECONDS);
        }
    }

    private void attachTo(CallContext parent) {
        if (parent.cancellable) {
            this.parentRegistration = parent.onDone(this::finish);
        }
    }

    private void armDeadline(Duration timeout) {
        long delayNanos = deadline == null ? timeout.toNanos()
            : Math.min(timeout.toNanos(), Duration.between(Instant.now(), deadline).toNanos());
        if (delayNanos <= 0) {
            finish(new TimeoutException("context deadline exceeded"));
            return;
        }
        ScheduledFuture<?> timer = SchedulerFactory.getInstance().getScheduler()
            .schedule(() -> finish(new TimeoutException("context deadline exceeded")), delayNanos, TimeUnit.NANOSECONDS);
        this.deadlineTimer = timer;
        // 定时器登记前上下文可能已结束
        if (isDone()) {
            timer.cancel(false);
        }
    }

    private void finish(Exception reason) {
        if (!cause.compareAndSet(null, reason)) {
            return;
        }
        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        Registration registration = parentRegistration;
        if (registration != null) {
            registration.close();
        }
        for (Consumer<Exception> listener : listeners) {
            if (listeners.remove(listener)) {
                listener.accept(reason);
            }
        }
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CallContext{background}";
        }
        return "CallContext{" +
            "deadline=" + deadline +
            ", cause=" + cause.get() +
            '}';
    }

    /**
     * Handle returned by {@link #onDone(Consumer)}; closing it removes the listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
