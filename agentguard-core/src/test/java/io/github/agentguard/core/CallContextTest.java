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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class CallContextTest {

    @Test
    void backgroundNeverEnds() throws InterruptedException {
        CallContext background = CallContext.background();

        background.cancel();

        assertThat(background.isDone()).isFalse();
        assertThat(background.isCancellable()).isFalse();
        assertThat(background.getCause()).isNull();
        assertThat(background.getDeadline()).isEmpty();
        assertThat(background.sleep(Duration.ofMillis(10))).isTrue();
    }

    @Test
    void shouldEndWithCancellationExceptionWhenCancelled() {
        CallContext context = CallContext.withCancel();
        assertThat(context.isDone()).isFalse();

        context.cancel();

        assertThat(context.isDone()).isTrue();
        assertThat(context.getCause()).isInstanceOf(CancellationException.class);
    }

    @Test
    void shouldEndWithTimeoutExceptionAfterDeadline() {
        CallContext context = CallContext.withTimeout(Duration.ofMillis(50));

        assertThat(context.getDeadline()).isPresent();
        await().atMost(Duration.ofSeconds(2)).until(context::isDone);
        assertThat(context.getCause()).isInstanceOf(TimeoutException.class);
    }

    @Test
    void shouldKeepFirstCause() throws InterruptedException {
        CallContext context = CallContext.withTimeout(Duration.ofMillis(30));
        context.cancel();

        Thread.sleep(60);

        assertThat(context.getCause()).isInstanceOf(CancellationException.class);
    }

    @Test
    void childShouldEndWithParent() {
        CallContext parent = CallContext.withCancel();
        CallContext child = parent.childWithCancel();

        parent.cancel();

        assertThat(child.isDone()).isTrue();
        assertThat(child.getCause()).isInstanceOf(CancellationException.class);
    }

    @Test
    void cancellingChildShouldNotEndParent() {
        CallContext parent = CallContext.withCancel();
        CallContext child = parent.childWithCancel();

        child.cancel();

        assertThat(child.isDone()).isTrue();
        assertThat(parent.isDone()).isFalse();
    }

    @Test
    void childShouldInheritEarlierDeadline() {
        CallContext parent = CallContext.withTimeout(Duration.ofMillis(100));
        CallContext child = parent.childWithTimeout(Duration.ofMinutes(1));

        assertThat(child.getDeadline()).isEqualTo(parent.getDeadline());
        await().atMost(Duration.ofSeconds(2)).until(child::isDone);
        assertThat(child.getCause()).isInstanceOf(TimeoutException.class);
    }

    @Test
    void childWithShorterTimeoutShouldEndFirst() {
        CallContext parent = CallContext.withTimeout(Duration.ofMinutes(1));
        CallContext child = parent.childWithTimeout(Duration.ofMillis(50));

        assertThat(child.getDeadline().get()).isBefore(parent.getDeadline().get());
        await().atMost(Duration.ofSeconds(2)).until(child::isDone);
        assertThat(parent.isDone()).isFalse();
        parent.cancel();
    }

    @Test
    void shouldNotifyListenersOnceWithCause() {
        CallContext context = CallContext.withCancel();
        List<Exception> causes = new CopyOnWriteArrayList<>();
        context.onDone(causes::add);

        context.cancel();
        context.cancel();

        assertThat(causes).hasSize(1);
        assertThat(causes.get(0)).isInstanceOf(CancellationException.class);
    }

    @Test
    void shouldRunListenerImmediatelyWhenAlreadyDone() {
        CallContext context = CallContext.withCancel();
        context.cancel();
        AtomicInteger notified = new AtomicInteger();

        context.onDone(cause -> notified.incrementAndGet());

        assertThat(notified).hasValue(1);
    }

    @Test
    void closedRegistrationShouldNotBeNotified() {
        CallContext context = CallContext.withCancel();
        AtomicInteger notified = new AtomicInteger();
        CallContext.Registration registration = context.onDone(cause -> notified.incrementAndGet());

        registration.close();
        context.cancel();

        assertThat(notified).hasValue(0);
    }

    @Test
    void sleepShouldReturnFalseWhenContextEnds() throws InterruptedException {
        CallContext context = CallContext.withTimeout(Duration.ofMillis(50));
        Instant start = Instant.now();

        boolean slept = context.sleep(Duration.ofSeconds(5));

        assertThat(slept).isFalse();
        assertThat(Duration.between(start, Instant.now())).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void sleepShouldReturnTrueWhenDurationElapsed() throws InterruptedException {
        CallContext context = CallContext.withCancel();

        assertThat(context.sleep(Duration.ofMillis(20))).isTrue();
        assertThat(context.isDone()).isFalse();
    }

    @Test
    void sleepOnEndedContextShouldReturnImmediately() throws InterruptedException {
        CallContext context = CallContext.withCancel();
        context.cancel();

        assertThat(context.sleep(Duration.ofMinutes(1))).isFalse();
    }
}
