/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.netty.channel.DefaultEventLoop;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventLoopDispatchQueueTest {

    private final DefaultEventLoop eventLoop = new DefaultEventLoop();
    private final CompletableFuture<Throwable> fatal = new CompletableFuture<>();
    private final EventLoopDispatchQueue queue = new EventLoopDispatchQueue(eventLoop, "producer 0", fatal::complete);

    @AfterEach
    void tearDown() {
        eventLoop.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    void runsTasksInOrderOnTheLoop() throws Exception {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        List<Boolean> onQueue = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(3);
        for (int i = 0; i < 3; i++) {
            int n = i;
            queue.execute(() -> {
                order.add(n);
                onQueue.add(queue.isExecuting());
                latch.countDown();
            });
        }

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(order).containsExactly(0, 1, 2);
        assertThat(onQueue).containsOnly(true);
        assertThat(queue.isExecuting()).isFalse();
    }

    @Test
    void executeFromTheQueueIsNotInline() throws Exception {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(1);
        queue.execute(() -> {
            queue.execute(() -> {
                order.add("inner");
                latch.countDown();
            });
            order.add("outer");
        });

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(order).containsExactly("outer", "inner");
    }

    @Test
    void delayedTaskRunsOnTheQueue() throws Exception {
        CompletableFuture<Boolean> ran = new CompletableFuture<>();
        long start = System.nanoTime();

        queue.executeAfter(50, TimeUnit.MILLISECONDS, () -> ran.complete(queue.isExecuting()));

        assertThat(ran.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
    }

    @Test
    void taskFailureIsReportedAsFatal() throws Exception {
        queue.execute(() -> {
            throw new IllegalStateException("broken invariant");
        });

        assertThat(fatal.get(5, TimeUnit.SECONDS)).isInstanceOf(IllegalStateException.class).hasMessage("broken invariant");
    }

    @Test
    void queuesSharingALoopOnlyOwnTheirOwnTasks() throws Exception {
        EventLoopDispatchQueue other = new EventLoopDispatchQueue(eventLoop, "consumer 1", fatal::complete);
        CompletableFuture<List<Boolean>> seen = new CompletableFuture<>();
        CompletableFuture<Throwable> otherAssertion = new CompletableFuture<>();

        queue.execute(() -> {
            seen.complete(List.of(queue.isExecuting(), other.isExecuting()));
            try {
                other.assertExecuting();
                otherAssertion.complete(null);
            }
            catch (IllegalStateException e) {
                otherAssertion.complete(e);
            }
        });

        assertThat(seen.get(5, TimeUnit.SECONDS)).containsExactly(true, false);
        assertThat(otherAssertion.get(5, TimeUnit.SECONDS))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("consumer 1");
        assertThat(fatal).isNotDone();
    }

    @Test
    void assertExecutingOffTheQueueThrows() {
        assertThatThrownBy(queue::assertExecuting)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("producer 0");
    }
}
