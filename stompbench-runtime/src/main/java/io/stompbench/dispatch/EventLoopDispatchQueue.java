/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.dispatch;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.EventLoop;

/**
 * A {@link DispatchQueue} backed by a Netty {@link EventLoop}.
 *
 * <p>Several clients may share one event loop; each still sees its own tasks serialized.
 * A task that throws signals a bug in the client, so the failure is logged and handed to
 * the fatal error handler instead of being swallowed by the event loop.</p>
 */
public final class EventLoopDispatchQueue implements DispatchQueue {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventLoopDispatchQueue.class);

    private final EventLoop eventLoop;
    private final String label;
    private final Consumer<Throwable> fatalErrorHandler;
    // only touched on the event loop thread
    private boolean executing;

    public EventLoopDispatchQueue(EventLoop eventLoop, String label, Consumer<Throwable> fatalErrorHandler) {
        this.eventLoop = Objects.requireNonNull(eventLoop);
        this.label = Objects.requireNonNull(label);
        this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler);
    }

    /**
     * @return the event loop that channels owned by this queue's client should be registered on
     */
    public EventLoop eventLoop() {
        return eventLoop;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public void execute(Runnable task) {
        eventLoop.execute(guard(task));
    }

    @Override
    public void executeAfter(long delay, TimeUnit unit, Runnable task) {
        eventLoop.schedule(guard(task), delay, unit);
    }

    @Override
    public boolean isExecuting() {
        // other queues may share the event loop
        return eventLoop.inEventLoop() && executing;
    }

    private Runnable guard(Runnable task) {
        return () -> {
            boolean wasExecuting = executing;
            executing = true;
            try {
                task.run();
            }
            catch (RuntimeException | Error e) {
                LOGGER.error("{}: Fatal error in dispatch queue task", label, e);
                fatalErrorHandler.accept(e);
            }
            finally {
                executing = wasExecuting;
            }
        };
    }

    @Override
    public String toString() {
        return "EventLoopDispatchQueue{" +
                "label='" + label + '\'' +
                ", eventLoop=" + eventLoop +
                '}';
    }
}
