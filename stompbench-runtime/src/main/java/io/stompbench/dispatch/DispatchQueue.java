/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.dispatch;

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * A serialized execution context. Tasks submitted to one queue never run concurrently with each
 * other and run in submission order; timers fire on the same queue. A client owns its state
 * exclusively and only touches it from tasks running on its queue.
 */
public interface DispatchQueue extends Executor {

    /**
     * @return human readable name of the owner, used in log and error messages
     */
    String label();

    /**
     * Runs the task on this queue. Never runs it inline, even when called from the queue itself.
     */
    @Override
    void execute(Runnable task);

    /**
     * Runs the task on this queue once the delay has elapsed. Never blocks the caller.
     */
    void executeAfter(long delay, TimeUnit unit, Runnable task);

    /**
     * @return true if the calling thread is currently running a task of this queue
     */
    boolean isExecuting();

    /**
     * @throws IllegalStateException if the caller is not running on this queue
     */
    default void assertExecuting() {
        if (!isExecuting()) {
            throw new IllegalStateException("Not executing on dispatch queue of " + label() + " (thread " + Thread.currentThread().getName() + ")");
        }
    }
}
