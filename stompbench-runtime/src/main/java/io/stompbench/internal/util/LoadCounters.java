/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.util;

import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Counters shared by every client of a scenario. They only ever grow and may be incremented and
 * read from any thread.
 */
public final class LoadCounters {

    public static final String PRODUCED_METER = "stompbench.produced";
    public static final String CONSUMED_METER = "stompbench.consumed";
    public static final String ERRORS_METER = "stompbench.errors";
    public static final String CONSUMER_SUSPENDED_METER = "stompbench.consumer.suspended";

    private final LongAdder produced = new LongAdder();
    private final LongAdder consumed = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final Timer consumerSuspendedTimer;

    public LoadCounters() {
        this(new SimpleMeterRegistry());
    }

    public LoadCounters(MeterRegistry registry) {
        Objects.requireNonNull(registry);
        FunctionCounter.builder(PRODUCED_METER, produced, LongAdder::sum)
                .description("Messages sent by producers")
                .register(registry);
        FunctionCounter.builder(CONSUMED_METER, consumed, LongAdder::sum)
                .description("Messages consumed by consumers")
                .register(registry);
        FunctionCounter.builder(ERRORS_METER, errors, LongAdder::sum)
                .description("Transport failures across all clients")
                .register(registry);
        this.consumerSuspendedTimer = Timer.builder(CONSUMER_SUSPENDED_METER)
                .description("Time consumers spent with inbound delivery suspended")
                .register(registry);
    }

    public void produced() {
        produced.increment();
    }

    public void consumed() {
        consumed.increment();
    }

    public void error() {
        errors.increment();
    }

    public long producedCount() {
        return produced.sum();
    }

    public long consumedCount() {
        return consumed.sum();
    }

    public long errorCount() {
        return errors.sum();
    }

    public Timer consumerSuspendedTimer() {
        return consumerSuspendedTimer;
    }

    public Snapshot snapshot() {
        return new Snapshot(producedCount(), consumedCount(), errorCount());
    }

    /**
     * Point in time copy of the counters.
     */
    public record Snapshot(long produced, long consumed, long errors) {

        public Snapshot minus(Snapshot earlier) {
            return new Snapshot(produced - earlier.produced, consumed - earlier.consumed, errors - earlier.errors);
        }
    }

    @Override
    public String toString() {
        return "LoadCounters{" +
                "produced=" + producedCount() +
                ", consumed=" + consumedCount() +
                ", errors=" + errorCount() +
                '}';
    }
}
