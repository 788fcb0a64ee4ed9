/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

import io.stompbench.internal.util.LoadCounters;

/**
 * Counter deltas observed over one sample window.
 *
 * @param index 1-based sample number
 * @param produced messages produced in the window
 * @param consumed messages consumed in the window
 * @param errors transport failures in the window
 * @param elapsed measured window length
 */
public record ScenarioSample(int index, long produced, long consumed, long errors, Duration elapsed) {

    public ScenarioSample {
        Objects.requireNonNull(elapsed, "elapsed");
    }

    static ScenarioSample of(int index, LoadCounters.Snapshot delta, Duration elapsed) {
        return new ScenarioSample(index, delta.produced(), delta.consumed(), delta.errors(), elapsed);
    }

    public double producedPerSecond() {
        return perSecond(produced);
    }

    public double consumedPerSecond() {
        return perSecond(consumed);
    }

    private double perSecond(long count) {
        long nanos = elapsed.toNanos();
        return nanos <= 0 ? 0.0 : count * 1_000_000_000.0 / nanos;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "sample %d: produced %.1f msg/s, consumed %.1f msg/s, errors %d",
                index, producedPerSecond(), consumedPerSecond(), errors);
    }
}
