/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * How each consumer subscribes and consumes.
 *
 * @param ackMode acknowledgement mode
 * @param durable whether to request a durable subscription
 * @param selector optional message selector
 * @param prefix subscription id prefix; consumer {@code i} subscribes with id {@code prefix + i}
 * @param sleepMs per-message processing delay in milliseconds, 0 for none
 */
public record ConsumerSettings(AckMode ackMode, boolean durable, @Nullable String selector, String prefix, long sleepMs) {

    public ConsumerSettings {
        Objects.requireNonNull(ackMode, "ackMode");
        Objects.requireNonNull(prefix, "prefix");
    }

    public static ConsumerSettings defaults() {
        return new ConsumerSettings(AckMode.AUTO, false, null, "consumer-", 0);
    }

    public boolean clientAck() {
        return ackMode == AckMode.CLIENT;
    }

    public ConsumerSettings withAckMode(AckMode ackMode) {
        return new ConsumerSettings(ackMode, durable, selector, prefix, sleepMs);
    }

    public ConsumerSettings withSleepMs(long sleepMs) {
        return new ConsumerSettings(ackMode, durable, selector, prefix, sleepMs);
    }
}
