/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.util.List;
import java.util.Objects;

/**
 * What each producer sends.
 *
 * @param messageSize body size in bytes
 * @param persistent whether to add {@code persistentHeader} to every message
 * @param persistentHeader header that requests persistent delivery from the broker
 * @param syncSend whether each send waits for a broker receipt before the next one
 * @param headers extra header sets; producer {@code i} uses set {@code i % headers.size()}
 * @param messagesPerConnection messages sent before the producer reconnects, 0 for unlimited
 * @param sleepMs delay between sends in milliseconds, 0 for none
 */
public record ProducerSettings(int messageSize,
                               boolean persistent,
                               HeaderSpec persistentHeader,
                               boolean syncSend,
                               List<List<HeaderSpec>> headers,
                               long messagesPerConnection,
                               long sleepMs) {

    public static final HeaderSpec DEFAULT_PERSISTENT_HEADER = new HeaderSpec("persistent", "true");

    public ProducerSettings {
        Objects.requireNonNull(persistentHeader, "persistentHeader");
        headers = headers.stream().map(List::copyOf).toList();
        if (messageSize < 0) {
            throw new IllegalArgumentException("messageSize must not be negative: " + messageSize);
        }
        if (messagesPerConnection < 0) {
            throw new IllegalArgumentException("messagesPerConnection must not be negative: " + messagesPerConnection);
        }
    }

    public static ProducerSettings defaults() {
        return new ProducerSettings(1024, false, DEFAULT_PERSISTENT_HEADER, false, List.of(), 0, 0);
    }

    public List<HeaderSpec> headersFor(int producerId) {
        if (headers.isEmpty()) {
            return List.of();
        }
        return headers.get(Math.floorMod(producerId, headers.size()));
    }

    public ProducerSettings withMessagesPerConnection(long messagesPerConnection) {
        return new ProducerSettings(messageSize, persistent, persistentHeader, syncSend, headers, messagesPerConnection, sleepMs);
    }

    public ProducerSettings withSyncSend(boolean syncSend) {
        return new ProducerSettings(messageSize, persistent, persistentHeader, syncSend, headers, messagesPerConnection, sleepMs);
    }

    public ProducerSettings withSleepMs(long sleepMs) {
        return new ProducerSettings(messageSize, persistent, persistentHeader, syncSend, headers, messagesPerConnection, sleepMs);
    }
}
