/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.util.Objects;

/**
 * Destination naming policy: client {@code i} uses {@code /<type>/<name>-<i % count>}, so producer
 * {@code i} and consumer {@code i} meet on the same destination.
 *
 * @param type destination type, e.g. {@code queue} or {@code topic}
 * @param name destination base name
 * @param count number of distinct destinations the clients are spread over
 */
public record DestinationSettings(String type, String name, int count) {

    public DestinationSettings {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        if (type.isBlank() || name.isBlank()) {
            throw new IllegalArgumentException("destination type and name must not be blank");
        }
        if (count < 1) {
            throw new IllegalArgumentException("destination count must be at least 1: " + count);
        }
    }

    public static DestinationSettings defaults() {
        return new DestinationSettings("queue", "load", 1);
    }

    public String destinationFor(int clientId) {
        return "/" + type + "/" + name + "-" + Math.floorMod(clientId, count);
    }
}
