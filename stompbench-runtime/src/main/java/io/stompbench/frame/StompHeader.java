/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.frame;

import java.util.Objects;

/**
 * A single {@code name:value} header line of a {@link StompFrame}.
 *
 * @param name header name
 * @param value header value, treated as an opaque string
 */
public record StompHeader(String name, String value) {

    public StompHeader {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return name + ":" + value;
    }
}
