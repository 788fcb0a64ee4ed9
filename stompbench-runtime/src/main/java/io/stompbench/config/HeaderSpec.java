/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.util.Objects;

/**
 * A {@code name:value} header supplied on the command line.
 *
 * @param name header name
 * @param value header value
 */
public record HeaderSpec(String name, String value) {

    public HeaderSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("header name must not be empty");
        }
    }

    /**
     * Parses {@code name:value}. The split happens at the first colon, so values may contain colons.
     */
    public static HeaderSpec parse(String spec) {
        int colon = spec.indexOf(':');
        if (colon <= 0) {
            throw new IllegalArgumentException("expected name:value but was '" + spec + "'");
        }
        return new HeaderSpec(spec.substring(0, colon), spec.substring(colon + 1));
    }

    @Override
    public String toString() {
        return name + ":" + value;
    }
}
