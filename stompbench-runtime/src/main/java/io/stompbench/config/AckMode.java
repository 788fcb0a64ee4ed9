/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.util.Locale;

/**
 * Subscription acknowledgement mode.
 */
public enum AckMode {
    /** The broker considers a message consumed once delivered. */
    AUTO("auto"),
    /** The consumer must ACK every message explicitly. */
    CLIENT("client");

    private final String wireValue;

    AckMode(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * @return the value of the SUBSCRIBE frame's {@code ack} header
     */
    public String wireValue() {
        return wireValue;
    }

    public static AckMode parse(String value) {
        for (AckMode mode : values()) {
            if (mode.wireValue.equals(value.toLowerCase(Locale.ROOT))) {
                return mode;
            }
        }
        throw new IllegalArgumentException("unknown ack mode '" + value + "', expected auto or client");
    }
}
