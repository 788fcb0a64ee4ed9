/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.util;

import java.nio.charset.StandardCharsets;

/**
 * Message bodies for producers.
 */
public final class MessageBodies {

    private MessageBodies() {
    }

    /**
     * Builds a body of exactly {@code size} bytes: {@code "Message from <name>\n"} followed by a
     * repeating {@code a..z} pattern, where the byte at body index {@code i} is {@code 'a' + i % 26}.
     * The prefix is truncated when it alone exceeds {@code size}.
     */
    public static byte[] create(String name, int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        StringBuilder sb = new StringBuilder(Math.max(size, 16));
        sb.append("Message from ").append(name).append('\n');
        for (int i = sb.length(); i < size; i++) {
            sb.append((char) ('a' + (i % 26)));
        }
        String body = sb.length() > size ? sb.substring(0, size) : sb.toString();
        return body.getBytes(StandardCharsets.US_ASCII);
    }
}
