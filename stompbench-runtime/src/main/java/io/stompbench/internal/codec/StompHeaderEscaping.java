/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.codec;

import io.netty.handler.codec.DecoderException;

import io.stompbench.frame.StompCommand;

/**
 * STOMP 1.1+ header value escaping. CONNECT and CONNECTED frames are exempt.
 */
final class StompHeaderEscaping {

    private StompHeaderEscaping() {
    }

    static boolean appliesTo(String command) {
        return !StompCommand.CONNECT.equals(command) && !StompCommand.CONNECTED.equals(command);
    }

    static String escape(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            String replacement = switch (c) {
                case '\\' -> "\\\\";
                case '\n' -> "\\n";
                case '\r' -> "\\r";
                case ':' -> "\\c";
                default -> null;
            };
            if (replacement != null && sb == null) {
                sb = new StringBuilder(value.length() + 8);
                sb.append(value, 0, i);
            }
            if (sb != null) {
                if (replacement != null) {
                    sb.append(replacement);
                }
                else {
                    sb.append(c);
                }
            }
        }
        return sb == null ? value : sb.toString();
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i + 1 >= value.length()) {
                throw new DecoderException("Dangling escape in header value: " + value);
            }
            char next = value.charAt(++i);
            switch (next) {
                case '\\' -> sb.append('\\');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 'c' -> sb.append(':');
                default -> throw new DecoderException("Undefined escape sequence \\" + next + " in header value");
            }
        }
        return sb.toString();
    }
}
