/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.frame;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import io.netty.buffer.ByteBuf;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One STOMP protocol message unit: a command token, an ordered list of headers and a body.
 *
 * <p>Frames are immutable. Producers build a frame once and send the same instance for
 * every message; {@link #withHeader(String, String)} derives a modified copy when a
 * transport needs to stamp a per-send header such as {@code receipt}.</p>
 */
public final class StompFrame {

    private static final byte[] EMPTY = new byte[0];

    private final String command;
    private final List<StompHeader> headers;
    private final byte[] content;

    public StompFrame(String command, List<StompHeader> headers, byte[] content) {
        this.command = Objects.requireNonNull(command, "command");
        this.headers = List.copyOf(headers);
        this.content = Objects.requireNonNull(content, "content").clone();
    }

    public static Builder builder(String command) {
        return new Builder(command);
    }

    public String command() {
        return command;
    }

    public List<StompHeader> headers() {
        return headers;
    }

    /**
     * Returns the value of the first header with the given name.
     *
     * @param name header name
     * @return the value, or null if the frame has no such header
     */
    @Nullable
    public String header(String name) {
        for (StompHeader header : headers) {
            if (header.name().equals(name)) {
                return header.value();
            }
        }
        return null;
    }

    public byte[] content() {
        return content.clone();
    }

    public void writeContentTo(ByteBuf out) {
        out.writeBytes(content);
    }

    public int contentLength() {
        return content.length;
    }

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    /**
     * Returns a copy of this frame in which the first header called {@code name} has the given value.
     * The header is appended if this frame does not have it.
     */
    public StompFrame withHeader(String name, String value) {
        List<StompHeader> copy = new ArrayList<>(headers.size() + 1);
        boolean replaced = false;
        for (StompHeader header : headers) {
            if (!replaced && header.name().equals(name)) {
                copy.add(new StompHeader(name, value));
                replaced = true;
            }
            else {
                copy.add(header);
            }
        }
        if (!replaced) {
            copy.add(new StompHeader(name, value));
        }
        return new StompFrame(command, copy, content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StompFrame that)) {
            return false;
        }
        return command.equals(that.command) && headers.equals(that.headers) && Arrays.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(command, headers);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "StompFrame{" +
                "command=" + command +
                ", headers=" + headers +
                ", contentLength=" + content.length +
                '}';
    }

    /**
     * Accumulates headers in insertion order.
     */
    public static final class Builder {
        private final String command;
        private final List<StompHeader> headers = new ArrayList<>();
        private byte[] content = EMPTY;

        private Builder(String command) {
            this.command = Objects.requireNonNull(command, "command");
        }

        public Builder header(String name, String value) {
            headers.add(new StompHeader(name, value));
            return this;
        }

        public Builder header(StompHeader header) {
            headers.add(header);
            return this;
        }

        public Builder content(byte[] content) {
            this.content = content;
            return this;
        }

        public Builder content(String content) {
            this.content = content.getBytes(StandardCharsets.UTF_8);
            return this;
        }

        public StompFrame build() {
            return new StompFrame(command, headers, content);
        }
    }
}
