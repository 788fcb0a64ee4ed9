/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.codec;

import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.frame.StompHeader;

/**
 * Writes {@link StompFrame}s in STOMP wire format: command line, header lines, a blank line,
 * the body and a NUL terminator. A {@code content-length} header is added for non-empty bodies
 * that do not already declare one.
 */
public class StompFrameEncoder extends MessageToByteEncoder<StompFrame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StompFrameEncoder.class);

    private static final byte LF = '\n';
    private static final byte COLON = ':';
    private static final byte NUL = 0;

    public StompFrameEncoder() {
        super(StompFrame.class);
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, StompFrame frame, ByteBuf out) {
        boolean escape = StompHeaderEscaping.appliesTo(frame.command());
        out.writeCharSequence(frame.command(), StandardCharsets.UTF_8);
        out.writeByte(LF);
        boolean hasContentLength = false;
        for (StompHeader header : frame.headers()) {
            if (header.name().equals(StompCommand.HEADER_CONTENT_LENGTH)) {
                hasContentLength = true;
            }
            writeHeader(out, header.name(), header.value(), escape);
        }
        if (!hasContentLength && frame.contentLength() > 0) {
            writeHeader(out, StompCommand.HEADER_CONTENT_LENGTH, Integer.toString(frame.contentLength()), false);
        }
        out.writeByte(LF);
        frame.writeContentTo(out);
        out.writeByte(NUL);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}: Encoded {}", ctx.channel(), frame);
        }
    }

    private static void writeHeader(ByteBuf out, String name, String value, boolean escape) {
        out.writeCharSequence(escape ? StompHeaderEscaping.escape(name) : name, StandardCharsets.UTF_8);
        out.writeByte(COLON);
        out.writeCharSequence(escape ? StompHeaderEscaping.escape(value) : value, StandardCharsets.UTF_8);
        out.writeByte(LF);
    }
}
