/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.codec;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;

import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.frame.StompHeader;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Decodes STOMP frames from a byte stream.
 *
 * <p>Blank lines between frames are heart-beats and are skipped. Lines may end in LF or CRLF.
 * A body is delimited by its {@code content-length} header when present, otherwise by the
 * first NUL byte. Incomplete input is left in the cumulation buffer until more bytes arrive.</p>
 */
public class StompFrameDecoder extends ByteToMessageDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(StompFrameDecoder.class);

    public static final int DEFAULT_MAX_FRAME_SIZE_BYTES = 10 * 1024 * 1024;

    private static final byte LF = '\n';
    private static final byte CR = '\r';
    private static final byte NUL = 0;

    private final int maxFrameSizeBytes;

    public StompFrameDecoder() {
        this(DEFAULT_MAX_FRAME_SIZE_BYTES);
    }

    public StompFrameDecoder(int maxFrameSizeBytes) {
        if (maxFrameSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFrameSizeBytes must be positive: " + maxFrameSizeBytes);
        }
        this.maxFrameSizeBytes = maxFrameSizeBytes;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        skipHeartbeats(in);
        if (!in.isReadable()) {
            return;
        }
        int frameStart = in.readerIndex();
        StompFrame frame = decodeFrame(in);
        if (frame == null) {
            in.readerIndex(frameStart);
            if (in.readableBytes() > maxFrameSizeBytes) {
                throw new TooLongFrameException("Frame exceeds " + maxFrameSizeBytes + " bytes");
            }
            return;
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("{}: Decoded {}", ctx.channel(), frame);
        }
        out.add(frame);
    }

    @Nullable
    private StompFrame decodeFrame(ByteBuf in) {
        String command = readLine(in);
        if (command == null) {
            return null;
        }
        boolean unescape = StompHeaderEscaping.appliesTo(command);
        List<StompHeader> headers = new ArrayList<>();
        Integer contentLength = null;
        while (true) {
            String line = readLine(in);
            if (line == null) {
                return null;
            }
            if (line.isEmpty()) {
                break;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new DecoderException("Malformed header line in " + command + " frame: " + line);
            }
            String name = line.substring(0, colon);
            String value = line.substring(colon + 1);
            if (unescape) {
                name = StompHeaderEscaping.unescape(name);
                value = StompHeaderEscaping.unescape(value);
            }
            // repeated headers: the first occurrence wins
            if (contentLength == null && name.equals(StompCommand.HEADER_CONTENT_LENGTH)) {
                contentLength = parseContentLength(value);
            }
            headers.add(new StompHeader(name, value));
        }

        byte[] body;
        if (contentLength != null) {
            if (contentLength > maxFrameSizeBytes) {
                throw new TooLongFrameException("Frame content-length " + contentLength + " exceeds " + maxFrameSizeBytes + " bytes");
            }
            if (in.readableBytes() < contentLength + 1) {
                return null;
            }
            body = new byte[contentLength];
            in.readBytes(body);
            if (in.readByte() != NUL) {
                throw new DecoderException("Frame body not terminated by NUL after " + contentLength + " bytes");
            }
        }
        else {
            int nul = in.indexOf(in.readerIndex(), in.writerIndex(), NUL);
            if (nul < 0) {
                return null;
            }
            body = new byte[nul - in.readerIndex()];
            in.readBytes(body);
            in.skipBytes(1);
        }
        return new StompFrame(command, headers, body);
    }

    private static int parseContentLength(String value) {
        try {
            int length = Integer.parseInt(value.trim());
            if (length < 0) {
                throw new DecoderException("Negative content-length: " + value);
            }
            return length;
        }
        catch (NumberFormatException e) {
            throw new DecoderException("Invalid content-length: " + value, e);
        }
    }

    @Nullable
    private static String readLine(ByteBuf in) {
        int lf = in.indexOf(in.readerIndex(), in.writerIndex(), LF);
        if (lf < 0) {
            return null;
        }
        int end = lf;
        if (end > in.readerIndex() && in.getByte(end - 1) == CR) {
            end--;
        }
        String line = in.toString(in.readerIndex(), end - in.readerIndex(), StandardCharsets.UTF_8);
        in.readerIndex(lf + 1);
        return line;
    }

    private static void skipHeartbeats(ByteBuf in) {
        while (in.isReadable()) {
            byte b = in.getByte(in.readerIndex());
            if (b != LF && b != CR) {
                return;
            }
            in.skipBytes(1);
        }
    }
}
