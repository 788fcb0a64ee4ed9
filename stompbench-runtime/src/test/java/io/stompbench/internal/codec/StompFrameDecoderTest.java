/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.codec;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;

import io.stompbench.frame.StompFrame;
import io.stompbench.frame.StompHeader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StompFrameDecoderTest {

    private EmbeddedChannel channel = new EmbeddedChannel(new StompFrameDecoder());

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static ByteBuf bytes(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void decodesFrameDelimitedByNul() {
        channel.writeInbound(bytes("MESSAGE\ndestination:/queue/a\nmessage-id:1\n\nhello\0"));

        StompFrame frame = channel.readInbound();
        assertThat(frame.command()).isEqualTo("MESSAGE");
        assertThat(frame.headers()).containsExactly(new StompHeader("destination", "/queue/a"), new StompHeader("message-id", "1"));
        assertThat(frame.contentAsString()).isEqualTo("hello");
        assertThat((Object) channel.readInbound()).isNull();
    }

    @Test
    void waitsForTheRestOfAPartialFrame() {
        channel.writeInbound(bytes("MESSAGE\ndestination:/queue/a\n"));
        assertThat((Object) channel.readInbound()).isNull();

        channel.writeInbound(bytes("\nhel"));
        assertThat((Object) channel.readInbound()).isNull();

        channel.writeInbound(bytes("lo\0"));
        StompFrame frame = channel.readInbound();
        assertThat(frame.contentAsString()).isEqualTo("hello");
    }

    @Test
    void contentLengthBodyMayContainNul() {
        ByteBuf in = bytes("MESSAGE\ncontent-length:3\n\n");
        in.writeBytes(new byte[]{ 'a', 0, 'b', 0 });
        channel.writeInbound(in);

        StompFrame frame = channel.readInbound();
        assertThat(frame.content()).containsExactly('a', 0, 'b');
    }

    @Test
    void contentLengthBodyArrivingInPieces() {
        channel.writeInbound(bytes("MESSAGE\ncontent-length:5\n\nab"));
        assertThat((Object) channel.readInbound()).isNull();
        channel.writeInbound(bytes("cde"));
        assertThat((Object) channel.readInbound()).isNull();
        channel.writeInbound(bytes("\0"));

        StompFrame frame = channel.readInbound();
        assertThat(frame.contentAsString()).isEqualTo("abcde");
    }

    @Test
    void firstContentLengthWins() {
        channel.writeInbound(bytes("MESSAGE\ncontent-length:2\ncontent-length:10\n\nab\0"));

        StompFrame frame = channel.readInbound();
        assertThat(frame.contentAsString()).isEqualTo("ab");
        assertThat(frame.header("content-length")).isEqualTo("2");
    }

    @Test
    void skipsHeartbeatsAndAcceptsCrLf() {
        channel.writeInbound(bytes("\n\r\n\nRECEIPT\r\nreceipt-id:r-1\r\n\r\n\0\n\nRECEIPT\nreceipt-id:r-2\n\n\0"));

        StompFrame first = channel.readInbound();
        StompFrame second = channel.readInbound();
        assertThat(first.command()).isEqualTo("RECEIPT");
        assertThat(first.header("receipt-id")).isEqualTo("r-1");
        assertThat(second.header("receipt-id")).isEqualTo("r-2");
    }

    @Test
    void headerValuesMayContainColons() {
        channel.writeInbound(bytes("CONNECTED\nserver:broker:1.0\n\n\0"));

        StompFrame frame = channel.readInbound();
        assertThat(frame.header("server")).isEqualTo("broker:1.0");
    }

    @Test
    void unescapesHeadersExceptInConnected() {
        channel.writeInbound(bytes("MESSAGE\nkey:a\\cb\\nc\\\\d\n\n\0CONNECTED\nkey:a\\cb\n\n\0"));

        StompFrame message = channel.readInbound();
        StompFrame connected = channel.readInbound();
        assertThat(message.header("key")).isEqualTo("a:b\nc\\d");
        assertThat(connected.header("key")).isEqualTo("a\\cb");
    }

    @Test
    void undefinedEscapeIsRejected() {
        assertThatThrownBy(() -> channel.writeInbound(bytes("MESSAGE\nkey:a\\tb\n\n\0")))
                .isInstanceOf(DecoderException.class);
    }

    @Test
    void malformedHeaderIsRejected() {
        assertThatThrownBy(() -> channel.writeInbound(bytes("MESSAGE\nno-colon\n\n\0")))
                .isInstanceOf(DecoderException.class)
                .hasMessageContaining("Malformed header");
    }

    @Test
    void invalidContentLengthIsRejected() {
        assertThatThrownBy(() -> channel.writeInbound(bytes("MESSAGE\ncontent-length:abc\n\n\0")))
                .isInstanceOf(DecoderException.class);
    }

    @Test
    void missingNulAfterContentLengthBodyIsRejected() {
        assertThatThrownBy(() -> channel.writeInbound(bytes("MESSAGE\ncontent-length:2\n\nabc\0")))
                .isInstanceOf(DecoderException.class)
                .hasMessageContaining("not terminated by NUL");
    }

    @Test
    void oversizedFrameIsRejected() {
        channel.finishAndReleaseAll();
        channel = new EmbeddedChannel(new StompFrameDecoder(16));

        assertThatThrownBy(() -> channel.writeInbound(bytes("MESSAGE\ndestination:/queue/a-long-name\n")))
                .isInstanceOf(TooLongFrameException.class);
    }

    @Test
    void oversizedContentLengthIsRejected() {
        channel.finishAndReleaseAll();
        channel = new EmbeddedChannel(new StompFrameDecoder(16));

        assertThatThrownBy(() -> channel.writeInbound(bytes("MESSAGE\ncontent-length:100\n\n")))
                .isInstanceOf(TooLongFrameException.class);
    }

    @Test
    void rejectsNonPositiveMaxFrameSize() {
        assertThatThrownBy(() -> new StompFrameDecoder(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
