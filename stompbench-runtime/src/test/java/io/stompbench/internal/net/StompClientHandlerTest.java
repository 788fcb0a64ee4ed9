/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.net;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.assertj.core.api.InstanceOfAssertFactories;

import io.netty.channel.embedded.EmbeddedChannel;

import io.stompbench.config.BrokerEndpoint;
import io.stompbench.dispatch.ManualDispatchQueue;
import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.frame.StompHeader;
import io.stompbench.transport.Callback;
import io.stompbench.transport.StompConnection;
import io.stompbench.transport.StompErrorException;
import io.stompbench.transport.StompTransportException;

import static org.assertj.core.api.Assertions.assertThat;

class StompClientHandlerTest {

    private final ManualDispatchQueue queue = new ManualDispatchQueue("producer 0");
    private final List<StompConnection> connected = new ArrayList<>();
    private final List<Throwable> failures = new ArrayList<>();
    private EmbeddedChannel channel;
    private StompClientHandler handler;

    @BeforeEach
    void setUp() {
        BrokerEndpoint endpoint = new BrokerEndpoint("broker.example", 61613, "guest", "secret", false);
        handler = new StompClientHandler(endpoint, queue, Callback.of(connected::add, failures::add));
        channel = new EmbeddedChannel(handler);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static StompFrame frame(String command, String... headers) {
        StompFrame.Builder builder = StompFrame.builder(command);
        for (int i = 0; i < headers.length; i += 2) {
            builder.header(headers[i], headers[i + 1]);
        }
        return builder.build();
    }

    @Test
    void sendsConnectWhenActive() {
        StompFrame connect = channel.readOutbound();

        assertThat(connect.command()).isEqualTo(StompCommand.CONNECT);
        assertThat(connect.headers()).containsExactly(
                new StompHeader("accept-version", "1.0,1.1,1.2"),
                new StompHeader("host", "broker.example"),
                new StompHeader("heart-beat", "0,0"),
                new StompHeader("login", "guest"),
                new StompHeader("passcode", "secret"));
    }

    @Test
    void connectWithoutCredentialsOmitsThem() {
        StompClientHandler anonymous = new StompClientHandler(BrokerEndpoint.of("localhost", 61613), queue, Callback.of(c -> {
        }, t -> {
        }));

        assertThat(anonymous.connectFrame().header("login")).isNull();
        assertThat(anonymous.connectFrame().header("passcode")).isNull();
    }

    @Test
    void connectedCompletesHandshakeWithReadingSuspended() {
        channel.writeInbound(frame(StompCommand.CONNECTED, "version", "1.2"));
        assertThat(connected).isEmpty();

        queue.runPending();

        assertThat(connected).hasSize(1);
        assertThat(failures).isEmpty();
        assertThat(channel.config().isAutoRead()).isFalse();
        assertThat(handler.connection).isNotNull();
        assertThat(handler.connection.version()).isEqualTo("1.2");
    }

    @Test
    void versionDefaultsTo10() {
        channel.writeInbound(frame(StompCommand.CONNECTED));
        queue.runPending();

        assertThat(handler.connection.version()).isEqualTo("1.0");
    }

    @Test
    void errorDuringHandshakeFailsOnce() {
        channel.writeInbound(frame(StompCommand.ERROR, "message", "bad credentials"));
        queue.runPending();

        assertThat(connected).isEmpty();
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).isInstanceOf(StompErrorException.class).hasMessage("Broker error: bad credentials");
        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    void unexpectedFrameDuringHandshakeFails() {
        channel.writeInbound(frame(StompCommand.MESSAGE));
        queue.runPending();

        assertThat(failures).singleElement(InstanceOfAssertFactories.THROWABLE).isInstanceOf(StompTransportException.class);
        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    void closeBeforeConnectedFails() {
        channel.close();
        queue.runPending();

        assertThat(failures).singleElement(InstanceOfAssertFactories.THROWABLE)
                .isInstanceOf(StompTransportException.class)
                .hasMessageContaining("before CONNECTED");
    }

    @Test
    void exceptionDuringHandshakeFailsAndCloses() {
        channel.pipeline().fireExceptionCaught(new IOException("reset"));
        queue.runPending();

        assertThat(failures).singleElement(InstanceOfAssertFactories.THROWABLE).isInstanceOf(StompTransportException.class);
        assertThat(failures.get(0)).hasCauseInstanceOf(IOException.class);
        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    void handshakeFailureReportedAtMostOnce() {
        handler.handshakeFailed(new StompTransportException("connect timed out"));
        handler.handshakeFailed(new StompTransportException("again"));
        queue.runPending();

        assertThat(failures).singleElement(InstanceOfAssertFactories.THROWABLE).hasMessage("connect timed out");
    }
}
