/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.net;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.assertj.core.api.InstanceOfAssertFactories;

import io.netty.channel.embedded.EmbeddedChannel;

import io.stompbench.config.BrokerEndpoint;
import io.stompbench.dispatch.ManualDispatchQueue;
import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.transport.Callback;
import io.stompbench.transport.StompConnection;
import io.stompbench.transport.StompErrorException;
import io.stompbench.transport.StompTransportException;

import static org.assertj.core.api.Assertions.assertThat;

class NettyStompConnectionTest {

    private final ManualDispatchQueue queue = new ManualDispatchQueue("consumer 0");
    private final List<StompFrame> received = new ArrayList<>();
    private final List<Throwable> receiveFailures = new ArrayList<>();
    private EmbeddedChannel channel;
    private StompConnection connection;

    @BeforeEach
    void setUp() {
        List<StompConnection> connected = new ArrayList<>();
        channel = new EmbeddedChannel(new StompClientHandler(BrokerEndpoint.of("localhost", 61613), queue,
                Callback.of(connected::add, t -> {
                })));
        // CONNECT
        channel.readOutbound();
        channel.writeInbound(StompFrame.builder(StompCommand.CONNECTED).header("version", "1.2").build());
        queue.runPending();
        connection = connected.get(0);
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void registerHandler() {
        queue.runOnQueue(() -> connection.receive(Callback.of(received::add, receiveFailures::add)));
    }

    private static StompFrame message(String id) {
        return StompFrame.builder(StompCommand.MESSAGE).header(StompCommand.HEADER_MESSAGE_ID, id).build();
    }

    @Test
    void sendCompletesOnTheQueue() {
        AtomicBoolean sent = new AtomicBoolean();
        StompFrame frame = StompFrame.builder(StompCommand.SEND).header("destination", "/queue/a").build();

        queue.runOnQueue(() -> connection.send(frame, Callback.of(v -> sent.set(true), t -> {
        })));

        assertThat((StompFrame) channel.readOutbound()).isEqualTo(frame);
        assertThat(sent).isFalse();
        queue.runPending();
        assertThat(sent).isTrue();
    }

    @Test
    void requestIsCompletedByMatchingReceipt() {
        List<StompFrame> replies = new ArrayList<>();
        StompFrame frame = StompFrame.builder(StompCommand.SEND).header("receipt", "xxx").build();

        queue.runOnQueue(() -> connection.request(frame, Callback.of(replies::add, t -> {
        })));
        queue.runOnQueue(() -> connection.request(frame, Callback.of(replies::add, t -> {
        })));

        StompFrame first = channel.readOutbound();
        StompFrame second = channel.readOutbound();
        assertThat(first.header("receipt")).isEqualTo("receipt-1");
        assertThat(second.header("receipt")).isEqualTo("receipt-2");
        assertThat(first.headers()).hasSize(1);

        channel.writeInbound(StompFrame.builder(StompCommand.RECEIPT).header("receipt-id", "receipt-2").build());
        queue.runPending();

        assertThat(replies).singleElement().extracting(f -> f.header("receipt-id")).isEqualTo("receipt-2");
        assertThat(((NettyStompConnection) connection).pendingReceiptCount()).isEqualTo(1);
    }

    @Test
    void unknownReceiptIsIgnored() {
        registerHandler();
        channel.writeInbound(StompFrame.builder(StompCommand.RECEIPT).header("receipt-id", "receipt-99").build());
        queue.runPending();

        assertThat(received).isEmpty();
        assertThat(receiveFailures).isEmpty();
    }

    @Test
    void framesArrivingBeforeHandlerRegistrationAreDelivered() {
        channel.writeInbound(message("m-1"));
        queue.runPending();

        registerHandler();
        channel.writeInbound(message("m-2"));
        queue.runPending();

        assertThat(received).extracting(f -> f.header("message-id")).containsExactly("m-1", "m-2");
    }

    @Test
    void suspendAndResumeToggleAutoRead() {
        queue.runOnQueue(connection::resume);
        assertThat(channel.config().isAutoRead()).isTrue();

        queue.runOnQueue(connection::suspend);
        assertThat(channel.config().isAutoRead()).isFalse();
    }

    @Test
    void brokerErrorFailsReceiverAndOutstandingRequests() {
        registerHandler();
        List<Throwable> requestFailures = new ArrayList<>();
        queue.runOnQueue(() -> connection.request(StompFrame.builder(StompCommand.SEND).build(), Callback.of(r -> {
        }, requestFailures::add)));

        channel.writeInbound(StompFrame.builder(StompCommand.ERROR).content("queue full").build());
        queue.runPending();

        assertThat(requestFailures).singleElement(InstanceOfAssertFactories.THROWABLE).isInstanceOf(StompErrorException.class);
        assertThat(receiveFailures).singleElement(InstanceOfAssertFactories.THROWABLE).isInstanceOf(StompErrorException.class).hasMessage("Broker error: queue full");
        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    void brokerCloseFailsReceiver() {
        registerHandler();

        channel.close();
        queue.runPending();

        assertThat(receiveFailures).singleElement(InstanceOfAssertFactories.THROWABLE).isInstanceOf(StompTransportException.class)
                .hasMessageContaining("closed by broker");
    }

    @Test
    void failureBeforeRegistrationIsReportedOnRegistration() {
        channel.close();
        queue.runPending();

        registerHandler();

        assertThat(receiveFailures).hasSize(1);
    }

    @Test
    void requestedCloseIsNotAFailure() {
        registerHandler();
        AtomicBoolean closed = new AtomicBoolean();

        queue.runOnQueue(() -> connection.close(() -> closed.set(true)));
        queue.runPending();

        assertThat(closed).isTrue();
        assertThat(channel.isOpen()).isFalse();
        assertThat(receiveFailures).isEmpty();
    }
}
