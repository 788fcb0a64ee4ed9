/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.client;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.Timer;

import io.stompbench.config.ConsumerSettings;
import io.stompbench.config.DestinationSettings;
import io.stompbench.dispatch.DispatchQueue;
import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.tag.VisibleForTesting;

/**
 * Subscribes on every connection and consumes what the broker delivers, optionally acknowledging
 * each message and optionally taking a fixed time per message.
 *
 * <p>With a consumption delay in auto-ack mode, inbound delivery is suspended while a message is
 * being "processed" so that unprocessed messages pile up in the broker rather than in this client.
 * In client-ack mode the broker's unacknowledged window bounds delivery instead.</p>
 */
public class ConsumerClient extends ClientStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsumerClient.class);

    private final ConsumerSettings settings;
    private final String destination;

    public ConsumerClient(int id, DispatchQueue queue, ClientContext context, ConsumerSettings settings, DestinationSettings destinations) {
        super(id, "consumer " + id, queue, context);
        this.settings = settings;
        this.destination = destinations.destinationFor(id);
    }

    @Override
    protected void reconnectAction() {
        connect(() -> send(subscribeFrame(), () -> LOGGER.debug("{}: Subscribed to {}", name, destination)));
    }

    @VisibleForTesting
    StompFrame subscribeFrame() {
        StompFrame.Builder builder = StompFrame.builder(StompCommand.SUBSCRIBE)
                .header(StompCommand.HEADER_ID, settings.prefix() + id)
                .header(StompCommand.HEADER_ACK, settings.ackMode().wireValue())
                .header(StompCommand.HEADER_DESTINATION, destination);
        if (settings.durable()) {
            builder.header(StompCommand.HEADER_PERSISTENT, "true");
        }
        if (settings.selector() != null) {
            builder.header(StompCommand.HEADER_SELECTOR, settings.selector());
        }
        return builder.build();
    }

    @Override
    protected void onReceive(StompFrame message) {
        if (settings.sleepMs() == 0) {
            processMessage(message);
            return;
        }
        boolean clientAck = settings.clientAck();
        Timer.Sample suspended = null;
        if (!clientAck) {
            suspendInbound();
            suspended = Timer.start();
        }
        ClientState receivedUnder = state();
        Timer.Sample suspendedSample = suspended;
        queue.executeAfter(Math.abs(settings.sleepMs()), TimeUnit.MILLISECONDS, () -> {
            if (suspendedSample != null) {
                suspendedSample.stop(context.counters().consumerSuspendedTimer());
            }
            if (state() != receivedUnder) {
                LOGGER.trace("{}: Dropping delayed message, state changed to {}", name, state());
                return;
            }
            if (!clientAck) {
                resumeInbound();
            }
            processMessage(message);
        });
    }

    private void processMessage(StompFrame message) {
        if (settings.clientAck()) {
            send(ackFrame(message), () -> {
                messageCounter++;
                context.counters().consumed();
            });
        }
        else {
            messageCounter++;
            context.counters().consumed();
        }
    }

    @VisibleForTesting
    static StompFrame ackFrame(StompFrame message) {
        String messageId = message.header(StompCommand.HEADER_MESSAGE_ID);
        StompFrame.Builder builder = StompFrame.builder(StompCommand.ACK)
                .header(StompCommand.HEADER_MESSAGE_ID, messageId == null ? "" : messageId);
        String subscription = message.header(StompCommand.HEADER_SUBSCRIPTION);
        if (subscription != null) {
            builder.header(StompCommand.HEADER_SUBSCRIPTION, subscription);
        }
        String ackId = message.header(StompCommand.HEADER_ACK);
        if (ackId != null) {
            builder.header(StompCommand.HEADER_ID, ackId);
        }
        return builder.build();
    }
}
