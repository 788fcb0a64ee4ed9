/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.client;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stompbench.config.DestinationSettings;
import io.stompbench.config.HeaderSpec;
import io.stompbench.config.ProducerSettings;
import io.stompbench.dispatch.DispatchQueue;
import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.internal.util.MessageBodies;
import io.stompbench.tag.VisibleForTesting;

/**
 * Sends the same message over and over, reconnecting whenever the connection drops or the
 * per-connection message limit is reached.
 */
public class ProducerClient extends ClientStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProducerClient.class);

    private final ProducerSettings settings;
    private final StompFrame messageFrame;

    public ProducerClient(int id, DispatchQueue queue, ClientContext context, ProducerSettings settings, DestinationSettings destinations) {
        super(id, "producer " + id, queue, context);
        this.settings = settings;
        this.messageFrame = buildMessageFrame(name, destinations.destinationFor(id), settings.headersFor(id), settings);
    }

    @VisibleForTesting
    static StompFrame buildMessageFrame(String name, String destination, Iterable<HeaderSpec> extraHeaders, ProducerSettings settings) {
        StompFrame.Builder builder = StompFrame.builder(StompCommand.SEND)
                .header(StompCommand.HEADER_DESTINATION, destination);
        if (settings.persistent()) {
            builder.header(settings.persistentHeader().name(), settings.persistentHeader().value());
        }
        if (settings.syncSend()) {
            // the transport stamps a unique value on every request
            builder.header(StompCommand.HEADER_RECEIPT, "xxx");
        }
        for (HeaderSpec header : extraHeaders) {
            builder.header(header.name(), header.value());
        }
        return builder.content(MessageBodies.create(name, settings.messageSize())).build();
    }

    public StompFrame messageFrame() {
        return messageFrame;
    }

    @Override
    protected void reconnectAction() {
        connect(this::writeAction);
    }

    private void writeAction() {
        if (context.done().get()) {
            close();
            return;
        }
        if (settings.syncSend()) {
            request(messageFrame, receipt -> onWriteCompleted());
        }
        else {
            send(messageFrame, this::onWriteCompleted);
        }
    }

    private void onWriteCompleted() {
        context.counters().produced();
        messageCounter++;
        if (context.done().get()) {
            close();
            return;
        }
        ClientState scheduledUnder = state();
        Runnable next = () -> {
            if (state() != scheduledUnder) {
                LOGGER.trace("{}: Dropping write continuation, state changed to {}", name, state());
                return;
            }
            continueWriting();
        };
        if (settings.sleepMs() != 0) {
            queue.executeAfter(Math.abs(settings.sleepMs()), TimeUnit.MILLISECONDS, next);
        }
        else {
            queue.execute(next);
        }
    }

    private void continueWriting() {
        long limit = settings.messagesPerConnection();
        if (limit > 0 && messageCounter >= limit) {
            LOGGER.trace("{}: Sent {} messages on this connection, reconnecting", name, messageCounter);
            messageCounter = 0;
            close();
        }
        else {
            writeAction();
        }
    }
}
