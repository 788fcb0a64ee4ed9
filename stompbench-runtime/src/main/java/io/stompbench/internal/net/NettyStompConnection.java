/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.net;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;

import io.stompbench.dispatch.DispatchQueue;
import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.tag.VisibleForTesting;
import io.stompbench.transport.Callback;
import io.stompbench.transport.StompConnection;
import io.stompbench.transport.StompErrorException;
import io.stompbench.transport.StompTransportException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A handshaken STOMP session over a Netty channel.
 *
 * <p>Channel events arrive on the channel's event loop and are re-posted onto the owner's
 * {@link DispatchQueue}; every field below is only touched from that queue.</p>
 */
final class NettyStompConnection implements StompConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyStompConnection.class);

    private final Channel channel;
    private final DispatchQueue queue;
    private final @Nullable String version;

    private @Nullable Callback<StompFrame> receiveHandler;
    // frames that arrived before a receive handler was registered
    private final Deque<StompFrame> undelivered = new ArrayDeque<>();
    private @Nullable Throwable undeliveredFailure;

    private final Map<String, Callback<StompFrame>> pendingReceipts = new HashMap<>();
    private long receiptSequence;

    private boolean closeRequested;
    private boolean failed;

    NettyStompConnection(Channel channel, DispatchQueue queue, @Nullable String version) {
        this.channel = Objects.requireNonNull(channel);
        this.queue = Objects.requireNonNull(queue);
        this.version = version;
    }

    /**
     * @return protocol version the broker chose, or {@code 1.0} if it did not say
     */
    String version() {
        return version == null ? "1.0" : version;
    }

    @Override
    public void send(StompFrame frame, Callback<Void> callback) {
        channel.writeAndFlush(frame).addListener((ChannelFutureListener) f -> queue.execute(() -> {
            if (f.isSuccess()) {
                callback.onSuccess(null);
            }
            else {
                callback.onFailure(new StompTransportException("Failed to send " + frame.command(), f.cause()));
            }
        }));
    }

    @Override
    public void request(StompFrame frame, Callback<StompFrame> callback) {
        String receiptId = "receipt-" + (++receiptSequence);
        pendingReceipts.put(receiptId, callback);
        channel.writeAndFlush(frame.withHeader(StompCommand.HEADER_RECEIPT, receiptId)).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                queue.execute(() -> {
                    Callback<StompFrame> pending = pendingReceipts.remove(receiptId);
                    if (pending != null) {
                        pending.onFailure(new StompTransportException("Failed to send " + frame.command(), f.cause()));
                    }
                });
            }
        });
    }

    @Override
    public void receive(Callback<StompFrame> handler) {
        this.receiveHandler = Objects.requireNonNull(handler);
        while (!undelivered.isEmpty()) {
            handler.onSuccess(undelivered.poll());
        }
        Throwable failure = undeliveredFailure;
        if (failure != null) {
            undeliveredFailure = null;
            handler.onFailure(failure);
        }
    }

    @Override
    public void suspend() {
        channel.config().setAutoRead(false);
    }

    @Override
    public void resume() {
        channel.config().setAutoRead(true);
    }

    @Override
    public void close(Runnable onComplete) {
        closeRequested = true;
        if (!pendingReceipts.isEmpty()) {
            LOGGER.debug("{}: Abandoning {} outstanding receipts on close", queue.label(), pendingReceipts.size());
            pendingReceipts.clear();
        }
        channel.close().addListener((ChannelFutureListener) f -> queue.execute(onComplete));
    }

    // ==================== Channel events (channel event loop) ====================

    void onFrame(StompFrame frame) {
        queue.execute(() -> dispatch(frame));
    }

    void onChannelInactive() {
        queue.execute(() -> {
            if (!closeRequested) {
                fail(new StompTransportException("Connection closed by broker"));
            }
        });
    }

    void onChannelError(Throwable cause) {
        queue.execute(() -> fail(new StompTransportException("Connection failed", cause)));
    }

    // ==================== Owner queue ====================

    @VisibleForTesting
    void dispatch(StompFrame frame) {
        switch (frame.command()) {
            case StompCommand.RECEIPT -> {
                String receiptId = frame.header(StompCommand.HEADER_RECEIPT_ID);
                Callback<StompFrame> pending = receiptId == null ? null : pendingReceipts.remove(receiptId);
                if (pending != null) {
                    pending.onSuccess(frame);
                }
                else {
                    LOGGER.debug("{}: Received RECEIPT for unknown receipt-id {}", queue.label(), receiptId);
                }
            }
            case StompCommand.ERROR -> {
                fail(new StompErrorException(frame));
                channel.close();
            }
            default -> {
                Callback<StompFrame> handler = receiveHandler;
                if (handler != null) {
                    handler.onSuccess(frame);
                }
                else {
                    undelivered.add(frame);
                }
            }
        }
    }

    private void fail(Throwable cause) {
        if (failed || closeRequested) {
            LOGGER.trace("{}: Suppressing failure after close or earlier failure: {}", queue.label(), cause.getMessage());
            return;
        }
        failed = true;
        List<Callback<StompFrame>> outstanding = new ArrayList<>(pendingReceipts.values());
        pendingReceipts.clear();
        for (Callback<StompFrame> pending : outstanding) {
            pending.onFailure(cause);
        }
        Callback<StompFrame> handler = receiveHandler;
        if (handler != null) {
            handler.onFailure(cause);
        }
        else {
            undeliveredFailure = cause;
        }
    }

    @VisibleForTesting
    int pendingReceiptCount() {
        return pendingReceipts.size();
    }

    @Override
    public String toString() {
        return "NettyStompConnection{" +
                "channel=" + channel +
                ", version=" + version() +
                ", pendingReceipts=" + pendingReceipts.size() +
                ", closeRequested=" + closeRequested +
                '}';
    }
}
