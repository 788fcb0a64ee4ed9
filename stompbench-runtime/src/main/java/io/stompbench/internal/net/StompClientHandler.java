/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.net;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.util.ReferenceCountUtil;

import io.stompbench.config.BrokerEndpoint;
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
 * Netty callbacks for one broker connection.
 *
 * <p>Until the broker answers CONNECT with CONNECTED this handler drives the handshake and
 * reports its outcome, exactly once, to the connect callback. Afterwards it hands every event
 * to the {@link NettyStompConnection} it created.</p>
 */
public class StompClientHandler extends ChannelInboundHandlerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(StompClientHandler.class);

    static final String ACCEPT_VERSION = "1.0,1.1,1.2";

    private final BrokerEndpoint endpoint;
    private final DispatchQueue queue;

    @Nullable
    private Callback<StompConnection> connectCallback;

    @VisibleForTesting
    @Nullable
    NettyStompConnection connection;

    public StompClientHandler(BrokerEndpoint endpoint, DispatchQueue queue, Callback<StompConnection> connectCallback) {
        this.endpoint = Objects.requireNonNull(endpoint);
        this.queue = Objects.requireNonNull(queue);
        this.connectCallback = Objects.requireNonNull(connectCallback);
    }

    /**
     * Netty callback that the TCP connection (and TLS, if any) is up. Starts the STOMP handshake.
     */
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        ctx.writeAndFlush(connectFrame()).addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                handshakeFailed(new StompTransportException("Failed to send CONNECT", f.cause()));
                f.channel().close();
            }
        });
        super.channelActive(ctx);
    }

    @VisibleForTesting
    StompFrame connectFrame() {
        StompFrame.Builder builder = StompFrame.builder(StompCommand.CONNECT)
                .header("accept-version", ACCEPT_VERSION)
                .header("host", endpoint.host())
                .header("heart-beat", "0,0");
        if (endpoint.login() != null) {
            builder.header("login", endpoint.login());
        }
        if (endpoint.passcode() != null) {
            builder.header("passcode", endpoint.passcode());
        }
        return builder.build();
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) {
        if (!(msg instanceof StompFrame frame)) {
            LOGGER.warn("{}: Ignoring unexpected inbound message {}", queue.label(), msg);
            ReferenceCountUtil.release(msg);
            return;
        }
        if (connection != null) {
            connection.onFrame(frame);
        }
        else {
            onHandshakeFrame(ctx, frame);
        }
    }

    private void onHandshakeFrame(ChannelHandlerContext ctx, StompFrame frame) {
        switch (frame.command()) {
            case StompCommand.CONNECTED -> {
                // inbound stays off until the owner resumes the connection
                ctx.channel().config().setAutoRead(false);
                NettyStompConnection established = new NettyStompConnection(ctx.channel(), queue, frame.header("version"));
                connection = established;
                LOGGER.debug("{}: STOMP session established with {}:{} (version {})",
                        queue.label(), endpoint.host(), endpoint.port(), established.version());
                Callback<StompConnection> callback = connectCallback;
                connectCallback = null;
                if (callback != null) {
                    queue.execute(() -> callback.onSuccess(established));
                }
            }
            case StompCommand.ERROR -> {
                handshakeFailed(new StompErrorException(frame));
                ctx.close();
            }
            default -> {
                handshakeFailed(new StompTransportException("Expected CONNECTED but received " + frame.command()));
                ctx.close();
            }
        }
    }

    /**
     * Netty callback that the channel closed.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (connection != null) {
            connection.onChannelInactive();
        }
        else {
            handshakeFailed(new StompTransportException("Connection closed before CONNECTED was received"));
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (connection != null) {
            connection.onChannelError(cause);
        }
        else {
            handshakeFailed(new StompTransportException("Connection failed during handshake", cause));
        }
        ctx.close();
    }

    /**
     * Reports a failed connection attempt, unless its outcome has already been reported.
     */
    void handshakeFailed(Throwable cause) {
        Callback<StompConnection> callback = connectCallback;
        if (callback == null) {
            LOGGER.trace("{}: Ignoring handshake failure after outcome was reported: {}", queue.label(), cause.getMessage());
            return;
        }
        connectCallback = null;
        queue.execute(() -> callback.onFailure(cause));
    }

    @Override
    public String toString() {
        return "StompClientHandler{" +
                "label=" + queue.label() +
                ", endpoint=" + endpoint +
                ", connected=" + (connection != null) +
                '}';
    }
}
