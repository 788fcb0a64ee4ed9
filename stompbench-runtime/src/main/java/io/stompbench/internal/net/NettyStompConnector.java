/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.net;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import javax.net.ssl.SSLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;

import io.stompbench.config.BrokerEndpoint;
import io.stompbench.dispatch.DispatchQueue;
import io.stompbench.dispatch.EventLoopDispatchQueue;
import io.stompbench.internal.codec.StompFrameDecoder;
import io.stompbench.internal.codec.StompFrameEncoder;
import io.stompbench.tag.VisibleForTesting;
import io.stompbench.transport.Callback;
import io.stompbench.transport.StompConnection;
import io.stompbench.transport.StompConnector;
import io.stompbench.transport.StompTransportException;

/**
 * Opens STOMP connections with Netty.
 *
 * <p>When the requesting client runs on an {@link EventLoopDispatchQueue} the channel is registered
 * on that same event loop, so I/O completions are already on the client's thread. Otherwise the
 * channel is placed on the connector's own group and completions hop over via the queue.</p>
 */
public class NettyStompConnector implements StompConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyStompConnector.class);

    private final EventLoopGroup group;
    private final int maxFrameSizeBytes;
    private final Duration connectTimeout;
    private final boolean logNetwork;
    private final boolean logFrames;
    private final Optional<SslContext> sslContext;

    public NettyStompConnector(EventLoopGroup group,
                               int maxFrameSizeBytes,
                               Duration connectTimeout,
                               boolean logNetwork,
                               boolean logFrames,
                               Optional<SslContext> sslContext) {
        this.group = Objects.requireNonNull(group);
        this.maxFrameSizeBytes = maxFrameSizeBytes;
        this.connectTimeout = Objects.requireNonNull(connectTimeout);
        this.logNetwork = logNetwork;
        this.logFrames = logFrames;
        this.sslContext = Objects.requireNonNull(sslContext);
    }

    /**
     * Builds the client TLS context for an endpoint, if it asks for TLS.
     */
    public static Optional<SslContext> buildSslContext(BrokerEndpoint endpoint) {
        if (!endpoint.tls()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SslContextBuilder.forClient().build());
        }
        catch (SSLException e) {
            throw new IllegalStateException("Failed to build TLS context for " + endpoint, e);
        }
    }

    @Override
    public void connect(BrokerEndpoint endpoint, DispatchQueue queue, Callback<StompConnection> callback) {
        LOGGER.debug("{}: Connecting to {}:{}", queue.label(), endpoint.host(), endpoint.port());
        StompClientHandler handler = new StompClientHandler(endpoint, queue, callback);
        Bootstrap bootstrap = configureBootstrap(queue, endpoint, handler);
        ChannelFuture connectFuture = bootstrap.connect(endpoint.host(), endpoint.port());
        connectFuture.addListener((ChannelFuture f) -> {
            if (f.isSuccess()) {
                LOGGER.trace("{}: TCP connected to {}:{}", queue.label(), endpoint.host(), endpoint.port());
            }
            else {
                handler.handshakeFailed(new StompTransportException(
                        "Failed to connect to " + endpoint.host() + ":" + endpoint.port(), f.cause()));
            }
        });
    }

    @VisibleForTesting
    Bootstrap configureBootstrap(DispatchQueue queue, BrokerEndpoint endpoint, StompClientHandler handler) {
        EventLoopGroup loop = queue instanceof EventLoopDispatchQueue eventLoopQueue ? eventLoopQueue.eventLoop() : group;
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(loop)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.AUTO_READ, true)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        configurePipeline(ch.pipeline(), endpoint, queue.label(), handler);
                    }
                });
        return bootstrap;
    }

    @VisibleForTesting
    void configurePipeline(ChannelPipeline pipeline, BrokerEndpoint endpoint, String label, StompClientHandler handler) {
        sslContext.ifPresent(ssl -> {
            SslHandler sslHandler = ssl.newHandler(pipeline.channel().alloc(), endpoint.host(), endpoint.port());
            pipeline.addLast("ssl", sslHandler);
        });
        if (logNetwork) {
            pipeline.addLast("networkLogger", new LoggingHandler("io.stompbench.internal.net.NetworkLogger." + label.replace(' ', '-'), LogLevel.INFO));
        }
        pipeline.addLast("frameDecoder", new StompFrameDecoder(maxFrameSizeBytes));
        pipeline.addLast("frameEncoder", new StompFrameEncoder());
        if (logFrames) {
            pipeline.addLast("frameLogger", new LoggingHandler("io.stompbench.internal.net.FrameLogger." + label.replace(' ', '-'), LogLevel.INFO));
        }
        pipeline.addLast("stompClient", handler);
        LOGGER.trace("{}: Configured pipeline {}", label, pipeline);
    }
}
