/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.client;

import java.util.Objects;

import io.stompbench.transport.StompConnection;

/**
 * Sealed hierarchy of a load client's connection states. Exactly one is current per client.
 *
 * <pre>
 *   Init
 *     │ start()
 *     ▼
 *   Disconnected ◄─────────────────────────────┐
 *     │ open()            ▲                     │
 *     ▼                   │ close() / failure   │
 *   Connecting ───────────┘                     │
 *     │ connect succeeded                       │
 *     ▼                                         │
 *   Connected                                   │
 *     │ close() / failure                       │
 *     ▼                                         │
 *   Closing ───── transport close completed ────┘
 * </pre>
 *
 * <p>Delayed actions capture the state instance they were scheduled under and compare it by
 * identity when they fire. {@code Connecting}, {@code Connected} and {@code Disconnected} are
 * therefore created fresh on every entry and must never be compared with {@code equals}.</p>
 */
public sealed interface ClientState permits
        ClientState.Init,
        ClientState.Disconnected,
        ClientState.Connecting,
        ClientState.Connected,
        ClientState.Closing {

    /**
     * Client created, not yet started.
     */
    record Init() implements ClientState {
        public static final Init INSTANCE = new Init();

        public Disconnected toDisconnected() {
            return new Disconnected();
        }
    }

    /**
     * No connection. The only state in which reconnection or termination is decided.
     */
    record Disconnected() implements ClientState {

        public Connecting toConnecting(String host, int port, Runnable onComplete) {
            return new Connecting(host, port, onComplete);
        }
    }

    /**
     * A connection attempt is pending, possibly still waiting out the reconnect backoff.
     *
     * @param host broker host
     * @param port broker port
     * @param onComplete continuation run once connected
     */
    record Connecting(String host, int port, Runnable onComplete) implements ClientState {

        public Connecting {
            Objects.requireNonNull(host);
            Objects.requireNonNull(onComplete);
        }

        public Connected toConnected(StompConnection connection) {
            return new Connected(connection);
        }

        public Disconnected toDisconnected() {
            return new Disconnected();
        }
    }

    /**
     * Owns the live connection; every read and write goes through it.
     *
     * @param connection the connection
     */
    record Connected(StompConnection connection) implements ClientState {

        public Connected {
            Objects.requireNonNull(connection);
        }

        public Closing toClosing() {
            return new Closing(connection);
        }
    }

    /**
     * Close requested; waiting for the transport to confirm.
     *
     * @param connection the connection being closed
     */
    record Closing(StompConnection connection) implements ClientState {

        public Disconnected toDisconnected() {
            return new Disconnected();
        }
    }

    /**
     * @return true while this state holds a live connection
     */
    default boolean holdsConnection() {
        return this instanceof Connected || this instanceof Closing;
    }
}
