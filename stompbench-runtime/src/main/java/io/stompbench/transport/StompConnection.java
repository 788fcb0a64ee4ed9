/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.transport;

import io.stompbench.frame.StompFrame;

/**
 * A live, handshaken STOMP session.
 *
 * <p>A connection starts with inbound delivery suspended; the owner calls {@link #resume()}
 * once it is ready to handle frames. Operations complete in the order they were issued.</p>
 */
public interface StompConnection {

    /**
     * Writes a frame. Completes once the frame has been written to the network.
     */
    void send(StompFrame frame, Callback<Void> callback);

    /**
     * Writes a frame with a fresh {@code receipt} header and completes with the broker's
     * matching RECEIPT frame.
     */
    void request(StompFrame frame, Callback<StompFrame> callback);

    /**
     * Registers the handler for inbound frames, replacing any earlier one. Broker ERROR frames
     * and unexpected disconnects are reported through {@link Callback#onFailure(Throwable)}.
     */
    void receive(Callback<StompFrame> handler);

    /**
     * Stops reading from the network. Idempotent.
     */
    void suspend();

    /**
     * Resumes reading from the network. Idempotent.
     */
    void resume();

    /**
     * Closes the connection and runs {@code onComplete} on the owner's queue once it is closed.
     * Nothing is reported to the receive handler for a close requested here.
     */
    void close(Runnable onComplete);
}
