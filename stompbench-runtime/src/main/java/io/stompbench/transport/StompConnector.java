/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.transport;

import io.stompbench.config.BrokerEndpoint;
import io.stompbench.dispatch.DispatchQueue;

/**
 * Opens STOMP connections.
 */
public interface StompConnector {

    /**
     * Connects and performs the STOMP handshake.
     *
     * @param endpoint broker to connect to
     * @param queue queue of the client that owns the connection; every callback of the
     *              attempt and of the resulting connection runs on it
     * @param callback completed with the handshaken connection or the failure
     */
    void connect(BrokerEndpoint endpoint, DispatchQueue queue, Callback<StompConnection> callback);
}
