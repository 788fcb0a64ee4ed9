/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Where the load clients connect to and how they authenticate.
 *
 * @param host broker host
 * @param port broker STOMP port
 * @param login optional login sent in the CONNECT frame
 * @param passcode optional passcode sent in the CONNECT frame
 * @param tls whether to wrap the connection in TLS
 */
public record BrokerEndpoint(String host, int port, @Nullable String login, @Nullable String passcode, boolean tls) {

    public BrokerEndpoint {
        Objects.requireNonNull(host, "host");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static BrokerEndpoint of(String host, int port) {
        return new BrokerEndpoint(host, port, null, null, false);
    }

    @Override
    public String toString() {
        // never print the passcode
        return "BrokerEndpoint[" + host + ":" + port + (login == null ? "" : ", login=" + login) + (tls ? ", tls" : "") + "]";
    }
}
