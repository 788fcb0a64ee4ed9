/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.client;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import io.stompbench.config.BrokerEndpoint;
import io.stompbench.internal.util.LoadCounters;
import io.stompbench.transport.StompConnector;

/**
 * Collaborators shared by every client of a scenario.
 *
 * @param connector opens connections
 * @param endpoint broker to connect to
 * @param counters shared counters
 * @param done set once to ask all clients to stop
 * @param displayErrors whether transport failures are logged with their stack trace at WARN
 */
public record ClientContext(StompConnector connector,
                            BrokerEndpoint endpoint,
                            LoadCounters counters,
                            AtomicBoolean done,
                            boolean displayErrors) {

    public ClientContext {
        Objects.requireNonNull(connector, "connector");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(counters, "counters");
        Objects.requireNonNull(done, "done");
    }
}
