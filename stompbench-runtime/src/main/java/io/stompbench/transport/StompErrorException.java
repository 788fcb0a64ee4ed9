/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.transport;

import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;

/**
 * The broker answered with an ERROR frame.
 */
public class StompErrorException extends StompTransportException {

    private final transient StompFrame frame;

    public StompErrorException(StompFrame frame) {
        super(describe(frame));
        this.frame = frame;
    }

    public StompFrame frame() {
        return frame;
    }

    private static String describe(StompFrame frame) {
        String message = frame.header(StompCommand.HEADER_MESSAGE);
        if (message != null) {
            return "Broker error: " + message;
        }
        String body = frame.contentAsString().strip();
        return body.isEmpty() ? "Broker error" : "Broker error: " + body;
    }
}
