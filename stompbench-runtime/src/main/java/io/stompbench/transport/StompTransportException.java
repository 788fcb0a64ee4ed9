/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.transport;

/**
 * A transport level failure: connect refused, channel closed, write failed, protocol violation.
 */
public class StompTransportException extends RuntimeException {

    public StompTransportException(String message) {
        super(message);
    }

    public StompTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
