/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.frame;

/**
 * Command tokens and header names used by the load clients.
 */
public final class StompCommand {

    // client frames
    public static final String CONNECT = "CONNECT";
    public static final String SEND = "SEND";
    public static final String SUBSCRIBE = "SUBSCRIBE";
    public static final String ACK = "ACK";
    public static final String DISCONNECT = "DISCONNECT";

    // server frames
    public static final String CONNECTED = "CONNECTED";
    public static final String MESSAGE = "MESSAGE";
    public static final String RECEIPT = "RECEIPT";
    public static final String ERROR = "ERROR";

    public static final String HEADER_DESTINATION = "destination";
    public static final String HEADER_RECEIPT = "receipt";
    public static final String HEADER_RECEIPT_ID = "receipt-id";
    public static final String HEADER_MESSAGE_ID = "message-id";
    public static final String HEADER_SUBSCRIPTION = "subscription";
    public static final String HEADER_ID = "id";
    public static final String HEADER_ACK = "ack";
    public static final String HEADER_SELECTOR = "selector";
    public static final String HEADER_PERSISTENT = "persistent";
    public static final String HEADER_CONTENT_LENGTH = "content-length";
    public static final String HEADER_MESSAGE = "message";

    private StompCommand() {
    }
}
