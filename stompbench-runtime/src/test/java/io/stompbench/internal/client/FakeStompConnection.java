/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.client;

import java.util.ArrayList;
import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

import io.stompbench.dispatch.DispatchQueue;
import io.stompbench.frame.StompCommand;
import io.stompbench.frame.StompFrame;
import io.stompbench.transport.Callback;
import io.stompbench.transport.StompConnection;

/**
 * In-memory connection whose completions are triggered by the test. Every completion is posted to
 * the owner's queue, as the Netty transport does.
 */
class FakeStompConnection implements StompConnection {

    record Pending<T>(StompFrame frame, Callback<T> callback) {}

    private final DispatchQueue queue;
    private final List<StompFrame> written = new ArrayList<>();
    private final List<Pending<Void>> pendingSends = new ArrayList<>();
    private final List<Pending<StompFrame>> pendingRequests = new ArrayList<>();
    private final List<String> events = new ArrayList<>();
    private @Nullable Callback<StompFrame> handler;
    private @Nullable Runnable resumeHook;
    private int suspendCount;
    private int resumeCount;
    private boolean closed;

    FakeStompConnection(DispatchQueue queue) {
        this.queue = queue;
    }

    @Override
    public void send(StompFrame frame, Callback<Void> callback) {
        queue.assertExecuting();
        written.add(frame);
        events.add("send " + frame.command());
        pendingSends.add(new Pending<>(frame, callback));
    }

    @Override
    public void request(StompFrame frame, Callback<StompFrame> callback) {
        queue.assertExecuting();
        written.add(frame);
        events.add("request " + frame.command());
        pendingRequests.add(new Pending<>(frame, callback));
    }

    @Override
    public void receive(Callback<StompFrame> handler) {
        this.handler = handler;
    }

    @Override
    public void suspend() {
        queue.assertExecuting();
        suspendCount++;
        events.add("suspend");
    }

    @Override
    public void resume() {
        queue.assertExecuting();
        resumeCount++;
        events.add("resume");
        if (resumeHook != null) {
            resumeHook.run();
        }
    }

    @Override
    public void close(Runnable onComplete) {
        closed = true;
        events.add("close");
        pendingSends.clear();
        pendingRequests.clear();
        queue.execute(onComplete);
    }

    /**
     * Completes every outstanding send.
     */
    void completeSends() {
        List<Pending<Void>> sends = new ArrayList<>(pendingSends);
        pendingSends.clear();
        sends.forEach(p -> queue.execute(() -> p.callback().onSuccess(null)));
    }

    /**
     * Answers every outstanding request with a RECEIPT.
     */
    void completeRequests() {
        List<Pending<StompFrame>> requests = new ArrayList<>(pendingRequests);
        pendingRequests.clear();
        requests.forEach(p -> queue.execute(() -> p.callback().onSuccess(StompFrame.builder(StompCommand.RECEIPT)
                .header(StompCommand.HEADER_RECEIPT_ID, "receipt-1")
                .build())));
    }

    void failSends(Throwable cause) {
        List<Pending<Void>> sends = new ArrayList<>(pendingSends);
        pendingSends.clear();
        sends.forEach(p -> queue.execute(() -> p.callback().onFailure(cause)));
    }

    void deliver(StompFrame frame) {
        Callback<StompFrame> h = requireHandler();
        queue.execute(() -> h.onSuccess(frame));
    }

    void fail(Throwable cause) {
        Callback<StompFrame> h = requireHandler();
        queue.execute(() -> h.onFailure(cause));
    }

    private Callback<StompFrame> requireHandler() {
        if (handler == null) {
            throw new IllegalStateException("no receive handler registered");
        }
        return handler;
    }

    void onResume(Runnable hook) {
        this.resumeHook = hook;
    }

    List<StompFrame> written() {
        return written;
    }

    List<String> events() {
        return events;
    }

    int pendingSendCount() {
        return pendingSends.size();
    }

    int pendingRequestCount() {
        return pendingRequests.size();
    }

    int suspendCount() {
        return suspendCount;
    }

    int resumeCount() {
        return resumeCount;
    }

    boolean isClosed() {
        return closed;
    }
}
