/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.internal.client;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stompbench.dispatch.DispatchQueue;
import io.stompbench.frame.StompFrame;
import io.stompbench.tag.VisibleForTesting;
import io.stompbench.transport.Callback;
import io.stompbench.transport.StompConnection;

/**
 * Connection lifecycle of a single load client.
 *
 * <h2>Threading</h2>
 * <p>Every method except {@link #start()} and {@link #shutdown()} must be called from the client's
 * own {@link DispatchQueue}; calling one from anywhere else is a bug and fails with
 * {@link IllegalStateException}. Transport callbacks are completed on the same queue, so no
 * locking is needed.</p>
 *
 * <h2>Failure handling</h2>
 * <p>Transport failures are expected under load. They are counted, logged, and answered by
 * closing the connection and reconnecting after {@link #RECONNECT_BACKOFF_MS}. Results of
 * operations issued under a state that is no longer current are discarded, which is what keeps a
 * client at one live connection at most.</p>
 *
 * <h2>Reconnection</h2>
 * <p>Each time a {@link ClientState.Disconnected} becomes current, a task is queued that either
 * signals shutdown completion (if the done flag is set) or runs {@link #reconnectAction()}.</p>
 */
public abstract class ClientStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientStateMachine.class);

    public static final long RECONNECT_BACKOFF_MS = 1000;

    protected final int id;
    protected final String name;
    protected final DispatchQueue queue;
    protected final ClientContext context;

    private ClientState state = ClientState.Init.INSTANCE;

    /**
     * Messages sent or received since the current connection cycle began.
     */
    protected long messageCounter;

    private long reconnectDelayMs;

    private final CountDownLatch hasShutdown = new CountDownLatch(1);

    protected ClientStateMachine(int id, String name, DispatchQueue queue, ClientContext context) {
        this.id = id;
        this.name = Objects.requireNonNull(name);
        this.queue = Objects.requireNonNull(queue);
        this.context = Objects.requireNonNull(context);
    }

    // ==================== Accessors ====================

    public int id() {
        return id;
    }

    public String name() {
        return name;
    }

    public DispatchQueue queue() {
        return queue;
    }

    /**
     * The current state. Only meaningful when read from the client's queue.
     */
    public ClientState state() {
        return state;
    }

    public long messageCounter() {
        return messageCounter;
    }

    public long reconnectDelayMs() {
        return reconnectDelayMs;
    }

    public boolean hasShutdown() {
        return hasShutdown.getCount() == 0;
    }

    // ==================== Lifecycle ====================

    /**
     * Moves the client out of {@code Init}. Safe to call from any thread.
     */
    public void start() {
        queue.execute(() -> {
            if (state instanceof ClientState.Init init) {
                setState(init.toDisconnected());
            }
            else {
                throw new IllegalStateException(name + ": start() called in state " + state);
            }
        });
    }

    /**
     * Asks the client to close and blocks until it has settled in {@code Disconnected}. The done flag
     * must already be set so the client does not reconnect. Safe to call from any thread except the
     * client's own queue.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void shutdown() throws InterruptedException {
        if (!context.done().get()) {
            throw new IllegalStateException(name + ": shutdown() requires the done flag to be set");
        }
        queue.execute(this::close);
        hasShutdown.await();
    }

    /**
     * Like {@link #shutdown()} but gives up after the timeout.
     *
     * @return true if the client shut down in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(long timeout, TimeUnit unit) throws InterruptedException {
        if (!context.done().get()) {
            throw new IllegalStateException(name + ": shutdown() requires the done flag to be set");
        }
        queue.execute(this::close);
        return hasShutdown.await(timeout, unit);
    }

    /**
     * Starts a connection attempt. Requires {@code Disconnected}. After a failure the attempt is
     * delayed by the reconnect backoff and only made if nothing superseded it in the meantime.
     *
     * @param host broker host
     * @param port broker port
     * @param onComplete run on the queue once connected
     */
    public void open(String host, int port, Runnable onComplete) {
        queue.assertExecuting();
        if (!(state instanceof ClientState.Disconnected disconnected)) {
            throw new IllegalStateException(name + ": open() requires Disconnected but state is " + state);
        }
        ClientState.Connecting connecting = disconnected.toConnecting(host, port, onComplete);
        setState(connecting);
        if (reconnectDelayMs == 0) {
            attemptConnect(connecting);
        }
        else {
            LOGGER.debug("{}: Reconnecting to {}:{} in {} ms", name, host, port, reconnectDelayMs);
            queue.executeAfter(reconnectDelayMs, TimeUnit.MILLISECONDS, () -> {
                if (state == connecting) {
                    attemptConnect(connecting);
                }
                else {
                    LOGGER.trace("{}: Dropping delayed connect, superseded by {}", name, state);
                }
            });
        }
    }

    private void attemptConnect(ClientState.Connecting connecting) {
        context.connector().connect(context.endpoint(), queue, new Callback<>() {
            @Override
            public void onSuccess(StompConnection connection) {
                onConnectSuccess(connecting, connection);
            }

            @Override
            public void onFailure(Throwable cause) {
                if (state == connecting) {
                    ClientStateMachine.this.onFailure(cause);
                }
                else {
                    LOGGER.trace("{}: Discarding failure of abandoned connect attempt: {}", name, cause.getMessage());
                }
            }
        });
    }

    @VisibleForTesting
    void onConnectSuccess(ClientState.Connecting connecting, StompConnection connection) {
        queue.assertExecuting();
        if (state != connecting) {
            LOGGER.debug("{}: Closing connection from abandoned attempt, state is now {}", name, state);
            connection.close(() -> LOGGER.trace("{}: Orphaned connection closed", name));
            return;
        }
        ClientState.Connected connected = connecting.toConnected(connection);
        setState(connected);
        LOGGER.debug("{}: Connected to {}:{}", name, connecting.host(), connecting.port());
        connection.receive(new Callback<>() {
            @Override
            public void onSuccess(StompFrame frame) {
                if (state == connected) {
                    onReceive(frame);
                }
            }

            @Override
            public void onFailure(Throwable cause) {
                failIfCurrent(connected, cause);
            }
        });
        connecting.onComplete().run();
        connection.resume();
    }

    /**
     * Handles a transport failure of the current connection or connection attempt: counts it,
     * logs it, arms the reconnect backoff and closes. Ignored in any other state.
     */
    public void onFailure(Throwable cause) {
        queue.assertExecuting();
        if (!(state instanceof ClientState.Connecting) && !(state instanceof ClientState.Connected)) {
            LOGGER.trace("{}: Ignoring failure in state {}: {}", name, state, cause.getMessage());
            return;
        }
        context.counters().error();
        if (context.displayErrors()) {
            LOGGER.warn("{}: Transport failure in state {}", name, state, cause);
        }
        else {
            LOGGER.debug("{}: Transport failure in state {}: {}", name, state, cause.getMessage());
        }
        reconnectDelayMs = RECONNECT_BACKOFF_MS;
        close();
    }

    /**
     * Abandons a pending connection attempt or closes the live connection. A no-op in other
     * states, except that an idle client asked to close after the done flag was set signals
     * shutdown completion again.
     */
    public void close() {
        queue.assertExecuting();
        if (state instanceof ClientState.Connecting connecting) {
            LOGGER.debug("{}: Abandoning connection attempt to {}:{}", name, connecting.host(), connecting.port());
            setState(connecting.toDisconnected());
        }
        else if (state instanceof ClientState.Connected connected) {
            ClientState.Closing closing = connected.toClosing();
            setState(closing);
            connected.connection().close(() -> {
                if (state == closing) {
                    setState(closing.toDisconnected());
                }
            });
        }
        else if (state instanceof ClientState.Disconnected && context.done().get()) {
            hasShutdown.countDown();
        }
    }

    private void onDisconnectedEntry(ClientState.Disconnected disconnected) {
        if (state != disconnected) {
            return;
        }
        if (context.done().get()) {
            LOGGER.debug("{}: Shut down", name);
            hasShutdown.countDown();
        }
        else {
            reconnectAction();
        }
    }

    // ==================== Operations on the live connection ====================

    /**
     * Opens a connection to the scenario's broker unless the done flag is set.
     */
    protected void connect(Runnable onConnected) {
        queue.assertExecuting();
        if (context.done().get()) {
            hasShutdown.countDown();
            return;
        }
        open(context.endpoint().host(), context.endpoint().port(), onConnected);
    }

    /**
     * Sends a frame without waiting for the broker. No-op unless connected.
     */
    protected void send(StompFrame frame, Runnable onComplete) {
        queue.assertExecuting();
        if (state instanceof ClientState.Connected connected) {
            connected.connection().send(frame, new Callback<>() {
                @Override
                public void onSuccess(Void value) {
                    if (state == connected) {
                        onComplete.run();
                    }
                }

                @Override
                public void onFailure(Throwable cause) {
                    failIfCurrent(connected, cause);
                }
            });
        }
    }

    /**
     * Sends a frame and waits for the broker's receipt. No-op unless connected.
     */
    protected void request(StompFrame frame, Consumer<StompFrame> onReply) {
        queue.assertExecuting();
        if (state instanceof ClientState.Connected connected) {
            connected.connection().request(frame, new Callback<>() {
                @Override
                public void onSuccess(StompFrame reply) {
                    if (state == connected) {
                        onReply.accept(reply);
                    }
                }

                @Override
                public void onFailure(Throwable cause) {
                    failIfCurrent(connected, cause);
                }
            });
        }
    }

    protected void suspendInbound() {
        queue.assertExecuting();
        if (state instanceof ClientState.Connected connected) {
            connected.connection().suspend();
        }
    }

    protected void resumeInbound() {
        queue.assertExecuting();
        if (state instanceof ClientState.Connected connected) {
            connected.connection().resume();
        }
    }

    private void failIfCurrent(ClientState.Connected connected, Throwable cause) {
        if (state == connected) {
            onFailure(cause);
        }
        else {
            LOGGER.trace("{}: Discarding failure of a previous connection: {}", name, cause.getMessage());
        }
    }

    // ==================== Client behaviour ====================

    /**
     * Runs each time the client settles in {@code Disconnected} while the done flag is clear.
     * Implementations call {@link #connect(Runnable)}.
     */
    protected abstract void reconnectAction();

    /**
     * Called for every inbound frame of the current connection.
     */
    protected void onReceive(StompFrame frame) {
    }

    // ==================== Internal state management ====================

    private void setState(ClientState newState) {
        LOGGER.trace("{}: State {} -> {}", name, state, newState);
        this.state = newState;
        if (newState instanceof ClientState.Disconnected disconnected) {
            queue.execute(() -> onDisconnectedEntry(disconnected));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + name + '\'' +
                ", state=" + state +
                ", messageCounter=" + messageCounter +
                ", reconnectDelayMs=" + reconnectDelayMs +
                '}';
    }
}
