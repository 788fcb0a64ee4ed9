/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;

import io.stompbench.config.ScenarioConfig;
import io.stompbench.dispatch.EventLoopDispatchQueue;
import io.stompbench.internal.client.ClientContext;
import io.stompbench.internal.client.ClientStateMachine;
import io.stompbench.internal.client.ConsumerClient;
import io.stompbench.internal.client.ProducerClient;
import io.stompbench.internal.net.NettyStompConnector;
import io.stompbench.internal.util.LoadCounters;
import io.stompbench.tag.VisibleForTesting;
import io.stompbench.transport.StompConnector;

/**
 * Runs one load test: creates the consumers and producers, lets them run for the configured
 * number of sample windows, then shuts every client down.
 *
 * <pre>
 *   EventLoopGroup ──next()──► EventLoopDispatchQueue (one per client)
 *                                      │
 *              ConsumerClient / ProducerClient ──► NettyStompConnector ──► broker
 *                                      │
 *                                 LoadCounters ◄── sampled every interval
 * </pre>
 */
public final class Scenario {

    private static final Logger LOGGER = LoggerFactory.getLogger(Scenario.class);

    static final Duration CLIENT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final ScenarioConfig config;
    private final LoadCounters counters;
    private final AtomicBoolean done = new AtomicBoolean();
    private final AtomicReference<Throwable> fatalError = new AtomicReference<>();
    private final CountDownLatch aborted = new CountDownLatch(1);

    public Scenario(ScenarioConfig config) {
        this(config, new SimpleMeterRegistry());
    }

    public Scenario(ScenarioConfig config, MeterRegistry registry) {
        this.config = Objects.requireNonNull(config);
        this.counters = new LoadCounters(registry);
    }

    public LoadCounters counters() {
        return counters;
    }

    /**
     * Runs the scenario to completion on a fresh event loop group.
     *
     * @return one entry per completed sample window
     * @throws InterruptedException if the calling thread is interrupted
     * @throws IllegalStateException if a client hit a fatal error
     */
    public List<ScenarioSample> run() throws InterruptedException {
        EventLoopGroup group = new NioEventLoopGroup(config.ioThreads(), new DefaultThreadFactory("stompbench-io"));
        try {
            StompConnector connector = new NettyStompConnector(
                    group,
                    config.maxFrameSizeBytes(),
                    config.connectTimeout(),
                    config.logNetwork(),
                    config.logFrames(),
                    NettyStompConnector.buildSslContext(config.endpoint()));
            return run(group, connector);
        }
        finally {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
    }

    @VisibleForTesting
    List<ScenarioSample> run(EventLoopGroup group, StompConnector connector) throws InterruptedException {
        ClientContext context = new ClientContext(connector, config.endpoint(), counters, done, config.displayErrors());
        List<ClientStateMachine> clients = new ArrayList<>(config.consumers() + config.producers());
        // consumers first, so they are subscribed before the first message is sent
        for (int i = 0; i < config.consumers(); i++) {
            clients.add(new ConsumerClient(i, queueFor(group, "consumer " + i), context, config.consumer(), config.destinations()));
        }
        for (int i = 0; i < config.producers(); i++) {
            clients.add(new ProducerClient(i, queueFor(group, "producer " + i), context, config.producer(), config.destinations()));
        }
        LOGGER.info("Starting {} producers and {} consumers against {}", config.producers(), config.consumers(), config.endpoint());
        clients.forEach(ClientStateMachine::start);

        List<ScenarioSample> samples = new ArrayList<>(config.sampleCount());
        try {
            sample(samples);
        }
        finally {
            stop(clients);
        }
        Throwable fatal = fatalError.get();
        if (fatal != null) {
            throw new IllegalStateException("Scenario aborted after a fatal client error", fatal);
        }
        return samples;
    }

    private void sample(List<ScenarioSample> samples) throws InterruptedException {
        if (!config.warmup().isZero() && aborted.await(config.warmup().toMillis(), TimeUnit.MILLISECONDS)) {
            return;
        }
        LoadCounters.Snapshot previous = counters.snapshot();
        long previousNanos = System.nanoTime();
        for (int index = 1; index <= config.sampleCount(); index++) {
            if (aborted.await(config.sampleInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Sampling aborted after {} of {} samples", index - 1, config.sampleCount());
                return;
            }
            LoadCounters.Snapshot current = counters.snapshot();
            long currentNanos = System.nanoTime();
            ScenarioSample sample = ScenarioSample.of(index, current.minus(previous), Duration.ofNanos(currentNanos - previousNanos));
            LOGGER.info("{}", sample);
            samples.add(sample);
            previous = current;
            previousNanos = currentNanos;
        }
    }

    private void stop(List<ClientStateMachine> clients) throws InterruptedException {
        done.set(true);
        LOGGER.debug("Shutting down {} clients", clients.size());
        for (ClientStateMachine client : clients) {
            if (!client.shutdown(CLIENT_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{}: Did not shut down within {}", client.name(), CLIENT_SHUTDOWN_TIMEOUT);
            }
        }
        LOGGER.info("All clients stopped: {}", counters);
    }

    private EventLoopDispatchQueue queueFor(EventLoopGroup group, String label) {
        return new EventLoopDispatchQueue(group.next(), label, this::onFatalError);
    }

    private void onFatalError(Throwable error) {
        if (fatalError.compareAndSet(null, error)) {
            aborted.countDown();
        }
    }
}
