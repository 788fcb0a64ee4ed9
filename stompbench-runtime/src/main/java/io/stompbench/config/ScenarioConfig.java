/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Everything a {@code Scenario} run needs.
 *
 * @param endpoint broker to load
 * @param destinations destination naming policy
 * @param producer producer behaviour
 * @param consumer consumer behaviour
 * @param producers number of producer clients
 * @param consumers number of consumer clients
 * @param ioThreads size of the shared event loop group, 0 for Netty's default
 * @param sampleInterval time between two counter samples
 * @param sampleCount number of samples to take before shutting down
 * @param warmup time to let clients connect before the first sample window opens
 * @param displayErrors whether transport failures are logged with their stack trace at WARN
 * @param logNetwork whether to log raw network events
 * @param logFrames whether to log decoded frames
 * @param maxFrameSizeBytes largest inbound frame accepted by the decoder
 * @param connectTimeout TCP connect timeout
 */
public record ScenarioConfig(BrokerEndpoint endpoint,
                             DestinationSettings destinations,
                             ProducerSettings producer,
                             ConsumerSettings consumer,
                             int producers,
                             int consumers,
                             int ioThreads,
                             Duration sampleInterval,
                             int sampleCount,
                             Duration warmup,
                             boolean displayErrors,
                             boolean logNetwork,
                             boolean logFrames,
                             int maxFrameSizeBytes,
                             Duration connectTimeout) {

    public ScenarioConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(destinations, "destinations");
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(sampleInterval, "sampleInterval");
        Objects.requireNonNull(warmup, "warmup");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (producers < 0 || consumers < 0) {
            throw new IllegalArgumentException("client counts must not be negative");
        }
        if (ioThreads < 0) {
            throw new IllegalArgumentException("ioThreads must not be negative: " + ioThreads);
        }
        if (sampleInterval.isZero() || sampleInterval.isNegative()) {
            throw new IllegalArgumentException("sampleInterval must be positive: " + sampleInterval);
        }
        if (sampleCount < 1) {
            throw new IllegalArgumentException("sampleCount must be at least 1: " + sampleCount);
        }
        if (warmup.isNegative()) {
            throw new IllegalArgumentException("warmup must not be negative: " + warmup);
        }
        if (maxFrameSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFrameSizeBytes must be positive: " + maxFrameSizeBytes);
        }
    }
}
