/*
 * Copyright Stompbench Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stompbench.app;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;
import picocli.CommandLine;

import io.stompbench.Scenario;
import io.stompbench.ScenarioSample;
import io.stompbench.config.AckMode;
import io.stompbench.config.BrokerEndpoint;
import io.stompbench.config.ConsumerSettings;
import io.stompbench.config.DestinationSettings;
import io.stompbench.config.HeaderSpec;
import io.stompbench.config.ProducerSettings;
import io.stompbench.config.ScenarioConfig;
import io.stompbench.internal.codec.StompFrameDecoder;

/**
 * Runs a load scenario against a STOMP broker.
 */
@CommandLine.Command(
        name = "stompbench",
        mixinStandardHelpOptions = true,
        sortOptions = false,
        description = "Generates STOMP producer and consumer load against a broker")
public class StompBenchApp implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StompBenchApp.class);

    static final int EXIT_ABORTED = 1;

    @CommandLine.Spec
    @Nullable
    CommandLine.Model.CommandSpec spec;

    // ==================== Broker ====================

    @CommandLine.Option(names = "--host", description = "broker host", defaultValue = "localhost")
    String host;

    @CommandLine.Option(names = { "--port", "-p" }, description = "broker port", defaultValue = "61613")
    int port;

    @CommandLine.Option(names = "--login", description = "login sent in the CONNECT frame")
    @Nullable
    String login;

    @CommandLine.Option(names = "--passcode", description = "passcode sent in the CONNECT frame")
    @Nullable
    String passcode;

    @CommandLine.Option(names = "--tls", description = "connect over TLS", defaultValue = "false")
    boolean tls;

    // ==================== Clients ====================

    @CommandLine.Option(names = { "--producers", "-x" }, description = "number of producers", defaultValue = "1",
            converter = NotNegativeIntegerTypeConverter.class)
    int producers;

    @CommandLine.Option(names = { "--consumers", "-y" }, description = "number of consumers", defaultValue = "1",
            converter = NotNegativeIntegerTypeConverter.class)
    int consumers;

    @CommandLine.Option(names = { "--io-threads" }, description = "event loop threads, 0 for Netty's default", defaultValue = "0",
            converter = NotNegativeIntegerTypeConverter.class)
    int ioThreads;

    // ==================== Producers ====================

    @CommandLine.Option(names = { "--message-size", "-s" }, description = "size of message bodies in bytes", defaultValue = "1024",
            converter = NotNegativeIntegerTypeConverter.class)
    int messageSize;

    @CommandLine.Option(names = "--persistent", description = "ask the broker for persistent delivery", defaultValue = "false")
    boolean persistent;

    @CommandLine.Option(names = "--persistent-header", description = "header used to request persistent delivery, as name:value",
            defaultValue = "persistent:true", converter = HeaderSpecTypeConverter.class)
    HeaderSpec persistentHeader;

    @CommandLine.Option(names = "--sync-send", description = "wait for a broker receipt after each message", defaultValue = "false")
    boolean syncSend;

    @CommandLine.Option(names = "--header",
            description = "extra headers for a producer, as name:value pairs separated by ';'. "
                    + "Repeat to give producers different header sets, producer i uses set i modulo the number of sets.")
    List<String> headerSets = new ArrayList<>();

    @CommandLine.Option(names = "--messages-per-connection", description = "messages sent before reconnecting, 0 for unlimited",
            defaultValue = "0", converter = NotNegativeLongTypeConverter.class)
    long messagesPerConnection;

    @CommandLine.Option(names = "--producer-sleep", description = "pause between two sends in milliseconds", defaultValue = "0",
            converter = NotNegativeLongTypeConverter.class)
    long producerSleepMs;

    // ==================== Consumers ====================

    @CommandLine.Option(names = "--consumer-sleep", description = "time spent processing each message in milliseconds",
            defaultValue = "0", converter = NotNegativeLongTypeConverter.class)
    long consumerSleepMs;

    @CommandLine.Option(names = "--ack", description = "acknowledgement mode, auto or client", defaultValue = "auto",
            converter = AckModeTypeConverter.class)
    AckMode ackMode;

    @CommandLine.Option(names = "--durable", description = "ask for durable subscriptions", defaultValue = "false")
    boolean durable;

    @CommandLine.Option(names = "--selector", description = "message selector for subscriptions")
    @Nullable
    String selector;

    @CommandLine.Option(names = "--consumer-prefix", description = "prefix of subscription ids", defaultValue = "consumer-")
    String consumerPrefix;

    // ==================== Destinations ====================

    @CommandLine.Option(names = "--destination-type", description = "destination type, e.g. queue or topic", defaultValue = "queue")
    String destinationType;

    @CommandLine.Option(names = "--destination-name", description = "destination base name", defaultValue = "load")
    String destinationName;

    @CommandLine.Option(names = "--destination-count", description = "number of destinations clients are spread over",
            defaultValue = "1", converter = PositiveIntegerTypeConverter.class)
    int destinationCount;

    // ==================== Sampling ====================

    @CommandLine.Option(names = "--sample-interval", description = "seconds between two samples", defaultValue = "1",
            converter = PositiveIntegerTypeConverter.class)
    int sampleIntervalSeconds;

    @CommandLine.Option(names = "--sample-count", description = "number of samples before stopping", defaultValue = "10",
            converter = PositiveIntegerTypeConverter.class)
    int sampleCount;

    @CommandLine.Option(names = "--warmup", description = "seconds to wait before the first sample", defaultValue = "0",
            converter = NotNegativeIntegerTypeConverter.class)
    int warmupSeconds;

    // ==================== Diagnostics ====================

    @CommandLine.Option(names = "--display-errors", description = "log transport failures with their stack trace", defaultValue = "false")
    boolean displayErrors;

    @CommandLine.Option(names = "--log-network", description = "log raw network events", defaultValue = "false")
    boolean logNetwork;

    @CommandLine.Option(names = "--log-frames", description = "log every frame sent and received", defaultValue = "false")
    boolean logFrames;

    public static void main(String[] args) {
        System.exit(new CommandLine(new StompBenchApp()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        ScenarioConfig config = buildConfig();
        Scenario scenario = new Scenario(config);
        try {
            List<ScenarioSample> samples = scenario.run();
            summarize(samples);
            return CommandLine.ExitCode.OK;
        }
        catch (IllegalStateException e) {
            LOGGER.error("Run aborted", e);
            return EXIT_ABORTED;
        }
    }

    ScenarioConfig buildConfig() {
        try {
            List<List<HeaderSpec>> headers = new ArrayList<>(headerSets.size());
            for (String headerSet : headerSets) {
                headers.add(parseHeaderSet(headerSet));
            }
            return new ScenarioConfig(
                    new BrokerEndpoint(host, port, login, passcode, tls),
                    new DestinationSettings(destinationType, destinationName, destinationCount),
                    new ProducerSettings(messageSize, persistent, persistentHeader, syncSend, headers, messagesPerConnection, producerSleepMs),
                    new ConsumerSettings(ackMode, durable, selector, consumerPrefix, consumerSleepMs),
                    producers,
                    consumers,
                    ioThreads,
                    Duration.ofSeconds(sampleIntervalSeconds),
                    sampleCount,
                    Duration.ofSeconds(warmupSeconds),
                    displayErrors,
                    logNetwork,
                    logFrames,
                    StompFrameDecoder.DEFAULT_MAX_FRAME_SIZE_BYTES,
                    Duration.ofSeconds(10));
        }
        catch (IllegalArgumentException e) {
            if (spec == null) {
                throw e;
            }
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    static List<HeaderSpec> parseHeaderSet(String headerSet) {
        return Arrays.stream(headerSet.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(HeaderSpec::parse)
                .toList();
    }

    private void summarize(List<ScenarioSample> samples) {
        if (samples.isEmpty()) {
            LOGGER.info("No samples taken");
            return;
        }
        double produced = samples.stream().mapToDouble(ScenarioSample::producedPerSecond).average().orElse(0);
        double consumed = samples.stream().mapToDouble(ScenarioSample::consumedPerSecond).average().orElse(0);
        long errors = samples.stream().mapToLong(ScenarioSample::errors).sum();
        LOGGER.info(String.format(Locale.ROOT, "Summary over %d samples: produced %.1f msg/s, consumed %.1f msg/s, errors %d",
                samples.size(), produced, consumed, errors));
    }

    static class NotNegativeIntegerTypeConverter implements CommandLine.ITypeConverter<Integer> {

        @Override
        public Integer convert(String input) {
            try {
                int value = Integer.parseInt(input);
                if (value < 0) {
                    throw new CommandLine.TypeConversionException(input + " is negative");
                }
                return value;
            }
            catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(input + " is not a number");
            }
        }
    }

    static class PositiveIntegerTypeConverter implements CommandLine.ITypeConverter<Integer> {

        @Override
        public Integer convert(String input) {
            try {
                int value = Integer.parseInt(input);
                if (value <= 0) {
                    throw new CommandLine.TypeConversionException(input + " is not positive");
                }
                return value;
            }
            catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(input + " is not a number");
            }
        }
    }

    static class NotNegativeLongTypeConverter implements CommandLine.ITypeConverter<Long> {

        @Override
        public Long convert(String input) {
            try {
                long value = Long.parseLong(input);
                if (value < 0) {
                    throw new CommandLine.TypeConversionException(input + " is negative");
                }
                return value;
            }
            catch (NumberFormatException e) {
                throw new CommandLine.TypeConversionException(input + " is not a number");
            }
        }
    }

    static class AckModeTypeConverter implements CommandLine.ITypeConverter<AckMode> {

        @Override
        public AckMode convert(String input) {
            try {
                return AckMode.parse(input);
            }
            catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    static class HeaderSpecTypeConverter implements CommandLine.ITypeConverter<HeaderSpec> {

        @Override
        public HeaderSpec convert(String input) {
            try {
                return HeaderSpec.parse(input);
            }
            catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
