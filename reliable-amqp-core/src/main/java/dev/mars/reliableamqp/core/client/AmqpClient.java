/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.reliableamqp.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.reliableamqp.api.error.AmqpConnectionException;
import dev.mars.reliableamqp.api.error.AmqpException;
import dev.mars.reliableamqp.api.error.AmqpPublisherException;
import dev.mars.reliableamqp.api.error.AmqpUninitializedException;
import dev.mars.reliableamqp.api.transport.AmqpChannel;
import dev.mars.reliableamqp.api.transport.AmqpConnection;
import dev.mars.reliableamqp.api.transport.AmqpConnector;
import dev.mars.reliableamqp.core.codec.JsonCodec;
import dev.mars.reliableamqp.core.config.AmqpConfig;
import dev.mars.reliableamqp.core.consumer.Consumer;
import dev.mars.reliableamqp.core.metrics.AmqpClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the AMQP connection and the single channel shared by every registered
 * consumer and by {@link #publish}.
 *
 * <p>Lifecycle: {@code DISCONNECTED -> CONNECTING -> CONNECTED -> CLOSED}. A failed
 * start returns the client to {@code DISCONNECTED}; there is no automatic
 * reconnect. A stopped client may be started again.</p>
 *
 * <pre>{@code
 * AmqpClient client = new AmqpClient(AmqpConfig.fromSystemEnvironment(),
 *     new RabbitMqConnector(), List.of(orderConsumer));
 * client.start().join();
 * client.publish("orders", "order.created", event);
 * client.stop().join();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class AmqpClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(AmqpClient.class);

    private static final AtomicInteger CLIENT_IDS = new AtomicInteger();

    private final AmqpConfig config;
    private final AmqpConnector connector;
    private final List<Consumer<?>> consumers;
    private final JsonCodec codec;
    private final AmqpClientMetrics metrics;
    private final ClientOptions options;
    private final int clientId = CLIENT_IDS.incrementAndGet();

    private final AtomicReference<ClientState> state = new AtomicReference<>(ClientState.DISCONNECTED);
    private final Object lifecycleLock = new Object();

    private volatile AmqpConnection connection;
    private volatile AmqpChannel channel;
    private volatile ExecutorService executor;
    private CompletableFuture<Void> startFuture;
    private CompletableFuture<Void> stopFuture;

    public AmqpClient(AmqpConfig config, AmqpConnector connector, List<? extends Consumer<?>> consumers) {
        this(config, connector, consumers, new JsonCodec(), null, ClientOptions.defaults());
    }

    public AmqpClient(AmqpConfig config, AmqpConnector connector, List<? extends Consumer<?>> consumers,
                      JsonCodec codec, AmqpClientMetrics metrics, ClientOptions options) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.connector = Objects.requireNonNull(connector, "Connector cannot be null");
        this.consumers = List.copyOf(Objects.requireNonNull(consumers, "Consumers cannot be null"));
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
        this.metrics = metrics;
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        logger.info("Created AMQP client for {} with {} consumer(s), options: {}",
            config.getRedactedConnectionString(), this.consumers.size(), options);
    }

    /**
     * Opens the connection and the shared channel, then starts every consumer
     * concurrently on that channel.
     *
     * @return a future that completes once every consumer is registered, or fails with
     *         {@link AmqpConnectionException} after releasing whatever was opened
     */
    public CompletableFuture<Void> start() {
        synchronized (lifecycleLock) {
            ClientState current = state.get();
            if (current == ClientState.CLOSED && stopFuture != null && !stopFuture.isDone()) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Cannot start AMQP client while it is stopping"));
            }
            if (current != ClientState.DISCONNECTED && current != ClientState.CLOSED) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Cannot start AMQP client in state " + current));
            }
            state.set(ClientState.CONNECTING);
            stopFuture = null;

            String target = config.getRedactedConnectionString();
            logger.info("Starting AMQP client for {}", target);

            ExecutorService startExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "amqp-client-" + clientId + "-" + System.nanoTime());
                t.setDaemon(true);
                return t;
            });
            this.executor = startExecutor;

            startFuture = CompletableFuture
                .supplyAsync(this::openChannel, startExecutor)
                .thenCompose(ch -> startConsumers(ch, startExecutor))
                .handle((result, error) -> {
                    if (error == null) {
                        state.set(ClientState.CONNECTED);
                        logger.info("AMQP client connected to {}, {} consumer(s) started", target, consumers.size());
                        return null;
                    }
                    throw startFailed(unwrap(error), target, startExecutor);
                });
            return startFuture;
        }
    }

    private AmqpChannel openChannel() {
        try {
            AmqpConnection conn = connector.connect(config.getConnectionString());
            this.connection = conn;
            logger.debug("AMQP connection established, creating channel");
            AmqpChannel ch = conn.createChannel();
            this.channel = ch;
            return ch;
        } catch (IOException e) {
            throw new CompletionException(e);
        }
    }

    private CompletableFuture<Void> startConsumers(AmqpChannel ch, ExecutorService startExecutor) {
        CompletableFuture<?>[] started = consumers.stream()
            .map(consumer -> CompletableFuture.supplyAsync(() -> consumer.start(ch), startExecutor)
                .thenCompose(future -> future))
            .toArray(CompletableFuture<?>[]::new);
        return CompletableFuture.allOf(started);
    }

    private AmqpConnectionException startFailed(Throwable cause, String target, ExecutorService startExecutor) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        logger.error("Failed to start AMQP client for {}: {}", target, reason);

        AmqpConnectionException failure = new AmqpConnectionException(reason, target, cause);
        try {
            closeResources(channel, connection);
        } catch (AmqpException e) {
            failure.addSuppressed(e);
        }
        channel = null;
        connection = null;
        consumers.forEach(Consumer::detach);
        startExecutor.shutdown();
        state.set(ClientState.DISCONNECTED);
        return failure;
    }

    /**
     * Serializes the payload to JSON and publishes it with the topic as routing key.
     *
     * @throws AmqpUninitializedException if the client is not connected; nothing is sent
     * @throws AmqpPublisherException if the payload cannot be encoded, the send fails,
     *         or the transport refuses the message
     */
    public void publish(String exchange, String topic, Object payload) {
        ClientState current = state.get();
        AmqpChannel ch = channel;
        if (current != ClientState.CONNECTED || ch == null) {
            throw new AmqpUninitializedException(current.name());
        }
        Objects.requireNonNull(exchange, "Exchange cannot be null");
        Objects.requireNonNull(topic, "Topic cannot be null");

        byte[] body;
        try {
            body = codec.encode(payload);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize payload for exchange {} topic {}: {}", exchange, topic, e.getMessage());
            recordPublishFailed(exchange);
            throw new AmqpPublisherException(exchange, topic, payload, e);
        }

        boolean accepted;
        try {
            accepted = ch.publish(exchange, topic, body);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to publish to exchange {} topic {}: {}", exchange, topic, e.getMessage());
            recordPublishFailed(exchange);
            throw new AmqpPublisherException(exchange, topic, payload, e);
        }
        if (!accepted) {
            logger.warn("Transport refused message for exchange {} topic {}", exchange, topic);
            recordPublishFailed(exchange);
            throw new AmqpPublisherException(exchange, topic, payload);
        }

        if (metrics != null) {
            metrics.recordMessagePublished(exchange);
        }
        logger.debug("Published {} bytes to exchange {} topic {}", body.length, exchange, topic);
    }

    private void recordPublishFailed(String exchange) {
        if (metrics != null) {
            metrics.recordPublishFailed(exchange);
        }
    }

    /**
     * Waits for in-flight deliveries, bounded by the shutdown timeout, then closes the
     * channel and the connection. Completes immediately when the client never started.
     *
     * @return a future failing with {@link AmqpException} if either close failed; every
     *         close failure is attached as a suppressed exception
     */
    public CompletableFuture<Void> stop() {
        CompletableFuture<Void> pendingStart;
        synchronized (lifecycleLock) {
            switch (state.get()) {
                case DISCONNECTED:
                    logger.debug("AMQP client is not started, nothing to stop");
                    return CompletableFuture.completedFuture(null);
                case CLOSED:
                    return stopFuture != null ? stopFuture : CompletableFuture.completedFuture(null);
                case CONNECTING:
                    pendingStart = startFuture;
                    break;
                case CONNECTED:
                    state.set(ClientState.CLOSED);
                    stopFuture = drainAndClose();
                    return stopFuture;
                default:
                    throw new IllegalStateException("Unknown client state: " + state.get());
            }
        }

        logger.debug("AMQP client is still connecting, stop will run once start completes");
        return pendingStart.handle((result, error) -> null).thenCompose(ignored -> stop());
    }

    private CompletableFuture<Void> drainAndClose() {
        AmqpChannel ch = channel;
        AmqpConnection conn = connection;
        ExecutorService stopExecutor = executor;
        Duration timeout = options.getShutdownTimeout();
        logger.info("Stopping AMQP client, waiting up to {} for in-flight deliveries", timeout);

        CompletableFuture<?>[] idle = consumers.stream()
            .map(Consumer::whenIdle)
            .toArray(CompletableFuture<?>[]::new);

        return CompletableFuture.allOf(idle)
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((result, error) -> {
                if (error != null) {
                    logger.warn("Shutdown timeout {} expired with {} deliveries still in flight",
                        timeout, getInFlightCount());
                }
                return null;
            })
            .thenRun(() -> closeResources(ch, conn))
            .whenComplete((result, error) -> {
                channel = null;
                connection = null;
                consumers.forEach(Consumer::detach);
                if (stopExecutor != null) {
                    stopExecutor.shutdown();
                }
                if (error == null) {
                    logger.info("AMQP client stopped");
                } else {
                    logger.error("AMQP client stopped with errors: {}", unwrap(error).getMessage());
                }
            });
    }

    /**
     * Closes the channel, then the connection. Both are attempted.
     */
    private void closeResources(AmqpChannel ch, AmqpConnection conn) {
        List<Exception> failures = new ArrayList<>();
        if (ch != null) {
            try {
                ch.close();
                logger.debug("AMQP channel closed");
            } catch (Exception e) {
                logger.error("Failed to close AMQP channel: {}", e.getMessage());
                failures.add(e);
            }
        }
        if (conn != null) {
            try {
                conn.close();
                logger.debug("AMQP connection closed");
            } catch (Exception e) {
                logger.error("Failed to close AMQP connection: {}", e.getMessage());
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            AmqpException failure = new AmqpException("Failed to close AMQP resources",
                Map.of("failures", failures.size()));
            failures.forEach(failure::addSuppressed);
            throw failure;
        }
    }

    /**
     * Stops the client and waits for it.
     */
    @Override
    public void close() {
        try {
            stop().join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    public ClientState getState() {
        return state.get();
    }

    public boolean isConnected() {
        return state.get() == ClientState.CONNECTED;
    }

    public int getInFlightCount() {
        return consumers.stream().mapToInt(Consumer::getInFlightCount).sum();
    }

    public List<Consumer<?>> getConsumers() {
        return consumers;
    }
}
