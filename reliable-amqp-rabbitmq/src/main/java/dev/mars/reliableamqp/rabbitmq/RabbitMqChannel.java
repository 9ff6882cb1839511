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
package dev.mars.reliableamqp.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import dev.mars.reliableamqp.api.transport.AmqpChannel;
import dev.mars.reliableamqp.api.transport.Delivery;
import dev.mars.reliableamqp.api.transport.DeliveryCallback;
import dev.mars.reliableamqp.api.transport.ExchangeType;
import dev.mars.reliableamqp.api.transport.QueueOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * {@link AmqpChannel} over a RabbitMQ {@link Channel}.
 *
 * <p>Consumers use manual acknowledgment. Published messages are persistent JSON.
 * Frame-writing calls are serialized because a RabbitMQ channel must not be
 * published to from several threads at once.</p>
 */
public class RabbitMqChannel implements AmqpChannel {
    private static final Logger logger = LoggerFactory.getLogger(RabbitMqChannel.class);

    public static final String CONTENT_TYPE = "application/json";
    public static final int PERSISTENT_DELIVERY_MODE = 2;

    private static final AMQP.BasicProperties PUBLISH_PROPERTIES = new AMQP.BasicProperties.Builder()
        .contentType(CONTENT_TYPE)
        .deliveryMode(PERSISTENT_DELIVERY_MODE)
        .build();

    private final Channel channel;
    private final BooleanSupplier blocked;
    private final Object writeLock = new Object();

    public RabbitMqChannel(Channel channel, BooleanSupplier blocked) {
        this.channel = Objects.requireNonNull(channel, "Channel cannot be null");
        this.blocked = Objects.requireNonNull(blocked, "Blocked supplier cannot be null");
    }

    @Override
    public void assertQueue(String queue, QueueOptions options) throws IOException {
        call(() -> channel.queueDeclare(queue, options.durable(), false, false, options.arguments()));
        logger.debug("Declared queue {} (durable: {}, arguments: {})", queue, options.durable(), options.arguments());
    }

    @Override
    public void assertExchange(String exchange, ExchangeType type, boolean durable) throws IOException {
        call(() -> channel.exchangeDeclare(exchange, type.getValue(), durable));
        logger.debug("Declared {} exchange {} (durable: {})", type.getValue(), exchange, durable);
    }

    @Override
    public void bindQueue(String queue, String exchange, String pattern) throws IOException {
        call(() -> channel.queueBind(queue, exchange, pattern));
        logger.debug("Bound queue {} to exchange {} with pattern {}", queue, exchange, pattern);
    }

    @Override
    public String consume(String queue, DeliveryCallback callback) throws IOException {
        Objects.requireNonNull(callback, "Callback cannot be null");
        return call(() -> channel.basicConsume(queue, false,
            (consumerTag, message) -> dispatch(queue, callback, toDelivery(message)),
            consumerTag -> {
                logger.warn("Consumer {} on queue {} was cancelled by the broker", consumerTag, queue);
                dispatch(queue, callback, null);
            }));
    }

    private void dispatch(String queue, DeliveryCallback callback, Delivery delivery) {
        try {
            callback.onDelivery(delivery);
        } catch (RuntimeException e) {
            // an exception escaping here would make the client close the channel
            logger.error("Delivery callback for queue {} failed", queue, e);
        }
    }

    @Override
    public void ack(Delivery delivery) throws IOException {
        synchronized (writeLock) {
            call(() -> {
                channel.basicAck(delivery.deliveryTag(), false);
                return null;
            });
        }
    }

    @Override
    public void nack(Delivery delivery, boolean allUpTo, boolean requeue) throws IOException {
        synchronized (writeLock) {
            call(() -> {
                channel.basicNack(delivery.deliveryTag(), allUpTo, requeue);
                return null;
            });
        }
    }

    /**
     * @return false without sending anything while the broker has blocked the connection
     */
    @Override
    public boolean publish(String exchange, String routingKey, byte[] body) throws IOException {
        if (blocked.getAsBoolean()) {
            logger.debug("Connection is blocked, refusing publish to exchange {} with routing key {}", exchange, routingKey);
            return false;
        }
        synchronized (writeLock) {
            call(() -> {
                channel.basicPublish(exchange, routingKey, PUBLISH_PROPERTIES, body);
                return null;
            });
        }
        return true;
    }

    @Override
    public void close() throws IOException {
        if (!channel.isOpen()) {
            logger.debug("Channel {} already closed", channel.getChannelNumber());
            return;
        }
        try {
            channel.close();
        } catch (TimeoutException e) {
            throw new IOException("Timed out closing channel " + channel.getChannelNumber(), e);
        } catch (ShutdownSignalException e) {
            throw new IOException("Failed to close channel: " + e.getMessage(), e);
        }
    }

    static Delivery toDelivery(com.rabbitmq.client.Delivery message) {
        Envelope envelope = message.getEnvelope();
        AMQP.BasicProperties properties = message.getProperties();
        Map<String, Object> headers = properties != null ? properties.getHeaders() : null;
        return new Delivery(envelope.getDeliveryTag(), envelope.getExchange(), envelope.getRoutingKey(),
            envelope.isRedeliver(), normalizeHeaders(headers), message.getBody());
    }

    /**
     * Converts AMQP long strings to {@link String} so header values read like plain Java values.
     */
    static Map<String, Object> normalizeHeaders(Map<String, Object> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> normalized = new HashMap<>(headers.size());
        headers.forEach((name, value) ->
            normalized.put(name, value instanceof LongString ? value.toString() : value));
        return normalized;
    }

    private <R> R call(ChannelCall<R> call) throws IOException {
        try {
            return call.run();
        } catch (ShutdownSignalException e) {
            throw new IOException("Channel is closed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ChannelCall<R> {
        R run() throws IOException;
    }
}
