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

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;
import dev.mars.reliableamqp.api.transport.AmqpChannel;
import dev.mars.reliableamqp.api.transport.AmqpConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link AmqpConnection} over a RabbitMQ {@link Connection}.
 *
 * <p>Tracks {@code connection.blocked} notifications, raised when the broker hits a
 * memory or disk alarm; channels created here refuse to publish while blocked.</p>
 */
public class RabbitMqConnection implements AmqpConnection {
    private static final Logger logger = LoggerFactory.getLogger(RabbitMqConnection.class);

    private final Connection connection;
    private final AtomicBoolean blocked = new AtomicBoolean(false);

    public RabbitMqConnection(Connection connection) {
        this.connection = Objects.requireNonNull(connection, "Connection cannot be null");
        connection.addBlockedListener(
            reason -> {
                blocked.set(true);
                logger.warn("RabbitMQ blocked the connection: {}", reason);
            },
            () -> {
                blocked.set(false);
                logger.info("RabbitMQ unblocked the connection");
            });
    }

    @Override
    public AmqpChannel createChannel() throws IOException {
        Channel channel;
        try {
            channel = connection.createChannel();
        } catch (ShutdownSignalException e) {
            throw new IOException("Connection is closed: " + e.getMessage(), e);
        }
        if (channel == null) {
            throw new IOException("No channel available on connection " + connection.getClientProvidedName());
        }
        logger.debug("Created channel {}", channel.getChannelNumber());
        return new RabbitMqChannel(channel, blocked::get);
    }

    public boolean isBlocked() {
        return blocked.get();
    }

    @Override
    public void close() throws IOException {
        if (!connection.isOpen()) {
            logger.debug("Connection already closed");
            return;
        }
        try {
            connection.close();
        } catch (ShutdownSignalException e) {
            throw new IOException("Failed to close connection: " + e.getMessage(), e);
        }
    }
}
