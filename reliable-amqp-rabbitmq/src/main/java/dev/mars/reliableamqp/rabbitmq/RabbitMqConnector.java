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

import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import dev.mars.reliableamqp.api.transport.AmqpConnection;
import dev.mars.reliableamqp.api.transport.AmqpConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Opens RabbitMQ connections from an {@code amqp://} or {@code amqps://} URI.
 *
 * <p>Automatic connection recovery is disabled: a lost connection surfaces to the
 * application instead of being retried behind its back.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class RabbitMqConnector implements AmqpConnector {
    private static final Logger logger = LoggerFactory.getLogger(RabbitMqConnector.class);

    public static final String CONNECTION_NAME = "reliable-amqp";

    private final Supplier<ConnectionFactory> connectionFactorySupplier;

    public RabbitMqConnector() {
        this(ConnectionFactory::new);
    }

    /**
     * @param connectionFactorySupplier supplies a pre-configured factory per connection,
     *                                  e.g. with custom timeouts or SSL context
     */
    public RabbitMqConnector(Supplier<ConnectionFactory> connectionFactorySupplier) {
        this.connectionFactorySupplier = Objects.requireNonNull(connectionFactorySupplier,
            "Connection factory supplier cannot be null");
    }

    @Override
    public AmqpConnection connect(String target) throws IOException {
        Objects.requireNonNull(target, "Target cannot be null");
        ConnectionFactory factory = connectionFactorySupplier.get();
        try {
            factory.setUri(target);
        } catch (URISyntaxException e) {
            // the exception message echoes the input, which may hold a password
            throw new IOException("Invalid AMQP URI: " + e.getReason(), e);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid AMQP URI: " + e.getMessage(), e);
        } catch (GeneralSecurityException e) {
            throw new IOException("Failed to configure TLS: " + e.getMessage(), e);
        }
        factory.setAutomaticRecoveryEnabled(false);

        try {
            Connection connection = factory.newConnection(CONNECTION_NAME);
            logger.info("Connected to RabbitMQ at {}:{}{}", factory.getHost(), factory.getPort(), factory.getVirtualHost());
            return new RabbitMqConnection(connection);
        } catch (TimeoutException e) {
            throw new IOException("Timed out connecting to " + factory.getHost() + ":" + factory.getPort(), e);
        }
    }
}
