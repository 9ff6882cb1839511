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
package dev.mars.reliableamqp.api.transport;

import java.io.IOException;

/**
 * Low-level channel operations the reliability layer relies on.
 *
 * <p>One channel is shared by every consumer and the publisher of a client, so
 * implementations must tolerate calls from several threads.</p>
 */
public interface AmqpChannel extends AutoCloseable {

    /**
     * Declares a queue, creating it if missing.
     */
    void assertQueue(String queue, QueueOptions options) throws IOException;

    /**
     * Declares an exchange, creating it if missing.
     */
    void assertExchange(String exchange, ExchangeType type, boolean durable) throws IOException;

    /**
     * Binds a queue to an exchange with a routing pattern.
     */
    void bindQueue(String queue, String exchange, String pattern) throws IOException;

    /**
     * Registers a callback receiving every delivery from the queue. Messages must be
     * settled explicitly with {@link #ack} or {@link #nack}.
     *
     * @return the consumer tag assigned by the transport
     */
    String consume(String queue, DeliveryCallback callback) throws IOException;

    /**
     * Acknowledges a single delivery.
     */
    void ack(Delivery delivery) throws IOException;

    /**
     * Rejects a delivery.
     *
     * @param delivery the delivery to reject
     * @param allUpTo  also reject every earlier unsettled delivery
     * @param requeue  put the message back on the queue instead of discarding or dead-lettering it
     */
    void nack(Delivery delivery, boolean allUpTo, boolean requeue) throws IOException;

    /**
     * Publishes a message.
     *
     * @return false when the transport cannot accept more data right now (backpressure)
     */
    boolean publish(String exchange, String routingKey, byte[] body) throws IOException;

    @Override
    void close() throws IOException;
}
