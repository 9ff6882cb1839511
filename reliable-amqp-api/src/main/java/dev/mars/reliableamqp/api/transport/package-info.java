/**
 * Service-provider interface over the AMQP transport.
 *
 * <p>The reliability layer only talks to the broker through
 * {@link dev.mars.reliableamqp.api.transport.AmqpConnector},
 * {@link dev.mars.reliableamqp.api.transport.AmqpConnection} and
 * {@link dev.mars.reliableamqp.api.transport.AmqpChannel}. The
 * {@code reliable-amqp-rabbitmq} module provides the RabbitMQ implementation.</p>
 */
package dev.mars.reliableamqp.api.transport;
