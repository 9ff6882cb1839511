/**
 * RabbitMQ implementation of the transport interfaces, built on
 * {@code com.rabbitmq:amqp-client}.
 */
package dev.mars.reliableamqp.rabbitmq;
