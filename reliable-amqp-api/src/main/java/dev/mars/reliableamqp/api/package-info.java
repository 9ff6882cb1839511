/**
 * Contracts of the reliable AMQP layer.
 *
 * <p>This package holds the types that application code wires together when
 * subscribing to a topic exchange:</p>
 *
 * <ul>
 *   <li>{@link dev.mars.reliableamqp.api.ConsumerBinding} - queue, exchange and topic of one subscription</li>
 *   <li>{@link dev.mars.reliableamqp.api.PayloadValidator} - shape check run before the handler</li>
 *   <li>{@link dev.mars.reliableamqp.api.MessageHandler} - business callback</li>
 *   <li>{@link dev.mars.reliableamqp.api.Message} - validated message handed to the handler</li>
 * </ul>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * ConsumerBinding binding = ConsumerBinding.of("orders.queue", "orders.exchange", "orders.created");
 *
 * MessageHandler<OrderCreated> handler = message -> {
 *     if (!inventory.isAvailable()) {
 *         return CompletableFuture.failedFuture(
 *             new AmqpRetriableException(new IllegalStateException("inventory offline"), 3));
 *     }
 *     return inventory.reserve(message.getPayload());
 * };
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 * @version 1.0
 */
package dev.mars.reliableamqp.api;
