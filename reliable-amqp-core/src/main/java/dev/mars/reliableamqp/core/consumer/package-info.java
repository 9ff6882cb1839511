/**
 * Per-binding acknowledgment logic.
 *
 * <p>A {@link dev.mars.reliableamqp.core.consumer.Consumer} settles every delivery with
 * exactly one ack or nack:</p>
 * <ul>
 *   <li>{@link dev.mars.reliableamqp.core.consumer.AckDecision#REJECTED_INVALID} - payload failed decoding or validation</li>
 *   <li>{@link dev.mars.reliableamqp.core.consumer.AckDecision#ACKED} - handler completed normally</li>
 *   <li>{@link dev.mars.reliableamqp.core.consumer.AckDecision#REQUEUED} - retriable failure below its retry limit</li>
 *   <li>{@link dev.mars.reliableamqp.core.consumer.AckDecision#REJECTED} - fatal failure, or retry limit reached</li>
 * </ul>
 *
 * <p>The retry budget is read from the broker's {@code x-delivery-count} header by
 * {@link dev.mars.reliableamqp.core.consumer.DeliveryCount}.</p>
 */
package dev.mars.reliableamqp.core.consumer;
