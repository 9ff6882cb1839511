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
package dev.mars.reliableamqp.core.consumer;

import dev.mars.reliableamqp.api.ConsumerBinding;
import dev.mars.reliableamqp.api.Message;
import dev.mars.reliableamqp.api.MessageHandler;
import dev.mars.reliableamqp.api.PayloadValidator;
import dev.mars.reliableamqp.api.SimpleMessage;
import dev.mars.reliableamqp.api.error.HandlerFailure;
import dev.mars.reliableamqp.api.transport.AmqpChannel;
import dev.mars.reliableamqp.api.transport.Delivery;
import dev.mars.reliableamqp.api.transport.ExchangeType;
import dev.mars.reliableamqp.api.transport.QueueOptions;
import dev.mars.reliableamqp.core.codec.JsonCodec;
import dev.mars.reliableamqp.core.metrics.AmqpClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Binds one queue to a topic exchange and settles every delivery from it.
 *
 * <p>For each delivery the payload is decoded and validated, then handed to the
 * business handler. The outcome decides the settlement:</p>
 * <ul>
 *   <li>invalid payload: nack without requeue, handler not called</li>
 *   <li>handler success: ack</li>
 *   <li>retriable failure: nack, requeued while the delivery count is below the retry limit</li>
 *   <li>any other failure: nack without requeue</li>
 * </ul>
 *
 * <p>The channel is borrowed from the client; a consumer never closes it.</p>
 *
 * @param <T> The type of message payload
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class Consumer<T> {
    private static final Logger logger = LoggerFactory.getLogger(Consumer.class);

    private final ConsumerBinding binding;
    private final Class<T> payloadType;
    private final PayloadValidator<T> validator;
    private final MessageHandler<T> handler;
    private final JsonCodec codec;
    private final AmqpClientMetrics metrics;

    private final AtomicReference<BindingState> state = new AtomicReference<>(BindingState.UNBOUND);
    private final Set<CompletableFuture<AckDecision>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile String consumerTag;

    public Consumer(ConsumerBinding binding, Class<T> payloadType,
                    PayloadValidator<T> validator, MessageHandler<T> handler) {
        this(binding, payloadType, validator, handler, new JsonCodec(), null);
    }

    public Consumer(ConsumerBinding binding, Class<T> payloadType, PayloadValidator<T> validator,
                    MessageHandler<T> handler, JsonCodec codec, AmqpClientMetrics metrics) {
        this.binding = Objects.requireNonNull(binding, "Binding cannot be null");
        this.payloadType = Objects.requireNonNull(payloadType, "Payload type cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.handler = Objects.requireNonNull(handler, "Handler cannot be null");
        this.codec = Objects.requireNonNull(codec, "Codec cannot be null");
        this.metrics = metrics;
        logger.debug("Created consumer for queue {} bound to exchange {} with topic {}",
            binding.queue(), binding.exchange(), binding.topic());
    }

    /**
     * Declares the quorum queue, the topic exchange and the binding, then registers
     * the delivery callback.
     *
     * @param channel the shared channel, borrowed for the lifetime of the subscription
     * @return a future completing once the callback is registered
     */
    public CompletableFuture<Void> start(AmqpChannel channel) {
        Objects.requireNonNull(channel, "Channel cannot be null");
        if (!state.compareAndSet(BindingState.UNBOUND, BindingState.STARTING)) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                "Consumer for queue " + binding.queue() + " is already " + state.get()));
        }

        try {
            channel.assertQueue(binding.queue(), QueueOptions.quorum());
            channel.assertExchange(binding.exchange(), ExchangeType.TOPIC, true);
            channel.bindQueue(binding.queue(), binding.exchange(), binding.topic());
            state.set(BindingState.BOUND);
            logger.debug("Declared queue {} bound to exchange {} with topic {}",
                binding.queue(), binding.exchange(), binding.topic());

            consumerTag = channel.consume(binding.queue(), delivery -> onDelivery(channel, delivery));
            state.set(BindingState.CONSUMING);
            logger.info("Started consuming from queue {} (consumer tag: {})", binding.queue(), consumerTag);
            return CompletableFuture.completedFuture(null);
        } catch (Exception e) {
            state.set(BindingState.UNBOUND);
            consumerTag = null;
            logger.error("Failed to start consumer for queue {}: {}", binding.queue(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Forgets the channel after it was closed by its owner, so the consumer can be
     * started again on a new one.
     */
    public void detach() {
        BindingState previous = state.getAndSet(BindingState.UNBOUND);
        consumerTag = null;
        if (previous != BindingState.UNBOUND) {
            logger.debug("Detached consumer for queue {} (was {})", binding.queue(), previous);
        }
    }

    /**
     * Runs the decision procedure for one delivery. The returned future completes
     * once the message has been acked or nacked; it never completes exceptionally.
     */
    CompletableFuture<AckDecision> onDelivery(AmqpChannel channel, Delivery delivery) {
        if (delivery == null) {
            logger.debug("Consumer for queue {} received a cancellation signal", binding.queue());
            return CompletableFuture.completedFuture(AckDecision.IGNORED);
        }

        CompletableFuture<AckDecision> decision = process(channel, delivery)
            .whenComplete((d, error) -> {
                if (metrics != null && d != null) {
                    metrics.recordDecision(binding.queue(), d);
                }
            });
        inFlight.add(decision);
        decision.whenComplete((d, error) -> inFlight.remove(decision));
        return decision;
    }

    private CompletableFuture<AckDecision> process(AmqpChannel channel, Delivery delivery) {
        T payload;
        List<String> violations;
        try {
            payload = codec.decode(delivery.body(), payloadType);
        } catch (IOException e) {
            return rejectInvalid(channel, delivery, List.of("payload is not valid JSON for "
                + payloadType.getSimpleName() + ": " + e.getMessage()));
        }
        if (payload == null) {
            return rejectInvalid(channel, delivery, List.of("payload is null"));
        }
        try {
            violations = validator.validate(payload);
        } catch (Exception e) {
            logger.error("Validator failed for message {} on queue {}", delivery.deliveryTag(), binding.queue(), e);
            violations = List.of("validator failed: " + e.getMessage());
        }
        if (violations != null && !violations.isEmpty()) {
            return rejectInvalid(channel, delivery, violations);
        }

        Message<T> message = new SimpleMessage<>(payload, delivery.headers(),
            delivery.exchange(), delivery.routingKey(), delivery.redelivered());

        long startTime = System.nanoTime();
        CompletableFuture<Void> processing;
        try {
            processing = handler.handle(message);
            if (processing == null) {
                processing = CompletableFuture.failedFuture(
                    new IllegalStateException("Message handler returned null instead of a future"));
            }
        } catch (Exception e) {
            processing = CompletableFuture.failedFuture(e);
        }

        return processing.handle((result, error) -> {
            if (metrics != null) {
                metrics.recordProcessingTime(binding.queue(), Duration.ofNanos(System.nanoTime() - startTime));
            }
            if (error == null) {
                logger.debug("Message {} processed successfully on queue {}", delivery.deliveryTag(), binding.queue());
                return settle(AckDecision.ACKED, delivery, () -> channel.ack(delivery));
            }
            return reject(channel, delivery, HandlerFailure.classify(error));
        });
    }

    private AckDecision reject(AmqpChannel channel, Delivery delivery, HandlerFailure failure) {
        int deliveryCount = DeliveryCount.of(delivery);
        boolean requeue = failure.shouldRequeue(deliveryCount);
        String reason = failure.cause() != null ? failure.cause().getMessage() : "unknown";

        switch (failure.kind()) {
            case RETRIABLE:
                logger.warn("Retriable failure for message {} on queue {} (delivery count {}, retry limit {}), {}: {}",
                    delivery.deliveryTag(), binding.queue(), deliveryCount, failure.retryLimit(),
                    requeue ? "requeueing" : "retry limit reached, rejecting", reason);
                break;
            case FATAL:
                logger.error("Fatal failure for message {} on queue {}, rejecting: {}",
                    delivery.deliveryTag(), binding.queue(), reason);
                break;
            default:
                throw new IllegalStateException("Unknown failure kind: " + failure.kind());
        }

        AckDecision decision = requeue ? AckDecision.REQUEUED : AckDecision.REJECTED;
        return settle(decision, delivery, () -> channel.nack(delivery, false, requeue));
    }

    private CompletableFuture<AckDecision> rejectInvalid(AmqpChannel channel, Delivery delivery,
                                                         List<String> violations) {
        logger.warn("Rejecting invalid message {} on queue {}: {}",
            delivery.deliveryTag(), binding.queue(), violations);
        return CompletableFuture.completedFuture(
            settle(AckDecision.REJECTED_INVALID, delivery, () -> channel.nack(delivery, false, false)));
    }

    private AckDecision settle(AckDecision decision, Delivery delivery, ChannelAction action) {
        try {
            action.run();
            return decision;
        } catch (Exception e) {
            logger.error("Failed to settle message {} on queue {} as {}: {}",
                delivery.deliveryTag(), binding.queue(), decision, e.getMessage());
            return AckDecision.ACK_FAILED;
        }
    }

    /**
     * Returns a future completing when every delivery in progress right now has
     * been settled.
     */
    public CompletableFuture<Void> whenIdle() {
        return CompletableFuture.allOf(inFlight.toArray(new CompletableFuture<?>[0]));
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public ConsumerBinding getBinding() {
        return binding;
    }

    public BindingState getState() {
        return state.get();
    }

    public String getConsumerTag() {
        return consumerTag;
    }

    @FunctionalInterface
    private interface ChannelAction {
        void run() throws IOException;
    }

    @Override
    public String toString() {
        return "Consumer{" +
                "binding=" + binding +
                ", payloadType=" + payloadType.getSimpleName() +
                ", state=" + state.get() +
                '}';
    }
}
