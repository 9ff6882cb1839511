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
import dev.mars.reliableamqp.api.MessageHandler;
import dev.mars.reliableamqp.api.PayloadValidator;
import dev.mars.reliableamqp.api.error.AmqpFatalException;
import dev.mars.reliableamqp.api.error.AmqpRetriableException;
import dev.mars.reliableamqp.api.transport.AmqpChannel;
import dev.mars.reliableamqp.api.transport.Delivery;
import dev.mars.reliableamqp.api.transport.DeliveryCallback;
import dev.mars.reliableamqp.api.transport.ExchangeType;
import dev.mars.reliableamqp.api.transport.QueueOptions;
import dev.mars.reliableamqp.core.codec.JsonCodec;
import dev.mars.reliableamqp.core.metrics.AmqpClientMetrics;
import dev.mars.reliableamqp.test.categories.TestCategories;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the acknowledgment decision procedure, using a mocked channel.
 */
@Tag(TestCategories.CORE)
class ConsumerTest {

    private static final ConsumerBinding BINDING = ConsumerBinding.of("orders.queue", "orders", "order.*");
    private static final String VALID_BODY = "{\"orderId\":\"A-1\",\"quantity\":2}";

    public record OrderEvent(String orderId, int quantity) {
    }

    private AutoCloseable mockitoCloseable;

    @Mock
    private AmqpChannel channel;

    private final AtomicInteger handlerCalls = new AtomicInteger();

    @BeforeEach
    void setUp() throws Exception {
        mockitoCloseable = MockitoAnnotations.openMocks(this);
        when(channel.consume(eq(BINDING.queue()), any())).thenReturn("ctag-1");
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mockitoCloseable != null) {
            mockitoCloseable.close();
        }
    }

    private Consumer<OrderEvent> consumer(MessageHandler<OrderEvent> handler) {
        return new Consumer<>(BINDING, OrderEvent.class, PayloadValidator.acceptAll(), message -> {
            handlerCalls.incrementAndGet();
            return handler.handle(message);
        });
    }

    private static Delivery delivery(String body, Map<String, Object> headers) {
        return new Delivery(1L, BINDING.exchange(), "order.created", false, headers,
            body.getBytes(StandardCharsets.UTF_8));
    }

    private static Delivery delivery(Map<String, Object> headers) {
        return delivery(VALID_BODY, headers);
    }

    private static MessageHandler<OrderEvent> failingWith(Throwable error) {
        return message -> CompletableFuture.failedFuture(error);
    }

    @Test
    @DisplayName("start declares quorum queue, topic exchange and binding, then consumes")
    void testStartDeclaresTopology() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));

        consumer.start(channel).get();

        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).assertQueue("orders.queue", QueueOptions.quorum());
        inOrder.verify(channel).assertExchange("orders", ExchangeType.TOPIC, true);
        inOrder.verify(channel).bindQueue("orders.queue", "orders", "order.*");
        inOrder.verify(channel).consume(eq("orders.queue"), any(DeliveryCallback.class));
        assertEquals(BindingState.CONSUMING, consumer.getState());
        assertEquals("ctag-1", consumer.getConsumerTag());
    }

    @Test
    void testStartTwiceFails() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));
        consumer.start(channel).get();

        ExecutionException e = assertThrows(ExecutionException.class, () -> consumer.start(channel).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        verify(channel, times(1)).consume(any(), any());
    }

    @Test
    void testStartFailsWhenDeclarationFails() throws Exception {
        doThrow(new IOException("access refused")).when(channel).assertQueue(any(), any());
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));

        ExecutionException e = assertThrows(ExecutionException.class, () -> consumer.start(channel).get());

        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(BindingState.UNBOUND, consumer.getState());
        verify(channel, never()).consume(any(), any());
    }

    @Test
    @DisplayName("a start racing one already in progress fails without touching the channel")
    void testConcurrentStartClaimsConsumerOnce() throws Exception {
        CountDownLatch declaring = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            declaring.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        }).when(channel).assertQueue(any(), any());
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));

        CompletableFuture<Void> first = CompletableFuture.supplyAsync(() -> consumer.start(channel))
            .thenCompose(f -> f);
        assertTrue(declaring.await(5, TimeUnit.SECONDS));
        assertEquals(BindingState.STARTING, consumer.getState());

        ExecutionException e = assertThrows(ExecutionException.class, () -> consumer.start(channel).get());
        assertInstanceOf(IllegalStateException.class, e.getCause());

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        assertEquals(BindingState.CONSUMING, consumer.getState());
        verify(channel, times(1)).assertQueue(any(), any());
        verify(channel, times(1)).consume(any(), any());
    }

    @Test
    void testStartFailsWhenConsumeFails() throws Exception {
        when(channel.consume(eq(BINDING.queue()), any())).thenThrow(new IOException("channel closed"));
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));

        assertThrows(ExecutionException.class, () -> consumer.start(channel).get());
        assertEquals(BindingState.UNBOUND, consumer.getState());
        assertNull(consumer.getConsumerTag());
    }

    @Test
    void testDetachAllowsRestart() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));
        consumer.start(channel).get();

        consumer.detach();
        assertEquals(BindingState.UNBOUND, consumer.getState());
        assertNull(consumer.getConsumerTag());

        consumer.start(channel).get();
        assertEquals(BindingState.CONSUMING, consumer.getState());
    }

    @Test
    @DisplayName("callback registered with the channel runs the decision procedure")
    void testRegisteredCallbackSettlesDelivery() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));
        consumer.start(channel).get();
        ArgumentCaptor<DeliveryCallback> captor = ArgumentCaptor.forClass(DeliveryCallback.class);
        verify(channel).consume(eq("orders.queue"), captor.capture());

        Delivery delivery = delivery(Map.of());
        CompletionStage<?> settled = captor.getValue().onDelivery(delivery);

        assertEquals(AckDecision.ACKED, settled.toCompletableFuture().get());
        verify(channel).ack(delivery);
    }

    @Test
    void testSuccessfulHandlerAcks() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> {
            assertEquals(new OrderEvent("A-1", 2), message.getPayload());
            assertEquals("order.created", message.getRoutingKey());
            return CompletableFuture.completedFuture(null);
        });
        Delivery delivery = delivery(Map.of());

        assertEquals(AckDecision.ACKED, consumer.onDelivery(channel, delivery).get());
        verify(channel).ack(delivery);
        verify(channel, never()).nack(any(), anyBoolean(), anyBoolean());
    }

    @Test
    @DisplayName("retriable failure without delivery count header is requeued")
    void testRetriableWithoutHeaderRequeues() throws Exception {
        Consumer<OrderEvent> consumer = consumer(
            failingWith(new AmqpRetriableException(new RuntimeException("db down"), 3)));
        Delivery delivery = delivery(Map.of());

        assertEquals(AckDecision.REQUEUED, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, true);
        verify(channel, never()).ack(any());
    }

    @Test
    @DisplayName("retriable failure at its retry limit is rejected")
    void testRetriableAtLimitRejected() throws Exception {
        Consumer<OrderEvent> consumer = consumer(
            failingWith(new AmqpRetriableException(new RuntimeException("db down"), 2)));
        Delivery delivery = delivery(Map.of(Delivery.DELIVERY_COUNT_HEADER, "2"));

        assertEquals(AckDecision.REJECTED, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, false);
    }

    @Test
    void testRetriableBelowLimitWithNumericHeaderRequeues() throws Exception {
        Consumer<OrderEvent> consumer = consumer(
            failingWith(new AmqpRetriableException(new RuntimeException("db down"), 3)));
        Delivery delivery = delivery(Map.of(Delivery.DELIVERY_COUNT_HEADER, 2L));

        assertEquals(AckDecision.REQUEUED, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, true);
    }

    @Test
    @DisplayName("unclassified failure is rejected regardless of delivery count")
    void testUnclassifiedFailureRejected() throws Exception {
        Consumer<OrderEvent> consumer = consumer(failingWith(new IllegalStateException("bug")));

        for (Object count : List.of(0, 1L, "5")) {
            Delivery delivery = delivery(Map.of(Delivery.DELIVERY_COUNT_HEADER, count));
            assertEquals(AckDecision.REJECTED, consumer.onDelivery(channel, delivery).get());
        }
        verify(channel, times(3)).nack(any(), eq(false), eq(false));
        verify(channel, never()).nack(any(), anyBoolean(), eq(true));
    }

    @Test
    void testFatalFailureRejected() throws Exception {
        Consumer<OrderEvent> consumer = consumer(failingWith(new AmqpFatalException(new RuntimeException("poison"))));
        Delivery delivery = delivery(Map.of());

        assertEquals(AckDecision.REJECTED, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, false);
    }

    @Test
    void testSynchronousThrowIsTreatedAsFailure() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> {
            throw new AmqpRetriableException(new RuntimeException("thrown"), 1);
        });
        Delivery delivery = delivery(Map.of());

        assertEquals(AckDecision.REQUEUED, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, true);
    }

    @Test
    void testNullFutureFromHandlerIsRejected() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> null);
        Delivery delivery = delivery(Map.of());

        assertEquals(AckDecision.REJECTED, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, false);
    }

    @Test
    @DisplayName("null delivery triggers neither handler nor settlement")
    void testNullDeliveryIgnored() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));

        assertEquals(AckDecision.IGNORED, consumer.onDelivery(channel, null).get());
        assertEquals(0, handlerCalls.get());
        verify(channel, never()).ack(any());
        verify(channel, never()).nack(any(), anyBoolean(), anyBoolean());
    }

    @Test
    void testMalformedJsonRejectedWithoutHandler() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));
        Delivery delivery = delivery("{not json", Map.of());

        assertEquals(AckDecision.REJECTED_INVALID, consumer.onDelivery(channel, delivery).get());
        assertEquals(0, handlerCalls.get());
        verify(channel).nack(delivery, false, false);
    }

    @Test
    void testJsonNullPayloadRejected() throws Exception {
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));
        Delivery delivery = delivery("null", Map.of());

        assertEquals(AckDecision.REJECTED_INVALID, consumer.onDelivery(channel, delivery).get());
        assertEquals(0, handlerCalls.get());
    }

    @Test
    @DisplayName("payload failing validation is rejected without calling the handler")
    void testValidationFailureRejected() throws Exception {
        PayloadValidator<OrderEvent> positiveQuantity = PayloadValidator.of(e -> e.quantity() > 0, "quantity must be positive");
        Consumer<OrderEvent> consumer = new Consumer<>(BINDING, OrderEvent.class, positiveQuantity, message -> {
            handlerCalls.incrementAndGet();
            return CompletableFuture.completedFuture(null);
        });
        Delivery delivery = delivery("{\"orderId\":\"A-1\",\"quantity\":0}", Map.of());

        assertEquals(AckDecision.REJECTED_INVALID, consumer.onDelivery(channel, delivery).get());
        assertEquals(0, handlerCalls.get());
        verify(channel).nack(delivery, false, false);
    }

    @Test
    void testThrowingValidatorRejected() throws Exception {
        PayloadValidator<OrderEvent> broken = payload -> {
            throw new IllegalStateException("validator bug");
        };
        Consumer<OrderEvent> consumer = new Consumer<>(BINDING, OrderEvent.class, broken,
            message -> CompletableFuture.completedFuture(null));
        Delivery delivery = delivery(Map.of());

        assertEquals(AckDecision.REJECTED_INVALID, consumer.onDelivery(channel, delivery).get());
        verify(channel).nack(delivery, false, false);
    }

    @Test
    @DisplayName("failing ack is reported as ACK_FAILED and does not propagate")
    void testAckFailure() throws Exception {
        doThrow(new IOException("channel closed")).when(channel).ack(any());
        Consumer<OrderEvent> consumer = consumer(message -> CompletableFuture.completedFuture(null));

        assertEquals(AckDecision.ACK_FAILED, consumer.onDelivery(channel, delivery(Map.of())).get());
    }

    @Test
    void testNackFailure() throws Exception {
        doThrow(new IOException("channel closed")).when(channel).nack(any(), anyBoolean(), anyBoolean());
        Consumer<OrderEvent> consumer = consumer(failingWith(new RuntimeException("boom")));

        assertEquals(AckDecision.ACK_FAILED, consumer.onDelivery(channel, delivery(Map.of())).get());
    }

    @Test
    @DisplayName("settlement waits for the handler future and tracks in-flight deliveries")
    void testAsyncHandlerTrackedInFlight() throws Exception {
        CompletableFuture<Void> processing = new CompletableFuture<>();
        Consumer<OrderEvent> consumer = consumer(message -> processing);
        Delivery delivery = delivery(Map.of());

        CompletableFuture<AckDecision> settled = consumer.onDelivery(channel, delivery);
        CompletableFuture<Void> idle = consumer.whenIdle();

        assertFalse(settled.isDone());
        assertFalse(idle.isDone());
        assertEquals(1, consumer.getInFlightCount());
        verify(channel, never()).ack(any());

        processing.complete(null);

        assertEquals(AckDecision.ACKED, settled.get());
        idle.get();
        assertEquals(0, consumer.getInFlightCount());
        verify(channel).ack(delivery);
    }

    @Test
    void testDecisionsAreRecorded() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        AmqpClientMetrics metrics = new AmqpClientMetrics("test");
        metrics.bindTo(registry);
        Consumer<OrderEvent> consumer = new Consumer<>(BINDING, OrderEvent.class, PayloadValidator.acceptAll(),
            message -> CompletableFuture.completedFuture(null), new JsonCodec(), metrics);

        consumer.onDelivery(channel, delivery(Map.of())).get();
        consumer.onDelivery(channel, delivery("{", Map.of())).get();

        assertEquals(1.0, registry.get(AmqpClientMetrics.MESSAGES_SETTLED).tag("decision", "acked").counter().count());
        assertEquals(1.0, registry.get(AmqpClientMetrics.MESSAGES_SETTLED).tag("decision", "rejected_invalid").counter().count());
        assertEquals(1L, registry.get(AmqpClientMetrics.MESSAGE_PROCESSING_TIME).timer().count());
    }

    @Test
    void testConstructorValidation() {
        MessageHandler<OrderEvent> handler = message -> CompletableFuture.completedFuture(null);

        assertThrows(NullPointerException.class,
            () -> new Consumer<>(null, OrderEvent.class, PayloadValidator.acceptAll(), handler));
        assertThrows(NullPointerException.class,
            () -> new Consumer<>(BINDING, OrderEvent.class, null, handler));
        assertThrows(NullPointerException.class,
            () -> new Consumer<OrderEvent>(BINDING, OrderEvent.class, PayloadValidator.acceptAll(), null));
    }
}
