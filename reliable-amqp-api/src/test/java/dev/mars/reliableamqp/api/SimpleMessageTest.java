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
package dev.mars.reliableamqp.api;

import dev.mars.reliableamqp.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class SimpleMessageTest {

    @Test
    void testHeadersAreCopied() {
        Map<String, Object> headers = new HashMap<>();
        headers.put("x-delivery-count", 1L);
        headers.put("trace", null);

        SimpleMessage<String> message = new SimpleMessage<>("payload", headers, "orders", "order.created", true);
        headers.put("late", "value");

        assertEquals(2, message.getHeaders().size());
        assertTrue(message.getHeaders().containsKey("trace"));
        assertEquals("orders", message.getExchange());
        assertEquals("order.created", message.getRoutingKey());
        assertTrue(message.isRedelivered());
        assertThrows(UnsupportedOperationException.class, () -> message.getHeaders().put("x", 1));
    }

    @Test
    void testDefaults() {
        SimpleMessage<String> message = new SimpleMessage<>("payload");

        assertTrue(message.getHeaders().isEmpty());
        assertNull(message.getExchange());
        assertFalse(message.isRedelivered());
        assertEquals(new SimpleMessage<>("payload", Map.of()), message);
    }

    @Test
    void testPayloadRequired() {
        assertThrows(NullPointerException.class, () -> new SimpleMessage<>(null));
    }
}
