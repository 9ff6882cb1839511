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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * A message delivered by the transport. Owned by the transport; read-only.
 *
 * @param deliveryTag Channel-scoped tag used to settle the delivery
 * @param exchange    Exchange the message was published to
 * @param routingKey  Routing key the message was published with
 * @param redelivered Whether the broker flagged this as a redelivery
 * @param headers     Message headers, never null
 * @param body        Raw payload bytes
 */
public record Delivery(long deliveryTag, String exchange, String routingKey, boolean redelivered,
                       Map<String, Object> headers, byte[] body) {

    public static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    public Delivery {
        // header tables may carry null values, which Map.copyOf rejects
        headers = headers == null || headers.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new HashMap<>(headers));
        body = body == null ? new byte[0] : body;
    }

    /** Returns a header value, or null when absent */
    public Object header(String name) {
        return headers.get(name);
    }
}
