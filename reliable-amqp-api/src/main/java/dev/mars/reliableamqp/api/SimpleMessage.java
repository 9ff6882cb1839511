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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Simple implementation of the Message interface.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class SimpleMessage<T> implements Message<T> {

    private final T payload;
    private final Map<String, Object> headers;
    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;

    public SimpleMessage(T payload, Map<String, Object> headers, String exchange,
                         String routingKey, boolean redelivered) {
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        // AMQP header tables may hold null values, which Map.copyOf rejects
        this.headers = headers != null ? Collections.unmodifiableMap(new HashMap<>(headers)) : Map.of();
        this.exchange = exchange;
        this.routingKey = routingKey;
        this.redelivered = redelivered;
    }

    public SimpleMessage(T payload, Map<String, Object> headers) {
        this(payload, headers, null, null, false);
    }

    public SimpleMessage(T payload) {
        this(payload, null, null, null, false);
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public Map<String, Object> getHeaders() {
        return headers;
    }

    @Override
    public String getExchange() {
        return exchange;
    }

    @Override
    public String getRoutingKey() {
        return routingKey;
    }

    @Override
    public boolean isRedelivered() {
        return redelivered;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SimpleMessage<?> that = (SimpleMessage<?>) o;
        return redelivered == that.redelivered &&
               Objects.equals(payload, that.payload) &&
               Objects.equals(headers, that.headers) &&
               Objects.equals(exchange, that.exchange) &&
               Objects.equals(routingKey, that.routingKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, headers, exchange, routingKey, redelivered);
    }

    @Override
    public String toString() {
        return "SimpleMessage{" +
                "exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", redelivered=" + redelivered +
                ", headers=" + headers +
                ", payload=" + payload +
                '}';
    }
}
