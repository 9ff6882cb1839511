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
package dev.mars.reliableamqp.api.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when a publish could not be handed to the transport, either because the
 * transport signalled backpressure or because the send itself failed.
 *
 * <p>The exchange, topic and payload are kept for diagnostics. The caller owns any
 * retry or backoff policy.</p>
 */
public class AmqpPublisherException extends AmqpException {

    private final String exchange;
    private final String topic;
    private final transient Object payload;

    public AmqpPublisherException(String exchange, String topic, Object payload) {
        this(exchange, topic, payload, null);
    }

    public AmqpPublisherException(String exchange, String topic, Object payload, Throwable cause) {
        super("Failed to publish message", context(exchange, topic, payload), cause);
        this.exchange = exchange;
        this.topic = topic;
        this.payload = payload;
    }

    public String getExchange() { return exchange; }

    public String getTopic() { return topic; }

    public Object getPayload() { return payload; }

    private static Map<String, Object> context(String exchange, String topic, Object payload) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("exchange", exchange);
        context.put("topic", topic);
        context.put("payload", payload);
        return context;
    }
}
