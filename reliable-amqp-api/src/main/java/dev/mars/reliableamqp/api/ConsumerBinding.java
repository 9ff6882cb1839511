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

import java.util.Objects;

/**
 * Topology of one subscription: the queue is bound to the topic exchange with the
 * given topic pattern.
 *
 * <p>Not a unique key. Two consumers may share a binding.</p>
 *
 * <p>Queue and exchange must be named: a quorum queue cannot be server-named, and
 * the default exchange accepts no bindings. The topic may be empty, which binds
 * the queue to messages published with an empty routing key.</p>
 *
 * @param queue    Name of the durable queue to consume from
 * @param exchange Name of the topic exchange
 * @param topic    Routing pattern, wildcards {@code *} and {@code #} allowed
 */
public record ConsumerBinding(String queue, String exchange, String topic) {

    public ConsumerBinding {
        requireText(queue, "Queue");
        requireText(exchange, "Exchange");
        Objects.requireNonNull(topic, "Topic cannot be null");
    }

    public static ConsumerBinding of(String queue, String exchange, String topic) {
        return new ConsumerBinding(queue, exchange, topic);
    }

    private static void requireText(String value, String name) {
        if (value == null) {
            throw new NullPointerException(name + " cannot be null");
        }
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be blank");
        }
    }
}
