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

import java.util.Map;

/**
 * A validated message handed to a {@link MessageHandler}.
 *
 * @param <T> The type of message payload
 */
public interface Message<T> {

    /**
     * Gets the decoded and validated payload.
     *
     * @return The message payload
     */
    T getPayload();

    /**
     * Gets the transport headers of the delivery. Read-only.
     *
     * @return The message headers
     */
    Map<String, Object> getHeaders();

    /**
     * Gets the exchange the message was published to.
     *
     * @return The exchange name
     */
    String getExchange();

    /**
     * Gets the routing key the message was published with.
     *
     * @return The routing key
     */
    String getRoutingKey();

    /**
     * Whether the broker flagged this delivery as a redelivery.
     *
     * @return true if redelivered
     */
    boolean isRedelivered();
}
