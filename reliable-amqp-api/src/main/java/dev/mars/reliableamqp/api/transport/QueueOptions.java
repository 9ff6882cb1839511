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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Queue declaration options.
 *
 * @param durable   Whether the queue survives a broker restart
 * @param arguments Optional declaration arguments such as {@code x-queue-type}
 */
public record QueueOptions(boolean durable, Map<String, Object> arguments) {

    public static final String QUEUE_TYPE_ARGUMENT = "x-queue-type";
    public static final String QUORUM_QUEUE_TYPE = "quorum";

    public QueueOptions {
        arguments = arguments == null || arguments.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    /**
     * Durable replicated queue, so requeued messages survive broker failover.
     */
    public static QueueOptions quorum() {
        return new QueueOptions(true, Map.of(QUEUE_TYPE_ARGUMENT, QUORUM_QUEUE_TYPE));
    }
}
