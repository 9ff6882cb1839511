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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for all errors raised by the reliable AMQP layer.
 *
 * <p>Every subclass carries a human-readable message plus a structured context map
 * suitable for logging. The rendered message has the form
 * {@code amqp error: <message>, {key=value, ...}}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class AmqpException extends RuntimeException {

    private final transient Map<String, Object> context;

    public AmqpException(String message) {
        this(message, Map.of(), null);
    }

    public AmqpException(String message, Throwable cause) {
        this(message, Map.of(), cause);
    }

    public AmqpException(String message, Map<String, ?> context) {
        this(message, context, null);
    }

    public AmqpException(String message, Map<String, ?> context, Throwable cause) {
        super(formatMessage(message, context), cause);
        this.context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /** Returns the structured diagnostic context, never null */
    public Map<String, Object> getContext() {
        return context;
    }

    private static String formatMessage(String message, Map<String, ?> context) {
        StringBuilder sb = new StringBuilder("amqp error: ").append(message);
        if (context != null && !context.isEmpty()) {
            sb.append(", ").append(context);
        }
        return sb.toString();
    }
}
