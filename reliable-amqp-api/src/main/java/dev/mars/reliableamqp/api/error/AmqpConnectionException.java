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

import java.util.Map;

/**
 * Exception thrown when the client cannot be started.
 *
 * <p>This exception is raised for:
 * <ul>
 *   <li>Connection failures</li>
 *   <li>Channel creation failures</li>
 *   <li>Consumer topology declaration or registration failures</li>
 * </ul>
 *
 * <p>The target is expected to be already redacted by the caller; it is included
 * verbatim in the message.</p>
 */
public class AmqpConnectionException extends AmqpException {

    private final String target;

    /**
     * Creates a new connection exception.
     *
     * @param errorMessage the message of the underlying failure
     * @param target the connection target, with credentials removed
     * @param cause the underlying cause
     */
    public AmqpConnectionException(String errorMessage, String target, Throwable cause) {
        super("Failed to connect to AMQP server: " + errorMessage,
            Map.of("target", String.valueOf(target)), cause);
        this.target = target;
    }

    /** Returns the connection target the client attempted to reach */
    public String getTarget() { return target; }
}
