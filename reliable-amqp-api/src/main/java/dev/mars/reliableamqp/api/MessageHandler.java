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

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for handling messages.
 *
 * <p>Completing the returned future normally acknowledges the message. Failing it,
 * or throwing, rejects the message. Raise
 * {@link dev.mars.reliableamqp.api.error.AmqpRetriableException} to request a
 * bounded requeue.</p>
 *
 * @param <T> The type of message payload
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * Handles a received message.
     *
     * @param message The message to handle
     * @return A CompletableFuture that completes when the message is processed
     */
    CompletableFuture<Void> handle(Message<T> message);
}
