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

import java.util.concurrent.CompletionStage;

/**
 * Receives deliveries registered through {@link AmqpChannel#consume}.
 *
 * <p>The returned stage completes once the delivery has been settled. A {@code null}
 * delivery signals that the transport cancelled the consumer.</p>
 */
@FunctionalInterface
public interface DeliveryCallback {

    CompletionStage<?> onDelivery(Delivery delivery);
}
