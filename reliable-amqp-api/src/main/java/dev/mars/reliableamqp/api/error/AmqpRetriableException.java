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

/**
 * Raised by message handlers to request a bounded requeue.
 *
 * <p>The message is requeued while its delivery count is below {@code retryLimit}.
 * The default limit of 0 means the message is never requeued.</p>
 */
public class AmqpRetriableException extends AmqpConsumerException implements ClassifiedFailure {

    private final int retryLimit;

    public AmqpRetriableException(Throwable cause) {
        this(cause, 0);
    }

    public AmqpRetriableException(Throwable cause, int retryLimit) {
        super(cause);
        if (retryLimit < 0) {
            throw new IllegalArgumentException("Retry limit must be non-negative, got: " + retryLimit);
        }
        this.retryLimit = retryLimit;
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    @Override
    public HandlerFailure failure() {
        return HandlerFailure.retriable(getCause(), retryLimit);
    }
}
