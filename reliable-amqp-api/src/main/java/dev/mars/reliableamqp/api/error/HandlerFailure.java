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

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Value describing how a handler failure must be treated by the acknowledgment logic.
 *
 * @param kind       RETRIABLE for a bounded requeue, FATAL for never requeue
 * @param cause      The error raised by the handler
 * @param retryLimit Number of deliveries after which a retriable message is no longer
 *                   requeued. Always 0 for FATAL.
 */
public record HandlerFailure(Kind kind, Throwable cause, int retryLimit) {

    public enum Kind {
        RETRIABLE,
        FATAL
    }

    public HandlerFailure {
        Objects.requireNonNull(kind, "Failure kind cannot be null");
        if (retryLimit < 0) {
            throw new IllegalArgumentException("Retry limit must be non-negative, got: " + retryLimit);
        }
        if (kind == Kind.FATAL) {
            retryLimit = 0;
        }
    }

    public static HandlerFailure retriable(Throwable cause, int retryLimit) {
        return new HandlerFailure(Kind.RETRIABLE, cause, retryLimit);
    }

    public static HandlerFailure fatal(Throwable cause) {
        return new HandlerFailure(Kind.FATAL, cause, 0);
    }

    /**
     * Classifies an error raised by a message handler. Async wrappers are unwrapped;
     * errors that do not expose a classification are treated as fatal.
     *
     * @param error the raised error
     * @return the classification, never null
     */
    public static HandlerFailure classify(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        if (current instanceof ClassifiedFailure) {
            HandlerFailure failure = ((ClassifiedFailure) current).failure();
            if (failure != null) {
                return failure;
            }
        }
        return fatal(current);
    }

    /**
     * Decides whether a message that already went through {@code deliveryCount}
     * deliveries must be put back on the queue.
     */
    public boolean shouldRequeue(int deliveryCount) {
        switch (kind) {
            case RETRIABLE:
                return deliveryCount < retryLimit;
            case FATAL:
                return false;
            default:
                throw new IllegalStateException("Unknown failure kind: " + kind);
        }
    }
}
