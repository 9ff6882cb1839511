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
package dev.mars.reliableamqp.core.consumer;

/**
 * Outcome of the acknowledgment decision for one delivery.
 */
public enum AckDecision {
    /** Cancellation signal from the transport; nothing was settled */
    IGNORED,
    /** Handler succeeded; message acknowledged */
    ACKED,
    /** Retriable failure below the retry limit; message rejected with requeue */
    REQUEUED,
    /** Handler failed for good; message rejected without requeue */
    REJECTED,
    /** Payload could not be decoded or failed validation; rejected without requeue, handler never called */
    REJECTED_INVALID,
    /** The ack or nack call itself failed, typically because the channel was closed */
    ACK_FAILED
}
