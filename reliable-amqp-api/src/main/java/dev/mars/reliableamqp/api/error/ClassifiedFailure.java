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
 * Implemented by errors that know how the consumer should treat them.
 *
 * <p>Any exception type can implement this, so handler code is free to keep its own
 * hierarchy and still request a bounded requeue.</p>
 */
public interface ClassifiedFailure {

    /**
     * @return the failure classification for this error
     */
    HandlerFailure failure();
}
