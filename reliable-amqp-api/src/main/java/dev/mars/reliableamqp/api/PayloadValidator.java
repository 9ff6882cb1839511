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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Checks the shape of a decoded payload before it reaches the business handler.
 * A payload with at least one violation is rejected without requeue.
 *
 * @param <T> The type of message payload
 */
@FunctionalInterface
public interface PayloadValidator<T> {

    /**
     * Validates a decoded payload.
     *
     * @param payload The decoded payload, never null
     * @return The violations found, empty when the payload is valid
     */
    List<String> validate(T payload);

    /**
     * A validator that accepts every payload.
     */
    static <T> PayloadValidator<T> acceptAll() {
        return payload -> List.of();
    }

    /**
     * Adapts a predicate; a payload failing it yields the given violation.
     */
    static <T> PayloadValidator<T> of(Predicate<? super T> predicate, String violation) {
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        return payload -> predicate.test(payload) ? List.of() : List.of(violation);
    }

    /**
     * Runs this validator, then the other one, and reports the violations of both.
     */
    default PayloadValidator<T> and(PayloadValidator<T> other) {
        Objects.requireNonNull(other, "Validator cannot be null");
        return payload -> {
            List<String> first = validate(payload);
            List<String> second = other.validate(payload);
            if (first.isEmpty()) {
                return second;
            }
            if (second.isEmpty()) {
                return first;
            }
            List<String> all = new ArrayList<>(first);
            all.addAll(second);
            return List.copyOf(all);
        };
    }
}
