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

import dev.mars.reliableamqp.api.transport.Delivery;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Reads the broker-maintained {@code x-delivery-count} header.
 *
 * <p>The header may be a number or a numeric string. Absent, unparsable, non-finite
 * and negative values count as 0. Fractions are truncated. Never throws.</p>
 */
public final class DeliveryCount {

    private static final BigDecimal MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

    private DeliveryCount() {
        // Utility class - prevent instantiation
    }

    public static int of(Delivery delivery) {
        if (delivery == null) {
            return 0;
        }
        return parse(delivery.header(Delivery.DELIVERY_COUNT_HEADER));
    }

    public static int parse(Object value) {
        if (value instanceof Number) {
            return fromNumber((Number) value);
        }
        if (value instanceof CharSequence) {
            return fromString(value.toString());
        }
        return 0;
    }

    private static int fromNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return 0;
            }
            return clamp((long) d);
        }
        if (number instanceof BigDecimal) {
            return fromDecimal((BigDecimal) number);
        }
        if (number instanceof BigInteger) {
            return fromDecimal(new BigDecimal((BigInteger) number));
        }
        return clamp(number.longValue());
    }

    private static int fromString(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        try {
            return fromDecimal(new BigDecimal(trimmed));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int fromDecimal(BigDecimal decimal) {
        if (decimal.signum() <= 0) {
            return 0;
        }
        if (decimal.compareTo(MAX) > 0) {
            return Integer.MAX_VALUE;
        }
        return clamp(decimal.longValue());
    }

    private static int clamp(long value) {
        if (value <= 0) {
            return 0;
        }
        return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }
}
