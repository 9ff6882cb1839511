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
package dev.mars.reliableamqp.core.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning options for an {@link AmqpClient}.
 *
 * <p>The shutdown timeout bounds how long {@code stop()} waits for deliveries that
 * are still being handled before the channel is closed. Handlers still running
 * when it expires are not cancelled; their messages are redelivered by the broker
 * once the channel is gone.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ClientOptions {

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final Duration shutdownTimeout;

    private ClientOptions(Builder builder) {
        this.shutdownTimeout = builder.shutdownTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return A new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates default client options (10 second shutdown drain).
     *
     * @return Default client options
     */
    public static ClientOptions defaults() {
        return builder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClientOptions that = (ClientOptions) o;
        return shutdownTimeout.equals(that.shutdownTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shutdownTimeout);
    }

    @Override
    public String toString() {
        return "ClientOptions{" +
               "shutdownTimeout=" + shutdownTimeout +
               '}';
    }

    /**
     * Builder for ClientOptions.
     */
    public static class Builder {
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;

        /**
         * Sets how long stop() waits for in-flight deliveries.
         *
         * @param shutdownTimeout The drain timeout (zero skips the wait)
         * @return This builder
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            Objects.requireNonNull(shutdownTimeout, "shutdownTimeout cannot be null");
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout cannot be negative");
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ClientOptions build() {
            return new ClientOptions(this);
        }
    }
}
