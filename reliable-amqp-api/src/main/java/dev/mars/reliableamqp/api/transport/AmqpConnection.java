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

import java.io.IOException;

/**
 * An open transport connection.
 */
public interface AmqpConnection extends AutoCloseable {

    /**
     * Opens a new channel on this connection.
     *
     * @return the channel
     * @throws IOException if the channel cannot be opened
     */
    AmqpChannel createChannel() throws IOException;

    /**
     * Closes the connection and every channel still open on it.
     */
    @Override
    void close() throws IOException;
}
