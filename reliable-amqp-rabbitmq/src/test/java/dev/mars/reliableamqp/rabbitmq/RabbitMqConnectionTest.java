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
package dev.mars.reliableamqp.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BlockedCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.UnblockedCallback;
import dev.mars.reliableamqp.api.transport.AmqpChannel;
import dev.mars.reliableamqp.test.categories.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@Tag(TestCategories.CORE)
class RabbitMqConnectionTest {

    private AutoCloseable mockitoCloseable;

    @Mock
    private Connection rabbitConnection;

    @Mock
    private Channel rabbitChannel;

    @BeforeEach
    void setUp() throws Exception {
        mockitoCloseable = MockitoAnnotations.openMocks(this);
        when(rabbitConnection.createChannel()).thenReturn(rabbitChannel);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mockitoCloseable != null) {
            mockitoCloseable.close();
        }
    }

    @Test
    void testBlockedConnectionRefusesPublish() throws Exception {
        RabbitMqConnection connection = new RabbitMqConnection(rabbitConnection);
        ArgumentCaptor<BlockedCallback> blockedCaptor = ArgumentCaptor.forClass(BlockedCallback.class);
        ArgumentCaptor<UnblockedCallback> unblockedCaptor = ArgumentCaptor.forClass(UnblockedCallback.class);
        verify(rabbitConnection).addBlockedListener(blockedCaptor.capture(), unblockedCaptor.capture());
        AmqpChannel channel = connection.createChannel();

        blockedCaptor.getValue().handle("low on memory");

        assertTrue(connection.isBlocked());
        assertFalse(channel.publish("orders", "order.created", new byte[0]));

        unblockedCaptor.getValue().handle();

        assertFalse(connection.isBlocked());
        assertTrue(channel.publish("orders", "order.created", new byte[0]));
        verify(rabbitChannel, times(1)).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    }

    @Test
    void testNoChannelAvailable() throws Exception {
        when(rabbitConnection.createChannel()).thenReturn(null);
        RabbitMqConnection connection = new RabbitMqConnection(rabbitConnection);

        assertThrows(IOException.class, connection::createChannel);
    }

    @Test
    void testCloseOnlyWhenOpen() throws Exception {
        when(rabbitConnection.isOpen()).thenReturn(true, false);
        RabbitMqConnection connection = new RabbitMqConnection(rabbitConnection);

        connection.close();
        connection.close();

        verify(rabbitConnection, times(1)).close();
    }
}
