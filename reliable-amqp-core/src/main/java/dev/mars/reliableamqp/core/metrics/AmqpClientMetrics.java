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
package dev.mars.reliableamqp.core.metrics;

import dev.mars.reliableamqp.core.consumer.AckDecision;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer metrics for publishing and acknowledgment decisions.
 *
 * <p>Nothing is recorded until the binder is bound to a registry.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class AmqpClientMetrics implements MeterBinder {
    private static final Logger logger = LoggerFactory.getLogger(AmqpClientMetrics.class);

    public static final String MESSAGES_PUBLISHED = "amqp.messages.published";
    public static final String MESSAGES_PUBLISH_FAILED = "amqp.messages.publish.failed";
    public static final String MESSAGES_SETTLED = "amqp.messages.settled";
    public static final String MESSAGE_PROCESSING_TIME = "amqp.messages.processing.time";

    private final String instanceId;
    private volatile MeterRegistry registry;

    public AmqpClientMetrics(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        logger.info("AMQP client metrics bound to registry for instance: {}", instanceId);
    }

    public void recordMessagePublished(String exchange) {
        MeterRegistry r = registry;
        if (r != null) {
            r.counter(MESSAGES_PUBLISHED, "instance", instanceId, "exchange", exchange).increment();
        }
    }

    public void recordPublishFailed(String exchange) {
        MeterRegistry r = registry;
        if (r != null) {
            r.counter(MESSAGES_PUBLISH_FAILED, "instance", instanceId, "exchange", exchange).increment();
        }
    }

    public void recordDecision(String queue, AckDecision decision) {
        MeterRegistry r = registry;
        if (r != null) {
            r.counter(MESSAGES_SETTLED, "instance", instanceId, "queue", queue,
                "decision", decision.name().toLowerCase(Locale.ROOT)).increment();
        }
    }

    public void recordProcessingTime(String queue, Duration duration) {
        MeterRegistry r = registry;
        if (r != null) {
            Timer.builder(MESSAGE_PROCESSING_TIME)
                .description("Time spent in the message handler")
                .tag("instance", instanceId)
                .tag("queue", queue)
                .register(r)
                .record(duration);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
