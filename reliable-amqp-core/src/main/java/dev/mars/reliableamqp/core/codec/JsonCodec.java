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
package dev.mars.reliableamqp.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON wire encoding for published and consumed payloads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class JsonCodec {

    private final ObjectMapper objectMapper;

    public JsonCodec() {
        this(createDefaultObjectMapper());
    }

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    /**
     * Serializes a payload to UTF-8 JSON bytes.
     */
    public byte[] encode(Object payload) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(payload);
    }

    /**
     * Deserializes JSON bytes into the given payload type.
     *
     * @throws IOException if the bytes are not valid JSON for the type
     */
    public <T> T decode(byte[] body, Class<T> payloadType) throws IOException {
        return objectMapper.readValue(body, payloadType);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Creates a default ObjectMapper with JSR310 support for Java 8 time types,
     * writing dates as ISO-8601 strings.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
