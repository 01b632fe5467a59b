/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.sequent.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.events.Metadata;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes domain events as JSON {@link DomainEventRecord}s: the event class name, its metadata and
 * its payload.
 */
public class DomainEventSerializer {
    private final ObjectMapper objectMapper;
    private final Map<String, Class<? extends DomainEvent>> eventTypes = new ConcurrentHashMap<>();

    public DomainEventSerializer() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public DomainEventSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] serialize(DomainEvent event) {
        return serialize(event, Map.of());
    }

    /**
     * Serializes the event with {@code additionalMeta} added to a copy of its metadata, the event
     * itself is left untouched.
     */
    public byte[] serialize(DomainEvent event, Map<String, String> additionalMeta) {
        Metadata meta = new Metadata(event.getMeta().asMap());
        additionalMeta.forEach(meta::put);
        try {
            DomainEventRecord record = new DomainEventRecord(
                    event.getClass().getName(),
                    meta.asMap(),
                    objectMapper.valueToTree(event));
            return objectMapper.writeValueAsBytes(record);
        } catch (IOException | IllegalArgumentException e) {
            throw new SerializationException("Could not serialize " + event.getClass().getName(), e);
        }
    }

    public DomainEvent deserialize(byte[] data) {
        DomainEventRecord record;
        try {
            record = objectMapper.readValue(data, DomainEventRecord.class);
        } catch (IOException e) {
            throw new SerializationException("Could not read DomainEventRecord", e);
        }
        try {
            DomainEvent event = objectMapper.treeToValue(record.payload(), resolveType(record.type()));
            record.meta().forEach(event.getMeta()::put);
            return event;
        } catch (IOException e) {
            throw new SerializationException("Could not deserialize " + record.type(), e);
        }
    }

    private Class<? extends DomainEvent> resolveType(String typeName) {
        return eventTypes.computeIfAbsent(typeName, name -> {
            try {
                return Class.forName(name, true, Thread.currentThread().getContextClassLoader()).asSubclass(DomainEvent.class);
            } catch (ClassNotFoundException | ClassCastException e) {
                throw new SerializationException("Unknown DomainEvent type " + name, e);
            }
        });
    }
}
