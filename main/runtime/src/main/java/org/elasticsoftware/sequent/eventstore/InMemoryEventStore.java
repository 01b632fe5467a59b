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

package org.elasticsoftware.sequent.eventstore;

import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.events.Metadata;
import org.elasticsoftware.sequent.serialization.DomainEventSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Stream;

/**
 * Keeps serialized copies of the events, so that whatever happens to the instances handed to
 * {@link #save(UUID, List)} or returned from {@link #load(String, long)} the stored history stays
 * as it was written.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);
    private final DomainEventSerializer serializer;
    // index is the global sequence number - 1
    private final List<byte[]> events = new ArrayList<>();
    // per aggregate root the global sequence numbers, index is the sequence number - 1
    private final Map<String, List<Long>> eventsByAggregateRoot = new HashMap<>();

    public InMemoryEventStore() {
        this(new DomainEventSerializer());
    }

    public InMemoryEventStore(DomainEventSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    @Override
    public synchronized void save(UUID batchId, List<DomainEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        Map<String, Long> nextSequenceNumbers = new HashMap<>();
        for (DomainEvent event : batch) {
            String aggregateRootId = EventStores.requireAggregateRootId(event);
            long sequenceNumber = event.getSequenceNumber();
            long expected = nextSequenceNumbers.computeIfAbsent(aggregateRootId, id -> getLastSequenceNumber(id) + 1);
            if (sequenceNumber != expected) {
                throw new ConcurrencyException(batchId, aggregateRootId, sequenceNumber);
            }
            nextSequenceNumbers.put(aggregateRootId, expected + 1);
        }
        // serialize everything first, a failure leaves the store untouched
        long globalSequenceNumber = events.size() + 1L;
        List<byte[]> serialized = new ArrayList<>(batch.size());
        for (DomainEvent event : batch) {
            serialized.add(serializer.serialize(event, Map.of(
                    Metadata.BATCH_ID, batchId.toString(),
                    Metadata.GLOBAL_SEQUENCE_NUMBER, Long.toString(globalSequenceNumber++))));
        }
        for (int i = 0; i < batch.size(); i++) {
            DomainEvent event = batch.get(i);
            long assigned = events.size() + 1L;
            events.add(serialized.get(i));
            eventsByAggregateRoot.computeIfAbsent(event.getAggregateRootId(), id -> new ArrayList<>()).add(assigned);
            event.getMeta()
                    .put(Metadata.BATCH_ID, batchId.toString())
                    .put(Metadata.GLOBAL_SEQUENCE_NUMBER, Long.toString(assigned));
        }
        log.trace("Saved batch {} with {} events, next global sequence number is {}", batchId, batch.size(), events.size() + 1);
    }

    @Override
    public Stream<DomainEvent> load(String aggregateRootId, long firstSeqNo) {
        List<byte[]> data = new ArrayList<>();
        synchronized (this) {
            List<Long> globalSequenceNumbers = eventsByAggregateRoot.getOrDefault(aggregateRootId, Collections.emptyList());
            int fromIndex = (int) Math.min(Math.max(firstSeqNo - 1, 0), globalSequenceNumbers.size());
            for (long globalSequenceNumber : globalSequenceNumbers.subList(fromIndex, globalSequenceNumbers.size())) {
                data.add(events.get((int) (globalSequenceNumber - 1)));
            }
        }
        return data.stream().map(serializer::deserialize);
    }

    @Override
    public Stream<DomainEvent> stream(long fromGlobalSeqNo) {
        List<byte[]> data;
        synchronized (this) {
            int fromIndex = (int) Math.min(Math.max(fromGlobalSeqNo - 1, 0), events.size());
            data = List.copyOf(events.subList(fromIndex, events.size()));
        }
        return data.stream().map(serializer::deserialize);
    }

    @Override
    public synchronized long getNextGlobalSequenceNumber() {
        return events.size() + 1L;
    }

    private long getLastSequenceNumber(String aggregateRootId) {
        List<Long> globalSequenceNumbers = eventsByAggregateRoot.get(aggregateRootId);
        return globalSequenceNumbers == null ? 0L : globalSequenceNumbers.size();
    }
}
