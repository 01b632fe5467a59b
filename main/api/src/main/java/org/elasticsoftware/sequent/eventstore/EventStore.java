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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.events.DomainEvent;

import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Durable, append-only storage of domain events.
 *
 * <p>Implementations must be safe for concurrent use. {@link #save(UUID, List)} is atomic: either
 * every event of the batch is stored and has been given a global sequence number, or none is.
 */
public interface EventStore {
    /**
     * Persists a batch of events. On success every event carries the batch id and its global
     * sequence number in its metadata.
     *
     * @throws ConcurrencyException when one of the events collides with an already stored
     *         sequence number of its aggregate root (or would leave a gap)
     */
    void save(@NotNull UUID batchId, @NotNull List<DomainEvent> events) throws ConcurrencyException;

    /**
     * @return the events of one aggregate root with a sequence number of at least
     *         {@code firstSeqNo}, ordered by sequence number
     */
    Stream<DomainEvent> load(@NotNull String aggregateRootId, long firstSeqNo);

    default Stream<DomainEvent> load(@NotNull String aggregateRootId) {
        return load(aggregateRootId, 1L);
    }

    /**
     * @return all events with a global sequence number of at least {@code fromGlobalSeqNo}, in
     *         global order
     */
    Stream<DomainEvent> stream(long fromGlobalSeqNo);

    long getNextGlobalSequenceNumber();
}
