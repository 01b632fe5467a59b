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

package org.elasticsoftware.sequent.aggregate;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.events.Metadata;

import java.time.Instant;

/**
 * In-memory state of an aggregate, rebuilt from its events every time it is loaded.
 *
 * <p>Subclasses expose a public constructor taking an {@link AggregateRootContext} (or register
 * an {@code AggregateRootFactory}) and implement {@link #apply(DomainEvent)} to fold events into
 * their state. Business methods change state exclusively through {@link #emit(DomainEvent)}.
 */
public abstract class AggregateRoot {
    private final String id;
    private final SequenceNumberGenerator sequenceNumberGenerator;
    private final UnitOfWork unitOfWork;
    private long currentSequenceNumber = 0L;

    protected AggregateRoot(@NotNull AggregateRootContext context) {
        this.id = context.aggregateRootId();
        this.sequenceNumberGenerator = context.sequenceNumberGenerator();
        this.unitOfWork = context.unitOfWork();
    }

    public final String getId() {
        return id;
    }

    /**
     * @return the sequence number of the last event applied to this instance, 0 when none
     */
    public final long getCurrentSequenceNumber() {
        return currentSequenceNumber;
    }

    protected final void emit(@NotNull DomainEvent event) {
        Metadata meta = event.getMeta();
        if (meta.containsKey(Metadata.SEQUENCE_NUMBER)) {
            throw new IllegalStateException("Event " + event.getClass().getSimpleName() + " has already been emitted");
        }
        // an event rejected by apply must not consume a sequence number
        apply(event);
        long sequenceNumber = sequenceNumberGenerator.next();
        meta.put(Metadata.AGGREGATE_ROOT_ID, id)
                .put(Metadata.SEQUENCE_NUMBER, Long.toString(sequenceNumber))
                .put(Metadata.TIME_UTC, Instant.now().toString());
        currentSequenceNumber = sequenceNumber;
        unitOfWork.record(event);
    }

    /**
     * Applies a persisted event while rebuilding state. Nothing is recorded.
     */
    public final void hydrate(@NotNull DomainEvent event) {
        long sequenceNumber = event.getSequenceNumber();
        if (sequenceNumber != currentSequenceNumber + 1) {
            throw new IllegalStateException("Cannot apply event with sequence number " + sequenceNumber +
                    " to aggregate root " + id + " at sequence number " + currentSequenceNumber);
        }
        apply(event);
        currentSequenceNumber = sequenceNumber;
    }

    protected abstract void apply(@NotNull DomainEvent event);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", seqNo=" + currentSequenceNumber + "]";
    }
}
