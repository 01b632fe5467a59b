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

import org.elasticsoftware.sequent.SequentException;

import java.util.UUID;

/**
 * Signals that a batch could not be saved because another batch already claimed a sequence
 * number of one of its aggregate roots. The command that produced the batch can be retried.
 */
public class ConcurrencyException extends SequentException {
    private final UUID batchId;
    private final String aggregateRootId;
    private final long sequenceNumber;

    public ConcurrencyException(UUID batchId, String aggregateRootId, long sequenceNumber) {
        super("Could not save batch " + batchId + ": sequence number " + sequenceNumber +
                " is not the next one for aggregate root " + aggregateRootId);
        this.batchId = batchId;
        this.aggregateRootId = aggregateRootId;
        this.sequenceNumber = sequenceNumber;
    }

    public UUID getBatchId() {
        return batchId;
    }

    public String getAggregateRootId() {
        return aggregateRootId;
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }
}
