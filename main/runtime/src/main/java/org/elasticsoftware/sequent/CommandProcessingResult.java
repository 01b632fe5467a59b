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

package org.elasticsoftware.sequent;

import org.elasticsoftware.sequent.events.DomainEvent;

import java.util.List;
import java.util.OptionalLong;

/**
 * Outcome of a successfully processed command: the global sequence numbers of the events it
 * persisted, in order. Empty when the command emitted nothing.
 */
public record CommandProcessingResult(List<Long> globalSequenceNumbers) {
    private static final CommandProcessingResult EMPTY = new CommandProcessingResult(List.of());

    public CommandProcessingResult {
        globalSequenceNumbers = List.copyOf(globalSequenceNumbers);
    }

    public static CommandProcessingResult empty() {
        return EMPTY;
    }

    public static CommandProcessingResult of(List<DomainEvent> persistedEvents) {
        return new CommandProcessingResult(persistedEvents.stream().map(DomainEvent::getGlobalSequenceNumber).toList());
    }

    public boolean isEmpty() {
        return globalSequenceNumbers.isEmpty();
    }

    /**
     * @return the global sequence number of the last persisted event, if any
     */
    public OptionalLong newPosition() {
        return globalSequenceNumbers.stream().mapToLong(Long::longValue).max();
    }
}
