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

package org.elasticsoftware.sequent.views;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.eventstore.EventStore;

import java.util.List;

/**
 * Delivers persisted events to the read side.
 */
public interface EventDispatcher {
    /**
     * Lets the views catch up with everything in the event store, optionally discarding their
     * current state first.
     */
    void initialize(@NotNull EventStore eventStore, boolean purgeExistingViews);

    /**
     * Applies a batch of events that has just been persisted. A failure here does not affect the
     * events already stored.
     */
    void dispatch(@NotNull EventStore eventStore, @NotNull List<DomainEvent> events);
}
