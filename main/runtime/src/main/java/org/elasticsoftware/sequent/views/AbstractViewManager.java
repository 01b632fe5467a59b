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

import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Stream;

/**
 * Base class for view managers that track the global sequence number of the last event they have
 * applied. Events at or below that position are skipped and a gap in front of a dispatched batch is
 * filled from the event store, so dispatching is idempotent and ordered.
 */
public abstract class AbstractViewManager implements ViewManager {
    private static final Logger log = LoggerFactory.getLogger(AbstractViewManager.class);
    private long position = 0L;

    @Override
    public synchronized void initialize(EventStore eventStore, boolean purgeExistingViews) {
        if (purgeExistingViews) {
            log.info("Purging views of {}", getName());
            purge();
            position = 0L;
        }
        catchUp(eventStore);
    }

    @Override
    public synchronized void dispatch(EventStore eventStore, List<DomainEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        if (events.get(0).getGlobalSequenceNumber() > position + 1) {
            log.debug("{} is at position {} and received events from {}, catching up",
                    getName(), position, events.get(0).getGlobalSequenceNumber());
            catchUp(eventStore);
            return;
        }
        List<DomainEvent> newEvents = events.stream()
                .filter(event -> event.getGlobalSequenceNumber() > position)
                .toList();
        if (!newEvents.isEmpty()) {
            apply(newEvents);
            position = newEvents.get(newEvents.size() - 1).getGlobalSequenceNumber();
        }
    }

    @Override
    public synchronized long getPosition() {
        return position;
    }

    private void catchUp(EventStore eventStore) {
        long start = position;
        try (Stream<DomainEvent> events = eventStore.stream(position + 1)) {
            events.forEach(event -> {
                apply(List.of(event));
                position = event.getGlobalSequenceNumber();
            });
        }
        log.info("{} caught up from position {} to {}", getName(), start, position);
    }

    /**
     * Applies events in global order. Called with the lock of this view manager held.
     */
    protected abstract void apply(List<DomainEvent> events);

    /**
     * Discards the state of all views.
     */
    protected abstract void purge();
}
