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

import org.elasticsoftware.sequent.events.DomainEvent;

import java.util.*;
import java.util.function.Supplier;

/**
 * Unit of work for one command execution attempt. Confined to a single thread and discarded
 * after the attempt, whatever its outcome.
 */
public class DefaultUnitOfWork implements UnitOfWork {
    private final Map<String, AggregateRootInfo<?>> cachedAggregateRoots = new HashMap<>();
    private final List<DomainEvent> emittedEvents = new ArrayList<>();

    @Override
    @SuppressWarnings("unchecked")
    public <A extends AggregateRoot> AggregateRootInfo<A> getOrLoad(String aggregateRootId,
                                                                    Class<A> aggregateRootType,
                                                                    Supplier<AggregateRootInfo<A>> loader) {
        AggregateRootInfo<?> cached = cachedAggregateRoots.get(aggregateRootId);
        if (cached != null) {
            if (!aggregateRootType.isInstance(cached.aggregateRoot())) {
                throw new IllegalStateException("Aggregate root " + aggregateRootId + " was loaded as " +
                        cached.aggregateRoot().getClass().getSimpleName() + " and cannot be used as " +
                        aggregateRootType.getSimpleName());
            }
            return (AggregateRootInfo<A>) cached;
        }
        AggregateRootInfo<A> loaded = loader.get();
        cachedAggregateRoots.put(aggregateRootId, loaded);
        return loaded;
    }

    @Override
    public void record(DomainEvent event) {
        emittedEvents.add(Objects.requireNonNull(event, "event"));
    }

    @Override
    public List<DomainEvent> getEmittedEvents() {
        return List.copyOf(emittedEvents);
    }

    public Collection<AggregateRootInfo<?>> getCachedAggregateRoots() {
        return Collections.unmodifiableCollection(cachedAggregateRoots.values());
    }
}
