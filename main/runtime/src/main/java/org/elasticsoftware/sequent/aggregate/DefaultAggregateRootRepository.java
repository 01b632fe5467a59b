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
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.MethodType;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Rebuilds aggregate roots by replaying their events from the {@link EventStore}.
 *
 * <p>Instances are created through the {@link AggregateRootFactory} registered for their type or,
 * when there is none, through a public constructor taking an {@link AggregateRootContext}.
 */
public class DefaultAggregateRootRepository implements AggregateRootRepository {
    private static final Logger log = LoggerFactory.getLogger(DefaultAggregateRootRepository.class);
    private final EventStore eventStore;
    private final Map<Class<?>, AggregateRootFactory<?>> factories = new ConcurrentHashMap<>();

    public DefaultAggregateRootRepository(EventStore eventStore) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    }

    public <A extends AggregateRoot> DefaultAggregateRootRepository registerFactory(Class<A> aggregateRootType,
                                                                                    AggregateRootFactory<A> factory) {
        factories.put(aggregateRootType, factory);
        return this;
    }

    @Override
    public <A extends AggregateRoot> AggregateRootInfo<A> get(Class<A> aggregateRootType,
                                                              String aggregateRootId,
                                                              UnitOfWork unitOfWork,
                                                              boolean createIfNotExists) {
        return unitOfWork.getOrLoad(aggregateRootId, aggregateRootType,
                () -> load(aggregateRootType, aggregateRootId, unitOfWork, createIfNotExists));
    }

    @Override
    public boolean exists(Class<? extends AggregateRoot> aggregateRootType, String aggregateRootId) {
        try (Stream<DomainEvent> events = eventStore.load(aggregateRootId)) {
            return events.findAny().isPresent();
        }
    }

    private <A extends AggregateRoot> AggregateRootInfo<A> load(Class<A> aggregateRootType,
                                                                String aggregateRootId,
                                                                UnitOfWork unitOfWork,
                                                                boolean createIfNotExists) {
        List<DomainEvent> history;
        try (Stream<DomainEvent> events = eventStore.load(aggregateRootId)) {
            history = events.toList();
        }
        if (history.isEmpty() && !createIfNotExists) {
            throw new AggregateNotFoundException(aggregateRootType, aggregateRootId);
        }
        long lastSeqNo = 0L;
        long lastGlobalSeqNo = 0L;
        if (!history.isEmpty()) {
            DomainEvent lastEvent = history.get(history.size() - 1);
            lastSeqNo = lastEvent.getSequenceNumber();
            lastGlobalSeqNo = lastEvent.getGlobalSequenceNumber();
        }
        A aggregateRoot = getFactory(aggregateRootType).create(new AggregateRootContext(
                aggregateRootId,
                new SequenceNumberGenerator(lastSeqNo + 1),
                unitOfWork));
        history.forEach(aggregateRoot::hydrate);
        log.trace("Loaded {} with id {} at seqNo {} (globalSeqNo {})",
                aggregateRootType.getSimpleName(), aggregateRootId, lastSeqNo, lastGlobalSeqNo);
        return new AggregateRootInfo<>(aggregateRoot, lastSeqNo, lastGlobalSeqNo);
    }

    @SuppressWarnings("unchecked")
    private <A extends AggregateRoot> AggregateRootFactory<A> getFactory(Class<A> aggregateRootType) {
        return (AggregateRootFactory<A>) factories.computeIfAbsent(aggregateRootType, this::constructorFactory);
    }

    @SuppressWarnings("unchecked")
    private <A extends AggregateRoot> AggregateRootFactory<A> constructorFactory(Class<?> aggregateRootType) {
        MethodHandle constructor;
        try {
            constructor = MethodHandles.publicLookup().findConstructor(
                    aggregateRootType,
                    MethodType.methodType(void.class, AggregateRootContext.class));
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new IllegalArgumentException("No AggregateRootFactory registered for " + aggregateRootType.getName() +
                    " and it has no public constructor taking an AggregateRootContext", e);
        }
        return context -> {
            try {
                return (A) constructor.invoke(context);
            } catch (RuntimeException e) {
                throw e;
            } catch (Throwable e) {
                throw new IllegalStateException("Could not create " + aggregateRootType.getName(), e);
            }
        };
    }
}
