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

import java.util.List;
import java.util.function.Supplier;

/**
 * Scope of a single command execution attempt. Caches the aggregate roots loaded during the
 * attempt and collects the events they emit, in emission order.
 */
public interface UnitOfWork {
    /**
     * Returns the cached aggregate root for {@code aggregateRootId} or invokes {@code loader} and
     * caches its result. The loader is invoked at most once per identity.
     */
    <A extends AggregateRoot> AggregateRootInfo<A> getOrLoad(@NotNull String aggregateRootId,
                                                             @NotNull Class<A> aggregateRootType,
                                                             @NotNull Supplier<AggregateRootInfo<A>> loader);

    void record(@NotNull DomainEvent event);

    @NotNull
    List<DomainEvent> getEmittedEvents();
}
