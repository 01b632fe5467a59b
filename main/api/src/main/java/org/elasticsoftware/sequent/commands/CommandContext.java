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

package org.elasticsoftware.sequent.commands;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.aggregate.AggregateNotFoundException;
import org.elasticsoftware.sequent.aggregate.AggregateRoot;

public interface CommandContext {
    /**
     * Loads the aggregate root, failing with {@link AggregateNotFoundException} when it has no
     * history yet.
     */
    default <A extends AggregateRoot> A load(@NotNull Class<A> aggregateRootType, @NotNull String aggregateRootId) {
        return load(aggregateRootType, aggregateRootId, false);
    }

    <A extends AggregateRoot> A load(@NotNull Class<A> aggregateRootType,
                                     @NotNull String aggregateRootId,
                                     boolean createIfNotExists);
}
