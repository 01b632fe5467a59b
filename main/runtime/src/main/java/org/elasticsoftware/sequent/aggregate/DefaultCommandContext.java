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

import org.elasticsoftware.sequent.commands.CommandContext;

public class DefaultCommandContext implements CommandContext {
    private final UnitOfWork unitOfWork;
    private final AggregateRootRepository aggregateRootRepository;

    public DefaultCommandContext(UnitOfWork unitOfWork, AggregateRootRepository aggregateRootRepository) {
        this.unitOfWork = unitOfWork;
        this.aggregateRootRepository = aggregateRootRepository;
    }

    @Override
    public <A extends AggregateRoot> A load(Class<A> aggregateRootType, String aggregateRootId, boolean createIfNotExists) {
        return aggregateRootRepository.get(aggregateRootType, aggregateRootId, unitOfWork, createIfNotExists).aggregateRoot();
    }
}
