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

import jakarta.annotation.Nullable;
import org.elasticsoftware.sequent.aggregate.AggregateRoot;

/**
 * A registered handler for one command type. Handlers bound to a single aggregate root carry
 * that type, handlers working on a {@link CommandContext} have none.
 */
public record CommandMapping<C extends Command>(
        Class<C> commandType,
        @Nullable Class<? extends AggregateRoot> aggregateRootType,
        ContextualCommandHandlerFunction<C> handler
) {
    public void invoke(CommandContext context, Command command) {
        handler.apply(context, commandType.cast(command));
    }
}
