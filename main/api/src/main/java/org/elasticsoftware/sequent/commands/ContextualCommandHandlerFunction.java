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

/**
 * Handler for commands that are not tied to one aggregate root at the type level. The handler
 * loads the aggregate roots it needs through the {@link CommandContext}.
 */
@FunctionalInterface
public interface ContextualCommandHandlerFunction<C extends Command> {
    void apply(@NotNull CommandContext context, @NotNull C command);
}
