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

package org.elasticsoftware.sequent.errors;

import org.elasticsoftware.sequent.SequentException;
import org.elasticsoftware.sequent.commands.Command;

public class UnmappedCommandException extends SequentException {
    private final Class<? extends Command> commandType;

    public UnmappedCommandException(Class<? extends Command> commandType) {
        super("No handler has been registered for command " + commandType.getName());
        this.commandType = commandType;
    }

    public Class<? extends Command> getCommandType() {
        return commandType;
    }
}
