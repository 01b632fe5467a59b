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

/**
 * Wraps an unexpected failure while loading, handling or persisting. Nothing of the command has
 * been persisted when this is thrown.
 */
public class CommandProcessingException extends SequentException {
    private final transient Command command;

    private CommandProcessingException(Command command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    public static CommandProcessingException create(Command command, Throwable cause) {
        return new CommandProcessingException(command,
                "An error occurred while processing command " + command + ": " + cause.getMessage(),
                cause);
    }

    public Command getCommand() {
        return command;
    }
}
