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

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.sequent.events.Metadata;

/**
 * Base class of everything that can be handed to the command processor. The metadata is copied
 * onto every event the command causes.
 */
public abstract class Command {
    private final Metadata meta = new Metadata();

    @JsonIgnore
    @NotNull
    public Metadata getMeta() {
        return meta;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + meta;
    }
}
