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

package org.elasticsoftware.sequent.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;

/**
 * Base class for all domain events. Subclasses hold their payload in final fields, everything the
 * engine needs to know about an event lives in its {@link Metadata}.
 */
public abstract class DomainEvent {
    private final Metadata meta = new Metadata();

    @JsonIgnore
    @NotNull
    public Metadata getMeta() {
        return meta;
    }

    @JsonIgnore
    public String getAggregateRootId() {
        return meta.getAggregateRootId();
    }

    @JsonIgnore
    public long getSequenceNumber() {
        return meta.getSequenceNumber();
    }

    @JsonIgnore
    public long getGlobalSequenceNumber() {
        return meta.getGlobalSequenceNumber();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + meta;
    }
}
