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

package org.elasticsoftware.sequent.eventstore;

import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.events.Metadata;

final class EventStores {
    private EventStores() {
    }

    static String requireAggregateRootId(DomainEvent event) {
        String aggregateRootId = event.getAggregateRootId();
        if (aggregateRootId == null || !event.getMeta().containsKey(Metadata.SEQUENCE_NUMBER)) {
            throw new IllegalArgumentException("Event " + event.getClass().getSimpleName() +
                    " has not been emitted by an aggregate root: " + event.getMeta());
        }
        return aggregateRootId;
    }
}
