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

/**
 * Result of loading an aggregate root: the hydrated instance plus the positions of the last
 * persisted event. Both positions are 0 for an aggregate root without history.
 */
public record AggregateRootInfo<A extends AggregateRoot>(
        @NotNull A aggregateRoot,
        long lastSeqNo,
        long lastGlobalSeqNo
) {
    public boolean isNew() {
        return lastSeqNo == 0L;
    }
}
