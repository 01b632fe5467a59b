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

/**
 * Hands out the per aggregate sequence numbers for newly emitted events, starting at the number
 * following the last persisted one. Instances are owned by a single aggregate root and are not
 * thread-safe.
 */
public final class SequenceNumberGenerator {
    private long nextSequenceNumber;

    public SequenceNumberGenerator(long firstSequenceNumber) {
        if (firstSequenceNumber < 1) {
            throw new IllegalArgumentException("Sequence numbers start at 1, got " + firstSequenceNumber);
        }
        this.nextSequenceNumber = firstSequenceNumber;
    }

    public long next() {
        return nextSequenceNumber++;
    }

    public long peek() {
        return nextSequenceNumber;
    }
}
