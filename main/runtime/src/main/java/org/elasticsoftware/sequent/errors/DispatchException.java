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

import java.util.List;
import java.util.stream.Collectors;

/**
 * The events were saved but could not be delivered to the event dispatcher. Views may be stale
 * until the dispatcher is initialized again.
 */
public class DispatchException extends SequentException {
    private final List<Long> globalSequenceNumbers;

    public DispatchException(List<Long> globalSequenceNumbers, Throwable cause) {
        super("An error occurred while dispatching events with global sequence numbers " +
                globalSequenceNumbers.stream().map(String::valueOf).collect(Collectors.joining(", ")) +
                " to the event dispatcher. The events were properly saved in the event store," +
                " but you might need to re-initialize the event dispatcher", cause);
        this.globalSequenceNumbers = List.copyOf(globalSequenceNumbers);
    }

    public List<Long> getGlobalSequenceNumbers() {
        return globalSequenceNumbers;
    }
}
