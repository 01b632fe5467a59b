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

package org.elasticsoftware.sequent.views;

import org.elasticsoftware.sequent.SequentException;

import java.util.List;

public class ViewDispatchException extends SequentException {
    private final List<String> failedViewManagers;

    public ViewDispatchException(List<String> failedViewManagers, Throwable cause) {
        super("Dispatching to view manager(s) " + String.join(", ", failedViewManagers) + " failed", cause);
        this.failedViewManagers = List.copyOf(failedViewManagers);
    }

    public List<String> getFailedViewManagers() {
        return failedViewManagers;
    }
}
