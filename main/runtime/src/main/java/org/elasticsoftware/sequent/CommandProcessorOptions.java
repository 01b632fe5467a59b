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

package org.elasticsoftware.sequent;

import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class CommandProcessorOptions {
    public static final int DEFAULT_MAX_RETRIES = 10;

    private volatile int maxRetries = DEFAULT_MAX_RETRIES;
    private volatile boolean purgeExistingViews = false;
    private final Set<Class<? extends Throwable>> domainExceptionTypes = ConcurrentHashMap.newKeySet();

    public int getMaxRetries() {
        return maxRetries;
    }

    /**
     * Number of times a command is executed again after its events collided with a concurrent
     * write, on top of the first attempt.
     */
    public CommandProcessorOptions setMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        return this;
    }

    public boolean isPurgeExistingViews() {
        return purgeExistingViews;
    }

    public CommandProcessorOptions setPurgeExistingViews(boolean purgeExistingViews) {
        this.purgeExistingViews = purgeExistingViews;
        return this;
    }

    public Set<Class<? extends Throwable>> getDomainExceptionTypes() {
        return Collections.unmodifiableSet(domainExceptionTypes);
    }

    /**
     * Exceptions of these types (or subtypes) signal a rejected command and reach the caller
     * without being wrapped.
     */
    @SafeVarargs
    public final CommandProcessorOptions addDomainExceptionTypes(Class<? extends Throwable>... types) {
        Collections.addAll(domainExceptionTypes, types);
        return this;
    }

    public boolean isDomainException(Throwable throwable) {
        return domainExceptionTypes.stream().anyMatch(type -> type.isInstance(throwable));
    }
}
