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

package org.elasticsoftware.sequent.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Re-executes an action when it fails with a designated conflict exception.
 */
public final class Retryer {
    private static final Logger log = LoggerFactory.getLogger(Retryer.class);

    /**
     * Runs {@code action} once and re-runs it at most {@code maxRetries} times for as long as it
     * fails with {@code conflictType}. When the retries are exhausted the last conflict is
     * rethrown as is. Any other exception is rethrown immediately.
     */
    public <T, E extends RuntimeException> T retryOn(Class<E> conflictType, Supplier<T> action, int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative, got " + maxRetries);
        }
        int retries = 0;
        while (true) {
            Attempt<T> attempt = attempt(conflictType, action);
            if (attempt instanceof Success<T> success) {
                return success.value();
            } else if (attempt instanceof Conflict<T> conflict) {
                if (retries >= maxRetries) {
                    log.warn("Giving up after {} retries, last conflict: {}", retries, conflict.exception().getMessage());
                    throw conflict.exception();
                }
                retries++;
                log.warn("Conflict detected, retrying ({}/{}): {}", retries, maxRetries, conflict.exception().getMessage());
            } else {
                throw ((Fatal<T>) attempt).exception();
            }
        }
    }

    private <T> Attempt<T> attempt(Class<? extends RuntimeException> conflictType, Supplier<T> action) {
        try {
            return new Success<>(action.get());
        } catch (RuntimeException e) {
            return conflictType.isInstance(e) ? new Conflict<>(e) : new Fatal<>(e);
        }
    }

    sealed interface Attempt<T> permits Success, Conflict, Fatal {
    }

    record Success<T>(T value) implements Attempt<T> {
    }

    record Conflict<T>(RuntimeException exception) implements Attempt<T> {
    }

    record Fatal<T>(RuntimeException exception) implements Attempt<T> {
    }
}
