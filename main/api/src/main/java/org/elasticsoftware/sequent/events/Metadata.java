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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.*;

/**
 * String keyed metadata attached to commands and domain events.
 *
 * <p>A number of keys are reserved and owned by the engine, they are written while emitting and
 * persisting events and are never taken over by {@link #merge(Metadata)}.
 */
public final class Metadata {
    public static final String AGGREGATE_ROOT_ID = "aggregate_root_id";
    public static final String SEQUENCE_NUMBER = "seq_no";
    public static final String GLOBAL_SEQUENCE_NUMBER = "global_seq_no";
    public static final String BATCH_ID = "batch_id";
    public static final String TIME_UTC = "time_utc";

    public static final Set<String> RESERVED_KEYS =
            Set.of(AGGREGATE_ROOT_ID, SEQUENCE_NUMBER, GLOBAL_SEQUENCE_NUMBER, BATCH_ID, TIME_UTC);

    private final Map<String, String> entries;

    public Metadata() {
        this.entries = new LinkedHashMap<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Metadata(Map<String, String> entries) {
        this.entries = new LinkedHashMap<>(entries);
    }

    public Metadata put(String key, String value) {
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
        return this;
    }

    @Nullable
    public String get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Copies the entries of {@code other} into this instance. Entries of {@code other} replace
     * existing values. The {@link #RESERVED_KEYS} of {@code other} are never copied.
     */
    public Metadata merge(Metadata other) {
        other.entries.forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key)) {
                entries.put(key, value);
            }
        });
        return this;
    }

    @JsonValue
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    @Nullable
    public String getAggregateRootId() {
        return entries.get(AGGREGATE_ROOT_ID);
    }

    public long getSequenceNumber() {
        return getLong(SEQUENCE_NUMBER);
    }

    public boolean hasGlobalSequenceNumber() {
        return entries.containsKey(GLOBAL_SEQUENCE_NUMBER);
    }

    public long getGlobalSequenceNumber() {
        return getLong(GLOBAL_SEQUENCE_NUMBER);
    }

    @Nullable
    public UUID getBatchId() {
        String batchId = entries.get(BATCH_ID);
        return batchId != null ? UUID.fromString(batchId) : null;
    }

    @Nullable
    public Instant getTimeUtc() {
        String time = entries.get(TIME_UTC);
        return time != null ? Instant.parse(time) : null;
    }

    private long getLong(String key) {
        String value = entries.get(key);
        if (value == null) {
            throw new IllegalStateException("Metadata does not contain a value for '" + key + "'");
        }
        return Long.parseLong(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Metadata) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
