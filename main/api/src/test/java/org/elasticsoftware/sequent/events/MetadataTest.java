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

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class MetadataTest {

    @Test
    void testMergeKeepsReservedKeys() {
        Metadata eventMeta = new Metadata()
                .put(Metadata.AGGREGATE_ROOT_ID, "w1")
                .put(Metadata.SEQUENCE_NUMBER, "3")
                .put("source", "handler");
        Metadata commandMeta = new Metadata(Map.of(
                Metadata.AGGREGATE_ROOT_ID, "other",
                "source", "command",
                "user", "alice"));

        eventMeta.merge(commandMeta);

        assertEquals("w1", eventMeta.getAggregateRootId());
        assertEquals(3L, eventMeta.getSequenceNumber());
        assertEquals("command", eventMeta.get("source"));
        assertEquals("alice", eventMeta.get("user"));
        assertEquals(4, eventMeta.size());
    }

    @Test
    void testReservedKeysAreNeverCopied() {
        Metadata commandMeta = new Metadata()
                .put(Metadata.BATCH_ID, UUID.randomUUID().toString())
                .put(Metadata.GLOBAL_SEQUENCE_NUMBER, "99")
                .put("user", "alice");

        Metadata eventMeta = new Metadata().merge(commandMeta);

        assertNull(eventMeta.getBatchId());
        assertFalse(eventMeta.hasGlobalSequenceNumber());
        assertEquals(1, eventMeta.size());
    }

    @Test
    void testTypedAccessors() {
        UUID batchId = UUID.randomUUID();
        Metadata meta = new Metadata()
                .put(Metadata.GLOBAL_SEQUENCE_NUMBER, "42")
                .put(Metadata.BATCH_ID, batchId.toString())
                .put(Metadata.TIME_UTC, "2024-01-01T00:00:00Z");

        assertTrue(meta.hasGlobalSequenceNumber());
        assertEquals(42L, meta.getGlobalSequenceNumber());
        assertEquals(batchId, meta.getBatchId());
        assertEquals("2024-01-01T00:00:00Z", meta.getTimeUtc().toString());
        assertNull(meta.getAggregateRootId());
        assertThrows(IllegalStateException.class, meta::getSequenceNumber);
        assertThrows(UnsupportedOperationException.class, () -> meta.asMap().put("x", "y"));
    }
}
