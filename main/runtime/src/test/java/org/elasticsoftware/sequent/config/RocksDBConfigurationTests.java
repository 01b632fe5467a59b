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

package org.elasticsoftware.sequent.config;

import org.elasticsoftware.sequent.CommandProcessor;
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.elasticsoftware.sequent.eventstore.RocksDBEventStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = CommandProcessorConfiguration.class,
        properties = {
                "sequent.eventstore.type=rocksdb",
                "sequent.rocksdb.baseDir=target/rocksdb",
                "sequent.rocksdb.name=configuration-tests",
                "sequent.commandprocessor.purge-existing-views=true"
        })
public class RocksDBConfigurationTests {
    @Autowired
    private EventStore eventStore;
    @Autowired
    private CommandProcessor commandProcessor;

    @Test
    void testRocksDBEventStoreIsSelected() {
        assertInstanceOf(RocksDBEventStore.class, eventStore);
        assertTrue(commandProcessor.getOptions().isPurgeExistingViews());
        assertEquals(10, commandProcessor.getOptions().getMaxRetries());
    }
}
