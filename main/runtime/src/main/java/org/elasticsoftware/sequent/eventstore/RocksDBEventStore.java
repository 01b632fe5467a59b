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

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Longs;
import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.events.Metadata;
import org.elasticsoftware.sequent.serialization.DomainEventSerializer;
import org.rocksdb.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Event store on top of a local RocksDB {@link TransactionDB}.
 *
 * <p>Key layout:
 * <ul>
 *     <li>{@code 'E' + globalSeqNo} holds the serialized event</li>
 *     <li>{@code 'A' + aggregateRootId + 0x00 + seqNo} holds the global sequence number of the event</li>
 *     <li>{@code NEXT_GLOBAL_SEQ_NO} holds the next global sequence number to hand out</li>
 * </ul>
 * Numbers are big-endian so that iteration order matches numeric order.
 */
public class RocksDBEventStore implements EventStore, Closeable {
    private static final Logger log = LoggerFactory.getLogger(RocksDBEventStore.class);
    private static final byte EVENT_PREFIX = 0x45;
    private static final byte AGGREGATE_ROOT_PREFIX = 0x41;
    private static final byte[] NEXT_GLOBAL_SEQ_NO = new byte[]{0x4e, 0x45, 0x58, 0x54, 0x5f, 0x47, 0x53, 0x4e};
    private final TransactionDB db;
    private final File baseDir;
    private final DomainEventSerializer serializer;
    private long nextGlobalSequenceNumber = 1L;

    public RocksDBEventStore(String baseDir, String name, DomainEventSerializer serializer) {
        this.serializer = serializer;
        RocksDB.loadLibrary();
        final Options options = new Options();
        final TransactionDBOptions transactionDBOptions = new TransactionDBOptions();
        options.setCreateIfMissing(true);
        this.baseDir = new File(baseDir, name);
        try {
            Files.createDirectories(this.baseDir.getAbsoluteFile().toPath());
            db = TransactionDB.open(options, transactionDBOptions, this.baseDir.getAbsolutePath());
            initializeNextGlobalSequenceNumber();
            log.info("RocksDB event store {} initialized in folder {}, next global sequence number is {}",
                    name, this.baseDir.getAbsolutePath(), nextGlobalSequenceNumber);
        } catch (IOException | RocksDBException e) {
            throw new EventStoreException("Error initializing RocksDB", e);
        }
    }

    @Override
    public void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            log.error("Error syncing WAL. Exception: '{}', message: '{}'", e.getCause(), e.getMessage(), e);
        }
        db.close();
    }

    private void initializeNextGlobalSequenceNumber() throws RocksDBException {
        byte[] value = db.get(NEXT_GLOBAL_SEQ_NO);
        if (value != null) {
            nextGlobalSequenceNumber = Longs.fromByteArray(value);
        }
    }

    @Override
    public synchronized void save(UUID batchId, List<DomainEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        long globalSequenceNumber = nextGlobalSequenceNumber;
        List<Long> assigned = new ArrayList<>(batch.size());
        try (WriteOptions writeOptions = new WriteOptions();
             ReadOptions readOptions = new ReadOptions();
             Transaction transaction = db.beginTransaction(writeOptions)) {
            Set<String> checked = new HashSet<>();
            Map<String, Long> nextSequenceNumbers = new HashMap<>();
            for (DomainEvent event : batch) {
                String aggregateRootId = EventStores.requireAggregateRootId(event);
                long sequenceNumber = event.getSequenceNumber();
                if (checked.add(aggregateRootId)) {
                    // the first event of an aggregate root must directly follow what is stored
                    boolean taken = transaction.getForUpdate(readOptions, aggregateRootKey(aggregateRootId, sequenceNumber), true) != null;
                    boolean previousMissing = sequenceNumber > 1 &&
                            transaction.get(readOptions, aggregateRootKey(aggregateRootId, sequenceNumber - 1)) == null;
                    if (taken || previousMissing) {
                        transaction.rollback();
                        throw new ConcurrencyException(batchId, aggregateRootId, sequenceNumber);
                    }
                } else if (sequenceNumber != nextSequenceNumbers.get(aggregateRootId)) {
                    transaction.rollback();
                    throw new ConcurrencyException(batchId, aggregateRootId, sequenceNumber);
                }
                nextSequenceNumbers.put(aggregateRootId, sequenceNumber + 1);

                Map<String, String> persistenceMeta = Map.of(
                        Metadata.BATCH_ID, batchId.toString(),
                        Metadata.GLOBAL_SEQUENCE_NUMBER, Long.toString(globalSequenceNumber));
                transaction.put(eventKey(globalSequenceNumber), serializer.serialize(event, persistenceMeta));
                transaction.put(aggregateRootKey(aggregateRootId, sequenceNumber), Longs.toByteArray(globalSequenceNumber));
                assigned.add(globalSequenceNumber);
                globalSequenceNumber++;
            }
            transaction.put(NEXT_GLOBAL_SEQ_NO, Longs.toByteArray(globalSequenceNumber));
            transaction.commit();
        } catch (RocksDBException e) {
            throw new EventStoreException("Error saving batch " + batchId, e);
        }
        nextGlobalSequenceNumber = globalSequenceNumber;
        // only now the batch is durable the events get their positions
        for (int i = 0; i < batch.size(); i++) {
            batch.get(i).getMeta()
                    .put(Metadata.BATCH_ID, batchId.toString())
                    .put(Metadata.GLOBAL_SEQUENCE_NUMBER, Long.toString(assigned.get(i)));
        }
        log.trace("Saved batch {} with {} events, next global sequence number is {}", batchId, batch.size(), nextGlobalSequenceNumber);
    }

    @Override
    public Stream<DomainEvent> load(String aggregateRootId, long firstSeqNo) {
        byte[] prefix = aggregateRootPrefix(aggregateRootId);
        List<DomainEvent> events = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator()) {
            for (iterator.seek(aggregateRootKey(aggregateRootId, Math.max(firstSeqNo, 1L)));
                 iterator.isValid() && startsWith(iterator.key(), prefix);
                 iterator.next()) {
                byte[] data = db.get(eventKey(Longs.fromByteArray(iterator.value())));
                events.add(serializer.deserialize(data));
            }
            iterator.status();
        } catch (RocksDBException e) {
            throw new EventStoreException("Problem reading events of aggregate root " + aggregateRootId, e);
        }
        return events.stream();
    }

    /**
     * Streams lazily over the store, the returned stream must be closed.
     */
    @Override
    public Stream<DomainEvent> stream(long fromGlobalSeqNo) {
        RocksIterator iterator = db.newIterator();
        iterator.seek(eventKey(Math.max(fromGlobalSeqNo, 1L)));
        Iterator<DomainEvent> events = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iterator.isValid() && iterator.key().length > 0 && iterator.key()[0] == EVENT_PREFIX;
            }

            @Override
            public DomainEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                DomainEvent event = serializer.deserialize(iterator.value());
                iterator.next();
                return event;
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(events, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(iterator::close);
    }

    @Override
    public synchronized long getNextGlobalSequenceNumber() {
        return nextGlobalSequenceNumber;
    }

    private static byte[] eventKey(long globalSequenceNumber) {
        return Bytes.concat(new byte[]{EVENT_PREFIX}, Longs.toByteArray(globalSequenceNumber));
    }

    private static byte[] aggregateRootPrefix(String aggregateRootId) {
        return Bytes.concat(new byte[]{AGGREGATE_ROOT_PREFIX}, aggregateRootId.getBytes(StandardCharsets.UTF_8), new byte[]{0x00});
    }

    private static byte[] aggregateRootKey(String aggregateRootId, long sequenceNumber) {
        return Bytes.concat(aggregateRootPrefix(aggregateRootId), Longs.toByteArray(sequenceNumber));
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }
}
