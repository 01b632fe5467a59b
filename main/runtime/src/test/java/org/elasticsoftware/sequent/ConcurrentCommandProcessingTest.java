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

import org.elasticsoftware.sequent.aggregate.DefaultAggregateRootRepository;
import org.elasticsoftware.sequent.aggregate.wallet.CreditWalletCommand;
import org.elasticsoftware.sequent.aggregate.wallet.Wallet;
import org.elasticsoftware.sequent.aggregate.wallet.WalletCommandHandlers;
import org.elasticsoftware.sequent.aggregate.wallet.TransferFundsCommand;
import org.elasticsoftware.sequent.commands.CommandMapper;
import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.eventstore.InMemoryEventStore;
import org.elasticsoftware.sequent.views.ViewManagerEventDispatcher;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentCommandProcessingTest {

    @Test
    void testConcurrentCommandsOnSameAggregateRoot() throws Exception {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        CyclicBarrier bothLoaded = new CyclicBarrier(2);
        AtomicInteger attempts = new AtomicInteger();
        CommandMapper commandMapper = new CommandMapper()
                .register(CreditWalletCommand.class, Wallet.class, (command, wallet) -> {
                    // the first two attempts run side by side on the same state
                    if (attempts.incrementAndGet() <= 2) {
                        try {
                            bothLoaded.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException | BrokenBarrierException | TimeoutException e) {
                            throw new IllegalStateException(e);
                        }
                    }
                    wallet.credit(command.getAmount());
                });
        CommandProcessor commandProcessor = new CommandProcessor(eventStore,
                new DefaultAggregateRootRepository(eventStore),
                new ViewManagerEventDispatcher(),
                commandMapper,
                new CommandProcessorOptions().setMaxRetries(3));

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<CommandProcessingResult> first = executor.submit(
                    () -> commandProcessor.processCommand(new CreditWalletCommand("w1", BigDecimal.ONE)));
            Future<CommandProcessingResult> second = executor.submit(
                    () -> commandProcessor.processCommand(new CreditWalletCommand("w1", BigDecimal.TEN)));
            first.get(30, TimeUnit.SECONDS);
            second.get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(3, attempts.get());
        List<DomainEvent> events = eventStore.load("w1").toList();
        assertEquals(2, events.size());
        assertEquals(1L, events.get(0).getSequenceNumber());
        assertEquals(2L, events.get(1).getSequenceNumber());
        assertEquals(1L, events.get(0).getGlobalSequenceNumber());
        assertEquals(2L, events.get(1).getGlobalSequenceNumber());
        assertNotEquals(events.get(0).getMeta().getBatchId(), events.get(1).getMeta().getBatchId());
        assertEquals(3L, eventStore.getNextGlobalSequenceNumber());
    }

    @Test
    void testTransferTouchesBothWalletsInOneBatch() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        CommandProcessor commandProcessor = new CommandProcessor(eventStore,
                new DefaultAggregateRootRepository(eventStore),
                new ViewManagerEventDispatcher(),
                WalletCommandHandlers.register(new CommandMapper()),
                new CommandProcessorOptions());
        commandProcessor.processCommand(new CreditWalletCommand("from", new BigDecimal("100")));
        commandProcessor.processCommand(new CreditWalletCommand("to", new BigDecimal("5")));

        CommandProcessingResult result = commandProcessor.processCommand(
                new TransferFundsCommand("from", "to", new BigDecimal("40")));

        assertEquals(List.of(3L, 4L), result.globalSequenceNumbers());
        List<DomainEvent> transfer = eventStore.stream(3L).toList();
        assertEquals("from", transfer.get(0).getAggregateRootId());
        assertEquals(2L, transfer.get(0).getSequenceNumber());
        assertEquals("to", transfer.get(1).getAggregateRootId());
        assertEquals(2L, transfer.get(1).getSequenceNumber());
        assertEquals(transfer.get(0).getMeta().getBatchId(), transfer.get(1).getMeta().getBatchId());
    }
}
