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

import org.elasticsoftware.sequent.aggregate.wallet.Wallet;
import org.elasticsoftware.sequent.aggregate.wallet.WalletCreditedEvent;
import org.elasticsoftware.sequent.aggregate.wallet.Vault;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DefaultUnitOfWorkTest {

    @Test
    void testLoaderIsInvokedOncePerIdentity() {
        DefaultUnitOfWork unitOfWork = new DefaultUnitOfWork();
        AtomicInteger loads = new AtomicInteger();

        AggregateRootInfo<Wallet> first = unitOfWork.getOrLoad("w1", Wallet.class, () -> {
            loads.incrementAndGet();
            return newWallet(unitOfWork, "w1");
        });
        AggregateRootInfo<Wallet> second = unitOfWork.getOrLoad("w1", Wallet.class, () -> {
            loads.incrementAndGet();
            return newWallet(unitOfWork, "w1");
        });

        assertEquals(1, loads.get());
        assertSame(first, second);
        assertEquals(1, unitOfWork.getCachedAggregateRoots().size());
    }

    @Test
    void testIncompatibleTypeFails() {
        DefaultUnitOfWork unitOfWork = new DefaultUnitOfWork();
        unitOfWork.getOrLoad("w1", Wallet.class, () -> newWallet(unitOfWork, "w1"));

        assertThrows(IllegalStateException.class,
                () -> unitOfWork.getOrLoad("w1", Vault.class, () -> {
                    throw new AssertionError("should not load");
                }));
    }

    @Test
    void testEmittedEventsKeepEmissionOrder() {
        DefaultUnitOfWork unitOfWork = new DefaultUnitOfWork();
        Wallet a = unitOfWork.getOrLoad("a", Wallet.class, () -> newWallet(unitOfWork, "a")).aggregateRoot();
        Wallet b = unitOfWork.getOrLoad("b", Wallet.class, () -> newWallet(unitOfWork, "b")).aggregateRoot();

        a.credit(BigDecimal.ONE);
        b.credit(BigDecimal.TEN);
        a.credit(BigDecimal.TEN);

        List<String> ids = unitOfWork.getEmittedEvents().stream().map(event -> event.getAggregateRootId()).toList();
        assertEquals(List.of("a", "b", "a"), ids);
        assertEquals(List.of(1L, 1L, 2L), unitOfWork.getEmittedEvents().stream().map(event -> event.getSequenceNumber()).toList());
        assertThrows(UnsupportedOperationException.class,
                () -> unitOfWork.getEmittedEvents().add(new WalletCreditedEvent("a", BigDecimal.ONE)));
    }

    private static AggregateRootInfo<Wallet> newWallet(UnitOfWork unitOfWork, String id) {
        return new AggregateRootInfo<>(
                new Wallet(new AggregateRootContext(id, new SequenceNumberGenerator(1L), unitOfWork)), 0L, 0L);
    }
}
