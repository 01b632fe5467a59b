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

package org.elasticsoftware.sequent.commands;

import org.elasticsoftware.sequent.aggregate.wallet.*;
import org.elasticsoftware.sequent.errors.UnmappedCommandException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CommandMapperTest {

    @Test
    void testResolveRegisteredCommand() {
        CommandMapper commandMapper = WalletCommandHandlers.register(new CommandMapper());

        CommandMapping<?> mapping = commandMapper.resolve(new CreditWalletCommand("w1", BigDecimal.ONE));

        assertEquals(CreditWalletCommand.class, mapping.commandType());
        assertEquals(Wallet.class, mapping.aggregateRootType());
        assertNull(commandMapper.resolve(new TransferFundsCommand("a", "b", BigDecimal.ONE)).aggregateRootType());
        assertEquals(Set.of(CreateWalletCommand.class, CreditWalletCommand.class, DebitWalletCommand.class, TransferFundsCommand.class),
                commandMapper.getMappedCommandTypes());
    }

    @Test
    void testUnmappedCommand() {
        CommandMapper commandMapper = new CommandMapper();
        assertFalse(commandMapper.isMapped(CreditWalletCommand.class));
        assertThrows(UnmappedCommandException.class,
                () -> commandMapper.resolve(new CreditWalletCommand("w1", BigDecimal.ONE)));
    }

    @Test
    void testDuplicateRegistrationFails() {
        CommandMapper commandMapper = new CommandMapper()
                .register(CreditWalletCommand.class, Wallet.class, (command, wallet) -> wallet.credit(command.getAmount()));
        assertThrows(IllegalStateException.class, () -> commandMapper.register(CreditWalletCommand.class, Wallet.class,
                (command, wallet) -> wallet.credit(command.getAmount())));
        assertThrows(IllegalStateException.class, () -> commandMapper.map(CreditWalletCommand.class, (context, command) -> { }));
    }

    @Test
    void testAddMappings() {
        CommandMapper walletMappings = WalletCommandHandlers.register(new CommandMapper());
        CommandMapper commandMapper = new CommandMapper().addMappings(walletMappings);

        assertEquals(walletMappings.getMappedCommandTypes(), commandMapper.getMappedCommandTypes());
        assertThrows(IllegalStateException.class, () -> commandMapper.addMappings(walletMappings));
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void testRegistrationForOtherAggregateRootTypeFails() {
        CommandMapper commandMapper = new CommandMapper();
        // only reachable by bypassing the generic bounds
        assertThrows(IllegalArgumentException.class, () -> commandMapper.register(
                (Class) CreditWalletCommand.class, (Class) Vault.class, (CommandHandlerFunction) (command, root) -> { }));
        assertFalse(commandMapper.isMapped(CreditWalletCommand.class));
    }
}
