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

import org.elasticsoftware.sequent.CommandProcessingResult;
import org.elasticsoftware.sequent.CommandProcessor;
import org.elasticsoftware.sequent.aggregate.wallet.CreditWalletCommand;
import org.elasticsoftware.sequent.aggregate.wallet.DebitWalletCommand;
import org.elasticsoftware.sequent.aggregate.wallet.InsufficientFundsException;
import org.elasticsoftware.sequent.aggregate.wallet.WalletCommandHandlers;
import org.elasticsoftware.sequent.eventstore.EventStore;
import org.elasticsoftware.sequent.eventstore.InMemoryEventStore;
import org.elasticsoftware.sequent.views.ViewManager;
import org.elasticsoftware.sequent.views.WalletBalanceViewManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = {CommandProcessorConfiguration.class, CommandProcessorConfigurationTests.WalletConfiguration.class},
        properties = {
                "sequent.commandprocessor.max-retries=3",
                "sequent.commandprocessor.domain-exception-types=org.elasticsoftware.sequent.aggregate.wallet.InsufficientFundsException"
        })
public class CommandProcessorConfigurationTests {
    @Autowired
    private CommandProcessor commandProcessor;
    @Autowired
    private EventStore eventStore;
    @Autowired
    private WalletBalanceViewManager viewManager;

    @Test
    void testContextLoads() {
        assertInstanceOf(InMemoryEventStore.class, eventStore);
        assertEquals(3, commandProcessor.getOptions().getMaxRetries());
        assertTrue(commandProcessor.getOptions().getDomainExceptionTypes().contains(InsufficientFundsException.class));
    }

    @Test
    void testCommandsFlowToViews() {
        CommandProcessingResult result = commandProcessor.processCommand(new CreditWalletCommand("spring-wallet", new BigDecimal("5")));

        assertEquals(result.newPosition().orElseThrow(), viewManager.getPosition());
        assertEquals(0, new BigDecimal("5").compareTo(viewManager.getBalance("spring-wallet")));
        assertThrows(InsufficientFundsException.class,
                () -> commandProcessor.processCommand(new DebitWalletCommand("spring-wallet", new BigDecimal("50"))));
    }

    @Configuration
    static class WalletConfiguration {
        @Bean
        public CommandMapperCustomizer walletHandlers() {
            return WalletCommandHandlers::register;
        }

        @Bean
        public WalletBalanceViewManager walletBalanceViewManager() {
            return new WalletBalanceViewManager();
        }
    }
}
