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

package org.elasticsoftware.sequent.aggregate.wallet;

import org.elasticsoftware.sequent.events.DomainEvent;
import org.elasticsoftware.sequent.events.Metadata;

import java.math.BigDecimal;

public final class WalletEvents {
    private WalletEvents() {
    }

    /**
     * A credit of one as if it was emitted by the wallet, but not yet saved.
     */
    public static DomainEvent emitted(String walletId, long seqNo) {
        WalletCreditedEvent event = new WalletCreditedEvent(walletId, BigDecimal.ONE);
        event.getMeta()
                .put(Metadata.AGGREGATE_ROOT_ID, walletId)
                .put(Metadata.SEQUENCE_NUMBER, Long.toString(seqNo));
        return event;
    }
}
