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

package org.elasticsoftware.eventcoretest.wallet;

import org.elasticsoftware.eventcore.events.EventEnvelope;
import org.elasticsoftware.eventcore.events.EventHandler;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class WalletBalanceProjection implements EventHandler {
    private final Map<String, BigDecimal> balances = new ConcurrentHashMap<>();

    @Override
    public void handle(EventEnvelope envelope) {
        if (envelope.getEvent() instanceof WalletCreatedEvent created) {
            balances.put(created.getAggregateId(), BigDecimal.ZERO);
        } else if (envelope.getEvent() instanceof WalletCreditedEvent credited) {
            balances.put(credited.getAggregateId(), credited.getBalance());
        }
    }

    @Override
    public List<String> getEventTypes() {
        return List.of("Wallet.*");
    }

    public BigDecimal getBalance(String walletId) {
        return balances.get(walletId);
    }
}
