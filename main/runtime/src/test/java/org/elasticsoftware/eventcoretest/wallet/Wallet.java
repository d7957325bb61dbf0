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

import org.elasticsoftware.eventcore.aggregate.EventSourcedAggregate;
import org.elasticsoftware.eventcore.events.DomainEvent;

import java.math.BigDecimal;
import java.util.List;

public class Wallet extends EventSourcedAggregate {
    private String currency;
    private BigDecimal balance = BigDecimal.ZERO;

    public Wallet(String id) {
        super(id);
    }

    private Wallet(Wallet source) {
        super(source);
        this.currency = source.currency;
        this.balance = source.balance;
    }

    public void create(String currency) {
        if (this.currency != null) {
            throw new IllegalStateException("Wallet " + getId() + " already exists");
        }
        WalletCreatedEvent event = new WalletCreatedEvent(getId(), currency);
        apply(event);
        addEvent(event);
    }

    public void credit(BigDecimal amount) {
        if (currency == null) {
            throw new IllegalStateException("Wallet " + getId() + " does not exist");
        }
        WalletCreditedEvent event = new WalletCreditedEvent(getId(), amount, balance.add(amount));
        apply(event);
        addEvent(event);
    }

    @Override
    public void loadFromHistory(List<? extends DomainEvent> events) {
        currency = null;
        balance = BigDecimal.ZERO;
        events.forEach(this::apply);
        super.loadFromHistory(events);
    }

    private void apply(DomainEvent event) {
        if (event instanceof WalletCreatedEvent created) {
            currency = created.getCurrency();
        } else if (event instanceof WalletCreditedEvent credited) {
            balance = credited.getBalance();
        }
    }

    @Override
    public Wallet copy() {
        return new Wallet(this);
    }

    public String getCurrency() {
        return currency;
    }

    public BigDecimal getBalance() {
        return balance;
    }
}
