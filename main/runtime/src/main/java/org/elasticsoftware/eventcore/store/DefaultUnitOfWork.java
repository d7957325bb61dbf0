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

package org.elasticsoftware.eventcore.store;

import org.elasticsoftware.eventcore.errors.UnitOfWorkDispatchException;
import org.elasticsoftware.eventcore.events.DomainEvent;
import org.elasticsoftware.eventcore.events.EventDispatcher;
import org.elasticsoftware.eventcore.events.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Saves the registered events in one call to the {@link EventStore} and hands the envelopes to the
 * {@link EventDispatcher}. When dispatching fails the events stay persisted; the resulting
 * {@link UnitOfWorkDispatchException} carries the envelopes so the caller can retry the dispatch.
 * When saving fails the registered events are discarded and the unit of work can be used again.
 */
public class DefaultUnitOfWork implements UnitOfWork {
    private static final Logger logger = LoggerFactory.getLogger(DefaultUnitOfWork.class);

    private final EventStore eventStore;
    private final EventDispatcher eventDispatcher;
    private final List<DomainEvent> events = new ArrayList<>();
    private boolean committed = false;

    public DefaultUnitOfWork(EventStore eventStore, EventDispatcher eventDispatcher) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.eventDispatcher = Objects.requireNonNull(eventDispatcher, "eventDispatcher");
    }

    @Override
    public synchronized void registerEvents(List<? extends DomainEvent> events) {
        if (committed) {
            throw new IllegalStateException("Cannot register events on a committed unit of work");
        }
        this.events.addAll(events);
    }

    @Override
    public synchronized List<EventEnvelope> commit() {
        if (committed) {
            throw new IllegalStateException("Unit of work is already committed");
        }
        if (events.isEmpty()) {
            committed = true;
            return List.of();
        }
        List<EventEnvelope> envelopes;
        try {
            envelopes = eventStore.save(List.copyOf(events));
        } catch (RuntimeException e) {
            logger.debug("Saving {} event(s) failed, discarding them", events.size());
            events.clear();
            throw e;
        }
        committed = true;
        events.clear();
        try {
            eventDispatcher.dispatch(envelopes);
        } catch (RuntimeException e) {
            logger.warn("Persisted {} event(s) but dispatching them failed", envelopes.size(), e);
            throw new UnitOfWorkDispatchException(envelopes, e);
        }
        return envelopes;
    }

    @Override
    public synchronized void rollback() {
        if (committed) {
            throw new IllegalStateException("Cannot roll back a committed unit of work");
        }
        events.clear();
    }

    public synchronized int getRegisteredEventCount() {
        return events.size();
    }
}
