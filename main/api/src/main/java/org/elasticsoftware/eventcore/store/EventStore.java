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

import org.elasticsoftware.eventcore.errors.ConcurrencyException;
import org.elasticsoftware.eventcore.events.DomainEvent;
import org.elasticsoftware.eventcore.events.EventEnvelope;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage of domain events, keyed by aggregate id and ordered by sequence number.
 */
public interface EventStore extends AutoCloseable {
    /**
     * Appends the events and returns their envelopes in the same order. For every aggregate in the
     * batch the events must continue the stored sequence without gaps.
     *
     * @throws ConcurrencyException when another writer got there first; nothing is stored in that case
     */
    List<EventEnvelope> save(List<? extends DomainEvent> events);

    List<EventEnvelope> load(String aggregateId);

    /**
     * Envelopes with a sequence number of at least {@code fromSequenceNo}.
     */
    List<EventEnvelope> loadFromSequence(String aggregateId, long fromSequenceNo);

    /**
     * Envelopes between both bounds, inclusive. A bound of {@code -1} leaves that side open.
     */
    List<EventEnvelope> loadRange(String aggregateId, long fromSequenceNo, long toSequenceNo);

    Optional<EventEnvelope> findEvent(String eventId);

    /**
     * @return the sequence number of the last stored event, or 0 when the aggregate is unknown
     */
    long getCurrentSequenceNo(String aggregateId);

    @Override
    void close();
}
