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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link EventStore} that keeps every event stream in memory. Meant for tests and prototypes; all
 * data is lost on {@link #close()}.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<EventEnvelope>> streams = new HashMap<>();
    private final Map<String, EventEnvelope> eventsById = new HashMap<>();
    private final Clock clock;
    private boolean closed = false;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<EventEnvelope> save(List<? extends DomainEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }
        lock.writeLock().lock();
        try {
            ensureOpen();
            checkSequences(events);
            List<EventEnvelope> envelopes = new ArrayList<>(events.size());
            for (DomainEvent event : events) {
                EventEnvelope envelope = new DefaultEventEnvelope(UUID.randomUUID().toString(),
                        event,
                        event.getMetadata(),
                        clock.instant());
                streams.computeIfAbsent(event.getAggregateId(), id -> new ArrayList<>()).add(envelope);
                eventsById.put(envelope.getEventId(), envelope);
                envelopes.add(envelope);
            }
            logger.debug("Saved {} event(s)", envelopes.size());
            return envelopes;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Every event has to follow the last stored (or previously checked) event of its aggregate.
     * Runs before anything is written so a conflict leaves the store untouched.
     */
    private void checkSequences(List<? extends DomainEvent> events) {
        Map<String, Long> expected = new LinkedHashMap<>();
        for (DomainEvent event : events) {
            String aggregateId = event.getAggregateId();
            long current = expected.computeIfAbsent(aggregateId, this::currentSequenceNo);
            if (event.getSequenceNo() != current + 1) {
                logger.debug("Sequence conflict for aggregate {}: event {} does not follow {}",
                        aggregateId, event.getSequenceNo(), current);
                throw new ConcurrencyException(aggregateId, event.getSequenceNo() - 1, current);
            }
            expected.put(aggregateId, event.getSequenceNo());
        }
    }

    @Override
    public List<EventEnvelope> load(String aggregateId) {
        return loadRange(aggregateId, -1, -1);
    }

    @Override
    public List<EventEnvelope> loadFromSequence(String aggregateId, long fromSequenceNo) {
        return loadRange(aggregateId, fromSequenceNo, -1);
    }

    @Override
    public List<EventEnvelope> loadRange(String aggregateId, long fromSequenceNo, long toSequenceNo) {
        lock.readLock().lock();
        try {
            ensureOpen();
            List<EventEnvelope> stream = streams.getOrDefault(aggregateId, List.of());
            List<EventEnvelope> result = new ArrayList<>();
            for (EventEnvelope envelope : stream) {
                long sequenceNo = envelope.getEvent().getSequenceNo();
                if ((fromSequenceNo == -1 || sequenceNo >= fromSequenceNo)
                        && (toSequenceNo == -1 || sequenceNo <= toSequenceNo)) {
                    result.add(envelope);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<EventEnvelope> findEvent(String eventId) {
        lock.readLock().lock();
        try {
            ensureOpen();
            return Optional.ofNullable(eventsById.get(eventId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long getCurrentSequenceNo(String aggregateId) {
        lock.readLock().lock();
        try {
            ensureOpen();
            return currentSequenceNo(aggregateId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> getAggregateIds() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return Set.copyOf(streams.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!closed) {
                closed = true;
                logger.info("Closing InMemoryEventStore with {} aggregate stream(s)", streams.size());
                streams.clear();
                eventsById.clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private long currentSequenceNo(String aggregateId) {
        List<EventEnvelope> stream = streams.get(aggregateId);
        if (stream == null || stream.isEmpty()) {
            return 0L;
        }
        return stream.get(stream.size() - 1).getEvent().getSequenceNo();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("InMemoryEventStore is closed");
        }
    }
}
