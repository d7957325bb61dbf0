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

package org.elasticsoftware.eventcore.aggregate;

import org.elasticsoftware.eventcore.errors.NullSourceException;
import org.elasticsoftware.eventcore.events.DomainEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Base class for event sourced aggregates. It owns the identity, the sequence counter and the
 * committed and uncommitted event streams; concrete aggregates own their domain state.
 *
 * <p>Every added event receives the sequence number of the aggregate after the increment, so the
 * numbers are gapless and start at 1. All mutable state is guarded by a single read/write lock,
 * which makes concurrent {@link #addEvent(DomainEvent)} calls on one instance safe. The lock is
 * never held while calling into code outside this class.
 *
 * <pre>{@code
 * public class Wallet extends EventSourcedAggregate {
 *     private BigDecimal balance = BigDecimal.ZERO;
 *
 *     public void credit(BigDecimal amount) {
 *         balance = balance.add(amount);
 *         addEvent(new WalletCreditedEvent(getId(), amount));
 *     }
 *
 *     @Override
 *     public void loadFromHistory(List<? extends DomainEvent> events) {
 *         events.forEach(this::apply);
 *         super.loadFromHistory(events);
 *     }
 * }
 * }</pre>
 */
public class EventSourcedAggregate implements Aggregate {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String id;
    private long sequenceNo;
    private final List<DomainEvent> committedEvents;
    private final List<DomainEvent> uncommittedEvents;
    private final List<Exception> errors;

    public EventSourcedAggregate(String id) {
        this.id = Objects.requireNonNull(id, "id");
        this.sequenceNo = 0L;
        this.committedEvents = new ArrayList<>();
        this.uncommittedEvents = new ArrayList<>();
        this.errors = new ArrayList<>();
    }

    /**
     * Copy constructor, used by {@link #copy()} and by subclasses that implement their own copy.
     */
    protected EventSourcedAggregate(EventSourcedAggregate source) {
        source.lock.readLock().lock();
        try {
            this.id = source.id;
            this.sequenceNo = source.sequenceNo;
            this.committedEvents = new ArrayList<>(source.committedEvents);
            this.uncommittedEvents = new ArrayList<>(source.uncommittedEvents);
            this.errors = new ArrayList<>(source.errors);
        } finally {
            source.lock.readLock().unlock();
        }
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public long getSequenceNo() {
        lock.readLock().lock();
        try {
            return sequenceNo;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records a new event: increments the sequence number, stamps it on the event and appends the
     * event to the uncommitted events.
     */
    public void addEvent(DomainEvent event) {
        Objects.requireNonNull(event, "event");
        lock.writeLock().lock();
        try {
            sequenceNo++;
            event.setSequenceNo(sequenceNo);
            uncommittedEvents.add(event);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns a copy of the uncommitted events; changing the returned list does not affect this
     * aggregate.
     */
    @Override
    public List<DomainEvent> getUncommittedEvents() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(uncommittedEvents);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<DomainEvent> getCommittedEvents() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(committedEvents);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean hasUncommittedEvents() {
        lock.readLock().lock();
        try {
            return !uncommittedEvents.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getUncommittedEventCount() {
        lock.readLock().lock();
        try {
            return uncommittedEvents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Moves the uncommitted events to the committed history. Call this after the events were
     * persisted successfully.
     */
    @Override
    public void markEventsAsCommitted() {
        lock.writeLock().lock();
        try {
            committedEvents.addAll(uncommittedEvents);
            uncommittedEvents.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the event bookkeeping with the given history. The history becomes the committed
     * events as is (sequence numbers are not reassigned), the sequence number becomes the size of
     * the history and uncommitted events and errors are cleared.
     *
     * <p>This only manages bookkeeping. Subclasses apply their domain state transitions for each
     * event and then call this method.
     */
    @Override
    public void loadFromHistory(List<? extends DomainEvent> events) {
        Objects.requireNonNull(events, "events");
        lock.writeLock().lock();
        try {
            committedEvents.clear();
            committedEvents.addAll(events);
            sequenceNo = events.size();
            uncommittedEvents.clear();
            errors.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Appends the uncommitted events of {@code source} to the uncommitted events of this aggregate.
     * The events keep their original sequence numbers, the source is left untouched and the
     * sequence number of this aggregate does not change.
     *
     * @throws NullSourceException when {@code source} is {@code null}
     */
    public void mergeEventsFrom(Aggregate source) {
        if (source == null) {
            throw new NullSourceException(id);
        }
        // read the source before taking our own lock, merging an aggregate into itself must not deadlock
        List<DomainEvent> sourceEvents = source.getUncommittedEvents();
        if (sourceEvents.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            uncommittedEvents.addAll(sourceEvents);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Clears the sequence number, all events and all errors while keeping the id. Meant for tests.
     */
    public void reset() {
        lock.writeLock().lock();
        try {
            sequenceNo = 0L;
            committedEvents.clear();
            uncommittedEvents.clear();
            errors.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns an independent copy of this aggregate's bookkeeping. Subclasses with domain state
     * should provide their own copy method built on {@link #EventSourcedAggregate(EventSourcedAggregate)}.
     */
    public EventSourcedAggregate copy() {
        return new EventSourcedAggregate(this);
    }

    /**
     * Records a business rule violation. Recording an error does not prevent adding events.
     */
    public void addError(Exception error) {
        Objects.requireNonNull(error, "error");
        lock.writeLock().lock();
        try {
            errors.add(error);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<Exception> getErrors() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(errors);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isValid() {
        lock.readLock().lock();
        try {
            return errors.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        lock.readLock().lock();
        try {
            return getName() + "{id=" + id
                    + ", sequenceNo=" + sequenceNo
                    + ", uncommittedEvents=" + uncommittedEvents.size()
                    + ", errors=" + errors.size() + "}";
        } finally {
            lock.readLock().unlock();
        }
    }
}
