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

package org.elasticsoftware.eventcore.events;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the bookkeeping part of a {@link DomainEvent}. Concrete events add their own payload
 * fields and implement {@link #getEventType()}.
 */
public abstract class AbstractDomainEvent implements DomainEvent {
    private final String aggregateId;
    private final Instant createdAt;
    private final Map<String, Object> metadata = new ConcurrentHashMap<>();
    private volatile long sequenceNo;

    protected AbstractDomainEvent(String aggregateId) {
        this(aggregateId, Instant.now());
    }

    protected AbstractDomainEvent(String aggregateId, Instant createdAt) {
        this.aggregateId = Objects.requireNonNull(aggregateId, "aggregateId");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    @Override
    public String getAggregateId() {
        return aggregateId;
    }

    @Override
    public long getSequenceNo() {
        return sequenceNo;
    }

    @Override
    public void setSequenceNo(long sequenceNo) {
        this.sequenceNo = sequenceNo;
    }

    @Override
    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public Map<String, Object> getMetadata() {
        return Map.copyOf(metadata);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{type=" + getEventType()
                + ", aggregateId=" + aggregateId
                + ", sequenceNo=" + sequenceNo + "}";
    }
}
