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

import org.elasticsoftware.eventcore.events.DomainEvent;
import org.elasticsoftware.eventcore.events.EventEnvelope;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class DefaultEventEnvelope implements EventEnvelope {
    private final String eventId;
    private final DomainEvent event;
    private final Map<String, Object> metadata;
    private final Instant timestamp;

    public DefaultEventEnvelope(String eventId, DomainEvent event, Map<String, Object> metadata, Instant timestamp) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.event = Objects.requireNonNull(event, "event");
        this.metadata = metadata != null ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Map.of();
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public DomainEvent getEvent() {
        return event;
    }

    @Override
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String getEventId() {
        return eventId;
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "EventEnvelope{eventId=" + eventId +
                ", eventType=" + event.getEventType() +
                ", aggregateId=" + event.getAggregateId() +
                ", sequenceNo=" + event.getSequenceNo() +
                ", timestamp=" + timestamp + "}";
    }
}
