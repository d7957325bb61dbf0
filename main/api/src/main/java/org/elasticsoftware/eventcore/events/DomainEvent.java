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

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Map;

/**
 * An immutable fact that happened to an aggregate. The only mutable part is the sequence number,
 * which the owning aggregate assigns exactly once when the event is added.
 */
public interface DomainEvent {
    /**
     * Stable identifier of the event type, for instance {@code "Wallet.Credited"}.
     */
    @JsonIgnore
    @NotNull String getEventType();

    @JsonIgnore
    @NotNull String getAggregateId();

    /**
     * The position of this event in the stream of its aggregate, starting at 1. Zero means the
     * event was not added to an aggregate yet.
     */
    long getSequenceNo();

    void setSequenceNo(long sequenceNo);

    /**
     * Business time at which the event occurred.
     */
    @NotNull Instant getCreatedAt();

    default Map<String, Object> getMetadata() {
        return Map.of();
    }
}
