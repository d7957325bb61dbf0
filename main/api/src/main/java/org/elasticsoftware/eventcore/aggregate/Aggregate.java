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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.eventcore.events.DomainEvent;

import java.util.List;

/**
 * The view of an event sourced aggregate that repositories and the unit of work rely on.
 */
public interface Aggregate {
    @NotNull String getId();

    long getSequenceNo();

    @NotNull List<DomainEvent> getUncommittedEvents();

    boolean hasUncommittedEvents();

    void markEventsAsCommitted();

    void loadFromHistory(@NotNull List<? extends DomainEvent> events);

    default String getName() {
        return getClass().getSimpleName();
    }
}
