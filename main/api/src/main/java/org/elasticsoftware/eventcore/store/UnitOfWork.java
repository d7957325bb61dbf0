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
import org.elasticsoftware.eventcore.events.EventEnvelope;

import java.util.List;

/**
 * Collects the events of one business operation, persists them in a single save and then
 * dispatches the resulting envelopes. A unit of work is used once.
 */
public interface UnitOfWork {
    /**
     * @throws IllegalStateException when the unit of work was already committed
     */
    void registerEvents(List<? extends DomainEvent> events);

    /**
     * @return the persisted envelopes, empty when no events were registered
     * @throws UnitOfWorkDispatchException when the events were saved but dispatching failed
     * @throws IllegalStateException       when called a second time
     */
    List<EventEnvelope> commit();

    /**
     * Discards the registered events.
     *
     * @throws IllegalStateException when the unit of work was already committed
     */
    void rollback();
}
