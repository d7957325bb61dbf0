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

package org.elasticsoftware.eventcore.errors;

import org.elasticsoftware.eventcore.EventCoreException;
import org.elasticsoftware.eventcore.events.EventEnvelope;

import java.util.List;

/**
 * The events were persisted but dispatching them failed. The commit itself stands, so the
 * persisted envelopes are handed back to let the caller mark its aggregates as committed.
 */
public class UnitOfWorkDispatchException extends EventCoreException {
    private final List<EventEnvelope> persistedEnvelopes;

    public UnitOfWorkDispatchException(List<EventEnvelope> persistedEnvelopes, Throwable cause) {
        super("events persisted but dispatch failed", cause);
        this.persistedEnvelopes = List.copyOf(persistedEnvelopes);
    }

    public List<EventEnvelope> getPersistedEnvelopes() {
        return persistedEnvelopes;
    }
}
