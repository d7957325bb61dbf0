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

import java.util.List;

/**
 * Reacts to persisted events, typically to maintain a projection or drive a process.
 */
public interface EventHandler {
    void handle(EventEnvelope envelope);

    /**
     * The event types (or wildcard patterns such as {@code "Wallet.*"}) this handler subscribes to.
     */
    List<String> getEventTypes();
}
