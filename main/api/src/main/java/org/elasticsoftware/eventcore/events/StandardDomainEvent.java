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

import jakarta.annotation.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A generic event for domains that do not want a class per event. The event type is composed of
 * the entity type and the action, e.g. {@code new StandardDomainEvent("order-1", "Order", "Shipped", data)}
 * has the type {@code "Order.Shipped"}.
 */
public class StandardDomainEvent extends AbstractDomainEvent {
    private final String entityType;
    private final String actionType;
    private final Map<String, Object> data;

    public StandardDomainEvent(String aggregateId, String entityType, String actionType, Map<String, Object> data) {
        this(aggregateId, entityType, actionType, data, Instant.now());
    }

    public StandardDomainEvent(String aggregateId,
                               String entityType,
                               String actionType,
                               @Nullable Map<String, Object> data,
                               Instant occurredAt) {
        super(aggregateId, occurredAt);
        this.entityType = Objects.requireNonNull(entityType, "entityType");
        this.actionType = Objects.requireNonNull(actionType, "actionType");
        this.data = data != null ? new HashMap<>(data) : new HashMap<>();
    }

    @Override
    public String getEventType() {
        return entityType + "." + actionType;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getActionType() {
        return actionType;
    }

    public Map<String, Object> getData() {
        return Collections.unmodifiableMap(new HashMap<>(data));
    }

    @Nullable
    public Object get(String key) {
        return data.get(key);
    }

    @Nullable
    public String getString(String key) {
        return data.get(key) instanceof String s ? s : null;
    }

    public int getInt(String key) {
        Object value = data.get(key);
        if (value instanceof Number n) {
            return n.intValue();
        }
        return 0;
    }

    public boolean getBoolean(String key) {
        return data.get(key) instanceof Boolean b && b;
    }

    @Nullable
    public Instant getInstant(String key) {
        Object value = data.get(key);
        if (value instanceof Instant instant) {
            return instant;
        } else if (value instanceof String s) {
            return Instant.parse(s);
        }
        return null;
    }

    public StandardDomainEvent withMetadata(String key, Object value) {
        putMetadata(key, value);
        return this;
    }
}
