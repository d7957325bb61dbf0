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

package org.elasticsoftware.eventcore.handling;

import jakarta.annotation.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps a command or query with the context of a single call.
 *
 * @param type     the resolved routing tag of {@code data}
 * @param data     the command or query
 * @param metadata free-form values for middleware and handlers, never {@code null}
 * @param traceId  distributed tracing id, may be {@code null}
 * @param userId   the calling user, may be {@code null}
 */
public record Payload<T>(RequestType type,
                         T data,
                         Map<String, Object> metadata,
                         @Nullable String traceId,
                         @Nullable String userId) {

    public Payload {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(data, "data");
        metadata = metadata != null ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Map.of();
    }

    public static <T> Payload<T> of(RequestType type, T data) {
        return new Payload<>(type, data, Map.of(), null, null);
    }

    public Payload<T> withTraceId(@Nullable String traceId) {
        return new Payload<>(type, data, metadata, traceId, userId);
    }

    public Payload<T> withUserId(@Nullable String userId) {
        return new Payload<>(type, data, metadata, traceId, userId);
    }

    public Payload<T> withMetadata(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(metadata);
        copy.put(key, value);
        return new Payload<>(type, data, copy, traceId, userId);
    }

    public boolean hasCaller() {
        return (traceId != null && !traceId.isEmpty()) || (userId != null && !userId.isEmpty());
    }
}
