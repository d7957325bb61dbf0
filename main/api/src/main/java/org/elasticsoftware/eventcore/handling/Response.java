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

/**
 * The result of handling a request. A response with an {@link #error()} is a failure, whatever
 * its data says; the buses raise that error to the caller.
 */
public record Response<T>(@Nullable T data,
                          Map<String, Object> metadata,
                          @Nullable Exception error) {

    public Response {
        metadata = metadata != null ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Map.of();
    }

    public static <T> Response<T> of(@Nullable T data) {
        return new Response<>(data, Map.of(), null);
    }

    public static <T> Response<T> empty() {
        return new Response<>(null, Map.of(), null);
    }

    public static <T> Response<T> failure(Exception error) {
        return new Response<>(null, Map.of(), error);
    }

    public Response<T> withMetadata(String key, Object value) {
        Map<String, Object> copy = new HashMap<>(metadata);
        copy.put(key, value);
        return new Response<>(data, copy, error);
    }

    public Response<T> withError(@Nullable Exception error) {
        return new Response<>(data, metadata, error);
    }

    public boolean isFailure() {
        return error != null;
    }
}
