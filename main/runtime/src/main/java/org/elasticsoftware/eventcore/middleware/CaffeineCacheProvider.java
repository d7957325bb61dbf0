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

package org.elasticsoftware.eventcore.middleware;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.elasticsoftware.eventcore.handling.Response;

import java.time.Duration;
import java.util.Optional;

public class CaffeineCacheProvider implements CacheProvider {
    private final Cache<String, Response<?>> responses;

    public CaffeineCacheProvider(long maximumSize, Duration expireAfterWrite) {
        this.responses = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireAfterWrite)
                .build();
    }

    @Override
    public Optional<Response<?>> get(String key) {
        return Optional.ofNullable(responses.getIfPresent(key));
    }

    @Override
    public void put(String key, Response<?> response) {
        responses.put(key, response);
    }

    @Override
    public void invalidate(String key) {
        responses.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        responses.invalidateAll();
    }

    public long estimatedSize() {
        return responses.estimatedSize();
    }
}
