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

import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Middleware;
import org.elasticsoftware.eventcore.handling.Response;

import java.util.Objects;
import java.util.Optional;

/**
 * Serves repeated queries from a {@link CacheProvider}. Commands always pass through, and only
 * successful responses are stored.
 */
public class CachingMiddleware<Q, R> implements Middleware<Q, R> {
    private final CacheProvider cacheProvider;
    private final CacheKeyGenerator keyGenerator;

    public CachingMiddleware(CacheProvider cacheProvider) {
        this(cacheProvider, new CacheKeyGenerator());
    }

    public CachingMiddleware(CacheProvider cacheProvider, CacheKeyGenerator keyGenerator) {
        this.cacheProvider = Objects.requireNonNull(cacheProvider, "cacheProvider");
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator");
    }

    @SuppressWarnings("unchecked")
    @Override
    public Handler<Q, R> apply(Handler<Q, R> next) {
        return (log, payload) -> {
            if (!payload.type().isQuery()) {
                return next.handle(log, payload);
            }
            String key;
            try {
                key = keyGenerator.generate(payload.type(), payload.data());
            } catch (IllegalArgumentException e) {
                log.warn("Not caching query {}: {}", payload.type().name(), e.getMessage());
                return next.handle(log, payload);
            }
            Optional<Response<?>> cached = cacheProvider.get(key);
            if (cached.isPresent()) {
                log.debug("Cache hit for query {} (key={})", payload.type().name(), key);
                return (Response<R>) cached.get();
            }
            log.debug("Cache miss for query {} (key={})", payload.type().name(), key);
            Response<R> response = next.handle(log, payload);
            if (response != null && !response.isFailure()) {
                cacheProvider.put(key, response);
            }
            return response;
        };
    }
}
