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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import org.elasticsoftware.eventcore.handling.RequestType;

import java.nio.charset.StandardCharsets;

/**
 * Derives a cache key from the type tag and the content of a request. Two requests with the same
 * type and equal field values produce the same key, regardless of field declaration order.
 */
public class CacheKeyGenerator {
    private final HashFunction hashFunction = Hashing.murmur3_32_fixed();
    private final ObjectMapper objectMapper;

    public CacheKeyGenerator() {
        this(canonicalObjectMapper());
    }

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper canonicalObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build();
    }

    /**
     * Returns {@code <type>:<murmur3 digest>:<canonical json>}. The digest only shortens what is
     * compared first; the canonical JSON keeps keys of different requests apart when digests collide.
     *
     * @throws IllegalArgumentException when the request cannot be serialized
     */
    public String generate(RequestType type, Object request) {
        try {
            String canonical = objectMapper.writeValueAsString(request);
            return type.name() + ":" + hashFunction.hashString(canonical, StandardCharsets.UTF_8) + ":" + canonical;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot derive cache key for " + type, e);
        }
    }
}
