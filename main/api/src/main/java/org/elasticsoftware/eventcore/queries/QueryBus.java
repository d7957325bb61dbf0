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

package org.elasticsoftware.eventcore.queries;

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventcore.errors.HandlerNotFoundException;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Middleware;
import org.elasticsoftware.eventcore.handling.Payload;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.List;

public interface QueryBus {
    /**
     * Routes the query to the handler registered for its type and returns the response data.
     *
     * @throws HandlerNotFoundException when no handler is registered for the query type
     */
    @Nullable
    Object handle(Logger log, Query query);

    @Nullable
    Object handle(Logger log, Payload<Query> payload);

    @Nullable
    default <R> R handle(Logger log, Query query, Class<R> resultType) {
        return resultType.cast(handle(log, query));
    }

    void register(String queryType, Handler<Query, Object> handler, List<Middleware<Query, Object>> middleware);

    @SuppressWarnings("unchecked")
    default void register(String queryType, Handler<Query, Object> handler, Middleware<Query, Object>... middleware) {
        register(queryType, handler, Arrays.asList(middleware));
    }

    /**
     * Adds middleware that wraps every handler registered after this call, outside of the
     * middleware passed to {@code register}. Handlers registered earlier are not affected.
     */
    void use(List<Middleware<Query, Object>> middleware);

    @SuppressWarnings("unchecked")
    default void use(Middleware<Query, Object>... middleware) {
        use(Arrays.asList(middleware));
    }
}
