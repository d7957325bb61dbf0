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

package org.elasticsoftware.eventcore.bus;

import jakarta.annotation.Nullable;
import org.elasticsoftware.eventcore.handling.Payload;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.queries.Query;
import org.elasticsoftware.eventcore.queries.QueryBus;
import org.slf4j.Logger;

import java.util.Objects;

public class DefaultQueryBus extends AbstractBus<Query, Object> implements QueryBus {

    public DefaultQueryBus() {
        super(RequestKind.QUERY);
    }

    @Nullable
    @Override
    public Object handle(Logger log, Query query) {
        Objects.requireNonNull(query, "query");
        return handle(log, createPayload(RequestType.of(query), query));
    }

    @Nullable
    @Override
    public Object handle(Logger log, Payload<Query> payload) {
        return dispatch(log, payload).data();
    }
}
