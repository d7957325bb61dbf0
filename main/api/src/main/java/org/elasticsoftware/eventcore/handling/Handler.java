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

import org.slf4j.Logger;

/**
 * The single handler shape shared by commands and queries, which is what lets one middleware
 * implementation serve both buses.
 *
 * <p>A handler reports failure either by throwing or by returning a {@link Response} that carries
 * an error; callers have to check both.
 *
 * @param <Q> the request type
 * @param <R> the response data type
 */
@FunctionalInterface
public interface Handler<Q, R> {
    Response<R> handle(Logger log, Payload<Q> payload);
}
