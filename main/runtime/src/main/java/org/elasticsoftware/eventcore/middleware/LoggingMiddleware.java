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
import org.elasticsoftware.eventcore.handling.Payload;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.handling.Response;
import org.slf4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * Logs every request before and after the handler runs, using the logger passed to the bus.
 * Requests that carry a trace or user id are logged at INFO, anonymous ones at DEBUG.
 */
public class LoggingMiddleware<Q, R> implements Middleware<Q, R> {

    @Override
    public Handler<Q, R> apply(Handler<Q, R> next) {
        return (log, payload) -> {
            RequestType type = payload.type();
            logStart(log, payload);
            long start = System.nanoTime();
            Response<R> response;
            try {
                response = next.handle(log, payload);
            } catch (RuntimeException | Error e) {
                log.error("Failed to handle {} {} after {} ms", type.kind().label(), type.name(), elapsedMillis(start), e);
                throw e;
            }
            if (response != null && response.isFailure()) {
                log.error("Failed to handle {} {} after {} ms", type.kind().label(), type.name(), elapsedMillis(start), response.error());
            } else {
                log.debug("Handled {} {} in {} ms", type.kind().label(), type.name(), elapsedMillis(start));
            }
            return response;
        };
    }

    private void logStart(Logger log, Payload<Q> payload) {
        RequestType type = payload.type();
        if (payload.hasCaller()) {
            log.info("Handling {} {} (traceId={}, userId={})", type.kind().label(), type.name(), payload.traceId(), payload.userId());
        } else {
            log.debug("Handling {} {}", type.kind().label(), type.name());
        }
    }

    private static long elapsedMillis(long start) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }
}
