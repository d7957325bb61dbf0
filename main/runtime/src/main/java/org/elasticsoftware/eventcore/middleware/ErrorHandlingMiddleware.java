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

import org.elasticsoftware.eventcore.EventCoreException;
import org.elasticsoftware.eventcore.errors.ApplicationException;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Middleware;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.handling.Response;
import org.slf4j.Logger;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Normalizes failures into the {@link EventCoreException} hierarchy.
 *
 * <ul>
 *     <li>an {@link EventCoreException} is passed on unchanged</li>
 *     <li>any other exception, thrown or returned, becomes an {@link ApplicationException} with code
 *     {@link ApplicationException#REQUEST_ERROR}</li>
 *     <li>an {@link Error} thrown by the handler is logged with the {@code FATAL} marker and becomes an
 *     {@link ApplicationException} with code {@link ApplicationException#HANDLER_PANIC}; the process
 *     keeps running. A {@link VirtualMachineError} is rethrown.</li>
 * </ul>
 */
public class ErrorHandlingMiddleware<Q, R> implements Middleware<Q, R> {
    public static final Marker FATAL = MarkerFactory.getMarker("FATAL");

    @Override
    public Handler<Q, R> apply(Handler<Q, R> next) {
        return (log, payload) -> {
            RequestType type = payload.type();
            Response<R> response;
            try {
                response = next.handle(log, payload);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Error e) {
                log.error(FATAL, "Handler for {} {} panicked", type.kind().label(), type.name(), e);
                return Response.failure(new ApplicationException(ApplicationException.HANDLER_PANIC,
                        "Handler panicked while handling " + type, e));
            } catch (Exception e) {
                return Response.failure(translate(log, type, e));
            }
            if (response == null) {
                return Response.empty();
            }
            if (response.isFailure()) {
                return response.withError(translate(log, type, response.error()));
            }
            return response;
        };
    }

    private static EventCoreException translate(Logger log, RequestType type, Exception error) {
        if (error instanceof EventCoreException known) {
            return known;
        }
        log.error("Unexpected failure handling {} {}", type.kind().label(), type.name(), error);
        return new ApplicationException(ApplicationException.REQUEST_ERROR, "Request execution failed", error);
    }
}
