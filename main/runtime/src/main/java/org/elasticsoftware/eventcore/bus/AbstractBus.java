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

import org.elasticsoftware.eventcore.errors.ApplicationException;
import org.elasticsoftware.eventcore.errors.HandlerNotFoundException;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Middleware;
import org.elasticsoftware.eventcore.handling.Payload;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.handling.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry and dispatch logic shared by the command and the query bus. Handlers are composed with
 * their middleware once, at registration time.
 *
 * @param <Q> the request type
 * @param <R> the response data type
 */
public abstract class AbstractBus<Q, R> {
    public static final String TRACE_ID_KEY = "traceId";
    public static final String USER_ID_KEY = "userId";

    private static final Logger logger = LoggerFactory.getLogger(AbstractBus.class);

    private final RequestKind kind;
    private final Map<String, Handler<Q, R>> handlers = new ConcurrentHashMap<>();
    private final List<Middleware<Q, R>> globalMiddleware = new CopyOnWriteArrayList<>();

    protected AbstractBus(RequestKind kind) {
        this.kind = kind;
    }

    public void register(String type, Handler<Q, R> handler, List<Middleware<Q, R>> middleware) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        List<Middleware<Q, R>> chain = new ArrayList<>(globalMiddleware);
        chain.addAll(requireNoNullElements(middleware));
        Handler<Q, R> previous = handlers.put(type, compose(handler, chain));
        if (previous != null) {
            logger.warn("Replaced {} handler for type {}", kind.label(), type);
        } else {
            logger.debug("Registered {} handler for type {} with {} middleware", kind.label(), type, chain.size());
        }
    }

    public void use(List<Middleware<Q, R>> middleware) {
        globalMiddleware.addAll(requireNoNullElements(middleware));
    }

    private static <T> List<T> requireNoNullElements(List<T> middleware) {
        Objects.requireNonNull(middleware, "middleware");
        for (int i = 0; i < middleware.size(); i++) {
            Objects.requireNonNull(middleware.get(i), "middleware[" + i + "]");
        }
        return middleware;
    }

    public boolean hasHandler(String type) {
        return handlers.containsKey(type);
    }

    /**
     * Folds the middleware right to left, so the first one in the list ends up outermost.
     */
    static <Q, R> Handler<Q, R> compose(Handler<Q, R> handler, List<Middleware<Q, R>> middleware) {
        Handler<Q, R> composed = handler;
        for (int i = middleware.size() - 1; i >= 0; i--) {
            composed = middleware.get(i).apply(composed);
        }
        return composed;
    }

    protected Payload<Q> createPayload(RequestType type, Q request) {
        return new Payload<>(type, request, Map.of(), MDC.get(TRACE_ID_KEY), MDC.get(USER_ID_KEY));
    }

    /**
     * Runs the composed handler and turns an error carried by the response into an exception.
     */
    protected Response<R> dispatch(Logger log, Payload<Q> payload) {
        Objects.requireNonNull(log, "log");
        Objects.requireNonNull(payload, "payload");
        RequestType type = payload.type();
        if (type.kind() != kind) {
            throw new IllegalArgumentException("Cannot handle " + type + " on the " + kind.label() + " bus");
        }
        Handler<Q, R> handler = handlers.get(type.name());
        if (handler == null) {
            throw new HandlerNotFoundException(type.name(), kind);
        }
        Response<R> response = handler.handle(log, payload);
        if (response == null) {
            return Response.empty();
        }
        if (response.isFailure()) {
            Exception error = response.error();
            if (error instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ApplicationException(ApplicationException.REQUEST_ERROR, "Request execution failed", error);
        }
        return response;
    }
}
