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

package org.elasticsoftware.eventcore.events;

import org.elasticsoftware.eventcore.errors.EventDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous {@link EventDispatcher}. Subscriptions are made to an event type or to a pattern
 * where {@code *} stands for one dot separated segment: {@code "Wallet.*"}, {@code "*.Created"},
 * {@code "*.*"}. Every matching handler is invoked, in subscription order, even when an earlier one
 * fails.
 */
public class SimpleEventDispatcher implements EventDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(SimpleEventDispatcher.class);

    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<EventHandler> catchAllHandlers = new CopyOnWriteArrayList<>();

    @Override
    public void subscribe(String eventType, EventHandler handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        subscriptions.add(new Subscription(eventType, handler));
    }

    public void subscribe(EventHandler handler) {
        for (String eventType : handler.getEventTypes()) {
            subscribe(eventType, handler);
        }
    }

    /**
     * Subscribes the handler to every event, whatever its type.
     */
    public void subscribeAll(EventHandler handler) {
        catchAllHandlers.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void dispatch(List<EventEnvelope> envelopes) {
        List<Exception> failures = new ArrayList<>();
        for (EventEnvelope envelope : envelopes) {
            String eventType = envelope.getEvent().getEventType();
            for (EventHandler handler : handlersFor(eventType)) {
                try {
                    handler.handle(envelope);
                } catch (RuntimeException e) {
                    logger.error("Event handler failed for event type {} (eventId={})", eventType, envelope.getEventId(), e);
                    failures.add(e);
                }
            }
        }
        if (!failures.isEmpty()) {
            throw new EventDispatchException(failures);
        }
    }

    private List<EventHandler> handlersFor(String eventType) {
        List<EventHandler> handlers = new ArrayList<>();
        for (Subscription subscription : subscriptions) {
            if (matches(eventType, subscription.pattern())) {
                handlers.add(subscription.handler());
            }
        }
        handlers.addAll(catchAllHandlers);
        return handlers;
    }

    static boolean matches(String eventType, String pattern) {
        if (eventType.equals(pattern)) {
            return true;
        }
        String[] typeParts = segments(eventType);
        String[] patternParts = segments(pattern);
        if (typeParts.length == 0 || typeParts.length != patternParts.length) {
            return false;
        }
        for (int i = 0; i < typeParts.length; i++) {
            if (!"*".equals(patternParts[i]) && !patternParts[i].equals(typeParts[i])) {
                return false;
            }
        }
        return true;
    }

    private static String[] segments(String value) {
        return Arrays.stream(value.split("\\.")).filter(s -> !s.isEmpty()).toArray(String[]::new);
    }

    private record Subscription(String pattern, EventHandler handler) {
    }
}
