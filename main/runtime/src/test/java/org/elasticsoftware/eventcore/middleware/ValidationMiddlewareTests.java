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

import org.elasticsoftware.eventcore.errors.ValidationException;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Payload;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.handling.Response;
import org.elasticsoftware.eventcore.handling.Validatable;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValidationMiddlewareTests {
    private static final Logger log = LoggerFactory.getLogger(ValidationMiddlewareTests.class);
    private static final RequestType TYPE = new RequestType(RequestKind.COMMAND, "Transfer");

    record Transfer(String from, String to) implements Validatable {
        @Override
        public void validate() {
            if (from == null) {
                throw new ValidationException("from", "is required");
            }
            if (from.equals(to)) {
                throw new IllegalArgumentException("cannot transfer to the same wallet");
            }
        }
    }

    private final AtomicInteger calls = new AtomicInteger();
    private final Handler<Object, String> handler = new ValidationMiddleware<Object, String>().apply((logger, payload) -> {
        calls.incrementAndGet();
        return Response.of("done");
    });

    @Test
    void testValidRequestReachesHandler() {
        Response<String> response = handler.handle(log, Payload.of(TYPE, new Transfer("a", "b")));
        assertEquals("done", response.data());
        assertEquals(1, calls.get());
    }

    @Test
    void testInvalidRequestShortCircuits() {
        Response<String> response = handler.handle(log, Payload.of(TYPE, new Transfer(null, "b")));

        ValidationException error = assertInstanceOf(ValidationException.class, response.error());
        assertEquals("from", error.getField());
        assertEquals(true, response.metadata().get(ValidationMiddleware.VALIDATION_FAILED));
        assertEquals(0, calls.get());
    }

    @Test
    void testOtherValidationFailuresBecomeValidationExceptions() {
        Response<String> response = handler.handle(log, Payload.of(TYPE, new Transfer("a", "a")));

        ValidationException error = assertInstanceOf(ValidationException.class, response.error());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertEquals(0, calls.get());
    }

    @Test
    void testNonValidatableRequestPassesThrough() {
        Response<String> response = handler.handle(log, Payload.of(TYPE, "plain"));
        assertEquals("done", response.data());
        assertEquals(1, calls.get());
    }
}
