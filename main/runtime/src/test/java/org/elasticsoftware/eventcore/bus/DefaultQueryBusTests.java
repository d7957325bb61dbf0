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

import org.elasticsoftware.eventcore.bus.TestRequests.GetBalanceQuery;
import org.elasticsoftware.eventcore.errors.HandlerNotFoundException;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.Response;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DefaultQueryBusTests {
    private static final Logger log = LoggerFactory.getLogger(DefaultQueryBusTests.class);

    @Test
    void testQueryReturnsResponseData() {
        DefaultQueryBus bus = new DefaultQueryBus();
        bus.register("GetBalance", (logger, payload) -> {
            GetBalanceQuery query = (GetBalanceQuery) payload.data();
            return Response.of(query.walletId().equals("wallet-1") ? new BigDecimal("100.00") : BigDecimal.ZERO);
        });

        assertEquals(new BigDecimal("100.00"), bus.handle(log, new GetBalanceQuery("wallet-1")));
        assertEquals(BigDecimal.ZERO, bus.handle(log, new GetBalanceQuery("wallet-2"), BigDecimal.class));
    }

    @Test
    void testTypedResultWithWrongTypeFails() {
        DefaultQueryBus bus = new DefaultQueryBus();
        bus.register("GetBalance", (logger, payload) -> Response.of("not a number"));

        assertThrows(ClassCastException.class, () -> bus.handle(log, new GetBalanceQuery("wallet-1"), BigDecimal.class));
    }

    @Test
    void testMissingHandler() {
        DefaultQueryBus bus = new DefaultQueryBus();
        bus.register("GetHistory", (logger, payload) -> Response.empty());

        HandlerNotFoundException exception = assertThrows(HandlerNotFoundException.class,
                () -> bus.handle(log, new GetBalanceQuery("wallet-1")));

        assertEquals("GetBalance", exception.getType());
        assertEquals(RequestKind.QUERY, exception.getKind());
        assertEquals("no query handler registered for type: GetBalance", exception.getMessage());
    }

    @Test
    void testNullResponseIsEmpty() {
        DefaultQueryBus bus = new DefaultQueryBus();
        bus.register("GetBalance", (logger, payload) -> null);

        assertNull(bus.handle(log, new GetBalanceQuery("wallet-1")));
        assertTrue(bus.hasHandler("GetBalance"));
    }

    @Test
    void testErrorInResponseIsRaisedEvenWithData() {
        DefaultQueryBus bus = new DefaultQueryBus();
        IllegalStateException error = new IllegalStateException("stale read");
        bus.register("GetBalance", (logger, payload) -> new Response<Object>(BigDecimal.ONE, null, error));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> bus.handle(log, new GetBalanceQuery("wallet-1")));
        assertSame(error, thrown);
    }
}
