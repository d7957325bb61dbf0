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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.elasticsoftware.eventcore.handling.Handler;
import org.elasticsoftware.eventcore.handling.Payload;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.handling.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MetricsMiddlewareTests {
    private static final Logger log = LoggerFactory.getLogger(MetricsMiddlewareTests.class);
    private static final RequestType TYPE = new RequestType(RequestKind.QUERY, "GetBalance");
    private static final Payload<String> PAYLOAD = Payload.of(TYPE, "wallet-1");

    private SimpleMeterRegistry meterRegistry;
    private MetricsMiddleware<String, String> middleware;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        middleware = new MetricsMiddleware<>(new MicrometerMetricsCollector(meterRegistry));
    }

    private Timer timer() {
        return meterRegistry.get(MicrometerMetricsCollector.DURATION_METRIC)
                .tag("type", "GetBalance")
                .tag("kind", "query")
                .timer();
    }

    @Test
    void testSuccessRecordsDurationOnly() {
        Response<String> response = middleware.apply((logger, payload) -> Response.of("100")).handle(log, PAYLOAD);

        assertThat(response.data()).isEqualTo("100");
        assertThat(timer().count()).isEqualTo(1);
        assertThat(meterRegistry.find(MicrometerMetricsCollector.ERRORS_METRIC).counter()).isNull();
    }

    @Test
    void testReturnedErrorIsCountedAndUntouched() {
        IllegalStateException error = new IllegalStateException("stale");
        Response<String> response = middleware.apply((logger, payload) -> Response.<String>failure(error)).handle(log, PAYLOAD);

        assertThat(response.error()).isSameAs(error);
        Counter errors = meterRegistry.get(MicrometerMetricsCollector.ERRORS_METRIC).tag("type", "GetBalance").counter();
        assertThat(errors.count()).isEqualTo(1.0);
        assertThat(timer().count()).isEqualTo(1);
    }

    @Test
    void testThrownErrorIsCountedAndRethrown() {
        IllegalStateException error = new IllegalStateException("down");
        Handler<String, String> handler = middleware.apply((logger, payload) -> {
            throw error;
        });

        assertThatThrownBy(() -> handler.handle(log, PAYLOAD)).isSameAs(error);
        assertThat(meterRegistry.get(MicrometerMetricsCollector.ERRORS_METRIC).counter().count()).isEqualTo(1.0);
        assertThat(timer().count()).isEqualTo(1);
    }

    @Test
    void testCollectorIsCalledPerRequestType() {
        MetricsCollector collector = mock(MetricsCollector.class);
        new MetricsMiddleware<String, String>(collector).apply((logger, payload) -> Response.of("ok")).handle(log, PAYLOAD);

        verify(collector).recordDuration(eq(TYPE), any(Duration.class));
        verify(collector, never()).incrementErrorCount(any());
    }
}
