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
import org.elasticsoftware.eventcore.handling.Response;

import java.time.Duration;
import java.util.Objects;

/**
 * Records the duration of every request and counts the failed ones. Responses and exceptions pass
 * through untouched.
 */
public class MetricsMiddleware<Q, R> implements Middleware<Q, R> {
    private final MetricsCollector metricsCollector;

    public MetricsMiddleware(MetricsCollector metricsCollector) {
        this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
    }

    @Override
    public Handler<Q, R> apply(Handler<Q, R> next) {
        return (log, payload) -> {
            long start = System.nanoTime();
            try {
                Response<R> response = next.handle(log, payload);
                if (response != null && response.isFailure()) {
                    metricsCollector.incrementErrorCount(payload.type());
                }
                return response;
            } catch (RuntimeException | Error e) {
                metricsCollector.incrementErrorCount(payload.type());
                throw e;
            } finally {
                metricsCollector.recordDuration(payload.type(), Duration.ofNanos(System.nanoTime() - start));
            }
        };
    }
}
