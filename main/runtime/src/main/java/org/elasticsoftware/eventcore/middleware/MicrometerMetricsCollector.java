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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.elasticsoftware.eventcore.handling.RequestType;

import java.time.Duration;

public class MicrometerMetricsCollector implements MetricsCollector {
    public static final String DURATION_METRIC = "eventcore.request.duration";
    public static final String ERRORS_METRIC = "eventcore.request.errors";

    private final MeterRegistry meterRegistry;

    public MicrometerMetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void recordDuration(RequestType type, Duration duration) {
        Timer.builder(DURATION_METRIC)
                .description("Time spent handling a command or query")
                .tag("kind", type.kind().label())
                .tag("type", type.name())
                .register(meterRegistry)
                .record(duration);
    }

    @Override
    public void incrementErrorCount(RequestType type) {
        Counter.builder(ERRORS_METRIC)
                .description("Number of failed commands and queries")
                .tag("kind", type.kind().label())
                .tag("type", type.name())
                .register(meterRegistry)
                .increment();
    }
}
