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

package org.elasticsoftware.eventcore;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.elasticsoftware.eventcore.bus.DefaultCommandBus;
import org.elasticsoftware.eventcore.bus.DefaultQueryBus;
import org.elasticsoftware.eventcore.commands.CommandBus;
import org.elasticsoftware.eventcore.events.EventDispatcher;
import org.elasticsoftware.eventcore.events.SimpleEventDispatcher;
import org.elasticsoftware.eventcore.handling.RequestKind;
import org.elasticsoftware.eventcore.handling.RequestType;
import org.elasticsoftware.eventcore.middleware.CacheProvider;
import org.elasticsoftware.eventcore.middleware.CaffeineCacheProvider;
import org.elasticsoftware.eventcore.middleware.MetricsCollector;
import org.elasticsoftware.eventcore.middleware.MetricsMiddleware;
import org.elasticsoftware.eventcore.middleware.MicrometerMetricsCollector;
import org.elasticsoftware.eventcore.queries.QueryBus;
import org.elasticsoftware.eventcore.store.EventStore;
import org.elasticsoftware.eventcore.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class EventCoreAutoConfigurationTests {
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(EventCoreAutoConfiguration.class));

    @Test
    void testDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CommandBus.class);
            assertThat(context.getBean(CommandBus.class)).isInstanceOf(DefaultCommandBus.class);
            assertThat(context.getBean(QueryBus.class)).isInstanceOf(DefaultQueryBus.class);
            assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
            assertThat(context.getBean(EventDispatcher.class)).isInstanceOf(SimpleEventDispatcher.class);
            assertThat(context.getBean(CacheProvider.class)).isInstanceOf(CaffeineCacheProvider.class);
            assertThat(context.getBean(MetricsCollector.class)).isInstanceOf(MicrometerMetricsCollector.class);
            assertThat(context).hasBean("eventCoreQueryCachingMiddleware");
            assertThat(context).hasBean("eventCoreCommandMetricsMiddleware");
            assertThat(context).hasBean("eventCoreQueryMetricsMiddleware");
        });
    }

    @Test
    void testDefaultProperties() {
        contextRunner.run(context -> {
            EventCoreProperties properties = context.getBean(EventCoreProperties.class);
            assertThat(properties.getCache().getMaximumSize()).isEqualTo(1000);
            assertThat(properties.getCache().getExpireAfterWrite()).isEqualTo(Duration.ofMinutes(5));
            assertThat(properties.getMetrics().isEnabled()).isTrue();
        });
    }

    @Test
    void testPropertiesAreBound() {
        contextRunner
                .withPropertyValues("eventcore.cache.maximum-size=10", "eventcore.cache.expire-after-write=30s")
                .run(context -> {
                    EventCoreProperties properties = context.getBean(EventCoreProperties.class);
                    assertThat(properties.getCache().getMaximumSize()).isEqualTo(10);
                    assertThat(properties.getCache().getExpireAfterWrite()).isEqualTo(Duration.ofSeconds(30));
                });
    }

    @Test
    void testMetricsCanBeDisabled() {
        contextRunner
                .withPropertyValues("eventcore.metrics.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(MetricsCollector.class);
                    assertThat(context).doesNotHaveBean(MetricsMiddleware.class);
                });
    }

    @Test
    void testExistingMeterRegistryIsUsed() {
        contextRunner
                .withUserConfiguration(MeterRegistryConfiguration.class)
                .run(context -> {
                    MetricsCollector collector = context.getBean(MetricsCollector.class);
                    collector.incrementErrorCount(new RequestType(RequestKind.COMMAND, "Deposit"));
                    MeterRegistry registry = context.getBean(MeterRegistry.class);
                    assertThat(registry.get(MicrometerMetricsCollector.ERRORS_METRIC).counter().count()).isEqualTo(1.0);
                });
    }

    @Test
    void testUserBeansTakePrecedence() {
        contextRunner
                .withUserConfiguration(CustomEventStoreConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(EventStore.class);
                    assertThat(context.getBean(EventStore.class)).isSameAs(CustomEventStoreConfiguration.STORE);
                });
    }

    @Configuration
    static class MeterRegistryConfiguration {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomEventStoreConfiguration {
        static final InMemoryEventStore STORE = new InMemoryEventStore();

        @Bean
        EventStore customEventStore() {
            return STORE;
        }
    }
}
