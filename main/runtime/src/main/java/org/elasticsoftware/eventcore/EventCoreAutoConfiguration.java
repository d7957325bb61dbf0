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
import org.elasticsoftware.eventcore.commands.Command;
import org.elasticsoftware.eventcore.commands.CommandBus;
import org.elasticsoftware.eventcore.events.EventDispatcher;
import org.elasticsoftware.eventcore.events.SimpleEventDispatcher;
import org.elasticsoftware.eventcore.middleware.CacheKeyGenerator;
import org.elasticsoftware.eventcore.middleware.CacheProvider;
import org.elasticsoftware.eventcore.middleware.CachingMiddleware;
import org.elasticsoftware.eventcore.middleware.CaffeineCacheProvider;
import org.elasticsoftware.eventcore.middleware.MetricsCollector;
import org.elasticsoftware.eventcore.middleware.MetricsMiddleware;
import org.elasticsoftware.eventcore.middleware.MicrometerMetricsCollector;
import org.elasticsoftware.eventcore.queries.Query;
import org.elasticsoftware.eventcore.queries.QueryBus;
import org.elasticsoftware.eventcore.store.EventStore;
import org.elasticsoftware.eventcore.store.InMemoryEventStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

@Configuration
@PropertySource("classpath:eventcore-defaults.properties")
@EnableConfigurationProperties(EventCoreProperties.class)
public class EventCoreAutoConfiguration {

    @ConditionalOnMissingBean(CommandBus.class)
    @Bean(name = "eventCoreCommandBus")
    public CommandBus commandBus() {
        return new DefaultCommandBus();
    }

    @ConditionalOnMissingBean(QueryBus.class)
    @Bean(name = "eventCoreQueryBus")
    public QueryBus queryBus() {
        return new DefaultQueryBus();
    }

    @ConditionalOnMissingBean(EventStore.class)
    @Bean(name = "eventCoreEventStore", destroyMethod = "close")
    public EventStore eventStore() {
        return new InMemoryEventStore();
    }

    @ConditionalOnMissingBean(EventDispatcher.class)
    @Bean(name = "eventCoreEventDispatcher")
    public EventDispatcher eventDispatcher() {
        return new SimpleEventDispatcher();
    }

    @ConditionalOnMissingBean(CacheProvider.class)
    @Bean(name = "eventCoreCacheProvider")
    public CacheProvider cacheProvider(EventCoreProperties properties) {
        return new CaffeineCacheProvider(properties.getCache().getMaximumSize(),
                properties.getCache().getExpireAfterWrite());
    }

    @ConditionalOnMissingBean(CacheKeyGenerator.class)
    @Bean(name = "eventCoreCacheKeyGenerator")
    public CacheKeyGenerator cacheKeyGenerator() {
        return new CacheKeyGenerator();
    }

    @ConditionalOnMissingBean(name = "eventCoreQueryCachingMiddleware")
    @Bean(name = "eventCoreQueryCachingMiddleware")
    public CachingMiddleware<Query, Object> queryCachingMiddleware(CacheProvider cacheProvider,
                                                                   CacheKeyGenerator cacheKeyGenerator) {
        return new CachingMiddleware<>(cacheProvider, cacheKeyGenerator);
    }

    @ConditionalOnProperty(prefix = "eventcore.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean(MetricsCollector.class)
    @Bean(name = "eventCoreMetricsCollector")
    public MetricsCollector metricsCollector(ObjectProvider<MeterRegistry> meterRegistry) {
        return new MicrometerMetricsCollector(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @ConditionalOnBean(MetricsCollector.class)
    @ConditionalOnMissingBean(name = "eventCoreCommandMetricsMiddleware")
    @Bean(name = "eventCoreCommandMetricsMiddleware")
    public MetricsMiddleware<Command, Void> commandMetricsMiddleware(MetricsCollector metricsCollector) {
        return new MetricsMiddleware<>(metricsCollector);
    }

    @ConditionalOnBean(MetricsCollector.class)
    @ConditionalOnMissingBean(name = "eventCoreQueryMetricsMiddleware")
    @Bean(name = "eventCoreQueryMetricsMiddleware")
    public MetricsMiddleware<Query, Object> queryMetricsMiddleware(MetricsCollector metricsCollector) {
        return new MetricsMiddleware<>(metricsCollector);
    }
}
