/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.director.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.director.core.observability.CompositeDirectorEvents;
import org.fireflyframework.director.core.observability.DirectorEvents;
import org.fireflyframework.director.core.observability.DirectorLoggerEvents;
import org.fireflyframework.director.core.observability.DirectorMetrics;
import org.fireflyframework.director.engine.Director;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Auto-configuration of the director.
 *
 * <p>Activated when {@code firefly.director.enabled=true} (default). Every
 * {@link DirectorEvents} bean is attached to the director; a single one is used
 * directly, several are wrapped in a {@link CompositeDirectorEvents}.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(DirectorProperties.class)
@ConditionalOnProperty(name = "firefly.director.enabled", havingValue = "true", matchIfMissing = true)
public class DirectorAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DirectorLoggerEvents directorLoggerEvents() {
        return new DirectorLoggerEvents();
    }

    @Bean
    @ConditionalOnMissingBean
    public Director director(DirectorProperties properties, ObjectProvider<DirectorEvents> events) {
        List<DirectorEvents> delegates = events.orderedStream().toList();
        DirectorEvents composed = delegates.size() == 1
                ? delegates.get(0)
                : new CompositeDirectorEvents(delegates);
        log.info("[director] Director initialized maxConcurrentActions={} depthFirst={} flattenResults={}",
                properties.getMaxConcurrentActions(), properties.isDepthFirst(), properties.isFlattenResults());
        return new Director(properties.toConfig(), composed);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionRegistrar subscriptionRegistrar(ApplicationContext applicationContext, Director director) {
        return new SubscriptionRegistrar(applicationContext, director);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(name = "firefly.director.metrics.enabled", havingValue = "true", matchIfMissing = true)
    static class DirectorMetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DirectorMetrics directorMetrics(MeterRegistry meterRegistry) {
            log.info("[director] Metrics initialized with MeterRegistry");
            return new DirectorMetrics(meterRegistry);
        }
    }
}
