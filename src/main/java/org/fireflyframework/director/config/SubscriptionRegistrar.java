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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.director.annotation.Subscribe;
import org.fireflyframework.director.core.action.Action;
import org.fireflyframework.director.engine.Director;
import org.springframework.aop.framework.AopProxyUtils;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.ApplicationContext;

import java.util.Map;

/**
 * Subscribes every {@link Subscribe}-annotated {@link Action} bean to the
 * director once all singletons are created.
 */
@Slf4j
public class SubscriptionRegistrar implements SmartInitializingSingleton {

    private final ApplicationContext applicationContext;
    private final Director director;

    public SubscriptionRegistrar(ApplicationContext applicationContext, Director director) {
        this.applicationContext = applicationContext;
        this.director = director;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = applicationContext.getBeansWithAnnotation(Subscribe.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            Object bean = entry.getValue();
            Class<?> targetClass = AopUtils.getTargetClass(bean);
            Subscribe ann = targetClass.getAnnotation(Subscribe.class);
            if (ann == null) continue;
            // proxies skip the Action constructor, subscribe the target instead
            Object target = AopProxyUtils.getSingletonTarget(bean);
            Object candidate = target != null ? target : bean;
            if (!(candidate instanceof Action action)) {
                throw new IllegalStateException("Bean '" + entry.getKey() + "' is annotated with @Subscribe but is not an Action");
            }
            for (String eventName : ann.value()) {
                director.subscribe(eventName, action);
                log.info("[director] Subscribed action '{}' to '{}'", action.name(), eventName);
            }
        }
    }
}
