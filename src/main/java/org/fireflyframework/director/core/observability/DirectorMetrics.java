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

package org.fireflyframework.director.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.director.engine.ChainResult;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer meters under {@code firefly.director.*}: {@code dispatches.started},
 * {@code dispatches.unrouted} and {@code dispatches.completed} counters tagged by event,
 * an {@code actions.completed} counter tagged by action and success, and an
 * {@code actions.duration} timer tagged by action.
 */
public class DirectorMetrics implements DirectorEvents {
    private static final String PREFIX = "firefly.director";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public DirectorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onDispatchStarted(String eventName, int subscribers) {
        counter("dispatches.started", "event", eventName).increment();
    }

    @Override
    public void onNoListeners(String eventName) {
        counter("dispatches.unrouted", "event", eventName).increment();
    }

    @Override
    public void onDispatchCompleted(String eventName, List<ChainResult> results) {
        counter("dispatches.completed", "event", eventName).increment();
    }

    @Override
    public void onActionSuccess(String eventName, String actionName, long latencyMs) {
        counter("actions.completed", "action", actionName, "success", "true").increment();
        timer("actions.duration", "action", actionName).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onActionFailed(String eventName, String actionName, Throwable error) {
        counter("actions.completed", "action", actionName, "success", "false").increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
