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

import org.fireflyframework.director.engine.DirectorConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

/**
 * Configuration properties of the director, under the {@code firefly.director} prefix.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   director:
 *     enabled: true
 *     max-concurrent-actions: 100
 *     max-log-entries: 1000000
 *     depth-first: false
 *     flatten-results: false
 *     metrics:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.director")
public class DirectorProperties {

    private boolean enabled = true;
    private int maxConcurrentActions = DirectorConfig.DEFAULT.maxConcurrentActions();
    private int maxLogEntries = DirectorConfig.DEFAULT.maxLogEntries();
    private boolean depthFirst = false;
    private boolean flattenResults = false;

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    public DirectorConfig toConfig() {
        return new DirectorConfig(maxConcurrentActions, maxLogEntries, depthFirst, flattenResults);
    }

    // --- Getters and Setters ---

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getMaxConcurrentActions() { return maxConcurrentActions; }
    public void setMaxConcurrentActions(int maxConcurrentActions) { this.maxConcurrentActions = maxConcurrentActions; }

    public int getMaxLogEntries() { return maxLogEntries; }
    public void setMaxLogEntries(int maxLogEntries) { this.maxLogEntries = maxLogEntries; }

    public boolean isDepthFirst() { return depthFirst; }
    public void setDepthFirst(boolean depthFirst) { this.depthFirst = depthFirst; }

    public boolean isFlattenResults() { return flattenResults; }
    public void setFlattenResults(boolean flattenResults) { this.flattenResults = flattenResults; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    // --- Nested property classes ---

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
