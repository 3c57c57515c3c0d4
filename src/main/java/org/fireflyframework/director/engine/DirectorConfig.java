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

package org.fireflyframework.director.engine;

/**
 * Construction parameters of a {@link Director}.
 *
 * @param maxConcurrentActions permits shared by every dispatch of the director, nested ones included
 * @param maxLogEntries        capacity of the director's message log
 * @param depthFirst           run each subscriber's whole sub-chain before the next subscriber
 * @param flattenResults       return flat pre-order lists instead of nested chains
 */
public record DirectorConfig(
        int maxConcurrentActions,
        int maxLogEntries,
        boolean depthFirst,
        boolean flattenResults
) {
    public static final DirectorConfig DEFAULT = new DirectorConfig(100, 1_000_000, false, false);

    public DirectorConfig {
        if (maxConcurrentActions < 1) throw new IllegalArgumentException("maxConcurrentActions must be >= 1");
        if (maxLogEntries < 1) throw new IllegalArgumentException("maxLogEntries must be >= 1");
    }

    public DirectorConfig withMaxConcurrentActions(int maxConcurrentActions) {
        return new DirectorConfig(maxConcurrentActions, maxLogEntries, depthFirst, flattenResults);
    }

    public DirectorConfig withMaxLogEntries(int maxLogEntries) {
        return new DirectorConfig(maxConcurrentActions, maxLogEntries, depthFirst, flattenResults);
    }

    public DirectorConfig withDepthFirst(boolean depthFirst) {
        return new DirectorConfig(maxConcurrentActions, maxLogEntries, depthFirst, flattenResults);
    }

    public DirectorConfig withFlattenResults(boolean flattenResults) {
        return new DirectorConfig(maxConcurrentActions, maxLogEntries, depthFirst, flattenResults);
    }
}
