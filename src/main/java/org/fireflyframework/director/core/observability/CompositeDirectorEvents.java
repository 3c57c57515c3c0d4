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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.director.engine.ChainResult;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeDirectorEvents implements DirectorEvents {
    private final List<DirectorEvents> delegates;

    public CompositeDirectorEvents(List<DirectorEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<DirectorEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    public List<DirectorEvents> getDelegates() {
        return delegates;
    }

    @Override public void onDispatchStarted(String eventName, int subscribers) { safeForEach(d -> d.onDispatchStarted(eventName, subscribers)); }
    @Override public void onNoListeners(String eventName) { safeForEach(d -> d.onNoListeners(eventName)); }
    @Override public void onDispatchCompleted(String eventName, List<ChainResult> results) { safeForEach(d -> d.onDispatchCompleted(eventName, results)); }
    @Override public void onActionStarted(String eventName, String actionName) { safeForEach(d -> d.onActionStarted(eventName, actionName)); }
    @Override public void onActionSuccess(String eventName, String actionName, long latencyMs) { safeForEach(d -> d.onActionSuccess(eventName, actionName, latencyMs)); }
    @Override public void onActionFailed(String eventName, String actionName, Throwable error) { safeForEach(d -> d.onActionFailed(eventName, actionName, error)); }
}
