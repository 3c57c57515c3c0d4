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

@Slf4j
public class DirectorLoggerEvents implements DirectorEvents {
    @Override
    public void onDispatchStarted(String eventName, int subscribers) {
        log.info("[director] dispatch.started event={} subscribers={}", eventName, subscribers);
    }
    @Override
    public void onNoListeners(String eventName) {
        log.debug("[director] dispatch.no-listeners event={}", eventName);
    }
    @Override
    public void onDispatchCompleted(String eventName, List<ChainResult> results) {
        log.info("[director] dispatch.completed event={} records={}", eventName, results.size());
    }
    @Override
    public void onActionStarted(String eventName, String actionName) {
        log.debug("[director] action.started event={} action={}", eventName, actionName);
    }
    @Override
    public void onActionSuccess(String eventName, String actionName, long latencyMs) {
        log.info("[director] action.success event={} action={} latencyMs={}", eventName, actionName, latencyMs);
    }
    @Override
    public void onActionFailed(String eventName, String actionName, Throwable error) {
        log.warn("[director] action.failed event={} action={} error={}", eventName, actionName, error.getMessage());
    }
}
