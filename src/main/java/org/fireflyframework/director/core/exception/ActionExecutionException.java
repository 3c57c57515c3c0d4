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

package org.fireflyframework.director.core.exception;

/**
 * Raised when an action's own logic fails after its retry policy gave up.
 * The original error is always the cause.
 */
public final class ActionExecutionException extends DirectorException {
    private final String eventName;
    private final String actionName;

    public ActionExecutionException(String eventName, String actionName, Throwable cause) {
        super("Action '" + actionName + "' failed while handling '" + eventName + "': " + cause.getMessage(),
                "DIRECTOR_ACTION_FAILED", cause);
        this.eventName = eventName;
        this.actionName = actionName;
    }

    public String getEventName() {
        return eventName;
    }

    public String getActionName() {
        return actionName;
    }
}
