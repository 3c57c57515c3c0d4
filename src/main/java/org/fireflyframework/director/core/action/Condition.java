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

package org.fireflyframework.director.core.action;

import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Runs its body only when the predicate accepts the input; otherwise the input
 * is passed on unchanged.
 */
public class Condition extends Action {

    private final Predicate<Object> condition;
    private final ActionHandler body;

    public Condition(String name, Predicate<Object> condition) {
        this(name, condition, null, ActionSettings.DEFAULT);
    }

    public Condition(String name, Predicate<Object> condition, ActionHandler body) {
        this(name, condition, body, ActionSettings.DEFAULT);
    }

    public Condition(String name, Predicate<Object> condition, ActionHandler body, ActionSettings settings) {
        super(name, settings);
        this.condition = Objects.requireNonNull(condition, "condition");
        this.body = body;
    }

    @Override
    public ActionVariant variant() {
        return ActionVariant.CONDITION;
    }

    @Override
    protected final Mono<Object> forward(Object data) {
        if (condition.test(data)) {
            return whenTrue(data);
        }
        return Mono.justOrEmpty(data);
    }

    /**
     * Logic for accepted inputs: the body when one was given, pass-through otherwise.
     */
    protected Mono<Object> whenTrue(Object data) {
        return body != null ? body.handle(data) : super.forward(data);
    }
}
