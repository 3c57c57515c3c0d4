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
import java.util.function.Function;

/**
 * Factory for actions backed by lambdas.
 *
 * <p>Usage:
 * <pre>{@code
 * Action upper = Actions.sync("upper", in -> in.toString().toUpperCase());
 * Action fetch = Actions.of("fetch", in -> client.get(in),
 *         ActionSettings.retrying(3, Duration.ofMillis(200)));
 * }</pre>
 */
public final class Actions {

    private Actions() {
    }

    public static Action of(String name, ActionHandler handler) {
        return of(name, handler, ActionSettings.DEFAULT);
    }

    public static Action of(String name, ActionHandler handler, ActionSettings settings) {
        return new HandlerAction(name, settings, handler);
    }

    public static Action sync(String name, Function<Object, Object> fn) {
        return sync(name, fn, ActionSettings.DEFAULT);
    }

    public static Action sync(String name, Function<Object, Object> fn, ActionSettings settings) {
        Objects.requireNonNull(fn, "fn");
        return new HandlerAction(name, settings, input -> Mono.fromCallable(() -> fn.apply(input)));
    }

    private static final class HandlerAction extends Action {
        private final ActionHandler handler;

        private HandlerAction(String name, ActionSettings settings, ActionHandler handler) {
            super(name, settings);
            this.handler = Objects.requireNonNull(handler, "handler");
        }

        @Override
        protected Mono<Object> forward(Object data) {
            return handler.handle(data);
        }
    }
}
