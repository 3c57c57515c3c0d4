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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.director.core.exception.ActionInitializationException;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named unit of work. Subscribed to one or more events on a director, it
 * receives each event's payload and its output is published under
 * {@link #outgoingEvent()}.
 *
 * <p>Subclasses override {@link #forward(Object)}; callers go through
 * {@link #invoke(Object)}, which applies the parser and the retry policy from
 * {@link ActionSettings}. An empty {@code Mono} stands for a {@code null} result
 * throughout.
 */
@Slf4j
public abstract class Action {

    public static final String TERMINATION_NAME = "Termination";
    public static final String SAVE_NAME = "Save";

    private static final Set<String> RESERVED_NAMES = Set.of(TERMINATION_NAME, SAVE_NAME);

    // also the outgoing event name
    private final String name;
    private final ActionSettings settings;
    private final boolean initialized;

    protected Action(String name) {
        this(name, ActionSettings.DEFAULT);
    }

    protected Action(String name, ActionSettings settings) {
        this(name, settings, false);
    }

    Action(String name, ActionSettings settings, boolean reservedNameAllowed) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name must not be blank");
        }
        if (!reservedNameAllowed && RESERVED_NAMES.contains(name)) {
            throw new IllegalArgumentException("Action name cannot be '" + name + "' (reserved for the built-in "
                    + name + " action)");
        }
        this.name = name;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.initialized = true;
    }

    public final String name() {
        return name;
    }

    /**
     * Event the output of this action is published under.
     */
    public final String outgoingEvent() {
        return name;
    }

    public final ActionSettings settings() {
        return settings;
    }

    public ActionVariant variant() {
        return ActionVariant.ACTION;
    }

    /**
     * Core logic of the action. Passes its input through unless overridden.
     */
    protected Mono<Object> forward(Object data) {
        return Mono.justOrEmpty(data);
    }

    /**
     * Validates the parsed output of a successful invocation. Runs once, after the
     * retry policy, and may throw to fail the invocation.
     */
    protected Object checkOutput(Object output) {
        return output;
    }

    /**
     * Runs {@link #forward(Object)} and the parser under the retry policy.
     *
     * <p>The first {@code retryCount} attempts are protected: a retryable error
     * waits {@code retryDelay} and tries again, any other error fails at once.
     * Once they are used up a last unprotected attempt runs, so an always-failing
     * action is tried {@code retryCount + 1} times.
     */
    public final Mono<Object> invoke(Object data) {
        return Mono.defer(() -> {
            if (!initialized) {
                return Mono.error(new ActionInitializationException(String.valueOf(name)));
            }
            return attempt(data, 0)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(out -> Mono.justOrEmpty(checkOutput(out.orElse(null))));
        });
    }

    private Mono<Object> attempt(Object data, int failedAttempts) {
        Mono<Object> call = Mono.defer(() -> forward(data))
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(raw -> Mono.justOrEmpty(settings.parser().apply(raw.orElse(null))));
        if (!settings.hasProtectedAttemptsLeft(failedAttempts)) {
            return call;
        }
        return call.onErrorResume(err -> {
            if (!settings.isRetryable(err)) {
                return Mono.error(err);
            }
            log.debug("[director] action.retry name={} failedAttempts={} error={}",
                    name, failedAttempts + 1, err.toString());
            return pause().then(attempt(data, failedAttempts + 1));
        });
    }

    private Mono<Void> pause() {
        if (settings.retryDelay().isZero()) {
            return Mono.empty();
        }
        return Mono.delay(settings.retryDelay()).then();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
