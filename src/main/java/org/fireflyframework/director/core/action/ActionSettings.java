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

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Construction parameters shared by every action: result parser and retry policy.
 *
 * @param parser      applied to the raw output of every attempt; identity by default
 * @param retryCount  number of protected attempts before the final unprotected one
 * @param retryDelay  pause after each retried failure
 * @param retryOn     error types that may be retried; empty means every error
 */
public record ActionSettings(
        Function<Object, Object> parser,
        int retryCount,
        Duration retryDelay,
        List<Class<? extends Throwable>> retryOn
) {
    public static final ActionSettings DEFAULT = new ActionSettings(
            Function.identity(), 0, Duration.ZERO, List.of());

    public ActionSettings {
        Objects.requireNonNull(parser, "parser");
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(retryOn, "retryOn");
        if (retryCount < 0) throw new IllegalArgumentException("retryCount must be >= 0");
        if (retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must be >= 0");
        retryOn = List.copyOf(retryOn);
    }

    public static ActionSettings retrying(int retryCount, Duration retryDelay) {
        return DEFAULT.withRetry(retryCount, retryDelay);
    }

    public ActionSettings withParser(Function<Object, Object> parser) {
        return new ActionSettings(parser, retryCount, retryDelay, retryOn);
    }

    public ActionSettings withRetry(int retryCount, Duration retryDelay) {
        return new ActionSettings(parser, retryCount, retryDelay, retryOn);
    }

    @SafeVarargs
    public final ActionSettings withRetryOn(Class<? extends Throwable>... types) {
        return new ActionSettings(parser, retryCount, retryDelay, List.of(types));
    }

    public boolean isRetryable(Throwable error) {
        if (retryOn.isEmpty()) return true;
        for (Class<? extends Throwable> type : retryOn) {
            if (type.isInstance(error)) return true;
        }
        return false;
    }

    public boolean hasProtectedAttemptsLeft(int failedAttempts) {
        return failedAttempts < retryCount;
    }
}
