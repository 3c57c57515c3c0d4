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

import java.util.List;
import java.util.Objects;

/**
 * One hop of a dispatch: the action that ran, what it produced and, unless the
 * results were flattened, what its outgoing event led to.
 *
 * @param eventName name of the action that produced {@code result}
 * @param result    the action's output, possibly {@code null}
 * @param chain     records of the dispatch of the action's outgoing event;
 *                  {@code null} when nothing listened to it or after flattening
 */
public record ChainResult(String eventName, Object result, List<ChainResult> chain) {

    public ChainResult {
        Objects.requireNonNull(eventName, "eventName");
        chain = chain != null ? List.copyOf(chain) : null;
    }

    public static ChainResult flat(String eventName, Object result) {
        return new ChainResult(eventName, result, null);
    }

    public boolean isLeaf() {
        return chain == null || chain.isEmpty();
    }
}
