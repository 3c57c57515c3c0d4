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

/**
 * Leaf marker of a chain. Always produces a {@code null} result; since nothing
 * normally listens to {@value Action#TERMINATION_NAME}, dispatch ends here.
 */
public final class Termination extends Action {

    public Termination() {
        super(TERMINATION_NAME, ActionSettings.DEFAULT, true);
    }

    @Override
    public ActionVariant variant() {
        return ActionVariant.TERMINATION;
    }

    @Override
    protected Mono<Object> forward(Object data) {
        return Mono.empty();
    }
}
