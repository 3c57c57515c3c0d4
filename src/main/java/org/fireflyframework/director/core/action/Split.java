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

import org.fireflyframework.director.core.exception.SplitTypeMismatchException;

import java.util.List;

/**
 * Fans a list out: the director publishes each element of this action's output
 * as its own event. Passes its input through unless {@link #forward(Object)} is
 * overridden; the final output must be a {@link List}.
 */
public class Split extends Action implements FanOut {

    public Split(String name) {
        super(name);
    }

    public Split(String name, ActionSettings settings) {
        super(name, settings);
    }

    @Override
    public ActionVariant variant() {
        return ActionVariant.SPLIT;
    }

    @Override
    protected Object checkOutput(Object output) {
        if (!(output instanceof List)) {
            throw new SplitTypeMismatchException(name(), output);
        }
        return output;
    }

    @Override
    public List<?> expand(Object output) {
        return (List<?>) checkOutput(output);
    }
}
