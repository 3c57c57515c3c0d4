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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns a tree of {@link ChainResult}s into a single pre-order list of
 * chain-less records.
 */
public final class ResultFlattener {

    private ResultFlattener() {
    }

    public static List<ChainResult> flatten(List<ChainResult> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<ChainResult> flat = new ArrayList<>();
        append(records, flat);
        return Collections.unmodifiableList(flat);
    }

    private static void append(List<ChainResult> records, List<ChainResult> flat) {
        for (ChainResult record : records) {
            flat.add(ChainResult.flat(record.eventName(), record.result()));
            if (record.chain() != null) {
                append(record.chain(), flat);
            }
        }
    }
}
