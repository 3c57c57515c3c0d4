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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only message log of a director. Once full, every append
 * evicts the oldest entry.
 */
public final class ActionLog {

    private final int capacity;
    private final Deque<String> entries = new ArrayDeque<>();

    public ActionLog(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    public synchronized void append(String message) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(message);
    }

    /**
     * Snapshot of the retained messages, oldest first.
     */
    public synchronized List<String> entries() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        entries.clear();
    }
}
