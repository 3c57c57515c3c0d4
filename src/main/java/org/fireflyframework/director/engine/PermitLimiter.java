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

import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Non-blocking counting semaphore. {@link #acquire()} completes at once while
 * permits are free and otherwise waits, FIFO, without holding a thread.
 */
public final class PermitLimiter {

    private final int maxPermits;
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final AtomicInteger wip = new AtomicInteger();
    private int available;
    private int pendingReleases;

    public PermitLimiter(int maxPermits) {
        if (maxPermits < 1) throw new IllegalArgumentException("maxPermits must be >= 1");
        this.maxPermits = maxPermits;
        this.available = maxPermits;
    }

    public Mono<Permit> acquire() {
        return Mono.create(sink -> {
            synchronized (this) {
                if (available == 0) {
                    Waiter waiter = new Waiter(sink);
                    waiters.addLast(waiter);
                    sink.onCancel(() -> abandon(waiter));
                    return;
                }
                available--;
            }
            sink.success(new Permit(this));
        });
    }

    /**
     * Runs {@code body} while holding a permit. The permit is released when the
     * body completes, fails or is cancelled.
     */
    public <T> Mono<T> withPermit(Supplier<Mono<T>> body) {
        return Mono.usingWhen(acquire(),
                permit -> body.get(),
                permit -> Mono.fromRunnable(permit::release));
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int queuedAcquirers() {
        return waiters.size();
    }

    public int maxPermits() {
        return maxPermits;
    }

    /**
     * Hands a released permit to the oldest live waiter, or returns it to the pool.
     * A release triggered while permits are being handed over, typically by a
     * waiter whose body completes synchronously, is only counted; the outermost
     * call drains it, so the stack depth stays constant however many waiters
     * are queued.
     */
    private void handOver() {
        synchronized (this) {
            pendingReleases++;
        }
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            drain();
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }

    private void drain() {
        while (true) {
            Waiter next;
            synchronized (this) {
                if (pendingReleases == 0) {
                    return;
                }
                next = waiters.pollFirst();
                if (next == null) {
                    available += pendingReleases;
                    pendingReleases = 0;
                    return;
                }
                pendingReleases--;
            }
            Permit permit = new Permit(this);
            next.permit = permit;
            if (next.settled.compareAndSet(false, true)) {
                next.sink.success(permit);
            } else {
                // waiter cancelled first, keep the permit for the next one
                synchronized (this) {
                    pendingReleases++;
                }
            }
        }
    }

    private void abandon(Waiter waiter) {
        if (waiter.settled.compareAndSet(false, true)) {
            synchronized (this) {
                waiters.remove(waiter);
            }
        } else if (waiter.permit != null) {
            // cancelled while the permit was being handed over
            waiter.permit.release();
        }
    }

    private static final class Waiter {
        final MonoSink<Permit> sink;
        final AtomicBoolean settled = new AtomicBoolean();
        volatile Permit permit;

        Waiter(MonoSink<Permit> sink) {
            this.sink = sink;
        }
    }

    /**
     * A held permit. Releasing it more than once has no effect.
     */
    public static final class Permit {
        private final PermitLimiter owner;
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit(PermitLimiter owner) {
            this.owner = owner;
        }

        public void release() {
            if (released.compareAndSet(false, true)) {
                owner.handOver();
            }
        }
    }
}
