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

package org.fireflyframework.director.unit.engine;

import org.fireflyframework.director.core.action.ActionHandler;
import org.fireflyframework.director.core.action.ActionSettings;
import org.fireflyframework.director.core.action.Actions;
import org.fireflyframework.director.core.action.Condition;
import org.fireflyframework.director.core.action.Split;
import org.fireflyframework.director.core.action.Termination;
import org.fireflyframework.director.core.exception.ActionExecutionException;
import org.fireflyframework.director.core.exception.SplitTypeMismatchException;
import org.fireflyframework.director.core.observability.DirectorEvents;
import org.fireflyframework.director.engine.ChainResult;
import org.fireflyframework.director.engine.Director;
import org.fireflyframework.director.engine.DirectorConfig;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class DirectorDispatchTest {

    private static final DirectorConfig DEPTH_FIRST = DirectorConfig.DEFAULT.withDepthFirst(true);

    /** Records execution order and tracks the highest number of actions running at once. */
    static class Tracker {
        final List<String> order = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxRunning = new AtomicInteger();

        ActionHandler slow(String name, Duration delay) {
            return in -> Mono.defer(() -> {
                order.add(name);
                maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                return Mono.delay(delay).thenReturn((Object) name)
                        .doFinally(s -> running.decrementAndGet());
            });
        }
    }

    static class RecordingEvents implements DirectorEvents {
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        @Override public void onDispatchStarted(String eventName, int subscribers) { calls.add("started:" + eventName + ":" + subscribers); }
        @Override public void onNoListeners(String eventName) { calls.add("unrouted:" + eventName); }
        @Override public void onDispatchCompleted(String eventName, List<ChainResult> results) { calls.add("completed:" + eventName + ":" + results.size()); }
        @Override public void onActionStarted(String eventName, String actionName) { calls.add("action:" + actionName); }
        @Override public void onActionSuccess(String eventName, String actionName, long latencyMs) { calls.add("success:" + actionName); }
        @Override public void onActionFailed(String eventName, String actionName, Throwable error) { calls.add("failed:" + actionName); }
    }

    @Test
    void noSubscribers_completesEmptyAndLogs() {
        var director = new Director();

        StepVerifier.create(director.dispatch("nothing", 1))
                .verifyComplete();
        assertThat(director.logs()).containsExactly("No listeners for 'nothing'");
        assertThat(director.availablePermits()).isEqualTo(100);
    }

    @Test
    void singleAction_producesOneRecordWithNullChain() {
        var director = new Director();
        director.subscribe("start", Actions.sync("A", in -> "x"));

        StepVerifier.create(director.dispatch("start", null))
                .assertNext(results -> assertThat(results).containsExactly(new ChainResult("A", "x", null)))
                .verifyComplete();
        assertThat(director.logs()).containsExactly(
                "Processing events for 'start'",
                "No listeners for 'A'",
                "Events for 'start' completed");
    }

    @Test
    void chain_nestsRecordsUnderEachHop() {
        var director = new Director();
        director.subscribe("start", Actions.sync("A", in -> "a"));
        director.subscribe("A", Actions.sync("B", in -> in.toString().toUpperCase() + "!"));
        director.subscribe("B", new Termination());

        StepVerifier.create(director.dispatch("start", "go"))
                .assertNext(results -> assertThat(results).containsExactly(
                        new ChainResult("A", "a", List.of(
                                new ChainResult("B", "A!", List.of(
                                        new ChainResult("Termination", null, null)))))))
                .verifyComplete();
    }

    @Test
    void flattenResults_returnsPreOrderRecords() {
        var director = new Director(DirectorConfig.DEFAULT.withFlattenResults(true));
        director.subscribe("start", Actions.sync("A", in -> "a"));
        director.subscribe("A", Actions.sync("B", in -> in + "b"));
        director.subscribe("B", new Termination());

        StepVerifier.create(director.dispatch("start", "go"))
                .assertNext(results -> assertThat(results).containsExactly(
                        ChainResult.flat("A", "a"),
                        ChainResult.flat("B", "ab"),
                        ChainResult.flat("Termination", null)))
                .verifyComplete();
    }

    @Test
    void nullOutput_isStillPublished() {
        var director = new Director();
        director.subscribe("start", Actions.of("A", in -> Mono.empty()));
        director.subscribe("A", Actions.sync("B", in -> in == null ? "got-null" : "got-value"));

        StepVerifier.create(director.dispatch("start", "x"))
                .assertNext(results -> assertThat(results).containsExactly(
                        new ChainResult("A", null, List.of(new ChainResult("B", "got-null", null)))))
                .verifyComplete();
    }

    @Test
    void split_dispatchesOncePerElement() {
        var director = new Director();
        director.subscribe("start", new Split("S"));
        director.subscribe("S", Actions.sync("Double", in -> (Integer) in * 2));

        var items = List.of(1, 2, 3);
        StepVerifier.create(director.dispatch("start", items))
                .assertNext(results -> assertThat(results).containsExactly(
                        new ChainResult("S", items, List.of(new ChainResult("Double", 2, null))),
                        new ChainResult("S", items, List.of(new ChainResult("Double", 4, null))),
                        new ChainResult("S", items, List.of(new ChainResult("Double", 6, null)))))
                .verifyComplete();
    }

    @Test
    void split_emptyList_producesNoRecords() {
        var director = new Director();
        director.subscribe("start", new Split("S"));

        StepVerifier.create(director.dispatch("start", List.of()))
                .assertNext(results -> assertThat(results).isEmpty())
                .verifyComplete();
        assertThat(director.logs()).doesNotContain("No listeners for 'S'");
    }

    @Test
    void split_withoutDownstream_logsOneUnroutedEventPerElement() {
        var director = new Director();
        director.subscribe("start", new Split("S"));

        StepVerifier.create(director.dispatch("start", List.of("a", "b")))
                .assertNext(results -> assertThat(results).hasSize(2).allMatch(r -> r.chain() == null))
                .verifyComplete();
        assertThat(director.logs()).filteredOn(entry -> entry.equals("No listeners for 'S'")).hasSize(2);
    }

    @Test
    void split_nonListInput_failsUnwrapped() {
        var director = new Director();
        director.subscribe("start", new Split("S"));

        StepVerifier.create(director.dispatch("start", "not a list"))
                .expectError(SplitTypeMismatchException.class)
                .verify();
        assertThat(director.availablePermits()).isEqualTo(100);
    }

    @Test
    void condition_routesItsOutputLikeAnyAction() {
        var director = new Director(DirectorConfig.DEFAULT.withFlattenResults(true));
        director.subscribe("start", new Condition("Positive", in -> (Integer) in > 0, in -> Mono.just("positive")));

        StepVerifier.create(director.dispatch("start", 5))
                .assertNext(results -> assertThat(results).containsExactly(ChainResult.flat("Positive", "positive")))
                .verifyComplete();
        StepVerifier.create(director.dispatch("start", -5))
                .assertNext(results -> assertThat(results).containsExactly(ChainResult.flat("Positive", -5)))
                .verifyComplete();
    }

    @Test
    void results_keepSubscriberOrder() {
        var director = new Director();
        director.subscribe("start", Actions.of("Slow", in -> Mono.delay(Duration.ofMillis(80)).thenReturn((Object) "slow")));
        director.subscribe("start", Actions.sync("Fast", in -> "fast"));

        StepVerifier.create(director.dispatch("start", "x"))
                .assertNext(results -> assertThat(results).extracting(ChainResult::eventName)
                        .containsExactly("Slow", "Fast"))
                .verifyComplete();
    }

    @Test
    void breadthFirst_invokesSiblingsBeforeTheirChildren() {
        var director = new Director();
        var tracker = new Tracker();
        director.subscribe("start", Actions.sync("A1", in -> { tracker.order.add("A1"); return in; }));
        director.subscribe("start", Actions.sync("A2", in -> { tracker.order.add("A2"); return in; }));
        director.subscribe("A1", Actions.sync("B1", in -> { tracker.order.add("B1"); return in; }));
        director.subscribe("A2", Actions.sync("B2", in -> { tracker.order.add("B2"); return in; }));

        StepVerifier.create(director.dispatch("start", "x")).expectNextCount(1).verifyComplete();
        assertThat(tracker.order).containsExactly("A1", "A2", "B1", "B2");
    }

    @Test
    void depthFirst_completesEachBranchBeforeTheNextSubscriber() {
        var director = new Director(DEPTH_FIRST);
        var tracker = new Tracker();
        director.subscribe("start", Actions.sync("A1", in -> { tracker.order.add("A1"); return in; }));
        director.subscribe("start", Actions.sync("A2", in -> { tracker.order.add("A2"); return in; }));
        director.subscribe("A1", Actions.sync("B1", in -> { tracker.order.add("B1"); return in; }));
        director.subscribe("A2", Actions.sync("B2", in -> { tracker.order.add("B2"); return in; }));

        StepVerifier.create(director.dispatch("start", "x"))
                .assertNext(results -> assertThat(results).extracting(ChainResult::eventName)
                        .containsExactly("A1", "A2"))
                .verifyComplete();
        assertThat(tracker.order).containsExactly("A1", "B1", "A2", "B2");
    }

    @Test
    void breadthFirst_runsSiblingsConcurrently() {
        var director = new Director();
        var tracker = new Tracker();
        director.subscribe("start", Actions.of("A1", tracker.slow("A1", Duration.ofMillis(150))));
        director.subscribe("start", Actions.of("A2", tracker.slow("A2", Duration.ofMillis(150))));
        director.subscribe("start", Actions.of("A3", tracker.slow("A3", Duration.ofMillis(150))));

        StepVerifier.create(director.dispatch("start", "x"))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(tracker.maxRunning.get()).isEqualTo(3);
    }

    @Test
    void breadthFirst_runsFanOutBranchesConcurrently() {
        var director = new Director();
        var tracker = new Tracker();
        director.subscribe("start", new Split("S"));
        director.subscribe("S", Actions.of("Work", tracker.slow("Work", Duration.ofMillis(150))));

        StepVerifier.create(director.dispatch("start", List.of(1, 2, 3, 4)))
                .assertNext(results -> assertThat(results).hasSize(4))
                .verifyComplete();
        assertThat(tracker.maxRunning.get()).isEqualTo(4);
    }

    @Test
    void depthFirst_runsOneActionAtATime() {
        var director = new Director(DEPTH_FIRST);
        var tracker = new Tracker();
        director.subscribe("start", Actions.of("A1", tracker.slow("A1", Duration.ofMillis(50))));
        director.subscribe("start", Actions.of("A2", tracker.slow("A2", Duration.ofMillis(50))));
        director.subscribe("A1", Actions.of("B1", tracker.slow("B1", Duration.ofMillis(50))));

        StepVerifier.create(director.dispatch("start", "x"))
                .expectNextCount(1)
                .verifyComplete();
        assertThat(tracker.maxRunning.get()).isEqualTo(1);
        assertThat(tracker.order).containsExactly("A1", "B1", "A2");
    }

    @Test
    void actionError_isWrappedWithActionAndEventNames() {
        var director = new Director();
        director.subscribe("start", Actions.sync("A", in -> "a"));
        director.subscribe("A", Actions.of("B", in -> Mono.error(new IllegalStateException("boom"))));

        StepVerifier.create(director.dispatch("start", "x"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ActionExecutionException.class)
                            .hasMessage("Action 'B' failed while handling 'A': boom")
                            .hasCauseInstanceOf(IllegalStateException.class);
                    var ex = (ActionExecutionException) e;
                    assertThat(ex.getActionName()).isEqualTo("B");
                    assertThat(ex.getEventName()).isEqualTo("A");
                    assertThat(ex.getErrorCode()).isEqualTo("DIRECTOR_ACTION_FAILED");
                })
                .verify();
        assertThat(director.availablePermits()).isEqualTo(100);
        assertThat(director.logs()).doesNotContain("Events for 'start' completed");
    }

    @Test
    void actionError_isWrappedOnlyAfterItsRetries() {
        var director = new Director();
        var calls = new AtomicInteger();
        director.subscribe("start", Actions.of("A", in -> {
            calls.incrementAndGet();
            return Mono.error(new IllegalStateException("always"));
        }, ActionSettings.retrying(2, Duration.ZERO)));

        StepVerifier.create(director.dispatch("start", "x"))
                .expectError(ActionExecutionException.class)
                .verify();
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void breadthFirst_failingSibling_doesNotCancelOthers() {
        var director = new Director();
        var slowFinished = new AtomicBoolean();
        director.subscribe("start", Actions.of("Fail", in -> Mono.error(new IllegalStateException("boom"))));
        director.subscribe("start", Actions.of("Slow", in -> Mono.delay(Duration.ofMillis(100))
                .then(Mono.fromCallable(() -> {
                    slowFinished.set(true);
                    return in;
                }))));

        StepVerifier.create(director.dispatch("start", "x"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ActionExecutionException.class);
                    assertThat(((ActionExecutionException) e).getActionName()).isEqualTo("Fail");
                    assertThat(slowFinished).isTrue();
                })
                .verify();
    }

    @Test
    void events_areNotifiedForEveryStep() {
        var events = new RecordingEvents();
        var director = new Director(DirectorConfig.DEFAULT, events);
        director.subscribe("start", Actions.sync("A", in -> "a"));

        StepVerifier.create(director.dispatch("start", "x")).expectNextCount(1).verifyComplete();

        assertThat(events.calls).containsExactly(
                "started:start:1",
                "action:A",
                "success:A",
                "unrouted:A",
                "completed:start:1");
        assertThat(director.events()).isSameAs(events);
    }

    @Test
    void events_reportFailedActions() {
        var events = new RecordingEvents();
        var director = new Director(DirectorConfig.DEFAULT, events);
        director.subscribe("start", Actions.of("A", in -> Mono.error(new IllegalStateException("boom"))));

        StepVerifier.create(director.dispatch("start", "x")).expectError().verify();

        assertThat(events.calls).containsExactly("started:start:1", "action:A", "failed:A");
    }

    @Test
    void logs_areBoundedByMaxLogEntries() {
        var director = new Director(DirectorConfig.DEFAULT.withMaxLogEntries(2));
        director.subscribe("start", Actions.sync("A", in -> in));

        StepVerifier.create(director.dispatch("start", "x")).expectNextCount(1).verifyComplete();

        assertThat(director.logs()).containsExactly("No listeners for 'A'", "Events for 'start' completed");
    }

    @Test
    void subscriptionsAddedLater_areSeenByLaterDispatches() {
        var director = new Director(DirectorConfig.DEFAULT.withFlattenResults(true));
        director.subscribe("start", Actions.sync("A", in -> "a"));

        StepVerifier.create(director.dispatch("start", "x"))
                .assertNext(results -> assertThat(results).hasSize(1))
                .verifyComplete();

        director.subscribe("A", Actions.sync("B", in -> "b"));

        StepVerifier.create(director.dispatch("start", "x"))
                .assertNext(results -> assertThat(results).extracting(ChainResult::eventName).containsExactly("A", "B"))
                .verifyComplete();
    }
}
