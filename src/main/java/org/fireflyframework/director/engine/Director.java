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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.director.core.action.Action;
import org.fireflyframework.director.core.action.FanOut;
import org.fireflyframework.director.core.exception.ActionExecutionException;
import org.fireflyframework.director.core.exception.AlreadySubscribedException;
import org.fireflyframework.director.core.exception.DirectorException;
import org.fireflyframework.director.core.exception.DuplicateActionNameException;
import org.fireflyframework.director.core.exception.UnknownActionException;
import org.fireflyframework.director.core.observability.DirectorEvents;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.concurrent.Queues;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Routes events to the actions subscribed to them and republishes every
 * action's output under the action's own name, recursively, until an event
 * has no subscribers.
 *
 * <p>Usage:
 * <pre>{@code
 * Director director = new Director();
 * director.subscribe("start", Actions.sync("upper", in -> in.toString().toUpperCase()));
 * director.subscribe("upper", new Termination());
 * List<ChainResult> results = director.dispatch("start", "hello").block();
 * }</pre>
 *
 * <p>Subscriptions are meant to be set up before dispatching. Changing the
 * subscribers of an event while a dispatch of that event is in flight is left
 * to the caller to coordinate: each dispatch works on the subscriber list as it
 * was when its permit was granted.
 */
@Slf4j
public class Director {

    private final DirectorConfig config;
    private final DirectorEvents events;
    private final PermitLimiter limiter;
    private final ActionLog actionLog;
    private final Map<String, List<Action>> listeners = new LinkedHashMap<>();
    private final Map<String, Action> actions = new LinkedHashMap<>();

    public Director() {
        this(DirectorConfig.DEFAULT);
    }

    public Director(DirectorConfig config) {
        this(config, new DirectorEvents() {});
    }

    public Director(DirectorConfig config, DirectorEvents events) {
        this.config = Objects.requireNonNull(config, "config");
        this.events = Objects.requireNonNull(events, "events");
        this.limiter = new PermitLimiter(config.maxConcurrentActions());
        this.actionLog = new ActionLog(config.maxLogEntries());
    }

    // --- Subscriptions ---

    /**
     * Subscribes {@code action} to {@code eventName}, registering it under its name
     * on first use.
     *
     * @throws DuplicateActionNameException if another instance is registered under the same name
     * @throws AlreadySubscribedException   if this instance already listens to the event
     */
    public synchronized void subscribe(String eventName, Action action) {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(action, "action");
        Action registered = actions.get(action.name());
        if (registered != null && registered != action) {
            throw new DuplicateActionNameException(action.name());
        }
        attach(eventName, action);
        actions.putIfAbsent(action.name(), action);
    }

    /**
     * Subscribes an already registered action to one more event.
     *
     * @throws UnknownActionException     if no action is registered under {@code actionName}
     * @throws AlreadySubscribedException if the action already listens to the event
     */
    public synchronized void addSubscription(String eventName, String actionName) {
        Objects.requireNonNull(eventName, "eventName");
        attach(eventName, registeredAction(actionName));
    }

    /**
     * Unsubscribes a registered action from an event. The action stays registered.
     *
     * @return whether a subscription was removed
     * @throws UnknownActionException if no action is registered under {@code actionName}
     */
    public synchronized boolean removeSubscription(String eventName, String actionName) {
        Action action = registeredAction(actionName);
        List<Action> subscribers = listeners.get(eventName);
        if (subscribers == null) {
            return false;
        }
        boolean removed = subscribers.removeIf(a -> a == action);
        if (subscribers.isEmpty()) {
            listeners.remove(eventName);
        }
        if (removed) {
            log.debug("[director] unsubscribed action={} event={}", actionName, eventName);
        }
        return removed;
    }

    /**
     * Names of the actions subscribed to {@code eventName}, in subscription order.
     */
    public synchronized List<String> listSubscriptions(String eventName) {
        List<Action> subscribers = listeners.get(eventName);
        if (subscribers == null) {
            return List.of();
        }
        return subscribers.stream().map(Action::name).toList();
    }

    public synchronized Optional<Action> getAction(String actionName) {
        return Optional.ofNullable(actions.get(actionName));
    }

    public synchronized Collection<Action> registeredActions() {
        return List.copyOf(actions.values());
    }

    public synchronized Set<String> eventNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(listeners.keySet()));
    }

    private Action registeredAction(String actionName) {
        Action action = actions.get(actionName);
        if (action == null) {
            throw new UnknownActionException(actionName);
        }
        return action;
    }

    private void attach(String eventName, Action action) {
        List<Action> subscribers = listeners.get(eventName);
        if (subscribers != null && subscribers.stream().anyMatch(a -> a == action)) {
            throw new AlreadySubscribedException(eventName, action.name());
        }
        listeners.computeIfAbsent(eventName, k -> new ArrayList<>()).add(action);
        log.debug("[director] subscribed action={} event={}", action.name(), eventName);
    }

    private synchronized List<Action> subscribers(String eventName) {
        List<Action> subscribers = listeners.get(eventName);
        return subscribers != null ? List.copyOf(subscribers) : List.of();
    }

    // --- Dispatch ---

    /**
     * Runs every action subscribed to {@code eventName} on {@code data} and,
     * recursively, everything their outputs trigger.
     *
     * <p>Each call holds one of the director's {@code maxConcurrentActions} permits
     * for its whole duration, including while it waits for the dispatches it
     * started, even for an output nobody listens to. A chain of depth {@code n}
     * needs {@code n + 1} permits; with fewer it never completes, because the
     * outer dispatches hold every permit and the inner ones wait forever.
     *
     * @return the chain records, flattened if so configured; completes empty
     *         when nothing is subscribed to {@code eventName}
     */
    public Mono<List<ChainResult>> dispatch(String eventName, Object data) {
        Objects.requireNonNull(eventName, "eventName");
        return limiter.withPermit(() -> dispatchHoldingPermit(eventName, data));
    }

    private Mono<List<ChainResult>> dispatchHoldingPermit(String eventName, Object data) {
        List<Action> subscribers = subscribers(eventName);
        if (subscribers.isEmpty()) {
            record("No listeners for '" + eventName + "'");
            events.onNoListeners(eventName);
            return Mono.empty();
        }
        record("Processing events for '" + eventName + "'");
        events.onDispatchStarted(eventName, subscribers.size());

        Flux<ChainResult> records = config.depthFirst()
                ? depthFirst(eventName, subscribers, data)
                : breadthFirst(eventName, subscribers, data);
        return records.collectList()
                .map(list -> config.flattenResults() ? ResultFlattener.flatten(list) : List.copyOf(list))
                .doOnNext(list -> {
                    record("Events for '" + eventName + "' completed");
                    events.onDispatchCompleted(eventName, list);
                });
    }

    private Flux<ChainResult> depthFirst(String eventName, List<Action> subscribers, Object data) {
        return Flux.fromIterable(subscribers)
                .concatMap(action -> invoke(eventName, action, data)
                        .flatMapMany(hop -> Flux.fromIterable(hop.next())
                                .concatMap(next -> next)
                                .map(chain -> hop.toRecord(chain.orElse(null)))));
    }

    private Flux<ChainResult> breadthFirst(String eventName, List<Action> subscribers, Object data) {
        return Flux.fromIterable(subscribers)
                .flatMapSequentialDelayError(action -> invoke(eventName, action, data),
                        subscribers.size(), Queues.XS_BUFFER_SIZE)
                .collectList()
                .flatMapMany(hops -> Flux.fromIterable(hops)
                        .flatMapSequentialDelayError(hop -> Flux.fromIterable(hop.next())
                                        .flatMapSequentialDelayError(next -> next,
                                                Math.max(1, hop.next().size()), Queues.XS_BUFFER_SIZE)
                                        .map(chain -> hop.toRecord(chain.orElse(null))),
                                Math.max(1, hops.size()), Queues.XS_BUFFER_SIZE))
                .onErrorMap(Exceptions::isMultiple, Director::firstError);
    }

    private Mono<Hop> invoke(String eventName, Action action, Object data) {
        return Mono.defer(() -> {
            events.onActionStarted(eventName, action.name());
            long startedAt = System.nanoTime();
            return action.invoke(data)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .onErrorMap(err -> !(err instanceof DirectorException),
                            err -> new ActionExecutionException(eventName, action.name(), err))
                    .doOnError(err -> events.onActionFailed(eventName, action.name(), err))
                    .map(output -> {
                        long latencyMs = (System.nanoTime() - startedAt) / 1_000_000;
                        events.onActionSuccess(eventName, action.name(), latencyMs);
                        Object result = output.orElse(null);
                        return new Hop(action.name(), result, publish(action, result));
                    });
        });
    }

    private List<Mono<Optional<List<ChainResult>>>> publish(Action action, Object result) {
        String nextEvent = action.outgoingEvent();
        if (action instanceof FanOut fanOut) {
            List<Mono<Optional<List<ChainResult>>>> next = new ArrayList<>();
            for (Object element : fanOut.expand(result)) {
                next.add(chain(nextEvent, element));
            }
            return next;
        }
        return List.of(chain(nextEvent, result));
    }

    private Mono<Optional<List<ChainResult>>> chain(String eventName, Object data) {
        return dispatch(eventName, data)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    private static Throwable firstError(Throwable error) {
        Throwable current = error;
        while (Exceptions.isMultiple(current)) {
            List<Throwable> errors = Exceptions.unwrapMultiple(current);
            if (errors.isEmpty()) {
                break;
            }
            current = errors.get(0);
        }
        return current;
    }

    // --- Log ---

    /**
     * Retained log messages, oldest first.
     */
    public List<String> logs() {
        return actionLog.entries();
    }

    public DirectorConfig config() {
        return config;
    }

    public DirectorEvents events() {
        return events;
    }

    public int availablePermits() {
        return limiter.availablePermits();
    }

    private void record(String message) {
        actionLog.append(message);
        log.debug("[director] {}", message);
    }

    /**
     * Output of one subscriber, with the not yet started dispatches of its outgoing event.
     */
    private record Hop(String actionName, Object result, List<Mono<Optional<List<ChainResult>>>> next) {
        ChainResult toRecord(List<ChainResult> chain) {
            return new ChainResult(actionName, result, chain);
        }
    }
}
