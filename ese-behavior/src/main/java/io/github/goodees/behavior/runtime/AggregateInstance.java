package io.github.goodees.behavior.runtime;

/*-
 * #%L
 * ese-behavior
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.behavior.AggregateState;
import io.github.goodees.behavior.Behavior;
import io.github.goodees.behavior.Command;
import io.github.goodees.behavior.CommandNotHandledException;
import io.github.goodees.behavior.Event;
import io.github.goodees.behavior.ValidationFailedException;
import io.github.goodees.behavior.action.CommandHandlerRule;
import io.github.goodees.behavior.action.HandlerResult;
import io.github.goodees.behavior.store.EventStore;
import io.github.goodees.behavior.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory instance of single aggregate. Holds its current state and version, and processes commands against the
 * behavior:
 * <ol>
 * <li>The command rule is resolved for current state. If there's none, the command fails with
 * {@link CommandNotHandledException}</li>
 * <li>The handler is invoked, and its result awaited. Failed result fails the command with
 * {@link ValidationFailedException}</li>
 * <li>Events are folded into candidate state, and appended to the event store at current version</li>
 * <li>Only after the store accepted the events, the candidate becomes current state</li>
 * </ol>
 * Whenever the processing fails, state and version stay unchanged.
 *
 * <p>Instance is not thread safe in the sense that it accepts single command at a time. Callers need to serialize the
 * calls, and await completion of the returned future before passing next command, as the dispatcher does.</p>
 *
 * @param <S> type of snapshot
 */
public final class AggregateInstance<S> {
    private static final Logger logger = LoggerFactory.getLogger(AggregateInstance.class);

    private final String identity;
    private final Behavior<S> behavior;
    private final EventStore store;
    private volatile AggregateState<S> state;
    private volatile long version;
    private volatile DispatchPhase phase = DispatchPhase.IDLE;
    private volatile CompletableFuture<HandlerResult> pendingValidation;

    AggregateInstance(String identity, Behavior<S> behavior, EventStore store, AggregateState<S> state, long version) {
        this.identity = Objects.requireNonNull(identity, "Identity must be specified");
        this.behavior = Objects.requireNonNull(behavior, "Behavior must be specified");
        this.store = Objects.requireNonNull(store, "Event store must be specified");
        this.state = Objects.requireNonNull(state, "State must be specified");
        this.version = version;
    }

    /**
     * Create an instance by replaying all stored events of the aggregate.
     * @param identity identity of the aggregate
     * @param behavior behavior applying the events
     * @param store the store to read from
     * @param <S> type of snapshot
     * @return instance reflecting all stored events
     * @throws io.github.goodees.behavior.BehaviorDefinitionException when history cannot be applied
     */
    public static <S> AggregateInstance<S> recover(String identity, Behavior<S> behavior, EventStore store) {
        long recoveryStart = System.currentTimeMillis();
        AtomicLong recoveredEvents = new AtomicLong();
        AggregateState<S> recovered;
        try (EventStore.StoredEvents<? extends Event> events = store.load(identity)) {
            recovered = events.reduce(AggregateState.<S>uninitialized(identity), (s, event) -> {
                try {
                    AggregateState<S> next = behavior.applyEvent(s, event);
                    recoveredEvents.incrementAndGet();
                    return next;
                } catch (RuntimeException e) {
                    logger.error("Aggregate {} failed to replay event #{} {}", identity, recoveredEvents.get() + 1,
                        event, e);
                    throw e;
                }
            });
        }
        logger.info("Aggregate {} recovered in {} ms replaying {} events", identity,
            System.currentTimeMillis() - recoveryStart, recoveredEvents.get());
        return new AggregateInstance<>(identity, behavior, store, recovered, recoveredEvents.get());
    }

    public String getIdentity() {
        return identity;
    }

    public AggregateState<S> getState() {
        return state;
    }

    public long getVersion() {
        return version;
    }

    public DispatchPhase getPhase() {
        return phase;
    }

    /**
     * Current state as result of a dispatch that produced no events.
     * @return current state and version
     */
    public DispatchResult<S> currentResult() {
        return new DispatchResult<>(Collections.emptyList(), state, version);
    }

    /**
     * Process a command.
     * @param command the command
     * @return future of the outcome. Completes exceptionally with {@link CommandNotHandledException},
     *     {@link ValidationFailedException}, {@link EventStoreException} or
     *     {@link io.github.goodees.behavior.BehaviorDefinitionException}
     * @throws IllegalStateException when previous command did not complete yet
     */
    public CompletableFuture<DispatchResult<S>> handle(Command command) {
        Objects.requireNonNull(command, "Command must be specified");
        if (phase != DispatchPhase.IDLE) {
            throw new IllegalStateException("Aggregate " + identity + " received " + command
                + " while processing another command in phase " + phase);
        }
        phase = DispatchPhase.AWAITING_VALIDATION;
        AggregateState<S> before = state;
        CompletableFuture<HandlerResult> validation;
        try {
            CommandHandlerRule<S, ?> rule = behavior.commandRuleFor(before, command)
                .orElseThrow(() -> new CommandNotHandledException(identity, command, before.getShape()));
            logger.debug("Aggregate {} handles {} with {}", identity, command, rule);
            validation = rule.invoke(before, command);
        } catch (Throwable t) {
            // errors included, the instance must not stay busy
            phase = DispatchPhase.IDLE;
            return failed(t);
        }
        pendingValidation = validation;
        return validation
            .thenCompose(result -> {
                pendingValidation = null;
                return apply(before, command, result);
            })
            .whenComplete((r, t) -> {
                pendingValidation = null;
                phase = DispatchPhase.IDLE;
            });
    }

    /**
     * Abort the command awaiting its validation. The validation completes with {@link CancellationException}, the
     * state stays unchanged and the instance accepts next command. Result of the handler, if it arrives later, is
     * ignored.
     * @return true if a pending validation was aborted, false if there is none, or the events are already being
     *     applied
     */
    public boolean abortValidation() {
        CompletableFuture<HandlerResult> pending = pendingValidation;
        if (pending == null || phase != DispatchPhase.AWAITING_VALIDATION) {
            return false;
        }
        return pending.cancel(false);
    }

    private CompletableFuture<DispatchResult<S>> apply(AggregateState<S> before, Command command, HandlerResult result) {
        if (!result.isOk()) {
            logger.debug("Aggregate {} rejected {}", identity, command, result.getCause());
            return failed(new ValidationFailedException(identity, command, result.getCause()));
        }
        List<Event> events = result.getEvents();
        if (events.isEmpty()) {
            return CompletableFuture.completedFuture(new DispatchResult<>(events, before, version));
        }
        phase = DispatchPhase.APPLYING_EVENTS;
        try {
            AggregateState<S> candidate = behavior.applyEvents(before, events);
            long newVersion = store.append(identity, version, events);
            state = candidate;
            version = newVersion;
            return CompletableFuture.completedFuture(new DispatchResult<>(events, candidate, newVersion));
        } catch (EventStoreException | RuntimeException e) {
            return failed(e);
        }
    }

    private static <T> CompletableFuture<T> failed(Throwable t) {
        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeExceptionally(t);
        return result;
    }

    @Override
    public String toString() {
        return "AggregateInstance{" + identity + ", version=" + version + ", phase=" + phase + ", state=" + state + '}';
    }
}
