package io.github.goodees.behavior.action;

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
import io.github.goodees.behavior.Event;
import io.github.goodees.behavior.StateShape;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Pure function applying one event to the snapshot. Constructor rules create the first snapshot of an
 * uninitialized aggregate, updater rules create new snapshot from the existing one.
 *
 * <p>Event handlers must be deterministic and must not have side effects, they are executed both when commands are
 * dispatched and when history is replayed.</p>
 *
 * @param <S> type of snapshot
 * @param <E> type of event
 */
public final class EventHandlerRule<S, E extends Event> {
    private final StateShape shape;
    private final Class<E> eventClass;
    private final BiFunction<AggregateState<S>, ? super E, ? extends S> handler;

    private EventHandlerRule(StateShape shape, Class<E> eventClass,
            BiFunction<AggregateState<S>, ? super E, ? extends S> handler) {
        this.shape = shape;
        this.eventClass = Objects.requireNonNull(eventClass, "Event class must be defined");
        this.handler = Objects.requireNonNull(handler, "Handler must be defined");
    }

    public static <S, E extends Event> EventHandlerRule<S, E> constructor(Class<E> eventClass,
            Function<? super E, ? extends S> constructor) {
        Objects.requireNonNull(constructor, "Handler must be defined");
        return new EventHandlerRule<S, E>(StateShape.UNINITIALIZED, eventClass, (s, e) -> constructor.apply(e));
    }

    /**
     * Constructor rule that also receives the identity of the aggregate.
     * @param eventClass class of event
     * @param constructor function of identity and event producing the snapshot
     * @param <S> type of snapshot
     * @param <E> type of event
     * @return new rule
     */
    public static <S, E extends Event> EventHandlerRule<S, E> constructor(Class<E> eventClass,
            BiFunction<String, ? super E, ? extends S> constructor) {
        Objects.requireNonNull(constructor, "Handler must be defined");
        return new EventHandlerRule<S, E>(StateShape.UNINITIALIZED, eventClass,
            (s, e) -> constructor.apply(s.getIdentity(), e));
    }

    public static <S, E extends Event> EventHandlerRule<S, E> updater(Class<E> eventClass,
            BiFunction<? super S, ? super E, ? extends S> updater) {
        Objects.requireNonNull(updater, "Handler must be defined");
        return new EventHandlerRule<S, E>(StateShape.INITIALIZED, eventClass,
            (s, e) -> updater.apply(s.getSnapshot().orElse(null), e));
    }

    public StateShape getShape() {
        return shape;
    }

    public boolean accepts(StateShape stateShape, Class<?> eventType) {
        return shape == stateShape && eventClass.isAssignableFrom(eventType);
    }

    public boolean matches(AggregateState<S> state, Event event) {
        return event != null && accepts(state.getShape(), event.getClass());
    }

    /**
     * Compute the snapshot after the event.
     * @param state current state, of the shape the rule accepts
     * @param event event that {@linkplain #matches(AggregateState, Event) matches} the rule
     * @return new snapshot, null signals broken handler
     */
    public S apply(AggregateState<S> state, Event event) {
        if (state.getShape() != shape) {
            throw new IllegalArgumentException("Rule for " + shape + " applied to " + state);
        }
        return handler.apply(state, eventClass.cast(event));
    }

    @Override
    public String toString() {
        return "EventHandlerRule[" + shape + " " + eventClass.getSimpleName() + "]";
    }
}
