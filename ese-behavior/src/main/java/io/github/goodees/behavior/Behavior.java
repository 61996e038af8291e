package io.github.goodees.behavior;

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

import io.github.goodees.behavior.action.ActionSet;
import io.github.goodees.behavior.action.CommandHandlerRule;
import io.github.goodees.behavior.action.EventHandlerRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Complete definition of an aggregate: the mapping from its state to actions applicable in that state.
 *
 * <p>The behavior is built from ordered entries, first matching entry wins:</p>
 * <pre>{@code
 * Behavior<Lottery> lottery = Behavior.<Lottery>builder("Lottery")
 *     .whenUninitialized(creation)
 *     .when(Lottery::hasWinner, ActionSet.empty())
 *     .when(l -> l.getParticipants().isEmpty(), participants)
 *     .otherwise(ActionSet.combine(running, participants))
 *     .build();
 * }</pre>
 *
 * <p>Events are applied one by one, each of them to the state produced by the previous one, with the event handlers of
 * the entry selected for that state. The same fold is used when history is replayed, therefore replay arrives at the
 * same state as live dispatch did.</p>
 *
 * @param <S> type of snapshot
 */
public final class Behavior<S> {
    private final BehaviorTable<S> table;

    private Behavior(BehaviorTable<S> table) {
        this.table = table;
    }

    public static <S> Builder<S> builder(String name) {
        return new Builder<>(name);
    }

    public String getName() {
        return table.getName();
    }

    public BehaviorTable<S> getTable() {
        return table;
    }

    /**
     * Actions applicable in given state.
     * @param state the state
     * @return the action set
     * @throws BehaviorDefinitionException if state is not covered
     */
    public ActionSet<S> resolve(AggregateState<S> state) {
        return table.resolve(state);
    }

    /**
     * Find command handler for the command.
     * @param state current state
     * @param command the command
     * @return the rule, or empty when command is not handled in this state
     * @throws BehaviorDefinitionException if state is not covered
     */
    public Optional<CommandHandlerRule<S, ?>> commandRuleFor(AggregateState<S> state, Command command) {
        return resolve(state).commandRuleFor(state, command);
    }

    /**
     * Apply single event.
     * @param state state before the event
     * @param event the event
     * @return state after the event
     * @throws EventHandlerNotDefinedException if no handler for the event exists in the state
     * @throws BehaviorDefinitionException if state is not covered, or handler returns null
     */
    public AggregateState<S> applyEvent(AggregateState<S> state, Event event) {
        Objects.requireNonNull(event, "Event must not be null");
        EventHandlerRule<S, ?> rule = resolve(state).eventRuleFor(state, event)
            .orElseThrow(() -> new EventHandlerNotDefinedException(getName(), state, event));
        S snapshot = rule.apply(state, event);
        if (snapshot == null) {
            throw BehaviorDefinitionException.nullSnapshot(getName(), event);
        }
        return state.withSnapshot(snapshot);
    }

    /**
     * Apply events in order.
     * @param state state before the events
     * @param events events in order of emission
     * @return state after last event
     */
    public AggregateState<S> applyEvents(AggregateState<S> state, Iterable<? extends Event> events) {
        AggregateState<S> result = state;
        for (Event event : events) {
            result = applyEvent(result, event);
        }
        return result;
    }

    /**
     * Builder of behavior table.
     * @param <S> type of snapshot
     */
    public static class Builder<S> {
        private final String name;
        private final List<BehaviorEntry<S>> entries = new ArrayList<>();

        Builder(String name) {
            this.name = Objects.requireNonNull(name, "Behavior name must be specified");
        }

        /**
         * Actions of an aggregate that was not created yet, i. e. the factory.
         * @param actions creation actions
         * @return this builder
         */
        public Builder<S> whenUninitialized(ActionSet<S> actions) {
            return entry(new BehaviorEntry<>("uninitialized", s -> !s.isInitialized(), actions));
        }

        /**
         * Actions of an initialized aggregate whose snapshot satisfies the predicate.
         * @param predicate test of the snapshot
         * @param actions actions for such state
         * @return this builder
         */
        public Builder<S> when(Predicate<? super S> predicate, ActionSet<S> actions) {
            Objects.requireNonNull(predicate, "Predicate must be specified");
            return entry(new BehaviorEntry<>("entry " + (entries.size() + 1),
                s -> s.getSnapshot().map(predicate::test).orElse(false), actions));
        }

        /**
         * Actions for states satisfying the predicate.
         * @param predicate test of the state
         * @param actions actions for such state
         * @return this builder
         */
        public Builder<S> whenState(Predicate<? super AggregateState<S>> predicate, ActionSet<S> actions) {
            return entry(new BehaviorEntry<>("entry " + (entries.size() + 1), predicate, actions));
        }

        /**
         * Actions for any initialized state not matched by previous entries.
         * @param actions the actions
         * @return this builder
         */
        public Builder<S> otherwise(ActionSet<S> actions) {
            return entry(new BehaviorEntry<>("otherwise", AggregateState::isInitialized, actions));
        }

        public Builder<S> entry(BehaviorEntry<S> entry) {
            entries.add(Objects.requireNonNull(entry, "Entry must not be null"));
            return this;
        }

        public Behavior<S> build() {
            return new Behavior<>(new BehaviorTable<>(name, entries));
        }
    }
}
