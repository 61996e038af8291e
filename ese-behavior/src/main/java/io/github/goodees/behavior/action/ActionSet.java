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
import io.github.goodees.behavior.Command;
import io.github.goodees.behavior.Event;
import io.github.goodees.behavior.StateShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reusable bundle of command and event handler rules. An action set is immutable; it is created with a
 * {@link Builder} and can be combined with other action sets.
 *
 * <p>Lookup of a rule is first match wins, in order of registration. When action sets are
 * {@linkplain #combine(ActionSet) combined}, rules of the receiver come before rules of the argument, so rules defined
 * in base sets can be overridden by putting more specific set in front of them.</p>
 *
 * <pre>{@code
 * ActionSet<Lottery> participants = ActionSet.<Lottery>builder()
 *     .onCommand(AddParticipant.class)
 *         .when((lottery, cmd) -> lottery.hasParticipant(cmd.getName()))
 *         .reject((lottery, cmd) -> new DuplicateParticipantException(cmd.getName()))
 *     .onCommand(AddParticipant.class)
 *         .emit((lottery, cmd) -> new ParticipantAdded(cmd.getName()))
 *     .onEvent(ParticipantAdded.class, (lottery, e) -> lottery.withParticipant(e.getName()))
 *     .build();
 * }</pre>
 *
 * @param <S> type of snapshot
 */
public final class ActionSet<S> {
    private final List<CommandHandlerRule<S, ?>> commandRules;
    private final List<EventHandlerRule<S, ?>> eventRules;

    private ActionSet(List<CommandHandlerRule<S, ?>> commandRules, List<EventHandlerRule<S, ?>> eventRules) {
        this.commandRules = Collections.unmodifiableList(commandRules);
        this.eventRules = Collections.unmodifiableList(eventRules);
    }

    public static <S> ActionSet<S> empty() {
        return new ActionSet<>(new ArrayList<>(), new ArrayList<>());
    }

    public static <S> Builder<S> builder() {
        return new Builder<>();
    }

    /**
     * Combine action sets in given order.
     * @param first the first set
     * @param others sets whose rules follow
     * @param <S> type of snapshot
     * @return union of all the sets
     */
    @SafeVarargs
    public static <S> ActionSet<S> combine(ActionSet<S> first, ActionSet<S>... others) {
        ActionSet<S> result = first;
        for (ActionSet<S> other : others) {
            result = result.combine(other);
        }
        return result;
    }

    /**
     * Union of this and other set. Rules of this set take precedence.
     * @param other the set to append
     * @return new action set
     */
    public ActionSet<S> combine(ActionSet<S> other) {
        Objects.requireNonNull(other, "Action set to combine must not be null");
        List<CommandHandlerRule<S, ?>> commands = new ArrayList<>(commandRules);
        commands.addAll(other.commandRules);
        List<EventHandlerRule<S, ?>> events = new ArrayList<>(eventRules);
        events.addAll(other.eventRules);
        return new ActionSet<>(commands, events);
    }

    /**
     * Find the rule handling the command.
     * @param state current state of the aggregate
     * @param command the command
     * @return first registered rule that matches
     */
    public Optional<CommandHandlerRule<S, ?>> commandRuleFor(AggregateState<S> state, Command command) {
        for (CommandHandlerRule<S, ?> rule : commandRules) {
            if (rule.matches(state, command)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Find the rule applying the event.
     * @param state state the event is applied to
     * @param event the event
     * @return first registered rule that matches
     */
    public Optional<EventHandlerRule<S, ?>> eventRuleFor(AggregateState<S> state, Event event) {
        for (EventHandlerRule<S, ?> rule : eventRules) {
            if (rule.matches(state, event)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public List<CommandHandlerRule<S, ?>> getCommandRules() {
        return commandRules;
    }

    public List<EventHandlerRule<S, ?>> getEventRules() {
        return eventRules;
    }

    public boolean isEmpty() {
        return commandRules.isEmpty() && eventRules.isEmpty();
    }

    @Override
    public String toString() {
        return "ActionSet{commandRules=" + commandRules + ", eventRules=" + eventRules + '}';
    }

    /**
     * Builder of action sets.
     * @param <S> type of snapshot
     */
    public static class Builder<S> {
        private final List<CommandHandlerRule<S, ?>> commandRules = new ArrayList<>();
        private final List<EventHandlerRule<S, ?>> eventRules = new ArrayList<>();

        Builder() {

        }

        public Builder<S> add(CommandHandlerRule<S, ?> rule) {
            commandRules.add(Objects.requireNonNull(rule, "Rule must not be null"));
            return this;
        }

        public Builder<S> add(EventHandlerRule<S, ?> rule) {
            eventRules.add(Objects.requireNonNull(rule, "Rule must not be null"));
            return this;
        }

        /**
         * Append all rules of other set at current position.
         * @param actions actions to include
         * @return this builder
         */
        public Builder<S> include(ActionSet<S> actions) {
            commandRules.addAll(actions.commandRules);
            eventRules.addAll(actions.eventRules);
            return this;
        }

        /**
         * Start defining a rule for commands of initialized aggregate.
         * @param commandClass class of the command
         * @param <C> type of command
         * @return rule builder, returning to this builder once handler is defined
         */
        public <C extends Command> CommandRuleBuilder<S, C> onCommand(Class<C> commandClass) {
            return new CommandRuleBuilder<>(this, commandClass);
        }

        /**
         * Start defining a rule for commands creating an aggregate.
         * @param commandClass class of the command
         * @param <C> type of command
         * @return rule builder, returning to this builder once handler is defined
         */
        public <C extends Command> CreationRuleBuilder<S, C> onCreateCommand(Class<C> commandClass) {
            return new CreationRuleBuilder<>(this, commandClass);
        }

        /**
         * Apply event to existing snapshot.
         * @param eventClass class of event
         * @param updater function producing new snapshot
         * @param <E> type of event
         * @return this builder
         */
        public <E extends Event> Builder<S> onEvent(Class<E> eventClass,
                BiFunction<? super S, ? super E, ? extends S> updater) {
            return add(EventHandlerRule.updater(eventClass, updater));
        }

        /**
         * Create first snapshot from an event.
         * @param eventClass class of event
         * @param constructor function producing the snapshot
         * @param <E> type of event
         * @return this builder
         */
        public <E extends Event> Builder<S> onCreateEvent(Class<E> eventClass,
                Function<? super E, ? extends S> constructor) {
            return add(EventHandlerRule.constructor(eventClass, constructor));
        }

        /**
         * Create first snapshot from an event and identity of the aggregate.
         * @param eventClass class of event
         * @param constructor function of identity and event producing the snapshot
         * @param <E> type of event
         * @return this builder
         */
        public <E extends Event> Builder<S> onCreateEvent(Class<E> eventClass,
                BiFunction<String, ? super E, ? extends S> constructor) {
            return add(EventHandlerRule.constructor(eventClass, constructor));
        }

        /**
         * Reject any command in any state. Rules defined before take precedence, rules defined after are never
         * reached.
         * @param reason creates the cause of rejection
         * @return this builder
         */
        public Builder<S> rejectAll(Function<? super Command, ? extends Throwable> reason) {
            Objects.requireNonNull(reason, "Reason must be specified");
            CommandHandler<S, Command> handler = (s, c) -> CommandResults.returning(HandlerResult.failed(reason.apply(c)));
            add(CommandHandlerRule.creating(Command.class, null, handler));
            return add(CommandHandlerRule.updating(Command.class, null, handler));
        }

        public ActionSet<S> build() {
            return new ActionSet<>(new ArrayList<>(commandRules), new ArrayList<>(eventRules));
        }
    }

    /**
     * Defines handler for a command of initialized aggregate. Each of the terminal methods registers the rule and
     * returns the parent builder.
     * @param <S> type of snapshot
     * @param <C> type of command
     */
    public static class CommandRuleBuilder<S, C extends Command> {
        private final Builder<S> parent;
        private final Class<C> commandClass;
        private BiPredicate<? super S, ? super C> check;

        CommandRuleBuilder(Builder<S> parent, Class<C> commandClass) {
            this.parent = parent;
            this.commandClass = Objects.requireNonNull(commandClass, "Command class must be defined");
        }

        /**
         * Apply the rule only when the check passes.
         * @param check test over snapshot and command
         * @return this rule builder
         */
        public CommandRuleBuilder<S, C> when(BiPredicate<? super S, ? super C> check) {
            this.check = check;
            return this;
        }

        /**
         * Handler producing single event.
         * @param handler the handler
         * @return parent builder
         */
        public Builder<S> emit(BiFunction<? super S, ? super C, ? extends Event> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> HandlerResult.ok(handler.apply(s, c))));
        }

        /**
         * Handler producing list of events.
         * @param handler the handler
         * @return parent builder
         */
        public Builder<S> emitAll(BiFunction<? super S, ? super C, ? extends List<? extends Event>> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> HandlerResult.ok(handler.apply(s, c))));
        }

        /**
         * Handler that may reject the command.
         * @param handler the handler, returning {@link HandlerResult#ok(List)} or {@link HandlerResult#failed(Throwable)}
         * @return parent builder
         */
        public Builder<S> validate(BiFunction<? super S, ? super C, HandlerResult> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> handler.apply(s, c)));
        }

        /**
         * Handler that always rejects the command.
         * @param reason creates cause of the rejection
         * @return parent builder
         */
        public Builder<S> reject(BiFunction<? super S, ? super C, ? extends Throwable> reason) {
            Objects.requireNonNull(reason, "Reason must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> HandlerResult.failed(reason.apply(s, c))));
        }

        /**
         * Handler producing events asynchronously, e. g. after querying external service. The stage completing
         * exceptionally rejects the command.
         * @param handler the handler
         * @return parent builder
         */
        public Builder<S> emitAsync(BiFunction<? super S, ? super C, ? extends CompletionStage<? extends List<? extends Event>>> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.eventually(() -> handler.apply(s, c)));
        }

        /**
         * Handler in normalized form.
         * @param handler the handler
         * @return parent builder
         */
        public Builder<S> handle(CommandHandler<S, ? super C> handler) {
            return parent.add(CommandHandlerRule.updating(commandClass, check, handler));
        }
    }

    /**
     * Defines handler for a command creating an aggregate. The handlers receive only the command.
     * @param <S> type of snapshot
     * @param <C> type of command
     */
    public static class CreationRuleBuilder<S, C extends Command> {
        private final Builder<S> parent;
        private final Class<C> commandClass;
        private BiPredicate<? super S, ? super C> check;

        CreationRuleBuilder(Builder<S> parent, Class<C> commandClass) {
            this.parent = parent;
            this.commandClass = Objects.requireNonNull(commandClass, "Command class must be defined");
        }

        public CreationRuleBuilder<S, C> when(Predicate<? super C> check) {
            Objects.requireNonNull(check, "Check must be defined");
            this.check = (s, c) -> check.test(c);
            return this;
        }

        public Builder<S> emit(Function<? super C, ? extends Event> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> HandlerResult.ok(handler.apply(c))));
        }

        public Builder<S> emitAll(Function<? super C, ? extends List<? extends Event>> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> HandlerResult.ok(handler.apply(c))));
        }

        public Builder<S> validate(Function<? super C, HandlerResult> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> handler.apply(c)));
        }

        public Builder<S> reject(Function<? super C, ? extends Throwable> reason) {
            Objects.requireNonNull(reason, "Reason must be defined");
            return handle((s, c) -> CommandResults.invoke(() -> HandlerResult.failed(reason.apply(c))));
        }

        public Builder<S> emitAsync(Function<? super C, ? extends CompletionStage<? extends List<? extends Event>>> handler) {
            Objects.requireNonNull(handler, "Handler must be defined");
            return handle((s, c) -> CommandResults.eventually(() -> handler.apply(c)));
        }

        public Builder<S> handle(CommandHandler<S, ? super C> handler) {
            return parent.add(CommandHandlerRule.creating(commandClass, check, handler));
        }
    }
}
