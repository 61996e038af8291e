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
import io.github.goodees.behavior.StateShape;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiPredicate;

/**
 * Command handler paired with the condition under which it applies. The rule applies to single
 * {@linkplain StateShape state shape}, to commands of single class, and optionally only when a check over the
 * snapshot and the command passes.
 *
 * @param <S> type of snapshot
 * @param <C> type of command
 */
public final class CommandHandlerRule<S, C extends Command> {
    private final StateShape shape;
    private final Class<C> commandClass;
    private final BiPredicate<? super S, ? super C> check;
    private final CommandHandler<S, ? super C> handler;

    private CommandHandlerRule(StateShape shape, Class<C> commandClass, BiPredicate<? super S, ? super C> check,
            CommandHandler<S, ? super C> handler) {
        this.shape = Objects.requireNonNull(shape, "State shape must be defined");
        this.commandClass = Objects.requireNonNull(commandClass, "Command class must be defined");
        this.check = check;
        this.handler = Objects.requireNonNull(handler, "Handler must be defined");
    }

    /**
     * Rule for creating an aggregate. Applies only when the aggregate is uninitialized, the handler receives
     * {@code null} snapshot.
     * @param commandClass class of commands to handle
     * @param check further test of the command, or null
     * @param handler the handler
     * @param <S> type of snapshot
     * @param <C> type of command
     * @return new rule
     */
    public static <S, C extends Command> CommandHandlerRule<S, C> creating(Class<C> commandClass,
            BiPredicate<? super S, ? super C> check, CommandHandler<S, ? super C> handler) {
        return new CommandHandlerRule<>(StateShape.UNINITIALIZED, commandClass, check, handler);
    }

    /**
     * Rule for an initialized aggregate.
     * @param commandClass class of commands to handle
     * @param check further test of the snapshot and command, or null
     * @param handler the handler
     * @param <S> type of snapshot
     * @param <C> type of command
     * @return new rule
     */
    public static <S, C extends Command> CommandHandlerRule<S, C> updating(Class<C> commandClass,
            BiPredicate<? super S, ? super C> check, CommandHandler<S, ? super C> handler) {
        return new CommandHandlerRule<>(StateShape.INITIALIZED, commandClass, check, handler);
    }

    public StateShape getShape() {
        return shape;
    }

    /**
     * Test whether the rule would handle the kind of command in the state shape, without evaluating the check.
     * @param stateShape shape of the state
     * @param commandType class of the command
     * @return true if shape and command class fit the rule
     */
    public boolean accepts(StateShape stateShape, Class<?> commandType) {
        return shape == stateShape && commandClass.isAssignableFrom(commandType);
    }

    /**
     * Test whether the rule applies to the command in given state.
     * @param state current state
     * @param command the command
     * @return true if the rule should handle the command
     */
    public boolean matches(AggregateState<S> state, Command command) {
        if (command == null || !accepts(state.getShape(), command.getClass())) {
            return false;
        }
        return check == null || check.test(state.getSnapshot().orElse(null), commandClass.cast(command));
    }

    /**
     * Invoke the handler. Synchronous handlers return already completed future.
     * @param state current state
     * @param command command that {@linkplain #matches(AggregateState, Command) matches} the rule
     * @return future of normalized result, never completes exceptionally
     */
    public CompletableFuture<HandlerResult> invoke(AggregateState<S> state, Command command) {
        if (!commandClass.isInstance(command)) {
            throw new IllegalArgumentException("Command " + command + " is not a " + commandClass.getSimpleName());
        }
        C typed = commandClass.cast(command);
        S snapshot = state.getSnapshot().orElse(null);
        try {
            return CommandResults.normalize(handler.handle(snapshot, typed));
        } catch (Exception e) {
            return CommandResults.returning(HandlerResult.failed(e));
        }
    }

    @Override
    public String toString() {
        return "CommandHandlerRule[" + shape + " " + commandClass.getSimpleName() + (check == null ? "" : " when ...")
            + "]";
    }
}
