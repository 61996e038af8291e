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
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class CommandHandlerRuleTest {

    static class Deposit implements Command {
        final int amount;

        Deposit(int amount) {
            this.amount = amount;
        }
    }

    static class Open implements Command {
    }

    static class Deposited implements Event {
        final int amount;

        Deposited(int amount) {
            this.amount = amount;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Deposited && ((Deposited) o).amount == amount;
        }

        @Override
        public int hashCode() {
            return amount;
        }

        @Override
        public String toString() {
            return "Deposited(" + amount + ")";
        }
    }

    private static final AggregateState<Integer> account = AggregateState.initialized("acc", 10);

    private static HandlerResult invoke(ActionSet<Integer> set, AggregateState<Integer> state, Command command)
            throws InterruptedException, ExecutionException, TimeoutException {
        return set.commandRuleFor(state, command).get().invoke(state, command).get(1, TimeUnit.SECONDS);
    }

    private static HandlerResult invoke(ActionSet<Integer> set, Command command)
            throws InterruptedException, ExecutionException, TimeoutException {
        return invoke(set, account, command);
    }

    @Test
    public void single_event_is_normalized_to_list() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emit((balance, cmd) -> new Deposited(cmd.amount))
            .build();

        HandlerResult result = invoke(set, new Deposit(5));
        assertTrue(result.isOk());
        assertThat(result.getEvents(), contains((Event) new Deposited(5)));
    }

    @Test
    public void synchronous_handler_completes_immediately() {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emit((balance, cmd) -> new Deposited(cmd.amount))
            .build();

        CompletableFuture<HandlerResult> result = set.getCommandRules().get(0).invoke(account, new Deposit(1));
        assertTrue(result.isDone());
    }

    @Test
    public void multiple_events_keep_their_order() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emitAll((balance, cmd) -> Arrays.asList(new Deposited(1), new Deposited(cmd.amount)))
            .build();

        HandlerResult result = invoke(set, new Deposit(7));
        assertThat(result.getEvents(), contains((Event) new Deposited(1), new Deposited(7)));
    }

    @Test
    public void fallible_handler_result_is_passed_as_is() throws Exception {
        IllegalArgumentException tooMuch = new IllegalArgumentException("too much");
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).validate((balance, cmd) -> cmd.amount > 100
                ? HandlerResult.failed(tooMuch)
                : HandlerResult.ok(new Deposited(cmd.amount)))
            .build();

        assertTrue(invoke(set, new Deposit(100)).isOk());
        HandlerResult rejected = invoke(set, new Deposit(101));
        assertFalse(rejected.isOk());
        assertThat(rejected.getCause(), sameInstance((Throwable) tooMuch));
        assertThat(rejected.getEvents(), is(empty()));
    }

    @Test
    public void rejecting_handler_fails() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).reject((balance, cmd) -> new IllegalStateException("frozen " + balance))
            .build();

        HandlerResult result = invoke(set, new Deposit(1));
        assertFalse(result.isOk());
        assertThat(result.getCause().getMessage(), is("frozen 10"));
    }

    @Test
    public void exception_thrown_by_handler_becomes_failure() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emit((balance, cmd) -> {
                throw new ArithmeticException("overflow");
            })
            .build();

        HandlerResult result = invoke(set, new Deposit(1));
        assertFalse(result.isOk());
        assertThat(result.getCause(), instanceOf(ArithmeticException.class));
    }

    @Test
    public void checked_exception_of_normalized_handler_becomes_failure() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).handle((balance, cmd) -> {
                throw new java.io.IOException("ledger unavailable");
            })
            .build();

        HandlerResult result = invoke(set, new Deposit(1));
        assertThat(result.getCause(), instanceOf(java.io.IOException.class));
    }

    @Test
    public void null_event_is_failure() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emit((balance, cmd) -> null)
            .build();

        HandlerResult result = invoke(set, new Deposit(1));
        assertFalse(result.isOk());
        assertThat(result.getCause(), instanceOf(NullPointerException.class));
    }

    @Test
    public void asynchronous_events_complete_later() throws Exception {
        CompletableFuture<List<Deposited>> pending = new CompletableFuture<>();
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emitAsync((balance, cmd) -> pending)
            .build();

        CompletableFuture<HandlerResult> result = set.getCommandRules().get(0).invoke(account, new Deposit(3));
        assertFalse(result.isDone());

        pending.complete(Collections.singletonList(new Deposited(3)));
        assertThat(result.get(1, TimeUnit.SECONDS).getEvents(), contains((Event) new Deposited(3)));
    }

    @Test
    public void failed_asynchronous_stage_becomes_failure() throws Exception {
        IllegalStateException unavailable = new IllegalStateException("bank unavailable");
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emitAsync((balance, cmd) -> CompletableFuture.supplyAsync(() -> {
                throw unavailable;
            }))
            .build();

        HandlerResult result = invoke(set, new Deposit(3));
        assertFalse(result.isOk());
        assertThat(result.getCause(), sameInstance((Throwable) unavailable));
    }

    @Test
    public void synchronous_and_asynchronous_handlers_are_equivalent() throws Exception {
        ActionSet<Integer> sync = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emitAll((balance, cmd) -> Arrays.asList(new Deposited(balance), new Deposited(cmd.amount)))
            .build();
        ActionSet<Integer> async = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emitAsync((balance, cmd) -> CompletableFuture.supplyAsync(
                () -> Arrays.asList(new Deposited(balance), new Deposited(cmd.amount))))
            .build();

        assertThat(invoke(async, new Deposit(4)).getEvents(), is(invoke(sync, new Deposit(4)).getEvents()));
    }

    @Test
    public void creating_rule_receives_no_snapshot() throws Exception {
        Integer[] seen = { -1 };
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .add(CommandHandlerRule.<Integer, Open>creating(Open.class, null, (snapshot, cmd) -> {
                seen[0] = snapshot;
                return CommandResults.returning(HandlerResult.ok(new Deposited(0)));
            }))
            .build();

        AggregateState<Integer> fresh = AggregateState.uninitialized("acc");
        assertTrue(invoke(set, fresh, new Open()).isOk());
        assertThat(seen[0], is(nullValue()));
    }

    @Test
    public void creation_check_sees_the_command() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCreateCommand(Deposit.class).when(cmd -> cmd.amount < 0).reject(cmd -> new IllegalArgumentException("negative"))
            .onCreateCommand(Deposit.class).emit(cmd -> new Deposited(cmd.amount))
            .build();

        AggregateState<Integer> fresh = AggregateState.uninitialized("acc");
        assertFalse(invoke(set, fresh, new Deposit(-1)).isOk());
        assertTrue(invoke(set, fresh, new Deposit(1)).isOk());
    }

    @Test
    public void ok_without_events_is_valid() throws Exception {
        ActionSet<Integer> set = ActionSet.<Integer>builder()
            .onCommand(Deposit.class).emitAll((balance, cmd) -> Collections.<Event>emptyList())
            .build();

        HandlerResult result = invoke(set, new Deposit(0));
        assertTrue(result.isOk());
        assertThat(result.getEvents(), is(empty()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invoking_with_foreign_command_is_rejected() {
        CommandHandlerRule<Integer, Deposit> rule = CommandHandlerRule.updating(Deposit.class, null,
            (balance, cmd) -> CommandResults.returning(HandlerResult.ok()));
        rule.invoke(account, new Open());
    }
}
