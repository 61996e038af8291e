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
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class ActionSetTest {

    static class Ping implements Command {
    }

    static class Pong implements Command {
    }

    static class Pinged implements Event {
    }

    static class Ponged implements Event {
    }

    private static final AggregateState<String> created = AggregateState.initialized("a", "created");
    private static final AggregateState<String> uninitialized = AggregateState.uninitialized("a");

    private static CommandHandlerRule<String, Ping> pingRule(String tag) {
        return CommandHandlerRule.updating(Ping.class, null,
            (s, c) -> CommandResults.returning(HandlerResult.failed(new IllegalStateException(tag))));
    }

    private static String tagOf(CommandHandlerRule<String, ?> rule, AggregateState<String> state, Command command)
            throws ExecutionException, InterruptedException {
        return rule.invoke(state, command).get().getCause().getMessage();
    }

    @Test
    public void empty_set_matches_nothing() {
        ActionSet<String> empty = ActionSet.empty();
        assertTrue(empty.isEmpty());
        assertFalse(empty.commandRuleFor(created, new Ping()).isPresent());
        assertFalse(empty.eventRuleFor(created, new Pinged()).isPresent());
    }

    @Test
    public void first_registered_rule_wins() throws ExecutionException, InterruptedException {
        ActionSet<String> set = ActionSet.<String>builder()
            .add(pingRule("first"))
            .add(pingRule("second"))
            .build();

        CommandHandlerRule<String, ?> rule = set.commandRuleFor(created, new Ping()).get();
        assertThat(tagOf(rule, created, new Ping()), is("first"));
    }

    @Test
    public void combined_rules_of_receiver_come_first() throws ExecutionException, InterruptedException {
        ActionSet<String> a = ActionSet.<String>builder().add(pingRule("a")).build();
        ActionSet<String> b = ActionSet.<String>builder().add(pingRule("b")).build();

        assertThat(tagOf(a.combine(b).commandRuleFor(created, new Ping()).get(), created, new Ping()), is("a"));
        assertThat(tagOf(b.combine(a).commandRuleFor(created, new Ping()).get(), created, new Ping()), is("b"));
    }

    @Test
    public void combine_does_not_modify_the_operands() {
        ActionSet<String> a = ActionSet.<String>builder().add(pingRule("a")).build();
        ActionSet<String> b = ActionSet.<String>builder()
            .onEvent(Pinged.class, (s, e) -> s + "!")
            .build();

        ActionSet<String> combined = a.combine(b);

        assertThat(combined.getCommandRules().size(), is(1));
        assertThat(combined.getEventRules().size(), is(1));
        assertThat(a.getEventRules(), is(empty()));
        assertThat(b.getCommandRules(), is(empty()));
    }

    @Test
    public void combine_is_associative() throws ExecutionException, InterruptedException {
        ActionSet<String> a = ActionSet.<String>builder()
            .add(pingRule("a"))
            .onEvent(Pinged.class, (s, e) -> "a")
            .build();
        ActionSet<String> b = ActionSet.<String>builder()
            .add(pingRule("b"))
            .add(CommandHandlerRule.updating(Pong.class, null,
                (s, c) -> CommandResults.returning(HandlerResult.failed(new IllegalStateException("b")))))
            .onEvent(Ponged.class, (s, e) -> "b")
            .build();
        ActionSet<String> c = ActionSet.<String>builder()
            .onEvent(Pinged.class, (s, e) -> "c")
            .onEvent(Ponged.class, (s, e) -> "c")
            .build();

        ActionSet<String> left = a.combine(b).combine(c);
        ActionSet<String> right = a.combine(b.combine(c));

        assertThat(left.getCommandRules(), is(right.getCommandRules()));
        assertThat(left.getEventRules(), is(right.getEventRules()));
        assertThat(ActionSet.combine(a, b, c).getCommandRules(), is(left.getCommandRules()));

        for (Command command : Arrays.asList(new Ping(), new Pong())) {
            assertThat(tagOf(left.commandRuleFor(created, command).get(), created, command),
                is(tagOf(right.commandRuleFor(created, command).get(), created, command)));
        }
        for (Event event : Arrays.asList(new Pinged(), new Ponged())) {
            assertThat(left.eventRuleFor(created, event).get().apply(created, event),
                is(right.eventRuleFor(created, event).get().apply(created, event)));
        }
        assertThat(left.eventRuleFor(created, new Pinged()).get().apply(created, new Pinged()), is("a"));
        assertThat(left.eventRuleFor(created, new Ponged()).get().apply(created, new Ponged()), is("b"));
    }

    @Test
    public void rules_match_only_their_state_shape() {
        ActionSet<String> set = ActionSet.<String>builder()
            .onCreateCommand(Ping.class).emit(c -> new Pinged())
            .onCreateEvent(Pinged.class, e -> "created")
            .onCommand(Pong.class).emit((s, c) -> new Ponged())
            .onEvent(Ponged.class, (s, e) -> s + " ponged")
            .build();

        assertTrue(set.commandRuleFor(uninitialized, new Ping()).isPresent());
        assertFalse(set.commandRuleFor(created, new Ping()).isPresent());
        assertTrue(set.commandRuleFor(created, new Pong()).isPresent());
        assertFalse(set.commandRuleFor(uninitialized, new Pong()).isPresent());

        assertTrue(set.eventRuleFor(uninitialized, new Pinged()).isPresent());
        assertFalse(set.eventRuleFor(created, new Pinged()).isPresent());
        assertTrue(set.eventRuleFor(created, new Ponged()).isPresent());
        assertFalse(set.eventRuleFor(uninitialized, new Ponged()).isPresent());

        assertThat(set.getCommandRules().get(0).getShape(), is(StateShape.UNINITIALIZED));
        assertThat(set.getCommandRules().get(1).getShape(), is(StateShape.INITIALIZED));
        assertThat(set.getEventRules().get(0).getShape(), is(StateShape.UNINITIALIZED));
        assertThat(set.getEventRules().get(1).getShape(), is(StateShape.INITIALIZED));
    }

    @Test
    public void guarded_rule_falls_through_to_next_one() throws ExecutionException, InterruptedException {
        ActionSet<String> set = ActionSet.<String>builder()
            .onCommand(Ping.class)
                .when((s, c) -> s.startsWith("busy"))
                .reject((s, c) -> new IllegalStateException("busy"))
            .onCommand(Ping.class)
                .emit((s, c) -> new Pinged())
            .build();

        AggregateState<String> busy = AggregateState.initialized("a", "busy now");
        HandlerResult rejected = set.commandRuleFor(busy, new Ping()).get().invoke(busy, new Ping()).get();
        HandlerResult accepted = set.commandRuleFor(created, new Ping()).get().invoke(created, new Ping()).get();

        assertFalse(rejected.isOk());
        assertThat(rejected.getCause().getMessage(), is("busy"));
        assertTrue(accepted.isOk());
        assertThat(accepted.getEvents().get(0), instanceOf(Pinged.class));
    }

    @Test
    public void reject_all_rejects_in_both_shapes() throws ExecutionException, InterruptedException {
        IllegalStateException closed = new IllegalStateException("closed");
        ActionSet<String> set = ActionSet.<String>builder().rejectAll(c -> closed).build();

        for (AggregateState<String> state : Arrays.asList(uninitialized, created)) {
            Optional<CommandHandlerRule<String, ?>> rule = set.commandRuleFor(state, new Pong());
            assertTrue(rule.isPresent());
            assertThat(rule.get().invoke(state, new Pong()).get().getCause(), sameInstance(closed));
        }
    }

    @Test
    public void included_set_keeps_position() {
        ActionSet<String> base = ActionSet.<String>builder().add(pingRule("base")).build();
        CommandHandlerRule<String, Ping> before = pingRule("before");
        CommandHandlerRule<String, Ping> after = pingRule("after");

        ActionSet<String> set = ActionSet.<String>builder().add(before).include(base).add(after).build();

        List<CommandHandlerRule<String, ?>> rules = set.getCommandRules();
        assertThat(rules.get(0), sameInstance((Object) before));
        assertThat(rules.get(1), sameInstance((Object) base.getCommandRules().get(0)));
        assertThat(rules.get(2), sameInstance((Object) after));
    }

    @Test
    public void rule_accepts_subclasses_of_its_command() {
        CommandHandlerRule<String, Command> any = CommandHandlerRule.updating(Command.class, null,
            (s, c) -> CommandResults.returning(HandlerResult.ok()));

        assertTrue(any.accepts(StateShape.INITIALIZED, Ping.class));
        assertFalse(any.accepts(StateShape.UNINITIALIZED, Ping.class));
        List<CommandHandlerRule<String, ?>> rules = ActionSet.<String>builder().add(any).build().getCommandRules();
        assertThat(rules.size(), is(1));
        assertThat(rules.get(0), sameInstance((Object) any));
    }
}
