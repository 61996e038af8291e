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

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A guard over aggregate state paired with actions applicable when the guard holds.
 *
 * @param <S> type of snapshot
 */
public final class BehaviorEntry<S> {
    private final String description;
    private final Predicate<? super AggregateState<S>> guard;
    private final ActionSet<S> actions;

    public BehaviorEntry(String description, Predicate<? super AggregateState<S>> guard, ActionSet<S> actions) {
        this.description = Objects.requireNonNull(description, "Description must be specified");
        this.guard = Objects.requireNonNull(guard, "Guard must be specified");
        this.actions = Objects.requireNonNull(actions, "Actions must be specified");
    }

    public String getDescription() {
        return description;
    }

    public ActionSet<S> getActions() {
        return actions;
    }

    public boolean test(AggregateState<S> state) {
        return guard.test(state);
    }

    @Override
    public String toString() {
        return "BehaviorEntry[" + description + "]";
    }
}
