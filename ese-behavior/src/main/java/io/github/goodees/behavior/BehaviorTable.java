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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of {@link BehaviorEntry behavior entries}. Resolution evaluates the guards top-down and selects
 * the actions of the first entry whose guard holds.
 *
 * @param <S> type of snapshot
 */
public final class BehaviorTable<S> {
    private final String name;
    private final List<BehaviorEntry<S>> entries;

    public BehaviorTable(String name, List<BehaviorEntry<S>> entries) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    /**
     * Select the actions for a state.
     * @param state current state
     * @return actions of first matching entry
     * @throws BehaviorDefinitionException when no entry covers the state
     */
    public ActionSet<S> resolve(AggregateState<S> state) {
        return entryFor(state).getActions();
    }

    /**
     * Select the entry for a state.
     * @param state current state
     * @return first matching entry
     * @throws BehaviorDefinitionException when no entry covers the state
     */
    public BehaviorEntry<S> entryFor(AggregateState<S> state) {
        for (BehaviorEntry<S> entry : entries) {
            if (entry.test(state)) {
                return entry;
            }
        }
        throw BehaviorDefinitionException.noMatchingEntry(name, state);
    }

    public List<BehaviorEntry<S>> getEntries() {
        return entries;
    }

    public String getName() {
        return name;
    }
}
