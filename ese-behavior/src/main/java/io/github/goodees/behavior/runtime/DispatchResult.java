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
import io.github.goodees.behavior.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of successfully dispatched command.
 *
 * @param <S> type of snapshot
 */
public final class DispatchResult<S> {
    private final List<Event> events;
    private final AggregateState<S> state;
    private final long version;

    public DispatchResult(List<? extends Event> events, AggregateState<S> state, long version) {
        this.events = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(events, "Events must be specified")));
        this.state = Objects.requireNonNull(state, "State must be specified");
        this.version = version;
    }

    /**
     * Events appended to the store, in order of emission. Empty when the command did not change the aggregate.
     * @return the events
     */
    public List<Event> getEvents() {
        return events;
    }

    /**
     * State after all of the events were applied.
     * @return the state
     */
    public AggregateState<S> getState() {
        return state;
    }

    /**
     * Version of the aggregate, i. e. number of events in its history.
     * @return the version
     */
    public long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "DispatchResult{events=" + events + ", state=" + state + ", version=" + version + '}';
    }
}
