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

/**
 * Immutable fact about business domain relevant fact that became true. Events are the only means of changing the
 * state of an aggregate.
 *
 * <p>Every aggregate defines its own set of events. The engine does not interpret them, rules are matched on the
 * class of the event, and the order in which events were emitted is preserved all the way into the store.</p>
 *
 * <p>The serialization format is not prescribed, that is the task of actual {@link io.github.goodees.behavior.store.EventStore}
 * implementations.</p>
 */
public interface Event {
    /**
     * The type of event. For every aggregate this must uniquely identify the event. If in future an event is removed,
     * the store must be able to translate it to an equivalent event in new model.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event, or
     *         prefix Immutable
     */
    default String getType() {
        return EventType.defaultTypeName(getClass());
    }
}
