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
 * An event has no event handler in the state it is applied to. Thrown during dispatch before the event is persisted,
 * and during replay.
 */
public class EventHandlerNotDefinedException extends BehaviorDefinitionException {
    private final transient Event event;
    private final StateShape shape;

    public EventHandlerNotDefinedException(String behaviorName, AggregateState<?> state, Event event) {
        super("Behavior " + behaviorName + " has no handler for event " + event.getType() + " in state " + state);
        this.event = event;
        this.shape = state.getShape();
    }

    public Event getEvent() {
        return event;
    }

    public StateShape getShape() {
        return shape;
    }
}
