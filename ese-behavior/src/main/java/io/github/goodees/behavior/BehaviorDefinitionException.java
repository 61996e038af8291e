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
 * The behavior of an aggregate does not cover a state it reached. This is a defect in the definition of the behavior,
 * not a condition to handle at runtime.
 */
public class BehaviorDefinitionException extends RuntimeException {

    public BehaviorDefinitionException(String message) {
        super(message);
    }

    public BehaviorDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static BehaviorDefinitionException noMatchingEntry(String behaviorName, AggregateState<?> state) {
        return new BehaviorDefinitionException("Behavior " + behaviorName + " defines no actions for state " + state);
    }

    public static BehaviorDefinitionException nullSnapshot(String behaviorName, Event event) {
        return new BehaviorDefinitionException("Event handler of behavior " + behaviorName + " returned no snapshot for "
            + event.getType());
    }
}
