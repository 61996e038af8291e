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
 * A request to perform an action on an aggregate. Commands are validated by command handlers before any state
 * change happens, and are matched to the handlers by their class.
 */
public interface Command {
    /**
     * The type of the command, used in log messages and error reports.
     * @return class name stripped from suffix Command, or prefix Immutable
     */
    default String getType() {
        return EventType.defaultCommandName(getClass());
    }
}
