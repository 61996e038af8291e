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
 * No command handler in the behavior accepts the command in current state of the aggregate. The aggregate is not
 * changed.
 */
public class CommandNotHandledException extends Exception {
    private final String aggregateId;
    private final transient Command command;

    public CommandNotHandledException(String aggregateId, Command command, StateShape shape) {
        super("Command " + command.getType() + " is not handled by aggregate " + aggregateId + " in state " + shape);
        this.aggregateId = aggregateId;
        this.command = command;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public Command getCommand() {
        return command;
    }
}
