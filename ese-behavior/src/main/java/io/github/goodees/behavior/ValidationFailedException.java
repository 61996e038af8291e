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
 * The command handler rejected the command. The reason for the rejection is the cause of this exception. The
 * aggregate is not changed.
 */
public class ValidationFailedException extends Exception {
    private final String aggregateId;
    private final transient Command command;

    public ValidationFailedException(String aggregateId, Command command, Throwable cause) {
        super("Command " + command.getType() + " rejected by aggregate " + aggregateId + ": " + cause.getMessage(),
            cause);
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
