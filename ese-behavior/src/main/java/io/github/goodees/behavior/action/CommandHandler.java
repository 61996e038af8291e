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

import io.github.goodees.behavior.Command;

import java.util.concurrent.CompletionStage;

/**
 * The normalized form of a command handler. All handler shapes offered by {@link ActionSet.Builder} are adapted to
 * this interface.
 *
 * @param <S> type of snapshot
 * @param <C> type of command
 */
@FunctionalInterface
public interface CommandHandler<S, C extends Command> {
    /**
     * Validate the command against the snapshot and decide on events. The handler must not change the snapshot.
     * Exception thrown from this method, as well as exceptionally completed stage, reject the command.
     * @param snapshot current snapshot, null for creation handlers
     * @param command the command
     * @return stage of the result
     * @throws Exception to reject the command
     */
    CompletionStage<HandlerResult> handle(S snapshot, C command) throws Exception;
}
