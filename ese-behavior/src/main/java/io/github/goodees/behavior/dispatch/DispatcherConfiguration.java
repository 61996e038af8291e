package io.github.goodees.behavior.dispatch;

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

import java.util.concurrent.ExecutorService;
import java.util.function.BiConsumer;

/**
 * Dependencies and strategies for Dispatcher.
 *
 * @param <T> type of the result of command execution
 */
public interface DispatcherConfiguration<T> {
    String dispatcherName();

    /**
     * The thread pool execution of commands should run on. Mailboxes of all identities share this pool, a single
     * identity never occupies more than one thread at time.
     * @return the executor service instance
     */
    ExecutorService executorService();

    /**
     * Execute command for the aggregate, pass the result to the callback.
     * <p>This method will be called on the executor thread when the command is due for execution. The next command
     * for same identity will not start until callback is invoked, even if the execution continues on other thread.</p>
     * @param id id of the aggregate
     * @param command command to process
     * @param callback callback to call upon completion
     */
    void execute(String id, Command command, BiConsumer<T, Throwable> callback);
}
