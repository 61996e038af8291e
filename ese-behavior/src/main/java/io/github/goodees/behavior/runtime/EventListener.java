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

/**
 * Receives events of every successfully dispatched command, after they were durably appended. For single aggregate,
 * notifications arrive in order of dispatch.
 *
 * <p>Listener is invoked on the thread completing the dispatch, and before the client's future completes. Exceptions
 * thrown by listener are logged and do not influence the outcome of the dispatch.</p>
 *
 * @param <S> type of snapshot
 */
@FunctionalInterface
public interface EventListener<S> {
    void eventsAppended(String aggregateId, DispatchResult<S> result);
}
