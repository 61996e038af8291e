package io.github.goodees.behavior.store;

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

import io.github.goodees.behavior.Event;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Storage for aggregate events.
 *
 * <p>Appending events constitutes a separate non-distributed transaction. The store needs to guarantee consistency of
 * event log across processes by checking the expected version, so that two processes cannot store new events for
 * single aggregate.</p>
 */
public interface EventStore {

    /**
     * Append events atomically, in given order. Either all events are stored, or none.
     * @param aggregateId identity of the aggregate
     * @param expectedVersion the number of events the caller knows of
     * @param events events to store, in order of emission
     * @return new version of the aggregate, i. e. {@code expectedVersion + events.size()}
     * @throws EventStoreException with fault {@code CONFLICT} when the store knows of more events, or with fault
     *     {@code STORAGE_FAILURE} when the storing fails.
     */
    long append(String aggregateId, long expectedVersion, List<? extends Event> events) throws EventStoreException;

    /**
     * Read all events for an aggregate.
     * @param aggregateId the identity of an aggregate
     * @return accessor for the events in order they were appended
     */
    StoredEvents<? extends Event> load(String aggregateId);

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a JDBC
     * ResultSet. This also means that only one of methods foreach and reduce may be called on single instance, and
     * only once.
     */
    interface StoredEvents<E extends Event> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super E> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }
}
