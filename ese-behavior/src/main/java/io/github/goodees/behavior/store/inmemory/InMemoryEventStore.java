package io.github.goodees.behavior.store.inmemory;

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
import io.github.goodees.behavior.store.EventStore;
import io.github.goodees.behavior.store.EventStoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event store keeping the events in memory. Useful for tests, and for aggregates that need not survive the process.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, List<Event>> storage = new ConcurrentHashMap<>();

    @Override
    public long append(String aggregateId, long expectedVersion, List<? extends Event> events) throws EventStoreException {
        Objects.requireNonNull(aggregateId, "Aggregate id must be specified");
        Objects.requireNonNull(events, "Events must be specified");
        if (expectedVersion < 0) {
            throw EventStoreException.negativeVersion(aggregateId, expectedVersion);
        }
        List<Event> log = aggregateLog(aggregateId);
        synchronized (log) {
            if (log.size() != expectedVersion) {
                throw EventStoreException.conflict(aggregateId, expectedVersion, log.size());
            }
            log.addAll(events);
            return log.size();
        }
    }

    /**
     * Number of events stored for an aggregate.
     * @param aggregateId identity of the aggregate
     * @return the version of the aggregate in this store
     */
    public long versionOf(String aggregateId) {
        List<Event> log = aggregateLog(aggregateId);
        synchronized (log) {
            return log.size();
        }
    }

    private List<Event> aggregateLog(String aggregateId) {
        return storage.computeIfAbsent(aggregateId, (i) -> Collections.synchronizedList(new ArrayList<>()));
    }

    @Override
    public StoredEvents<Event> load(String aggregateId) {
        return new StoredEvents<Event>() {
            final List<Event> events;
            boolean stop = false;

            {
                List<Event> log = aggregateLog(aggregateId);
                // copy under the list lock, appends may run concurrently
                synchronized (log) {
                    events = new ArrayList<>(log);
                }
            }

            @Override
            public void foreach(Consumer<? super Event> consumer) {
                for (Event event : events) {
                    if (stop) {
                        break;
                    }
                    consumer.accept(event);
                }
            }

            @Override
            public <R> R reduce(R initial, BiFunction<R, ? super Event, R> reducer) {
                R result = initial;
                for (Event event : events) {
                    if (stop) {
                        break;
                    }
                    result = reducer.apply(result, event);
                }
                return result;
            }

            @Override
            public void stop() {
                stop = true;
            }

            @Override
            public void close() {
            }
        };
    }
}
