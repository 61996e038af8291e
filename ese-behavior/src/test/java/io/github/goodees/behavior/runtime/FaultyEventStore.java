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

import io.github.goodees.behavior.Event;
import io.github.goodees.behavior.store.EventStoreException;
import io.github.goodees.behavior.store.inmemory.InMemoryEventStore;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory store that can be instructed to fail next append.
 */
class FaultyEventStore extends InMemoryEventStore {
    private final AtomicReference<EventStoreException> nextFailure = new AtomicReference<>();
    final AtomicInteger appends = new AtomicInteger();

    void failNextAppend(EventStoreException failure) {
        nextFailure.set(failure);
    }

    @Override
    public long append(String aggregateId, long expectedVersion, List<? extends Event> events) throws EventStoreException {
        appends.incrementAndGet();
        EventStoreException failure = nextFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        return super.append(aggregateId, expectedVersion, events);
    }
}
