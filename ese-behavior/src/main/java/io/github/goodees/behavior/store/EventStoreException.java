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

/**
 * Exception generated when storing of events fails. The dispatcher passes it to the caller unchanged, the events
 * were not applied.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /**
         * Store already holds events past the expected version.
         */
        CONFLICT,
        /**
         * The store could not complete the append.
         */
        STORAGE_FAILURE,
        /**
         * The append request itself is wrong.
         */
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException conflict(String aggregateId, long expectedVersion, long actualVersion) {
        return new EventStoreException(Fault.CONFLICT, "Aggregate " + aggregateId + " appending at version "
                + expectedVersion + " attempted while last known version is " + actualVersion, null);
    }

    public static EventStoreException storeFailed(String aggregateId, Throwable cause) {
        return new EventStoreException(Fault.STORAGE_FAILURE,
            "Store of aggregate " + aggregateId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException negativeVersion(String aggregateId, long expectedVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Aggregate " + aggregateId
                + " cannot append at negative version " + expectedVersion, null);
    }
}
