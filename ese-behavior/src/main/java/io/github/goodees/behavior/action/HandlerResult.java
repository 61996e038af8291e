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

import io.github.goodees.behavior.Event;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Normalized outcome of a command handler. Either the command was accepted and produced events in given order, or
 * it was rejected with a cause.
 */
public final class HandlerResult {
    private final List<Event> events;
    private final Throwable cause;

    private HandlerResult(List<Event> events, Throwable cause) {
        this.events = events;
        this.cause = cause;
    }

    /**
     * Command was accepted.
     * @param events events to persist and apply, in order of emission. May be empty.
     * @return successful result
     */
    public static HandlerResult ok(List<? extends Event> events) {
        Objects.requireNonNull(events, "Events must be specified");
        List<Event> copy = new ArrayList<>(events.size());
        for (Event event : events) {
            copy.add(Objects.requireNonNull(event, "Command handler produced null event"));
        }
        return new HandlerResult(Collections.unmodifiableList(copy), null);
    }

    public static HandlerResult ok(Event... events) {
        return ok(Arrays.asList(events));
    }

    /**
     * Command was rejected.
     * @param cause reason of rejection
     * @return failed result
     */
    public static HandlerResult failed(Throwable cause) {
        return new HandlerResult(Collections.emptyList(), Objects.requireNonNull(cause, "Cause must be specified"));
    }

    public boolean isOk() {
        return cause == null;
    }

    /**
     * Events produced by the handler.
     * @return events in emission order, empty for failed results
     */
    public List<Event> getEvents() {
        return events;
    }

    /**
     * The reason of rejection.
     * @return the cause, null for successful results
     */
    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok" + events : "Failed(" + cause + ")";
    }
}
