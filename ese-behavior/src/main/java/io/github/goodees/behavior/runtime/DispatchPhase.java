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
 * Phase of command processing of single aggregate instance.
 */
public enum DispatchPhase {
    /**
     * No command is being processed.
     */
    IDLE,
    /**
     * Command handler was invoked, and its result is awaited. Asynchronous handlers may keep the instance in this phase
     * for extended time.
     */
    AWAITING_VALIDATION,
    /**
     * Events are folded into new state and appended to the event store.
     */
    APPLYING_EVENTS
}
