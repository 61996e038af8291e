/**
 * Engine for behavior of event sourced aggregates. Instead of implementing an entity class, the aggregate is described
 * by data: a {@linkplain io.github.goodees.behavior.Behavior behavior} maps the state of an aggregate to the actions
 * that apply in that state.
 *
 * <h2>What is an aggregate?</h2>
 * <p>An aggregate is the consistency boundary, whose state is rebuilt from sequence of events. The state is either
 * {@linkplain io.github.goodees.behavior.AggregateState.Uninitialized uninitialized}, before first event was applied,
 * or {@linkplain io.github.goodees.behavior.AggregateState.Initialized initialized} with an immutable snapshot.
 * <p>An aggregate has an unique id, represented with a String.
 *
 * <h2>Actions</h2>
 * <p>Actions are grouped into {@linkplain io.github.goodees.behavior.action.ActionSet action sets}. An action set holds
 * command handlers, that validate a command and produce events, and event handlers, that create new snapshot from an
 * event. Action sets are reusable, and can be combined. Lookup of rule in an action set is always first match wins.
 * <p>Command handlers may have many shapes: producing single event, list of events, result that may fail, or deliver
 * the events asynchronously. All of them are normalized to a
 * {@linkplain io.github.goodees.behavior.action.HandlerResult uniform result}.
 *
 * <h2>Behavior</h2>
 * <p>Behavior is an ordered table of guarded action sets. For every state the first entry whose guard matches defines
 * the actions. State that no entry covers is a defect of the behavior.
 *
 * <h2>Runtime and processing flow</h2>
 * <p>{@linkplain io.github.goodees.behavior.runtime.AggregateRuntime The runtime} guarantees that single aggregate
 * processes only single command at a time, in order of submission. For this, the
 * {@linkplain io.github.goodees.behavior.dispatch dispatcher} maintains a queue for every aggregate. Clients are never
 * blocked, commands always return a CompletableFuture of the result, even if the handler is synchronous.
 * <p>Events of a command are applied to the state one by one, then appended to the
 * {@linkplain io.github.goodees.behavior.store.EventStore event store}. Only after the store accepts them the new state
 * becomes visible. When an aggregate is first used, its state is recovered by applying all stored events in the same
 * way.
 *
 * @see io.github.goodees.behavior.Behavior
 * @see io.github.goodees.behavior.action.ActionSet
 * @see io.github.goodees.behavior.runtime.AggregateRuntime
 * @see io.github.goodees.behavior.store.EventStore
 */
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
