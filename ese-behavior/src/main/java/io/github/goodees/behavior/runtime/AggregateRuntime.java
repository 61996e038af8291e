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

import io.github.goodees.behavior.AggregateState;
import io.github.goodees.behavior.Behavior;
import io.github.goodees.behavior.BehaviorDefinitionException;
import io.github.goodees.behavior.Command;
import io.github.goodees.behavior.CommandNotHandledException;
import io.github.goodees.behavior.ValidationFailedException;
import io.github.goodees.behavior.action.CommandResults;
import io.github.goodees.behavior.dispatch.Dispatcher;
import io.github.goodees.behavior.dispatch.DispatcherConfiguration;
import io.github.goodees.behavior.store.EventStore;
import io.github.goodees.behavior.store.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.BiConsumer;

/**
 * Runtime executing commands against aggregates of single behavior.
 *
 * <p>Every aggregate is processed by its own instance, kept in working memory. An instance is created on first
 * command for its identity, by replaying the history from the event store. Commands for single identity are processed
 * one at a time in order of submission, commands for different identities run in parallel on the executor.</p>
 *
 * <p>Result future completes exceptionally with</p>
 * <ul>
 *     <li>{@link CommandNotHandledException} when no rule handles the command in current state</li>
 *     <li>{@link ValidationFailedException} when the handler rejected the command</li>
 *     <li>{@link EventStoreException} when the store did not accept the events. On a conflict the instance is evicted,
 *     so next command will see the events appended by others</li>
 *     <li>{@link BehaviorDefinitionException} when the behavior is defective. Such error is logged, and the instance
 *     is evicted</li>
 *     <li>{@link CancellationException} when the validation was {@linkplain #abort(String) aborted}</li>
 * </ul>
 * In all of these cases the state of the aggregate does not change.
 *
 * @param <S> type of snapshot
 */
public class AggregateRuntime<S> {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final String name;
    private final Behavior<S> behavior;
    private final EventStore eventStore;
    private final ExecutorService executorService;
    private final ConcurrentMap<String, AggregateInstance<S>> workingMemory = new ConcurrentHashMap<>();
    private final List<EventListener<S>> listeners = new CopyOnWriteArrayList<>();
    private final Dispatcher<DispatchResult<S>> dispatcher;

    public AggregateRuntime(String name, Behavior<S> behavior, EventStore eventStore, ExecutorService executorService) {
        this.name = Objects.requireNonNull(name, "Runtime name must be specified");
        this.behavior = Objects.requireNonNull(behavior, "Behavior must be specified");
        this.eventStore = Objects.requireNonNull(eventStore, "Event store must be specified");
        this.executorService = Objects.requireNonNull(executorService, "Executor service must be specified");
        this.dispatcher = new Dispatcher<>(new Configuration());
    }

    public AggregateRuntime(Behavior<S> behavior, EventStore eventStore, ExecutorService executorService) {
        this(behavior.getName(), behavior, eventStore, executorService);
    }

    public String getName() {
        return name;
    }

    public Behavior<S> getBehavior() {
        return behavior;
    }

    /**
     * Execute a command.
     * The returned future can be cancelled as long as the command did not start executing. Clients must not complete
     * it.
     *
     * @param aggregateId identity of the aggregate
     * @param command the command
     * @return future of dispatch result
     */
    public CompletableFuture<DispatchResult<S>> execute(String aggregateId, Command command) {
        return dispatcher.execute(aggregateId, command);
    }

    /**
     * Read the state of the aggregate after all commands submitted so far.
     * @param aggregateId identity of the aggregate
     * @return future of the state
     */
    public CompletableFuture<AggregateState<S>> currentState(String aggregateId) {
        return dispatcher.execute(aggregateId, Control.READ_STATE).thenApply(DispatchResult::getState);
    }

    /**
     * Remove the instance from working memory after all commands submitted so far. Next command will recover the
     * aggregate from the event store.
     * @param aggregateId identity of the aggregate
     * @return future completing when the instance is removed
     */
    public CompletableFuture<Void> passivate(String aggregateId) {
        return dispatcher.execute(aggregateId, Control.PASSIVATE).thenAccept(r -> { });
    }

    /**
     * Abort the command of the aggregate that awaits asynchronous validation. The command fails with
     * {@link CancellationException}, state of the aggregate does not change, and the next queued command starts.
     * Supervisors use this for validations that would not complete.
     * <p>Unlike other operations of the runtime, abort is not queued behind the pending commands.</p>
     * @param aggregateId identity of the aggregate
     * @return true if a validation was aborted
     */
    public boolean abort(String aggregateId) {
        AggregateInstance<S> instance = workingMemory.get(aggregateId);
        if (instance == null || !instance.abortValidation()) {
            logger.debug("Aggregate {} has no validation to abort", aggregateId);
            return false;
        }
        return true;
    }

    public void addListener(EventListener<S> listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener must not be null"));
    }

    public void removeListener(EventListener<S> listener) {
        listeners.remove(listener);
    }

    /**
     * Test if aggregate is kept in working memory.
     * @param aggregateId identity of the aggregate
     * @return true if instance is active
     */
    public boolean isActive(String aggregateId) {
        return workingMemory.containsKey(aggregateId);
    }

    private AggregateInstance<S> lookup(String aggregateId) {
        return workingMemory.computeIfAbsent(aggregateId, id -> AggregateInstance.recover(id, behavior, eventStore));
    }

    private void invoke(String aggregateId, Command command, BiConsumer<DispatchResult<S>, Throwable> callback) {
        if (command == Control.PASSIVATE) {
            if (workingMemory.remove(aggregateId) != null) {
                logger.debug("Passivated aggregate {}", aggregateId);
            }
            callback.accept(null, null);
            return;
        }
        AggregateInstance<S> instance;
        try {
            instance = lookup(aggregateId);
        } catch (Throwable e) {
            logger.error("Aggregate {} of {} could not be recovered", aggregateId, name, e);
            callback.accept(null, e);
            return;
        }
        if (command == Control.READ_STATE) {
            callback.accept(instance.currentResult(), null);
            return;
        }
        instance.handle(command).whenComplete((result, t) -> {
            if (t == null) {
                notifyListeners(aggregateId, result);
                callback.accept(result, null);
            } else {
                Throwable cause = CommandResults.unwrapCompletionException(t);
                handleFailure(aggregateId, instance, command, cause);
                callback.accept(null, cause);
            }
        });
    }

    private void handleFailure(String aggregateId, AggregateInstance<S> instance, Command command, Throwable cause) {
        if (cause instanceof CommandNotHandledException || cause instanceof ValidationFailedException) {
            logger.debug("Aggregate {} did not accept {}: {}", aggregateId, command, cause.getMessage());
        } else if (cause instanceof CancellationException) {
            logger.warn("Aggregate {} aborted validation of {}", aggregateId, command);
        } else if (cause instanceof EventStoreException) {
            EventStoreException ese = (EventStoreException) cause;
            logger.warn("Events of aggregate {} were not stored: {}", aggregateId, ese.getMessage());
            if (ese.getFault() == EventStoreException.Fault.CONFLICT) {
                evict(aggregateId, instance);
            }
        } else {
            logger.error("Aggregate {} of {} failed processing {}, evicting it", aggregateId, name, command, cause);
            evict(aggregateId, instance);
        }
    }

    private void evict(String aggregateId, AggregateInstance<S> instance) {
        if (workingMemory.remove(aggregateId, instance)) {
            logger.info("Evicted aggregate {} at version {}", aggregateId, instance.getVersion());
        }
    }

    private void notifyListeners(String aggregateId, DispatchResult<S> result) {
        if (result.getEvents().isEmpty()) {
            return;
        }
        for (EventListener<S> listener : listeners) {
            try {
                listener.eventsAppended(aggregateId, result);
            } catch (RuntimeException e) {
                logger.error("Listener {} failed on events of aggregate {}", listener, aggregateId, e);
            }
        }
    }

    /**
     * Requests of the runtime itself, passed through the dispatcher so that they are ordered with the commands.
     */
    private enum Control implements Command {
        READ_STATE,
        PASSIVATE
    }

    private class Configuration implements DispatcherConfiguration<DispatchResult<S>> {

        @Override
        public String dispatcherName() {
            return name;
        }

        @Override
        public ExecutorService executorService() {
            return executorService;
        }

        @Override
        public void execute(String id, Command command, BiConsumer<DispatchResult<S>, Throwable> callback) {
            invoke(id, command, callback);
        }
    }
}
