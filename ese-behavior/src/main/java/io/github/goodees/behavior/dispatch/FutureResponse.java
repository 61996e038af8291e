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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Response to a dispatched command. Clients can only observe it, or cancel it while the command waits in the mailbox.
 *
 * @param <T> type of response
 */
final class FutureResponse<T> extends CompletableFuture<T> {

    enum Stage {
        QUEUED,
        STARTED,
        CANCELLED
    }

    private final AtomicReference<Stage> stage = new AtomicReference<>(Stage.QUEUED);
    private final Runnable dequeue;

    FutureResponse(Runnable dequeue) {
        this.dequeue = dequeue;
    }

    /**
     * Mark the command as started. Races with {@link #cancel(boolean)}, exactly one of them wins.
     * @return false if the command was cancelled meanwhile
     */
    boolean start() {
        return stage.compareAndSet(Stage.QUEUED, Stage.STARTED);
    }

    Stage getStage() {
        return stage.get();
    }

    void settle(T value, Throwable failure) {
        if (failure == null) {
            super.complete(value);
        } else {
            super.completeExceptionally(failure);
        }
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!stage.compareAndSet(Stage.QUEUED, Stage.CANCELLED)) {
            return false;
        }
        dequeue.run();
        return super.cancel(mayInterruptIfRunning);
    }

    @Override
    public boolean complete(T value) {
        throw readOnly();
    }

    @Override
    public boolean completeExceptionally(Throwable ex) {
        throw readOnly();
    }

    @Override
    public void obtrudeValue(T value) {
        throw readOnly();
    }

    @Override
    public void obtrudeException(Throwable ex) {
        throw readOnly();
    }

    private static UnsupportedOperationException readOnly() {
        return new UnsupportedOperationException("Response of a command can only be completed by its dispatcher");
    }
}
