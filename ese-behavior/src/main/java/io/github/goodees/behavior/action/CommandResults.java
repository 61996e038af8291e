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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Helpers for adapting handler return values to {@code CompletableFuture<HandlerResult>}. The futures returned from
 * here never complete exceptionally, any failure becomes {@link HandlerResult#failed(Throwable)}.
 */
public final class CommandResults {
    private CommandResults() {

    }

    /**
     * Wrap a value.
     * @param result value to wrap
     * @return future that is already complete
     */
    public static CompletableFuture<HandlerResult> returning(HandlerResult result) {
        return CompletableFuture.completedFuture(result);
    }

    /**
     * Wrap a result of callable. The callable is invoked immediately.
     * @param action the action to perform
     * @return completed future with the returned result, or failed result if callable throws or returns null
     */
    public static CompletableFuture<HandlerResult> invoke(Callable<HandlerResult> action) {
        try {
            return returning(nonNull(action.call()));
        } catch (Exception e) {
            return returning(HandlerResult.failed(e));
        }
    }

    /**
     * Wrap a stage of events produced by callable. The callable is invoked immediately.
     * @param action action returning the stage
     * @return future completing when the stage completes
     */
    public static CompletableFuture<HandlerResult> eventually(Callable<? extends CompletionStage<? extends List<? extends Event>>> action) {
        CompletionStage<? extends List<? extends Event>> stage;
        try {
            stage = action.call();
        } catch (Exception e) {
            return returning(HandlerResult.failed(e));
        }
        if (stage == null) {
            return returning(HandlerResult.failed(new NullPointerException("Command handler returned null stage")));
        }
        CompletableFuture<HandlerResult> result = new CompletableFuture<>();
        stage.whenComplete((events, t) -> {
            if (t == null) {
                result.complete(events == null
                    ? HandlerResult.failed(new NullPointerException("Command handler completed with null"))
                    : okOrFailed(events));
            } else {
                result.complete(HandlerResult.failed(unwrapCompletionException(t)));
            }
        });
        return result;
    }

    /**
     * Adapt arbitrary stage of result, so that it never completes exceptionally.
     * @param stage the stage returned by a handler
     * @return future of normalized result
     */
    public static CompletableFuture<HandlerResult> normalize(CompletionStage<HandlerResult> stage) {
        if (stage == null) {
            return returning(HandlerResult.failed(new NullPointerException("Command handler returned null stage")));
        }
        CompletableFuture<HandlerResult> result = new CompletableFuture<>();
        stage.whenComplete((r, t) -> {
            if (t == null) {
                result.complete(nonNull(r));
            } else {
                result.complete(HandlerResult.failed(unwrapCompletionException(t)));
            }
        });
        return result;
    }

    public static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    private static HandlerResult okOrFailed(List<? extends Event> events) {
        try {
            return HandlerResult.ok(events);
        } catch (NullPointerException e) {
            return HandlerResult.failed(e);
        }
    }

    private static HandlerResult nonNull(HandlerResult result) {
        return result == null
            ? HandlerResult.failed(new NullPointerException("Command handler returned null result"))
            : result;
    }
}
