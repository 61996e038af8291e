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

import io.github.goodees.behavior.Command;
import io.github.goodees.behavior.action.CommandResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Asynchronous command dispatcher. Guarantees to handle at most one command at time per aggregate. Internally, the
 * dispatcher maintains a queue of invocations for every aggregate id. Whenever a new command should be invoked, the
 * dispatcher checks if it is not invoking a command already.
 *
 * <p>Commands for single id are executed in order of their arrival. Commands for different ids are independent, and
 * execute in parallel as far as the executor service allows. An invocation that suspends, e. g. waiting for
 * asynchronous validation, does not occupy a thread and does not block other ids.</p>
 *
 * <p>Dispatcher never retries a command, and imposes no timeouts. A client may cancel the returned future as long as
 * the command did not start.</p>
 *
 * @param <T> type of the result
 */
public class Dispatcher<T> {

    private final DispatcherConfiguration<T> conf;
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final Logger logger;

    public Dispatcher(DispatcherConfiguration<T> conf) {
        this.conf = Objects.requireNonNull(conf, "Configuration must be specified");
        this.logger = LoggerFactory.getLogger(getClass().getName() + "." + conf.dispatcherName());
    }

    /**
     * Schedule a command.
     * The command is added to aggregate's mailbox, and that mailbox is scheduled for dequeue. The response is returned
     * immediately, as it is just a holder for future result that completes when the command invocation completes.
     *
     * @param id      aggregate id
     * @param command command to pass
     * @return the promise for the response
     */
    public CompletableFuture<T> execute(String id, Command command) {
        Objects.requireNonNull(id, "Aggregate id must be specified");
        Objects.requireNonNull(command, "Command must be specified");
        AtomicReference<Mailbox.Invocation> enqueued = new AtomicReference<>();
        // enqueue and retirement of idle mailbox are atomic per id
        Mailbox mailbox = mailboxes.compute(id, (key, existing) -> {
            Mailbox box = existing == null ? new Mailbox(key) : existing;
            enqueued.set(box.enqueue(command));
            return box;
        });
        Mailbox.Invocation inv = enqueued.get();
        if (inv.startsProcessing) {
            conf.executorService().submit(mailbox);
        }
        return inv.result;
    }

    /**
     * Number of commands waiting for execution for given id, not counting the one executing.
     * @param id aggregate id
     * @return number of queued commands
     */
    public int queuedCommands(String id) {
        Mailbox mailbox = mailboxes.get(id);
        return mailbox == null ? 0 : mailbox.queue.size();
    }

    /**
     * Number of ids with commands queued or executing. Mailboxes of ids without commands are released.
     * @return number of mailboxes
     */
    int activeMailboxes() {
        return mailboxes.size();
    }

    /**
     * Queue of commands for single aggregate. At this level we're handling the concurrency between adding new command,
     * and executing only single command.
     */
    class Mailbox implements Runnable {
        private final String id;
        private final Deque<Invocation> queue = new ConcurrentLinkedDeque<>();
        private final AtomicInteger enqueuesWhileBusy = new AtomicInteger();
        private final AtomicReference<Invocation> currentInvocation = new AtomicReference<>();

        Mailbox(String id) {
            this.id = id;
        }

        /**
         * Add a command to aggregate queue. If it is the first one, the caller needs to submit the mailbox.
         */
        Invocation enqueue(Command command) {
            Invocation inv = new Invocation(command);
            queue.add(inv);
            inv.startsProcessing = canStartProcessing();
            return inv;
        }

        private boolean isIdle() {
            return enqueuesWhileBusy.get() == 0 && currentInvocation.get() == null && queue.isEmpty();
        }

        private void retireIfIdle() {
            mailboxes.computeIfPresent(id, (key, box) -> box == this && isIdle() ? null : box);
        }

        private boolean canStartProcessing() {
            int queueSize = enqueuesWhileBusy.getAndIncrement();
            if (queueSize == 0) {
                logger.debug("Will start processing queue for {}", id);
                return true;
            } else {
                logger.debug("Will not start processing the queue for {}, {} commands enqueued during current execution",
                    id, queueSize);
                return false;
            }
        }

        private boolean canStopProcessing(int observedEnqueues) {
            return enqueuesWhileBusy.compareAndSet(observedEnqueues, 0);
        }

        /**
         * Process single command.
         * Called when Mailbox is submitted for execution and not processing, but also at end
         * of processing. This way even commands that arrive during processing will be processed.
         */
        @Override
        public void run() {
            Invocation inv = nextInvocation();
            if (inv != null) {
                if (currentInvocation.compareAndSet(null, inv)) {
                    inv.run();
                } else {
                    logger.error("Submit has run while invocation is in progress. Current invocation: {}, "
                        + "dequeued invocation: {}", currentInvocation, inv);
                    queue.addFirst(inv);
                }
            }
        }

        private Invocation nextInvocation() {
            while (true) {
                int enqueues = enqueuesWhileBusy.get();
                Invocation inv = queue.poll();
                if (inv == null) {
                    // An invocation might have been queued between previous line, and this decision point.
                    // Therefore we check, if canStartProcessing was called in between, and try polling the
                    // queue again, or we guarantee, that canStartProcessing will return true past the next statement.
                    if (canStopProcessing(enqueues)) {
                        logger.debug("Stopping processing of command queue for {}", id);
                        retireIfIdle();
                        return null;
                    }
                } else {
                    return inv;
                }
            }
        }

        /**
         * Encapsulation of command processing. Represents the command as well as actual response given to client.
         * On this level we are handling the concurrency between invocation of the command, and cancellation of it.
         */
        class Invocation implements Runnable {

            private final Command command;
            private final FutureResponse<T> result = new FutureResponse<>(this::dequeue);
            private final Instant submission = Instant.now();
            private final AtomicBoolean completed = new AtomicBoolean();
            private volatile Instant executionStart;
            private boolean startsProcessing;

            Invocation(Command command) {
                this.command = command;
            }

            @Override
            public void run() {
                if (result.start()) {
                    executionStart = Instant.now();
                    try {
                        conf.execute(id, command, this::handleCompletion);
                    } catch (Throwable t) {
                        logger.error("Execution of {} failed", this, t);
                        handleCompletion(null, t);
                    }
                } else {
                    logger.debug("Skipping cancelled invocation {}", this);
                    finish();
                }
            }

            void finish() {
                if (currentInvocation.compareAndSet(this, null)) {
                    executionStart = null;
                    conf.executorService().submit(Mailbox.this);
                } else {
                    logger.error("Invocation finished, but wasn't current invocation: {}", this);
                }
            }

            void dequeue() {
                queue.remove(this);
            }

            private void handleCompletion(T response, Throwable throwable) {
                if (!completed.compareAndSet(false, true)) {
                    logger.error("Invocation completed more than once: {}", this, throwable);
                    return;
                }
                result.settle(response, throwable == null ? null : CommandResults.unwrapCompletionException(throwable));
                finish();
            }

            @Override
            public String toString() {
                return "Invocation[aggregate=" + id + ", command=" + command + ", stage=" + result.getStage()
                    + ", submissionTime=" + submission + ", executionStart=" + executionStart + "]";
            }
        }
    }

}
