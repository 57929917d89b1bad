/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.jackrabbit.shareddoc.schedule;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A reconciliation expressed as an ordered list of small steps, so that it
 * can either run to completion ({@link #run()}) or be driven one step at a
 * time ({@link #step()}) by a {@link CooperativeScheduler}. Both ways
 * execute exactly the same steps in the same order.
 * <p>
 * A sequence is built once, then executed once:
 * <pre>
 * ReconcileSequence&lt;Boolean&gt; seq = new ReconcileSequence&lt;Boolean&gt;()
 *         .then(() -&gt; plan())
 *         .openTransaction(tree)
 *         .repeat(() -&gt; applyNext())
 *         .commit()
 *         .complete(() -&gt; changed);
 * </pre>
 * The transaction opened by {@link #openTransaction(SharedTree)} is closed
 * on every exit path: by {@link #commit()}, when a step fails and when the
 * sequence is cancelled. Closing commits what was applied so far.
 *
 * @param <T> type of the result
 */
public final class ReconcileSequence<T> {

    private static final Logger LOG = LoggerFactory.getLogger(ReconcileSequence.class);

    private final Deque<BooleanSupplier> steps = new ArrayDeque<>();

    private Supplier<T> result = () -> null;

    private Transaction transaction;

    private boolean started;

    private boolean done;

    private boolean cancelled;

    private T value;

    private int stepCount;

    private long totalNanos;

    private long maxStepNanos;

    /**
     * Creates a sequence that completes with {@code value} without doing
     * anything.
     */
    @NotNull
    public static <T> ReconcileSequence<T> completed(@Nullable T value) {
        return new ReconcileSequence<T>().complete(() -> value);
    }

    /**
     * Adds a step that runs once.
     */
    @NotNull
    public ReconcileSequence<T> then(@NotNull Runnable step) {
        checkNotNull(step);
        return add(() -> {
            step.run();
            return false;
        });
    }

    /**
     * Adds a step that is executed again as long as it returns {@code true}.
     * Each execution is a step of its own.
     */
    @NotNull
    public ReconcileSequence<T> repeat(@NotNull BooleanSupplier step) {
        return add(checkNotNull(step));
    }

    /**
     * Adds the steps of another sequence, whose result is ignored.
     */
    @NotNull
    public ReconcileSequence<T> include(@NotNull ReconcileSequence<?> other) {
        checkState(!other.started, "Sequence already started");
        return repeat(other::step);
    }

    /**
     * Adds a step opening a transaction on {@code tree}. A {@code null} tree
     * means there is nothing to open.
     */
    @NotNull
    public ReconcileSequence<T> openTransaction(@Nullable SharedTree tree) {
        return then(() -> {
            checkState(transaction == null, "Transaction already open");
            if (tree != null) {
                transaction = tree.transaction();
            }
        });
    }

    /**
     * Adds a step closing the transaction opened before.
     */
    @NotNull
    public ReconcileSequence<T> commit() {
        return then(this::closeTransaction);
    }

    /**
     * Sets how the result is computed once all steps are done.
     */
    @NotNull
    public ReconcileSequence<T> complete(@NotNull Supplier<T> result) {
        checkState(!started, "Sequence already started");
        this.result = checkNotNull(result);
        return this;
    }

    /**
     * Executes the next step.
     *
     * @return {@code true} if there are more steps to execute
     * @throws CancellationException if the sequence was cancelled
     */
    public boolean step() {
        if (cancelled) {
            throw new CancellationException("Reconciliation cancelled");
        }
        if (done) {
            return false;
        }
        started = true;
        BooleanSupplier next = steps.peekFirst();
        if (next != null) {
            long start = System.nanoTime();
            boolean again;
            try {
                again = next.getAsBoolean();
            } catch (RuntimeException | Error e) {
                done = true;
                closeTransaction();
                throw e;
            }
            long nanos = System.nanoTime() - start;
            stepCount++;
            totalNanos += nanos;
            maxStepNanos = Math.max(maxStepNanos, nanos);
            if (!again) {
                steps.pollFirst();
            }
        }
        if (steps.isEmpty()) {
            closeTransaction();
            value = result.get();
            done = true;
            LOG.trace("Sequence completed after {} steps", stepCount);
        }
        return !done;
    }

    /**
     * Executes all remaining steps.
     *
     * @return the result
     */
    @Nullable
    public T run() {
        boolean more = true;
        while (more) {
            more = step();
        }
        return value;
    }

    /**
     * Stops the sequence. An open transaction is closed, leaving the shared
     * tree in the state produced by the steps executed so far.
     */
    public void cancel() {
        if (!done) {
            cancelled = true;
            done = true;
            closeTransaction();
        }
    }

    public boolean isDone() {
        return done;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @return the result, {@code null} until the sequence is done
     */
    @Nullable
    public T getResult() {
        return value;
    }

    public int getStepCount() {
        return stepCount;
    }

    public long getTotalNanos() {
        return totalNanos;
    }

    public long getMaxStepNanos() {
        return maxStepNanos;
    }

    private ReconcileSequence<T> add(BooleanSupplier step) {
        checkState(!started, "Sequence already started");
        steps.addLast(step);
        return this;
    }

    private void closeTransaction() {
        Transaction tx = transaction;
        transaction = null;
        if (tx != null) {
            tx.close();
        }
    }
}
