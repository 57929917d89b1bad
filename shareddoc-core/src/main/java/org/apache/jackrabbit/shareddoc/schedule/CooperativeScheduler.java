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

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.jackrabbit.shareddoc.commons.concurrent.ExecutorCloser;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link ReconcileSequence}s on a host executor one step at a time.
 * After each step the next one is submitted to the executor again, so
 * other tasks of the same executor run in between and no task waits for
 * longer than a single step.
 * <p>
 * Cancelling the returned future stops the sequence before its next step.
 */
public class CooperativeScheduler implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(CooperativeScheduler.class);

    private final Executor executor;

    @Nullable
    private final ExecutorService owned;

    private final AtomicLong longestStepNanos = new AtomicLong();

    /**
     * Creates a scheduler with a single thread of its own, shut down by
     * {@link #close()}.
     */
    public CooperativeScheduler() {
        ThreadFactory tf = new ThreadFactoryBuilder()
                .setNameFormat("shareddoc-reconcile-%d")
                .setDaemon(true)
                .build();
        this.owned = Executors.newSingleThreadExecutor(tf);
        this.executor = owned;
    }

    /**
     * Creates a scheduler running on {@code executor}. Executors passed in
     * are not shut down by {@link #close()}.
     */
    public CooperativeScheduler(@NotNull Executor executor) {
        this.executor = checkNotNull(executor);
        this.owned = null;
    }

    /**
     * Schedules the steps of {@code sequence}.
     *
     * @return a future completed with the result of the sequence, or
     *         exceptionally with the failure of a step
     */
    @NotNull
    public <T> CompletableFuture<T> submit(@NotNull ReconcileSequence<T> sequence) {
        checkNotNull(sequence);
        CompletableFuture<T> future = new CompletableFuture<>();
        schedule(sequence, future);
        return future;
    }

    /**
     * @return the duration of the longest step executed so far, in
     *         nanoseconds
     */
    public long getLongestStepNanos() {
        return longestStepNanos.get();
    }

    @Override
    public void close() {
        new ExecutorCloser(owned).close();
    }

    private <T> void schedule(ReconcileSequence<T> sequence, CompletableFuture<T> future) {
        try {
            executor.execute(() -> step(sequence, future));
        } catch (RejectedExecutionException e) {
            sequence.cancel();
            future.completeExceptionally(e);
        }
    }

    private <T> void step(ReconcileSequence<T> sequence, CompletableFuture<T> future) {
        if (future.isDone()) {
            LOG.debug("Reconciliation cancelled after {} steps", sequence.getStepCount());
            sequence.cancel();
            return;
        }
        boolean more;
        long start = System.nanoTime();
        try {
            more = sequence.step();
        } catch (RuntimeException | Error e) {
            future.completeExceptionally(e);
            return;
        }
        longestStepNanos.accumulateAndGet(System.nanoTime() - start, Math::max);
        if (more) {
            schedule(sequence, future);
        } else {
            future.complete(sequence.getResult());
        }
    }
}
