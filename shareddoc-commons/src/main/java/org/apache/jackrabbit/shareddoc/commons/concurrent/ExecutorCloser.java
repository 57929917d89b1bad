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
package org.apache.jackrabbit.shareddoc.commons.concurrent;

import java.io.Closeable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shuts an {@link ExecutorService} down, waiting for queued work up to a
 * timeout before interrupting whatever is still running.
 */
public final class ExecutorCloser implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorCloser.class);

    private final ExecutorService executorService;

    private final long timeout;

    private final TimeUnit timeUnit;

    /**
     * Waits up to five seconds.
     */
    public ExecutorCloser(@Nullable ExecutorService executorService) {
        this(executorService, 5, TimeUnit.SECONDS);
    }

    public ExecutorCloser(@Nullable ExecutorService executorService, long timeout, @NotNull TimeUnit unit) {
        this.executorService = executorService;
        this.timeout = timeout;
        this.timeUnit = unit;
    }

    @Override
    public void close() {
        if (executorService == null) {
            return;
        }
        boolean terminated = false;
        try {
            executorService.shutdown();
            terminated = executorService.awaitTermination(timeout, timeUnit);
        } catch (InterruptedException e) {
            LOG.error("Interrupted while shutting down {}", executorService, e);
            Thread.currentThread().interrupt();
        } finally {
            if (!terminated) {
                LOG.warn("ExecutorService {} did not terminate within {} {}, forcing shutdown",
                        executorService, timeout, timeUnit);
                executorService.shutdownNow();
            }
        }
    }
}
