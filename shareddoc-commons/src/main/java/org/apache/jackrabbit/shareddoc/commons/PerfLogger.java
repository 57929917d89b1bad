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
package org.apache.jackrabbit.shareddoc.commons;

import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Thin wrapper around a slf4j {@link Logger} that reports how long a piece
 * of work took.
 * <p>
 * Usage:
 * <pre>
 * long start = perfLogger.start();
 * ... some code ...
 * perfLogger.end(start, 10, "reconcile: path={}", path);
 * </pre>
 * Nothing is measured unless the delegate has DEBUG enabled. At DEBUG the
 * end statement is logged only if the work took longer than the given
 * threshold; at TRACE it is always logged, and so is the optional start
 * message.
 */
public final class PerfLogger {

    private final Logger delegate;

    public PerfLogger(@NotNull Logger delegate) {
        this.delegate = checkNotNull(delegate, "delegate must not be null");
    }

    /**
     * @return the start time in nanoseconds, or -1 if DEBUG is disabled
     */
    public long start() {
        return start(null);
    }

    /**
     * Like {@link #start()}, additionally logging {@code traceMsgOrNull}
     * at TRACE level.
     */
    public long start(@Nullable String traceMsgOrNull) {
        if (!delegate.isDebugEnabled()) {
            return -1;
        }
        if (traceMsgOrNull != null && delegate.isTraceEnabled()) {
            delegate.trace(traceMsgOrNull);
        }
        return System.nanoTime();
    }

    /**
     * Logs {@code logMessagePrefix} with the elapsed time appended as
     * {@code [took x ms]}.
     *
     * @param start value returned by {@link #start()}; negative values are
     *        ignored
     * @param logAtDebugIfSlowerThanMs threshold for DEBUG statements, a
     *        negative value logs unconditionally
     * @param logMessagePrefix slf4j message pattern
     * @param arguments arguments of the pattern
     */
    public void end(long start, long logAtDebugIfSlowerThanMs,
                    @NotNull String logMessagePrefix, Object... arguments) {
        if (start < 0) {
            return;
        }
        long diff = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        String message = logMessagePrefix + " [took " + diff + "ms]";
        if (delegate.isTraceEnabled()) {
            delegate.trace(message, arguments);
        } else if (logAtDebugIfSlowerThanMs < 0 || diff > logAtDebugIfSlowerThanMs) {
            delegate.debug(message, arguments);
        }
    }

    public boolean isDebugEnabled() {
        return delegate.isDebugEnabled();
    }

}
