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
package org.apache.jackrabbit.shareddoc.cells;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.jetbrains.annotations.NotNull;

/**
 * The writes bringing a live cell to its desired content without replacing
 * it. Obtained from {@link CellPatcher#plan}.
 */
public final class CellPatch {

    static final CellPatch EMPTY = new CellPatch(ImmutableList.of());

    private final List<Runnable> edits;

    CellPatch(@NotNull List<Runnable> edits) {
        this.edits = ImmutableList.copyOf(edits);
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    /**
     * Performs the writes, in the transaction of the caller.
     *
     * @return {@code true} if anything was written
     */
    public boolean apply() {
        for (Runnable edit : edits) {
            edit.run();
        }
        return !edits.isEmpty();
    }
}
