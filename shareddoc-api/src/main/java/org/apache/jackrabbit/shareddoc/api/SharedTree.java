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
package org.apache.jackrabbit.shareddoc.api;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.NotNull;

/**
 * A replicated, transactional and observable tree of shared types.
 * <p>
 * A tree exposes a set of named root types. Nested types are created
 * <em>preliminary</em> through the {@code new*} factory methods and become
 * part of the tree once they are inserted into a type that already is.
 * <p>
 * All mutations that happen between acquiring a {@link Transaction} and
 * closing it are reported to observers as one consolidated change set
 * when the outermost transaction is closed. Mutations done outside of an
 * explicit transaction run in an implicit one of their own.
 * <p>
 * Implementations are not required to be thread-safe: a tree is meant to be
 * written by a single writer at a time.
 */
public interface SharedTree {

    /**
     * Returns the root text with the given name, creating it if needed.
     *
     * @param name name of the root
     * @return the root text
     * @throws IllegalArgumentException if the name is bound to another kind
     */
    @NotNull
    SharedText getText(@NotNull String name);

    /**
     * Returns the root map with the given name, creating it if needed.
     *
     * @param name name of the root
     * @return the root map
     * @throws IllegalArgumentException if the name is bound to another kind
     */
    @NotNull
    SharedMap getMap(@NotNull String name);

    /**
     * Returns the root array with the given name, creating it if needed.
     *
     * @param name name of the root
     * @return the root array
     * @throws IllegalArgumentException if the name is bound to another kind
     */
    @NotNull
    SharedArray getArray(@NotNull String name);

    /**
     * Starts a transaction, or joins the currently open one. The returned
     * handle must be closed on all exit paths, typically with a
     * try-with-resources statement.
     *
     * @return the transaction handle
     */
    @NotNull
    Transaction transaction();

    /**
     * Creates a preliminary text not yet attached to this tree.
     */
    @NotNull
    SharedText newText(@NotNull String content);

    /**
     * Creates a preliminary map not yet attached to this tree. Values may
     * be plain values or other preliminary types.
     */
    @NotNull
    SharedMap newMap(@NotNull Map<String, ?> entries);

    /**
     * Creates a preliminary array not yet attached to this tree. Items may
     * be plain values or other preliminary types.
     */
    @NotNull
    SharedArray newArray(@NotNull List<?> items);

}
