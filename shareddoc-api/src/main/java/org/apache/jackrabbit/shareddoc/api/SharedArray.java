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

import org.apache.jackrabbit.shareddoc.api.event.ArrayEvent;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Shared, index addressed sequence of items. An item is either a plain
 * value or a nested shared type. There is no move operation: moving an
 * item means deleting it and inserting a new one.
 */
public interface SharedArray extends SharedType<ArrayEvent> {

    /**
     * Inserts an item at {@code index}. A preliminary shared type becomes
     * attached to the tree of this array.
     *
     * @throws IndexOutOfBoundsException if the index is not within
     *         {@code [0, length()]}
     * @throws IllegalStateException if the item is a type that is already
     *         attached somewhere
     */
    void insert(int index, @Nullable Object item);

    /**
     * Appends an item, see {@link #insert(int, Object)}.
     */
    void append(@Nullable Object item);

    /**
     * Deletes the item at {@code index}.
     */
    void delete(int index);

    /**
     * Removes all items.
     */
    void clear();

    /**
     * Returns the live item at {@code index}: a plain value or a shared type.
     */
    @Nullable
    Object get(int index);

    int length();

    /**
     * @return the items of this array, materialized as plain values
     */
    @NotNull
    List<Object> toList();

}
