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

import org.apache.jackrabbit.shareddoc.api.event.TextEvent;
import org.jetbrains.annotations.NotNull;

/**
 * Shared, position addressed text. Positions and lengths are expressed in
 * UTF-16 code units, like {@link String} indexes.
 */
public interface SharedText extends SharedType<TextEvent> {

    /**
     * Inserts {@code content} at {@code index}.
     *
     * @throws IndexOutOfBoundsException if the index is not within
     *         {@code [0, length()]}
     */
    void insert(int index, @NotNull String content);

    /**
     * Deletes the code units in {@code [start, end)}.
     *
     * @throws IndexOutOfBoundsException if the range is invalid
     */
    void delete(int start, int end);

    /**
     * Appends {@code content} at the end of this text.
     */
    void append(@NotNull String content);

    /**
     * Removes the whole content.
     */
    void clear();

    int length();

    /**
     * @return the current content
     */
    @Override
    @NotNull
    String toString();

}
