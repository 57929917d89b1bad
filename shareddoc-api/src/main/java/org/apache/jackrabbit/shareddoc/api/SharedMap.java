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

import java.util.Map;
import java.util.Set;

import org.apache.jackrabbit.shareddoc.api.event.MapEvent;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Shared, string keyed map. Values are plain values or nested shared types.
 */
public interface SharedMap extends SharedType<MapEvent> {

    /**
     * Returns the live value for {@code key}: a plain value, a shared type,
     * or {@code null} if the key is absent or mapped to {@code null}.
     */
    @Nullable
    Object get(@NotNull String key);

    boolean containsKey(@NotNull String key);

    /**
     * Sets the value for {@code key}. A preliminary shared type becomes
     * attached to the tree of this map; a type previously stored under the
     * key is detached.
     *
     * @throws IllegalStateException if the value is a type that is already
     *         attached somewhere
     */
    void put(@NotNull String key, @Nullable Object value);

    /**
     * Removes {@code key}. Removing an absent key does nothing.
     */
    void remove(@NotNull String key);

    /**
     * Removes all keys.
     */
    void clear();

    @NotNull
    Set<String> keySet();

    int size();

    /**
     * @return the entries of this map, materialized as plain values
     */
    @NotNull
    Map<String, Object> toMap();

}
