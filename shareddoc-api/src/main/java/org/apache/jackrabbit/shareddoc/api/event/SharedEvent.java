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
package org.apache.jackrabbit.shareddoc.api.event;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.jackrabbit.shareddoc.api.SharedType;
import org.jetbrains.annotations.NotNull;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Change of a single shared type, as reported once per transaction.
 * <p>
 * The path locates the changed type relative to the type that was observed:
 * an {@link Integer} step is an index into an array, a {@link String} step a
 * key into a map. Events delivered to shallow observers have an empty path.
 */
public abstract class SharedEvent {

    private final SharedType<?> target;

    private final List<Object> path;

    protected SharedEvent(@NotNull SharedType<?> target, @NotNull List<Object> path) {
        this.target = checkNotNull(target);
        this.path = ImmutableList.copyOf(path);
    }

    /**
     * The type that changed.
     */
    @NotNull
    public SharedType<?> getTarget() {
        return target;
    }

    @NotNull
    public List<Object> getPath() {
        return path;
    }

}
