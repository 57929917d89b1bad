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
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.jetbrains.annotations.NotNull;

/**
 * Change of a {@link SharedMap}: the net change of every key touched by a
 * transaction.
 */
public final class MapEvent extends SharedEvent {

    private final Map<String, KeyChange> keys;

    public MapEvent(@NotNull SharedMap target, @NotNull List<Object> path,
                    @NotNull Map<String, KeyChange> keys) {
        super(target, path);
        this.keys = ImmutableMap.copyOf(keys);
    }

    @NotNull
    public Map<String, KeyChange> getKeys() {
        return keys;
    }

    @Override
    public String toString() {
        return "MapEvent{path=" + getPath() + ", keys=" + keys + "}";
    }
}
