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
package org.apache.jackrabbit.shareddoc.plugins.memory;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.apache.jackrabbit.shareddoc.api.event.KeyChange;
import org.apache.jackrabbit.shareddoc.api.event.MapEvent;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory {@link SharedMap} keeping its keys in insertion order.
 */
public final class MemoryMap extends MemoryType<MapEvent> implements SharedMap {

    private final Map<String, Object> entries = new LinkedHashMap<>();

    MemoryMap(@NotNull MemorySharedTree tree, @NotNull String rootName) {
        super(tree, rootName);
    }

    MemoryMap() {
    }

    @Nullable
    @Override
    public Object get(@NotNull String key) {
        return entries.get(key);
    }

    @Override
    public boolean containsKey(@NotNull String key) {
        return entries.containsKey(key);
    }

    @Override
    public void put(@NotNull String key, @Nullable Object value) {
        checkNotNull(key);
        try (Transaction tx = begin()) {
            Object adopted = adopt(value);
            touch(key);
            release(entries.put(key, adopted));
        }
    }

    @Override
    public void remove(@NotNull String key) {
        if (!entries.containsKey(key)) {
            return;
        }
        try (Transaction tx = begin()) {
            touch(key);
            release(entries.remove(key));
        }
    }

    @Override
    public void clear() {
        if (entries.isEmpty()) {
            return;
        }
        try (Transaction tx = begin()) {
            for (String key : entries.keySet()) {
                touch(key);
            }
            for (Object value : entries.values()) {
                release(value);
            }
            entries.clear();
        }
    }

    @NotNull
    @Override
    public Set<String> keySet() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @NotNull
    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            map.put(e.getKey(), plain(e.getValue()));
        }
        return map;
    }

    @NotNull
    @Override
    public Object toPlain() {
        return toMap();
    }

    @Override
    public String toString() {
        return "MemoryMap" + toMap();
    }

    private void touch(String key) {
        MapChanges changes = mapChanges();
        if (changes != null) {
            changes.touched(key, entries.containsKey(key) ? entries.get(key) : MapChanges.ABSENT);
        }
    }

    @SuppressWarnings("unchecked")
    @Override
    MapEvent newEvent(List<Object> path, Object change) {
        return new MapEvent(this, path, (Map<String, KeyChange>) change);
    }

    @Override
    void collectKeys(Map<MemoryType<?>, Object> keys) {
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            if (e.getValue() instanceof MemoryType) {
                keys.put((MemoryType<?>) e.getValue(), e.getKey());
            }
        }
    }

    @Override
    Iterable<MemoryType<?>> children() {
        List<MemoryType<?>> children = new ArrayList<>();
        for (Object value : entries.values()) {
            if (value instanceof MemoryType) {
                children.add((MemoryType<?>) value);
            }
        }
        return children;
    }
}
