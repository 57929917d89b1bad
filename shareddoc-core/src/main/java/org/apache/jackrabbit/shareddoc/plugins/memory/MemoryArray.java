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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.apache.jackrabbit.shareddoc.api.event.ArrayEvent;
import org.apache.jackrabbit.shareddoc.api.event.Delta;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * In-memory {@link SharedArray}.
 */
public final class MemoryArray extends MemoryType<ArrayEvent> implements SharedArray {

    private final List<Object> items = new ArrayList<>();

    MemoryArray(@NotNull MemorySharedTree tree, @NotNull String rootName) {
        super(tree, rootName);
    }

    MemoryArray() {
    }

    @Override
    public void insert(int index, @Nullable Object item) {
        checkPositionIndex(index, items.size());
        try (Transaction tx = begin()) {
            Object adopted = adopt(item);
            SequenceChanges changes = changes();
            if (changes != null) {
                changes.inserted(index, 1);
            }
            items.add(index, adopted);
        }
    }

    @Override
    public void append(@Nullable Object item) {
        insert(items.size(), item);
    }

    @Override
    public void delete(int index) {
        checkElementIndex(index, items.size());
        try (Transaction tx = begin()) {
            SequenceChanges changes = changes();
            if (changes != null) {
                changes.deleted(index, 1);
            }
            release(items.remove(index));
        }
    }

    @Override
    public void clear() {
        if (items.isEmpty()) {
            return;
        }
        try (Transaction tx = begin()) {
            SequenceChanges changes = changes();
            if (changes != null) {
                changes.deleted(0, items.size());
            }
            for (Object item : items) {
                release(item);
            }
            items.clear();
        }
    }

    @Nullable
    @Override
    public Object get(int index) {
        checkElementIndex(index, items.size());
        return items.get(index);
    }

    @Override
    public int length() {
        return items.size();
    }

    @NotNull
    @Override
    public List<Object> toList() {
        List<Object> list = new ArrayList<>(items.size());
        for (Object item : items) {
            list.add(plain(item));
        }
        return list;
    }

    @NotNull
    @Override
    public Object toPlain() {
        return toList();
    }

    @Override
    public String toString() {
        return "MemoryArray" + toList();
    }

    private SequenceChanges changes() {
        return sequenceChanges(items.size(),
                (from, to) -> Delta.insert(new ArrayList<>(items.subList(from, to))));
    }

    @SuppressWarnings("unchecked")
    @Override
    ArrayEvent newEvent(List<Object> path, Object change) {
        return new ArrayEvent(this, path, (List<Delta>) change);
    }

    @Override
    void collectKeys(Map<MemoryType<?>, Object> keys) {
        for (int i = 0; i < items.size(); i++) {
            Object item = items.get(i);
            if (item instanceof MemoryType) {
                keys.put((MemoryType<?>) item, i);
            }
        }
    }

    @Override
    Iterable<MemoryType<?>> children() {
        List<MemoryType<?>> children = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof MemoryType) {
                children.add((MemoryType<?>) item);
            }
        }
        return children;
    }
}
