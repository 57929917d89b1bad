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
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.apache.jackrabbit.shareddoc.api.event.Delta;
import org.apache.jackrabbit.shareddoc.api.event.TextEvent;
import org.jetbrains.annotations.NotNull;

/**
 * In-memory {@link SharedText} backed by a {@link StringBuilder}.
 */
public final class MemoryText extends MemoryType<TextEvent> implements SharedText {

    private final StringBuilder content;

    MemoryText(@NotNull MemorySharedTree tree, @NotNull String rootName) {
        super(tree, rootName);
        this.content = new StringBuilder();
    }

    MemoryText(@NotNull String content) {
        this.content = new StringBuilder(content);
    }

    @Override
    public void insert(int index, @NotNull String text) {
        checkNotNull(text);
        checkPositionIndex(index, content.length());
        if (text.isEmpty()) {
            return;
        }
        try (Transaction tx = begin()) {
            SequenceChanges changes = changes();
            if (changes != null) {
                changes.inserted(index, text.length());
            }
            content.insert(index, text);
        }
    }

    @Override
    public void delete(int start, int end) {
        checkPositionIndexes(start, end, content.length());
        if (start == end) {
            return;
        }
        try (Transaction tx = begin()) {
            SequenceChanges changes = changes();
            if (changes != null) {
                changes.deleted(start, end - start);
            }
            content.delete(start, end);
        }
    }

    @Override
    public void append(@NotNull String text) {
        insert(content.length(), text);
    }

    @Override
    public void clear() {
        delete(0, content.length());
    }

    @Override
    public int length() {
        return content.length();
    }

    @NotNull
    @Override
    public Object toPlain() {
        return content.toString();
    }

    @NotNull
    @Override
    public String toString() {
        return content.toString();
    }

    private SequenceChanges changes() {
        return sequenceChanges(content.length(),
                (from, to) -> Delta.insert(content.substring(from, to)));
    }

    @SuppressWarnings("unchecked")
    @Override
    TextEvent newEvent(List<Object> path, Object change) {
        return new TextEvent(this, path, (List<Delta>) change);
    }

    @Override
    void collectKeys(Map<MemoryType<?>, Object> keys) {
    }

    @Override
    Iterable<MemoryType<?>> children() {
        return Collections.emptyList();
    }
}
