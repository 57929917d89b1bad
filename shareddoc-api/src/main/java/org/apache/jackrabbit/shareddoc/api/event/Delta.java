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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One operation of a sequence delta, in the style of the Quill/Yjs delta
 * format. Walking the operations of a delta from the start of the old
 * content yields the new content: {@code retain} keeps items, {@code delete}
 * drops items and {@code insert} adds items.
 * <p>
 * For text the inserted value is a {@link String}, for arrays it is a
 * {@link List} of the inserted items.
 */
public final class Delta {

    public enum Kind {
        INSERT, DELETE, RETAIN
    }

    private final Kind kind;

    private final int count;

    private final Object insert;

    private Delta(Kind kind, int count, Object insert) {
        this.kind = kind;
        this.count = count;
        this.insert = insert;
    }

    @NotNull
    public static Delta retain(int count) {
        checkArgument(count > 0, "count must be positive: %s", count);
        return new Delta(Kind.RETAIN, count, null);
    }

    @NotNull
    public static Delta delete(int count) {
        checkArgument(count > 0, "count must be positive: %s", count);
        return new Delta(Kind.DELETE, count, null);
    }

    @NotNull
    public static Delta insert(@NotNull String text) {
        checkArgument(!text.isEmpty(), "empty insert");
        return new Delta(Kind.INSERT, text.length(), text);
    }

    @NotNull
    public static Delta insert(@NotNull List<?> items) {
        checkArgument(!items.isEmpty(), "empty insert");
        // items may contain null
        return new Delta(Kind.INSERT, items.size(),
                Collections.unmodifiableList(new ArrayList<Object>(checkNotNull(items))));
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    /**
     * Number of items retained, deleted or inserted.
     */
    public int getCount() {
        return count;
    }

    /**
     * The inserted text or list of items, {@code null} for other kinds.
     */
    @Nullable
    public Object getInsert() {
        return insert;
    }

    //~---------------------------------------------------< equals/hashcode >

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Delta that = (Delta) o;
        return kind == that.kind && count == that.count && Objects.equals(insert, that.insert);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, count, insert);
    }

    @Override
    public String toString() {
        switch (kind) {
            case INSERT:
                return "{insert: " + insert + "}";
            case DELETE:
                return "{delete: " + count + "}";
            default:
                return "{retain: " + count + "}";
        }
    }
}
