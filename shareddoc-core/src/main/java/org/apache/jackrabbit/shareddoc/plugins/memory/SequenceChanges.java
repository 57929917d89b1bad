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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

import org.apache.jackrabbit.shareddoc.api.event.Delta;
import org.jetbrains.annotations.Nullable;

/**
 * Tracks inserts and deletes on a sequence (text or array) as a list of
 * segments of the new content: runs of original items, identified by their
 * original offset, and runs of inserted items. Inserted content is read
 * back from the live sequence when the delta is built.
 */
final class SequenceChanges implements ChangeRecorder {

    private static final class Segment {

        final boolean original;

        int start;

        int length;

        Segment(boolean original, int start, int length) {
            this.original = original;
            this.start = start;
            this.length = length;
        }
    }

    private final List<Segment> segments = new ArrayList<>();

    private final int originalLength;

    private final BiFunction<Integer, Integer, Delta> insertion;

    /**
     * @param originalLength length of the sequence before the first change
     * @param insertion creates the insert operation for the given range of
     *        the current content
     */
    SequenceChanges(int originalLength, BiFunction<Integer, Integer, Delta> insertion) {
        this.originalLength = originalLength;
        this.insertion = insertion;
        if (originalLength > 0) {
            segments.add(new Segment(true, 0, originalLength));
        }
    }

    void inserted(int index, int count) {
        int pos = 0;
        for (int i = 0; i < segments.size(); i++) {
            Segment s = segments.get(i);
            if (index <= pos + s.length) {
                int offset = index - pos;
                if (!s.original) {
                    s.length += count;
                } else if (offset == 0) {
                    segments.add(i, new Segment(false, 0, count));
                } else if (offset == s.length) {
                    if (i + 1 < segments.size() && !segments.get(i + 1).original) {
                        segments.get(i + 1).length += count;
                    } else {
                        segments.add(i + 1, new Segment(false, 0, count));
                    }
                } else {
                    Segment tail = new Segment(true, s.start + offset, s.length - offset);
                    s.length = offset;
                    segments.add(i + 1, new Segment(false, 0, count));
                    segments.add(i + 2, tail);
                }
                return;
            }
            pos += s.length;
        }
        segments.add(new Segment(false, 0, count));
    }

    void deleted(int index, int count) {
        int pos = 0;
        int i = 0;
        while (count > 0 && i < segments.size()) {
            Segment s = segments.get(i);
            if (index >= pos + s.length) {
                pos += s.length;
                i++;
                continue;
            }
            int offset = index - pos;
            int n = Math.min(count, s.length - offset);
            if (!s.original || offset + n == s.length) {
                s.length -= n;
            } else if (offset == 0) {
                s.start += n;
                s.length -= n;
            } else {
                segments.add(i + 1, new Segment(true, s.start + offset + n, s.length - offset - n));
                s.length = offset;
            }
            count -= n;
            if (s.length == 0) {
                segments.remove(i);
            } else {
                pos += s.length;
                i++;
            }
        }
    }

    @Nullable
    @Override
    public Object summarize() {
        List<Delta> delta = new ArrayList<>();
        int originalCursor = 0;
        int newCursor = 0;
        int pendingInsert = 0;
        for (Segment s : segments) {
            if (s.original) {
                if (s.start > originalCursor) {
                    add(delta, Delta.delete(s.start - originalCursor));
                }
                if (pendingInsert > 0) {
                    delta.add(insertion.apply(newCursor - pendingInsert, newCursor));
                    pendingInsert = 0;
                }
                add(delta, Delta.retain(s.length));
                originalCursor = s.start + s.length;
            } else {
                pendingInsert += s.length;
            }
            newCursor += s.length;
        }
        if (originalLength > originalCursor) {
            add(delta, Delta.delete(originalLength - originalCursor));
        }
        if (pendingInsert > 0) {
            delta.add(insertion.apply(newCursor - pendingInsert, newCursor));
        }
        if (!delta.isEmpty() && delta.get(delta.size() - 1).getKind() == Delta.Kind.RETAIN) {
            delta.remove(delta.size() - 1);
        }
        return delta.isEmpty() ? null : delta;
    }

    private static void add(List<Delta> delta, Delta op) {
        if (!delta.isEmpty()) {
            Delta last = delta.get(delta.size() - 1);
            if (last.getKind() == op.getKind()) {
                int count = last.getCount() + op.getCount();
                delta.set(delta.size() - 1,
                        op.getKind() == Delta.Kind.RETAIN ? Delta.retain(count) : Delta.delete(count));
                return;
            }
        }
        delta.add(op);
    }
}
