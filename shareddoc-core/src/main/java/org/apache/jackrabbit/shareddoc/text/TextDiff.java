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
package org.apache.jackrabbit.shareddoc.text;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Chunk;
import com.github.difflib.patch.Patch;

import org.apache.jackrabbit.shareddoc.text.Opcode.Tag;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Difference between two strings, computed over their UTF-8 encodings.
 * <p>
 * Similarity is measured like {@code difflib}: {@code 2 * M / T} where
 * {@code M} is the number of matching bytes and {@code T} the total number
 * of bytes of both strings. {@link #realQuickRatio()} and
 * {@link #quickRatio()} are cheap upper bounds of {@link #ratio()}.
 */
public final class TextDiff {

    private final String a;

    private final String b;

    private final GraphemeBoundaries boundsA;

    private final GraphemeBoundaries boundsB;

    private List<AbstractDelta<Byte>> deltas;

    public TextDiff(@NotNull String a, @NotNull String b) {
        this.a = a;
        this.b = b;
        this.boundsA = GraphemeBoundaries.of(a);
        this.boundsB = GraphemeBoundaries.of(b);
    }

    public double realQuickRatio() {
        int la = boundsA.utf8().length;
        int lb = boundsB.utf8().length;
        return ratio(Math.min(la, lb), la + lb);
    }

    public double quickRatio() {
        int[] histogram = new int[256];
        for (byte x : boundsA.utf8()) {
            histogram[x & 0xFF]++;
        }
        int matches = 0;
        for (byte x : boundsB.utf8()) {
            if (histogram[x & 0xFF]-- > 0) {
                matches++;
            }
        }
        return ratio(matches, boundsA.utf8().length + boundsB.utf8().length);
    }

    public double ratio() {
        int changed = 0;
        for (AbstractDelta<Byte> delta : deltas()) {
            changed += delta.getSource().size();
        }
        int la = boundsA.utf8().length;
        return ratio(la - changed, la + boundsB.utf8().length);
    }

    /**
     * Returns the edit script turning the first string into the second one,
     * with every range aligned to grapheme cluster boundaries of its string.
     * A range is widened by the same number of bytes on both sides until
     * both ends fall on boundaries.
     *
     * @return the opcodes covering both strings, or {@code null} if aligning
     *         the raw byte ranges made them overlap or disagree on the
     *         content between them
     */
    @Nullable
    public List<Opcode> getOpcodes() {
        byte[] ba = boundsA.utf8();
        byte[] bb = boundsB.utf8();
        List<int[]> ranges = new ArrayList<>();
        for (AbstractDelta<Byte> delta : deltas()) {
            int a1;
            int a2;
            int b1;
            int b2;
            switch (delta.getType()) {
                case CHANGE:
                case DELETE:
                case INSERT:
                    Chunk<Byte> source = delta.getSource();
                    Chunk<Byte> target = delta.getTarget();
                    a1 = source.getPosition();
                    a2 = a1 + source.size();
                    b1 = target.getPosition();
                    b2 = b1 + target.size();
                    break;
                case EQUAL:
                    continue;
                default:
                    throw new IllegalStateException("Unknown delta type " + delta.getType());
            }
            // widen both sides alike, the bytes around a change are equal
            int shift = Math.max(a1 - boundsA.floor(a1), b1 - boundsB.floor(b1));
            while (shift > 0) {
                a1 -= shift;
                b1 -= shift;
                if (a1 < 0 || b1 < 0) {
                    return null;
                }
                shift = Math.max(a1 - boundsA.floor(a1), b1 - boundsB.floor(b1));
            }
            shift = Math.max(boundsA.ceil(a2) - a2, boundsB.ceil(b2) - b2);
            while (shift > 0) {
                a2 += shift;
                b2 += shift;
                if (a2 > ba.length || b2 > bb.length) {
                    return null;
                }
                shift = Math.max(boundsA.ceil(a2) - a2, boundsB.ceil(b2) - b2);
            }
            if (!ranges.isEmpty()) {
                int[] last = ranges.get(ranges.size() - 1);
                if (a1 < last[1] || b1 < last[3]) {
                    return null;
                }
                if (a1 == last[1] && b1 == last[3]) {
                    last[1] = a2;
                    last[3] = b2;
                    continue;
                }
            }
            ranges.add(new int[] {a1, a2, b1, b2});
        }

        List<Opcode> opcodes = new ArrayList<>();
        int ea = 0;
        int eb = 0;
        for (int[] r : ranges) {
            if (!equalRange(ba, ea, r[0], bb, eb, r[2])) {
                return null;
            }
            if (r[0] > ea) {
                opcodes.add(opcode(Tag.EQUAL, ea, r[0], eb, r[2]));
            }
            opcodes.add(opcode(tag(r), r[0], r[1], r[2], r[3]));
            ea = r[1];
            eb = r[3];
        }
        if (!equalRange(ba, ea, ba.length, bb, eb, bb.length)) {
            return null;
        }
        if (ea < ba.length) {
            opcodes.add(opcode(Tag.EQUAL, ea, ba.length, eb, bb.length));
        }
        return opcodes;
    }

    @NotNull
    public String getOld() {
        return a;
    }

    @NotNull
    public String getNew() {
        return b;
    }

    //------------------------------------------------------------< internal >

    private List<AbstractDelta<Byte>> deltas() {
        if (deltas == null) {
            Patch<Byte> patch = DiffUtils.diff(boxed(boundsA.utf8()), boxed(boundsB.utf8()));
            deltas = patch.getDeltas();
        }
        return deltas;
    }

    private Opcode opcode(Tag tag, int a1, int a2, int b1, int b2) {
        return new Opcode(tag, boundsA.toChars(a1), boundsA.toChars(a2),
                boundsB.toChars(b1), boundsB.toChars(b2));
    }

    private static Tag tag(int[] r) {
        if (r[0] == r[1]) {
            return Tag.INSERT;
        } else if (r[2] == r[3]) {
            return Tag.DELETE;
        }
        return Tag.REPLACE;
    }

    private static boolean equalRange(byte[] a, int a1, int a2, byte[] b, int b1, int b2) {
        return a2 - a1 == b2 - b1 && Arrays.equals(a, a1, a2, b, b1, b2);
    }

    private static double ratio(int matches, int length) {
        return length == 0 ? 1.0 : 2.0 * matches / length;
    }

    private static List<Byte> boxed(byte[] bytes) {
        List<Byte> list = new ArrayList<>(bytes.length);
        for (byte x : bytes) {
            list.add(x);
        }
        return list;
    }
}
