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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Edit script turning the content of a {@link SharedText} into a desired
 * string, applied one opcode at a time. Positions of later opcodes are
 * shifted by the net length change of the opcodes applied before them.
 */
public final class TextPatch {

    private final String desired;

    private final List<Opcode> opcodes;

    private int next;

    private int offset;

    private TextPatch(String desired, List<Opcode> opcodes) {
        this.desired = desired;
        this.opcodes = opcodes;
    }

    /**
     * Patch clearing the text and inserting {@code desired}.
     */
    @NotNull
    public static TextPatch replace(@NotNull String desired) {
        return new TextPatch(checkNotNull(desired), null);
    }

    /**
     * Patch applying the given opcodes, whose {@code j} ranges refer to
     * {@code desired}.
     */
    @NotNull
    public static TextPatch granular(@NotNull String desired, @NotNull List<Opcode> opcodes) {
        return new TextPatch(checkNotNull(desired), ImmutableList.copyOf(opcodes));
    }

    public boolean isHardReplace() {
        return opcodes == null;
    }

    /**
     * @return the opcodes, or {@code null} for a hard replace
     */
    @Nullable
    public List<Opcode> getOpcodes() {
        return opcodes;
    }

    /**
     * Applies the next edit.
     *
     * @return {@code true} if there are more edits to apply
     */
    public boolean applyNext(@NotNull SharedText text) {
        if (opcodes == null) {
            if (next++ == 0) {
                text.clear();
                if (!desired.isEmpty()) {
                    text.insert(0, desired);
                }
            }
            return false;
        }
        if (next >= opcodes.size()) {
            return false;
        }
        Opcode op = opcodes.get(next++);
        int i1 = op.getI1() + offset;
        int i2 = op.getI2() + offset;
        switch (op.getTag()) {
            case EQUAL:
                break;
            case REPLACE:
                text.delete(i1, i2);
                text.insert(i1, desired.substring(op.getJ1(), op.getJ2()));
                offset += (op.getJ2() - op.getJ1()) - (op.getI2() - op.getI1());
                break;
            case DELETE:
                text.delete(i1, i2);
                offset -= op.getI2() - op.getI1();
                break;
            case INSERT:
                text.insert(i1, desired.substring(op.getJ1(), op.getJ2()));
                offset += op.getJ2() - op.getJ1();
                break;
            default:
                throw new IllegalStateException("Unknown opcode tag " + op.getTag());
        }
        return next < opcodes.size();
    }

    /**
     * Applies all remaining edits.
     */
    public void applyTo(@NotNull SharedText text) {
        boolean more = true;
        while (more) {
            more = applyNext(text);
        }
    }

    @Override
    public String toString() {
        return opcodes == null ? "TextPatch{replace}" : "TextPatch" + opcodes;
    }
}
