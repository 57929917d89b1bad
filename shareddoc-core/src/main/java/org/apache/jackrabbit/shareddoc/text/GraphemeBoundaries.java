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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

import org.jetbrains.annotations.NotNull;

/**
 * Extended grapheme cluster boundaries of a string, addressable by UTF-8
 * byte offset and convertible to UTF-16 offsets.
 * <p>
 * The segmentation follows the rules of Unicode Standard Annex #29 that
 * matter for editing: CR LF pairs, combining and enclosing marks, spacing
 * marks, variation selectors, emoji modifiers and tags, zero width joiner
 * sequences, regional indicator pairs and Hangul syllable sequences are
 * kept together. Prepend characters are not handled.
 */
final class GraphemeBoundaries {

    private static final int CR = 0x0D;

    private static final int LF = 0x0A;

    private static final int ZWJ = 0x200D;

    private final byte[] utf8;

    /** UTF-8 offsets of the boundaries, ascending, including 0 and the length */
    private final int[] byteOffsets;

    /** UTF-16 offsets matching {@link #byteOffsets} */
    private final int[] charOffsets;

    private GraphemeBoundaries(byte[] utf8, int[] byteOffsets, int[] charOffsets) {
        this.utf8 = utf8;
        this.byteOffsets = byteOffsets;
        this.charOffsets = charOffsets;
    }

    @NotNull
    static GraphemeBoundaries of(@NotNull String text) {
        int[] bytes = new int[text.length() + 1];
        int[] chars = new int[text.length() + 1];
        byte[] utf8 = new byte[text.length() * 3];
        int count = 0;
        int byteOffset = 0;
        int previous = -1;
        int regionalIndicators = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (previous < 0 || isBreak(previous, cp, regionalIndicators)) {
                bytes[count] = byteOffset;
                chars[count] = i;
                count++;
            }
            regionalIndicators = isRegionalIndicator(cp) ? regionalIndicators + 1 : 0;
            previous = cp;
            byteOffset = encode(cp, utf8, byteOffset);
            i += Character.charCount(cp);
        }
        bytes[count] = byteOffset;
        chars[count] = text.length();
        count++;
        return new GraphemeBoundaries(Arrays.copyOf(utf8, byteOffset),
                Arrays.copyOf(bytes, count), Arrays.copyOf(chars, count));
    }

    /**
     * @return the UTF-8 encoding of the string, unpaired surrogates encoded
     *         like any other code point
     */
    byte[] utf8() {
        return utf8;
    }

    /**
     * @return whether a cluster starts or ends at the given UTF-16 offset
     */
    boolean isCharBoundary(int charOffset) {
        return Arrays.binarySearch(charOffsets, charOffset) >= 0;
    }

    /**
     * @return the largest boundary not after {@code byteOffset}
     */
    int floor(int byteOffset) {
        int i = Arrays.binarySearch(byteOffsets, byteOffset);
        return i >= 0 ? byteOffsets[i] : byteOffsets[-i - 2];
    }

    /**
     * @return the smallest boundary not before {@code byteOffset}
     */
    int ceil(int byteOffset) {
        int i = Arrays.binarySearch(byteOffsets, byteOffset);
        return i >= 0 ? byteOffsets[i] : byteOffsets[-i - 1];
    }

    /**
     * Converts the UTF-8 offset of a boundary to a UTF-16 offset.
     *
     * @throws IllegalArgumentException if the offset is not a boundary
     */
    int toChars(int byteOffset) {
        int i = Arrays.binarySearch(byteOffsets, byteOffset);
        checkArgument(i >= 0, "Not a grapheme boundary: %s", byteOffset);
        return charOffsets[i];
    }

    //------------------------------------------------------------< rules >

    private static boolean isBreak(int previous, int cp, int regionalIndicatorsBefore) {
        if (previous == CR && cp == LF) {
            return false;
        }
        if (isControl(previous) || isControl(cp)) {
            return true;
        }
        if (isHangulBreak(previous, cp)) {
            return hangulBreak(previous, cp);
        }
        if (isExtend(cp) || cp == ZWJ || isSpacingMark(cp)) {
            return false;
        }
        if (previous == ZWJ) {
            return false;
        }
        if (isRegionalIndicator(previous) && isRegionalIndicator(cp)) {
            return regionalIndicatorsBefore % 2 == 0;
        }
        return true;
    }

    private static boolean isControl(int cp) {
        if (cp == CR || cp == LF) {
            return true;
        }
        int type = Character.getType(cp);
        return (type == Character.CONTROL || type == Character.LINE_SEPARATOR
                || type == Character.PARAGRAPH_SEPARATOR)
                && cp != ZWJ && cp != 0x200C;
    }

    private static boolean isExtend(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || cp == 0x200C
                || (cp >= 0xFE00 && cp <= 0xFE0F)
                || (cp >= 0xE0100 && cp <= 0xE01EF)
                || (cp >= 0xE0020 && cp <= 0xE007F)
                || (cp >= 0x1F3FB && cp <= 0x1F3FF);
    }

    private static boolean isSpacingMark(int cp) {
        return Character.getType(cp) == Character.COMBINING_SPACING_MARK;
    }

    private static boolean isRegionalIndicator(int cp) {
        return cp >= 0x1F1E6 && cp <= 0x1F1FF;
    }

    // Hangul jamo and syllables

    private static boolean isL(int cp) {
        return (cp >= 0x1100 && cp <= 0x115F) || (cp >= 0xA960 && cp <= 0xA97C);
    }

    private static boolean isV(int cp) {
        return (cp >= 0x1160 && cp <= 0x11A7) || (cp >= 0xD7B0 && cp <= 0xD7C6);
    }

    private static boolean isT(int cp) {
        return (cp >= 0x11A8 && cp <= 0x11FF) || (cp >= 0xD7CB && cp <= 0xD7FB);
    }

    private static boolean isLV(int cp) {
        return cp >= 0xAC00 && cp <= 0xD7A3 && (cp - 0xAC00) % 28 == 0;
    }

    private static boolean isLVT(int cp) {
        return cp >= 0xAC00 && cp <= 0xD7A3 && (cp - 0xAC00) % 28 != 0;
    }

    private static boolean isHangulBreak(int previous, int cp) {
        boolean a = isL(previous) || isV(previous) || isT(previous) || isLV(previous) || isLVT(previous);
        boolean b = isL(cp) || isV(cp) || isT(cp) || isLV(cp) || isLVT(cp);
        return a && b;
    }

    private static boolean hangulBreak(int previous, int cp) {
        if (isL(previous)) {
            return !(isL(cp) || isV(cp) || isLV(cp) || isLVT(cp));
        }
        if (isLV(previous) || isV(previous)) {
            return !(isV(cp) || isT(cp));
        }
        if (isLVT(previous) || isT(previous)) {
            return !isT(cp);
        }
        return true;
    }

    private static int encode(int cp, byte[] out, int offset) {
        if (cp < 0x80) {
            out[offset++] = (byte) cp;
        } else if (cp < 0x800) {
            out[offset++] = (byte) (0xC0 | (cp >> 6));
            out[offset++] = (byte) (0x80 | (cp & 0x3F));
        } else if (cp < 0x10000) {
            out[offset++] = (byte) (0xE0 | (cp >> 12));
            out[offset++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
            out[offset++] = (byte) (0x80 | (cp & 0x3F));
        } else {
            out[offset++] = (byte) (0xF0 | (cp >> 18));
            out[offset++] = (byte) (0x80 | ((cp >> 12) & 0x3F));
            out[offset++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
            out[offset++] = (byte) (0x80 | (cp & 0x3F));
        }
        return offset;
    }
}
