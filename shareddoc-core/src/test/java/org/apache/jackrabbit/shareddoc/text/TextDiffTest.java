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

import java.util.List;

import org.apache.jackrabbit.shareddoc.text.Opcode.Tag;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class TextDiffTest {

    @Test
    public void ratios() {
        assertEquals(1.0, new TextDiff("", "").ratio(), 0.0);
        assertEquals(1.0, new TextDiff("abc", "abc").ratio(), 0.0);

        TextDiff diff = new TextDiff("abcd", "bcde");
        assertEquals(1.0, diff.realQuickRatio(), 1e-9);
        assertEquals(0.75, diff.quickRatio(), 1e-9);
        assertEquals(0.75, diff.ratio(), 1e-9);

        assertEquals(0.0, new TextDiff("abc", "xyz").quickRatio(), 0.0);
    }

    @Test
    public void asciiOpcodes() {
        List<Opcode> opcodes = new TextDiff("hello world", "hello World").getOpcodes();
        assertEquals(3, opcodes.size());
        assertOpcode(opcodes.get(0), Tag.EQUAL, 0, 6, 0, 6);
        assertOpcode(opcodes.get(1), Tag.REPLACE, 6, 7, 6, 7);
        assertOpcode(opcodes.get(2), Tag.EQUAL, 7, 11, 7, 11);
    }

    @Test
    public void insertAndDeleteOpcodes() {
        List<Opcode> opcodes = new TextDiff("abc", "abXc").getOpcodes();
        assertEquals(3, opcodes.size());
        assertOpcode(opcodes.get(1), Tag.INSERT, 2, 2, 2, 3);

        opcodes = new TextDiff("abXc", "abc").getOpcodes();
        assertOpcode(opcodes.get(1), Tag.DELETE, 2, 3, 2, 2);
    }

    @Test
    public void offsetsAreUtf16() {
        List<Opcode> opcodes = new TextDiff("\u00e9!", "\u00e9?").getOpcodes();
        assertEquals(2, opcodes.size());
        assertOpcode(opcodes.get(0), Tag.EQUAL, 0, 1, 0, 1);
        assertOpcode(opcodes.get(1), Tag.REPLACE, 1, 2, 1, 2);

        opcodes = new TextDiff("😀a", "😀b").getOpcodes();
        assertOpcode(opcodes.get(0), Tag.EQUAL, 0, 2, 0, 2);
        assertOpcode(opcodes.get(1), Tag.REPLACE, 2, 3, 2, 3);
    }

    @Test
    public void rangesCoverWholeClusters() {
        // e + combining acute accent vs e + combining grave accent
        List<Opcode> opcodes = new TextDiff("e\u0301", "e\u0300").getOpcodes();
        assertEquals(1, opcodes.size());
        assertOpcode(opcodes.get(0), Tag.REPLACE, 0, 2, 0, 2);

        // thumbs up with two different skin tone modifiers
        opcodes = new TextDiff("x👍🏽", "x👍🏿").getOpcodes();
        assertEquals(2, opcodes.size());
        assertOpcode(opcodes.get(0), Tag.EQUAL, 0, 1, 0, 1);
        assertOpcode(opcodes.get(1), Tag.REPLACE, 1, 5, 1, 5);
    }

    @Test
    public void overlappingClusterEditsAreRejected() {
        // thumbs up / medium tone vs thumbs down / dark tone: two byte edits in one cluster
        TextDiff diff = new TextDiff("abc 👍🏽", "abc 👎🏿");
        assertTrue(diff.ratio() >= 0.6);
        assertNull(diff.getOpcodes());
    }

    @Test
    public void regionalIndicatorPairs() {
        GraphemeBoundaries bounds = GraphemeBoundaries.of("🇫🇷🇩🇪");
        assertTrue(bounds.isCharBoundary(0));
        assertFalse(bounds.isCharBoundary(2));
        assertTrue(bounds.isCharBoundary(4));
        assertFalse(bounds.isCharBoundary(6));
        assertTrue(bounds.isCharBoundary(8));
    }

    @Test
    public void crLfAndZwjSequences() {
        GraphemeBoundaries bounds = GraphemeBoundaries.of("a\r\nb");
        assertTrue(bounds.isCharBoundary(1));
        assertFalse(bounds.isCharBoundary(2));
        assertTrue(bounds.isCharBoundary(3));

        // man, zero width joiner, laptop
        bounds = GraphemeBoundaries.of("\uD83D\uDC68\u200D\uD83D\uDCBB!");
        assertFalse(bounds.isCharBoundary(2));
        assertFalse(bounds.isCharBoundary(3));
        assertTrue(bounds.isCharBoundary(5));
    }

    @Test
    public void hangulJamoSequence() {
        // choseong kiyeok, jungseong a, jongseong kiyeok
        GraphemeBoundaries bounds = GraphemeBoundaries.of("\u1100\u1161\u11A8x");
        assertFalse(bounds.isCharBoundary(1));
        assertFalse(bounds.isCharBoundary(2));
        assertTrue(bounds.isCharBoundary(3));
    }

    private static void assertOpcode(Opcode op, Tag tag, int i1, int i2, int j1, int j2) {
        assertEquals(op.toString(), tag, op.getTag());
        assertEquals(op.toString(), i1, op.getI1());
        assertEquals(op.toString(), i2, op.getI2());
        assertEquals(op.toString(), j1, op.getJ1());
        assertEquals(op.toString(), j2, op.getJ2());
    }
}
