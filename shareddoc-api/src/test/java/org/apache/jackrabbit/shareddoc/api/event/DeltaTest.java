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

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;

public class DeltaTest {

    @Test
    public void textInsertCountsCodeUnits() {
        Delta d = Delta.insert("a😀");
        assertEquals(Delta.Kind.INSERT, d.getKind());
        assertEquals(3, d.getCount());
        assertEquals("a😀", d.getInsert());
    }

    @Test
    public void listInsertKeepsNulls() {
        Delta d = Delta.insert(Arrays.asList("x", null));
        assertEquals(2, d.getCount());
        assertEquals(Arrays.asList("x", null), d.getInsert());
    }

    @Test(expected = UnsupportedOperationException.class)
    public void listInsertIsUnmodifiable() {
        @SuppressWarnings("unchecked")
        List<Object> items = (List<Object>) Delta.insert(Arrays.asList("x")).getInsert();
        items.add("y");
    }

    @Test
    public void equality() {
        assertEquals(Delta.retain(2), Delta.retain(2));
        assertNotEquals(Delta.retain(2), Delta.delete(2));
        assertEquals(Delta.insert("ab"), Delta.insert("ab"));
        assertNull(Delta.delete(1).getInsert());
    }

    @Test
    public void readableToString() {
        assertEquals("{retain: 1}", Delta.retain(1).toString());
        assertEquals("{delete: 4}", Delta.delete(4).toString());
        assertEquals("{insert: ab}", Delta.insert("ab").toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroRetain() {
        Delta.retain(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyInsert() {
        Delta.insert("");
    }
}
