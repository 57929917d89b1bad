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
package org.apache.jackrabbit.shareddoc.commons.json;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class JsonValuesTest {

    @Test
    public void copyNormalizesNumbers() {
        Map<String, Object> source = ImmutableMap.<String, Object>of(
                "a", 1, "b", 2.5f, "c", ImmutableList.of(3, "x"));
        Map<String, Object> copy = JsonValues.copyMap(source);

        assertEquals(Long.valueOf(1), copy.get("a"));
        assertEquals(Double.valueOf(2.5), copy.get("b"));
        assertEquals(Arrays.asList(3L, "x"), copy.get("c"));
        assertTrue(copy instanceof LinkedHashMap);
    }

    @Test
    public void copyIsMutableAndDetached() {
        List<Object> inner = new ArrayList<>(Arrays.asList("a"));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("list", inner);
        Map<String, Object> copy = JsonValues.copyMap(source);

        assertNotSame(inner, copy.get("list"));
        inner.add("b");
        assertEquals(Arrays.asList("a"), copy.get("list"));
    }

    @Test
    public void deepEqualsComparesNumbersByValue() {
        assertTrue(JsonValues.deepEquals(ImmutableMap.of("n", 1L), ImmutableMap.of("n", 1.0)));
        assertTrue(JsonValues.deepEquals(ImmutableList.of(1, "a"), Arrays.asList(1L, "a")));
        assertFalse(JsonValues.deepEquals(ImmutableMap.of("n", 1L), ImmutableMap.of("n", 1.5)));
        assertFalse(JsonValues.deepEquals(ImmutableMap.of("n", 1L), ImmutableMap.of("m", 1L)));
        assertFalse(JsonValues.deepEquals(ImmutableList.of(1), ImmutableList.of(1, 2)));
        assertTrue(JsonValues.deepEquals(new byte[] {1, 2}, new byte[] {1, 2}));
    }

    @Test
    public void castsOnlyExactValues() {
        Map<String, Object> cell = new LinkedHashMap<>();
        cell.put("execution_count", 3L);
        cell.put("flag", true);
        cell.put("metadata", new LinkedHashMap<>(ImmutableMap.of("scale", 2L, "ratio", 0.5)));

        JsonValues.integralToFloating(cell);
        assertEquals(Double.valueOf(3.0), cell.get("execution_count"));
        assertEquals(Boolean.TRUE, cell.get("flag"));
        assertEquals(Double.valueOf(2.0), ((Map<?, ?>) cell.get("metadata")).get("scale"));

        JsonValues.floatingToIntegral(cell);
        assertEquals(Long.valueOf(3), cell.get("execution_count"));
        assertEquals(Long.valueOf(2), ((Map<?, ?>) cell.get("metadata")).get("scale"));
        assertEquals(Double.valueOf(0.5), ((Map<?, ?>) cell.get("metadata")).get("ratio"));
    }

    @Test
    public void castConvertsScalarArgument() {
        assertEquals(Double.valueOf(3.0), JsonValues.integralToFloating(3L));
        assertEquals(Long.valueOf(3), JsonValues.floatingToIntegral(3.0));
        assertEquals("x", JsonValues.integralToFloating("x"));
        assertEquals(Boolean.TRUE, JsonValues.floatingToIntegral(Boolean.TRUE));
    }
}
