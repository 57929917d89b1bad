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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.jackrabbit.shareddoc.api.event.KeyChange;
import org.apache.jackrabbit.shareddoc.api.event.KeyChange.Action;
import org.jetbrains.annotations.Nullable;

/**
 * Remembers the value each touched key had before the transaction, and
 * compares it with the current value at commit.
 */
final class MapChanges implements ChangeRecorder {

    static final Object ABSENT = new Object();

    private final MemoryMap map;

    private final Map<String, Object> before = new LinkedHashMap<>();

    MapChanges(MemoryMap map) {
        this.map = map;
    }

    void touched(String key, @Nullable Object oldValue) {
        if (!before.containsKey(key)) {
            before.put(key, oldValue);
        }
    }

    @Nullable
    @Override
    public Object summarize() {
        Map<String, KeyChange> keys = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : before.entrySet()) {
            Object oldValue = e.getValue();
            Object newValue = map.containsKey(e.getKey()) ? map.get(e.getKey()) : ABSENT;
            if (oldValue == ABSENT && newValue == ABSENT) {
                continue;
            } else if (oldValue == ABSENT) {
                keys.put(e.getKey(), new KeyChange(Action.ADD, null, newValue));
            } else if (newValue == ABSENT) {
                keys.put(e.getKey(), new KeyChange(Action.DELETE, oldValue, null));
            } else if (!same(oldValue, newValue)) {
                keys.put(e.getKey(), new KeyChange(Action.UPDATE, oldValue, newValue));
            }
        }
        return keys.isEmpty() ? null : keys;
    }

    private static boolean same(Object a, Object b) {
        if (a instanceof byte[] && b instanceof byte[]) {
            return Arrays.equals((byte[]) a, (byte[]) b);
        }
        return Objects.equals(a, b);
    }
}
