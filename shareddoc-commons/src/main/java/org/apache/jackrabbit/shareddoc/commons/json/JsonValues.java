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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.Nullable;

/**
 * Helpers for JSON-like value trees made of {@link Map}s with string keys,
 * {@link List}s, strings, booleans, numbers and {@code null}.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Returns a mutable deep copy of {@code value}. Maps become
     * {@link LinkedHashMap}s keeping their iteration order, lists become
     * {@link ArrayList}s, integral numbers become {@link Long} and
     * {@link Float} becomes {@link Double}.
     */
    @Nullable
    public static Object copy(@Nullable Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                copy.put(String.valueOf(e.getKey()), copy(e.getValue()));
            }
            return copy;
        } else if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(copy(item));
            }
            return copy;
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        } else if (value instanceof Float) {
            return ((Float) value).doubleValue();
        } else if (value instanceof byte[]) {
            return ((byte[]) value).clone();
        }
        return value;
    }

    /**
     * Typed variant of {@link #copy(Object)} for maps.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> copyMap(Map<String, ?> map) {
        return (Map<String, Object>) copy(map);
    }

    /**
     * Structural equality where numbers compare by value, so {@code 1}
     * equals {@code 1.0}.
     */
    public static boolean deepEquals(@Nullable Object a, @Nullable Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number && b instanceof Number) {
            return numberEquals((Number) a, (Number) b);
        }
        if (a instanceof Map && b instanceof Map) {
            Map<?, ?> ma = (Map<?, ?>) a;
            Map<?, ?> mb = (Map<?, ?>) b;
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> e : ma.entrySet()) {
                if (!mb.containsKey(e.getKey()) || !deepEquals(e.getValue(), mb.get(e.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List && b instanceof List) {
            List<?> la = (List<?>) a;
            List<?> lb = (List<?>) b;
            if (la.size() != lb.size()) {
                return false;
            }
            Iterator<?> ib = lb.iterator();
            for (Object item : la) {
                if (!deepEquals(item, ib.next())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof byte[] && b instanceof byte[]) {
            return Arrays.equals((byte[]) a, (byte[]) b);
        }
        return Objects.equals(a, b);
    }

    /**
     * Replaces, in place and at any depth below {@code container}, every
     * {@link Long} by the {@link Double} of the same value where that
     * conversion is exact. A scalar passed directly is converted the same
     * way and returned.
     *
     * @return {@code container}, or the converted scalar
     */
    @Nullable
    public static Object integralToFloating(@Nullable Object container) {
        return cast(container, true);
    }

    /**
     * Replaces, in place and at any depth below {@code container}, every
     * finite {@link Double} with an integral value by the equal
     * {@link Long}. Fractional values are kept. A scalar passed directly is
     * converted the same way and returned.
     *
     * @return {@code container}, or the converted scalar
     */
    @Nullable
    public static Object floatingToIntegral(@Nullable Object container) {
        return cast(container, false);
    }

    @SuppressWarnings("unchecked")
    private static Object cast(Object container, boolean toFloating) {
        if (container instanceof Map) {
            for (Map.Entry<String, Object> e : ((Map<String, Object>) container).entrySet()) {
                Object v = e.getValue();
                Object cast = castScalar(v, toFloating);
                if (cast != v) {
                    e.setValue(cast);
                } else {
                    cast(v, toFloating);
                }
            }
        } else if (container instanceof List) {
            List<Object> list = (List<Object>) container;
            for (int i = 0; i < list.size(); i++) {
                Object v = list.get(i);
                Object cast = castScalar(v, toFloating);
                if (cast != v) {
                    list.set(i, cast);
                } else {
                    cast(v, toFloating);
                }
            }
            return container;
        }
        return castScalar(container, toFloating);
    }

    private static Object castScalar(Object v, boolean toFloating) {
        if (toFloating && v instanceof Long) {
            long l = (Long) v;
            double d = (double) l;
            if ((long) d == l && d != 0x1p63) {
                return d;
            }
        } else if (!toFloating && v instanceof Double) {
            double d = (Double) v;
            if (!Double.isInfinite(d) && !Double.isNaN(d) && d == Math.rint(d)
                    && Math.abs(d) < 0x1p63) {
                return (long) d;
            }
        }
        return v;
    }

    private static boolean numberEquals(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return a.longValue() == b.longValue();
        }
        return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }
}
