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
package org.apache.jackrabbit.shareddoc.cells;

import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.apache.jackrabbit.shareddoc.api.SharedType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * How a cell field is held in the shared tree.
 */
public enum FieldKind {

    /** Plain value stored directly in the cell map */
    SCALAR,

    /** {@link SharedText} */
    TEXT,

    /** {@link SharedArray} */
    ORDERED_LIST,

    /** {@link SharedMap} */
    MAP;

    private static final Map<String, FieldKind> FIELDS = ImmutableMap.of(
            "source", TEXT,
            "metadata", MAP,
            "outputs", ORDERED_LIST);

    /**
     * @return the kind of the named cell field, {@link #SCALAR} for fields
     *         without a nested shared type
     */
    @NotNull
    public static FieldKind of(@NotNull String field) {
        FieldKind kind = FIELDS.get(field);
        return kind == null ? SCALAR : kind;
    }

    public boolean isStructural() {
        return this != SCALAR;
    }

    /**
     * @return whether the live value is held the way this kind requires
     */
    public boolean accepts(@Nullable Object live) {
        switch (this) {
            case TEXT:
                return live instanceof SharedText;
            case ORDERED_LIST:
                return live instanceof SharedArray;
            case MAP:
                return live instanceof SharedMap;
            default:
                return !(live instanceof SharedType);
        }
    }
}
