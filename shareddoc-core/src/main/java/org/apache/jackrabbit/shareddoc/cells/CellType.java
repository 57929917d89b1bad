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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The kinds of notebook cells.
 */
public enum CellType {

    CODE("code"),

    MARKDOWN("markdown"),

    RAW("raw");

    private final String name;

    CellType(String name) {
        this.name = name;
    }

    /**
     * @return the name used in the {@code cell_type} field
     */
    @NotNull
    public String getName() {
        return name;
    }

    /**
     * Raw and markdown cells may carry attachments, which are omitted when
     * empty.
     */
    public boolean hasAttachments() {
        return this != CODE;
    }

    /**
     * @throws IllegalArgumentException for an unknown or missing name
     */
    @NotNull
    public static CellType fromName(@Nullable Object name) {
        CellType type = find(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown cell_type: " + name);
        }
        return type;
    }

    /**
     * @return the type with the given name, or {@code null} if there is none
     */
    @Nullable
    public static CellType find(@Nullable Object name) {
        for (CellType type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}
