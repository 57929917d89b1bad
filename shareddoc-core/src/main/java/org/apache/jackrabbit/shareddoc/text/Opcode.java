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

import org.jetbrains.annotations.NotNull;

/**
 * Tagged range pair of an edit script: {@code old[i1, i2)} relates to
 * {@code new[j1, j2)}. Offsets are UTF-16 code unit offsets.
 */
public final class Opcode {

    public enum Tag {
        EQUAL, REPLACE, DELETE, INSERT
    }

    private final Tag tag;

    private final int i1;

    private final int i2;

    private final int j1;

    private final int j2;

    public Opcode(@NotNull Tag tag, int i1, int i2, int j1, int j2) {
        this.tag = tag;
        this.i1 = i1;
        this.i2 = i2;
        this.j1 = j1;
        this.j2 = j2;
    }

    @NotNull
    public Tag getTag() {
        return tag;
    }

    public int getI1() {
        return i1;
    }

    public int getI2() {
        return i2;
    }

    public int getJ1() {
        return j1;
    }

    public int getJ2() {
        return j2;
    }

    @Override
    public String toString() {
        return tag + "(" + i1 + ", " + i2 + ", " + j1 + ", " + j2 + ")";
    }
}
