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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.jetbrains.annotations.NotNull;

/**
 * Change of a {@link SharedText}, expressed as a delta over UTF-16 code units.
 */
public final class TextEvent extends SharedEvent {

    private final List<Delta> delta;

    public TextEvent(@NotNull SharedText target, @NotNull List<Object> path, @NotNull List<Delta> delta) {
        super(target, path);
        this.delta = ImmutableList.copyOf(delta);
    }

    @NotNull
    public List<Delta> getDelta() {
        return delta;
    }

    @Override
    public String toString() {
        return "TextEvent{path=" + getPath() + ", delta=" + delta + "}";
    }
}
