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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Net change of a single map key within one transaction.
 */
public final class KeyChange {

    public enum Action {
        ADD, UPDATE, DELETE
    }

    private final Action action;

    private final Object oldValue;

    private final Object newValue;

    public KeyChange(@NotNull Action action, @Nullable Object oldValue, @Nullable Object newValue) {
        this.action = checkNotNull(action);
        this.oldValue = oldValue;
        this.newValue = newValue;
    }

    @NotNull
    public Action getAction() {
        return action;
    }

    /**
     * The value before the transaction, {@code null} for {@link Action#ADD}.
     */
    @Nullable
    public Object getOldValue() {
        return oldValue;
    }

    /**
     * The value after the transaction, {@code null} for {@link Action#DELETE}.
     */
    @Nullable
    public Object getNewValue() {
        return newValue;
    }

    @Override
    public String toString() {
        return "{action: " + action + ", oldValue: " + oldValue + ", newValue: " + newValue + "}";
    }
}
