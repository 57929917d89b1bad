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
package org.apache.jackrabbit.shareddoc.api;

import java.util.List;
import java.util.function.Consumer;

import org.apache.jackrabbit.shareddoc.api.event.SharedEvent;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Base interface of all shared types held by a {@link SharedTree}.
 *
 * @param <E> the kind of event reported to shallow observers
 */
public interface SharedType<E extends SharedEvent> {

    /**
     * The tree this type is attached to, or {@code null} while the type is
     * still preliminary.
     */
    @Nullable
    SharedTree getTree();

    /**
     * Observes changes to this type only. The listener is called once per
     * transaction that changed this type.
     */
    @NotNull
    Subscription observe(@NotNull Consumer<? super E> listener);

    /**
     * Observes changes to this type and to all types nested below it. The
     * listener is called once per transaction with all events of that
     * transaction that concern this subtree, parents before children.
     */
    @NotNull
    Subscription observeDeep(@NotNull Consumer<List<SharedEvent>> listener);

    /**
     * Cancels a subscription obtained from this type. Unknown or already
     * cancelled subscriptions are ignored.
     */
    void unobserve(@NotNull Subscription subscription);

    /**
     * Materializes the content of this type into plain values: strings,
     * numbers, booleans, {@code null}, byte arrays, lists and maps.
     */
    @NotNull
    Object toPlain();

}
