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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.api.SharedType;
import org.apache.jackrabbit.shareddoc.api.Subscription;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.apache.jackrabbit.shareddoc.api.event.Delta;
import org.apache.jackrabbit.shareddoc.api.event.SharedEvent;
import org.apache.jackrabbit.shareddoc.commons.json.JsonValues;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of the in-memory shared types. A type is either a named root
 * of a {@link MemorySharedTree}, nested below another type, or preliminary
 * (not yet inserted anywhere).
 */
abstract class MemoryType<E extends SharedEvent> implements SharedType<E> {

    private static final Logger LOG = LoggerFactory.getLogger(MemoryType.class);

    private static final Transaction NO_TRANSACTION = () -> { };

    private MemorySharedTree tree;

    private final String rootName;

    private MemoryType<?> parent;

    private boolean deleted;

    private final Map<Subscription, Consumer<? super E>> observers = new LinkedHashMap<>();

    private final Map<Subscription, Consumer<List<SharedEvent>>> deepObservers = new LinkedHashMap<>();

    /**
     * Creates a root type.
     */
    MemoryType(@NotNull MemorySharedTree tree, @NotNull String rootName) {
        this.tree = checkNotNull(tree);
        this.rootName = checkNotNull(rootName);
    }

    /**
     * Creates a preliminary type.
     */
    MemoryType() {
        this.tree = null;
        this.rootName = null;
    }

    @Nullable
    @Override
    public SharedTree getTree() {
        return tree;
    }

    @NotNull
    @Override
    public Subscription observe(@NotNull Consumer<? super E> listener) {
        Subscription subscription = new MemorySubscription();
        observers.put(subscription, checkNotNull(listener));
        return subscription;
    }

    @NotNull
    @Override
    public Subscription observeDeep(@NotNull Consumer<List<SharedEvent>> listener) {
        Subscription subscription = new MemorySubscription();
        deepObservers.put(subscription, checkNotNull(listener));
        return subscription;
    }

    @Override
    public void unobserve(@NotNull Subscription subscription) {
        observers.remove(subscription);
        deepObservers.remove(subscription);
    }

    //------------------------------------------------------------< internal >

    /**
     * Creates the event for a net change produced by the recorder of this
     * type.
     */
    abstract E newEvent(List<Object> path, Object change);

    /**
     * Puts the key or index of each shared type held by this type into
     * {@code keys}.
     */
    abstract void collectKeys(Map<MemoryType<?>, Object> keys);

    /**
     * @return the shared types directly held by this type
     */
    abstract Iterable<MemoryType<?>> children();

    @Nullable
    MemoryType<?> getParent() {
        return parent;
    }

    boolean isAttached() {
        if (tree == null || deleted) {
            return false;
        }
        return rootName != null || parent.isAttached();
    }

    /**
     * Opens a transaction on the tree of this type, or a no-op one for a
     * preliminary type.
     */
    Transaction begin() {
        return tree == null ? NO_TRANSACTION : tree.transaction();
    }

    @Nullable
    SequenceChanges sequenceChanges(int length, BiFunction<Integer, Integer, Delta> insertion) {
        return tree == null ? null : tree.sequenceChanges(this, length, insertion);
    }

    @Nullable
    MapChanges mapChanges() {
        return tree == null ? null : tree.mapChanges(this);
    }

    /**
     * Prepares a value for being stored in this type. Shared types become
     * children of this type, plain values are copied.
     */
    Object adopt(@Nullable Object value) {
        if (value instanceof SharedType) {
            checkArgument(value instanceof MemoryType, "Not an in-memory type: %s", value.getClass());
            MemoryType<?> child = (MemoryType<?>) value;
            child.attachTo(this);
            return child;
        }
        return JsonValues.copy(value);
    }

    /**
     * Called when a value is no longer stored in this type.
     */
    static void release(@Nullable Object value) {
        if (value instanceof MemoryType) {
            ((MemoryType<?>) value).deleted = true;
        }
    }

    static Object plain(@Nullable Object value) {
        if (value instanceof MemoryType) {
            return ((MemoryType<?>) value).toPlain();
        }
        return JsonValues.copy(value);
    }

    private void attachTo(MemoryType<?> newParent) {
        checkState(parent == null && rootName == null && !deleted,
                "Type is already part of a tree: %s", describe());
        for (MemoryType<?> t = newParent; t != null; t = t.parent) {
            checkArgument(t != this, "Type cannot be nested below itself");
        }
        parent = newParent;
        if (newParent.tree != null) {
            bind(newParent.tree);
        }
    }

    private void bind(MemorySharedTree tree) {
        this.tree = tree;
        tree.created(this);
        for (MemoryType<?> child : children()) {
            child.bind(tree);
        }
    }

    void fire(E event) {
        for (Consumer<? super E> observer : new ArrayList<>(observers.values())) {
            try {
                observer.accept(event);
            } catch (RuntimeException e) {
                LOG.warn("Observer of {} failed on {}", describe(), event, e);
            }
        }
    }

    boolean hasDeepObservers() {
        return !deepObservers.isEmpty();
    }

    void fireDeep(List<SharedEvent> events) {
        for (Consumer<List<SharedEvent>> observer : new ArrayList<>(deepObservers.values())) {
            try {
                observer.accept(events);
            } catch (RuntimeException e) {
                LOG.warn("Deep observer of {} failed on {}", describe(), events, e);
            }
        }
    }

    private String describe() {
        return rootName != null
                ? getClass().getSimpleName() + "[" + rootName + "]"
                : getClass().getSimpleName();
    }

    private static final class MemorySubscription implements Subscription {
    }
}
