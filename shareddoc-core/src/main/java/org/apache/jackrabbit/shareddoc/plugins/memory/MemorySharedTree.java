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
import static com.google.common.collect.Maps.newLinkedHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.apache.jackrabbit.shareddoc.api.event.Delta;
import org.apache.jackrabbit.shareddoc.api.event.SharedEvent;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single process, in-memory {@link SharedTree}.
 * <p>
 * Changes are recorded per type while a transaction is open. When the
 * outermost transaction is closed, every type that is still attached and
 * that existed before the transaction receives one event with its net
 * change: shallow observers first, then deep observers of the type and of
 * each of its ancestors.
 * <p>
 * This class is not thread-safe.
 */
public class MemorySharedTree implements SharedTree {

    private static final Logger LOG = LoggerFactory.getLogger(MemorySharedTree.class);

    private final Map<String, MemoryType<?>> roots = newLinkedHashMap();

    private int depth;

    private TransactionState current;

    @NotNull
    @Override
    public SharedText getText(@NotNull String name) {
        return root(name, MemoryText.class, () -> new MemoryText(this, name));
    }

    @NotNull
    @Override
    public SharedMap getMap(@NotNull String name) {
        return root(name, MemoryMap.class, () -> new MemoryMap(this, name));
    }

    @NotNull
    @Override
    public SharedArray getArray(@NotNull String name) {
        return root(name, MemoryArray.class, () -> new MemoryArray(this, name));
    }

    @NotNull
    @Override
    public Transaction transaction() {
        if (current == null) {
            current = new TransactionState();
        }
        depth++;
        return new MemoryTransaction();
    }

    @NotNull
    @Override
    public SharedText newText(@NotNull String content) {
        return new MemoryText(checkNotNull(content));
    }

    @NotNull
    @Override
    public SharedMap newMap(@NotNull Map<String, ?> entries) {
        MemoryMap map = new MemoryMap();
        for (Map.Entry<String, ?> e : entries.entrySet()) {
            map.put(e.getKey(), e.getValue());
        }
        return map;
    }

    @NotNull
    @Override
    public SharedArray newArray(@NotNull List<?> items) {
        MemoryArray array = new MemoryArray();
        for (Object item : items) {
            array.append(item);
        }
        return array;
    }

    /**
     * @return {@code true} while a transaction is open
     */
    public boolean inTransaction() {
        return current != null;
    }

    //------------------------------------------------------------< internal >

    private <T extends MemoryType<?>> T root(String name, Class<T> kind, Supplier<T> factory) {
        checkNotNull(name);
        MemoryType<?> root = roots.get(name);
        if (root == null) {
            root = factory.get();
            roots.put(name, root);
        }
        checkArgument(kind.isInstance(root), "Root '%s' is a %s, not a %s",
                name, root.getClass().getSimpleName(), kind.getSimpleName());
        return kind.cast(root);
    }

    void created(MemoryType<?> type) {
        if (current != null) {
            current.created.add(type);
        }
    }

    @Nullable
    SequenceChanges sequenceChanges(MemoryType<?> type, int length,
                                    BiFunction<Integer, Integer, Delta> insertion) {
        if (!recording(type)) {
            return null;
        }
        ChangeRecorder recorder = current.changes.get(type);
        if (recorder == null) {
            recorder = new SequenceChanges(length, insertion);
            current.changes.put(type, recorder);
        }
        return (SequenceChanges) recorder;
    }

    @Nullable
    MapChanges mapChanges(MemoryType<?> type) {
        if (!recording(type)) {
            return null;
        }
        ChangeRecorder recorder = current.changes.get(type);
        if (recorder == null) {
            recorder = new MapChanges((MemoryMap) type);
            current.changes.put(type, recorder);
        }
        return (MapChanges) recorder;
    }

    private boolean recording(MemoryType<?> type) {
        return current != null && !current.created.contains(type) && type.isAttached();
    }

    private void commit(TransactionState state) {
        Map<MemoryType<?>, Object> changed = newLinkedHashMap();
        for (Map.Entry<MemoryType<?>, ChangeRecorder> e : state.changes.entrySet()) {
            if (e.getKey().isAttached()) {
                Object change = e.getValue().summarize();
                if (change != null) {
                    changed.put(e.getKey(), change);
                }
            }
        }
        if (changed.isEmpty()) {
            return;
        }
        LOG.trace("Dispatching changes of {} types", changed.size());

        for (Map.Entry<MemoryType<?>, Object> e : changed.entrySet()) {
            fire(e.getKey(), e.getValue());
        }

        Map<MemoryType<?>, List<SharedEvent>> deep = newLinkedHashMap();
        Map<MemoryType<?>, Object> keys = new IdentityHashMap<>();
        for (Map.Entry<MemoryType<?>, Object> e : changed.entrySet()) {
            MemoryType<?> target = e.getKey();
            MemoryType<?> top = null;
            for (MemoryType<?> t = target; t != null; t = t.getParent()) {
                if (t.hasDeepObservers()) {
                    top = t;
                }
            }
            if (top == null) {
                continue;
            }
            List<Object> reversePath = new ArrayList<>();
            for (MemoryType<?> t = target; ; t = t.getParent()) {
                if (t.hasDeepObservers()) {
                    List<SharedEvent> events = deep.get(t);
                    if (events == null) {
                        events = new ArrayList<>();
                        deep.put(t, events);
                    }
                    events.add(target.newEvent(Lists.reverse(reversePath), e.getValue()));
                }
                if (t == top) {
                    break;
                }
                reversePath.add(keyOf(keys, t));
            }
        }
        for (Map.Entry<MemoryType<?>, List<SharedEvent>> e : deep.entrySet()) {
            List<SharedEvent> events = e.getValue();
            events.sort(Comparator.comparingInt(event -> event.getPath().size()));
            e.getKey().fireDeep(Collections.unmodifiableList(events));
        }
    }

    /**
     * Key of {@code child} in its parent. The keys of all children of a
     * parent are resolved together, once per commit.
     */
    private static Object keyOf(Map<MemoryType<?>, Object> keys, MemoryType<?> child) {
        Object key = keys.get(child);
        if (key == null) {
            child.getParent().collectKeys(keys);
            key = keys.get(child);
            checkState(key != null, "Not a child of its parent");
        }
        return key;
    }

    private static <E extends SharedEvent> void fire(MemoryType<E> type, Object change) {
        type.fire(type.newEvent(ImmutableList.of(), change));
    }

    private static final class TransactionState {

        final Map<MemoryType<?>, ChangeRecorder> changes = newLinkedHashMap();

        final Set<MemoryType<?>> created = Collections.newSetFromMap(new IdentityHashMap<>());

    }

    private final class MemoryTransaction implements Transaction {

        private boolean closed;

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (--depth == 0) {
                TransactionState state = current;
                current = null;
                commit(state);
            }
        }
    }
}
