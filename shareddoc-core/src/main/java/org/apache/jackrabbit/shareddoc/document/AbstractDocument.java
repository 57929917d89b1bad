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
package org.apache.jackrabbit.shareddoc.document;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.api.SharedType;
import org.apache.jackrabbit.shareddoc.api.Subscription;
import org.apache.jackrabbit.shareddoc.api.event.SharedEvent;
import org.apache.jackrabbit.shareddoc.commons.PerfLogger;
import org.apache.jackrabbit.shareddoc.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.shareddoc.schedule.CooperativeScheduler;
import org.apache.jackrabbit.shareddoc.schedule.ReconcileSequence;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class of documents backed by a {@link SharedTree}.
 * <p>
 * A document reads its content as a plain value with {@link #get()} and
 * writes it with {@link #set(Object)}, which changes the tree only as much
 * as needed. Every document has a {@code state} map holding the
 * {@code dirty}, {@code hash} and {@code path} entries, which are never
 * written by {@code set}.
 *
 * @param <T> type of the plain content
 */
public abstract class AbstractDocument<T> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractDocument.class);

    private static final PerfLogger PERF_LOGGER = new PerfLogger(
            LoggerFactory.getLogger(AbstractDocument.class.getName() + ".perf"));

    /**
     * System property with the duration in milliseconds above which
     * {@code set} calls are logged at DEBUG level.
     */
    public static final String PERF_THRESHOLD_PROPERTY = "shareddoc.perf.logThresholdMillis";

    protected static final String STATE = "state";

    private static final String DIRTY = "dirty";
    private static final String HASH = "hash";
    private static final String PATH = "path";

    private final long perfThreshold = SystemPropertySupplier.create(PERF_THRESHOLD_PROPERTY, 10L)
            .loggingTo(LOG).get();

    private final SharedTree tree;

    private final SharedMap state;

    private final Map<SharedType<?>, Subscription> subscriptions = Maps.newLinkedHashMap();

    protected AbstractDocument(@NotNull SharedTree tree) {
        this.tree = checkNotNull(tree);
        this.state = tree.getMap(STATE);
    }

    /**
     * @return the version of the document format
     */
    @NotNull
    public abstract String getVersion();

    /**
     * @return the content as a plain value
     */
    @NotNull
    public abstract T get();

    /**
     * Returns the steps bringing the tree to {@code value}.
     */
    @NotNull
    protected abstract ReconcileSequence<?> setSequence(@NotNull T value);

    /**
     * Subscribes {@code listener} to the topics of this document, replacing
     * previous subscriptions.
     */
    public abstract void observe(@NotNull DocumentChangeListener listener);

    /**
     * Sets the content. Observers are notified once, and not at all if
     * {@code value} equals the current content.
     */
    public void set(@NotNull T value) {
        checkNotNull(value);
        long start = PERF_LOGGER.start();
        setSequence(value).run();
        PERF_LOGGER.end(start, perfThreshold, "{} set", getClass().getSimpleName());
    }

    /**
     * Like {@link #set(Object)}, one step at a time on {@code scheduler}.
     * The resulting tree and notifications are the same.
     */
    @NotNull
    public CompletableFuture<Void> setAsync(@NotNull T value, @NotNull CooperativeScheduler scheduler) {
        checkNotNull(value);
        return scheduler.submit(setSequence(value)).thenApply(result -> null);
    }

    /**
     * Like {@link #get()}, on {@code scheduler}.
     */
    @NotNull
    public CompletableFuture<T> getAsync(@NotNull CooperativeScheduler scheduler) {
        return scheduler.submit(new ReconcileSequence<T>().complete(this::get));
    }

    /**
     * Removes all subscriptions of this document. Calling it again has no
     * effect.
     */
    public void unobserve() {
        for (Map.Entry<SharedType<?>, Subscription> e : subscriptions.entrySet()) {
            e.getKey().unobserve(e.getValue());
        }
        subscriptions.clear();
    }

    @NotNull
    public SharedTree getTree() {
        return tree;
    }

    @NotNull
    public SharedMap getState() {
        return state;
    }

    @Nullable
    public Boolean getDirty() {
        Object dirty = state.get(DIRTY);
        return dirty instanceof Boolean ? (Boolean) dirty : null;
    }

    public void setDirty(boolean dirty) {
        state.put(DIRTY, dirty);
    }

    @Nullable
    public String getHash() {
        return (String) state.get(HASH);
    }

    public void setHash(@NotNull String hash) {
        state.put(HASH, checkNotNull(hash));
    }

    @Nullable
    public String getPath() {
        return (String) state.get(PATH);
    }

    public void setPath(@NotNull String path) {
        state.put(PATH, checkNotNull(path));
    }

    protected <E extends SharedEvent> void observeShallow(@NotNull SharedType<E> type, @NotNull String topic,
                                                          @NotNull DocumentChangeListener listener) {
        subscriptions.put(type, type.observe(event -> listener.changed(topic, ImmutableList.<SharedEvent>of(event))));
    }

    protected void observeDeep(@NotNull SharedType<?> type, @NotNull String topic,
                               @NotNull DocumentChangeListener listener) {
        subscriptions.put(type, type.observeDeep(events -> listener.changed(topic, events)));
    }
}
