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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BooleanSupplier;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.commons.json.JsonValues;
import org.apache.jackrabbit.shareddoc.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.shareddoc.schedule.ReconcileSequence;
import org.apache.jackrabbit.shareddoc.text.TextReconciler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a live array of cells to a desired list of plain cells.
 * <p>
 * Cells are correlated by their {@code id} only. A matched cell whose
 * content changed is patched in place if possible (see
 * {@link CellPatcher}), so that references to it and to its nested types
 * stay valid. All other cells are removed, and desired cells without a
 * live counterpart are created. A matched cell that is not at its desired
 * position is removed and created again at that position.
 * <p>
 * Planning (indexing the live cells, normalizing the desired cells and
 * computing cell patches) is done before the transaction is opened, all
 * writes happen in one transaction.
 */
public class CellReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(CellReconciler.class);

    /**
     * System property disabling in place updates of changed cells when set
     * to {@code false}.
     */
    public static final String GRANULAR_PROPERTY = "shareddoc.cells.granular";

    private final CellFactory factory;

    private final CellPatcher patcher;

    private final boolean granular;

    public CellReconciler() {
        this(new CellFactory(), new TextReconciler());
    }

    public CellReconciler(@NotNull CellFactory factory, @NotNull TextReconciler text) {
        this(factory, text, SystemPropertySupplier.create(GRANULAR_PROPERTY, Boolean.TRUE).loggingTo(LOG).get());
    }

    public CellReconciler(@NotNull CellFactory factory, @NotNull TextReconciler text, boolean granular) {
        this.factory = checkNotNull(factory);
        this.patcher = new CellPatcher(factory, text);
        this.granular = granular;
    }

    @NotNull
    public CellFactory getFactory() {
        return factory;
    }

    /**
     * Reconciles {@code cells} with {@code desired} in a transaction.
     *
     * @return {@code true} if anything was written
     */
    public boolean reconcile(@NotNull List<? extends Map<String, ?>> desired, @NotNull SharedArray cells) {
        return Boolean.TRUE.equals(sequence(desired, cells, null).run());
    }

    /**
     * Same as {@link #reconcile(List, SharedArray)}, expressed as steps of
     * one cell each.
     *
     * @param desired the desired cells
     * @param cells the live cells
     * @param alsoInTransaction optional extra writes to perform in the same
     *        transaction, returning {@code true} if they wrote anything
     * @return the sequence, completing with {@code true} if anything was
     *         written
     */
    @NotNull
    public ReconcileSequence<Boolean> sequence(@NotNull List<? extends Map<String, ?>> desired,
                                               @NotNull SharedArray cells,
                                               @Nullable BooleanSupplier alsoInTransaction) {
        Run run = new Run(ImmutableList.copyOf(desired), checkNotNull(cells));
        ReconcileSequence<Boolean> sequence = new ReconcileSequence<Boolean>()
                .repeat(run::index)
                .repeat(run::plan)
                .openTransaction(cells.getTree())
                .repeat(run::patch)
                .repeat(run::delete)
                .repeat(run::place)
                .repeat(run::truncate);
        if (alsoInTransaction != null) {
            sequence.then(() -> run.changed |= alsoInTransaction.getAsBoolean());
        }
        return sequence.commit().complete(() -> run.changed);
    }

    private static final class Current {

        final SharedMap live;

        final Map<String, Object> view;

        Current(SharedMap live, Map<String, Object> view) {
            this.live = live;
            this.view = view;
        }
    }

    /**
     * State of one reconciliation. Each method is one step and returns
     * whether it needs to run again.
     */
    private final class Run {

        private final List<? extends Map<String, ?>> desired;

        private final SharedArray cells;

        private final Map<String, Current> index = Maps.newHashMap();

        private final Set<String> knownIds = new HashSet<>();

        private final List<Map<String, Object>> targets = new ArrayList<>();

        private final Set<String> targetIds = new HashSet<>();

        private final Map<String, CellPatch> retained = Maps.newLinkedHashMap();

        private final List<CellPatch> patches = new ArrayList<>();

        private final Set<String> seen = new HashSet<>();

        private int cursor;

        private boolean changed;

        Run(List<? extends Map<String, ?>> desired, SharedArray cells) {
            this.desired = desired;
            this.cells = cells;
        }

        boolean index() {
            if (cursor < cells.length()) {
                Object cell = cells.get(cursor);
                String id = CellFactory.idOf(cell);
                if (id != null) {
                    knownIds.add(id);
                    if (!index.containsKey(id)) {
                        SharedMap live = (SharedMap) cell;
                        index.put(id, new Current(live, factory.view(live)));
                    }
                }
                cursor++;
            }
            if (cursor < cells.length()) {
                return true;
            }
            cursor = 0;
            return false;
        }

        boolean plan() {
            if (cursor < desired.size()) {
                Map<String, Object> target = factory.normalize(desired.get(cursor));
                Object id = target.get(CellFactory.ID);
                if (!(id instanceof String)) {
                    target.put(CellFactory.ID, mint());
                } else if (targetIds.contains(id)) {
                    String newId = mint();
                    LOG.warn("Duplicate cell id {} at index {} in the desired cells, using {}",
                            id, cursor, newId);
                    target.put(CellFactory.ID, newId);
                } else {
                    Current current = index.get(id);
                    if (current != null) {
                        CellPatch patch = granular || JsonValues.deepEquals(current.view, target)
                                ? patcher.plan(current.view, target, current.live) : null;
                        if (patch != null) {
                            retained.put((String) id, patch);
                            patches.add(patch);
                        } else if (!granular) {
                            LOG.debug("Cell {} rebuilt: in place updates disabled", id);
                        }
                    }
                }
                targetIds.add((String) target.get(CellFactory.ID));
                targets.add(target);
                cursor++;
            }
            if (cursor < desired.size()) {
                return true;
            }
            cursor = 0;
            LOG.debug("Planned {} cells: {} live, {} retained, {} patched",
                    targets.size(), cells.length(), retained.size(), countPatched());
            return false;
        }

        boolean patch() {
            if (cursor < patches.size()) {
                changed |= patches.get(cursor).apply();
                cursor++;
            }
            if (cursor < patches.size()) {
                return true;
            }
            cursor = 0;
            return false;
        }

        boolean delete() {
            if (cursor < cells.length()) {
                String id = CellFactory.idOf(cells.get(cursor));
                if (id == null || !retained.containsKey(id) || !seen.add(id)) {
                    LOG.trace("Removing cell {} at index {}", id, cursor);
                    cells.delete(cursor);
                    changed = true;
                } else {
                    cursor++;
                }
            }
            if (cursor < cells.length()) {
                return true;
            }
            cursor = 0;
            return false;
        }

        boolean place() {
            if (cursor < targets.size()) {
                Map<String, Object> target = targets.get(cursor);
                String id = (String) target.get(CellFactory.ID);
                if (cursor >= cells.length() || !id.equals(CellFactory.idOf(cells.get(cursor)))) {
                    if (retained.containsKey(id)) {
                        int from = find(id, cursor + 1);
                        LOG.trace("Moving cell {} from index {} to {}", id, from, cursor);
                        cells.delete(from);
                    }
                    cells.insert(cursor, factory.create(tree(), target));
                    changed = true;
                }
                cursor++;
            }
            if (cursor < targets.size()) {
                return true;
            }
            cursor = 0;
            return false;
        }

        boolean truncate() {
            int length = cells.length();
            if (length > targets.size()) {
                cells.delete(length - 1);
                changed = true;
                return length - 1 > targets.size();
            }
            return false;
        }

        private int find(String id, int start) {
            for (int i = start; i < cells.length(); i++) {
                if (id.equals(CellFactory.idOf(cells.get(i)))) {
                    return i;
                }
            }
            throw new IllegalStateException("Retained cell " + id + " not found after index " + start);
        }

        private String mint() {
            String id = factory.newId();
            if (knownIds.contains(id) || targetIds.contains(id)) {
                throw new IllegalStateException("Generated cell id " + id + " is already in use");
            }
            return id;
        }

        private SharedTree tree() {
            SharedTree tree = cells.getTree();
            checkState(tree != null, "Cells are not part of a tree");
            return tree;
        }

        private int countPatched() {
            int count = 0;
            for (CellPatch patch : patches) {
                if (!patch.isEmpty()) {
                    count++;
                }
            }
            return count;
        }
    }
}
