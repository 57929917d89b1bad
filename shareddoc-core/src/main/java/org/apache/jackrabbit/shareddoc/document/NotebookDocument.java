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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.api.Transaction;
import org.apache.jackrabbit.shareddoc.cells.CellFactory;
import org.apache.jackrabbit.shareddoc.cells.CellReconciler;
import org.apache.jackrabbit.shareddoc.commons.json.JsonValues;
import org.apache.jackrabbit.shareddoc.schedule.ReconcileSequence;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A Jupyter notebook. The {@code meta} map of the tree holds the format
 * version and the notebook metadata, the {@code cells} array holds one map
 * per cell.
 * <p>
 * Topics: {@code state} (shallow), {@code meta} and {@code cells} (deep).
 */
public class NotebookDocument extends AbstractDocument<Map<String, Object>> {

    private static final Logger LOG = LoggerFactory.getLogger(NotebookDocument.class);

    private static final String META = "meta";
    private static final String CELLS = "cells";
    private static final String METADATA = "metadata";
    private static final String NBFORMAT = "nbformat";
    private static final String NBFORMAT_MINOR = "nbformat_minor";
    private static final String ID = "id";

    private static final int DEFAULT_NBFORMAT = 4;
    private static final int DEFAULT_NBFORMAT_MINOR = 5;

    private final SharedMap meta;

    private final SharedArray cells;

    private final CellReconciler reconciler;

    public NotebookDocument(@NotNull SharedTree tree) {
        this(tree, new CellReconciler());
    }

    public NotebookDocument(@NotNull SharedTree tree, @NotNull CellReconciler reconciler) {
        super(tree);
        this.meta = tree.getMap(META);
        this.cells = tree.getArray(CELLS);
        this.reconciler = checkNotNull(reconciler);
    }

    @NotNull
    @Override
    public String getVersion() {
        return "2.0.0";
    }

    @NotNull
    public SharedArray getCells() {
        return cells;
    }

    @NotNull
    public SharedMap getMeta() {
        return meta;
    }

    public int getCellCount() {
        return cells.length();
    }

    /**
     * Returns the cell at {@code index} as a plain value, without
     * {@code id} for notebooks of format 4.4 and older.
     */
    @NotNull
    public Map<String, Object> getCell(int index) {
        checkElementIndex(index, cells.length());
        return readCell(index, withoutIds(readMeta()));
    }

    /**
     * Creates a preliminary cell of this notebook from a plain cell.
     */
    @NotNull
    public SharedMap createCell(@NotNull Map<String, ?> value) {
        return reconciler.getFactory().create(getTree(), value);
    }

    public void appendCell(@NotNull Map<String, ?> value) {
        cells.append(createCell(value));
    }

    /**
     * Replaces the cell at {@code index}, or appends it if {@code index}
     * is the number of cells.
     */
    public void setCell(int index, @NotNull Map<String, ?> value) {
        checkPositionIndex(index, cells.length());
        SharedMap cell = createCell(value);
        try (Transaction tx = getTree().transaction()) {
            if (index < cells.length()) {
                cells.delete(index);
            }
            cells.insert(index, cell);
        }
    }

    /**
     * Returns the notebook as a plain value. A cell whose id is already used
     * by a cell before it gets a new id in the returned value.
     */
    @NotNull
    @Override
    public Map<String, Object> get() {
        Map<String, Object> m = readMeta();
        boolean withoutIds = withoutIds(m);
        Map<String, Map<String, Object>> byId = new HashMap<>();
        List<Object> plainCells = new ArrayList<>();
        for (int i = 0; i < cells.length(); i++) {
            Map<String, Object> cell = readCell(i, withoutIds);
            Object id = cell.get(ID);
            if (id instanceof String) {
                Map<String, Object> first = byId.get(id);
                if (first == null) {
                    byId.put((String) id, cell);
                } else {
                    String newId = reconciler.getFactory().newId();
                    Set<String> differing = differingFields(first, cell);
                    if (differing.isEmpty()) {
                        LOG.warn("Cell at index {} has the duplicate id {}, using {}", i, id, newId);
                    } else {
                        LOG.warn("Cell at index {} has the duplicate id {}, using {}. Differing fields: {}",
                                i, id, newId, differing);
                    }
                    cell.put(ID, newId);
                    byId.put(newId, cell);
                }
            }
            plainCells.add(cell);
        }
        Map<String, Object> nb = Maps.newLinkedHashMap();
        nb.put(CELLS, plainCells);
        Object metadata = m.get(METADATA);
        nb.put(METADATA, metadata instanceof Map ? metadata : Maps.newLinkedHashMap());
        nb.put(NBFORMAT, intValue(m.get(NBFORMAT), 0));
        nb.put(NBFORMAT_MINOR, intValue(m.get(NBFORMAT_MINOR), 0));
        return nb;
    }

    @NotNull
    @Override
    protected ReconcileSequence<Boolean> setSequence(@NotNull Map<String, Object> value) {
        List<Map<String, ?>> desired = desiredCells(value.get(CELLS));
        Map<String, Object> metadata = value.get(METADATA) instanceof Map
                ? JsonValues.copyMap(castMap(value.get(METADATA))) : Maps.newLinkedHashMap();
        metadata.putIfAbsent("language_info", singleton("name", ""));
        Map<String, Object> kernelspec = Maps.newLinkedHashMap();
        kernelspec.put("name", "");
        kernelspec.put("display_name", "");
        metadata.putIfAbsent("kernelspec", kernelspec);
        long nbformat = intValue(value.get(NBFORMAT), DEFAULT_NBFORMAT);
        long nbformatMinor = intValue(value.get(NBFORMAT_MINOR), DEFAULT_NBFORMAT_MINOR);
        return reconciler.sequence(desired, cells, () -> {
            boolean changed = update(METADATA, metadata);
            changed |= update(NBFORMAT, nbformat);
            changed |= update(NBFORMAT_MINOR, nbformatMinor);
            return changed;
        });
    }

    @Override
    public void observe(@NotNull DocumentChangeListener listener) {
        unobserve();
        observeShallow(getState(), STATE, listener);
        observeDeep(meta, META, listener);
        observeDeep(cells, CELLS, listener);
    }

    private List<Map<String, ?>> desiredCells(Object value) {
        List<Map<String, ?>> desired = Lists.newArrayList();
        if (value instanceof List) {
            for (Object cell : (List<?>) value) {
                desired.add(castMap(cell));
            }
        }
        if (desired.isEmpty()) {
            Map<String, Object> metadata = singleton("trusted", true);
            Map<String, Object> cell = Maps.newLinkedHashMap();
            cell.put("cell_type", "code");
            cell.put("execution_count", null);
            cell.put(METADATA, metadata);
            cell.put("outputs", new ArrayList<>());
            cell.put("source", "");
            cell.put(ID, reconciler.getFactory().newId());
            desired.add(cell);
        }
        return desired;
    }

    private boolean update(String key, Object value) {
        Object current = JsonValues.floatingToIntegral(JsonValues.copy(meta.get(key)));
        if (meta.containsKey(key) && JsonValues.deepEquals(current, value)) {
            return false;
        }
        LOG.debug("Updating notebook {}", key);
        meta.put(key, JsonValues.integralToFloating(JsonValues.copy(value)));
        return true;
    }

    private Map<String, Object> readMeta() {
        Map<String, Object> m = meta.toMap();
        JsonValues.floatingToIntegral(m);
        return m;
    }

    private Map<String, Object> readCell(int index, boolean withoutIds) {
        Object cell = cells.get(index);
        checkState(cell instanceof SharedMap, "Cell at index %s is not a map: %s", index, cell);
        Map<String, Object> view = reconciler.getFactory().view((SharedMap) cell);
        if (withoutIds) {
            view.remove(ID);
        }
        return view;
    }

    private static boolean withoutIds(Map<String, Object> m) {
        return intValue(m.get(NBFORMAT), 0) == 4 && intValue(m.get(NBFORMAT_MINOR), 0) <= 4;
    }

    private static Set<String> differingFields(Map<String, Object> a, Map<String, Object> b) {
        Set<String> differing = new TreeSet<>();
        for (String key : Sets.union(a.keySet(), b.keySet())) {
            if (!ID.equals(key) && !JsonValues.deepEquals(a.get(key), b.get(key))) {
                differing.add(key);
            }
        }
        return differing;
    }

    private static long intValue(Object value, long defaultValue) {
        return value instanceof Number ? ((Number) value).longValue() : defaultValue;
    }

    private static Map<String, Object> singleton(String key, Object value) {
        Map<String, Object> map = Maps.newLinkedHashMap();
        map.put(key, value);
        return map;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Not a map: " + value);
        }
        return (Map<String, Object>) value;
    }
}
