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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.collect.Sets;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.commons.json.JsonValues;
import org.apache.jackrabbit.shareddoc.text.TextPatch;
import org.apache.jackrabbit.shareddoc.text.TextReconciler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plans the update of a live cell in place. Texts are patched with a
 * {@link TextReconciler}, lists and maps are cleared and refilled, plain
 * values are overwritten.
 * <p>
 * A cell cannot be updated in place if
 * <ul>
 *     <li>its type changes,</li>
 *     <li>a field held by a nested shared type is added,</li>
 *     <li>a live field is not held the way its {@link FieldKind} requires,</li>
 *     <li>its new outputs contain a stream output.</li>
 * </ul>
 * In these cases no patch is returned and the cell must be rebuilt.
 */
public class CellPatcher {

    private static final Logger LOG = LoggerFactory.getLogger(CellPatcher.class);

    private final CellFactory factory;

    private final TextReconciler text;

    public CellPatcher(@NotNull CellFactory factory, @NotNull TextReconciler text) {
        this.factory = checkNotNull(factory);
        this.text = checkNotNull(text);
    }

    /**
     * Plans the writes turning {@code live}, whose plain view is
     * {@code current}, into {@code desired}.
     *
     * @param current the {@link CellFactory#view(SharedMap) view} of the live cell
     * @param desired the {@link CellFactory#normalize(Map) normalized} desired cell
     * @param live the live cell
     * @return the patch, or {@code null} if the cell must be rebuilt
     */
    @Nullable
    public CellPatch plan(@NotNull Map<String, Object> current, @NotNull Map<String, Object> desired,
                          @NotNull SharedMap live) {
        if (JsonValues.deepEquals(current, desired)) {
            return CellPatch.EMPTY;
        }
        Object id = current.get(CellFactory.ID);
        if (!JsonValues.deepEquals(current.get(CellFactory.CELL_TYPE), desired.get(CellFactory.CELL_TYPE))) {
            return refuse(id, "cell_type changed");
        }
        List<Runnable> edits = new ArrayList<>();
        for (String key : Sets.intersection(current.keySet(), desired.keySet())) {
            Object oldValue = current.get(key);
            Object newValue = desired.get(key);
            if (JsonValues.deepEquals(oldValue, newValue)) {
                continue;
            }
            FieldKind kind = FieldKind.of(key);
            Object field = live.get(key);
            if (!kind.accepts(field)) {
                return refuse(id, key + " is not held as " + kind);
            }
            switch (kind) {
                case TEXT:
                    if (!(oldValue instanceof String) || !(newValue instanceof String)) {
                        return refuse(id, key + " is not a string");
                    }
                    TextPatch patch = text.diff((String) oldValue, (String) newValue);
                    SharedText sharedText = (SharedText) field;
                    edits.add(() -> patch.applyTo(sharedText));
                    break;
                case ORDERED_LIST:
                    if (!(newValue instanceof List)) {
                        return refuse(id, key + " is not a list");
                    }
                    List<?> items = (List<?>) newValue;
                    if (CellFactory.OUTPUTS.equals(key) && items.stream().anyMatch(CellFactory::isStream)) {
                        return refuse(id, "outputs contain a stream");
                    }
                    SharedArray array = (SharedArray) field;
                    edits.add(() -> refill(array, items));
                    break;
                case MAP:
                    if (!(newValue instanceof Map)) {
                        return refuse(id, key + " is not a map");
                    }
                    Map<String, Object> entries = CellFactory.asMap(newValue);
                    SharedMap map = (SharedMap) field;
                    edits.add(() -> refill(map, entries));
                    break;
                default:
                    edits.add(() -> live.put(key, stored(newValue)));
            }
        }
        for (String key : Sets.difference(current.keySet(), desired.keySet())) {
            edits.add(() -> live.remove(key));
        }
        for (String key : Sets.difference(desired.keySet(), current.keySet())) {
            if (FieldKind.of(key).isStructural()) {
                return refuse(id, key + " added");
            }
            Object value = desired.get(key);
            edits.add(() -> live.put(key, stored(value)));
        }
        LOG.trace("Cell {} patched in place with {} edits", id, edits.size());
        return new CellPatch(edits);
    }

    /**
     * Updates {@code live} in place, in the transaction of the caller.
     *
     * @return {@code false} if the cell must be rebuilt instead
     */
    public boolean update(@NotNull Map<String, Object> current, @NotNull Map<String, ?> desired,
                          @NotNull SharedMap live) {
        CellPatch patch = plan(current, factory.normalize(desired), live);
        if (patch == null) {
            return false;
        }
        patch.apply();
        return true;
    }

    private void refill(SharedArray array, List<?> items) {
        SharedTree tree = checkNotNull(array.getTree(), "Detached array");
        array.clear();
        for (Object item : items) {
            array.append(factory.output(tree, item));
        }
    }

    private static void refill(SharedMap map, Map<String, Object> entries) {
        map.clear();
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            map.put(e.getKey(), stored(e.getValue()));
        }
    }

    /**
     * @return a copy of {@code value} with integral numbers as floating
     *         point numbers
     */
    @Nullable
    static Object stored(@Nullable Object value) {
        return JsonValues.integralToFloating(JsonValues.copy(value));
    }

    private static CellPatch refuse(Object id, String reason) {
        LOG.debug("Cell {} rebuilt: {}", id, reason);
        return null;
    }
}
