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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

import com.google.common.collect.Maps;

import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.commons.json.JsonValues;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Converts between plain cell values and their representation in a shared
 * tree.
 * <p>
 * Plain cells are maps as found in a notebook file. In the tree, a cell is a
 * {@link SharedMap} whose {@code source} is a text, whose {@code metadata}
 * is a map and, for code cells, whose {@code outputs} is an array of maps.
 * Integral numbers are stored as floating point numbers and read back as
 * integers.
 */
public class CellFactory {

    static final String ID = "id";
    static final String CELL_TYPE = "cell_type";
    static final String SOURCE = "source";
    static final String METADATA = "metadata";
    static final String OUTPUTS = "outputs";
    static final String ATTACHMENTS = "attachments";
    static final String EXECUTION_STATE = "execution_state";

    private static final String OUTPUT_TYPE = "output_type";
    private static final String STREAM = "stream";
    private static final String TEXT = "text";

    private final Supplier<String> ids;

    public CellFactory() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * @param ids source of identifiers for cells without one
     */
    public CellFactory(@NotNull Supplier<String> ids) {
        this.ids = checkNotNull(ids);
    }

    @NotNull
    public String newId() {
        return checkNotNull(ids.get(), "id supplier returned null");
    }

    /**
     * Returns a normalized copy of a plain cell: list valued sources and
     * stream texts are joined, {@code metadata} defaults to an empty map,
     * code cells get {@code outputs}, empty attachments of raw and markdown
     * cells are dropped. The copy carries no {@code execution_state}.
     *
     * @throws IllegalArgumentException if the cell type is missing or unknown
     */
    @NotNull
    public Map<String, Object> normalize(@NotNull Map<String, ?> cell) {
        Map<String, Object> copy = JsonValues.copyMap(checkNotNull(cell));
        CellType type = CellType.fromName(copy.get(CELL_TYPE));
        copy.remove(EXECUTION_STATE);
        copy.put(SOURCE, join(copy.get(SOURCE)));
        if (!(copy.get(METADATA) instanceof Map)) {
            checkArgument(copy.get(METADATA) == null, "metadata is not a map: %s", copy.get(METADATA));
            copy.put(METADATA, Maps.newLinkedHashMap());
        }
        if (type == CellType.CODE) {
            Object outputs = copy.get(OUTPUTS);
            if (outputs == null) {
                copy.put(OUTPUTS, new ArrayList<>());
            } else {
                checkArgument(outputs instanceof List, "outputs is not a list: %s", outputs);
                for (Object output : (List<?>) outputs) {
                    normalizeOutput(output);
                }
            }
        }
        if (type.hasAttachments() && isEmpty(copy.get(ATTACHMENTS))) {
            copy.remove(ATTACHMENTS);
        }
        JsonValues.floatingToIntegral(copy);
        return copy;
    }

    /**
     * Creates a preliminary cell of {@code tree} from a plain cell, minting
     * an id if it has none.
     */
    @NotNull
    public SharedMap create(@NotNull SharedTree tree, @NotNull Map<String, ?> cell) {
        Map<String, Object> plain = normalize(cell);
        if (!(plain.get(ID) instanceof String)) {
            plain.put(ID, newId());
        }
        JsonValues.integralToFloating(plain);
        CellType type = CellType.fromName(plain.get(CELL_TYPE));
        plain.put(SOURCE, tree.newText((String) plain.get(SOURCE)));
        plain.put(METADATA, tree.newMap(asMap(plain.get(METADATA))));
        if (type == CellType.CODE) {
            List<Object> outputs = new ArrayList<>();
            for (Object output : (List<?>) plain.get(OUTPUTS)) {
                outputs.add(output(tree, output));
            }
            plain.put(OUTPUTS, tree.newArray(outputs));
            plain.put(EXECUTION_STATE, "idle");
        }
        return tree.newMap(plain);
    }

    /**
     * Creates the tree value of an output: a map, whose text is a shared
     * text for stream outputs. Values that are not maps are stored as is.
     */
    @Nullable
    public Object output(@NotNull SharedTree tree, @Nullable Object output) {
        Object plain = normalizeOutput(JsonValues.copy(output));
        if (!(plain instanceof Map)) {
            return plain;
        }
        Map<String, Object> map = asMap(plain);
        JsonValues.integralToFloating(map);
        if (isStream(map)) {
            map.put(TEXT, tree.newText((String) map.get(TEXT)));
        }
        return tree.newMap(map);
    }

    /**
     * Reads the plain view of a live cell, without the internal
     * {@code execution_state}, with integral numbers as integers and
     * without empty attachments on raw and markdown cells.
     */
    @NotNull
    public Map<String, Object> view(@NotNull SharedMap cell) {
        Map<String, Object> view = cell.toMap();
        view.remove(EXECUTION_STATE);
        JsonValues.floatingToIntegral(view);
        CellType type = CellType.find(view.get(CELL_TYPE));
        if (type != null && type.hasAttachments() && isEmpty(view.get(ATTACHMENTS))) {
            view.remove(ATTACHMENTS);
        }
        return view;
    }

    /**
     * @return whether {@code output} is a stream output
     */
    static boolean isStream(@Nullable Object output) {
        return output instanceof Map && STREAM.equals(((Map<?, ?>) output).get(OUTPUT_TYPE));
    }

    /**
     * @return the id of a live cell, {@code null} if {@code cell} is not a
     *         map or has no string id
     */
    @Nullable
    static String idOf(@Nullable Object cell) {
        if (cell instanceof SharedMap) {
            Object id = ((SharedMap) cell).get(ID);
            return id instanceof String ? (String) id : null;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value) {
        return (Map<String, Object>) value;
    }

    private static Object normalizeOutput(Object output) {
        if (isStream(output)) {
            Map<String, Object> map = asMap(output);
            map.put(TEXT, join(map.get(TEXT)));
        }
        return output;
    }

    private static String join(@Nullable Object source) {
        if (source == null) {
            return "";
        } else if (source instanceof List) {
            StringBuilder sb = new StringBuilder();
            for (Object line : (List<?>) source) {
                sb.append(line);
            }
            return sb.toString();
        }
        checkArgument(source instanceof String, "Not a string or list of strings: %s", source);
        return (String) source;
    }

    private static boolean isEmpty(@Nullable Object attachments) {
        return attachments == null || (attachments instanceof Map && ((Map<?, ?>) attachments).isEmpty());
    }
}
