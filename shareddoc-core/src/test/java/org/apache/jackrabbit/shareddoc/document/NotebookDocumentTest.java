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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableMap;

import ch.qos.logback.classic.Level;

import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedType;
import org.apache.jackrabbit.shareddoc.api.event.ArrayEvent;
import org.apache.jackrabbit.shareddoc.api.event.Delta;
import org.apache.jackrabbit.shareddoc.api.event.MapEvent;
import org.apache.jackrabbit.shareddoc.api.event.SharedEvent;
import org.apache.jackrabbit.shareddoc.api.event.TextEvent;
import org.apache.jackrabbit.shareddoc.cells.CellFactory;
import org.apache.jackrabbit.shareddoc.cells.CellReconciler;
import org.apache.jackrabbit.shareddoc.commons.json.JsonValues;
import org.apache.jackrabbit.shareddoc.junit.LogCustomizer;
import org.apache.jackrabbit.shareddoc.plugins.memory.MemorySharedTree;
import org.apache.jackrabbit.shareddoc.schedule.CooperativeScheduler;
import org.apache.jackrabbit.shareddoc.text.TextReconciler;
import org.junit.Before;
import org.junit.Test;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class NotebookDocumentTest {

    private static final String CELL_ID = "8800f7d8-6cad-42ef-a339-a9c185ffdd54";

    private NotebookDocument nb;

    private final List<String> topics = new ArrayList<>();

    private final List<List<SharedEvent>> changes = new ArrayList<>();

    @Before
    public void setup() {
        nb = newNotebook();
    }

    @Test
    public void version() {
        assertEquals("2.0.0", nb.getVersion());
    }

    @Test
    public void setOfGetIsSilent() {
        nb.set(notebook(cell("a", "code", "x = 1"), cell("b", "markdown", "# Title"), cell("c", "raw", "")));
        observe();

        nb.set(nb.get());

        assertTrue(topics.isEmpty());
    }

    @Test
    public void emptyNotebookDefaults() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("cells", emptyList());
        nb.set(value);

        Map<String, Object> read = nb.get();
        Map<String, Object> metadata = ImmutableMap.of(
                "kernelspec", ImmutableMap.of("display_name", "", "name", ""),
                "language_info", ImmutableMap.of("name", ""));
        assertEquals(metadata, read.get("metadata"));
        assertEquals(4L, read.get("nbformat"));
        assertEquals(5L, read.get("nbformat_minor"));

        List<?> cells = (List<?>) read.get("cells");
        assertEquals(1, cells.size());
        Map<?, ?> cell = (Map<?, ?>) cells.get(0);
        assertEquals("code", cell.get("cell_type"));
        assertEquals("", cell.get("source"));
        assertEquals(emptyList(), cell.get("outputs"));
        assertEquals(ImmutableMap.of("trusted", true), cell.get("metadata"));
        assertTrue(cell.containsKey("execution_count"));
        assertTrue(cell.get("id") instanceof String);
    }

    @Test
    public void existingMetadataKept() {
        Map<String, Object> value = notebook(cell("a", "code", "x"));
        value.put("metadata", ImmutableMap.of("kernelspec", ImmutableMap.of("name", "python3")));
        value.put("nbformat_minor", 4);
        nb.set(value);

        Map<String, Object> read = nb.get();
        assertEquals(ImmutableMap.of("name", "python3"),
                ((Map<?, ?>) read.get("metadata")).get("kernelspec"));
        assertEquals(ImmutableMap.of("name", ""),
                ((Map<?, ?>) read.get("metadata")).get("language_info"));
        assertEquals(4L, read.get("nbformat_minor"));
    }

    @Test
    public void insertAndRemove() {
        nb.set(notebook(cell("first", "code", "1"), cell("middle", "code", "2"), cell("last", "code", "3")));
        Map<String, Object> model = nb.get();
        List<Object> cells = cellsOf(model);
        Map<String, Object> inserted = new LinkedHashMap<>();
        inserted.put("cell_type", "markdown");
        inserted.put("source", "new");
        cells.set(1, inserted);
        observe();

        nb.set(model);

        assertEquals(asList("cells"), topics);
        List<SharedEvent> events = changes.get(0);
        assertEquals(1, events.size());
        assertEquals(asList(Delta.retain(1), Delta.delete(1), Delta.insert(asList(nb.getCells().get(1)))),
                ((ArrayEvent) events.get(0)).getDelta());
        assertTrue(nb.getCells().get(1) instanceof SharedMap);
        assertEquals("1", nb.getCell(0).get("source"));
        assertEquals("3", nb.getCell(2).get("source"));
    }

    @Test
    public void modifySource() {
        modify(ImmutableMap.of("source", "'b'"), TextEvent.class);
    }

    @Test
    public void clearOutputs() {
        List<SharedEvent> events = modify(ImmutableMap.of("outputs", emptyList()), ArrayEvent.class);
        assertEquals(asList(0, "outputs"), events.get(0).getPath());
    }

    @Test
    public void replaceStreamOutputs() {
        List<SharedEvent> events = modify(ImmutableMap.of("outputs", asList(ImmutableMap.of(
                "name", "stdout", "output_type", "stream", "text", "b\n"))), ArrayEvent.class);
        assertEquals(emptyList(), events.get(0).getPath());
    }

    @Test
    public void modifyExecutionCount() {
        modify(ImmutableMap.of("execution_count", 2), MapEvent.class);
    }

    @Test
    public void modifyMetadata() {
        modify(ImmutableMap.of("metadata", ImmutableMap.of("tags", emptyList())), MapEvent.class);
    }

    @Test
    public void addKey() {
        modify(ImmutableMap.of("new_key", "test"), MapEvent.class);
    }

    @Test
    public void modifySourceAndExecutionCount() {
        modify(ImmutableMap.of("source", "10", "execution_count", 10), MapEvent.class, TextEvent.class);
    }

    @Test
    public void reorderKeepsContent() {
        nb.set(notebook(cell("a", "code", "A"), cell("b", "code", "B"), cell("c", "code", "C")));
        Map<String, Object> model = nb.get();
        List<Object> cells = cellsOf(model);
        cells.add(0, cells.remove(2));
        cells.add(1, cells.remove(2));

        nb.set(model);

        assertEquals(asList("c", "b", "a"), ids(nb.get()));
        assertEquals("C", nb.getCell(0).get("source"));
        assertEquals("B", nb.getCell(1).get("source"));
        assertEquals("A", nb.getCell(2).get("source"));
    }

    @Test
    public void duplicateIdsHealedOnRead() {
        nb.set(notebook(cell("a", "code", "1"), cell("b", "code", "2")));
        nb.appendCell(cell("b", "code", "other"));
        LogCustomizer logs = LogCustomizer.forLogger(NotebookDocument.class).filter(Level.WARN).create();
        logs.starting();
        try {
            Map<String, Object> read = nb.get();
            List<Object> ids = ids(read);
            assertEquals("a", ids.get(0));
            assertEquals("b", ids.get(1));
            assertEquals("gen-0", ids.get(2));
            assertEquals("b", ((SharedMap) nb.getCells().get(2)).get("id"));

            assertEquals(1, logs.getLogs().size());
            String message = logs.getLogs().get(0);
            assertTrue(message, message.contains("b") && message.contains("gen-0") && message.contains("source"));

            nb.set(read);
        } finally {
            logs.finished();
        }
        assertEquals(asList("a", "b", "gen-0"), ids(nb.get()));
        assertEquals("other", nb.getCell(2).get("source"));
    }

    @Test
    public void duplicateIdsRemovedOnSet() {
        nb.set(notebook(cell("a", "code", "1"), cell("b", "code", "2"), cell("c", "code", "3")));
        nb.getCells().insert(2, nb.createCell(cell("b", "code", "2")));
        assertEquals(4, nb.getCellCount());

        nb.set(notebook(cell("a", "code", "1"), cell("b", "code", "2"), cell("c", "code", "3")));

        assertEquals(3, nb.getCellCount());
        assertEquals(asList("a", "b", "c"), ids(nb.get()));
    }

    @Test
    public void getCellView() {
        nb.set(notebook(cell("a", "code", "1")));
        SharedMap live = (SharedMap) nb.getCells().get(0);
        assertEquals("idle", live.get("execution_state"));

        Map<String, Object> cell = nb.getCell(0);
        assertFalse(cell.containsKey("execution_state"));
        assertEquals(1L, cell.get("execution_count"));
        assertEquals("a", cell.get("id"));
    }

    @Test
    public void getCellWithoutIdForOldFormat() {
        Map<String, Object> value = notebook(cell("a", "markdown", "text"));
        value.put("nbformat_minor", 4);
        nb.set(value);

        assertFalse(nb.getCell(0).containsKey("id"));
        assertFalse(((Map<?, ?>) cellsOf(nb.get()).get(0)).containsKey("id"));
        assertEquals("a", ((SharedMap) nb.getCells().get(0)).get("id"));
    }

    @Test
    public void appendAndSetCell() {
        nb.set(notebook(cell("a", "code", "1")));
        nb.appendCell(cell("b", "markdown", "2"));
        assertEquals(2, nb.getCellCount());

        nb.setCell(0, cell("c", "raw", "3"));
        assertEquals(2, nb.getCellCount());
        assertEquals("c", nb.getCell(0).get("id"));
        assertEquals("raw", nb.getCell(0).get("cell_type"));

        nb.setCell(2, cell("d", "raw", "4"));
        assertEquals(asList("c", "b", "d"), ids(nb.get()));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void getCellOutOfRange() {
        nb.getCell(0);
    }

    @Test
    public void metaTopic() {
        nb.set(notebook(cell("a", "code", "1")));
        observe();
        Map<String, Object> model = nb.get();
        model.put("metadata", ImmutableMap.of("title", "changed"));

        nb.set(model);

        assertEquals(asList("meta"), topics);
        assertTrue(changes.get(0).get(0) instanceof MapEvent);
    }

    @Test
    public void stateTopic() {
        observe();
        nb.setDirty(true);
        nb.setPath("notebooks/test.ipynb");

        assertEquals(asList("state", "state"), topics);
        assertEquals(Boolean.TRUE, nb.getDirty());
        assertEquals("notebooks/test.ipynb", nb.getPath());

        nb.unobserve();
        nb.unobserve();
        nb.setHash("abc");
        assertEquals(2, topics.size());
        assertEquals("abc", nb.getHash());
    }

    @Test
    public void setAsync() throws Exception {
        Map<String, Object> value = notebook(cell("a", "code", "1"), cell("b", "markdown", "two"));
        NotebookDocument blocking = newNotebook();
        blocking.set(value);

        try (CooperativeScheduler scheduler = new CooperativeScheduler()) {
            nb.setAsync(value, scheduler).get(10, TimeUnit.SECONDS);
            Map<String, Object> read = nb.getAsync(scheduler).get(10, TimeUnit.SECONDS);
            assertEquals(blocking.get(), read);
        }
    }

    private List<SharedEvent> modify(Map<String, Object> modifications, Class<?>... expected) {
        Map<String, Object> initial = new LinkedHashMap<>();
        initial.put("id", CELL_ID);
        initial.put("cell_type", "code");
        initial.put("source", "'a'");
        initial.put("metadata", ImmutableMap.of("tags", asList("test-tag")));
        initial.put("outputs", asList(ImmutableMap.of(
                "name", "stdout", "output_type", "stream", "text", asList("a\n"))));
        initial.put("execution_count", 1);
        nb.set(notebook(initial));

        Map<String, Object> model = nb.get();
        @SuppressWarnings("unchecked")
        Map<String, Object> cell = (Map<String, Object>) cellsOf(model).get(0);
        cell.putAll(modifications);
        observe();

        nb.set(model);

        for (Map.Entry<String, Object> e : modifications.entrySet()) {
            Object after = ((SharedMap) nb.getCells().get(0)).get(e.getKey());
            Object plain = after instanceof SharedType ? ((SharedType<?>) after).toPlain() : after;
            assertTrue(e.getKey() + ": " + plain, JsonValues.deepEquals(e.getValue(), plain));
        }
        assertEquals(asList("cells"), topics);
        List<SharedEvent> events = changes.get(0);
        assertEquals(events.toString(), expected.length, events.size());
        for (int i = 0; i < expected.length; i++) {
            assertTrue(events.get(i).toString(), expected[i].isInstance(events.get(i)));
        }
        return events;
    }

    private void observe() {
        nb.observe((topic, events) -> {
            topics.add(topic);
            changes.add(events);
        });
    }

    private static NotebookDocument newNotebook() {
        CellFactory factory = new CellFactory(new Supplier<String>() {
            private int next;

            @Override
            public String get() {
                return "gen-" + next++;
            }
        });
        return new NotebookDocument(new MemorySharedTree(),
                new CellReconciler(factory, new TextReconciler(0.6, true), true));
    }

    private static Map<String, Object> cell(String id, String type, String source) {
        Map<String, Object> cell = new LinkedHashMap<>();
        cell.put("id", id);
        cell.put("cell_type", type);
        cell.put("source", source);
        cell.put("metadata", new LinkedHashMap<>());
        if ("code".equals(type)) {
            cell.put("execution_count", 1);
            cell.put("outputs", new ArrayList<>());
        }
        return cell;
    }

    @SafeVarargs
    private static Map<String, Object> notebook(Map<String, Object>... cells) {
        Map<String, Object> nb = new LinkedHashMap<>();
        nb.put("cells", new ArrayList<>(asList(cells)));
        nb.put("metadata", new LinkedHashMap<>());
        nb.put("nbformat", 4);
        nb.put("nbformat_minor", 5);
        return nb;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> cellsOf(Map<String, Object> nb) {
        return (List<Object>) nb.get("cells");
    }

    private static List<Object> ids(Map<String, Object> nb) {
        List<Object> ids = new ArrayList<>();
        for (Object cell : cellsOf(nb)) {
            ids.add(((Map<?, ?>) cell).get("id"));
        }
        return ids;
    }
}
