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

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.jackrabbit.shareddoc.api.SharedMap;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.schedule.ReconcileSequence;
import org.jetbrains.annotations.NotNull;

/**
 * A binary document, held in the {@code bytes} entry of the {@code source}
 * map of the tree. Topics: {@code state} and {@code source}.
 */
public class BlobDocument extends AbstractDocument<byte[]> {

    private static final String SOURCE = "source";

    private static final String BYTES = "bytes";

    private static final byte[] EMPTY = new byte[0];

    private final SharedMap source;

    public BlobDocument(@NotNull SharedTree tree) {
        super(tree);
        this.source = tree.getMap(SOURCE);
    }

    @NotNull
    @Override
    public String getVersion() {
        return "2.0.0";
    }

    /**
     * @return a copy of the content, empty if none was set
     */
    @NotNull
    @Override
    public byte[] get() {
        Object bytes = source.get(BYTES);
        return bytes instanceof byte[] ? ((byte[]) bytes).clone() : EMPTY.clone();
    }

    @NotNull
    @Override
    protected ReconcileSequence<Boolean> setSequence(@NotNull byte[] value) {
        byte[] copy = value.clone();
        AtomicBoolean changed = new AtomicBoolean();
        return new ReconcileSequence<Boolean>()
                .openTransaction(getTree())
                .then(() -> {
                    Object current = source.get(BYTES);
                    if (!(current instanceof byte[] && Arrays.equals((byte[]) current, copy))) {
                        source.put(BYTES, copy);
                        changed.set(true);
                    }
                })
                .commit()
                .complete(changed::get);
    }

    @Override
    public void observe(@NotNull DocumentChangeListener listener) {
        unobserve();
        observeShallow(getState(), STATE, listener);
        observeShallow(source, SOURCE, listener);
    }
}
