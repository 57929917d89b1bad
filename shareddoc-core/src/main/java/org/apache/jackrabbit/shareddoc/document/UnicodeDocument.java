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

import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.apache.jackrabbit.shareddoc.schedule.ReconcileSequence;
import org.apache.jackrabbit.shareddoc.text.TextReconciler;
import org.jetbrains.annotations.NotNull;

/**
 * A plain text document, held in the {@code source} text of the tree.
 * Topics: {@code state} and {@code source}.
 */
public class UnicodeDocument extends AbstractDocument<String> {

    protected static final String SOURCE = "source";

    private final SharedText source;

    private final TextReconciler reconciler;

    public UnicodeDocument(@NotNull SharedTree tree) {
        this(tree, new TextReconciler());
    }

    public UnicodeDocument(@NotNull SharedTree tree, @NotNull TextReconciler reconciler) {
        super(tree);
        this.source = tree.getText(SOURCE);
        this.reconciler = checkNotNull(reconciler);
    }

    @NotNull
    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @NotNull
    @Override
    public String get() {
        return source.toString();
    }

    @NotNull
    public SharedText getSource() {
        return source;
    }

    @NotNull
    @Override
    protected ReconcileSequence<Boolean> setSequence(@NotNull String value) {
        return reconciler.sequence(value, source);
    }

    @Override
    public void observe(@NotNull DocumentChangeListener listener) {
        unobserve();
        observeShallow(getState(), STATE, listener);
        observeShallow(source, SOURCE, listener);
    }
}
