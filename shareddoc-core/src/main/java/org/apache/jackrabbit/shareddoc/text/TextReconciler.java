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
package org.apache.jackrabbit.shareddoc.text;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import org.apache.jackrabbit.shareddoc.api.SharedText;
import org.apache.jackrabbit.shareddoc.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.shareddoc.schedule.ReconcileSequence;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a {@link SharedText} to a desired content with few edits.
 * <p>
 * Similar strings are patched with a grapheme-safe edit script. Strings
 * that are not similar enough, or whose edit script cannot be aligned to
 * grapheme cluster boundaries, are replaced as a whole: the text is
 * cleared, then the desired content is inserted.
 */
public class TextReconciler {

    private static final Logger LOG = LoggerFactory.getLogger(TextReconciler.class);

    /**
     * Minimum similarity ratio, in {@code [0, 1]}, for granular edits.
     */
    public static final String SIMILARITY_CUTOFF_PROPERTY = "shareddoc.text.similarityCutoff";

    /**
     * Set to {@code false} to always replace texts as a whole.
     */
    public static final String GRANULAR_PROPERTY = "shareddoc.text.granular";

    public static final double DEFAULT_SIMILARITY_CUTOFF = 0.6;

    private final double similarityCutoff;

    private final boolean granular;

    public TextReconciler() {
        this(SystemPropertySupplier.create(SIMILARITY_CUTOFF_PROPERTY, DEFAULT_SIMILARITY_CUTOFF)
                        .loggingTo(LOG).validateWith(v -> v >= 0 && v <= 1).get(),
                SystemPropertySupplier.create(GRANULAR_PROPERTY, Boolean.TRUE).loggingTo(LOG).get());
    }

    public TextReconciler(double similarityCutoff, boolean granular) {
        checkArgument(similarityCutoff >= 0 && similarityCutoff <= 1,
                "similarityCutoff not in [0, 1]: %s", similarityCutoff);
        this.similarityCutoff = similarityCutoff;
        this.granular = granular;
    }

    /**
     * Computes the patch turning {@code current} into {@code desired}.
     */
    @NotNull
    public TextPatch diff(@NotNull String current, @NotNull String desired) {
        checkNotNull(current);
        checkNotNull(desired);
        if (!granular) {
            return TextPatch.replace(desired);
        }
        TextDiff diff = new TextDiff(current, desired);
        if (diff.realQuickRatio() < similarityCutoff
                || diff.quickRatio() < similarityCutoff
                || diff.ratio() < similarityCutoff) {
            LOG.debug("Replacing text of length {}, not similar to the new content", current.length());
            return TextPatch.replace(desired);
        }
        List<Opcode> opcodes = diff.getOpcodes();
        if (opcodes == null) {
            LOG.debug("Replacing text of length {}, edits overlap once aligned to grapheme boundaries",
                    current.length());
            return TextPatch.replace(desired);
        }
        return TextPatch.granular(desired, opcodes);
    }

    /**
     * Applies the edits turning {@code current} into {@code desired} to
     * {@code text}, in the transaction of the caller.
     *
     * @return {@code true} if the text was changed
     */
    public boolean apply(@NotNull String current, @NotNull String desired, @NotNull SharedText text) {
        if (current.equals(desired)) {
            return false;
        }
        diff(current, desired).applyTo(text);
        return true;
    }

    /**
     * Brings {@code text}, whose content is {@code current}, to
     * {@code desired} in a transaction of its own. Nothing is written, and
     * no transaction opened, if both are equal.
     *
     * @return {@code true} if the text was changed
     */
    public boolean reconcile(@NotNull String current, @NotNull String desired, @NotNull SharedText text) {
        return Boolean.TRUE.equals(sequence(current, desired, text).run());
    }

    /**
     * Same as {@link #reconcile(String, String, SharedText)}, expressed as
     * steps: computing the diff, then one step per edit.
     */
    @NotNull
    public ReconcileSequence<Boolean> sequence(@NotNull String current, @NotNull String desired,
                                               @NotNull SharedText text) {
        if (current.equals(desired)) {
            return ReconcileSequence.completed(Boolean.FALSE);
        }
        PatchHolder holder = new PatchHolder();
        return new ReconcileSequence<Boolean>()
                .then(() -> holder.patch = diff(current, desired))
                .openTransaction(text.getTree())
                .repeat(() -> holder.patch.applyNext(text))
                .commit()
                .complete(() -> Boolean.TRUE);
    }

    /**
     * Brings {@code text} to {@code desired}, reading its current content in
     * the first step. Nothing is written if the content is already equal.
     */
    @NotNull
    public ReconcileSequence<Boolean> sequence(@NotNull String desired, @NotNull SharedText text) {
        checkNotNull(desired);
        PatchHolder holder = new PatchHolder();
        return new ReconcileSequence<Boolean>()
                .then(() -> {
                    String current = text.toString();
                    holder.patch = current.equals(desired) ? null : diff(current, desired);
                })
                .openTransaction(text.getTree())
                .repeat(() -> holder.patch != null && holder.patch.applyNext(text))
                .commit()
                .complete(() -> holder.patch != null);
    }

    private static final class PatchHolder {

        TextPatch patch;

    }
}
