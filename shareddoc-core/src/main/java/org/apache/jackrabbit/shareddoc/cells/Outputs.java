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

import java.util.Map;

import com.google.common.collect.Maps;

import org.apache.jackrabbit.shareddoc.api.SharedArray;
import org.apache.jackrabbit.shareddoc.api.SharedTree;
import org.jetbrains.annotations.NotNull;

/**
 * Operations on the outputs of a live code cell.
 */
public final class Outputs {

    private Outputs() {
    }

    /**
     * Appends an input request to {@code outputs}. The answer is typed into
     * the {@code value} text of the new output.
     *
     * @param outputs the live outputs of a code cell
     * @param prompt the prompt shown to the user
     * @param password whether the input is to be hidden
     * @return the index of the new output
     */
    public static int addStdinOutput(@NotNull SharedArray outputs, @NotNull String prompt, boolean password) {
        SharedTree tree = outputs.getTree();
        checkState(tree != null, "Outputs are not part of a tree");
        Map<String, Object> stdin = Maps.newLinkedHashMap();
        stdin.put("output_type", "stdin");
        stdin.put("submitted", false);
        stdin.put("password", password);
        stdin.put("prompt", checkNotNull(prompt));
        stdin.put("value", tree.newText(""));
        int index = outputs.length();
        outputs.append(tree.newMap(stdin));
        return index;
    }
}
