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

import java.util.List;

import org.apache.jackrabbit.shareddoc.api.event.SharedEvent;
import org.jetbrains.annotations.NotNull;

/**
 * Receives the changes of a document, grouped by topic.
 */
@FunctionalInterface
public interface DocumentChangeListener {

    /**
     * @param topic the part of the document that changed, for example
     *        {@code source} or {@code cells}
     * @param events the events of one transaction; a single event for
     *        topics observed shallowly
     */
    void changed(@NotNull String topic, @NotNull List<SharedEvent> events);

}
