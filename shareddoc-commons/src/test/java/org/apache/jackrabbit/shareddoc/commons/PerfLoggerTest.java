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
package org.apache.jackrabbit.shareddoc.commons;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.invocation.Invocation;
import org.slf4j.Logger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mockingDetails;
import static org.mockito.Mockito.when;

public class PerfLoggerTest {

    @Mock
    Logger logger;

    private PerfLogger perfLogger;

    @Before
    public void setup() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(logger.isTraceEnabled()).thenReturn(false);
        when(logger.isDebugEnabled()).thenReturn(false);
        perfLogger = new PerfLogger(logger);
    }

    @Test
    public void nothingBelowDebug() {
        long start = perfLogger.start("starting");
        assertEquals(-1, start);
        perfLogger.end(start, -1, "message {}", "argument");

        assertTrue(messages("debug").isEmpty());
        assertTrue(messages("trace").isEmpty());
    }

    @Test
    public void debugWithoutThreshold() {
        when(logger.isDebugEnabled()).thenReturn(true);

        long start = perfLogger.start("starting");
        assertTrue(start >= 0);
        perfLogger.end(start, -1, "message {}", "argument");

        List<String> debug = messages("debug");
        assertEquals(1, debug.size());
        assertTrue(debug.get(0).startsWith("message {} [took "));
        assertTrue(messages("trace").isEmpty());
    }

    @Test
    public void debugBelowThreshold() {
        when(logger.isDebugEnabled()).thenReturn(true);

        long start = perfLogger.start();
        perfLogger.end(start, 60_000, "message");

        assertTrue(messages("debug").isEmpty());
    }

    @Test
    public void traceAlwaysLogs() {
        when(logger.isDebugEnabled()).thenReturn(true);
        when(logger.isTraceEnabled()).thenReturn(true);

        long start = perfLogger.start("starting");
        perfLogger.end(start, 60_000, "message");

        List<String> trace = messages("trace");
        assertEquals(2, trace.size());
        assertEquals("starting", trace.get(0));
        assertTrue(trace.get(1).startsWith("message [took "));
        assertTrue(messages("debug").isEmpty());
    }

    private List<String> messages(String level) {
        List<String> result = new ArrayList<>();
        for (Invocation invocation : mockingDetails(logger).getInvocations()) {
            if (invocation.getMethod().getName().equals(level)) {
                result.add(String.valueOf(invocation.getArguments()[0]));
            }
        }
        return result;
    }
}
