/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.textmerge.commons.sort;

import static org.junit.Assert.assertEquals;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

public class MergeBufferPlanTest {

    private static final Path A = Paths.get("a.txt");
    private static final Path B = Paths.get("b.txt");
    private static final Path C = Paths.get("c.txt");

    @Test
    public void proportionalReadBuffers() {
        MergeBufferPlan plan = MergeBufferPlan.plan(1000, 0.2, sizes(100, 300));
        assertEquals(200, plan.getWriteBufferSize());
        assertEquals(200, plan.getReadBufferSize(A));
        assertEquals(600, plan.getReadBufferSize(B));
        assertEquals(1000, plan.getTotalSize());
    }

    @Test
    public void minimumSizes() {
        MergeBufferPlan plan = MergeBufferPlan.plan(10, 0.5, sizes(1, 1_000_000));
        assertEquals(5, plan.getWriteBufferSize());
        assertEquals(MergeBufferPlan.MIN_READ_BUFFER_SIZE, plan.getReadBufferSize(A));
        assertEquals(4, plan.getReadBufferSize(B));

        plan = MergeBufferPlan.plan(3, 0.1, sizes(10, 10, 10));
        assertEquals(MergeBufferPlan.MIN_WRITE_BUFFER_SIZE, plan.getWriteBufferSize());
        for (int size : plan.getReadBufferSizes().values()) {
            assertEquals(MergeBufferPlan.MIN_READ_BUFFER_SIZE, size);
        }
    }

    @Test
    public void emptySources() {
        MergeBufferPlan plan = MergeBufferPlan.plan(1000, 0.5, sizes(0, 0));
        assertEquals(500, plan.getWriteBufferSize());
        assertEquals(MergeBufferPlan.MIN_READ_BUFFER_SIZE, plan.getReadBufferSize(A));
        assertEquals(MergeBufferPlan.MIN_READ_BUFFER_SIZE, plan.getReadBufferSize(B));
    }

    @Test
    public void samePlanForSameInput() {
        MergeBufferPlan first = MergeBufferPlan.plan(4096, 0.3, sizes(17, 4711, 123456));
        MergeBufferPlan second = MergeBufferPlan.plan(4096, 0.3, sizes(17, 4711, 123456));
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertEquals(first.toString(), second.toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void ratioOne() {
        MergeBufferPlan.plan(1000, 1.0, sizes(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void ratioZero() {
        MergeBufferPlan.plan(1000, 0.0, sizes(1, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void singleSource() {
        MergeBufferPlan.plan(1000, 0.5, Collections.singletonMap(A, 10L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownSource() {
        MergeBufferPlan.plan(1000, 0.5, sizes(1, 2)).getReadBufferSize(C);
    }

    private static Map<Path, Long> sizes(long... sizes) {
        Path[] files = {A, B, C};
        Map<Path, Long> map = new LinkedHashMap<>();
        for (int i = 0; i < sizes.length; i++) {
            map.put(files[i], sizes[i]);
        }
        return map;
    }
}
