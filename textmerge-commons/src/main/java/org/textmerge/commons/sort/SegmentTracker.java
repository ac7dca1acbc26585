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

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

import org.jetbrains.annotations.NotNull;
import org.textmerge.commons.conditions.Validate;

/**
 * End of the still unconsumed part of a source file. Everything at or beyond
 * this offset has been turned into records and may be truncated.
 * <p>
 * Updated by the single reader of the source, read by the merging thread.
 * The value never grows.
 */
public final class SegmentTracker implements LongConsumer {

    private final Path file;
    private final AtomicLong end;

    public SegmentTracker(@NotNull Path file, long size) {
        Validate.checkArgument(size >= 0, "Size of %s must not be negative: %s", file, size);
        this.file = file;
        this.end = new AtomicLong(size);
    }

    @Override
    public void accept(long newEnd) {
        long current = end.get();
        Validate.checkState(newEnd >= 0 && newEnd <= current,
                "Segment of %s can only shrink: current end = %s, new end = %s", file, current, newEnd);
        end.set(newEnd);
    }

    public long get() {
        return end.get();
    }

    @Override
    public String toString() {
        return file + "[0, " + end.get() + ")";
    }
}
