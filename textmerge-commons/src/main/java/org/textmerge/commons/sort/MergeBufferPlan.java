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

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.textmerge.commons.conditions.Validate;

import com.google.common.base.MoreObjects;

/**
 * Splits a memory allowance into the write buffer and the read buffers of a
 * merge.
 * <p>
 * {@code allocatedMemory * writeRatio} bytes go to the write buffer, the rest
 * is shared by the sources proportionally to their sizes:
 * {@code readBudget * size(i) / (size(1) + ... + size(N))}. Every buffer gets
 * at least its minimum size, so with many small sources the total may exceed
 * the allowance.
 */
public final class MergeBufferPlan {

    public static final int MIN_WRITE_BUFFER_SIZE = 2;

    public static final int MIN_READ_BUFFER_SIZE = 2;

    /**
     * Size of a buffer when nothing else is specified.
     */
    public static final int DEFAULT_BUFFER_SIZE = 8192;

    private final int writeBufferSize;
    private final Map<Path, Integer> readBufferSizes;

    private MergeBufferPlan(int writeBufferSize, Map<Path, Integer> readBufferSizes) {
        this.writeBufferSize = writeBufferSize;
        this.readBufferSizes = Collections.unmodifiableMap(readBufferSizes);
    }

    /**
     * Plans the buffers for sources of the given sizes.
     *
     * @param allocatedMemory the number of bytes to share
     * @param writeRatio the part of the allowance reserved for writing, in {@code (0, 1)}
     * @param sourceSizes the sizes of the sources in bytes, at least two
     * @return the plan
     * @throws IllegalArgumentException if the ratio is out of range or there are fewer than two sources
     */
    @NotNull
    public static MergeBufferPlan plan(int allocatedMemory, double writeRatio, @NotNull Map<Path, Long> sourceSizes) {
        Validate.checkArgument(sourceSizes.size() > 1,
                "Number of given sources (%s) must be greater than 1", sourceSizes.size());
        Validate.checkArgument(writeRatio > 0.0 && writeRatio < 1.0,
                "Write to total memory ratio must be in (0, 1): %s", writeRatio);
        Validate.checkArgument(allocatedMemory > 0, "Allocated memory must be positive: %s", allocatedMemory);

        int writeBufferSize = Math.max((int) (allocatedMemory * writeRatio), MIN_WRITE_BUFFER_SIZE);
        int readBuffersSize = Math.max(allocatedMemory - writeBufferSize, MIN_READ_BUFFER_SIZE);
        long filesSize = 0;
        for (long size : sourceSizes.values()) {
            filesSize += size;
        }
        double readFilesSizeRatio = filesSize == 0 ? 0 : (double) readBuffersSize / filesSize;

        Map<Path, Integer> readBufferSizes = new LinkedHashMap<>();
        sourceSizes.forEach((file, size) ->
                readBufferSizes.put(file, Math.max((int) (readFilesSizeRatio * size), MIN_READ_BUFFER_SIZE)));
        return new MergeBufferPlan(writeBufferSize, readBufferSizes);
    }

    public int getWriteBufferSize() {
        return writeBufferSize;
    }

    /**
     * @return the read buffer sizes by source, in the order the sources were given
     */
    @NotNull
    public Map<Path, Integer> getReadBufferSizes() {
        return readBufferSizes;
    }

    public int getReadBufferSize(@NotNull Path source) {
        Integer size = readBufferSizes.get(source);
        Validate.checkArgument(size != null, "Unknown source %s", source);
        return size;
    }

    /**
     * @return the sum of all buffer sizes
     */
    public long getTotalSize() {
        long total = writeBufferSize;
        for (int size : readBufferSizes.values()) {
            total += size;
        }
        return total;
    }

    static void checkReadBuffer(@NotNull ByteBuffer buffer) {
        if (buffer.capacity() < MIN_READ_BUFFER_SIZE) {
            throw new BufferTooSmallException("read", buffer.capacity(), MIN_READ_BUFFER_SIZE);
        }
    }

    static void checkWriteBuffer(@NotNull ByteBuffer buffer) {
        if (buffer.capacity() < MIN_WRITE_BUFFER_SIZE) {
            throw new BufferTooSmallException("write", buffer.capacity(), MIN_WRITE_BUFFER_SIZE);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MergeBufferPlan)) {
            return false;
        }
        MergeBufferPlan that = (MergeBufferPlan) o;
        return writeBufferSize == that.writeBufferSize && readBufferSizes.equals(that.readBufferSizes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(writeBufferSize, readBufferSizes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("writeBufferSize", writeBufferSize)
                .add("readBufferSizes", readBufferSizes)
                .toString();
    }
}
