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

import static java.nio.charset.StandardCharsets.UTF_8;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.textmerge.commons.conditions.Validate;
import org.textmerge.commons.io.AsyncRecordIterator;
import org.textmerge.commons.io.ByteOrderMarks;
import org.textmerge.commons.io.ReverseLineReader;
import org.textmerge.commons.properties.SystemPropertySupplier;

/**
 * Resolved settings of an inverse merge, see {@link InverseFileMerger}.
 * <p>
 * Buffers are either planned from a memory allowance ({@link Builder#allocatedMemory(int)},
 * {@link Builder#writeToTotalMemRatio(double)}) or supplied by the caller
 * ({@link Builder#buffers(Function, Function)}); whichever is set last wins.
 * <p>
 * Defaults can be tuned with the system properties
 * {@code textmerge.merge.allocatedMemory}, {@code textmerge.merge.writeRatio}
 * and {@code textmerge.reader.queueSize}.
 */
public final class MergeOptions {

    private static final Logger LOG = LoggerFactory.getLogger(MergeOptions.class);

    public static final int DEFAULT_ALLOCATED_MEMORY = SystemPropertySupplier
            .create("textmerge.merge.allocatedMemory", 2 * MergeBufferPlan.DEFAULT_BUFFER_SIZE)
            .loggingTo(LOG).validateWith(v -> v > 0).get();

    public static final double DEFAULT_WRITE_RATIO = SystemPropertySupplier
            .create("textmerge.merge.writeRatio", 0.5)
            .loggingTo(LOG).validateWith(v -> v > 0.0 && v < 1.0).get();

    public static final int DEFAULT_QUEUE_SIZE = SystemPropertySupplier
            .create("textmerge.reader.queueSize", 1000)
            .loggingTo(LOG).validateWith(v -> v > 0).get();

    public static final long DEFAULT_START_TIMEOUT_MS = SystemPropertySupplier
            .create("textmerge.reader.startTimeoutMs", AsyncRecordIterator.DEFAULT_START_TIMEOUT_MS)
            .loggingTo(LOG).validateWith(v -> v > 0).get();

    private final Comparator<byte[]> comparator;
    private final byte[] delimiter;
    private final byte[] bom;
    private final int allocatedMemory;
    private final double writeRatio;
    private final Function<Path, ByteBuffer> sourceBuffer;
    private final Function<Path, ByteBuffer> targetBuffer;
    private final boolean controlDiskSpace;
    private final ExecutorService executor;
    private final int queueSize;
    private final int maxRecordLength;
    private final long startTimeoutMs;

    private MergeOptions(Builder b, Comparator<byte[]> comparator, byte[] delimiter, byte[] bom) {
        this.comparator = comparator;
        this.delimiter = delimiter;
        this.bom = bom;
        this.allocatedMemory = b.allocatedMemory;
        this.writeRatio = b.writeRatio;
        this.sourceBuffer = b.sourceBuffer;
        this.targetBuffer = b.targetBuffer;
        this.controlDiskSpace = b.controlDiskSpace;
        this.executor = b.executor;
        this.queueSize = b.queueSize;
        this.maxRecordLength = b.maxRecordLength;
        this.startTimeoutMs = b.startTimeoutMs;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the default options: reverse UTF-8 string order, {@code "\n"} delimiter, no byte order mark
     */
    @NotNull
    public static MergeOptions defaults() {
        return builder().build();
    }

    @NotNull
    public Comparator<byte[]> getComparator() {
        return comparator;
    }

    @NotNull
    public byte[] getDelimiter() {
        return delimiter.clone();
    }

    @NotNull
    public byte[] getBom() {
        return bom.clone();
    }

    public int getAllocatedMemory() {
        return allocatedMemory;
    }

    public double getWriteRatio() {
        return writeRatio;
    }

    /**
     * @return {@code true} if the buffers are supplied by the caller instead of being planned
     */
    public boolean hasBufferProviders() {
        return sourceBuffer != null;
    }

    @Nullable
    public Function<Path, ByteBuffer> getSourceBuffer() {
        return sourceBuffer;
    }

    @Nullable
    public Function<Path, ByteBuffer> getTargetBuffer() {
        return targetBuffer;
    }

    public boolean isControlDiskSpace() {
        return controlDiskSpace;
    }

    /**
     * @return the executor of the source readers, or {@code null} to use a private one
     */
    @Nullable
    public ExecutorService getExecutor() {
        return executor;
    }

    public int getQueueSize() {
        return queueSize;
    }

    public int getMaxRecordLength() {
        return maxRecordLength;
    }

    public long getStartTimeoutMs() {
        return startTimeoutMs;
    }

    public static final class Builder {
        private Comparator<byte[]> comparator;
        private Comparator<String> stringComparator;
        private byte[] delimiter;
        private String stringDelimiter = "\n";
        private Charset charset = UTF_8;
        private byte[] bom;
        private int allocatedMemory = DEFAULT_ALLOCATED_MEMORY;
        private double writeRatio = DEFAULT_WRITE_RATIO;
        private Function<Path, ByteBuffer> sourceBuffer;
        private Function<Path, ByteBuffer> targetBuffer;
        private boolean controlDiskSpace;
        private ExecutorService executor;
        private int queueSize = DEFAULT_QUEUE_SIZE;
        private int maxRecordLength = ReverseLineReader.DEFAULT_MAX_RECORD_LENGTH;
        private long startTimeoutMs = DEFAULT_START_TIMEOUT_MS;

        private Builder() {
        }

        /**
         * Order of the records as they are read, i.e. from the end of each
         * source: the reverse of the order the sources are sorted in.
         */
        public Builder comparator(@NotNull Comparator<byte[]> comparator) {
            this.comparator = Objects.requireNonNull(comparator);
            this.stringComparator = null;
            return this;
        }

        /**
         * Same as {@link #comparator(Comparator)} for decoded records, see
         * {@link #charset(Charset)}.
         */
        public Builder stringComparator(@NotNull Comparator<String> comparator) {
            this.stringComparator = Objects.requireNonNull(comparator);
            this.comparator = null;
            return this;
        }

        public Builder delimiter(@NotNull byte[] delimiter) {
            this.delimiter = Objects.requireNonNull(delimiter).clone();
            this.stringDelimiter = null;
            return this;
        }

        /**
         * The delimiter as text, encoded with the {@link #charset(Charset) charset}.
         */
        public Builder delimiter(@NotNull String delimiter) {
            this.stringDelimiter = Objects.requireNonNull(delimiter);
            this.delimiter = null;
            return this;
        }

        /**
         * Charset used for string comparators and delimiters, and for the
         * byte order mark unless {@link #bom(byte[])} is given.
         */
        public Builder charset(@NotNull Charset charset) {
            this.charset = Objects.requireNonNull(charset);
            return this;
        }

        public Builder bom(@NotNull byte[] bom) {
            this.bom = Objects.requireNonNull(bom).clone();
            return this;
        }

        public Builder allocatedMemory(int allocatedMemory) {
            this.allocatedMemory = allocatedMemory;
            this.sourceBuffer = null;
            this.targetBuffer = null;
            return this;
        }

        public Builder writeToTotalMemRatio(double writeRatio) {
            this.writeRatio = writeRatio;
            this.sourceBuffer = null;
            this.targetBuffer = null;
            return this;
        }

        /**
         * Caller supplied buffers; direct buffers are preferred.
         *
         * @param sourceBuffer read buffer of a source, at least {@link MergeBufferPlan#MIN_READ_BUFFER_SIZE} bytes
         * @param targetBuffer write buffer of the target, at least {@link MergeBufferPlan#MIN_WRITE_BUFFER_SIZE} bytes
         */
        public Builder buffers(@NotNull Function<Path, ByteBuffer> sourceBuffer,
                               @NotNull Function<Path, ByteBuffer> targetBuffer) {
            this.sourceBuffer = Objects.requireNonNull(sourceBuffer);
            this.targetBuffer = Objects.requireNonNull(targetBuffer);
            return this;
        }

        /**
         * If {@code true} sources are truncated while they are merged and
         * deleted at the end. Saves disk space, takes more time.
         */
        public Builder controlDiskSpace(boolean controlDiskSpace) {
            this.controlDiskSpace = controlDiskSpace;
            return this;
        }

        /**
         * Executor of the source readers. It must be able to run one task per
         * source at the same time; it is not shut down by the merge.
         */
        public Builder executor(@Nullable ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder queueSize(int queueSize) {
            this.queueSize = queueSize;
            return this;
        }

        public Builder maxRecordLength(int maxRecordLength) {
            this.maxRecordLength = maxRecordLength;
            return this;
        }

        /**
         * How long a source reader may wait for the executor to start it before
         * the merge fails.
         */
        public Builder startTimeout(long timeout, @NotNull TimeUnit unit) {
            this.startTimeoutMs = unit.toMillis(timeout);
            return this;
        }

        @NotNull
        public MergeOptions build() {
            Validate.checkArgument(queueSize > 0, "Queue size must be positive: %s", queueSize);
            Validate.checkArgument(startTimeoutMs > 0, "Start timeout must be positive: %s ms", startTimeoutMs);
            Validate.checkArgument(maxRecordLength > 0, "Max record length must be positive: %s", maxRecordLength);
            Comparator<byte[]> cmp = comparator;
            if (cmp == null) {
                cmp = stringComparator != null
                        ? ByteArrayComparators.fromStringComparator(stringComparator, charset)
                        : ByteArrayComparators.stringComparator(charset).reversed();
            }
            byte[] delim = delimiter != null ? delimiter : ByteOrderMarks.encode(stringDelimiter, charset);
            Validate.checkArgument(delim.length > 0, "Delimiter must not be empty");
            byte[] mark = bom != null ? bom : ByteOrderMarks.bomOf(charset);
            return new MergeOptions(this, cmp, delim, mark);
        }
    }
}
