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

import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.textmerge.commons.collect.MergingIterator;
import org.textmerge.commons.concurrent.ExecutorCloser;
import org.textmerge.commons.conditions.Validate;
import org.textmerge.commons.io.AsyncRecordIterator;
import org.textmerge.commons.io.ReverseLineReader;
import org.textmerge.commons.io.ScanFailure;
import org.textmerge.commons.io.SourceScanException;

import com.google.common.base.Stopwatch;
import com.google.common.io.Closer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Merges sorted files into a single one with a fixed allocation.
 * <p>
 * Sources are read from their end to their beginning, so the comparator must
 * be the reverse of the order the sources are sorted in, e.g.
 * {@code (a, b) -> b.compareTo(a)} for ascending sources. The target content
 * is in that reverse order: if {@code a < d < b < e < c < f} then
 * {@code a, b, c} + {@code d, e, f} = {@code f, c, e, b, d, a}.
 * {@link org.textmerge.commons.FileMergeUtils#invert(Path, Path, byte[], byte[], int)}
 * rewrites it in direct order.
 * <p>
 * Every source is read by its own task into a small queue; the calling thread
 * merges the queues, writes the target and, if
 * {@link MergeOptions#isControlDiskSpace() disk space control} is on,
 * truncates the sources after every record and deletes them at the end. The
 * first failing reader closes all sources and cancels the other readers; the
 * call then fails with a {@link SourceScanException}. The target is not
 * rolled back.
 * <p>
 * A caller supplied executor must run one reader per source at the same time.
 * A {@code ThreadPoolExecutor} that cannot is rejected up front; with other
 * executors a reader that is not started within
 * {@link MergeOptions#getStartTimeoutMs() the start timeout} fails the merge.
 */
public final class InverseFileMerger {

    private static final Logger LOG = LoggerFactory.getLogger(InverseFileMerger.class);

    private InverseFileMerger() {
    }

    /**
     * Merges the sources into the target, which is created or truncated.
     *
     * @param sources at least two distinct files, each sorted in the reverse of the comparator order
     * @param target the file to write
     * @param options the merge settings
     * @throws IllegalArgumentException on invalid settings or an executor with too few threads, before any I/O
     * @throws BufferTooSmallException if a buffer is below its minimum, before any I/O
     * @throws SourceScanException if reading a source failed
     * @throws IOException if writing the target or truncating a source failed
     */
    public static void merge(@NotNull Set<Path> sources, @NotNull Path target, @NotNull MergeOptions options)
            throws IOException {
        Validate.checkArgument(sources.size() > 1,
                "Number of given sources (%s) must be greater than 1", sources.size());
        Validate.checkArgument(!sources.contains(target), "Target %s must not be one of the sources", target);

        Map<Path, Long> sizes = new LinkedHashMap<>();
        for (Path source : sources) {
            sizes.put(source, Files.size(source));
        }

        Function<Path, ByteBuffer> sourceBuffer = options.getSourceBuffer();
        Function<Path, ByteBuffer> targetBuffer = options.getTargetBuffer();
        if (!options.hasBufferProviders()) {
            MergeBufferPlan plan = MergeBufferPlan.plan(options.getAllocatedMemory(), options.getWriteRatio(), sizes);
            LOG.debug("Buffers for merging {} into {}: {}", sources, target, plan);
            sourceBuffer = file -> ByteBuffer.allocateDirect(plan.getReadBufferSize(file));
            targetBuffer = file -> ByteBuffer.allocateDirect(plan.getWriteBufferSize());
        }
        Map<Path, ByteBuffer> readBuffers = new LinkedHashMap<>();
        for (Path source : sources) {
            ByteBuffer buffer = sourceBuffer.apply(source);
            MergeBufferPlan.checkReadBuffer(buffer);
            readBuffers.put(source, buffer);
        }
        ByteBuffer writeBuffer = targetBuffer.apply(target);
        MergeBufferPlan.checkWriteBuffer(writeBuffer);

        Map<Path, SegmentTracker> trackers = new LinkedHashMap<>();
        sizes.forEach((file, size) -> trackers.put(file, new SegmentTracker(file, size)));

        ExecutorService executor = options.getExecutor();
        if (executor == null) {
            executor = newReaderExecutor();
        } else {
            checkExecutor(executor, sources.size());
        }

        Stopwatch w = Stopwatch.createStarted();
        Closer closer = Closer.create();
        TargetWriter writer;
        DiskReclaimer reclaimer = null;
        try {
            if (options.getExecutor() == null) {
                closer.register(new ExecutorCloser(executor));
            }
            Map<Path, FileChannel> channels = new LinkedHashMap<>();
            for (Path source : sources) {
                channels.put(source, closer.register(options.isControlDiskSpace()
                        ? FileChannel.open(source, READ, WRITE)
                        : FileChannel.open(source, READ)));
            }
            FileChannel out = closer.register(FileChannel.open(target, CREATE, TRUNCATE_EXISTING, WRITE));

            List<AsyncRecordIterator<byte[]>> inputs = new CopyOnWriteArrayList<>();
            ScanFailure failure = new ScanFailure();
            failure.onFailure(() -> {
                inputs.forEach(AsyncRecordIterator::close);
                Closer sourceCloser = Closer.create();
                channels.values().forEach(sourceCloser::register);
                try {
                    sourceCloser.close();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            int bomLength = options.getBom().length;
            for (Path source : sources) {
                SegmentTracker tracker = trackers.get(source);
                ReverseLineReader reader = new ReverseLineReader(channels.get(source), bomLength, tracker.get(),
                        readBuffers.get(source), options.getDelimiter(), tracker, options.getMaxRecordLength());
                inputs.add(closer.register(new AsyncRecordIterator<>(source.toString(), reader, executor,
                        options.getQueueSize(), failure, options.getStartTimeoutMs())));
            }

            if (options.isControlDiskSpace()) {
                reclaimer = new DiskReclaimer(channels, trackers, bomLength);
            }
            writer = new TargetWriter(out, writeBuffer, options.getDelimiter());
            try {
                writer.writeBom(options.getBom());
                Iterator<byte[]> merged = new MergingIterator<>(inputs, options.getComparator());
                while (merged.hasNext()) {
                    writer.write(merged.next());
                    if (reclaimer != null) {
                        reclaimer.truncate();
                    }
                }
                writer.flush();
                if (reclaimer != null) {
                    reclaimer.truncate();
                }
            } catch (IOException | RuntimeException e) {
                // a closed source is a consequence of the reader failure, not its cause
                SourceScanException scanFailure = failure.awaitReported();
                if (scanFailure != null && scanFailure != e) {
                    scanFailure.addSuppressed(e);
                    throw scanFailure;
                }
                throw e;
            }
        } catch (Throwable t) {
            throw closer.rethrow(t);
        } finally {
            closer.close();
        }

        if (reclaimer != null) {
            reclaimer.deleteDrained();
        }
        LOG.info("Merged {} records of {} files into {} ({} bytes) in {}",
                writer.getRecordCount(), sources.size(), target, writer.getByteCount(), w);
    }

    private static ExecutorService newReaderExecutor() {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("merge-files-inverse-%d")
                .setDaemon(true)
                .build());
    }

    private static void checkExecutor(ExecutorService executor, int sources) {
        if (!(executor instanceof ThreadPoolExecutor)) {
            return;
        }
        ThreadPoolExecutor pool = (ThreadPoolExecutor) executor;
        // tasks beyond the core size wait in the queue unless it hands them over directly
        int concurrency = pool.getQueue().remainingCapacity() == 0
                ? pool.getMaximumPoolSize()
                : pool.getCorePoolSize();
        Validate.checkArgument(concurrency >= sources,
                "Executor %s runs %s tasks at a time, the merge of %s sources needs one per source",
                executor, concurrency, sources);
    }
}
