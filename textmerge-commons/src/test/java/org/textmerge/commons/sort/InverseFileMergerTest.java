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

import static java.nio.charset.StandardCharsets.UTF_16;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.textmerge.commons.FileMergeUtils;
import org.textmerge.commons.concurrent.ExecutorCloser;
import org.textmerge.commons.io.SourceScanException;
import org.textmerge.commons.junit.LogCustomizer;

import ch.qos.logback.classic.Level;

import com.google.common.util.concurrent.ForwardingFuture;

public class InverseFileMergerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder(new File("target"));

    @Test
    public void mergeDescending() throws Exception {
        Set<Path> sources = sources(write("b\nd\nf"), write("a\nc\ne"));
        Path target = target();

        InverseFileMerger.merge(sources, target, MergeOptions.defaults());
        assertEquals("f\ne\nd\nc\nb\na", read(target));

        Path direct = target();
        FileMergeUtils.invert(target, direct, UTF_8);
        assertEquals("a\nb\nc\nd\ne\nf", read(direct));
    }

    @Test
    public void sourcesAreKeptByDefault() throws Exception {
        Path a = write("b\nd\nf");
        Path b = write("a\nc\ne");
        InverseFileMerger.merge(sources(a, b), target(), MergeOptions.defaults());
        assertEquals("b\nd\nf", read(a));
        assertEquals("a\nc\ne", read(b));
    }

    @Test
    public void prefixSource() throws Exception {
        Path target = target();
        InverseFileMerger.merge(sources(write("a\nb\nc"), write("a\nb")), target, MergeOptions.defaults());
        String merged = read(target);
        assertEquals("c\nb\nb\na\na", merged);
        assertEquals(5, merged.split("\n", -1).length);
    }

    @Test
    public void emptyRecordsAreFramed() throws Exception {
        Path target = target();
        InverseFileMerger.merge(sources(write("\nb"), write("\na")), target, MergeOptions.defaults());
        assertEquals("b\na\n\n", read(target));
    }

    @Test
    public void emptySources() throws Exception {
        Path target = target();
        InverseFileMerger.merge(sources(write(""), write(""), write("x")), target, MergeOptions.defaults());
        assertEquals("x", read(target));
    }

    @Test
    public void tinyBuffers() throws Exception {
        Path target = target();
        MergeOptions options = MergeOptions.builder()
                .delimiter("\r\n")
                .buffers(p -> ByteBuffer.allocate(MergeBufferPlan.MIN_READ_BUFFER_SIZE),
                        p -> ByteBuffer.allocate(MergeBufferPlan.MIN_WRITE_BUFFER_SIZE))
                .queueSize(1)
                .build();
        InverseFileMerger.merge(sources(write("aaa\r\nccc\r\neee"), write("\r\nbb\r\ndddd")), target, options);
        assertEquals("eee\r\ndddd\r\nccc\r\nbb\r\naaa\r\n", read(target));
    }

    @Test
    public void randomFilesRoundTrip() throws Exception {
        Random random = new Random(42);
        List<String> all = new ArrayList<>();
        Set<Path> sources = new LinkedHashSet<>();
        for (int count : new int[] {1, 2, 10, 1000, 3, 250, 40}) {
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                lines.add(randomLine(random));
            }
            all.addAll(lines);
            Collections.sort(lines);
            sources.add(write(String.join("\n", lines)));
        }
        Path target = target();
        MergeOptions options = MergeOptions.builder()
                .allocatedMemory(64)
                .writeToTotalMemRatio(0.25)
                .queueSize(2)
                .build();
        InverseFileMerger.merge(sources, target, options);

        all.sort(Comparator.reverseOrder());
        assertEquals(String.join("\n", all), read(target));

        Path direct = target();
        FileMergeUtils.invert(target, direct, UTF_8);
        Collections.reverse(all);
        assertEquals(String.join("\n", all), read(direct));
    }

    @Test
    public void controlDiskSpace() throws Exception {
        Random random = new Random(7);
        Map<Path, Long> lastSizes = new LinkedHashMap<>();
        List<String> all = new ArrayList<>();
        for (int f = 0; f < 3; f++) {
            List<String> lines = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                lines.add(randomLine(random));
            }
            all.addAll(lines);
            Collections.sort(lines);
            Path source = write(String.join("\n", lines));
            lastSizes.put(source, Files.size(source));
        }
        Map<Path, Long> initialSizes = new LinkedHashMap<>(lastSizes);
        List<String> violations = new ArrayList<>();

        // sizes are sampled on the merging thread, which is the only one truncating
        Comparator<byte[]> order = ByteArrayComparators.stringComparator(UTF_8).reversed();
        Comparator<byte[]> sampling = (a, b) -> {
            for (Map.Entry<Path, Long> e : lastSizes.entrySet()) {
                long size = size(e.getKey());
                if (size > e.getValue()) {
                    violations.add(e.getKey() + " grew from " + e.getValue() + " to " + size);
                }
                e.setValue(size);
            }
            return order.compare(a, b);
        };

        Path target = target();
        InverseFileMerger.merge(new LinkedHashSet<>(lastSizes.keySet()), target, MergeOptions.builder()
                .comparator(sampling)
                .allocatedMemory(256)
                .queueSize(4)
                .controlDiskSpace(true)
                .build());

        assertEquals(Collections.emptyList(), violations);
        for (Path source : lastSizes.keySet()) {
            assertFalse(source + " must be deleted", Files.exists(source));
            assertTrue(lastSizes.get(source) < initialSizes.get(source));
        }
        all.sort(Comparator.reverseOrder());
        assertEquals(String.join("\n", all), read(target));
    }

    @Test
    public void byteOrderMark() throws Exception {
        Path a = write("b\nd\nf", UTF_16);
        Path b = write("a\nc\ne", UTF_16);
        Path target = target();
        InverseFileMerger.merge(sources(a, b), target, MergeOptions.builder()
                .charset(UTF_16)
                .stringComparator(Comparator.reverseOrder())
                .allocatedMemory(16)
                .controlDiskSpace(true)
                .build());

        byte[] merged = Files.readAllBytes(target);
        assertArrayEquals(new byte[] {-2, -1}, Arrays.copyOf(merged, 2));
        assertEquals("f\ne\nd\nc\nb\na", new String(merged, UTF_16));
        assertFalse(Files.exists(a));
        assertFalse(Files.exists(b));

        Path direct = target();
        FileMergeUtils.invert(target, direct, UTF_16);
        assertEquals("a\nb\nc\nd\ne\nf", new String(Files.readAllBytes(direct), UTF_16));
    }

    @Test
    public void readBufferTooSmall() throws Exception {
        Path a = write("a");
        Path target = folder.getRoot().toPath().resolve("never-written.txt");
        try {
            InverseFileMerger.merge(sources(a, write("b")), target, MergeOptions.builder()
                    .buffers(p -> ByteBuffer.allocate(1), p -> ByteBuffer.allocate(16))
                    .build());
            fail("read buffer below the minimum must be rejected");
        } catch (BufferTooSmallException e) {
            assertEquals(1, e.getCapacity());
            assertEquals(MergeBufferPlan.MIN_READ_BUFFER_SIZE, e.getMinimum());
        }
        assertFalse(Files.exists(target));
        assertEquals("a", read(a));
    }

    @Test
    public void writeBufferTooSmall() throws Exception {
        Path target = folder.getRoot().toPath().resolve("never-written.txt");
        try {
            InverseFileMerger.merge(sources(write("a"), write("b")), target, MergeOptions.builder()
                    .buffers(p -> ByteBuffer.allocate(16), p -> ByteBuffer.allocate(0))
                    .build());
            fail("write buffer below the minimum must be rejected");
        } catch (BufferTooSmallException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("write"));
        }
        assertFalse(Files.exists(target));
    }

    @Test(expected = IllegalArgumentException.class)
    public void singleSource() throws Exception {
        InverseFileMerger.merge(Collections.singleton(write("a")), target(), MergeOptions.defaults());
    }

    @Test
    public void invalidRatio() throws Exception {
        Path target = folder.getRoot().toPath().resolve("never-written.txt");
        try {
            InverseFileMerger.merge(sources(write("a"), write("b")), target,
                    MergeOptions.builder().writeToTotalMemRatio(1.5).build());
            fail("ratio outside (0, 1) must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("ratio"));
        }
        assertFalse(Files.exists(target));
    }

    @Test(expected = IllegalArgumentException.class)
    public void targetIsSource() throws Exception {
        Path a = write("a");
        InverseFileMerger.merge(sources(a, write("b")), a, MergeOptions.defaults());
    }

    @Test(timeout = 30000)
    public void sourceScanFailure() throws Exception {
        Path good = write("a\nb\nc");
        Path bad = write("this-record-is-too-long\nz");
        try {
            InverseFileMerger.merge(sources(good, bad), target(), MergeOptions.builder()
                    .maxRecordLength(4)
                    .queueSize(1)
                    .controlDiskSpace(true)
                    .build());
            fail("malformed source must fail the merge");
        } catch (SourceScanException e) {
            assertEquals(bad.toString(), e.getSource());
            assertTrue(e.getCause() instanceof UncheckedIOException);
        }
        assertTrue(Files.exists(good));
        assertTrue(Files.exists(bad));
    }

    @Test
    public void callerExecutorStaysOpen() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Path target = target();
            InverseFileMerger.merge(sources(write("c"), write("a"), write("b")), target,
                    MergeOptions.builder().executor(executor).build());
            assertEquals("c\nb\na", read(target));
            assertFalse(executor.isShutdown());
        } finally {
            new ExecutorCloser(executor).close();
        }
    }

    @Test
    public void executorWithTooFewThreads() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(1);
        Path target = folder.getRoot().toPath().resolve("never-written.txt");
        try {
            InverseFileMerger.merge(sources(write("a"), write("b")), target,
                    MergeOptions.builder().executor(executor).build());
            fail("executor running fewer readers than sources must be rejected");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("needs one per source"));
        } finally {
            new ExecutorCloser(executor).close();
        }
        assertFalse(Files.exists(target));
    }

    @Test(timeout = 30000)
    public void readerNeverStarted() throws Exception {
        // not a ThreadPoolExecutor, so its size cannot be checked up front
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Path a = write("a\nb\nc\nd");
        Path b = write("e\nf\ng\nh");
        try {
            InverseFileMerger.merge(sources(a, b), target(), MergeOptions.builder()
                    .executor(executor)
                    .queueSize(1)
                    .startTimeout(200, TimeUnit.MILLISECONDS)
                    .build());
            fail("reader waiting for a busy executor must fail the merge");
        } catch (SourceScanException e) {
            assertEquals(b.toString(), e.getSource());
            assertTrue(e.getCause() instanceof IllegalStateException);
            assertTrue(e.getMessage(), e.getMessage().contains("not started within 200 ms"));
        } finally {
            new ExecutorCloser(executor).close();
        }
        assertEquals("a\nb\nc\nd", read(a));
    }

    @Test(timeout = 30000)
    public void failureCancelsOtherReaders() throws Exception {
        List<String> healthyLines = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            healthyLines.add(String.format("h%05d", i));
        }
        Path healthy = write(String.join("\n", healthyLines));
        // read from the end: the malformed first record is reached after all others were merged
        List<String> failingLines = new ArrayList<>();
        failingLines.add("!!!-record-longer-than-allowed");
        for (int i = 0; i < 1000; i++) {
            failingLines.add(String.format("x%05d", i));
        }
        Path failing = write(String.join("\n", failingLines));
        Path target = target();

        RecordingExecutor executor = new RecordingExecutor();
        String mergeThread = Thread.currentThread().getName();
        try {
            InverseFileMerger.merge(sources(healthy, failing), target, MergeOptions.builder()
                    .executor(executor)
                    .queueSize(1)
                    .maxRecordLength(6)
                    .allocatedMemory(64)
                    .build());
            fail("malformed source must fail the merge");
        } catch (SourceScanException e) {
            assertEquals(failing.toString(), e.getSource());
        } finally {
            new ExecutorCloser(executor).close();
        }

        CancelRecordingFuture<?> healthyReader = executor.tasks.get(0);
        assertTrue(healthyReader.isCancelled());
        assertNotNull(healthyReader.cancelledBy);
        assertNotEquals("reader must be cancelled by the failing reader, not by the final cleanup",
                mergeThread, healthyReader.cancelledBy);

        // records merged before the failure stay in the target
        String merged = read(target);
        assertTrue(merged.length() > 100);
        assertTrue(merged.startsWith("x00999\nx00998\nx00997\n"));
        assertEquals(String.join("\n", healthyLines), read(healthy));
    }

    @Test
    public void logsSummary() throws Exception {
        LogCustomizer logs = LogCustomizer.forLogger(InverseFileMerger.class.getName())
                .enable(Level.INFO)
                .contains("Merged 6 records of 2 files")
                .create();
        logs.starting();
        try {
            InverseFileMerger.merge(sources(write("b\nd\nf"), write("a\nc\ne")), target(), MergeOptions.defaults());
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    private static final class RecordingExecutor extends ThreadPoolExecutor {

        final List<CancelRecordingFuture<?>> tasks = new CopyOnWriteArrayList<>();

        RecordingExecutor() {
            super(0, Integer.MAX_VALUE, 60, TimeUnit.SECONDS, new SynchronousQueue<>());
        }

        @Override
        public Future<?> submit(Runnable task) {
            CancelRecordingFuture<?> future = CancelRecordingFuture.of(super.submit(task));
            tasks.add(future);
            return future;
        }
    }

    private static final class CancelRecordingFuture<V> extends ForwardingFuture.SimpleForwardingFuture<V> {

        volatile String cancelledBy;

        private CancelRecordingFuture(Future<V> delegate) {
            super(delegate);
        }

        static <V> CancelRecordingFuture<V> of(Future<V> delegate) {
            return new CancelRecordingFuture<>(delegate);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (cancelledBy == null) {
                cancelledBy = Thread.currentThread().getName();
            }
            return super.cancel(mayInterruptIfRunning);
        }
    }

    private static String randomLine(Random random) {
        int length = 1 + random.nextInt(12);
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append((char) ('a' + random.nextInt(26)));
        }
        return sb.toString();
    }

    private static long size(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Set<Path> sources(Path... files) {
        return new LinkedHashSet<>(Arrays.asList(files));
    }

    private Path target() throws IOException {
        return folder.newFile().toPath();
    }

    private Path write(String content) throws IOException {
        return write(content, UTF_8);
    }

    private Path write(String content, Charset charset) throws IOException {
        Path file = folder.newFile().toPath();
        Files.write(file, content.getBytes(charset));
        return file;
    }

    private static String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), UTF_8);
    }
}
