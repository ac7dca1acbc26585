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
package org.textmerge.commons;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Set;

import org.apache.commons.io.FileUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.textmerge.commons.conditions.Validate;
import org.textmerge.commons.io.ByteOrderMarks;
import org.textmerge.commons.io.ReverseLineReader;
import org.textmerge.commons.sort.InverseFileMerger;
import org.textmerge.commons.sort.MergeBufferPlan;
import org.textmerge.commons.sort.MergeOptions;
import org.textmerge.commons.sort.TargetWriter;

import com.google.common.io.Closer;

/**
 * Simple entry points for merging sorted files and for restoring the direct
 * order of a merge result.
 */
public final class FileMergeUtils {

    private static final Logger LOG = LoggerFactory.getLogger(FileMergeUtils.class);

    private FileMergeUtils() {
    }

    /**
     * Merges files sorted in ascending UTF-8 string order, separated by
     * {@code "\n"}. The target is in descending order.
     *
     * @param sources files to merge
     * @param target merge output file
     * @throws IOException
     */
    public static void mergeFilesInverse(@NotNull Set<Path> sources, @NotNull Path target) throws IOException {
        InverseFileMerger.merge(sources, target, MergeOptions.defaults());
    }

    /**
     * Merges text files with the given comparator, delimiter and charset.
     *
     * @param sources files to merge
     * @param target merge output file
     * @param comparator reverse of the order the sources are sorted in
     * @param delimiter line delimiter
     * @param charset charset of the files, also defines the byte order mark
     * @param allocatedMemorySizeInBytes approximate memory to use for buffers
     * @param controlDiskSpace if {@code true} sources are truncated while merging and deleted at the end
     * @throws IOException
     */
    public static void mergeFilesInverse(@NotNull Set<Path> sources, @NotNull Path target,
                                         @NotNull Comparator<String> comparator, @NotNull String delimiter,
                                         @NotNull Charset charset, int allocatedMemorySizeInBytes,
                                         boolean controlDiskSpace) throws IOException {
        InverseFileMerger.merge(sources, target, MergeOptions.builder()
                .stringComparator(comparator)
                .delimiter(delimiter)
                .charset(charset)
                .allocatedMemory(allocatedMemorySizeInBytes)
                .controlDiskSpace(controlDiskSpace)
                .build());
    }

    /**
     * Merges files of raw records.
     *
     * @param sources files to merge
     * @param target merge output file
     * @param comparator reverse of the order the sources are sorted in
     * @param delimiter record delimiter, e.g. for UTF-16 {@code " " = [0, 32]}
     * @param bom byte order mark, e.g. for UTF-16 {@code [-2, -1]}
     * @param controlDiskSpace if {@code true} sources are truncated while merging and deleted at the end
     * @throws IOException
     */
    public static void mergeFilesInverse(@NotNull Set<Path> sources, @NotNull Path target,
                                         @NotNull Comparator<byte[]> comparator, @NotNull byte[] delimiter,
                                         @NotNull byte[] bom, boolean controlDiskSpace) throws IOException {
        InverseFileMerger.merge(sources, target, MergeOptions.builder()
                .comparator(comparator)
                .delimiter(delimiter)
                .bom(bom)
                .controlDiskSpace(controlDiskSpace)
                .build());
    }

    /**
     * Rewrites the {@code "\n"} separated lines of a file in reverse order.
     *
     * @param source the file to read
     * @param target the file to write, created or truncated
     * @param charset charset of the file, defines the byte order mark
     * @throws IOException
     */
    public static void invert(@NotNull Path source, @NotNull Path target, @NotNull Charset charset) throws IOException {
        invert(source, target, ByteOrderMarks.encode("\n", charset), ByteOrderMarks.bomOf(charset),
                MergeBufferPlan.DEFAULT_BUFFER_SIZE);
    }

    /**
     * Rewrites the records of a file in reverse order: the target gets the
     * byte order mark, then the last record of the source first.
     *
     * @param source the file to read
     * @param target the file to write, created or truncated
     * @param delimiter record delimiter
     * @param bom byte order mark of both files
     * @param bufferSize size of the read buffer and of the write buffer
     * @throws IOException
     */
    public static void invert(@NotNull Path source, @NotNull Path target, @NotNull byte[] delimiter,
                              @NotNull byte[] bom, int bufferSize) throws IOException {
        Validate.checkArgument(!source.equals(target), "Source and target must be different files: %s", source);
        Validate.checkArgument(bufferSize >= MergeBufferPlan.MIN_READ_BUFFER_SIZE
                && bufferSize >= MergeBufferPlan.MIN_WRITE_BUFFER_SIZE, "Buffer size is too small: %s", bufferSize);
        try (FileChannel in = FileChannel.open(source, READ);
             FileChannel out = FileChannel.open(target, CREATE, TRUNCATE_EXISTING, WRITE)) {
            ReverseLineReader reader = new ReverseLineReader(in, bom.length, in.size(),
                    ByteBuffer.allocateDirect(bufferSize), delimiter);
            TargetWriter writer = new TargetWriter(out, ByteBuffer.allocateDirect(bufferSize), delimiter);
            writer.writeBom(bom);
            try {
                while (reader.hasNext()) {
                    writer.write(reader.next());
                }
            } catch (UncheckedIOException e) {
                throw e.getCause();
            }
            writer.flush();
            LOG.debug("Inverted {} records of {} into {}", writer.getRecordCount(), source, target);
        }
    }

    /**
     * Rewrites the {@code "\n"} separated lines of a file in reverse order,
     * replacing the file.
     *
     * @param file the file to invert
     * @param charset charset of the file
     * @throws IOException
     */
    public static void invert(@NotNull Path file, @NotNull Charset charset) throws IOException {
        Path inverted = Files.createTempFile(file.toAbsolutePath().getParent(), "fileinvert", null);
        boolean success = false;
        try {
            invert(file, inverted, charset);
            Files.move(inverted, file, StandardCopyOption.REPLACE_EXISTING);
            success = true;
        } finally {
            if (!success) {
                FileUtils.deleteQuietly(inverted.toFile());
            }
        }
    }

    /**
     * Same as {@link #invert(Path, Charset)} with UTF-8.
     */
    public static void invert(@NotNull Path file) throws IOException {
        invert(file, UTF_8);
    }

    /**
     * Closes all given resources, last one first. Every resource is closed
     * even if closing another one failed; the first failure is thrown with
     * the others attached as suppressed exceptions.
     *
     * @param closeables the resources to close
     * @throws IOException the first failure
     */
    public static void closeAll(@NotNull Iterable<? extends Closeable> closeables) throws IOException {
        Closer closer = Closer.create();
        for (Closeable closeable : closeables) {
            closer.register(closeable);
        }
        closer.close();
    }
}
