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

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.textmerge.commons.conditions.Validate;

/**
 * Gives the disk space of merged sources back while the merge is running.
 * <p>
 * {@link #truncate()} cuts every source at the end of its unconsumed segment;
 * {@link #deleteDrained()} checks that every source is down to its byte order
 * mark and deletes it.
 */
class DiskReclaimer {

    private static final Logger LOG = LoggerFactory.getLogger(DiskReclaimer.class);

    private final Map<Path, FileChannel> channels;
    private final Map<Path, SegmentTracker> trackers;
    private final Map<Path, Long> drainedSizes = new LinkedHashMap<>();

    DiskReclaimer(@NotNull Map<Path, FileChannel> channels, @NotNull Map<Path, SegmentTracker> trackers,
                  int bomLength) {
        this.channels = channels;
        this.trackers = trackers;
        // a source shorter than the mark keeps its bytes
        trackers.forEach((file, tracker) -> drainedSizes.put(file, Math.min(bomLength, tracker.get())));
    }

    void truncate() throws IOException {
        for (Map.Entry<Path, FileChannel> e : channels.entrySet()) {
            e.getValue().truncate(trackers.get(e.getKey()).get());
        }
    }

    /**
     * Must be called after the source channels have been closed.
     */
    void deleteDrained() throws IOException {
        for (Map.Entry<Path, Long> e : drainedSizes.entrySet()) {
            Path file = e.getKey();
            long size = Files.size(file);
            Validate.checkState(size == e.getValue(),
                    "Source file <%s> must be empty; real-size = %s, segment-size = %s",
                    file.getFileName(), size, trackers.get(file).get());
            FileUtils.forceDelete(file.toFile());
            LOG.debug("Deleted drained source {}", file);
        }
    }
}
