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
package org.textmerge.commons.io;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.Uninterruptibles;

/**
 * First failure of a group of readers working for the same consumer.
 * <p>
 * Only the first reported failure is kept; it runs the registered handlers
 * (closing sources, cancelling the other readers) on the reporting thread.
 * Errors thrown by a handler are attached to the failure as suppressed
 * exceptions and do not stop the other handlers. The failure becomes visible
 * to consumers only once all handlers have run.
 */
public final class ScanFailure {

    private static final Logger LOG = LoggerFactory.getLogger(ScanFailure.class);

    private final AtomicReference<SourceScanException> failure = new AtomicReference<>();
    private final CountDownLatch published = new CountDownLatch(1);
    private final List<Runnable> handlers = new CopyOnWriteArrayList<>();

    /**
     * Registers a handler run once, when the first failure is reported.
     */
    public void onFailure(@NotNull Runnable handler) {
        handlers.add(handler);
    }

    /**
     * @return {@code true} if this was the first failure of the group
     */
    public boolean report(@NotNull String source, @NotNull Throwable cause) {
        SourceScanException e = new SourceScanException(source, cause);
        if (!failure.compareAndSet(null, e)) {
            LOG.debug("Ignoring failure of {} after an earlier failure", source, cause);
            return false;
        }
        LOG.error("Reading {} failed, cancelling all readers", source, cause);
        for (Runnable handler : handlers) {
            try {
                handler.run();
            } catch (RuntimeException | Error t) {
                e.addSuppressed(t);
            }
        }
        published.countDown();
        return true;
    }

    public boolean hasFailed() {
        return published.getCount() == 0;
    }

    @Nullable
    public SourceScanException get() {
        return hasFailed() ? failure.get() : null;
    }

    /**
     * Returns the reported failure, waiting for its handlers to complete if
     * they are still running. Must not be called from a handler.
     *
     * @return the failure, or {@code null} if none was reported
     */
    @Nullable
    public SourceScanException awaitReported() {
        SourceScanException e = failure.get();
        if (e != null) {
            Uninterruptibles.awaitUninterruptibly(published);
        }
        return e;
    }

    /**
     * @throws SourceScanException the first reported failure, if any
     */
    public void rethrowIfFailed() {
        SourceScanException e = get();
        if (e != null) {
            throw e;
        }
    }
}
