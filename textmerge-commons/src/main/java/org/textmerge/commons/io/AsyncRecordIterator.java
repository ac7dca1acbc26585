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

import java.io.Closeable;
import java.util.Iterator;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.textmerge.commons.conditions.Validate;

import com.google.common.collect.AbstractIterator;

/**
 * Iterates over the elements of a source iterator that is drained by a task
 * of the given executor into a bounded queue. The task blocks while the queue
 * is full, the consumer while it is empty.
 * <p>
 * A failure of the task is reported to the shared {@link ScanFailure}; the
 * consumer of any iterator of the group then gets the
 * {@link SourceScanException} on its next call. A task that the executor has
 * not started within the start timeout is reported the same way, as the
 * executor then runs fewer tasks at a time than the group needs.
 *
 * @param <T> the type of the elements
 */
public class AsyncRecordIterator<T> extends AbstractIterator<T> implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(AsyncRecordIterator.class);

    private static final Object END = new Object();

    /**
     * Time the executor gets to start a task when nothing else is specified.
     */
    public static final long DEFAULT_START_TIMEOUT_MS = 60_000;

    // how long the consumer waits before looking at the failure again
    private static final long POLL_INTERVAL_MS = 100;

    private final String name;
    private final Iterator<T> source;
    private final BlockingQueue<Object> queue;
    private final ScanFailure failure;
    private final long startTimeoutMs;
    private final long submitted;
    private final Future<?> task;
    private volatile boolean started;
    private volatile boolean closed;

    public AsyncRecordIterator(@NotNull String name, @NotNull Iterator<T> source, @NotNull ExecutorService executor,
                               int queueSize, @NotNull ScanFailure failure) {
        this(name, source, executor, queueSize, failure, DEFAULT_START_TIMEOUT_MS);
    }

    /**
     * @param startTimeoutMs how long the consumer waits for the executor to start the task
     */
    public AsyncRecordIterator(@NotNull String name, @NotNull Iterator<T> source, @NotNull ExecutorService executor,
                               int queueSize, @NotNull ScanFailure failure, long startTimeoutMs) {
        Validate.checkArgument(queueSize > 0, "Queue size must be positive: %s", queueSize);
        Validate.checkArgument(startTimeoutMs > 0, "Start timeout must be positive: %s", startTimeoutMs);
        this.name = name;
        this.source = source;
        this.queue = new ArrayBlockingQueue<>(queueSize);
        this.failure = failure;
        this.startTimeoutMs = startTimeoutMs;
        this.submitted = System.nanoTime();
        this.task = executor.submit(this::produce);
    }

    private void produce() {
        started = true;
        try {
            while (source.hasNext()) {
                queue.put(source.next());
            }
            queue.put(END);
        } catch (InterruptedException e) {
            LOG.debug("Reader of {} interrupted", name);
            Thread.currentThread().interrupt();
        } catch (RuntimeException | Error e) {
            if (closed) {
                LOG.debug("Reader of {} stopped after close", name, e);
            } else {
                failure.report(name, e);
            }
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    protected T computeNext() {
        try {
            while (true) {
                failure.rethrowIfFailed();
                Object next = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (next == END) {
                    return endOfData();
                } else if (next != null) {
                    return (T) next;
                } else if (task.isDone() && queue.isEmpty()) {
                    failure.rethrowIfFailed();
                    throw new IllegalStateException("Reader of " + name + " stopped before the end of its records");
                } else if (!started
                        && TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submitted) >= startTimeoutMs) {
                    failure.report(name, new IllegalStateException("Reader of " + name + " not started within "
                            + startTimeoutMs + " ms, the executor must run one reader per source at the same time"));
                    failure.rethrowIfFailed();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for records of " + name, e);
        }
    }

    /**
     * Cancels the reading task. Does not close the underlying source.
     */
    @Override
    public void close() {
        closed = true;
        task.cancel(true);
        queue.clear();
    }

    @Override
    public String toString() {
        return "AsyncRecordIterator{" + name + "}";
    }
}
