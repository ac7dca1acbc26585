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

import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.Arrays;
import java.util.function.LongConsumer;

import org.jetbrains.annotations.NotNull;
import org.textmerge.commons.conditions.Validate;

import com.google.common.collect.AbstractIterator;

/**
 * Reads the delimiter separated records of an area of a file from its end
 * towards its beginning, i.e. the last record of the area is returned first.
 * <p>
 * Records are the bytes between two successive delimiters, or between a
 * delimiter and a border of the area. Empty content has no records, otherwise
 * {@code k} delimiters separate {@code k + 1} records, some possibly empty.
 * <p>
 * Each time a record is complete the listener receives the offset up to which
 * the area still holds unread records: the offset of the delimiter in front of
 * the record, or the start of the area for its first record. All bytes at or
 * beyond that offset are no longer needed by the reader, so the file can be
 * truncated there. Bytes are read with positional reads, a concurrent
 * truncate of the consumed tail does not disturb the reader.
 * <p>
 * The delimiter is matched on the reversed byte stream with a KMP failure
 * table; a delimiter may span two reads.
 */
public class ReverseLineReader extends AbstractIterator<byte[]> {

    /**
     * Largest record accepted by default.
     */
    public static final int DEFAULT_MAX_RECORD_LENGTH = Integer.MAX_VALUE - 8;

    // largest array the VM reliably allocates
    private static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    private static final LongConsumer NO_LISTENER = size -> {
    };

    private final FileChannel channel;
    private final ByteBuffer buffer;
    private final byte[] reversedDelimiter;
    private final int[] failureTable;
    private final long start;
    private final LongConsumer listener;
    private final int maxRecordLength;

    // lowest offset loaded so far
    private long position;
    private long chunkStart;
    private int bufferIndex = -1;

    // bytes of the current record, last byte first
    private byte[] record = new byte[64];
    private int recordLength;
    private int matched;
    private boolean finished;

    public ReverseLineReader(@NotNull FileChannel channel, long startInclusive, long endExclusive,
                             @NotNull ByteBuffer buffer, @NotNull byte[] delimiter) {
        this(channel, startInclusive, endExclusive, buffer, delimiter, NO_LISTENER, DEFAULT_MAX_RECORD_LENGTH);
    }

    /**
     * @param channel the file to read
     * @param startInclusive start of the area, e.g. the length of the byte order mark
     * @param endExclusive end of the area, usually the size of the file
     * @param buffer the read buffer; its whole capacity is used
     * @param delimiter the record separator, not empty
     * @param listener receives the new end of the unread area after each record
     * @param maxRecordLength longer records are reported as malformed content; lowered if
     *                        a record of that length and a partial delimiter would not fit into an array
     */
    public ReverseLineReader(@NotNull FileChannel channel, long startInclusive, long endExclusive,
                             @NotNull ByteBuffer buffer, @NotNull byte[] delimiter,
                             @NotNull LongConsumer listener, int maxRecordLength) {
        Validate.checkArgument(delimiter.length > 0, "Delimiter must not be empty");
        Validate.checkArgument(buffer.capacity() > 0, "Read buffer must not be empty");
        Validate.checkArgument(startInclusive >= 0, "Start position must not be negative: %s", startInclusive);
        Validate.checkArgument(maxRecordLength > 0, "Max record length must be positive: %s", maxRecordLength);
        this.channel = channel;
        this.buffer = buffer;
        this.reversedDelimiter = reverse(delimiter, delimiter.length);
        this.failureTable = failureTable(reversedDelimiter);
        this.start = startInclusive;
        this.position = endExclusive;
        this.listener = listener;
        // a record is held together with at most delimiter.length - 1 bytes of a partial match
        this.maxRecordLength = Math.min(maxRecordLength, MAX_ARRAY_LENGTH - delimiter.length);
        this.finished = endExclusive <= startInclusive;
    }

    @Override
    protected byte[] computeNext() {
        if (finished) {
            return endOfData();
        }
        try {
            return readRecord();
        } catch (IOException e) {
            finished = true;
            throw new UncheckedIOException(e);
        }
    }

    private byte[] readRecord() throws IOException {
        while (true) {
            if (bufferIndex < 0) {
                if (position <= start) {
                    finished = true;
                    byte[] first = takeRecord();
                    listener.accept(start);
                    return first;
                }
                fill();
            }
            byte b = buffer.get(bufferIndex);
            long offset = chunkStart + bufferIndex;
            bufferIndex--;

            while (matched > 0 && b != reversedDelimiter[matched]) {
                matched = failureTable[matched - 1];
            }
            if (b == reversedDelimiter[matched]) {
                matched++;
            }
            if (matched == reversedDelimiter.length) {
                // the other delimiter bytes have already been appended
                matched = 0;
                recordLength -= reversedDelimiter.length - 1;
                byte[] line = takeRecord();
                listener.accept(offset);
                return line;
            }
            append(b, offset);
        }
    }

    private void fill() throws IOException {
        int length = (int) Math.min(buffer.capacity(), position - start);
        long from = position - length;
        buffer.clear();
        buffer.limit(length);
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, from + buffer.position());
            if (read < 0) {
                throw new EOFException("Unexpected end of file at " + (from + buffer.position())
                        + ", expected to read up to " + (from + length));
            }
        }
        chunkStart = from;
        position = from;
        bufferIndex = length - 1;
    }

    private void append(byte b, long offset) throws IOException {
        if (recordLength == record.length) {
            record = Arrays.copyOf(record, (int) Math.min((long) record.length * 2, MAX_ARRAY_LENGTH));
        }
        record[recordLength++] = b;
        if (recordLength - matched > maxRecordLength) {
            throw new IOException("Malformed content: record ending before offset " + offset
                    + " is longer than " + maxRecordLength + " bytes");
        }
    }

    /**
     * @return the effective limit, at most the one given to the constructor
     */
    public int getMaxRecordLength() {
        return maxRecordLength;
    }

    private byte[] takeRecord() {
        byte[] line = reverse(record, recordLength);
        recordLength = 0;
        return line;
    }

    private static byte[] reverse(byte[] bytes, int length) {
        byte[] result = new byte[length];
        for (int i = 0; i < length; i++) {
            result[i] = bytes[length - 1 - i];
        }
        return result;
    }

    private static int[] failureTable(byte[] pattern) {
        int[] table = new int[pattern.length];
        int k = 0;
        for (int i = 1; i < pattern.length; i++) {
            while (k > 0 && pattern[i] != pattern[k]) {
                k = table[k - 1];
            }
            if (pattern[i] == pattern[k]) {
                k++;
            }
            table[i] = k;
        }
        return table;
    }
}
