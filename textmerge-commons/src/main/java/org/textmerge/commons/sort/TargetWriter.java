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

import java.io.Flushable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

import org.jetbrains.annotations.NotNull;

/**
 * Writes records separated by a delimiter through a fixed size buffer.
 * <p>
 * The delimiter is written between records only, never before the first or
 * after the last one. Data larger than the free space of the buffer is split;
 * the buffer is written to the channel each time it is full. {@link #flush()}
 * writes what is left.
 */
public class TargetWriter implements Flushable {

    private final WritableByteChannel channel;
    private final ByteBuffer buffer;
    private final byte[] delimiter;

    private boolean firstRecord = true;
    private long recordCount;
    private long byteCount;

    /**
     * @param channel the target
     * @param buffer the write buffer, owned by this writer from now on
     * @param delimiter the record separator
     */
    public TargetWriter(@NotNull WritableByteChannel channel, @NotNull ByteBuffer buffer, @NotNull byte[] delimiter) {
        this.channel = channel;
        this.buffer = buffer;
        this.delimiter = delimiter;
        buffer.clear();
    }

    /**
     * Writes the byte order mark straight to the channel. Must be called before
     * the first record.
     */
    public void writeBom(@NotNull byte[] bom) throws IOException {
        if (bom.length == 0) {
            return;
        }
        ByteBuffer mark = ByteBuffer.wrap(bom);
        while (mark.hasRemaining()) {
            byteCount += channel.write(mark);
        }
    }

    public void write(@NotNull byte[] record) throws IOException {
        if (!firstRecord) {
            writeData(delimiter);
        }
        firstRecord = false;
        writeData(record);
        recordCount++;
    }

    private void writeData(byte[] data) throws IOException {
        int index = 0;
        while (index < data.length) {
            int length = Math.min(data.length - index, buffer.remaining());
            buffer.put(data, index, length);
            index += length;
            if (!buffer.hasRemaining()) {
                writeBuffer();
            }
        }
    }

    @Override
    public void flush() throws IOException {
        if (buffer.position() > 0) {
            writeBuffer();
        }
    }

    private void writeBuffer() throws IOException {
        buffer.flip();
        while (buffer.hasRemaining()) {
            byteCount += channel.write(buffer);
        }
        buffer.clear();
    }

    public long getRecordCount() {
        return recordCount;
    }

    /**
     * @return the number of bytes written to the channel so far
     */
    public long getByteCount() {
        return byteCount;
    }
}
