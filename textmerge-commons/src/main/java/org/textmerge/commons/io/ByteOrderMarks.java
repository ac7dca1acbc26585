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

import java.nio.charset.Charset;
import java.util.Arrays;

import org.jetbrains.annotations.NotNull;

/**
 * Byte order mark helpers.
 * <p>
 * The mark of a charset is whatever its encoder writes in front of the first
 * character, e.g. {@code FE FF} for {@code UTF-16} and nothing for
 * {@code UTF-8} or {@code UTF-16LE}.
 */
public final class ByteOrderMarks {

    private static final byte[] EMPTY = new byte[0];

    private ByteOrderMarks() {
    }

    /**
     * Returns the byte order mark the given charset writes, or an empty array.
     *
     * @param charset the charset
     * @return a new array with the mark bytes
     */
    @NotNull
    public static byte[] bomOf(@NotNull Charset charset) {
        if (!charset.canEncode()) {
            return EMPTY;
        }
        byte[] one = "a".getBytes(charset);
        byte[] two = "aa".getBytes(charset);
        int charLength = two.length - one.length;
        int bomLength = one.length - charLength;
        if (bomLength <= 0) {
            return EMPTY;
        }
        return Arrays.copyOf(one, bomLength);
    }

    /**
     * Encodes the string with the given charset, without the byte order mark.
     *
     * @param str the string to encode
     * @param charset the charset
     * @return the encoded bytes
     */
    @NotNull
    public static byte[] encode(@NotNull String str, @NotNull Charset charset) {
        byte[] bytes = str.getBytes(charset);
        int bomLength = bomOf(charset).length;
        if (bomLength == 0 || bytes.length < bomLength) {
            return bytes;
        }
        return Arrays.copyOfRange(bytes, bomLength, bytes.length);
    }
}
