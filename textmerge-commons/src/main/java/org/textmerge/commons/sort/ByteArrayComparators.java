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

import java.nio.charset.Charset;
import java.util.Comparator;

import org.jetbrains.annotations.NotNull;

import com.google.common.primitives.UnsignedBytes;

/**
 * Comparators over the raw bytes of records.
 */
public final class ByteArrayComparators {

    private ByteArrayComparators() {
    }

    /**
     * Compares records by the natural order of the strings they decode to.
     */
    @NotNull
    public static Comparator<byte[]> stringComparator(@NotNull Charset charset) {
        return fromStringComparator(Comparator.naturalOrder(), charset);
    }

    /**
     * Adapts a string comparator; both records are decoded with the charset
     * before every comparison.
     */
    @NotNull
    public static Comparator<byte[]> fromStringComparator(@NotNull Comparator<String> cmp, @NotNull Charset charset) {
        return (a, b) -> cmp.compare(new String(a, charset), new String(b, charset));
    }

    /**
     * Unsigned lexicographical order of the bytes. For UTF-8 this is the code
     * point order of the text and needs no decoding.
     */
    @NotNull
    public static Comparator<byte[]> lexicographical() {
        return UnsignedBytes.lexicographicalComparator();
    }
}
