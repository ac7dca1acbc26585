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

/**
 * Thrown before any I/O when a read or write buffer of a merge is smaller
 * than its minimum size.
 */
public class BufferTooSmallException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int capacity;
    private final int minimum;

    public BufferTooSmallException(String what, int capacity, int minimum) {
        super("Specified " + what + " buffer size is too small: " + capacity + " < " + minimum);
        this.capacity = capacity;
        this.minimum = minimum;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getMinimum() {
        return minimum;
    }
}
