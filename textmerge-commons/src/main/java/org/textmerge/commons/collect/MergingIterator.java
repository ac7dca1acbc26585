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
package org.textmerge.commons.collect;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

import org.jetbrains.annotations.NotNull;

import com.google.common.collect.AbstractIterator;

/**
 * Merges sorted iterators into one sorted iterator.
 * <p>
 * Each input must be sorted by the comparator. The head of every input is
 * kept in a priority queue; when heads are equal the one of the input that
 * comes first in the list is returned first, so the merge is stable with
 * respect to the order of the inputs. Inputs are pulled lazily, one element
 * ahead at most.
 *
 * @param <T> the type of the elements
 */
public class MergingIterator<T> extends AbstractIterator<T> {

    private final PriorityQueue<Head<T>> heads;

    public MergingIterator(@NotNull List<? extends Iterator<? extends T>> inputs, @NotNull Comparator<? super T> cmp) {
        Comparator<Head<T>> byValue = (a, b) -> cmp.compare(a.value, b.value);
        this.heads = new PriorityQueue<>(Math.max(1, inputs.size()), byValue.thenComparingInt(h -> h.index));
        int index = 0;
        for (Iterator<? extends T> input : inputs) {
            Head<T> head = new Head<>(index++, input);
            if (head.advance()) {
                heads.add(head);
            }
        }
    }

    @Override
    protected T computeNext() {
        Head<T> head = heads.poll();
        if (head == null) {
            return endOfData();
        }
        T answer = head.value;
        if (head.advance()) {
            heads.add(head); // add it back
        }
        return answer;
    }

    private static final class Head<T> {
        final int index;
        final Iterator<? extends T> input;
        T value;

        Head(int index, Iterator<? extends T> input) {
            this.index = index;
            this.input = input;
        }

        boolean advance() {
            if (!input.hasNext()) {
                value = null;
                return false;
            }
            value = input.next();
            return true;
        }
    }
}
