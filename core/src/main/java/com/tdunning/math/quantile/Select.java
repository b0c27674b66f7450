/*
 * Licensed to Ted Dunning under one or more
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

package com.tdunning.math.quantile;

import java.util.Comparator;
import java.util.List;

/**
 * Static partial selection methods.
 */
public class Select {
    private Select() {
    }

    /**
     * Finds the k-th smallest element of a list without sorting it.  On return, the list has
     * been reordered so that values.get(k) is the element that would be at position k in
     * sorted order, every element before k compares less than or equal to it and every
     * element after k compares greater than or equal to it.
     *
     * @param values     The values to select from.  These are reordered in place.
     * @param k          The rank to select, 0 is the minimum.
     * @param comparator The ordering of the values.
     * @param <T>        The type of the values.
     * @return The k-th smallest value.
     */
    public static <T> T select(List<T> values, int k, Comparator<? super T> comparator) {
        int n = values.size();
        if (k < 0 || k >= n) {
            throw new IndexOutOfBoundsException(String.format("Rank %d out of range for %d values", k, n));
        }

        int start = 0;
        int end = n;
        while (end - start > 1) {
            // median of three values for the pivot
            int a = start;
            int b = (start + end) / 2;
            int c = end - 1;

            int pivotIndex;
            T va = values.get(a);
            T vb = values.get(b);
            T vc = values.get(c);
            if (comparator.compare(va, vb) > 0) {
                if (comparator.compare(vc, va) > 0) {
                    // vc > va > vb
                    pivotIndex = a;
                } else if (comparator.compare(vc, vb) < 0) {
                    // va > vb > vc
                    pivotIndex = b;
                } else {
                    // va >= vc >= vb
                    pivotIndex = c;
                }
            } else {
                if (comparator.compare(vc, vb) > 0) {
                    // vc > vb >= va
                    pivotIndex = b;
                } else if (comparator.compare(vc, va) < 0) {
                    // vb >= va > vc
                    pivotIndex = a;
                } else {
                    // vb >= vc >= va
                    pivotIndex = c;
                }
            }

            // move pivot to beginning of range
            swap(values, start, pivotIndex);
            T pivotValue = values.get(start);

            // three way partition because many duplicate values is an important case
            int low = start + 1;   // low points to first value not known to be equal to pivotValue
            int high = end;        // high points to first value > pivotValue
            int i = low;           // i scans the range
            while (i < high) {
                // invariant:  values[k] == pivotValue for k in [start..low)
                // invariant:  values[k] < pivotValue for k in [low..i)
                // invariant:  values[k] > pivotValue for k in [high..end)
                int cmp = comparator.compare(values.get(i), pivotValue);
                if (cmp == 0) {
                    if (low != i) {
                        swap(values, low, i);
                    } else {
                        i++;
                    }
                    low++;
                } else if (cmp > 0) {
                    high--;
                    swap(values, i, high);
                } else {
                    i++;
                }
            }

            // move the values equal to the pivot from [start, low) into the top of [low, high)
            int from = start;
            int to = high - 1;
            while (from < low && to >= low) {
                swap(values, from++, to--);
            }
            if (from == low) {
                // ran out of things to copy, the last destination is the boundary
                low = to + 1;
            } else {
                // ran out of places to copy to, the uncopied pivots start the boundary
                low = from;
            }

            // now [start, low) < pivot, [low, high) == pivot, [high, end) > pivot
            if (k < low) {
                end = low;
            } else if (k >= high) {
                start = high;
            } else {
                return values.get(k);
            }
        }
        return values.get(k);
    }

    private static <T> void swap(List<T> values, int i, int j) {
        T t = values.get(i);
        values.set(i, values.get(j));
        values.set(j, t);
    }

    /**
     * Check that a selection left the values partitioned around rank k.  For debugging and testing.
     */
    @SuppressWarnings("UnusedDeclaration")
    public static <T> void checkPartition(List<T> values, int k, Comparator<? super T> comparator) {
        if (k < 0 || k >= values.size()) {
            throw new IllegalArgumentException(String.format("Invalid rank %d for %d values", k, values.size()));
        }

        T pivotValue = values.get(k);
        for (int i = 0; i < k; i++) {
            if (comparator.compare(values.get(i), pivotValue) > 0) {
                throw new IllegalArgumentException(String.format("Value greater than pivot at %d", i));
            }
        }

        for (int i = k + 1; i < values.size(); i++) {
            if (comparator.compare(values.get(i), pivotValue) < 0) {
                throw new IllegalArgumentException(String.format("Value less than pivot at %d", i));
            }
        }
    }
}
