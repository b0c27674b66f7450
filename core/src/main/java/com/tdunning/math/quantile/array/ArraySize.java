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

package com.tdunning.math.quantile.array;

import com.google.common.primitives.Ints;

import java.util.ArrayList;
import java.util.List;

/**
 * Size vectors of nested structures.
 */
public class ArraySize {
    private ArraySize() {
    }

    /**
     * Computes the size of a nested structure by following the first element of each level.
     * The structure is not checked for being rectangular, see {@link #validate(Object, int[])}.
     *
     * @param nested A list, array or matrix.
     * @return The length of each dimension, outermost first.
     */
    public static int[] of(Object nested) {
        if (nested instanceof DenseMatrix) {
            return ((DenseMatrix) nested).size();
        }
        List<Integer> size = new ArrayList<>();
        Object x = nested;
        while (Flatten.isCollection(x)) {
            List<Object> level = Flatten.asList(x);
            size.add(level.size());
            if (level.isEmpty()) {
                break;
            }
            x = level.get(0);
        }
        return Ints.toArray(size);
    }

    /**
     * Checks that every level of a nested structure has the given size.
     *
     * @throws DimensionMismatchException if any level differs.
     */
    public static void validate(Object nested, int[] size) {
        if (size.length == 0) {
            if (Flatten.isCollection(nested)) {
                throw new DimensionMismatchException(0, of(nested).length, ">");
            }
            return;
        }
        validate(nested, size, 0);
    }

    private static void validate(Object x, int[] size, int dim) {
        if (!Flatten.isCollection(x)) {
            throw new DimensionMismatchException(dim, size.length, "<");
        }
        List<Object> level = Flatten.asList(x);
        if (level.size() != size[dim]) {
            throw new DimensionMismatchException(level.size(), size[dim], "!=");
        }
        for (Object item : level) {
            if (dim + 1 < size.length) {
                validate(item, size, dim + 1);
            } else if (Flatten.isCollection(item)) {
                throw new DimensionMismatchException(size.length + 1, size.length, ">");
            }
        }
    }
}
