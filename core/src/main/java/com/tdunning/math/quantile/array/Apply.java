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

import com.google.common.collect.Lists;

import java.util.List;
import java.util.function.Function;

/**
 * Reduces a multidimensional structure along one dimension by applying a function to
 * every one dimensional slice along that dimension.
 */
public class Apply {
    private Apply() {
    }

    /**
     * Applies {@code callback} to each slice of {@code data} along dimension {@code dim}.
     * For a two dimensional structure, dim 0 reduces each column and dim 1 reduces each row.
     *
     * @param data     Nested lists, arrays or a {@link DenseMatrix}.
     * @param dim      The dimension to reduce, 0 is outermost.
     * @param callback Maps one slice, given as a list, to its reduced value.
     * @return Nested lists with dimension dim replaced by the callback results; a matrix if data
     * was a matrix and the result is still an array.
     * @throws IndexOutOfBoundsException if dim is not a dimension of data.
     * @throws DimensionMismatchException if data is not rectangular.
     */
    @SuppressWarnings("unchecked")
    public static Object apply(Object data, int dim, Function<Object, Object> callback) {
        if (!Flatten.isCollection(data)) {
            throw new IllegalArgumentException("Cannot apply along a dimension of " + data);
        }
        int[] size = ArraySize.of(data);
        if (dim < 0 || dim >= size.length) {
            throw new IndexOutOfBoundsException(String.format("Index out of range (%d not in [0, %d))", dim, size.length));
        }
        ArraySize.validate(data, size);

        List<Object> nested = (List<Object>) Flatten.toNestedList(data);
        Object r = apply(nested, dim, callback);
        if (data instanceof DenseMatrix && r instanceof List) {
            return new DenseMatrix(r);
        }
        return r;
    }

    @SuppressWarnings("unchecked")
    private static Object apply(List<Object> mat, int dim, Function<Object, Object> callback) {
        List<Object> r = Lists.newArrayList();
        if (dim <= 0) {
            if (mat.isEmpty() || !(mat.get(0) instanceof List)) {
                return callback.apply(mat);
            }
            for (List<Object> row : transpose(mat)) {
                r.add(apply(row, dim - 1, callback));
            }
        } else {
            for (Object item : mat) {
                r.add(apply((List<Object>) item, dim - 1, callback));
            }
        }
        return r;
    }

    /**
     * Swaps the two outermost dimensions.
     */
    @SuppressWarnings("unchecked")
    static List<List<Object>> transpose(List<Object> mat) {
        int rows = mat.size();
        int cols = ((List<Object>) mat.get(0)).size();
        List<List<Object>> r = Lists.newArrayListWithCapacity(cols);
        for (int j = 0; j < cols; j++) {
            List<Object> column = Lists.newArrayListWithCapacity(rows);
            for (int i = 0; i < rows; i++) {
                column.add(((List<Object>) mat.get(i)).get(j));
            }
            r.add(column);
        }
        return r;
    }
}
