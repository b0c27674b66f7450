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

import java.util.Arrays;
import java.util.List;

/**
 * An immutable rectangular matrix of any rank, stored as nested lists.
 */
public final class DenseMatrix {
    private final List<Object> data;
    private final int[] size;

    /**
     * Creates a matrix from nested lists or arrays.  The data are copied.
     *
     * @param data Nested lists or arrays, which must be rectangular.
     * @throws IllegalArgumentException   if data is not a collection.
     * @throws DimensionMismatchException if data is not rectangular.
     */
    @SuppressWarnings("unchecked")
    public DenseMatrix(Object data) {
        if (!Flatten.isCollection(data)) {
            throw new IllegalArgumentException("Matrix data must be a list or an array, got " + data);
        }
        this.data = (List<Object>) Flatten.toNestedList(data);
        this.size = ArraySize.of(this.data);
        ArraySize.validate(this.data, size);
    }

    public int[] size() {
        return size.clone();
    }

    /**
     * Returns a copy of the contents as nested lists.
     */
    @SuppressWarnings("unchecked")
    public List<Object> valueOf() {
        return (List<Object>) Flatten.toNestedList(data);
    }

    List<Object> data() {
        return data;
    }

    public Object get(int... index) {
        if (index.length != size.length) {
            throw new DimensionMismatchException(index.length, size.length, "!=");
        }
        Object x = data;
        for (int i = 0; i < index.length; i++) {
            if (index[i] < 0 || index[i] >= size[i]) {
                throw new IndexOutOfBoundsException(String.format("Index out of range (%d not in [0, %d))", index[i], size[i]));
            }
            x = ((List<?>) x).get(index[i]);
        }
        return x;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DenseMatrix)) {
            return false;
        }
        DenseMatrix other = (DenseMatrix) o;
        return Arrays.equals(size, other.size) && data.equals(other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(size) + data.hashCode();
    }

    @Override
    public String toString() {
        return data.toString();
    }
}
