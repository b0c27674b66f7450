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

/**
 * Linearizes nested lists, arrays and matrices.
 */
public class Flatten {
    private Flatten() {
    }

    /**
     * Tells whether a value is one of the recognized sequence or matrix containers.
     */
    public static boolean isCollection(Object x) {
        return x instanceof List
                || x instanceof Object[]
                || x instanceof double[]
                || x instanceof float[]
                || x instanceof long[]
                || x instanceof int[]
                || x instanceof DenseMatrix;
    }

    /**
     * Copies all elements of a nested structure into a new flat list, depth first and left
     * to right.  The result never shares storage with the argument.
     *
     * @param nested A list, array or matrix, possibly nested.
     * @return A new mutable list holding the leaves in order.
     */
    public static List<Object> flatten(Object nested) {
        List<Object> flat = Lists.newArrayList();
        collect(nested, flat);
        return flat;
    }

    private static void collect(Object x, List<Object> flat) {
        if (x instanceof DenseMatrix) {
            collect(((DenseMatrix) x).data(), flat);
        } else if (isCollection(x)) {
            for (Object item : asList(x)) {
                collect(item, flat);
            }
        } else {
            flat.add(x);
        }
    }

    /**
     * Converts arrays and matrices into nested lists, copying every level.  Leaves are
     * returned unchanged.
     */
    public static Object toNestedList(Object x) {
        if (x instanceof DenseMatrix) {
            return ((DenseMatrix) x).valueOf();
        }
        if (!isCollection(x)) {
            return x;
        }
        List<Object> items = asList(x);
        List<Object> r = Lists.newArrayListWithCapacity(items.size());
        for (Object item : items) {
            r.add(toNestedList(item));
        }
        return r;
    }

    /**
     * Views one level of a collection as a list, boxing primitive array elements.
     */
    @SuppressWarnings("unchecked")
    static List<Object> asList(Object x) {
        if (x instanceof List) {
            return (List<Object>) x;
        } else if (x instanceof Object[]) {
            return Lists.newArrayList((Object[]) x);
        } else if (x instanceof double[]) {
            List<Object> r = Lists.newArrayList();
            for (double v : (double[]) x) {
                r.add(v);
            }
            return r;
        } else if (x instanceof float[]) {
            List<Object> r = Lists.newArrayList();
            for (float v : (float[]) x) {
                r.add(v);
            }
            return r;
        } else if (x instanceof long[]) {
            List<Object> r = Lists.newArrayList();
            for (long v : (long[]) x) {
                r.add(v);
            }
            return r;
        } else if (x instanceof int[]) {
            List<Object> r = Lists.newArrayList();
            for (int v : (int[]) x) {
                r.add(v);
            }
            return r;
        } else if (x instanceof DenseMatrix) {
            return ((DenseMatrix) x).data();
        }
        throw new IllegalArgumentException("Not a collection: " + x);
    }
}
