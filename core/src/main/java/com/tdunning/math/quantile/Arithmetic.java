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

/**
 * The operations the quantile computation needs from a numeric representation.  The
 * computation itself never looks at the concrete type of the values it selects and
 * interpolates; everything goes through one of these.
 *
 * @param <T> The representation of the values, for instance {@link Number} or
 *            {@link java.math.BigDecimal}.
 */
public interface Arithmetic<T> {
    /**
     * Returns a + b.
     */
    T add(T a, T b);

    /**
     * Scales a value by a dimensionless weight.
     *
     * @param a      The value to scale.
     * @param weight Either a {@link Double} or a {@link java.math.BigDecimal}.
     * @return a * weight
     */
    T multiply(T a, Number weight);

    /**
     * Orders two values.  Must be consistent with a total order on the values this
     * arithmetic accepts.
     */
    int compare(T a, T b);

    /**
     * Tells whether a value is of a kind this arithmetic handles.
     */
    boolean accepts(Object x);

    /**
     * Wraps a result for callers that asked with an arbitrary precision probability.
     * Representations without an arbitrary precision form return the value unchanged.
     */
    Object toPrecise(T x);

    /**
     * Checks that a value is of a kind this arithmetic handles and returns it with the right type.
     *
     * @throws QuantileTypeException if the value is not accepted.
     */
    @SuppressWarnings("unchecked")
    default T cast(Object x) {
        Preconditions.checkType(accepts(x), x);
        return (T) x;
    }

    default Comparator<T> comparator() {
        return this::compare;
    }
}
