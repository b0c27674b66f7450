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

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

/**
 * Computes exact quantiles of a flat sequence by partial selection and linear interpolation
 * between adjacent order statistics.
 * <p>
 * The quantile for probability p is found at the fractional rank p * (n - 1).  When that rank
 * falls between two order statistics, the result is (1 - f) * left + f * right where f is
 * the fractional part of the rank.  All arithmetic on values goes through the
 * {@link Arithmetic} this was built with.
 * <p>
 * When the data are not declared sorted, each call selects from its own private copy of
 * the data; the caller's list is never reordered.  When the data are declared sorted that
 * claim is trusted without checking and unsorted data will give wrong answers.
 *
 * @param <T> The representation of the values.
 */
public class QuantileSeq<T> {
    private static final Logger log = LoggerFactory.getLogger(QuantileSeq.class);

    private final Arithmetic<T> arithmetic;
    private final QuantileConfig config;

    public QuantileSeq(Arithmetic<T> arithmetic) {
        this(arithmetic, QuantileConfig.defaults());
    }

    public QuantileSeq(Arithmetic<T> arithmetic, QuantileConfig config) {
        this.arithmetic = arithmetic;
        this.config = config;
    }

    /**
     * Computes the quantile or quantiles described by a probability specification.
     *
     * @param data   The values, already flattened.
     * @param spec   What to compute.
     * @param sorted Whether data are known to be in ascending order.
     * @return A single value for {@link ProbabilitySpec.Single}, otherwise a list of values in
     * the order of the requested probabilities.  Results for probabilities given in arbitrary
     * precision are wrapped by {@link Arithmetic#toPrecise(Object)}, except in the list form.
     */
    public Object evaluate(List<?> data, ProbabilitySpec spec, boolean sorted) {
        Selection selection = new Selection(data, sorted);
        switch (spec.kind()) {
            case SINGLE: {
                Probability p = ((ProbabilitySpec.Single) spec).probability();
                T value = selection.quantile(p);
                return p.isPrecise() ? arithmetic.toPrecise(value) : value;
            }
            case COUNT: {
                ProbabilitySpec.Count count = (ProbabilitySpec.Count) spec;
                log.debug("Computing {} evenly spaced quantiles of {} values", count.n(), data.size());
                List<Probability> probabilities = count.probabilities(config.mathContext());
                List<Object> r = Lists.newArrayListWithCapacity(probabilities.size());
                for (Probability p : probabilities) {
                    T value = selection.quantile(p);
                    r.add(count.isPrecise() ? arithmetic.toPrecise(value) : value);
                }
                return r;
            }
            case LISTED: {
                List<Probability> probabilities = ((ProbabilitySpec.Listed) spec).probabilities();
                return Lists.<Object>newArrayList(quantiles(selection, probabilities));
            }
            default:
                throw new IllegalStateException("Unknown kind of probability: " + spec.kind());
        }
    }

    /**
     * Computes one quantile.
     *
     * @param data   The values, already flattened.
     * @param p      The probability, between 0 and 1 inclusive.
     * @param sorted Whether data are known to be in ascending order.
     * @return The quantile, which is one of the values if the rank is exact and an
     * interpolation of two of them otherwise.
     * @throws EmptySequenceException if data is empty.
     * @throws QuantileTypeException  if a value used is not accepted by the arithmetic.
     */
    public T quantile(List<?> data, Probability p, boolean sorted) {
        return new Selection(data, sorted).quantile(p);
    }

    /**
     * Computes a quantile for each probability, in order.
     */
    public List<T> quantiles(List<?> data, List<Probability> probabilities, boolean sorted) {
        return quantiles(new Selection(data, sorted), probabilities);
    }

    private List<T> quantiles(Selection selection, List<Probability> probabilities) {
        List<T> r = Lists.newArrayListWithCapacity(probabilities.size());
        for (Probability p : probabilities) {
            r.add(selection.quantile(p));
        }
        return r;
    }

    /**
     * The data for one call.  The working copy that selection reorders is made on first use
     * and shared by all the probabilities of the call.
     */
    private class Selection {
        private final List<?> data;
        private final boolean sorted;
        private final Comparator<T> comparator = arithmetic.comparator();
        private List<T> values;

        Selection(List<?> data, boolean sorted) {
            this.data = data;
            this.sorted = sorted;
        }

        T quantile(Probability p) {
            int n = data.size();
            if (n == 0) {
                throw new EmptySequenceException();
            }

            Rank rank = p.rank(n);
            int k = rank.index();
            if (rank.isExact()) {
                if (sorted) {
                    return arithmetic.cast(data.get(k));
                }
                return arithmetic.cast(Select.select(values(), k, comparator));
            }

            T left;
            T right;
            if (sorted) {
                left = arithmetic.cast(data.get(k));
                right = arithmetic.cast(data.get(k + 1));
            } else {
                List<T> v = values();
                right = Select.select(v, k + 1, comparator);

                // everything below k+1 is now <= right, so the largest of them is the k-th
                left = v.get(k);
                for (int i = 0; i < k; i++) {
                    if (arithmetic.compare(v.get(i), left) > 0) {
                        left = v.get(i);
                    }
                }
            }

            // Q(p) = (1-f) * x[k] + f * x[k+1]
            return arithmetic.add(arithmetic.multiply(left, rank.complement()), arithmetic.multiply(right, rank.fraction()));
        }

        private List<T> values() {
            if (values == null) {
                values = Lists.newArrayListWithCapacity(data.size());
                for (Object x : data) {
                    values.add(arithmetic.cast(x));
                }
            }
            return values;
        }
    }
}
