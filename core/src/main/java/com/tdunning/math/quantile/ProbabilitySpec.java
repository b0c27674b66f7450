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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.primitives.Ints;
import com.tdunning.math.quantile.array.Flatten;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;

/**
 * What quantiles a caller asked for: one probability, a count of evenly spaced
 * probabilities or an explicit list.  A single number is a probability when it is at
 * most 1 and a count when it is larger.
 */
public abstract class ProbabilitySpec {
    static final String NON_NEGATIVE = "N/prob must be non-negative";
    static final String POSITIVE_INTEGER = "N must be a positive integer";
    static final String MAX_COUNT = "N must be less than or equal to 2^32-1, as that is the maximum length of an Array";
    static final String IN_RANGE = "Probability must be between 0 and 1, inclusive";

    public enum Kind {
        SINGLE, COUNT, LISTED
    }

    ProbabilitySpec() {
    }

    public abstract Kind kind();

    /**
     * Resolves the probability argument of a quantile call.
     *
     * @param probOrN A number or {@link BigDecimal} (a probability if at most 1, a count if
     *                larger) or a list or array of probabilities.
     * @param config  Limits on counts.
     * @return The resolved specification.
     * @throws QuantileDomainException if a number is out of range.
     * @throws QuantileTypeException   if the argument or a list element is of the wrong kind.
     */
    public static ProbabilitySpec parse(Object probOrN, QuantileConfig config) {
        if (probOrN instanceof BigInteger) {
            probOrN = new BigDecimal((BigInteger) probOrN);
        }

        if (probOrN instanceof BigDecimal) {
            Probability p = Probability.of((BigDecimal) probOrN);
            Preconditions.checkDomain(!p.isNegative(), NON_NEGATIVE);
            if (p.isAtMostOne()) {
                return new Single(p);
            }
            Preconditions.checkDomain(p.isInteger(), POSITIVE_INTEGER);
            Preconditions.checkDomain(((BigDecimal) probOrN).compareTo(BigDecimal.valueOf(maxCount(config))) <= 0, MAX_COUNT);
            return new Count(p.longValue(), true);
        }

        if (Arithmetics.NUMBERS.accepts(probOrN)) {
            double x = ((Number) probOrN).doubleValue();
            Preconditions.checkType(!Double.isNaN(x), probOrN);
            Probability p = Probability.of(x);
            Preconditions.checkDomain(!p.isNegative(), NON_NEGATIVE);
            if (p.isAtMostOne()) {
                return new Single(p);
            }
            Preconditions.checkDomain(p.isInteger(), POSITIVE_INTEGER);
            Preconditions.checkDomain(x <= maxCount(config), MAX_COUNT);
            return new Count(p.longValue(), false);
        }

        if (Flatten.isCollection(probOrN)) {
            List<Object> values = Flatten.flatten(probOrN);
            List<Probability> probabilities = Lists.newArrayListWithCapacity(values.size());
            for (Object value : values) {
                Probability p;
                if (value instanceof BigDecimal) {
                    p = Probability.of((BigDecimal) value);
                } else {
                    Preconditions.checkType(Arithmetics.NUMBERS.accepts(value), value);
                    p = Probability.of(((Number) value).doubleValue());
                }
                // NaN fails both comparisons
                Preconditions.checkDomain(!p.isNegative() && p.isAtMostOne(), IN_RANGE);
                probabilities.add(p);
            }
            return new Listed(probabilities);
        }

        Preconditions.checkType(false, probOrN);
        return null;
    }

    /**
     * The largest count that can be expanded, limited by the size of a list.
     */
    private static long maxCount(QuantileConfig config) {
        return Math.min(config.maxCount(), Integer.MAX_VALUE);
    }

    public static ProbabilitySpec single(Probability p) {
        Preconditions.checkDomain(!p.isNegative() && p.isAtMostOne(), IN_RANGE);
        return new Single(p);
    }

    public static ProbabilitySpec count(long n, boolean precise) {
        Preconditions.checkDomain(n >= 1, POSITIVE_INTEGER);
        Preconditions.checkDomain(n <= Integer.MAX_VALUE, MAX_COUNT);
        return new Count(n, precise);
    }

    public static ProbabilitySpec listed(List<Probability> probabilities) {
        for (Probability p : probabilities) {
            Preconditions.checkDomain(!p.isNegative() && p.isAtMostOne(), IN_RANGE);
        }
        return new Listed(probabilities);
    }

    /**
     * A single probability in [0, 1].
     */
    public static final class Single extends ProbabilitySpec {
        private final Probability probability;

        Single(Probability probability) {
            this.probability = probability;
        }

        @Override
        public Kind kind() {
            return Kind.SINGLE;
        }

        public Probability probability() {
            return probability;
        }

        @Override
        public String toString() {
            return "Single(" + probability + ")";
        }
    }

    /**
     * The N probabilities 1/(N+1), 2/(N+1), ..., N/(N+1).
     */
    public static final class Count extends ProbabilitySpec {
        private final long n;
        private final boolean precise;

        Count(long n, boolean precise) {
            this.n = n;
            this.precise = precise;
        }

        @Override
        public Kind kind() {
            return Kind.COUNT;
        }

        public long n() {
            return n;
        }

        /**
         * True if the count was given as an arbitrary precision number, in which case the
         * probabilities are computed as decimals.
         */
        public boolean isPrecise() {
            return precise;
        }

        /**
         * Lists the evenly spaced probabilities in ascending order.
         *
         * @param mathContext Precision of the decimal divisions, used only for precise counts.
         */
        public List<Probability> probabilities(MathContext mathContext) {
            int size = Ints.checkedCast(n);
            List<Probability> r = Lists.newArrayListWithCapacity(size);
            if (precise) {
                BigDecimal nPlusOne = BigDecimal.valueOf(n + 1);
                for (int i = 1; i <= size; i++) {
                    r.add(Probability.of(BigDecimal.valueOf(i).divide(nPlusOne, mathContext)));
                }
            } else {
                double nPlusOne = n + 1;
                for (int i = 1; i <= size; i++) {
                    r.add(Probability.of(i / nPlusOne));
                }
            }
            return r;
        }

        @Override
        public String toString() {
            return "Count(" + n + (precise ? ", precise)" : ")");
        }
    }

    /**
     * An explicit list of probabilities, kept in the order given.
     */
    public static final class Listed extends ProbabilitySpec {
        private final List<Probability> probabilities;

        Listed(List<Probability> probabilities) {
            this.probabilities = ImmutableList.copyOf(probabilities);
        }

        @Override
        public Kind kind() {
            return Kind.LISTED;
        }

        public List<Probability> probabilities() {
            return probabilities;
        }

        @Override
        public String toString() {
            return "Listed" + probabilities;
        }
    }
}
