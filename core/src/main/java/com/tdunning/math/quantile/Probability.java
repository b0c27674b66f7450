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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A probability, either a double or an arbitrary precision decimal.  Ranks are computed in
 * the arithmetic of the representation the probability was given in.
 */
public abstract class Probability {
    public static Probability of(double p) {
        return new NativeProbability(p);
    }

    public static Probability of(BigDecimal p) {
        if (p == null) {
            throw new NullPointerException("p");
        }
        return new PreciseProbability(p);
    }

    /**
     * Computes the fractional rank p * (length - 1).
     *
     * @param length The number of values in the sequence, at least 1.
     */
    public abstract Rank rank(int length);

    public abstract boolean isNegative();

    public abstract boolean isAtMostOne();

    public abstract boolean isInteger();

    /**
     * True for arbitrary precision probabilities.
     */
    public abstract boolean isPrecise();

    public abstract long longValue();

    public abstract Number value();

    static boolean isInteger(BigDecimal x) {
        return x.signum() == 0 || x.scale() <= 0 || x.stripTrailingZeros().scale() <= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value().equals(((Probability) o).value());
    }

    @Override
    public int hashCode() {
        return value().hashCode();
    }

    @Override
    public String toString() {
        return value().toString();
    }

    private static final class NativeProbability extends Probability {
        private final double p;

        NativeProbability(double p) {
            this.p = p;
        }

        @Override
        public Rank rank(int length) {
            double index = p * (length - 1);
            double fraction = index % 1;
            if (fraction == 0) {
                return Rank.exact((int) index);
            }
            return Rank.between((int) Math.floor(index), fraction, 1 - fraction);
        }

        @Override
        public boolean isNegative() {
            return p < 0;
        }

        @Override
        public boolean isAtMostOne() {
            return p <= 1;
        }

        @Override
        public boolean isInteger() {
            return !Double.isInfinite(p) && p == Math.rint(p);
        }

        @Override
        public boolean isPrecise() {
            return false;
        }

        @Override
        public long longValue() {
            return (long) p;
        }

        @Override
        public Number value() {
            return p;
        }
    }

    private static final class PreciseProbability extends Probability {
        private final BigDecimal p;

        PreciseProbability(BigDecimal p) {
            this.p = p;
        }

        @Override
        public Rank rank(int length) {
            BigDecimal index = p.multiply(BigDecimal.valueOf(length - 1));
            if (isInteger(index)) {
                return Rank.exact(index.intValueExact());
            }
            BigDecimal integerPart = index.setScale(0, RoundingMode.FLOOR);
            BigDecimal fraction = index.subtract(integerPart);
            return Rank.between(integerPart.intValueExact(), fraction, BigDecimal.ONE.subtract(fraction));
        }

        @Override
        public boolean isNegative() {
            return p.signum() < 0;
        }

        @Override
        public boolean isAtMostOne() {
            return p.compareTo(BigDecimal.ONE) <= 0;
        }

        @Override
        public boolean isInteger() {
            return isInteger(p);
        }

        @Override
        public boolean isPrecise() {
            return true;
        }

        @Override
        public long longValue() {
            return p.longValueExact();
        }

        @Override
        public Number value() {
            return p;
        }
    }
}
