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

import com.tdunning.math.quantile.unit.Quantity;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * The supported numeric representations.
 */
public class Arithmetics {
    /**
     * Plain numbers, computed in double precision.
     */
    public static final Arithmetic<Number> NUMBERS = new NumberArithmetic();

    /**
     * Dimensioned quantities.  Mixing dimensions fails with
     * {@link com.tdunning.math.quantile.unit.IncompatibleUnitsException}.
     */
    public static final Arithmetic<Quantity> QUANTITIES = new QuantityArithmetic();

    private Arithmetics() {
    }

    /**
     * Arbitrary precision decimals.
     *
     * @param mathContext The precision used for sums and products.
     */
    public static Arithmetic<BigDecimal> decimals(MathContext mathContext) {
        return new DecimalArithmetic(mathContext);
    }

    /**
     * Picks the arithmetic for a sequence from the kind of one of its elements.
     *
     * @throws QuantileTypeException if the element is of no supported kind.
     */
    public static Arithmetic<?> forValue(Object x, MathContext mathContext) {
        if (x instanceof Quantity) {
            return QUANTITIES;
        } else if (x instanceof BigDecimal) {
            return decimals(mathContext);
        } else if (NUMBERS.accepts(x)) {
            return NUMBERS;
        }
        Preconditions.checkType(false, x);
        return null;
    }

    static BigDecimal toDecimal(Number x) {
        if (x instanceof BigDecimal) {
            return (BigDecimal) x;
        } else if (x instanceof BigInteger) {
            return new BigDecimal((BigInteger) x);
        } else if (x instanceof Double || x instanceof Float) {
            return BigDecimal.valueOf(x.doubleValue());
        }
        return BigDecimal.valueOf(x.longValue());
    }

    private static class NumberArithmetic implements Arithmetic<Number> {
        @Override
        public Number add(Number a, Number b) {
            return a.doubleValue() + b.doubleValue();
        }

        @Override
        public Number multiply(Number a, Number weight) {
            return a.doubleValue() * weight.doubleValue();
        }

        @Override
        public int compare(Number a, Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }

        @Override
        public boolean accepts(Object x) {
            return x instanceof Number && !(x instanceof BigDecimal) && !(x instanceof BigInteger);
        }

        @Override
        public Object toPrecise(Number x) {
            return toDecimal(x);
        }
    }

    private static class DecimalArithmetic implements Arithmetic<BigDecimal> {
        private final MathContext mathContext;

        DecimalArithmetic(MathContext mathContext) {
            this.mathContext = mathContext;
        }

        @Override
        public BigDecimal add(BigDecimal a, BigDecimal b) {
            return a.add(b, mathContext);
        }

        @Override
        public BigDecimal multiply(BigDecimal a, Number weight) {
            return a.multiply(toDecimal(weight), mathContext);
        }

        @Override
        public int compare(BigDecimal a, BigDecimal b) {
            return a.compareTo(b);
        }

        @Override
        public boolean accepts(Object x) {
            return x instanceof BigDecimal;
        }

        @Override
        public Object toPrecise(BigDecimal x) {
            return x;
        }
    }

    private static class QuantityArithmetic implements Arithmetic<Quantity> {
        @Override
        public Quantity add(Quantity a, Quantity b) {
            return a.plus(b);
        }

        @Override
        public Quantity multiply(Quantity a, Number weight) {
            return a.scale(weight.doubleValue());
        }

        @Override
        public int compare(Quantity a, Quantity b) {
            return a.compareTo(b);
        }

        @Override
        public boolean accepts(Object x) {
            return x instanceof Quantity;
        }

        @Override
        public Object toPrecise(Quantity x) {
            return x;
        }
    }
}
