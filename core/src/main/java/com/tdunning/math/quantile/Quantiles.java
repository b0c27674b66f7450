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

import com.google.common.primitives.Ints;
import com.tdunning.math.quantile.array.Apply;
import com.tdunning.math.quantile.array.Flatten;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Entry points for exact quantiles of lists, arrays and matrices.
 * <pre>
 *     Quantiles.quantileSeq(Arrays.asList(3, -1, 5, 7), 0.5)                     // 4.0
 *     Quantiles.quantileSeq(Arrays.asList(3, -1, 5, 7), Arrays.asList(1 / 3.0, 2 / 3.0)) // [3, 5]
 *     Quantiles.quantileSeq(Arrays.asList(3, -1, 5, 7), 2)                       // [3, 5]
 *     Quantiles.quantileSeq(Arrays.asList(-1, 3, 5, 7), 0.5, true)               // 4.0
 * </pre>
 * The data may be nested, in which case the quantile of all values is computed, unless a
 * dimension is given, in which case quantiles are computed along that dimension.  Values can
 * be plain numbers, {@link BigDecimal}s or {@link com.tdunning.math.quantile.unit.Quantity}s.
 * <p>
 * The probability argument is a probability in [0, 1], a count N &gt; 1 which asks for the N
 * quantiles at 1/(N+1), ..., N/(N+1), or a list of probabilities.  Single values may be
 * doubles or {@link BigDecimal}s.
 */
public class Quantiles {
    private static final Logger log = LoggerFactory.getLogger(Quantiles.class);

    private final QuantileConfig config;

    private Quantiles(QuantileConfig config) {
        this.config = config;
    }

    public static Quantiles withConfig(QuantileConfig config) {
        return new Quantiles(config);
    }

    private static Quantiles shared() {
        return Holder.DEFAULT;
    }

    public static Object quantileSeq(Object data, Object probOrN) {
        return shared().evaluate(data, probOrN, false);
    }

    /**
     * @param sorted True if data are already in ascending order.  This is not checked.
     */
    public static Object quantileSeq(Object data, Object probOrN, boolean sorted) {
        return shared().evaluate(data, probOrN, sorted);
    }

    public static Object quantileSeq(Object data, Object probOrN, int dim) {
        return shared().evaluate(data, probOrN, false, dim);
    }

    public static Object quantileSeq(Object data, Object probOrN, boolean sorted, int dim) {
        return shared().evaluate(data, probOrN, sorted, dim);
    }

    /**
     * Untyped entry point taking the arguments in the order (data, probOrN[, sorted][, dim]).
     *
     * @throws QuantileUsageException if there are fewer than two or more than four arguments.
     * @throws QuantileTypeException  if sorted is not a boolean or dim is not an integer.
     */
    public static Object invoke(Object... args) {
        return shared().call(args);
    }

    public Object call(Object... args) {
        Preconditions.checkUsage(args != null && args.length >= 2 && args.length <= 4,
                "Function quantileSeq requires two to four parameters");
        switch (args.length) {
            case 2:
                return evaluate(args[0], args[1], false);
            case 3:
                if (args[2] instanceof Boolean) {
                    return evaluate(args[0], args[1], (Boolean) args[2]);
                }
                return evaluate(args[0], args[1], false, dimension(args[2]));
            default:
                Preconditions.checkType(args[2] instanceof Boolean, args[2]);
                return evaluate(args[0], args[1], (Boolean) args[2], dimension(args[3]));
        }
    }

    public Object evaluate(Object data, Object probOrN, boolean sorted) {
        Preconditions.checkType(Flatten.isCollection(data), data);
        return evaluate(data, ProbabilitySpec.parse(probOrN, config), sorted);
    }

    public Object evaluate(Object data, Object probOrN, boolean sorted, int dim) {
        Preconditions.checkType(Flatten.isCollection(data), data);
        final ProbabilitySpec spec = ProbabilitySpec.parse(probOrN, config);
        log.debug("Computing {} along dimension {}", spec, dim);
        return Apply.apply(data, dim, slice -> evaluate(slice, spec, sorted));
    }

    private Object evaluate(Object data, ProbabilitySpec spec, boolean sorted) {
        List<Object> flat = Flatten.flatten(data);
        Arithmetic<?> arithmetic = flat.isEmpty() ? Arithmetics.NUMBERS : Arithmetics.forValue(flat.get(0), config.mathContext());
        return evaluate(arithmetic, flat, spec, sorted);
    }

    private <T> Object evaluate(Arithmetic<T> arithmetic, List<Object> flat, ProbabilitySpec spec, boolean sorted) {
        return new QuantileSeq<>(arithmetic, config).evaluate(flat, spec, sorted);
    }

    private static int dimension(Object x) {
        if (x instanceof BigDecimal || x instanceof BigInteger) {
            Preconditions.checkType(Probability.isInteger(new BigDecimal(x.toString())), x);
            return ((Number) x).intValue();
        }
        Preconditions.checkType(x instanceof Number && Probability.of(((Number) x).doubleValue()).isInteger(), x);
        return Ints.checkedCast(((Number) x).longValue());
    }

    private static class Holder {
        static final Quantiles DEFAULT = new Quantiles(QuantileConfig.defaults());
    }
}
