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

import com.carrotsearch.randomizedtesting.annotations.Repeat;
import com.google.common.collect.Lists;
import com.google.common.primitives.Doubles;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Checks quantiles of random data against full sorts.
 */
public class QuantilePropertiesTest extends AbstractTest {

    @Test
    @Repeat(iterations = 10)
    public void testExtremes() {
        double[] data = randomData(getRandom(), randomIntBetween(1, 1000));
        assertEquals(Dist.min(data), number(Quantiles.quantileSeq(data, 0)), 0);
        assertEquals(Dist.max(data), number(Quantiles.quantileSeq(data, 1)), 0);
    }

    @Test
    @Repeat(iterations = 10)
    public void testExactRanks() {
        Random gen = getRandom();
        // with n - 1 a power of two, k / (n - 1) * (n - 1) == k exactly
        int n = (1 << randomIntBetween(0, 10)) + 1;
        double[] data = randomData(gen, n);
        double[] sorted = Dist.sorted(data);
        for (int i = 0; i < 20; i++) {
            int k = gen.nextInt(n);
            double p = (double) k / (n - 1);
            assertEquals(sorted[k], number(Quantiles.quantileSeq(data, p)), 0);
        }
    }

    @Test
    @Repeat(iterations = 10)
    public void testSortedMatchesUnsorted() {
        Random gen = getRandom();
        double[] data = randomData(gen, randomIntBetween(1, 1000));
        double[] sorted = Dist.sorted(data);
        List<Double> shuffled = Lists.newArrayList(Doubles.asList(data));
        Collections.shuffle(shuffled, gen);
        for (int i = 0; i < 20; i++) {
            double p = gen.nextDouble();
            assertEquals(number(Quantiles.quantileSeq(sorted, p, true)), number(Quantiles.quantileSeq(shuffled, p)), 0);
        }
    }

    @Test
    @Repeat(iterations = 10)
    public void testAgainstFullSort() {
        Random gen = getRandom();
        double[] data = randomData(gen, randomIntBetween(1, 1000));
        double[] sorted = Dist.sorted(data);
        double scale = Math.max(1, Dist.max(data) - Dist.min(data));
        for (int i = 0; i < 50; i++) {
            double p = gen.nextDouble();
            assertEquals(Dist.quantile(p, sorted), number(Quantiles.quantileSeq(data, p)), 1e-12 * scale);
        }
    }

    @Test
    @Repeat(iterations = 5)
    public void testAgainstPercentile() {
        Random gen = getRandom();
        double[] data = randomData(gen, randomIntBetween(2, 500));
        double scale = Math.max(1, Dist.max(data) - Dist.min(data));
        Percentile reference = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        reference.setData(data);
        for (int i = 0; i < 20; i++) {
            double p = 0.001 + 0.999 * gen.nextDouble();
            assertEquals(reference.evaluate(100 * p), number(Quantiles.quantileSeq(data, p)), 1e-9 * scale);
        }
    }

    @Test
    @Repeat(iterations = 10)
    public void testMonotonic() {
        Random gen = getRandom();
        double[] data = randomData(gen, randomIntBetween(1, 500));
        double[] ps = new double[30];
        for (int i = 0; i < ps.length; i++) {
            ps[i] = gen.nextDouble();
        }
        Arrays.sort(ps);

        List<?> r = (List<?>) Quantiles.quantileSeq(data, ps);
        for (int i = 1; i < r.size(); i++) {
            double previous = number(r.get(i - 1));
            double current = number(r.get(i));
            assertTrue(String.format("q(%.6f) = %.6f < q(%.6f) = %.6f", ps[i], current, ps[i - 1], previous),
                    current >= previous - 1e-12 * Math.max(1, Math.abs(previous)));
        }
    }

    @Test
    @Repeat(iterations = 5)
    public void testCountForm() {
        double[] data = randomData(getRandom(), randomIntBetween(1, 300));
        int n = randomIntBetween(2, 40);
        List<?> r = (List<?>) Quantiles.quantileSeq(data, n);
        assertEquals(n, r.size());
        for (int i = 1; i <= n; i++) {
            assertEquals(Quantiles.quantileSeq(data, i / (n + 1.0)), r.get(i - 1));
        }
    }

    @Test
    @Repeat(iterations = 5)
    public void testListForm() {
        Random gen = getRandom();
        double[] data = randomData(gen, randomIntBetween(1, 300));
        List<Double> ps = Lists.newArrayList();
        for (int i = 0; i < 15; i++) {
            ps.add(gen.nextDouble());
        }
        ps.add(0.0);
        ps.add(1.0);

        List<?> r = (List<?>) Quantiles.quantileSeq(data, ps);
        assertEquals(ps.size(), r.size());
        for (int i = 0; i < ps.size(); i++) {
            assertEquals(Quantiles.quantileSeq(data, ps.get(i)), r.get(i));
        }
    }

    @Test
    @Repeat(iterations = 5)
    public void testInputUnchanged() {
        double[] data = randomData(getRandom(), randomIntBetween(1, 300));
        double[] copy = data.clone();
        Quantiles.quantileSeq(data, Arrays.asList(0.1, 0.5, 0.9));
        assertArrayEquals(copy, data, 0);
    }

    private static double number(Object x) {
        return ((Number) x).doubleValue();
    }
}
