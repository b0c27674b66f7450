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

import org.junit.Test;

import java.math.BigDecimal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ProbabilityTest {
    @Test
    public void testNativeRank() {
        Rank r = Probability.of(0.5).rank(4);
        assertFalse(r.isExact());
        assertEquals(1, r.index());
        assertEquals(0.5, r.fraction().doubleValue(), 0);
        assertEquals(0.5, r.complement().doubleValue(), 0);

        r = Probability.of(0.5).rank(5);
        assertTrue(r.isExact());
        assertEquals(2, r.index());

        r = Probability.of(1).rank(7);
        assertTrue(r.isExact());
        assertEquals(6, r.index());

        r = Probability.of(0.9).rank(4);
        assertEquals(2, r.index());
        assertEquals(0.7, r.fraction().doubleValue(), 1e-12);
        assertEquals(0.3, r.complement().doubleValue(), 1e-12);
    }

    @Test
    public void testPreciseRank() {
        Rank r = Probability.of(new BigDecimal("0.1")).rank(11);
        assertTrue(r.isExact());
        assertEquals(1, r.index());

        r = Probability.of(new BigDecimal("0.35")).rank(3);
        assertFalse(r.isExact());
        assertEquals(0, r.index());
        assertEquals(new BigDecimal("0.70"), r.fraction());
        assertEquals(new BigDecimal("0.30"), r.complement());

        r = Probability.of(new BigDecimal("0.75")).rank(11);
        assertEquals(7, r.index());
        assertEquals(0, new BigDecimal("0.5").compareTo((BigDecimal) r.fraction()));
    }

    @Test
    public void testIsInteger() {
        assertTrue(Probability.of(3).isInteger());
        assertFalse(Probability.of(2.5).isInteger());
        assertFalse(Probability.of(Double.POSITIVE_INFINITY).isInteger());
        assertFalse(Probability.of(Double.NaN).isInteger());
        assertTrue(Probability.of(new BigDecimal("3.000")).isInteger());
        assertTrue(Probability.of(new BigDecimal("3E+2")).isInteger());
        assertTrue(Probability.of(BigDecimal.ZERO.setScale(5)).isInteger());
        assertFalse(Probability.of(new BigDecimal("3.001")).isInteger());
    }

    @Test
    public void testRanges() {
        assertTrue(Probability.of(-0.0001).isNegative());
        assertFalse(Probability.of(0).isNegative());
        assertTrue(Probability.of(1).isAtMostOne());
        assertFalse(Probability.of(1.0000001).isAtMostOne());
        assertTrue(Probability.of(new BigDecimal("-1E-30")).isNegative());
        assertTrue(Probability.of(new BigDecimal("1.000")).isAtMostOne());
        assertFalse(Probability.of(new BigDecimal("1.0000000000000000000000000001")).isAtMostOne());
    }
}
