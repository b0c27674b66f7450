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

import com.tdunning.math.quantile.unit.IncompatibleUnitsException;
import com.tdunning.math.quantile.unit.Quantity;
import org.junit.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ArithmeticsTest {
    private final Arithmetic<BigDecimal> decimals = Arithmetics.decimals(new MathContext(5));

    @Test
    public void testNumbers() {
        Arithmetic<Number> a = Arithmetics.NUMBERS;
        assertEquals(5.0, a.add(2, 3.0));
        assertEquals(1.5, a.multiply(3, 0.5));
        assertEquals(1.5, a.multiply(3, new BigDecimal("0.5")));
        assertTrue(a.compare(2, 3.5) < 0);
        assertEquals(0, a.compare(2, 2.0));
        assertTrue(a.accepts(1L));
        assertFalse(a.accepts(BigDecimal.ONE));
        assertFalse(a.accepts(BigInteger.ONE));
        assertFalse(a.accepts("1"));
        assertEquals(new BigDecimal("2.5"), a.toPrecise(2.5));
        assertEquals(new BigDecimal(7), a.toPrecise(7));
    }

    @Test
    public void testDecimals() {
        assertEquals(new BigDecimal("3.5"), decimals.add(new BigDecimal("1.2"), new BigDecimal("2.3")));
        assertEquals(new BigDecimal("1.0"), decimals.multiply(new BigDecimal("2"), 0.5));
        // rounded to five digits
        assertEquals(new BigDecimal("0.33333"), decimals.multiply(BigDecimal.ONE, new BigDecimal("0.333333333")));
        assertEquals(0, decimals.compare(new BigDecimal("2.0"), new BigDecimal("2")));
        BigDecimal x = new BigDecimal("1.5");
        assertSame(x, decimals.toPrecise(x));
    }

    @Test
    public void testQuantities() {
        Arithmetic<Quantity> a = Arithmetics.QUANTITIES;
        assertEquals(Quantity.of(150, "cm"), a.add(Quantity.of(50, "cm"), Quantity.of(1, "m")));
        assertEquals(Quantity.of(2.5, "kg"), a.multiply(Quantity.of(5, "kg"), 0.5));
        assertTrue(a.compare(Quantity.of(999, "g"), Quantity.of(1, "kg")) < 0);
        Quantity q = Quantity.of(1, "s");
        assertSame(q, a.toPrecise(q));
    }

    @Test(expected = IncompatibleUnitsException.class)
    public void testQuantitiesIncompatible() {
        Arithmetics.QUANTITIES.add(Quantity.of(1, "s"), Quantity.of(1, "m"));
    }

    @Test
    public void testForValue() {
        MathContext mc = MathContext.DECIMAL64;
        assertSame(Arithmetics.NUMBERS, Arithmetics.forValue(1, mc));
        assertSame(Arithmetics.NUMBERS, Arithmetics.forValue(1.5f, mc));
        assertSame(Arithmetics.QUANTITIES, Arithmetics.forValue(Quantity.of(1, "m"), mc));
        assertTrue(Arithmetics.forValue(BigDecimal.TEN, mc).accepts(BigDecimal.ONE));
    }

    @Test(expected = QuantileTypeException.class)
    public void testForValueRejectsStrings() {
        Arithmetics.forValue("1", MathContext.DECIMAL64);
    }

    @Test(expected = QuantileTypeException.class)
    public void testForValueRejectsNull() {
        Arithmetics.forValue(null, MathContext.DECIMAL64);
    }

    @Test
    public void testCast() {
        assertEquals(3, Arithmetics.NUMBERS.cast(3));
        try {
            Arithmetics.NUMBERS.cast(Quantity.of(3, "m"));
            fail("Numbers should not accept quantities");
        } catch (QuantileTypeException e) {
            assertEquals("Unexpected type of argument in function quantileSeq (value: Quantity 3 m)", e.getMessage());
        }
    }
}
