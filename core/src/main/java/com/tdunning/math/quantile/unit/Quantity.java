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

package com.tdunning.math.quantile.unit;

/**
 * A number tagged with a physical unit.  Quantities of the same dimension can be added,
 * scaled and compared; mixing dimensions raises {@link IncompatibleUnitsException}.
 */
public final class Quantity implements Comparable<Quantity> {
    private final double value;
    private final Unit unit;

    public Quantity(double value, Unit unit) {
        if (unit == null) {
            throw new NullPointerException("unit");
        }
        this.value = value;
        this.unit = unit;
    }

    public static Quantity of(double value, String unit) {
        return new Quantity(value, Unit.parse(unit));
    }

    public double value() {
        return value;
    }

    public Unit unit() {
        return unit;
    }

    /**
     * The value expressed in the base unit of this quantity's dimension.
     */
    public double baseValue() {
        return value * unit.factor();
    }

    public Quantity to(Unit target) {
        checkCompatible(target);
        if (target == unit) {
            return this;
        }
        return new Quantity(baseValue() / target.factor(), target);
    }

    /**
     * Adds another quantity.  The result is expressed in this quantity's unit.
     */
    public Quantity plus(Quantity other) {
        checkCompatible(other.unit);
        return new Quantity(value + other.to(unit).value, unit);
    }

    public Quantity scale(double factor) {
        return new Quantity(value * factor, unit);
    }

    @Override
    public int compareTo(Quantity other) {
        checkCompatible(other.unit);
        return Double.compare(baseValue(), other.baseValue());
    }

    private void checkCompatible(Unit other) {
        if (!unit.equalBase(other)) {
            throw new IncompatibleUnitsException(unit, other);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Quantity)) {
            return false;
        }
        Quantity other = (Quantity) o;
        return Double.compare(value, other.value) == 0 && unit == other.unit;
    }

    @Override
    public int hashCode() {
        long bits = Double.doubleToLongBits(value);
        return 31 * (int) (bits ^ (bits >>> 32)) + unit.hashCode();
    }

    @Override
    public String toString() {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.format("%d %s", (long) value, unit);
        }
        return value + " " + unit;
    }
}
