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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A physical unit, described by the dimension it measures and its size relative to the
 * base unit of that dimension.
 */
public final class Unit {
    public static final Unit M = new Unit("m", "length", 1);
    public static final Unit CM = new Unit("cm", "length", 0.01);
    public static final Unit MM = new Unit("mm", "length", 0.001);
    public static final Unit KM = new Unit("km", "length", 1000);
    public static final Unit INCH = new Unit("inch", "length", 0.0254);

    public static final Unit G = new Unit("g", "mass", 0.001);
    public static final Unit KG = new Unit("kg", "mass", 1);

    public static final Unit S = new Unit("s", "time", 1);
    public static final Unit MS = new Unit("ms", "time", 0.001);
    public static final Unit MIN = new Unit("min", "time", 60);
    public static final Unit H = new Unit("h", "time", 3600);

    public static final Unit K = new Unit("K", "temperature", 1);

    private static final Map<String, Unit> UNITS;

    static {
        ImmutableMap.Builder<String, Unit> builder = ImmutableMap.builder();
        for (Unit unit : new Unit[]{M, CM, MM, KM, INCH, G, KG, S, MS, MIN, H, K}) {
            builder.put(unit.symbol, unit);
        }
        UNITS = builder.build();
    }

    private final String symbol;
    private final String dimension;
    private final double factor;

    private Unit(String symbol, String dimension, double factor) {
        this.symbol = symbol;
        this.dimension = dimension;
        this.factor = factor;
    }

    /**
     * Looks up a unit by its symbol.
     *
     * @param symbol The unit symbol, for instance "cm".
     * @return The unit.
     * @throws IllegalArgumentException if the symbol is not known.
     */
    public static Unit parse(String symbol) {
        Unit unit = UNITS.get(symbol);
        if (unit == null) {
            throw new IllegalArgumentException(String.format("Unit \"%s\" not found", symbol));
        }
        return unit;
    }

    public String symbol() {
        return symbol;
    }

    public String dimension() {
        return dimension;
    }

    /**
     * Returns how many base units one of this unit is.
     */
    public double factor() {
        return factor;
    }

    public boolean equalBase(Unit other) {
        return dimension.equals(other.dimension);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
