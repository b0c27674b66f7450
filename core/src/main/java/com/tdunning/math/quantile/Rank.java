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

/**
 * A fractional position in a sorted sequence.  The integer part is the position of the
 * lower order statistic and the fractional part is the weight of the upper one.
 */
public final class Rank {
    private final int index;
    private final boolean exact;
    private final Number fraction;
    private final Number complement;

    private Rank(int index, boolean exact, Number fraction, Number complement) {
        this.index = index;
        this.exact = exact;
        this.fraction = fraction;
        this.complement = complement;
    }

    static Rank exact(int index) {
        return new Rank(index, true, 0.0, 1.0);
    }

    static Rank between(int index, Number fraction, Number complement) {
        return new Rank(index, false, fraction, complement);
    }

    /**
     * The integer part of the rank.
     */
    public int index() {
        return index;
    }

    /**
     * True if the rank has no fractional part.
     */
    public boolean isExact() {
        return exact;
    }

    /**
     * The fractional part, in the representation of the probability it came from.
     */
    public Number fraction() {
        return fraction;
    }

    /**
     * One minus the fractional part.
     */
    public Number complement() {
        return complement;
    }

    @Override
    public String toString() {
        return exact ? Integer.toString(index) : index + "+" + fraction;
    }
}
