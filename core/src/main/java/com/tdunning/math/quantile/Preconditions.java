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
 * Argument checks that raise the quantile error taxonomy.
 */
public class Preconditions {

    static final String UNEXPECTED_TYPE = "Unexpected type of argument in function quantileSeq";

    private Preconditions() {
    }

    /**
     * Ensures that a numeric argument is inside its allowed range.
     *
     * @param expression   a boolean expression
     * @param errorMessage the exception message to use if the check fails
     * @throws QuantileDomainException if {@code expression} is false
     */
    public static void checkDomain(boolean expression, String errorMessage) {
        if (!expression) {
            throw new QuantileDomainException(errorMessage);
        }
    }

    /**
     * Ensures that an argument is one of the recognized kinds.
     *
     * @param expression a boolean expression
     * @param value      the offending value, reported in the message
     * @throws QuantileTypeException if {@code expression} is false
     */
    public static void checkType(boolean expression, Object value) {
        if (!expression) {
            throw new QuantileTypeException(String.format("%s (value: %s)", UNEXPECTED_TYPE, describe(value)));
        }
    }

    /**
     * Ensures that a call was made with a supported number of arguments.
     *
     * @param expression   a boolean expression
     * @param errorMessage the exception message to use if the check fails
     * @throws QuantileUsageException if {@code expression} is false
     */
    public static void checkUsage(boolean expression, String errorMessage) {
        if (!expression) {
            throw new QuantileUsageException(errorMessage);
        }
    }

    /**
     * Ensures the truth of an expression involving one or more parameters to the calling method.
     *
     * @param expression   a boolean expression
     * @param errorMessage the exception message template, formatted with {@code args}
     * @param args         arguments for the template
     * @throws IllegalArgumentException if {@code expression} is false
     */
    public static void checkArgument(boolean expression, String errorMessage, Object... args) {
        if (!expression) {
            throw new IllegalArgumentException(String.format(errorMessage, args));
        }
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value.getClass().getSimpleName() + " " + value;
    }
}
