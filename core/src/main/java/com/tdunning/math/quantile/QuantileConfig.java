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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.MathContext;
import java.util.Properties;

/**
 * Settings for quantile computations.  The defaults are read from a
 * {@code quantile.properties} file in the working directory if there is one, and from
 * the classpath otherwise.
 */
public class QuantileConfig {
    private static final Logger log = LoggerFactory.getLogger(QuantileConfig.class);

    public static final String PROPERTIES_FILE_NAME = "quantile.properties";
    public static final String PRECISION_KEY = "quantile.precision";
    public static final String MAX_COUNT_KEY = "quantile.maxCount";

    public static final int DEFAULT_PRECISION = 64;
    public static final long DEFAULT_MAX_COUNT = 4294967295L;

    private final MathContext mathContext;
    private final long maxCount;

    public QuantileConfig(int precision, long maxCount) {
        Preconditions.checkArgument(precision > 0, "%s must be positive, got %d", PRECISION_KEY, precision);
        Preconditions.checkArgument(maxCount >= 1, "%s must be at least 1, got %d", MAX_COUNT_KEY, maxCount);
        this.mathContext = new MathContext(precision);
        this.maxCount = maxCount;
    }

    public QuantileConfig(Properties props) {
        this(parseInt(props, PRECISION_KEY, DEFAULT_PRECISION), parseLong(props, MAX_COUNT_KEY, DEFAULT_MAX_COUNT));
    }

    /**
     * The shared settings, loaded on first use.
     */
    public static QuantileConfig defaults() {
        return Holder.DEFAULTS;
    }

    /**
     * Precision used for arbitrary precision sums, products and divisions.
     */
    public MathContext mathContext() {
        return mathContext;
    }

    /**
     * The largest count of evenly spaced quantiles accepted in arbitrary precision.
     */
    public long maxCount() {
        return maxCount;
    }

    static QuantileConfig load(String fileName) {
        Properties props = new Properties();
        File f = new File(fileName);
        try (InputStream is = f.exists() ?
                new FileInputStream(f)
                : QuantileConfig.class.getClassLoader().getResourceAsStream(fileName)) {
            if (is != null) {
                props.load(is);
                log.debug("Loaded quantile settings from {}: {}", f.exists() ? f.getAbsolutePath() : "classpath", props);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using default quantile settings", fileName, e);
            props.clear();
        }
        return new QuantileConfig(props);
    }

    private static int parseInt(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s must be an integer, got \"%s\"", key, value), e);
        }
    }

    private static long parseLong(Properties props, String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("%s must be an integer, got \"%s\"", key, value), e);
        }
    }

    @Override
    public String toString() {
        return String.format("QuantileConfig{precision=%d, maxCount=%d}", mathContext.getPrecision(), maxCount);
    }

    private static class Holder {
        static final QuantileConfig DEFAULTS = load(PROPERTIES_FILE_NAME);
    }
}
