/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.metricsifter.config;

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkConfiguration;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import lombok.Getter;

import com.amazon.metricsifter.ConfigurationException;
import com.amazon.metricsifter.util.SampleStatistics;

/**
 * The bandwidth of the Gaussian kernel used to estimate the density of
 * changepoints over time. It is either a fixed value, in units of time steps,
 * or chosen from the data by a normal reference rule.
 */
@Getter
public final class Bandwidth {

    public enum Rule {
        /**
         * a fixed bandwidth
         */
        FIXED,
        /**
         * Scott's rule of thumb, 1.059 * A * n^(-1/5)
         */
        SCOTT,
        /**
         * Silverman's rule of thumb, 0.9 * A * n^(-1/5)
         */
        SILVERMAN
    }

    static final double IQR_TO_SIGMA = 1.349;

    public static final Bandwidth SCOTT = new Bandwidth(Rule.SCOTT, 0.0);

    public static final Bandwidth SILVERMAN = new Bandwidth(Rule.SILVERMAN, 0.0);

    private final Rule rule;

    private final double value;

    private Bandwidth(Rule rule, double value) {
        this.rule = rule;
        this.value = value;
    }

    public static Bandwidth fixed(double value) {
        checkConfiguration(Double.isFinite(value) && value > 0, "bandwidth must be a finite positive number");
        return new Bandwidth(Rule.FIXED, value);
    }

    /**
     * Parses "scott", "silverman" (ignoring case) or a positive decimal literal.
     *
     * @param text the rule name or literal
     * @return the bandwidth
     * @throws ConfigurationException if the text is neither a rule nor a number
     */
    public static Bandwidth parse(String text) {
        checkConfiguration(text != null, "bandwidth cannot be null");
        String keyword = text.trim().toLowerCase(Locale.ROOT);
        if (keyword.equals("scott")) {
            return SCOTT;
        } else if (keyword.equals("silverman")) {
            return SILVERMAN;
        }
        try {
            return fixed(Double.parseDouble(keyword));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("unparseable bandwidth: " + text, e);
        }
    }

    /**
     * Resolves the bandwidth for a sample. The sample must have a positive
     * standard deviation when a rule is used.
     *
     * @param sample the values the density is estimated over
     * @return a positive bandwidth
     */
    public double select(double[] sample) {
        if (rule == Rule.FIXED) {
            return value;
        }
        checkArgument(sample.length > 1, "a bandwidth rule needs at least two values");
        double spread = SampleStatistics.standardDeviation(sample, 1);
        double[] sorted = Arrays.copyOf(sample, sample.length);
        Arrays.sort(sorted);
        double iqr = (SampleStatistics.percentile(sorted, 75) - SampleStatistics.percentile(sorted, 25))
                / IQR_TO_SIGMA;
        if (iqr > 0) {
            spread = Math.min(spread, iqr);
        }
        double constant = (rule == Rule.SCOTT) ? 1.059 : 0.9;
        double bandwidth = constant * spread * Math.pow(sample.length, -0.2);
        checkArgument(bandwidth > 0, "bandwidth rule needs a sample with positive spread");
        return bandwidth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Bandwidth)) {
            return false;
        }
        Bandwidth other = (Bandwidth) o;
        return rule == other.rule && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, value);
    }

    @Override
    public String toString() {
        return (rule == Rule.FIXED) ? Double.toString(value) : rule.name().toLowerCase(Locale.ROOT);
    }
}
