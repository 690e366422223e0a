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

import static com.amazon.metricsifter.CommonUtils.checkConfiguration;

import java.util.Locale;
import java.util.Objects;

import lombok.Getter;

import com.amazon.metricsifter.ConfigurationException;

/**
 * The cost of adding a changepoint to a segmentation. The penalty is either
 * derived from the variance of the metric being searched (AIC or BIC style) or
 * a literal value. In both cases it is multiplied by the penalty adjustment of
 * the sifter.
 */
@Getter
public final class Penalty {

    public enum Type {
        /**
         * the variance of the metric
         */
        AIC,
        /**
         * the variance of the metric times the log of the series length
         */
        BIC,
        /**
         * a fixed value, independent of the metric
         */
        FIXED
    }

    public static final Penalty AIC = new Penalty(Type.AIC, 0.0);

    public static final Penalty BIC = new Penalty(Type.BIC, 0.0);

    private final Type type;

    private final double value;

    private Penalty(Type type, double value) {
        this.type = type;
        this.value = value;
    }

    public static Penalty fixed(double value) {
        checkConfiguration(Double.isFinite(value) && value >= 0, "penalty must be a finite non-negative number");
        return new Penalty(Type.FIXED, value);
    }

    /**
     * Parses "aic", "bic" (ignoring case) or a decimal literal.
     *
     * @param text the penalty keyword or literal
     * @return the penalty
     * @throws ConfigurationException if the text is neither a keyword nor a number
     */
    public static Penalty parse(String text) {
        checkConfiguration(text != null, "penalty cannot be null");
        String keyword = text.trim().toLowerCase(Locale.ROOT);
        if (keyword.equals("aic")) {
            return AIC;
        } else if (keyword.equals("bic")) {
            return BIC;
        }
        try {
            return fixed(Double.parseDouble(keyword));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("unparseable penalty: " + text, e);
        }
    }

    /**
     * Computes the numeric penalty for a metric.
     *
     * @param sigma          standard deviation over the observed values of the
     *                       metric
     * @param length         number of samples of the metric, missing ones included
     * @param penaltyAdjust  multiplier applied to the derived penalty
     * @return the penalty passed to the changepoint search
     */
    public double compute(double sigma, int length, double penaltyAdjust) {
        double base;
        switch (type) {
        case AIC:
            base = sigma * sigma;
            break;
        case BIC:
            base = Math.log(length) * sigma * sigma;
            break;
        default:
            base = value;
        }
        return base * penaltyAdjust;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Penalty)) {
            return false;
        }
        Penalty other = (Penalty) o;
        return type == other.type && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /**
     * @return the keyword or the literal, in a form accepted by
     *         {@link #parse(String)}
     */
    @Override
    public String toString() {
        return (type == Type.FIXED) ? Double.toString(value) : type.name().toLowerCase(Locale.ROOT);
    }
}
