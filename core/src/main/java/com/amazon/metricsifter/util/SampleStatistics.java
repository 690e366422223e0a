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

package com.amazon.metricsifter.util;

import static com.amazon.metricsifter.CommonUtils.checkArgument;

import java.util.Arrays;

/**
 * Summary statistics over metric samples, where {@code NaN} marks a missing
 * value.
 */
public class SampleStatistics {

    private SampleStatistics() {
    }

    public static int countObserved(double[] values) {
        int count = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                ++count;
            }
        }
        return count;
    }

    /**
     * Mean of the observed values; {@code NaN} when nothing is observed.
     *
     * @param values samples, possibly with missing values
     * @return the mean
     */
    public static double mean(double[] values) {
        double sum = 0;
        int count = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                sum += value;
                ++count;
            }
        }
        return (count == 0) ? Double.NaN : sum / count;
    }

    /**
     * Standard deviation of the observed values, computed in two passes.
     *
     * @param values samples, possibly with missing values
     * @param ddof   delta degrees of freedom; 0 for the population standard
     *               deviation, 1 for the sample standard deviation
     * @return the standard deviation, {@code NaN} if fewer than {@code ddof + 1}
     *         values are observed
     */
    public static double standardDeviation(double[] values, int ddof) {
        checkArgument(ddof >= 0, "ddof cannot be negative");
        double mean = mean(values);
        int count = countObserved(values);
        if (count <= ddof) {
            return Double.NaN;
        }
        double sum = 0;
        for (double value : values) {
            if (!Double.isNaN(value)) {
                sum += (value - mean) * (value - mean);
            }
        }
        return Math.sqrt(sum / (count - ddof));
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param sorted     values sorted in ascending order, none missing
     * @param percentile a number in [0, 100]
     * @return the interpolated percentile
     */
    public static double percentile(double[] sorted, double percentile) {
        checkArgument(sorted.length > 0, "cannot take the percentile of an empty sample");
        checkArgument(0 <= percentile && percentile <= 100, "percentile must be in [0,100]");
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }

    /**
     * Median of a segment of an array, without modifying the array.
     *
     * @param values source array, none missing
     * @param start  first index, inclusive
     * @param end    last index, exclusive
     * @return the median
     */
    public static double median(double[] values, int start, int end) {
        checkArgument(start < end, "cannot take the median of an empty segment");
        double[] segment = Arrays.copyOfRange(values, start, end);
        Arrays.sort(segment);
        return percentile(segment, 50);
    }

    /**
     * Replaces every missing value by the last observed value before it; a gap at
     * the beginning takes the first observed value. Used only to feed searches
     * which require complete data.
     *
     * @param values samples, at least one observed
     * @return a filled copy
     */
    public static double[] fillMissing(double[] values) {
        double[] filled = Arrays.copyOf(values, values.length);
        double last = Double.NaN;
        for (int i = 0; i < filled.length; i++) {
            if (Double.isNaN(filled[i])) {
                filled[i] = last;
            } else {
                last = filled[i];
            }
        }
        int first = 0;
        while (first < filled.length && Double.isNaN(filled[first])) {
            ++first;
        }
        checkArgument(first < filled.length, "at least one value must be observed");
        for (int i = 0; i < first; i++) {
            filled[i] = filled[first];
        }
        return filled;
    }
}
