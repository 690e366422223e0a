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

package com.amazon.metricsifter.segmentation;

import static com.amazon.metricsifter.CommonUtils.checkArgument;

import java.util.Map;
import java.util.TreeMap;

/**
 * A one dimensional Gaussian kernel density estimate. Densities are evaluated
 * in log space with a log-sum-exp over the distinct sample values, so that
 * positions far away from every sample keep a finite, strictly monotone value
 * instead of underflowing to zero.
 */
public class GaussianKernelDensity {

    private static final double LOG_SQRT_TWO_PI = 0.5 * Math.log(2 * Math.PI);

    private final double bandwidth;

    private final double[] values;

    private final double[] logWeights;

    private final double logNormalizer;

    public GaussianKernelDensity(double[] sample, double bandwidth) {
        checkArgument(sample != null && sample.length > 0, "sample cannot be empty");
        checkArgument(Double.isFinite(bandwidth) && bandwidth > 0, "bandwidth must be a finite positive number");
        this.bandwidth = bandwidth;
        TreeMap<Double, Integer> counts = new TreeMap<>();
        for (double value : sample) {
            checkArgument(Double.isFinite(value), "sample values must be finite");
            counts.merge(value, 1, Integer::sum);
        }
        values = new double[counts.size()];
        logWeights = new double[counts.size()];
        int i = 0;
        for (Map.Entry<Double, Integer> entry : counts.entrySet()) {
            values[i] = entry.getKey();
            logWeights[i] = Math.log(entry.getValue());
            ++i;
        }
        logNormalizer = -Math.log(sample.length) - Math.log(bandwidth) - LOG_SQRT_TWO_PI;
    }

    public double getBandwidth() {
        return bandwidth;
    }

    /**
     * @param x a position
     * @return the log of the estimated density at {@code x}
     */
    public double logDensity(double x) {
        double max = Double.NEGATIVE_INFINITY;
        double[] exponents = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double z = (x - values[i]) / bandwidth;
            exponents[i] = logWeights[i] - 0.5 * z * z;
            max = Math.max(max, exponents[i]);
        }
        double sum = 0;
        for (double exponent : exponents) {
            sum += Math.exp(exponent - max);
        }
        return logNormalizer + max + Math.log(sum);
    }

    public double density(double x) {
        return Math.exp(logDensity(x));
    }

    /**
     * Evaluates the log density at the integer positions {@code 0..length-1}.
     *
     * @param length number of positions
     * @return the log densities
     */
    public double[] logDensityGrid(int length) {
        double[] grid = new double[length];
        for (int t = 0; t < length; t++) {
            grid[t] = logDensity(t);
        }
        return grid;
    }
}
