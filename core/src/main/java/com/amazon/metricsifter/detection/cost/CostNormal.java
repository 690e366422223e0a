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

package com.amazon.metricsifter.detection.cost;

/**
 * Negative log likelihood (up to constants) of a Gaussian segment with its own
 * mean and variance: segment length times the log of the sample variance. A
 * small constant is added to the variance so that constant segments have a
 * finite cost.
 */
public class CostNormal extends AbstractSegmentCost {

    static final double VARIANCE_REGULARIZER = 1e-6;

    public CostNormal(double[] signal) {
        super(signal);
    }

    @Override
    public int getMinSize() {
        return 2;
    }

    @Override
    protected double segmentError(int start, int end) {
        int n = end - start;
        double mean = 0;
        for (int i = start; i < end; i++) {
            mean += signal[i];
        }
        mean /= n;
        double sum = 0;
        for (int i = start; i < end; i++) {
            sum += (signal[i] - mean) * (signal[i] - mean);
        }
        double variance = sum / (n - 1) + VARIANCE_REGULARIZER;
        return n * Math.log(variance);
    }
}
