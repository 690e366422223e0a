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
 * Sum of squared deviations from the segment mean, which is also the cost of
 * the linear kernel. Uses prefix sums of the signal centered on its global mean
 * so that every segment costs O(1) without catastrophic cancellation on large
 * offsets.
 */
public class CostL2 extends AbstractSegmentCost {

    private final double[] prefixSum;
    private final double[] prefixSumOfSquares;

    public CostL2(double[] signal) {
        super(signal);
        double mean = 0;
        for (double value : signal) {
            mean += value;
        }
        mean = (signal.length == 0) ? 0 : mean / signal.length;
        prefixSum = new double[signal.length + 1];
        prefixSumOfSquares = new double[signal.length + 1];
        for (int i = 0; i < signal.length; i++) {
            double centered = signal[i] - mean;
            prefixSum[i + 1] = prefixSum[i] + centered;
            prefixSumOfSquares[i + 1] = prefixSumOfSquares[i] + centered * centered;
        }
    }

    @Override
    public int getMinSize() {
        return 1;
    }

    @Override
    protected double segmentError(int start, int end) {
        double sum = prefixSum[end] - prefixSum[start];
        double sumOfSquares = prefixSumOfSquares[end] - prefixSumOfSquares[start];
        return Math.max(0.0, sumOfSquares - sum * sum / (end - start));
    }
}
