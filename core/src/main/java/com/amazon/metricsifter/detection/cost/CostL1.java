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

import com.amazon.metricsifter.util.SampleStatistics;

/**
 * Sum of absolute deviations from the segment median; robust to outliers.
 */
public class CostL1 extends AbstractSegmentCost {

    public CostL1(double[] signal) {
        super(signal);
    }

    @Override
    public int getMinSize() {
        return 1;
    }

    @Override
    protected double segmentError(int start, int end) {
        double median = SampleStatistics.median(signal, start, end);
        double sum = 0;
        for (int i = start; i < end; i++) {
            sum += Math.abs(signal[i] - median);
        }
        return sum;
    }
}
