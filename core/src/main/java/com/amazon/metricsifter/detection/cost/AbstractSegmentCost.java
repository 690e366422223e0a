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

import static com.amazon.metricsifter.CommonUtils.checkArgument;

/**
 * Shared bounds checking for costs over a fully observed signal.
 */
public abstract class AbstractSegmentCost implements ISegmentCost {

    protected final double[] signal;

    protected AbstractSegmentCost(double[] signal) {
        checkArgument(signal != null, "signal cannot be null");
        for (double value : signal) {
            checkArgument(!Double.isNaN(value), "signal cannot contain missing values");
        }
        this.signal = signal;
    }

    @Override
    public int getLength() {
        return signal.length;
    }

    @Override
    public double error(int start, int end) {
        checkArgument(0 <= start && end <= signal.length, "segment out of bounds");
        checkArgument(end - start >= getMinSize(),
                String.format("segment [%d, %d) is shorter than %d", start, end, getMinSize()));
        return segmentError(start, end);
    }

    protected abstract double segmentError(int start, int end);
}
