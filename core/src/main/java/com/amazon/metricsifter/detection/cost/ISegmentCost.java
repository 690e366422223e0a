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
 * The cost of modeling a contiguous segment of a signal as homogeneous. Lower
 * is better; a changepoint search minimizes the sum of the costs of its
 * segments plus a penalty per segment.
 */
public interface ISegmentCost {

    /**
     * @return the number of samples of the signal
     */
    int getLength();

    /**
     * @return the smallest segment length for which {@link #error(int, int)} is
     *         defined
     */
    int getMinSize();

    /**
     * The cost of the segment {@code [start, end)}.
     *
     * @param start first index, inclusive
     * @param end   last index, exclusive
     * @return the cost, never negative for L1 and L2
     */
    double error(int start, int end);
}
