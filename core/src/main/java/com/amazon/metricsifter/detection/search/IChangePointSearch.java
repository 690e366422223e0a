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

package com.amazon.metricsifter.detection.search;

import java.util.List;

import com.amazon.metricsifter.detection.cost.ISegmentCost;

/**
 * A penalized changepoint search over a single signal.
 */
public interface IChangePointSearch {

    /**
     * Segments the signal behind {@code cost}.
     *
     * @param cost    the segment cost, which also carries the signal length
     * @param penalty the cost of every additional segment
     * @return the ends of the segments in ascending order; the last element is
     *         always the signal length
     */
    List<Integer> search(ISegmentCost cost, double penalty);
}
