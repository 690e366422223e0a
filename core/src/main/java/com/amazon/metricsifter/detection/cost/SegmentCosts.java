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

import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import com.amazon.metricsifter.config.CostModel;

public class SegmentCosts {

    private SegmentCosts() {
    }

    /**
     * Creates the cost of a model over a fully observed signal.
     *
     * @param model  the cost model
     * @param signal the samples, without missing values
     * @return the cost
     */
    public static ISegmentCost create(CostModel model, double[] signal) {
        checkNotNull(model, "cost model cannot be null");
        switch (model) {
        case L1:
            return new CostL1(signal);
        case NORMAL:
            return new CostNormal(signal);
        default:
            return new CostL2(signal);
        }
    }
}
