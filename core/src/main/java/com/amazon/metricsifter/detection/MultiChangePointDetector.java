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

package com.amazon.metricsifter.detection;

import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.List;

import com.amazon.metricsifter.executor.AbstractColumnExecutor;
import com.amazon.metricsifter.series.MultivariateSeries;

/**
 * Runs a {@link ChangePointDetector} over every metric of a table. Metrics are
 * independent, so each one is a unit of work for the executor; the results are
 * merged in column order.
 */
public class MultiChangePointDetector {

    private final ChangePointDetector detector;

    public MultiChangePointDetector(ChangePointDetector detector) {
        this.detector = checkNotNull(detector, "detector cannot be null");
    }

    public ChangePointIndex detect(MultivariateSeries series, AbstractColumnExecutor executor) {
        checkNotNull(series, "series cannot be null");
        checkNotNull(executor, "executor cannot be null");
        List<String> metrics = series.getMetrics();
        List<int[]> changePoints = executor.map(metrics, metric -> detector.detect(series.getColumn(metric)));
        return ChangePointIndex.of(series.length(), metrics, changePoints);
    }
}
