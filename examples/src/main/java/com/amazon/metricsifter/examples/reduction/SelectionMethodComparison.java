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

package com.amazon.metricsifter.examples.reduction;

import com.amazon.metricsifter.MetricSifter;
import com.amazon.metricsifter.config.SegmentSelectionMethod;
import com.amazon.metricsifter.examples.Example;
import com.amazon.metricsifter.returntypes.SiftResult;
import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.testutils.LevelShiftTestData;

/**
 * Contrasts the two segment selection methods on a table where a group of
 * unstable metrics, each with many changepoints early on, competes with a
 * smaller group of metrics with a single sharp shift later.
 */
public class SelectionMethodComparison implements Example {

    public static void main(String[] args) throws Exception {
        new SelectionMethodComparison().run();
    }

    @Override
    public String command() {
        return "selection";
    }

    @Override
    public String description() {
        return "compare the max and weighted_max segment selection methods";
    }

    @Override
    public void run() throws Exception {
        int length = 100;
        MultivariateSeries.Builder builder = MultivariateSeries.builder(length);
        for (int j = 0; j < 6; j++) {
            double[] flapping = new double[length];
            for (int i = 0; i < length; i++) {
                flapping[i] = (i >= 10 && i < 30 && (i / 3) % 2 == 0) ? 10 : 0;
            }
            builder.column("flapping_" + j, flapping);
        }
        for (int j = 0; j < 4; j++) {
            double[] shifted = LevelShiftTestData.constant(length, 0);
            for (int i = 70; i < length; i++) {
                shifted[i] = 10;
            }
            builder.column("shifted_" + j, shifted);
        }
        MultivariateSeries series = builder.build();

        for (SegmentSelectionMethod method : SegmentSelectionMethod.values()) {
            MetricSifter sifter = MetricSifter.builder().segmentSelectionMethod(method).build();
            SiftResult result = sifter.sift(series);
            System.out.printf("%-12s -> %s%n", method, result.getSeries().getMetrics());
            result.getSegment().ifPresent(segment -> System.out.printf("%-12s    segment [%d, %d]%n", "",
                    segment.getStartTime(), segment.getEndTime()));
        }
    }
}
