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
import com.amazon.metricsifter.config.CostModel;
import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.examples.Example;
import com.amazon.metricsifter.returntypes.SiftResult;
import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.testutils.IncidentData;
import com.amazon.metricsifter.testutils.LevelShiftTestData;

/**
 * Runs every search method with every cost model over the same incident and
 * reports the quality of the reduction and the time spent.
 */
public class SearchMethodComparison implements Example {

    public static void main(String[] args) throws Exception {
        new SearchMethodComparison().run();
    }

    @Override
    public String command() {
        return "searches";
    }

    @Override
    public String description() {
        return "compare changepoint search methods and cost models on one incident";
    }

    @Override
    public void run() throws Exception {
        IncidentData data = new LevelShiftTestData().generate(100, 30, 70, 50, 29L);
        MultivariateSeries series = IncidentTables.toSeries(data);

        for (SearchMethod searchMethod : SearchMethod.values()) {
            for (CostModel costModel : CostModel.values()) {
                if (searchMethod == SearchMethod.PELT && costModel != CostModel.L2) {
                    // pelt always uses the l2 cost
                    continue;
                }
                MetricSifter sifter = MetricSifter.builder().searchMethod(searchMethod).costModel(costModel).build();
                long start = System.currentTimeMillis();
                SiftResult result = sifter.sift(series);
                long elapsed = System.currentTimeMillis() - start;
                System.out.printf("%-8s %-6s %5d ms  %s%n", searchMethod, costModel, elapsed,
                        IncidentTables.score(data.changedNames, result.getSeries().getMetrics()));
            }
        }
    }
}
