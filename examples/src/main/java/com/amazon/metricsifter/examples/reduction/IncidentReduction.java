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
import com.amazon.metricsifter.examples.Example;
import com.amazon.metricsifter.returntypes.SiftResult;
import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.testutils.IncidentData;
import com.amazon.metricsifter.testutils.LevelShiftTestData;

/**
 * Reduces a table of metrics around a simulated incident. Half of the metrics
 * shift their level at the incident, the other half are noise; a few constant
 * and partially missing metrics are added to show the simple change filter at
 * work.
 */
public class IncidentReduction implements Example {

    public static void main(String[] args) throws Exception {
        new IncidentReduction().run();
    }

    @Override
    public String command() {
        return "incident";
    }

    @Override
    public String description() {
        return "reduce the metrics of a simulated incident to the ones that changed";
    }

    @Override
    public void run() throws Exception {
        int length = 120;
        int incidentIndex = 80;
        IncidentData data = new LevelShiftTestData().generate(length, 40, 160, incidentIndex, 7L);

        MultivariateSeries.Builder builder = MultivariateSeries.builder(length).columns(data.names, data.columns);
        for (int j = 0; j < 10; j++) {
            builder.column("idle_" + j, LevelShiftTestData.constant(length, j));
        }
        builder.column("scrape_gap", LevelShiftTestData.withMissing(LevelShiftTestData.constant(length, 1), 20, 30));
        MultivariateSeries series = builder.build();

        MetricSifter sifter = MetricSifter.builder().build();
        long start = System.currentTimeMillis();
        SiftResult result = sifter.sift(series);
        long elapsed = System.currentTimeMillis() - start;

        System.out.printf("metrics = %d, length = %d, incident at %d%n", series.width(), length, incidentIndex);
        System.out.printf("stage = %s, elapsed = %d ms%n", result.getStage(), elapsed);
        result.getSegment().ifPresent(segment -> System.out.printf("segment %d covers [%d, %d]%n",
                segment.getLabel(), segment.getStartTime(), segment.getEndTime()));
        System.out.println(IncidentTables.score(data.changedNames, result.getSeries().getMetrics()));
    }
}
