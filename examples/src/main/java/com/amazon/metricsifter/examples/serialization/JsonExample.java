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

package com.amazon.metricsifter.examples.serialization;

import com.amazon.metricsifter.MetricSifter;
import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.config.SegmentSelectionMethod;
import com.amazon.metricsifter.examples.Example;
import com.amazon.metricsifter.examples.reduction.IncidentTables;
import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.state.MetricSifterMapper;
import com.amazon.metricsifter.state.MetricSifterState;
import com.amazon.metricsifter.testutils.LevelShiftTestData;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Store the configuration of a MetricSifter as JSON using
 * <a href="https://github.com/FasterXML/jackson">Jackson</a>, and rebuild an
 * equivalent sifter from it.
 */
public class JsonExample implements Example {

    public static void main(String[] args) throws Exception {
        new JsonExample().run();
    }

    @Override
    public String command() {
        return "json";
    }

    @Override
    public String description() {
        return "store a MetricSifter configuration as a JSON string";
    }

    @Override
    public void run() throws Exception {
        MetricSifter sifter = MetricSifter.builder().searchMethod(SearchMethod.BINSEG).penalty("aic")
                .penaltyAdjust(3.0).bandwidth("scott").segmentSelectionMethod(SegmentSelectionMethod.MAX)
                .threadPoolSize(2).build();

        MetricSifterMapper mapper = new MetricSifterMapper();
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapper.toState(sifter));
        System.out.println(json);

        MetricSifter sifter2 = mapper.toModel(jsonMapper.readValue(json, MetricSifterState.class));

        // both sifters must reduce the same table in the same way
        MultivariateSeries series = IncidentTables
                .toSeries(new LevelShiftTestData().generate(100, 20, 20, 60, 8L));
        if (!sifter.run(series).equals(sifter2.run(series))) {
            throw new IllegalStateException("restored sifter does not agree with original sifter");
        }

        System.out.println("Looks good!");
    }
}
