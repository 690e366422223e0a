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

package com.amazon.metricsifter;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.returntypes.SiftResult;
import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.testutils.IncidentData;
import com.amazon.metricsifter.testutils.LevelShiftTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class MetricSifterBenchmark {

    public final static int LENGTH = 180;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "100", "1000" })
        int numberOfMetrics;

        @Param({ "PELT", "BINSEG", "BOTTOMUP" })
        String searchMethod;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        MultivariateSeries series;
        MetricSifter sifter;

        @Setup(Level.Trial)
        public void setUpData() {
            int shifted = numberOfMetrics / 10;
            IncidentData data = new LevelShiftTestData().generate(LENGTH, shifted, numberOfMetrics - shifted,
                    LENGTH * 2 / 3, 99L);
            series = MultivariateSeries.fromRows(data.names, data.toRows());
        }

        @Setup(Level.Trial)
        public void setUpSifter() {
            sifter = MetricSifter.builder().searchMethod(SearchMethod.valueOf(searchMethod))
                    .parallelExecutionEnabled(parallelExecutionEnabled).build();
        }
    }

    @Benchmark
    public SiftResult sift(BenchmarkState state) {
        return state.sifter.sift(state.series);
    }

    @Benchmark
    public MultivariateSeries runUpToChangePointDetection(BenchmarkState state, Blackhole blackhole) {
        MultivariateSeries changed = state.sifter.runUpToChangePointDetection(state.series);
        blackhole.consume(changed.width());
        return changed;
    }
}
