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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.Logger;

import com.amazon.metricsifter.config.Bandwidth;
import com.amazon.metricsifter.config.CostModel;
import com.amazon.metricsifter.config.Penalty;
import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.config.SegmentSelectionMethod;
import com.amazon.metricsifter.executor.ParallelColumnExecutor;
import com.amazon.metricsifter.executor.SequentialColumnExecutor;
import com.amazon.metricsifter.returntypes.Segment;
import com.amazon.metricsifter.returntypes.SiftResult;
import com.amazon.metricsifter.returntypes.SiftStage;
import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.testutils.IncidentData;
import com.amazon.metricsifter.testutils.LevelShiftTestData;

public class MetricSifterTest {

    private static final long SEED = 7L;

    private static MultivariateSeries toSeries(IncidentData data) {
        return MultivariateSeries.fromRows(data.names, data.toRows());
    }

    private static IncidentData incident() {
        return new LevelShiftTestData().generate(100, 50, 50, 50, SEED);
    }

    @Test
    public void testDefaults() {
        MetricSifter sifter = MetricSifter.builder().build();
        assertEquals(SearchMethod.PELT, sifter.getSearchMethod());
        assertEquals(CostModel.L2, sifter.getCostModel());
        assertEquals(Penalty.BIC, sifter.getPenalty());
        assertEquals(2.0, sifter.getPenaltyAdjust());
        assertEquals(Bandwidth.fixed(2.5), sifter.getBandwidth());
        assertEquals(SegmentSelectionMethod.WEIGHTED_MAX, sifter.getSegmentSelectionMethod());
        assertTrue(sifter.isParallelExecutionEnabled());
        assertEquals(Runtime.getRuntime().availableProcessors(), sifter.getThreadPoolSize());
    }

    @Test
    public void testReducesToShiftedMetrics() {
        IncidentData data = incident();
        MetricSifter sifter = MetricSifter.builder().build();
        MultivariateSeries reduced = sifter.run(toSeries(data));
        assertEquals(data.changedNames, reduced.getMetrics());
        assertEquals(100, reduced.length());
    }

    @ParameterizedTest
    @CsvSource({ "PELT,L2,WEIGHTED_MAX", "PELT,L2,MAX", "BINSEG,L2,WEIGHTED_MAX", "BINSEG,L1,WEIGHTED_MAX",
            "BOTTOMUP,L1,WEIGHTED_MAX" })
    public void testSelectedSegment(SearchMethod searchMethod, CostModel costModel, SegmentSelectionMethod method) {
        IncidentData data = incident();
        MetricSifter sifter = MetricSifter.builder().searchMethod(searchMethod).costModel(costModel)
                .segmentSelectionMethod(method).build();
        SiftResult result = sifter.runWithSelectedSegment(toSeries(data));
        assertEquals(SiftStage.DONE, result.getStage());
        Segment segment = result.getSegment().get();
        assertEquals(data.changedNames, segment.getMetrics());
        assertEquals(data.incidentIndex, segment.getStartTime());
        assertEquals(data.incidentIndex, segment.getEndTime());
        assertEquals(data.changedNames, result.getSeries().getMetrics());
        assertFalse(result.getChangePointIndex().isEmpty());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 4 })
    public void testSameResultForAnyThreadPoolSize(int threadPoolSize) {
        MultivariateSeries series = toSeries(incident());
        SiftResult sequential = MetricSifter.builder().parallelExecutionEnabled(false).build().sift(series);
        SiftResult parallel = MetricSifter.builder().threadPoolSize(threadPoolSize).build().sift(series);
        assertEquals(sequential.getSeries(), parallel.getSeries());
        assertEquals(sequential.getSegment(), parallel.getSegment());
        assertEquals(sequential.getChangePointIndex().getChangePointToMetrics(),
                parallel.getChangePointIndex().getChangePointToMetrics());
    }

    @Test
    public void testDegenerateMetricsNeverSurvive() {
        IncidentData data = incident();
        MultivariateSeries.Builder builder = MultivariateSeries.builder(100).columns(data.names, data.columns);
        double[] allMissing = new double[100];
        Arrays.fill(allMissing, Double.NaN);
        builder.column("constant", LevelShiftTestData.constant(100, 3.0));
        builder.column("allMissing", allMissing);
        builder.column("constantWithGaps", LevelShiftTestData.withMissing(LevelShiftTestData.constant(100, 1), 10, 20));
        MultivariateSeries series = builder.build();

        MetricSifter sifter = MetricSifter.builder().build();
        MultivariateSeries detected = sifter.runUpToChangePointDetection(series);
        assertFalse(detected.hasMetric("constant"));
        assertFalse(detected.hasMetric("allMissing"));
        assertFalse(detected.hasMetric("constantWithGaps"));
        assertEquals(data.changedNames, sifter.run(series).getMetrics());
    }

    @Test
    public void testChangePointDetectionOnly() {
        double[] step = new double[40];
        Arrays.fill(step, 20, 40, 10.0);
        MultivariateSeries series = MultivariateSeries.builder(40).column("flat", LevelShiftTestData.constant(40, 1))
                .column("step", step).column("gappy", LevelShiftTestData.withMissing(step, 30, 35)).build();
        MetricSifter sifter = MetricSifter.builder().build();
        assertThat(sifter.runUpToChangePointDetection(series).getMetrics(), contains("step", "gappy"));
    }

    @Test
    public void testAllConstant() {
        MultivariateSeries series = MultivariateSeries.builder(20).column("a", LevelShiftTestData.constant(20, 3))
                .column("b", LevelShiftTestData.constant(20, 4)).column("c", LevelShiftTestData.constant(20, 5))
                .build();
        MetricSifter sifter = MetricSifter.builder().build();
        SiftResult result = sifter.runWithSelectedSegment(series);
        assertEquals(SiftStage.EMPTY_AFTER_FILTER, result.getStage());
        assertTrue(result.getStage().isEarlyExit());
        assertTrue(result.getSeries().isEmpty());
        assertFalse(result.getSegment().isPresent());
        assertTrue(result.getChangePointIndex().isEmpty());
        assertTrue(sifter.run(series).isEmpty());
        assertTrue(sifter.runUpToChangePointDetection(series).isEmpty());
    }

    @Test
    public void testWithoutSimpleFilterKeepsZeroVarianceMetrics() {
        MultivariateSeries series = MultivariateSeries.builder(20).column("a", LevelShiftTestData.constant(20, 3))
                .column("b", LevelShiftTestData.constant(20, 4)).column("c", LevelShiftTestData.constant(20, 5))
                .build();
        Logger logger = mock(Logger.class);
        MetricSifter sifter = MetricSifter.builder().logger(logger).build();
        SiftResult result = sifter.sift(series, true);
        assertEquals(SiftStage.DONE, result.getStage());
        assertThat(result.getSeries().getMetrics(), contains("a", "b", "c"));
        assertEquals(2, result.getSegment().get().getStartTime());
        assertEquals(18, result.getSegment().get().getEndTime());
        assertEquals(3, sifter.runUpToChangePointDetection(series, true).width());
        verify(logger, atLeastOnce()).warn(anyString());
    }

    @Test
    public void testNoColumns() {
        MetricSifter sifter = MetricSifter.builder().build();
        SiftResult result = sifter.sift(MultivariateSeries.empty(50));
        assertEquals(SiftStage.EMPTY_AFTER_FILTER, result.getStage());
        assertEquals(50, result.getSeries().length());
        assertTrue(sifter.run(MultivariateSeries.empty(0)).isEmpty());
    }

    @Test
    public void testNoChangePoints() {
        MultivariateSeries series = MultivariateSeries.builder(3).column("ramp", LevelShiftTestData.ramp(3, 1.0))
                .build();
        SiftResult result = MetricSifter.builder().build().sift(series);
        assertEquals(SiftStage.NO_CHANGEPOINTS, result.getStage());
        assertTrue(result.getSeries().isEmpty());
        assertFalse(result.getSegment().isPresent());
        assertThat(result.getChangePointIndex().getMetricsWithoutChangePoints(), contains("ramp"));
    }

    @Test
    public void testStagesAreLogged() {
        Logger logger = mock(Logger.class);
        MetricSifter sifter = MetricSifter.builder().logger(logger).build();
        SiftResult result = sifter.sift(toSeries(incident()));
        verify(logger).debug(eq("{}: {}"), eq(SiftStage.SELECTED), eq(result.getSegment().get()));
        verify(logger, never()).warn(anyString());
        assertEquals(logger, sifter.getLogger());
    }

    @Test
    public void testStringOptions() {
        MetricSifter sifter = MetricSifter.builder().searchMethod("binseg").costModel("l1").penalty("aic")
                .bandwidth("silverman").segmentSelectionMethod("max").build();
        assertEquals(SearchMethod.BINSEG, sifter.getSearchMethod());
        assertEquals(CostModel.L1, sifter.getCostModel());
        assertEquals(Penalty.AIC, sifter.getPenalty());
        assertEquals(Bandwidth.SILVERMAN, sifter.getBandwidth());
        assertEquals(SegmentSelectionMethod.MAX, sifter.getSegmentSelectionMethod());
        assertEquals(Penalty.fixed(15.0), MetricSifter.builder().penalty(15.0).build().getPenalty());
        assertEquals(Bandwidth.fixed(4.0), MetricSifter.builder().bandwidth(4.0).build().getBandwidth());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().searchMethod("dynp"));
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().costModel("rbf"));
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().penalty("mbic"));
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().bandwidth("wide"));
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().segmentSelectionMethod("min"));
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().penaltyAdjust(0).build());
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().penaltyAdjust(-2).build());
        assertThrows(ConfigurationException.class, () -> MetricSifter.builder().threadPoolSize(0).build());
        assertThrows(ConfigurationException.class,
                () -> MetricSifter.builder().parallelExecutionEnabled(false).threadPoolSize(2).build());
        assertThrows(ConfigurationException.class,
                () -> MetricSifter.builder().searchMethod((SearchMethod) null).build());
        assertThrows(NullPointerException.class, () -> MetricSifter.builder().build().run(null));
    }

    @Test
    public void testExecutorFollowsParallelism() {
        assertThat(MetricSifter.builder().parallelExecutionEnabled(false).build().createExecutor(),
                instanceOf(SequentialColumnExecutor.class));
        assertThat(MetricSifter.builder().threadPoolSize(1).build().createExecutor(),
                instanceOf(SequentialColumnExecutor.class));
        assertThat(MetricSifter.builder().threadPoolSize(3).build().createExecutor(),
                instanceOf(ParallelColumnExecutor.class));
    }

    @Test
    public void testSelectedSegmentWithinSeries() {
        IncidentData data = new LevelShiftTestData(0.0, 1.0, 8.0).generate(60, 5, 5, 30, 11L);
        SiftResult result = MetricSifter.builder().build().sift(toSeries(data));
        result.getSegment().ifPresent(segment -> {
            assertTrue(segment.getStartTime() >= 0);
            assertTrue(segment.getStartTime() <= segment.getEndTime());
            assertTrue(segment.getEndTime() <= 59);
        });
        assertEquals(data.changedNames, result.getSeries().getMetrics());
    }
}
