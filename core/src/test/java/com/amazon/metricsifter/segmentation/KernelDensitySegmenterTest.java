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

package com.amazon.metricsifter.segmentation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.metricsifter.config.Bandwidth;
import com.amazon.metricsifter.detection.ChangePointIndex;
import com.amazon.metricsifter.segmentation.KernelDensitySegmenter.MetricSegmentation;

public class KernelDensitySegmenterTest {

    private final KernelDensitySegmenter segmenter = new KernelDensitySegmenter(Bandwidth.fixed(2.5));

    @Test
    public void testTwoClusters() {
        int[] changePoints = { 10, 12, 14, 50, 52, 54 };
        KernelDensitySegmentation segmentation = segmenter.segment(changePoints, 100, true);
        assertArrayEquals(new int[] { 32 }, segmentation.getBoundaries());
        assertArrayEquals(new int[] { 0, 0, 0, 1, 1, 1 }, segmentation.getLabels());
        assertEquals(2, segmentation.getNumberOfLabels());
        assertArrayEquals(new int[] { 10, 12, 14 }, segmentation.getChangePoints(0));
        assertArrayEquals(new int[] { 50, 52, 54 }, segmentation.getChangePoints(1));
        assertArrayEquals(new int[0], segmentation.getChangePoints(2));
    }

    @Test
    public void testSingleCluster() {
        KernelDensitySegmentation segmentation = segmenter.segment(new int[] { 50, 51, 52, 53, 54 }, 100, true);
        assertEquals(0, segmentation.getBoundaries().length);
        assertThat(segmentation.getLabelToChangePoints().keySet(), contains(0));
        assertArrayEquals(new int[] { 50, 51, 52, 53, 54 }, segmentation.getChangePoints(0));
    }

    @Test
    public void testIdenticalChangePoints() {
        KernelDensitySegmentation unique = segmenter.segment(new int[] { 50, 50, 50, 50 }, 100, true);
        assertArrayEquals(new int[] { 0, 0, 0, 0 }, unique.getLabels());
        assertArrayEquals(new int[] { 50 }, unique.getChangePoints(0));

        KernelDensitySegmentation all = segmenter.segment(new int[] { 50, 50, 50, 50 }, 100, false);
        assertArrayEquals(new int[] { 50, 50, 50, 50 }, all.getChangePoints(0));
    }

    @Test
    public void testDuplicatesKeptWhenNotUnique() {
        KernelDensitySegmentation segmentation = segmenter.segment(new int[] { 52, 50, 51, 50, 51 }, 100, false);
        assertArrayEquals(new int[] { 50, 50, 51, 51, 52 }, segmentation.getChangePoints(0));
        assertEquals(5, segmentation.getLabels().length);
    }

    @Test
    public void testSmallBandwidthSplitsMore() {
        int[] changePoints = { 10, 12, 14, 50, 52, 54 };
        KernelDensitySegmentation narrow = new KernelDensitySegmenter(Bandwidth.fixed(0.5)).segment(changePoints, 100,
                true);
        assertArrayEquals(new int[] { 11, 13, 32, 51, 53 }, narrow.getBoundaries());
        assertArrayEquals(new int[] { 0, 1, 2, 3, 4, 5 }, narrow.getLabels());
        KernelDensitySegmentation wide = new KernelDensitySegmenter(Bandwidth.fixed(10.0)).segment(changePoints, 100,
                true);
        assertArrayEquals(new int[] { 32 }, wide.getBoundaries());
    }

    @Test
    public void testChangePointsPerLabelAreCopies() {
        KernelDensitySegmentation segmentation = segmenter.segment(new int[] { 10, 12, 14, 50, 52, 54 }, 100, true);
        segmentation.getLabelToChangePoints().get(0)[0] = 77;
        segmentation.getChangePoints(1)[0] = 77;
        assertArrayEquals(new int[] { 10, 12, 14 }, segmentation.getLabelToChangePoints().get(0));
        assertArrayEquals(new int[] { 50, 52, 54 }, segmentation.getChangePoints(1));
        assertThrows(UnsupportedOperationException.class,
                () -> segmentation.getLabelToChangePoints().put(2, new int[] { 90 }));
    }

    @Test
    public void testDistantClustersStaySeparate() {
        // far enough apart that the plain density underflows to zero between them
        int[] changePoints = { 10, 12, 14, 260, 262, 264 };
        GaussianKernelDensity density = new GaussianKernelDensity(
                Arrays.stream(changePoints).asDoubleStream().toArray(), 2.5);
        assertEquals(0.0, density.density(137));
        assertTrue(Double.isFinite(density.logDensity(137)));

        KernelDensitySegmentation segmentation = segmenter.segment(changePoints, 300, true);
        assertArrayEquals(new int[] { 137 }, segmentation.getBoundaries());
        assertArrayEquals(new int[] { 0, 0, 0, 1, 1, 1 }, segmentation.getLabels());
    }

    @ParameterizedTest
    @ValueSource(strings = { "scott", "silverman" })
    public void testBandwidthRules(String rule) {
        KernelDensitySegmenter byRule = new KernelDensitySegmenter(Bandwidth.parse(rule));
        KernelDensitySegmentation segmentation = byRule.segment(new int[] { 10, 12, 14, 50, 52, 54 }, 100, true);
        assertArrayEquals(new int[] { 32 }, segmentation.getBoundaries());
    }

    @Test
    public void testChangePointAtMinimumGoesRight() {
        int[] boundaries = { 20, 40 };
        assertEquals(0, KernelDensitySegmenter.labelOf(19, boundaries));
        assertEquals(1, KernelDensitySegmenter.labelOf(20, boundaries));
        assertEquals(1, KernelDensitySegmenter.labelOf(39, boundaries));
        assertEquals(2, KernelDensitySegmenter.labelOf(40, boundaries));
        assertEquals(2, KernelDensitySegmenter.labelOf(99, boundaries));
        assertEquals(0, KernelDensitySegmenter.labelOf(5, new int[0]));
    }

    @Test
    public void testMinimaExcludeEndpoints() {
        assertArrayEquals(new int[] { 2 }, KernelDensitySegmenter.findMinima(new double[] { 0, 1, 0, 1, 0 }));
        assertArrayEquals(new int[0], KernelDensitySegmenter.findMinima(new double[] { 3, 2, 2, 3 }));
        assertArrayEquals(new int[0], KernelDensitySegmenter.findMinima(new double[] { 1 }));
    }

    @Test
    public void testEmptyChangePoints() {
        assertThrows(IllegalArgumentException.class, () -> segmenter.segment(new int[0], 100, true));
    }

    @Test
    public void testMetricsPerLabel() {
        ChangePointIndex index = ChangePointIndex.of(100,
                Arrays.asList("metric1", "metric2", "constant", "metric3", "metric4"),
                Arrays.asList(new int[] { 10, 12 }, new int[] { 10, 14 }, new int[0], new int[] { 50, 52 },
                        new int[] { 50, 54 }));
        MetricSegmentation result = segmenter.segmentMetrics(index);
        assertThat(result.getLabelToMetrics().keySet(), contains(0, 1));
        assertThat(result.getLabelToMetrics().get(0), contains("metric1", "metric2"));
        assertThat(result.getLabelToMetrics().get(1), contains("metric3", "metric4"));
        assertArrayEquals(new int[] { 10, 12, 14 }, result.getSegmentation().getChangePoints(0));
        assertFalse(result.getLabelToMetrics().values().stream().anyMatch(s -> s.contains("constant")));
    }

    @Test
    public void testMetricsFollowColumnOrder() {
        ChangePointIndex index = ChangePointIndex.of(100, List.of("b", "a", "c"),
                List.of(new int[] { 52 }, new int[] { 50 }, new int[] { 51 }));
        MetricSegmentation result = segmenter.segmentMetrics(index);
        assertThat(result.getLabelToMetrics().get(0), contains("b", "a", "c"));
    }

    @Test
    public void testMetricInSeveralLabels() {
        ChangePointIndex index = ChangePointIndex.of(100, List.of("m1", "m2"),
                List.of(new int[] { 11, 80 }, new int[] { 11 }));
        MetricSegmentation result = segmenter.segmentMetrics(index);
        assertEquals(2, result.getLabelToMetrics().size());
        assertThat(result.getLabelToMetrics().get(0), contains("m1", "m2"));
        assertThat(result.getLabelToMetrics().get(1), contains("m1"));
    }
}
