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

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import lombok.Getter;

import com.amazon.metricsifter.config.Bandwidth;
import com.amazon.metricsifter.detection.ChangePointIndex;

/**
 * Groups changepoints pooled from many metrics into temporally contiguous
 * segments. A Gaussian kernel density of the changepoints is evaluated at every
 * time index; its strict local minima split the time axis into intervals, and
 * every changepoint is labeled with the interval that contains it.
 */
@Getter
public class KernelDensitySegmenter {

    private final Bandwidth bandwidth;

    public KernelDensitySegmenter(Bandwidth bandwidth) {
        this.bandwidth = checkNotNull(bandwidth, "bandwidth cannot be null");
    }

    /**
     * Labels the changepoints. Intervals are {@code [0, m0)}, {@code [m0, m1)},
     * ..., {@code [mk, length-1]} for the minima {@code m0 < ... < mk}, labeled
     * from 0 in ascending order; a changepoint located exactly at a minimum belongs
     * to the interval on its right. If all changepoints coincide every one of them
     * gets label 0.
     *
     * @param changePoints the pooled changepoints, not empty
     * @param length       the number of time indices of the series
     * @param uniqueValues whether the changepoints of a label are deduplicated
     * @return the segmentation
     */
    public KernelDensitySegmentation segment(int[] changePoints, int length, boolean uniqueValues) {
        checkArgument(changePoints != null && changePoints.length > 0, "changepoints should not be empty");
        checkArgument(length > 0, "length must be greater than 0");

        int[] boundaries = new int[0];
        int min = Arrays.stream(changePoints).min().getAsInt();
        int max = Arrays.stream(changePoints).max().getAsInt();
        if (min != max) {
            double[] sample = Arrays.stream(changePoints).asDoubleStream().toArray();
            GaussianKernelDensity density = new GaussianKernelDensity(sample, bandwidth.select(sample));
            boundaries = findMinima(density.logDensityGrid(length));
        }

        int[] labels = new int[changePoints.length];
        TreeMap<Integer, List<Integer>> members = new TreeMap<>();
        for (int label = 0; label <= boundaries.length; label++) {
            members.put(label, new ArrayList<>());
        }
        for (int i = 0; i < changePoints.length; i++) {
            labels[i] = labelOf(changePoints[i], boundaries);
            members.get(labels[i]).add(changePoints[i]);
        }

        TreeMap<Integer, int[]> labelToChangePoints = new TreeMap<>();
        members.forEach((label, points) -> {
            int[] values = points.stream().mapToInt(Integer::intValue).sorted().toArray();
            labelToChangePoints.put(label, uniqueValues ? Arrays.stream(values).distinct().toArray() : values);
        });
        return new KernelDensitySegmentation(labels, boundaries, labelToChangePoints);
    }

    /**
     * Segments the changepoints of an index and collects, for every label, the
     * metrics having a changepoint in it. Changepoints are deduplicated per label
     * so that a metric with many changepoints at the same place does not weigh
     * more; labels without changepoints and metrics without changepoints are left
     * out.
     *
     * @param index the changepoints of all metrics, with at least one changepoint
     * @return the segmentation and the label to metrics mapping
     */
    public MetricSegmentation segmentMetrics(ChangePointIndex index) {
        checkNotNull(index, "index cannot be null");
        KernelDensitySegmentation segmentation = segment(index.getFlattenedChangePoints(), index.getLength(), true);
        List<String> columnOrder = index.getMetricsWithChangePoints();
        TreeMap<Integer, Set<String>> labelToMetrics = new TreeMap<>();
        segmentation.getLabelToChangePoints().forEach((label, points) -> {
            Set<String> changed = new HashSet<>();
            for (int point : points) {
                changed.addAll(index.getMetricsAt(point));
            }
            if (!changed.isEmpty()) {
                LinkedHashSet<String> ordered = new LinkedHashSet<>();
                for (String metric : columnOrder) {
                    if (changed.contains(metric)) {
                        ordered.add(metric);
                    }
                }
                labelToMetrics.put(label, Collections.unmodifiableSet(ordered));
            }
        });
        return new MetricSegmentation(segmentation, Collections.unmodifiableSortedMap(labelToMetrics));
    }

    /**
     * @param curve values at consecutive positions
     * @return the ascending positions {@code i} with
     *         {@code curve[i-1] > curve[i] < curve[i+1]}; the first and last
     *         positions are never minima
     */
    static int[] findMinima(double[] curve) {
        TreeSet<Integer> minima = new TreeSet<>();
        for (int i = 1; i + 1 < curve.length; i++) {
            if (curve[i] < curve[i - 1] && curve[i] < curve[i + 1]) {
                minima.add(i);
            }
        }
        return minima.stream().mapToInt(Integer::intValue).toArray();
    }

    static int labelOf(int changePoint, int[] boundaries) {
        int position = Arrays.binarySearch(boundaries, changePoint);
        return (position >= 0) ? position + 1 : -(position + 1);
    }

    /**
     * A segmentation together with the metrics of every non empty label.
     */
    @Getter
    public static class MetricSegmentation {

        private final KernelDensitySegmentation segmentation;

        private final SortedMap<Integer, Set<String>> labelToMetrics;

        MetricSegmentation(KernelDensitySegmentation segmentation, SortedMap<Integer, Set<String>> labelToMetrics) {
            this.segmentation = segmentation;
            this.labelToMetrics = labelToMetrics;
        }
    }
}
