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

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Getter;

/**
 * The changepoints of every metric of a table, indexed three ways: as a single
 * flattened list (duplicates preserved), by time index, and by metric. Metrics
 * without any changepoint are listed separately and never appear under a time
 * index.
 */
@Getter
public class ChangePointIndex {

    /**
     * number of samples per metric
     */
    private final int length;

    /**
     * all changepoints of all metrics, metric after metric in column order
     */
    private final int[] flattenedChangePoints;

    /**
     * time index to the metrics changing there, in column order
     */
    private final SortedMap<Integer, List<String>> changePointToMetrics;

    /**
     * metric to its own sorted changepoints, in column order, empty arrays
     * included
     */
    private final Map<String, int[]> metricToChangePoints;

    private final List<String> metricsWithoutChangePoints;

    ChangePointIndex(int length, int[] flattenedChangePoints, SortedMap<Integer, List<String>> changePointToMetrics,
            Map<String, int[]> metricToChangePoints, List<String> metricsWithoutChangePoints) {
        this.length = length;
        this.flattenedChangePoints = flattenedChangePoints;
        this.changePointToMetrics = changePointToMetrics;
        this.metricToChangePoints = metricToChangePoints;
        this.metricsWithoutChangePoints = metricsWithoutChangePoints;
    }

    /**
     * Builds the index from per metric detections.
     *
     * @param length       number of samples per metric
     * @param metrics      metric names in column order
     * @param changePoints the changepoints of each metric, aligned with
     *                     {@code metrics}
     * @return the index
     */
    public static ChangePointIndex of(int length, List<String> metrics, List<int[]> changePoints) {
        checkNotNull(metrics, "metrics cannot be null");
        checkNotNull(changePoints, "changePoints cannot be null");
        checkArgument(metrics.size() == changePoints.size(), "one changepoint set is needed per metric");
        TreeMap<Integer, List<String>> byIndex = new TreeMap<>();
        LinkedHashMap<String, int[]> byMetric = new LinkedHashMap<>();
        List<String> unchanged = new ArrayList<>();
        int total = 0;
        for (int j = 0; j < metrics.size(); j++) {
            String metric = metrics.get(j);
            int[] points = checkNotNull(changePoints.get(j), "changepoints of " + metric + " cannot be null");
            byMetric.put(metric, Arrays.copyOf(points, points.length));
            if (points.length == 0) {
                unchanged.add(metric);
            }
            for (int point : points) {
                byIndex.computeIfAbsent(point, k -> new ArrayList<>()).add(metric);
            }
            total += points.length;
        }
        int[] flattened = new int[total];
        int position = 0;
        for (int[] points : byMetric.values()) {
            System.arraycopy(points, 0, flattened, position, points.length);
            position += points.length;
        }
        byIndex.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return new ChangePointIndex(length, flattened, Collections.unmodifiableSortedMap(byIndex),
                Collections.unmodifiableMap(byMetric), Collections.unmodifiableList(unchanged));
    }

    public static ChangePointIndex empty(int length) {
        return of(length, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * @return true if no metric has a changepoint
     */
    public boolean isEmpty() {
        return flattenedChangePoints.length == 0;
    }

    /**
     * @return the metrics with at least one changepoint, in column order
     */
    public List<String> getMetricsWithChangePoints() {
        List<String> changed = new ArrayList<>();
        metricToChangePoints.forEach((metric, points) -> {
            if (points.length > 0) {
                changed.add(metric);
            }
        });
        return changed;
    }

    /**
     * @param index a time index
     * @return the metrics with a changepoint at {@code index}, possibly empty
     */
    public List<String> getMetricsAt(int index) {
        return changePointToMetrics.getOrDefault(index, Collections.emptyList());
    }

    /**
     * @param metric a metric of the index
     * @return the number of changepoints of the metric
     */
    public int getChangePointCount(String metric) {
        int[] points = metricToChangePoints.get(metric);
        checkArgument(points != null, "unknown metric: " + metric);
        return points.length;
    }

    public int[] getFlattenedChangePoints() {
        return Arrays.copyOf(flattenedChangePoints, flattenedChangePoints.length);
    }

    /**
     * @return metric to a copy of its changepoints, in column order
     */
    public Map<String, int[]> getMetricToChangePoints() {
        LinkedHashMap<String, int[]> copy = new LinkedHashMap<>();
        metricToChangePoints.forEach((metric, points) -> copy.put(metric, Arrays.copyOf(points, points.length)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * @param metric a metric of the index
     * @return a copy of the changepoints of the metric
     */
    public int[] getChangePoints(String metric) {
        int[] points = metricToChangePoints.get(metric);
        checkArgument(points != null, "unknown metric: " + metric);
        return Arrays.copyOf(points, points.length);
    }
}
