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

import java.util.Arrays;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Getter;

/**
 * The outcome of segmenting a list of changepoints: the label of every
 * changepoint, aligned with the input list, the boundaries between labels, and
 * the changepoints of every label in ascending order.
 */
@Getter
public class KernelDensitySegmentation {

    private final int[] labels;

    /**
     * the time indices of the density minima; label {@code k} covers
     * {@code [boundaries[k-1], boundaries[k])}
     */
    private final int[] boundaries;

    private final SortedMap<Integer, int[]> labelToChangePoints;

    KernelDensitySegmentation(int[] labels, int[] boundaries, SortedMap<Integer, int[]> labelToChangePoints) {
        this.labels = labels;
        this.boundaries = boundaries;
        this.labelToChangePoints = Collections.unmodifiableSortedMap(labelToChangePoints);
    }

    public int[] getLabels() {
        return Arrays.copyOf(labels, labels.length);
    }

    public int[] getBoundaries() {
        return Arrays.copyOf(boundaries, boundaries.length);
    }

    /**
     * @return label to a copy of its changepoints, in ascending label order
     */
    public SortedMap<Integer, int[]> getLabelToChangePoints() {
        TreeMap<Integer, int[]> copy = new TreeMap<>();
        labelToChangePoints.forEach((label, points) -> copy.put(label, Arrays.copyOf(points, points.length)));
        return Collections.unmodifiableSortedMap(copy);
    }

    public int getNumberOfLabels() {
        return labelToChangePoints.size();
    }

    /**
     * @param label a label
     * @return the changepoints of the label, empty if the label is unknown
     */
    public int[] getChangePoints(int label) {
        int[] points = labelToChangePoints.get(label);
        return (points == null) ? new int[0] : Arrays.copyOf(points, points.length);
    }
}
