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

package com.amazon.metricsifter.selection;

import static com.amazon.metricsifter.CommonUtils.checkConfiguration;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

import com.amazon.metricsifter.config.SegmentSelectionMethod;
import com.amazon.metricsifter.detection.ChangePointIndex;
import com.amazon.metricsifter.returntypes.Segment;
import com.amazon.metricsifter.segmentation.KernelDensitySegmenter.MetricSegmentation;

/**
 * Chooses one segment among the labels of a segmentation. Labels are scored in
 * ascending order and a later label replaces the current choice only if its
 * score is strictly larger, so ties go to the smallest label.
 */
@Getter
public class SegmentSelector {

    private final SegmentSelectionMethod method;

    public SegmentSelector(SegmentSelectionMethod method) {
        checkConfiguration(method != null, "segment selection method cannot be null");
        this.method = method;
    }

    /**
     * @param segmentation the segmentation of the changepoints with the metrics of
     *                     every label
     * @param index        the changepoints the segmentation was built from
     * @return the selected segment, empty if no label has any metric
     */
    public Optional<Segment> select(MetricSegmentation segmentation, ChangePointIndex index) {
        checkNotNull(segmentation, "segmentation cannot be null");
        checkNotNull(index, "index cannot be null");
        int bestLabel = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Integer, Set<String>> entry : segmentation.getLabelToMetrics().entrySet()) {
            double score = score(entry.getValue(), index);
            if (score > bestScore) {
                bestScore = score;
                bestLabel = entry.getKey();
            }
        }
        if (bestLabel < 0) {
            return Optional.empty();
        }
        int[] points = segmentation.getSegmentation().getChangePoints(bestLabel);
        int start = points[0];
        int end = points[0];
        for (int point : points) {
            start = Math.min(start, point);
            end = Math.max(end, point);
        }
        return Optional.of(new Segment(bestLabel, start, end,
                new ArrayList<>(segmentation.getLabelToMetrics().get(bestLabel))));
    }

    /**
     * @param metrics the metrics of one label
     * @param index   the changepoints of all metrics
     * @return the score of the label under the selection method
     */
    public double score(Set<String> metrics, ChangePointIndex index) {
        switch (method) {
        case MAX:
            return metrics.size();
        default:
            double sum = 0;
            for (String metric : metrics) {
                sum += 1.0 / index.getChangePointCount(metric);
            }
            return sum;
        }
    }
}
