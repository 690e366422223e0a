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

import static com.amazon.metricsifter.CommonUtils.checkConfiguration;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import com.amazon.metricsifter.config.CostModel;
import com.amazon.metricsifter.config.Penalty;
import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.detection.cost.CostL2;
import com.amazon.metricsifter.detection.cost.ISegmentCost;
import com.amazon.metricsifter.detection.cost.SegmentCosts;
import com.amazon.metricsifter.detection.search.BinarySegmentation;
import com.amazon.metricsifter.detection.search.BottomUp;
import com.amazon.metricsifter.detection.search.IChangePointSearch;
import com.amazon.metricsifter.detection.search.Pelt;
import com.amazon.metricsifter.util.SampleStatistics;

/**
 * Detects the changepoints of a single metric: the breakpoints found by a
 * penalized search, together with the positions where a run of missing values
 * begins.
 *
 * The penalty scales with the variance of the metric, so a metric with zero
 * variance is searched with a zero penalty and is cut almost everywhere; such
 * metrics are expected to be removed by the simple change filter beforehand.
 */
@Getter
public class ChangePointDetector {

    /**
     * The minimum number of samples between two breakpoints of the search.
     */
    public static final int MIN_SEGMENT_LENGTH = 2;

    private final SearchMethod searchMethod;

    private final CostModel costModel;

    private final Penalty penalty;

    private final double penaltyAdjust;

    private final Logger logger;

    public ChangePointDetector(SearchMethod searchMethod, CostModel costModel, Penalty penalty, double penaltyAdjust,
            Logger logger) {
        checkConfiguration(searchMethod != null, "search method cannot be null");
        checkConfiguration(costModel != null, "cost model cannot be null");
        checkConfiguration(penalty != null, "penalty cannot be null");
        checkConfiguration(Double.isFinite(penaltyAdjust) && penaltyAdjust > 0,
                "penaltyAdjust must be a finite positive number");
        this.searchMethod = searchMethod;
        this.costModel = costModel;
        this.penalty = penalty;
        this.penaltyAdjust = penaltyAdjust;
        this.logger = (logger == null) ? NOPLogger.NOP_LOGGER : logger;
    }

    public ChangePointDetector(SearchMethod searchMethod, CostModel costModel, Penalty penalty, double penaltyAdjust) {
        this(searchMethod, costModel, penalty, penaltyAdjust, null);
    }

    /**
     * Detects the changepoints of one metric.
     *
     * @param samples the samples, {@code NaN} for missing values
     * @return sorted, distinct indices in {@code [0, samples.length - 1]}
     */
    public int[] detect(double[] samples) {
        checkNotNull(samples, "samples cannot be null");
        TreeSet<Integer> changePoints = new TreeSet<>();
        if (SampleStatistics.countObserved(samples) > 0) {
            double sigma = SampleStatistics.standardDeviation(samples, 0);
            if (sigma == 0) {
                logger.warn("searching a metric with zero variance, the penalty is zero");
            }
            double value = penalty.compute(sigma, samples.length, penaltyAdjust);
            List<Integer> ends = createSearch().search(createCost(SampleStatistics.fillMissing(samples)), value);
            // the last end is always the length of the series
            changePoints.addAll(ends.subList(0, ends.size() - 1));
        }
        for (int index : detectMissingRunStarts(samples)) {
            changePoints.add(index);
        }
        return changePoints.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Positions where a run of missing values starts: index 0 if the first sample
     * is missing, and every index whose sample is missing while the previous one
     * is observed.
     *
     * @param samples the samples, {@code NaN} for missing values
     * @return the ascending start positions
     */
    public static int[] detectMissingRunStarts(double[] samples) {
        checkNotNull(samples, "samples cannot be null");
        int count = 0;
        int[] starts = new int[samples.length];
        for (int i = 0; i < samples.length; i++) {
            if (Double.isNaN(samples[i]) && (i == 0 || !Double.isNaN(samples[i - 1]))) {
                starts[count++] = i;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    IChangePointSearch createSearch() {
        switch (searchMethod) {
        case BINSEG:
            return new BinarySegmentation(MIN_SEGMENT_LENGTH);
        case BOTTOMUP:
            return new BottomUp(MIN_SEGMENT_LENGTH);
        default:
            return new Pelt(MIN_SEGMENT_LENGTH);
        }
    }

    ISegmentCost createCost(double[] signal) {
        return (searchMethod == SearchMethod.PELT) ? new CostL2(signal) : SegmentCosts.create(costModel, signal);
    }
}
