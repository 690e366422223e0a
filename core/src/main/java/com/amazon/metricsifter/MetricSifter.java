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

import static com.amazon.metricsifter.CommonUtils.checkConfiguration;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.List;
import java.util.Optional;

import lombok.Getter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.metricsifter.config.Bandwidth;
import com.amazon.metricsifter.config.CostModel;
import com.amazon.metricsifter.config.Penalty;
import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.config.SegmentSelectionMethod;
import com.amazon.metricsifter.detection.ChangePointDetector;
import com.amazon.metricsifter.detection.ChangePointIndex;
import com.amazon.metricsifter.detection.MultiChangePointDetector;
import com.amazon.metricsifter.executor.AbstractColumnExecutor;
import com.amazon.metricsifter.executor.ParallelColumnExecutor;
import com.amazon.metricsifter.executor.SequentialColumnExecutor;
import com.amazon.metricsifter.filter.SimpleChangeFilter;
import com.amazon.metricsifter.returntypes.Segment;
import com.amazon.metricsifter.returntypes.SiftResult;
import com.amazon.metricsifter.returntypes.SiftStage;
import com.amazon.metricsifter.segmentation.KernelDensitySegmenter;
import com.amazon.metricsifter.segmentation.KernelDensitySegmenter.MetricSegmentation;
import com.amazon.metricsifter.selection.SegmentSelector;
import com.amazon.metricsifter.series.MultivariateSeries;

/**
 * Reduces a table of monitoring metrics collected around an incident to the
 * metrics that changed together. The pipeline removes degenerate metrics,
 * detects the changepoints of every remaining metric, groups the pooled
 * changepoints into segments by the minima of their kernel density, and keeps
 * the metrics of the segment chosen by the selection method.
 *
 * A sifter holds only its configuration. Every run creates its own workers and
 * intermediate results, so a single instance can be used from several threads.
 *
 * <pre>
 * MetricSifter sifter = MetricSifter.builder().searchMethod(SearchMethod.PELT).penaltyAdjust(2.0).build();
 * MultivariateSeries reduced = sifter.run(series);
 * </pre>
 */
@Getter
public class MetricSifter {

    public static final SearchMethod DEFAULT_SEARCH_METHOD = SearchMethod.PELT;

    public static final CostModel DEFAULT_COST_MODEL = CostModel.L2;

    public static final Penalty DEFAULT_PENALTY = Penalty.BIC;

    public static final double DEFAULT_PENALTY_ADJUST = 2.0;

    public static final Bandwidth DEFAULT_BANDWIDTH = Bandwidth.fixed(2.5);

    public static final SegmentSelectionMethod DEFAULT_SEGMENT_SELECTION_METHOD = SegmentSelectionMethod.WEIGHTED_MAX;

    public static final boolean DEFAULT_PARALLEL_EXECUTION_ENABLED = true;

    private final SearchMethod searchMethod;

    private final CostModel costModel;

    private final Penalty penalty;

    private final double penaltyAdjust;

    private final Bandwidth bandwidth;

    private final SegmentSelectionMethod segmentSelectionMethod;

    private final boolean parallelExecutionEnabled;

    /**
     * number of workers of a run, 0 when parallel execution is disabled
     */
    private final int threadPoolSize;

    private final Logger logger;

    private final MultiChangePointDetector multiChangePointDetector;

    private final KernelDensitySegmenter segmenter;

    private final SegmentSelector selector;

    protected MetricSifter(Builder<?> builder) {
        checkConfiguration(builder.searchMethod != null, "search method cannot be null");
        checkConfiguration(builder.costModel != null, "cost model cannot be null");
        checkConfiguration(builder.penalty != null, "penalty cannot be null");
        checkConfiguration(Double.isFinite(builder.penaltyAdjust) && builder.penaltyAdjust > 0,
                "penaltyAdjust must be a finite positive number");
        checkConfiguration(builder.bandwidth != null, "bandwidth cannot be null");
        checkConfiguration(builder.segmentSelectionMethod != null, "segment selection method cannot be null");
        searchMethod = builder.searchMethod;
        costModel = builder.costModel;
        penalty = builder.penalty;
        penaltyAdjust = builder.penaltyAdjust;
        bandwidth = builder.bandwidth;
        segmentSelectionMethod = builder.segmentSelectionMethod;
        parallelExecutionEnabled = builder.parallelExecutionEnabled;

        if (parallelExecutionEnabled) {
            threadPoolSize = builder.threadPoolSize.orElse(Runtime.getRuntime().availableProcessors());
            checkConfiguration(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        } else {
            checkConfiguration(!builder.threadPoolSize.isPresent(),
                    "threadPoolSize can only be set when parallel execution is enabled");
            threadPoolSize = 0;
        }
        logger = builder.logger.orElseGet(() -> LoggerFactory.getLogger(MetricSifter.class));

        multiChangePointDetector = new MultiChangePointDetector(
                new ChangePointDetector(searchMethod, costModel, penalty, penaltyAdjust, logger));
        segmenter = new KernelDensitySegmenter(bandwidth);
        selector = new SegmentSelector(segmentSelectionMethod);
    }

    /**
     * @return a builder with every option at its default value
     */
    public static Builder<?> builder() {
        return new Builder<>();
    }

    /**
     * Removes degenerate metrics and detects the changepoints of the others.
     *
     * @param series the metrics
     * @return the metrics with at least one changepoint, in column order
     */
    public MultivariateSeries runUpToChangePointDetection(MultivariateSeries series) {
        return runUpToChangePointDetection(series, false);
    }

    /**
     * Detects the changepoints of every metric.
     *
     * @param series              the metrics
     * @param withoutSimpleFilter true to skip the removal of degenerate metrics
     * @return the metrics with at least one changepoint, in column order
     */
    public MultivariateSeries runUpToChangePointDetection(MultivariateSeries series, boolean withoutSimpleFilter) {
        checkNotNull(series, "series cannot be null");
        try (AbstractColumnExecutor executor = createExecutor()) {
            MultivariateSeries filtered = filter(series, withoutSimpleFilter, executor);
            if (filtered.isEmpty()) {
                return filtered;
            }
            ChangePointIndex index = detect(filtered, executor);
            return filtered.select(index.getMetricsWithChangePoints());
        }
    }

    /**
     * Runs the whole pipeline.
     *
     * @param series the metrics
     * @return the metrics of the selected segment in column order, an empty table
     *         when no metric has a changepoint
     */
    public MultivariateSeries run(MultivariateSeries series) {
        return sift(series, false).getSeries();
    }

    public MultivariateSeries run(MultivariateSeries series, boolean withoutSimpleFilter) {
        return sift(series, withoutSimpleFilter).getSeries();
    }

    /**
     * Runs the whole pipeline and reports the selected segment as well.
     *
     * @param series the metrics
     * @return the reduced table and the segment, absent when no metric has a
     *         changepoint
     */
    public SiftResult runWithSelectedSegment(MultivariateSeries series) {
        return sift(series, false);
    }

    public SiftResult runWithSelectedSegment(MultivariateSeries series, boolean withoutSimpleFilter) {
        return sift(series, withoutSimpleFilter);
    }

    public SiftResult sift(MultivariateSeries series) {
        return sift(series, false);
    }

    /**
     * Runs the whole pipeline and reports the stage it ended in together with the
     * changepoints it found.
     *
     * @param series              the metrics
     * @param withoutSimpleFilter true to skip the removal of degenerate metrics
     * @return the result of the run
     */
    public SiftResult sift(MultivariateSeries series, boolean withoutSimpleFilter) {
        checkNotNull(series, "series cannot be null");
        int length = series.length();
        logger.debug("{}: {} metrics of length {}", SiftStage.INIT, series.width(), length);

        try (AbstractColumnExecutor executor = createExecutor()) {
            MultivariateSeries filtered = filter(series, withoutSimpleFilter, executor);
            if (filtered.isEmpty()) {
                logger.debug("{}: no metric left after filtering", SiftStage.EMPTY_AFTER_FILTER);
                return new SiftResult(filtered, null, SiftStage.EMPTY_AFTER_FILTER, ChangePointIndex.empty(length));
            }

            ChangePointIndex index = detect(filtered, executor);
            if (index.isEmpty()) {
                logger.debug("{}: no changepoint in {} metrics", SiftStage.NO_CHANGEPOINTS, filtered.width());
                return new SiftResult(MultivariateSeries.empty(length), null, SiftStage.NO_CHANGEPOINTS, index);
            }

            MetricSegmentation segmentation = segmenter.segmentMetrics(index);
            logger.debug("{}: {} segments", SiftStage.SEGMENTED,
                    segmentation.getSegmentation().getNumberOfLabels());

            Optional<Segment> segment = selector.select(segmentation, index);
            if (!segment.isPresent()) {
                logger.debug("{}: no segment has any metric", SiftStage.NO_CHANGEPOINTS);
                return new SiftResult(MultivariateSeries.empty(length), null, SiftStage.NO_CHANGEPOINTS, index);
            }
            logger.debug("{}: {}", SiftStage.SELECTED, segment.get());

            MultivariateSeries reduced = filtered.select(segment.get().getMetrics());
            logger.debug("{}: kept {} of {} metrics", SiftStage.DONE, reduced.width(), series.width());
            return new SiftResult(reduced, segment.get(), SiftStage.DONE, index);
        }
    }

    MultivariateSeries filter(MultivariateSeries series, boolean withoutSimpleFilter,
            AbstractColumnExecutor executor) {
        MultivariateSeries filtered = withoutSimpleFilter ? series : SimpleChangeFilter.filter(series, executor);
        logger.debug("{}: {} of {} metrics kept", SiftStage.FILTERED, filtered.width(), series.width());
        return filtered;
    }

    ChangePointIndex detect(MultivariateSeries series, AbstractColumnExecutor executor) {
        ChangePointIndex index = multiChangePointDetector.detect(series, executor);
        List<String> changed = index.getMetricsWithChangePoints();
        logger.debug("{}: {} changepoints in {} metrics", SiftStage.CHANGEPOINTS_DETECTED,
                index.getFlattenedChangePoints().length, changed.size());
        return index;
    }

    AbstractColumnExecutor createExecutor() {
        if (parallelExecutionEnabled && threadPoolSize > 1) {
            return new ParallelColumnExecutor(threadPoolSize);
        }
        return new SequentialColumnExecutor();
    }

    public static class Builder<T extends Builder<T>> {

        private SearchMethod searchMethod = DEFAULT_SEARCH_METHOD;
        private CostModel costModel = DEFAULT_COST_MODEL;
        private Penalty penalty = DEFAULT_PENALTY;
        private double penaltyAdjust = DEFAULT_PENALTY_ADJUST;
        private Bandwidth bandwidth = DEFAULT_BANDWIDTH;
        private SegmentSelectionMethod segmentSelectionMethod = DEFAULT_SEGMENT_SELECTION_METHOD;
        private boolean parallelExecutionEnabled = DEFAULT_PARALLEL_EXECUTION_ENABLED;
        private Optional<Integer> threadPoolSize = Optional.empty();
        private Optional<Logger> logger = Optional.empty();

        public T searchMethod(SearchMethod searchMethod) {
            this.searchMethod = searchMethod;
            return (T) this;
        }

        public T searchMethod(String searchMethod) {
            this.searchMethod = SearchMethod.fromName(searchMethod);
            return (T) this;
        }

        public T costModel(CostModel costModel) {
            this.costModel = costModel;
            return (T) this;
        }

        public T costModel(String costModel) {
            this.costModel = CostModel.fromName(costModel);
            return (T) this;
        }

        public T penalty(Penalty penalty) {
            this.penalty = penalty;
            return (T) this;
        }

        public T penalty(String penalty) {
            this.penalty = Penalty.parse(penalty);
            return (T) this;
        }

        public T penalty(double penalty) {
            this.penalty = Penalty.fixed(penalty);
            return (T) this;
        }

        public T penaltyAdjust(double penaltyAdjust) {
            this.penaltyAdjust = penaltyAdjust;
            return (T) this;
        }

        public T bandwidth(Bandwidth bandwidth) {
            this.bandwidth = bandwidth;
            return (T) this;
        }

        public T bandwidth(String bandwidth) {
            this.bandwidth = Bandwidth.parse(bandwidth);
            return (T) this;
        }

        public T bandwidth(double bandwidth) {
            this.bandwidth = Bandwidth.fixed(bandwidth);
            return (T) this;
        }

        public T segmentSelectionMethod(SegmentSelectionMethod segmentSelectionMethod) {
            this.segmentSelectionMethod = segmentSelectionMethod;
            return (T) this;
        }

        public T segmentSelectionMethod(String segmentSelectionMethod) {
            this.segmentSelectionMethod = SegmentSelectionMethod.fromName(segmentSelectionMethod);
            return (T) this;
        }

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = Optional.of(threadPoolSize);
            return (T) this;
        }

        public T logger(Logger logger) {
            this.logger = Optional.ofNullable(logger);
            return (T) this;
        }

        public MetricSifter build() {
            return new MetricSifter(this);
        }
    }
}
