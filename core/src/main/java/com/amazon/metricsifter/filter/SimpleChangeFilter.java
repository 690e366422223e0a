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

package com.amazon.metricsifter.filter;

import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.metricsifter.executor.AbstractColumnExecutor;
import com.amazon.metricsifter.executor.ColumnSlices;
import com.amazon.metricsifter.series.MultivariateSeries;

/**
 * A cheap pre-pass removing metrics which cannot carry a change: columns that
 * are entirely missing, constant, or whose successive differences are all zero
 * or missing.
 */
public class SimpleChangeFilter {

    private SimpleChangeFilter() {
    }

    /**
     * Decides whether a column shows any real change.
     *
     * @param samples the samples of a metric, {@code NaN} for missing values
     * @return true if the column should be kept
     */
    public static boolean hasChange(double[] samples) {
        boolean observed = false;
        double first = Double.NaN;
        boolean constant = true;
        for (double sample : samples) {
            if (Double.isNaN(sample)) {
                continue;
            }
            if (!observed) {
                observed = true;
                first = sample;
            } else if (sample != first) {
                constant = false;
            }
        }
        if (!observed || constant) {
            return false;
        }
        for (int i = 1; i < samples.length; i++) {
            double difference = samples[i] - samples[i - 1];
            if (!Double.isNaN(difference) && difference != 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keeps the columns with a change, sequentially.
     *
     * @param series the input table
     * @return the columns with a change, in their original order
     */
    public static MultivariateSeries filter(MultivariateSeries series) {
        checkNotNull(series, "series cannot be null");
        List<String> kept = new ArrayList<>();
        for (String metric : series.getMetrics()) {
            if (hasChange(series.getColumn(metric))) {
                kept.add(metric);
            }
        }
        return series.select(kept);
    }

    /**
     * Keeps the columns with a change. The columns are split into one contiguous
     * slice per worker and the surviving names are concatenated back in slice
     * order.
     *
     * @param series   the input table
     * @param executor the executor running the slices
     * @return the columns with a change, in their original order
     */
    public static MultivariateSeries filter(MultivariateSeries series, AbstractColumnExecutor executor) {
        checkNotNull(series, "series cannot be null");
        checkNotNull(executor, "executor cannot be null");
        if (executor.getParallelism() == 1) {
            return filter(series);
        }
        List<ColumnSlices.Slice> slices = ColumnSlices.evenSlices(series.width(), executor.getParallelism());
        List<List<String>> kept = executor.map(slices,
                slice -> filter(series.slice(slice.getFrom(), slice.getTo())).getMetrics());
        List<String> all = new ArrayList<>();
        kept.forEach(all::addAll);
        return series.select(all);
    }
}
