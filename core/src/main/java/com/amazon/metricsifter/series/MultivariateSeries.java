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

package com.amazon.metricsifter.series;

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable table of named metric columns over an implicit time index
 * {@code 0..N-1}. Every column has the same length; {@code NaN} denotes a
 * missing sample. Column order is significant and preserved by every
 * selection.
 */
public final class MultivariateSeries {

    private final int length;

    private final List<String> metrics;

    private final Map<String, double[]> columns;

    private MultivariateSeries(int length, List<String> metrics, Map<String, double[]> columns) {
        this.length = length;
        this.metrics = metrics;
        this.columns = columns;
    }

    public static Builder builder(int length) {
        return new Builder(length);
    }

    /**
     * An empty table with no columns and the given number of rows.
     *
     * @param length number of rows
     * @return the empty table
     */
    public static MultivariateSeries empty(int length) {
        return new Builder(length).build();
    }

    /**
     * Creates a table from row-major data, as produced by most generators.
     *
     * @param metrics the column names
     * @param rows    {@code rows[t][j]} is the sample of metric {@code j} at time
     *                {@code t}
     * @return the table
     */
    public static MultivariateSeries fromRows(List<String> metrics, double[][] rows) {
        checkNotNull(metrics, "metrics cannot be null");
        checkNotNull(rows, "rows cannot be null");
        Builder builder = new Builder(rows.length);
        for (int j = 0; j < metrics.size(); j++) {
            double[] column = new double[rows.length];
            for (int t = 0; t < rows.length; t++) {
                checkArgument(rows[t].length == metrics.size(), "every row must have one value per metric");
                column[t] = rows[t][j];
            }
            builder.column(metrics.get(j), column);
        }
        return builder.build();
    }

    /**
     * @return the number of samples per column
     */
    public int length() {
        return length;
    }

    /**
     * @return the number of columns
     */
    public int width() {
        return metrics.size();
    }

    public boolean isEmpty() {
        return metrics.isEmpty();
    }

    /**
     * @return the column names in column order
     */
    public List<String> getMetrics() {
        return metrics;
    }

    public boolean hasMetric(String metric) {
        return columns.containsKey(metric);
    }

    /**
     * @param metric a column name
     * @return a copy of the samples of the column
     */
    public double[] getColumn(String metric) {
        double[] column = columns.get(metric);
        checkArgument(column != null, "no such metric: " + metric);
        return Arrays.copyOf(column, column.length);
    }

    double[] column(int index) {
        return columns.get(metrics.get(index));
    }

    /**
     * Returns the columns whose names are in the given collection, in the column
     * order of this table. Names unknown to the table are ignored.
     *
     * @param selected the names to keep
     * @return a new table
     */
    public MultivariateSeries select(Collection<String> selected) {
        checkNotNull(selected, "selected metrics cannot be null");
        Set<String> keep = new HashSet<>(selected);
        Builder builder = new Builder(length);
        for (String metric : metrics) {
            if (keep.contains(metric)) {
                builder.column(metric, columns.get(metric));
            }
        }
        return builder.build();
    }

    /**
     * Returns the contiguous block of columns {@code [from, to)} in column order.
     *
     * @param from first column position, inclusive
     * @param to   last column position, exclusive
     * @return a new table
     */
    public MultivariateSeries slice(int from, int to) {
        checkArgument(0 <= from && from <= to && to <= metrics.size(), "invalid column slice");
        Builder builder = new Builder(length);
        for (int j = from; j < to; j++) {
            builder.column(metrics.get(j), column(j));
        }
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MultivariateSeries)) {
            return false;
        }
        MultivariateSeries other = (MultivariateSeries) o;
        if (length != other.length || !metrics.equals(other.metrics)) {
            return false;
        }
        for (String metric : metrics) {
            if (!Arrays.equals(columns.get(metric), other.columns.get(metric))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 31 * length + metrics.hashCode();
        for (String metric : metrics) {
            result = 31 * result + Arrays.hashCode(columns.get(metric));
        }
        return result;
    }

    @Override
    public String toString() {
        return "MultivariateSeries(length=" + length + ", metrics=" + metrics + ")";
    }

    public static class Builder {

        private final int length;

        private final LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();

        private Builder(int length) {
            checkArgument(length >= 0, "length cannot be negative");
            this.length = length;
        }

        /**
         * Adds a column; the samples are copied.
         *
         * @param metric  a name not used by any other column
         * @param samples exactly {@code length} samples
         * @return this builder
         */
        public Builder column(String metric, double[] samples) {
            checkNotNull(metric, "metric name cannot be null");
            checkNotNull(samples, "samples cannot be null");
            checkArgument(samples.length == length,
                    String.format("metric %s has %d samples, expected %d", metric, samples.length, length));
            checkArgument(!columns.containsKey(metric), "duplicate metric: " + metric);
            columns.put(metric, Arrays.copyOf(samples, samples.length));
            return this;
        }

        /**
         * Adds columns in the given order.
         *
         * @param metrics the column names
         * @param samples the samples of each column, aligned with {@code metrics}
         * @return this builder
         */
        public Builder columns(List<String> metrics, List<double[]> samples) {
            checkNotNull(metrics, "metrics cannot be null");
            checkNotNull(samples, "samples cannot be null");
            checkArgument(metrics.size() == samples.size(), "one column of samples is needed per metric");
            for (int j = 0; j < metrics.size(); j++) {
                column(metrics.get(j), samples.get(j));
            }
            return this;
        }

        public MultivariateSeries build() {
            LinkedHashMap<String, double[]> copy = new LinkedHashMap<>(columns);
            return new MultivariateSeries(length, Collections.unmodifiableList(new ArrayList<>(copy.keySet())),
                    Collections.unmodifiableMap(copy));
        }
    }
}
