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

package com.amazon.metricsifter.returntypes;

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.Getter;

/**
 * The time span of the selected group of changepoints and the metrics that
 * changed inside it.
 */
@Getter
public class Segment {

    // label of the group in the kernel density segmentation
    private final int label;

    // first changepoint of the group
    private final int startTime;

    // last changepoint of the group, inclusive
    private final int endTime;

    // metrics in column order
    private final List<String> metrics;

    public Segment(int label, int startTime, int endTime, List<String> metrics) {
        checkArgument(label >= 0, "label must be non-negative");
        checkArgument(startTime >= 0 && startTime <= endTime, "incorrect bounds");
        checkNotNull(metrics, "metrics cannot be null");
        this.label = label;
        this.startTime = startTime;
        this.endTime = endTime;
        this.metrics = Collections.unmodifiableList(new ArrayList<>(metrics));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Segment)) {
            return false;
        }
        Segment other = (Segment) o;
        return label == other.label && startTime == other.startTime && endTime == other.endTime
                && metrics.equals(other.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, startTime, endTime, metrics);
    }

    @Override
    public String toString() {
        return "Segment{label=" + label + ", startTime=" + startTime + ", endTime=" + endTime + ", metrics="
                + metrics.size() + "}";
    }
}
