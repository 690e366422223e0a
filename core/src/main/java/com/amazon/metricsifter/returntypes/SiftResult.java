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

import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.Optional;

import lombok.Getter;

import com.amazon.metricsifter.detection.ChangePointIndex;
import com.amazon.metricsifter.series.MultivariateSeries;

/**
 * Everything a sifter run produces: the reduced table, the selected segment if
 * any, the stage the run ended in and the changepoints found on the way.
 */
@Getter
public class SiftResult {

    private final MultivariateSeries series;

    // absent when the run exited early
    private final Segment segment;

    private final SiftStage stage;

    // empty when the run exited before detection
    private final ChangePointIndex changePointIndex;

    public SiftResult(MultivariateSeries series, Segment segment, SiftStage stage,
            ChangePointIndex changePointIndex) {
        this.series = checkNotNull(series, "series cannot be null");
        this.segment = segment;
        this.stage = checkNotNull(stage, "stage cannot be null");
        this.changePointIndex = checkNotNull(changePointIndex, "changePointIndex cannot be null");
    }

    public Optional<Segment> getSegment() {
        return Optional.ofNullable(segment);
    }

    @Override
    public String toString() {
        return "SiftResult{stage=" + stage + ", metrics=" + series.getMetrics().size() + ", segment=" + segment + "}";
    }
}
