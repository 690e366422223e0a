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

package com.amazon.metricsifter.state;

import static com.amazon.metricsifter.state.Version.V1_0;

import lombok.Data;

/**
 * The configuration of a MetricSifter as plain values, so that it can be stored
 * as JSON and validated again when a sifter is rebuilt from it. Options are
 * kept under their names; the penalty and the bandwidth are either a keyword or
 * a number written as text.
 */
@Data
public class MetricSifterState {

    private String version = V1_0;

    private String searchMethod;

    private String costModel;

    private String penalty;

    private double penaltyAdjust;

    private String bandwidth;

    private String segmentSelectionMethod;

    private boolean parallelExecutionEnabled;

    // 0 when parallel execution is disabled
    private int threadPoolSize;
}
