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

/**
 * The stages a sifter run goes through. A run ends either in {@link #DONE} or
 * in one of the early exits.
 */
public enum SiftStage {

    /**
     * nothing processed yet
     */
    INIT,
    /**
     * degenerate metrics removed
     */
    FILTERED,
    /**
     * changepoints detected for every remaining metric
     */
    CHANGEPOINTS_DETECTED,
    /**
     * changepoints grouped into segments
     */
    SEGMENTED,
    /**
     * one segment chosen
     */
    SELECTED,
    /**
     * the table is reduced to the metrics of the chosen segment
     */
    DONE,
    /**
     * no metric survived the simple change filter
     */
    EMPTY_AFTER_FILTER,
    /**
     * no metric has a changepoint
     */
    NO_CHANGEPOINTS;

    /**
     * @return true if the run stopped before selecting a segment
     */
    public boolean isEarlyExit() {
        return this == EMPTY_AFTER_FILTER || this == NO_CHANGEPOINTS;
    }
}
