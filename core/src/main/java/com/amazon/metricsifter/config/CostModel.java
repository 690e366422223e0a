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

package com.amazon.metricsifter.config;

import static com.amazon.metricsifter.CommonUtils.checkConfiguration;

import java.util.Locale;

import com.amazon.metricsifter.ConfigurationException;

/**
 * The segment cost used by {@link SearchMethod#BINSEG} and
 * {@link SearchMethod#BOTTOMUP}.
 */
public enum CostModel {

    /**
     * sum of absolute deviations from the segment median
     */
    L1,
    /**
     * sum of squared deviations from the segment mean
     */
    L2,
    /**
     * segment length times the log of the (regularized) sample variance; detects
     * changes in mean and scale
     */
    NORMAL;

    public static CostModel fromName(String name) {
        checkConfiguration(name != null, "cost model cannot be null");
        for (CostModel model : values()) {
            if (model.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return model;
            }
        }
        throw new ConfigurationException("cost model " + name + " is not supported");
    }
}
