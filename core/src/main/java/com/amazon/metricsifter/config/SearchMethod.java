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
 * The search algorithm used to locate changepoints in a single metric.
 */
public enum SearchMethod {

    /**
     * exact penalized search with pruning (PELT) over the linear kernel cost, that
     * is, the sum of squared deviations from the segment mean; the cost model
     * option does not apply
     */
    PELT,
    /**
     * greedy binary segmentation; the segment with the best split is divided as
     * long as the gain of the split exceeds the penalty
     */
    BINSEG,
    /**
     * bottom-up segmentation; a fine partition is merged pairwise as long as the
     * cheapest merge costs less than the penalty
     */
    BOTTOMUP;

    /**
     * Resolves a search method from its name, ignoring case.
     *
     * @param name the name, for example "pelt"
     * @return the search method
     * @throws ConfigurationException if the name is unknown
     */
    public static SearchMethod fromName(String name) {
        checkConfiguration(name != null, "search method cannot be null");
        for (SearchMethod method : values()) {
            if (method.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return method;
            }
        }
        throw new ConfigurationException("search method " + name + " is not supported");
    }
}
