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
 * Policies for choosing one segment among the competing segments produced by
 * the kernel density segmentation.
 */
public enum SegmentSelectionMethod {

    /**
     * the segment containing the largest number of metrics
     */
    MAX,
    /**
     * the segment maximizing the sum, over its metrics, of the inverse of the
     * number of changepoints of that metric; a metric with few, sharply localized
     * changepoints counts more than a metric with many scattered ones
     */
    WEIGHTED_MAX;

    public static SegmentSelectionMethod fromName(String name) {
        checkConfiguration(name != null, "segment selection method cannot be null");
        for (SegmentSelectionMethod method : values()) {
            if (method.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return method;
            }
        }
        throw new ConfigurationException("Unknown segment selection method: " + name);
    }
}
