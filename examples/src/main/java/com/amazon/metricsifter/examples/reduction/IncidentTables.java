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

package com.amazon.metricsifter.examples.reduction;

import java.util.List;

import com.amazon.metricsifter.series.MultivariateSeries;
import com.amazon.metricsifter.testutils.IncidentData;

public class IncidentTables {

    private IncidentTables() {
    }

    public static MultivariateSeries toSeries(IncidentData data) {
        return MultivariateSeries.fromRows(data.names, data.toRows());
    }

    /**
     * @param expected the metrics that should have been kept
     * @param kept     the metrics that were kept
     * @return precision and recall of the kept metrics as a printable line
     */
    public static String score(List<String> expected, List<String> kept) {
        long hits = kept.stream().filter(expected::contains).count();
        double precision = kept.isEmpty() ? 0 : (double) hits / kept.size();
        double recall = expected.isEmpty() ? 0 : (double) hits / expected.size();
        return String.format("kept %d metrics, precision = %.2f, recall = %.2f", kept.size(), precision, recall);
    }
}
