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

package com.amazon.metricsifter.testutils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A generated table of metrics, column by column, with the names of the metrics
 * that were made to change at the incident.
 */
public class IncidentData {

    public final List<String> names;

    public final List<double[]> columns;

    public final List<String> changedNames;

    public final int incidentIndex;

    public IncidentData(List<String> names, List<double[]> columns, List<String> changedNames, int incidentIndex) {
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.changedNames = Collections.unmodifiableList(new ArrayList<>(changedNames));
        this.incidentIndex = incidentIndex;
    }

    public int length() {
        return columns.isEmpty() ? 0 : columns.get(0).length;
    }

    /**
     * @return the samples as rows, one row per time index
     */
    public double[][] toRows() {
        double[][] rows = new double[length()][names.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < column.length; i++) {
                rows[i][j] = column[i];
            }
        }
        return rows;
    }
}
