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

package com.amazon.metricsifter.detection.search;

import static com.amazon.metricsifter.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.metricsifter.detection.cost.ISegmentCost;

/**
 * Pruned exact linear time (PELT) search. Minimizes the sum of segment costs
 * plus one penalty per segment over all segmentations whose segments have at
 * least {@code minSize} samples. A start position is pruned once it can no
 * longer beat the optimum by more than one penalty.
 *
 * When two starts give the same objective the later start wins, so that with a
 * zero penalty a constant signal is cut into minimal segments.
 */
public class Pelt implements IChangePointSearch {

    private final int minSize;

    public Pelt(int minSize) {
        checkArgument(minSize > 0, "minSize must be greater than 0");
        this.minSize = minSize;
    }

    @Override
    public List<Integer> search(ISegmentCost cost, double penalty) {
        int n = cost.getLength();
        int effectiveMinSize = Math.max(minSize, cost.getMinSize());
        if (n < 2 * effectiveMinSize) {
            return Collections.singletonList(n);
        }

        double[] best = new double[n + 1];
        int[] lastStart = new int[n + 1];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        Arrays.fill(lastStart, -1);
        best[0] = 0;

        List<Integer> admissible = new ArrayList<>();
        for (int end = effectiveMinSize; end <= n; end++) {
            int candidate = end - effectiveMinSize;
            if (best[candidate] < Double.POSITIVE_INFINITY) {
                admissible.add(candidate);
            }
            double[] objective = new double[admissible.size()];
            double minimum = Double.POSITIVE_INFINITY;
            int argument = -1;
            for (int k = 0; k < admissible.size(); k++) {
                int start = admissible.get(k);
                objective[k] = best[start] + cost.error(start, end) + penalty;
                if (objective[k] <= minimum) {
                    minimum = objective[k];
                    argument = start;
                }
            }
            best[end] = minimum;
            lastStart[end] = argument;

            List<Integer> retained = new ArrayList<>(admissible.size());
            for (int k = 0; k < admissible.size(); k++) {
                if (objective[k] <= minimum + penalty) {
                    retained.add(admissible.get(k));
                }
            }
            admissible = retained;
        }

        List<Integer> ends = new ArrayList<>();
        for (int end = n; end > 0; end = lastStart[end]) {
            ends.add(end);
        }
        Collections.reverse(ends);
        return ends;
    }
}
