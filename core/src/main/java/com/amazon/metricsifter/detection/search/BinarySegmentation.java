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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.amazon.metricsifter.detection.cost.ISegmentCost;

/**
 * Greedy binary segmentation. At every step the single split with the largest
 * cost reduction over all current segments is considered; it is accepted while
 * the reduction exceeds the penalty.
 */
public class BinarySegmentation implements IChangePointSearch {

    private final int minSize;

    public BinarySegmentation(int minSize) {
        checkArgument(minSize > 0, "minSize must be greater than 0");
        this.minSize = minSize;
    }

    static class Split {
        final int position;
        final double gain;

        Split(int position, double gain) {
            this.position = position;
            this.gain = gain;
        }
    }

    @Override
    public List<Integer> search(ISegmentCost cost, double penalty) {
        int n = cost.getLength();
        int effectiveMinSize = Math.max(minSize, cost.getMinSize());
        List<Integer> ends = new ArrayList<>();
        ends.add(n);
        if (n < 2 * effectiveMinSize) {
            return ends;
        }
        Map<Long, Split> cache = new HashMap<>();

        while (true) {
            Split chosen = null;
            int start = 0;
            for (int end : ends) {
                Split split = cache.computeIfAbsent(((long) start << 32) | end,
                        key -> bestSplit(cost, effectiveMinSize, key));
                if (chosen == null || split.gain > chosen.gain) {
                    chosen = split;
                }
                start = end;
            }
            if (chosen.position < 0 || !(chosen.gain > penalty)) {
                break;
            }
            ends.add(chosen.position);
            Collections.sort(ends);
        }
        return ends;
    }

    Split bestSplit(ISegmentCost cost, int effectiveMinSize, long key) {
        int start = (int) (key >>> 32);
        int end = (int) key;
        double segmentCost = cost.error(start, end);
        Split best = new Split(-1, 0);
        boolean found = false;
        for (int position = start + effectiveMinSize; position <= end - effectiveMinSize; position++) {
            double gain = segmentCost - cost.error(start, position) - cost.error(position, end);
            if (!found || gain > best.gain) {
                best = new Split(position, gain);
                found = true;
            }
        }
        return best;
    }
}
