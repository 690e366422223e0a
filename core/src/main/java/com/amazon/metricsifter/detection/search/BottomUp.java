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
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

import com.amazon.metricsifter.detection.cost.ISegmentCost;

/**
 * Bottom-up segmentation. The signal is first bisected recursively into the
 * finest partition allowed by the minimum segment size; adjacent segments are
 * then merged, cheapest merge first, while the cost of the merge is below the
 * penalty.
 */
public class BottomUp implements IChangePointSearch {

    private final int minSize;

    public BottomUp(int minSize) {
        checkArgument(minSize > 0, "minSize must be greater than 0");
        this.minSize = minSize;
    }

    static class Node {
        final int start;
        final int end;
        final double cost;

        Node(int start, int end, double cost) {
            this.start = start;
            this.end = end;
            this.cost = cost;
        }
    }

    static class Merge {
        final Node left;
        final Node right;
        final Node merged;
        final double gain;

        Merge(Node left, Node right, ISegmentCost cost) {
            this.left = left;
            this.right = right;
            this.merged = new Node(left.start, right.end, cost.error(left.start, right.end));
            this.gain = merged.cost - left.cost - right.cost;
        }
    }

    @Override
    public List<Integer> search(ISegmentCost cost, double penalty) {
        int n = cost.getLength();
        int effectiveMinSize = Math.max(minSize, cost.getMinSize());
        if (n < 2 * effectiveMinSize) {
            return Collections.singletonList(n);
        }

        List<Node> leaves = new ArrayList<>();
        bisect(0, n, effectiveMinSize, cost, leaves);

        PriorityQueue<Merge> candidates = new PriorityQueue<>(
                Comparator.<Merge>comparingDouble(m -> m.gain).thenComparingInt(m -> m.left.start));
        for (int i = 0; i + 1 < leaves.size(); i++) {
            candidates.add(new Merge(leaves.get(i), leaves.get(i + 1), cost));
        }

        Map<Node, Boolean> removed = new IdentityHashMap<>();
        while (!candidates.isEmpty()) {
            Merge merge = candidates.poll();
            if (removed.containsKey(merge.left) || removed.containsKey(merge.right)) {
                continue;
            }
            if (!(merge.gain < penalty)) {
                break;
            }
            int index = indexOf(leaves, merge.left);
            leaves.set(index, merge.merged);
            leaves.remove(index + 1);
            removed.put(merge.left, Boolean.TRUE);
            removed.put(merge.right, Boolean.TRUE);
            if (index > 0) {
                candidates.add(new Merge(leaves.get(index - 1), merge.merged, cost));
            }
            if (index < leaves.size() - 1) {
                candidates.add(new Merge(merge.merged, leaves.get(index + 1), cost));
            }
        }

        List<Integer> ends = new ArrayList<>(leaves.size());
        for (Node leaf : leaves) {
            ends.add(leaf.end);
        }
        return ends;
    }

    /**
     * Splits {@code [start, end)} at the admissible position closest to its middle
     * (the smaller one on ties) until no segment can be split any more.
     */
    void bisect(int start, int end, int effectiveMinSize, ISegmentCost cost, List<Node> leaves) {
        int first = start + effectiveMinSize;
        int last = end - effectiveMinSize;
        if (first > last) {
            leaves.add(new Node(start, end, cost.error(start, end)));
            return;
        }
        int position = Math.max(first, Math.min(last, (start + end) / 2));
        bisect(start, position, effectiveMinSize, cost, leaves);
        bisect(position, end, effectiveMinSize, cost, leaves);
    }

    private static int indexOf(List<Node> leaves, Node node) {
        for (int i = 0; i < leaves.size(); i++) {
            if (leaves.get(i) == node) {
                return i;
            }
        }
        throw new IllegalStateException("segment is not a leaf of the partition");
    }
}
