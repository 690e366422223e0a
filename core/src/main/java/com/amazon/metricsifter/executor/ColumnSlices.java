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

package com.amazon.metricsifter.executor;

import static com.amazon.metricsifter.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Splits {@code n} columns into contiguous, order preserving slices of nearly
 * equal size, so that a batch of columns can be handed to each worker.
 */
public class ColumnSlices {

    private ColumnSlices() {
    }

    /**
     * A half open range {@code [from, to)} of column positions.
     */
    @Getter
    public static class Slice {
        private final int from;
        private final int to;

        public Slice(int from, int to) {
            this.from = from;
            this.to = to;
        }

        public int size() {
            return to - from;
        }

        @Override
        public String toString() {
            return "[" + from + ", " + to + ")";
        }
    }

    /**
     * Creates at most {@code packs} slices covering {@code 0..n-1}. The sizes of
     * any two slices differ by at most one, the larger slices come first, and no
     * slice is empty.
     *
     * @param n     number of columns
     * @param packs desired number of slices, at least 1
     * @return the slices in ascending order
     */
    public static List<Slice> evenSlices(int n, int packs) {
        checkArgument(packs >= 1, "packs must be >= 1, got " + packs);
        checkArgument(n >= 0, "n cannot be negative");
        List<Slice> slices = new ArrayList<>();
        int start = 0;
        for (int pack = 0; pack < packs; pack++) {
            int size = n / packs + ((pack < n % packs) ? 1 : 0);
            if (size > 0) {
                slices.add(new Slice(start, start + size));
                start += size;
            }
        }
        return slices;
    }
}
