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

import java.util.List;
import java.util.function.Function;

/**
 * Applies a function to independent units of work (metric columns or slices of
 * columns) and returns the results in the order of the units, whatever the
 * order in which they complete. A failure of any unit aborts the whole batch
 * and is rethrown to the caller.
 */
public abstract class AbstractColumnExecutor implements AutoCloseable {

    /**
     * Maps every unit of work with the given function.
     *
     * @param units    the units of work, read only
     * @param function a function without side effects on shared state
     * @param <T>      the type of a unit of work
     * @param <R>      the type of a result
     * @return one result per unit, in the order of {@code units}
     */
    public abstract <T, R> List<R> map(List<T> units, Function<T, R> function);

    /**
     * @return the number of units that may be processed at the same time
     */
    public abstract int getParallelism();

    /**
     * Releases the workers of this executor, if any.
     */
    @Override
    public void close() {
    }
}
