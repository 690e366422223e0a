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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Processes units of work on a private thread pool. The pool is created lazily
 * and released by {@link #close()}; an executor is meant to live for a single
 * sifter run.
 */
public class ParallelColumnExecutor extends AbstractColumnExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelColumnExecutor(int threadPoolSize) {
        checkArgument(threadPoolSize > 0, "threadPoolSize must be greater than 0");
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    public <T, R> List<R> map(List<T> units, Function<T, R> function) {
        return submitAndJoin(() -> units.parallelStream().map(function).collect(Collectors.toList()));
    }

    @Override
    public int getParallelism() {
        return threadPoolSize;
    }

    @Override
    public void close() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    private <T> T submitAndJoin(Callable<T> callable) {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool.submit(callable).join();
    }
}
