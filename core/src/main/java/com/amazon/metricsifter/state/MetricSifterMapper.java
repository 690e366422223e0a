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

package com.amazon.metricsifter.state;

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;

import java.util.Locale;

import lombok.Getter;
import lombok.Setter;

import org.slf4j.Logger;

import com.amazon.metricsifter.MetricSifter;

/**
 * A utility class for creating a {@link MetricSifterState} instance from a
 * {@link MetricSifter} instance and vice versa. The logger of a sifter is not
 * part of its state; a rebuilt sifter gets the default logger unless the mapper
 * carries another one.
 */
@Getter
@Setter
public class MetricSifterMapper implements IStateMapper<MetricSifter, MetricSifterState> {

    /**
     * If false, the thread pool size of the state is ignored and the rebuilt
     * sifter uses as many workers as there are processors.
     */
    private boolean saveThreadPoolSizeEnabled = true;

    private Logger logger;

    @Override
    public MetricSifterState toState(MetricSifter sifter) {
        checkNotNull(sifter, "sifter cannot be null");
        MetricSifterState state = new MetricSifterState();
        state.setSearchMethod(sifter.getSearchMethod().name().toLowerCase(Locale.ROOT));
        state.setCostModel(sifter.getCostModel().name().toLowerCase(Locale.ROOT));
        state.setPenalty(sifter.getPenalty().toString());
        state.setPenaltyAdjust(sifter.getPenaltyAdjust());
        state.setBandwidth(sifter.getBandwidth().toString());
        state.setSegmentSelectionMethod(sifter.getSegmentSelectionMethod().name().toLowerCase(Locale.ROOT));
        state.setParallelExecutionEnabled(sifter.isParallelExecutionEnabled());
        state.setThreadPoolSize(saveThreadPoolSizeEnabled ? sifter.getThreadPoolSize() : 0);
        return state;
    }

    /**
     * Rebuilds a sifter. Every option is validated as if it was given to the
     * builder directly.
     *
     * @param state a sifter state
     * @return a new sifter
     * @throws com.amazon.metricsifter.ConfigurationException if an option is
     *                                                        invalid
     */
    @Override
    public MetricSifter toModel(MetricSifterState state) {
        checkNotNull(state, "state cannot be null");
        checkArgument(Version.V1_0.equals(state.getVersion()), "unsupported state version: " + state.getVersion());
        MetricSifter.Builder<?> builder = MetricSifter.builder().searchMethod(state.getSearchMethod())
                .costModel(state.getCostModel()).penalty(state.getPenalty()).penaltyAdjust(state.getPenaltyAdjust())
                .bandwidth(state.getBandwidth()).segmentSelectionMethod(state.getSegmentSelectionMethod())
                .parallelExecutionEnabled(state.isParallelExecutionEnabled()).logger(logger);
        if (state.isParallelExecutionEnabled() && state.getThreadPoolSize() > 0) {
            builder.threadPoolSize(state.getThreadPoolSize());
        }
        return builder.build();
    }
}
