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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import com.amazon.metricsifter.ConfigurationException;
import com.amazon.metricsifter.MetricSifter;
import com.amazon.metricsifter.config.Bandwidth;
import com.amazon.metricsifter.config.CostModel;
import com.amazon.metricsifter.config.Penalty;
import com.amazon.metricsifter.config.SearchMethod;
import com.amazon.metricsifter.config.SegmentSelectionMethod;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

public class MetricSifterMapperTest {

    private final MetricSifterMapper mapper = new MetricSifterMapper();

    private static void assertSameConfiguration(MetricSifter expected, MetricSifter actual) {
        assertEquals(expected.getSearchMethod(), actual.getSearchMethod());
        assertEquals(expected.getCostModel(), actual.getCostModel());
        assertEquals(expected.getPenalty(), actual.getPenalty());
        assertEquals(expected.getPenaltyAdjust(), actual.getPenaltyAdjust());
        assertEquals(expected.getBandwidth(), actual.getBandwidth());
        assertEquals(expected.getSegmentSelectionMethod(), actual.getSegmentSelectionMethod());
        assertEquals(expected.isParallelExecutionEnabled(), actual.isParallelExecutionEnabled());
        assertEquals(expected.getThreadPoolSize(), actual.getThreadPoolSize());
    }

    @Test
    public void testToState() {
        MetricSifter sifter = MetricSifter.builder().searchMethod(SearchMethod.BOTTOMUP).costModel(CostModel.NORMAL)
                .penalty(12.5).penaltyAdjust(3.0).bandwidth(Bandwidth.SCOTT)
                .segmentSelectionMethod(SegmentSelectionMethod.MAX).threadPoolSize(3).build();
        MetricSifterState state = mapper.toState(sifter);
        assertEquals(Version.V1_0, state.getVersion());
        assertEquals("bottomup", state.getSearchMethod());
        assertEquals("normal", state.getCostModel());
        assertEquals("12.5", state.getPenalty());
        assertEquals(3.0, state.getPenaltyAdjust());
        assertEquals("scott", state.getBandwidth());
        assertEquals("max", state.getSegmentSelectionMethod());
        assertEquals(3, state.getThreadPoolSize());
    }

    @Test
    public void testRoundTrip() {
        MetricSifter sifter = MetricSifter.builder().searchMethod(SearchMethod.BINSEG).penalty(Penalty.AIC)
                .bandwidth(4.0).threadPoolSize(2).build();
        assertSameConfiguration(sifter, mapper.toModel(mapper.toState(sifter)));

        MetricSifter sequential = MetricSifter.builder().parallelExecutionEnabled(false).build();
        MetricSifter rebuilt = mapper.toModel(mapper.toState(sequential));
        assertSameConfiguration(sequential, rebuilt);
        assertFalse(rebuilt.isParallelExecutionEnabled());
    }

    @Test
    public void testJsonRoundTrip() throws JsonProcessingException {
        MetricSifter sifter = MetricSifter.builder().searchMethod(SearchMethod.PELT).penalty(Penalty.BIC)
                .penaltyAdjust(2.5).bandwidth(Bandwidth.SILVERMAN).threadPoolSize(4).build();
        ObjectMapper jsonMapper = new ObjectMapper();
        String json = jsonMapper.writeValueAsString(mapper.toState(sifter));
        MetricSifterState state = jsonMapper.readValue(json, MetricSifterState.class);
        assertEquals(mapper.toState(sifter), state);
        assertSameConfiguration(sifter, mapper.toModel(state));
    }

    @Test
    public void testInvalidStateIsRejected() throws JsonProcessingException {
        String json = "{\"version\":\"1.0\",\"searchMethod\":\"dynp\",\"costModel\":\"l2\",\"penalty\":\"bic\","
                + "\"penaltyAdjust\":2.0,\"bandwidth\":\"2.5\",\"segmentSelectionMethod\":\"weighted_max\","
                + "\"parallelExecutionEnabled\":false,\"threadPoolSize\":0}";
        MetricSifterState state = new ObjectMapper().readValue(json, MetricSifterState.class);
        assertThrows(ConfigurationException.class, () -> mapper.toModel(state));

        state.setSearchMethod("pelt");
        state.setPenaltyAdjust(-1);
        assertThrows(ConfigurationException.class, () -> mapper.toModel(state));

        state.setPenaltyAdjust(2.0);
        state.setVersion("0.1");
        assertThrows(IllegalArgumentException.class, () -> mapper.toModel(state));
    }

    @Test
    public void testThreadPoolSizeNotSaved() {
        MetricSifterMapper noThreads = new MetricSifterMapper();
        noThreads.setSaveThreadPoolSizeEnabled(false);
        MetricSifter sifter = MetricSifter.builder().threadPoolSize(3).build();
        MetricSifterState state = noThreads.toState(sifter);
        assertEquals(0, state.getThreadPoolSize());
        assertEquals(Runtime.getRuntime().availableProcessors(), noThreads.toModel(state).getThreadPoolSize());
    }

    @Test
    public void testLoggerIsCarriedByMapper() {
        Logger logger = mock(Logger.class);
        MetricSifterMapper withLogger = new MetricSifterMapper();
        withLogger.setLogger(logger);
        MetricSifter rebuilt = withLogger.toModel(withLogger.toState(MetricSifter.builder().build()));
        assertSame(logger, rebuilt.getLogger());
    }
}
