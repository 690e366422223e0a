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

package com.amazon.metricsifter.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.metricsifter.ConfigurationException;

public class BandwidthTest {

    @Test
    public void testParse() {
        assertSame(Bandwidth.SCOTT, Bandwidth.parse("scott"));
        assertSame(Bandwidth.SILVERMAN, Bandwidth.parse("Silverman"));
        assertEquals(Bandwidth.fixed(2.5), Bandwidth.parse("2.5"));
        assertEquals(Bandwidth.fixed(2.5), Bandwidth.parse(Bandwidth.fixed(2.5).toString()));
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "-2.5", "wide", "Infinity" })
    public void testRejectedBandwidths(String text) {
        assertThrows(ConfigurationException.class, () -> Bandwidth.parse(text));
    }

    @Test
    public void testFixedIgnoresSample() {
        assertEquals(2.5, Bandwidth.fixed(2.5).select(new double[] { 1, 100 }));
    }

    @Test
    public void testRules() {
        double[] sample = { 1, 2, 3, 4, 5, 6, 7, 8 };
        // std (ddof 1) = 2.449..., iqr / 1.349 = 3.5 / 1.349 = 2.594...
        double spread = Math.sqrt(6.0);
        double factor = Math.pow(8, -0.2);
        assertThat(Bandwidth.SCOTT.select(sample), closeTo(1.059 * spread * factor, 1e-9));
        assertThat(Bandwidth.SILVERMAN.select(sample), closeTo(0.9 * spread * factor, 1e-9));
    }

    @Test
    public void testRulesUseInterquartileRangeWhenSmaller() {
        double[] sample = { 0, 10, 10, 10, 11, 11, 12, 12, 12, 100 };
        double scott = Bandwidth.SCOTT.select(sample);
        assertThat(scott, greaterThan(0.0));
        assertThat(scott, lessThan(1.059 * Math.pow(10, -0.2) * 2.0));
    }

    @Test
    public void testRulesNeedSpread() {
        assertThrows(IllegalArgumentException.class, () -> Bandwidth.SCOTT.select(new double[] { 4 }));
        assertThrows(IllegalArgumentException.class, () -> Bandwidth.SILVERMAN.select(new double[] { 4, 4, 4 }));
    }
}
