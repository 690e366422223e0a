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

package com.amazon.metricsifter;

import static com.amazon.metricsifter.CommonUtils.checkArgument;
import static com.amazon.metricsifter.CommonUtils.checkConfiguration;
import static com.amazon.metricsifter.CommonUtils.checkNotNull;
import static com.amazon.metricsifter.CommonUtils.checkState;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class CommonUtilsTest {

    @Test
    public void testCheckArgument() {
        assertDoesNotThrow(() -> checkArgument(true, "unused"));
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> checkArgument(false, "bad argument"));
        assertEquals("bad argument", exception.getMessage());
    }

    @Test
    public void testCheckConfiguration() {
        assertDoesNotThrow(() -> checkConfiguration(true, "unused"));
        ConfigurationException exception = assertThrows(ConfigurationException.class,
                () -> checkConfiguration(false, "bad option"));
        assertEquals("bad option", exception.getMessage());
        assertTrue(exception instanceof IllegalArgumentException);
    }

    @Test
    public void testCheckState() {
        assertDoesNotThrow(() -> checkState(true, "unused"));
        assertThrows(IllegalStateException.class, () -> checkState(false, "bad state"));
    }

    @Test
    public void testCheckNotNull() {
        String value = "value";
        assertSame(value, checkNotNull(value, "unused"));
        NullPointerException exception = assertThrows(NullPointerException.class,
                () -> checkNotNull(null, "null value"));
        assertEquals("null value", exception.getMessage());
    }
}
