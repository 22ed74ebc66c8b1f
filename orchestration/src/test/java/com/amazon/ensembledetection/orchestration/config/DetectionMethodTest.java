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

package com.amazon.ensembledetection.orchestration.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

public class DetectionMethodTest {

    @ParameterizedTest
    @EnumSource(DetectionMethod.class)
    public void testWireNameRoundTrip(DetectionMethod method) {
        assertEquals(method, DetectionMethod.fromName(method.getWireName()));
        assertEquals(method, DetectionMethod.fromName(method.name()));
        assertEquals(method.getWireName(), method.toString());
    }

    @Test
    public void testFromName() {
        assertEquals(DetectionMethod.TIME_SERIES, DetectionMethod.fromName(" Time_Series "));
        assertEquals("pattern_recognition", DetectionMethod.PATTERN_RECOGNITION.getWireName());
        assertThrows(IllegalArgumentException.class, () -> DetectionMethod.fromName("forest"));
    }

    @Test
    public void testFusionStrategyNames() {
        assertEquals(FusionStrategy.STACKING, FusionStrategy.fromName("stacking"));
        assertEquals("adaptive", FusionStrategy.ADAPTIVE.getWireName());
        assertThrows(IllegalArgumentException.class, () -> FusionStrategy.fromName("average"));
    }
}
