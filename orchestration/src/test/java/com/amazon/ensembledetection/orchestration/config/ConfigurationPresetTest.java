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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class ConfigurationPresetTest {

    @ParameterizedTest
    @CsvSource({ "lightweight, 0.8, VOTING, 5, 256", "standard, 0.7, ADAPTIVE, 30, 1024",
            "comprehensive, 0.6, STACKING, 120, 4096", "high-precision, 0.85, WEIGHTED, 60, 2048" })
    public void testPresetValues(String name, double threshold, FusionStrategy strategy, long seconds,
            long megabytes) {
        ConfigurationPreset preset = ConfigurationPreset.fromName(name);
        assertEquals(threshold, preset.getThreshold(), 0);
        assertEquals(strategy, preset.getFusionStrategy());
        assertEquals(Duration.ofSeconds(seconds), preset.getMaxProcessingTime());
        assertEquals(megabytes * ConfigurationPreset.MEGABYTE, preset.getMaxMemoryBytes());
    }

    @Test
    public void testDefaultMethods() {
        assertThat(ConfigurationPreset.LIGHTWEIGHT.getDefaultMethods(), contains(DetectionMethod.ENSEMBLE));
        assertThat(ConfigurationPreset.STANDARD.getDefaultMethods(), contains(DetectionMethod.ENSEMBLE));
        assertThat(ConfigurationPreset.COMPREHENSIVE.getDefaultMethods(), contains(DetectionMethod.ENSEMBLE,
                DetectionMethod.TIME_SERIES, DetectionMethod.MULTIVARIATE, DetectionMethod.PATTERN_RECOGNITION));
        assertThat(ConfigurationPreset.HIGH_PRECISION.getDefaultMethods(),
                contains(DetectionMethod.ENSEMBLE, DetectionMethod.MULTIVARIATE));
    }

    @Test
    public void testNames() {
        assertEquals(ConfigurationPreset.HIGH_PRECISION, ConfigurationPreset.fromName("HIGH_PRECISION"));
        assertEquals(ConfigurationPreset.STANDARD, ConfigurationPreset.fromName(" Standard "));
        assertThrows(IllegalArgumentException.class, () -> ConfigurationPreset.fromName("unknown"));
        assertThrows(NullPointerException.class, () -> ConfigurationPreset.fromName(null));
    }
}
