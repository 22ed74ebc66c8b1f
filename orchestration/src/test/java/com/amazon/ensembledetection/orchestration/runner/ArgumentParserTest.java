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

package com.amazon.ensembledetection.orchestration.runner;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.orchestration.Priority;
import com.amazon.ensembledetection.orchestration.config.ConfigurationPreset;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.config.FusionStrategy;

public class ArgumentParserTest {

    private ArgumentParser parser;

    @BeforeEach
    public void setUp() {
        parser = new ArgumentParser("runner-class", "runner-description");
    }

    @Test
    public void testNew() {
        assertEquals(ConfigurationPreset.STANDARD, parser.getPreset());
        assertFalse(parser.getFusionStrategy().isPresent());
        assertTrue(parser.getMethods().isEmpty());
        assertEquals(Priority.MEDIUM, parser.getPriority());
        assertFalse(parser.getThreshold().isPresent());
        assertTrue(parser.getParallel());
        assertEquals(",", parser.getDelimiter());
        assertFalse(parser.getHeaderRow());
        assertEquals(42, parser.getRandomSeed());
    }

    @Test
    public void testParse() {
        parser.parse("--preset", "high-precision", "--fusion", "stacking", "--methods", "time_series, ensemble",
                "--priority", "critical", "--threshold", "0.65", "--parallel", "false", "--delimiter", "\t",
                "--header-row", "true", "--random-seed", "7");

        assertEquals(ConfigurationPreset.HIGH_PRECISION, parser.getPreset());
        assertEquals(FusionStrategy.STACKING, parser.getFusionStrategy().get());
        assertThat(parser.getMethods(), contains(DetectionMethod.TIME_SERIES, DetectionMethod.ENSEMBLE));
        assertEquals(Priority.CRITICAL, parser.getPriority());
        assertEquals(0.65, parser.getThreshold().get(), 0);
        assertFalse(parser.getParallel());
        assertEquals("\t", parser.getDelimiter());
        assertTrue(parser.getHeaderRow());
        assertEquals(7, parser.getRandomSeed());
    }

    @Test
    public void testParseShortFlags() {
        parser.parse("-p", "lightweight", "-f", "voting", "-m", "multivariate", "-t", "0.9", "-d", ";");

        assertEquals(ConfigurationPreset.LIGHTWEIGHT, parser.getPreset());
        assertEquals(FusionStrategy.VOTING, parser.getFusionStrategy().get());
        assertThat(parser.getMethods(), contains(DetectionMethod.MULTIVARIATE));
        assertEquals(0.9, parser.getThreshold().get(), 0);
        assertEquals(";", parser.getDelimiter());
    }

    @Test
    public void testParseMethods() {
        assertThat(ArgumentParser.parseMethods("ensemble,,PATTERN_RECOGNITION "),
                contains(DetectionMethod.ENSEMBLE, DetectionMethod.PATTERN_RECOGNITION));
        assertTrue(ArgumentParser.parseMethods("").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseMethods("forest"));
    }
}
