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

package com.amazon.ensembledetection.orchestration.detector;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.orchestration.DataProfile;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.pattern.GraphEdge;
import com.amazon.ensembledetection.pattern.PatternRecognitionEngine;
import com.amazon.ensembledetection.testutils.ExampleDataSets;
import com.amazon.ensembledetection.util.Deadline;

public class PatternRecognitionDetectorTest {

    private PatternRecognitionDetector detector;
    private DetectionContext context;

    @BeforeEach
    public void setUp() {
        detector = new PatternRecognitionDetector(PatternRecognitionEngine.builder().windowSize(10).build());
        context = new DetectionContext(DataProfile.builder().build(), 0.7, Deadline.none());
    }

    @Test
    public void testStarCenter() {
        List<Object> payload = new ArrayList<>();
        for (String[] pair : ExampleDataSets.starGraph(10)) {
            payload.add(new GraphEdge(pair[0], pair[1]));
        }
        DetectionMethodResult result = detector.detect(payload, context);
        assertEquals(DetectionMethod.PATTERN_RECOGNITION, result.getMethod());
        assertTrue(result.isAnomaly());
        assertEquals(1.0, result.getScore(), 1e-12);
        assertEquals(Collections.singletonList(0), result.getFlaggedIndices());
        assertEquals("Most anomalous node: center", result.getExplanations().get(0));
        assertEquals(10.0, result.getDiagnostics().get("maxDegree"), 0);
        assertEquals(1.0, result.getDiagnostics().get("motifs"), 0);
    }

    @Test
    public void testSequenceSpike() {
        List<Object> payload = new ArrayList<>();
        for (double value : ExampleDataSets.spikeSeries(20, 19, 1, 100)) {
            payload.add(value);
        }
        DetectionMethodResult result = detector.detect(payload, context);
        assertTrue(result.isAnomaly());
        assertEquals(10, result.getFlaggedIndices().size());
        assertEquals(Integer.valueOf(10), result.getFlaggedIndices().get(0));
        assertEquals(1.0, result.getScore(), 1e-12);
        assertThat(result.getExplanations(), hasItem("Most anomalous index: 10"));
        assertFalse(result.getDiagnostics().containsKey("maxDegree"));
    }

    @Test
    public void testTooFewElements() {
        DetectionMethodResult result = detector.detect(Collections.singletonList(1.0), context);
        assertFalse(result.isAnomaly());
        assertThat(result.getExplanations(), contains("Too few elements for pattern analysis"));
        assertEquals(0.0, result.getDiagnostics().get("motifs"), 0);
    }
}
