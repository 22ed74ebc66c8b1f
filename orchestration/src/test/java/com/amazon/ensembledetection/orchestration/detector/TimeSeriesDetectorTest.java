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
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
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
import com.amazon.ensembledetection.orchestration.TimeSeriesPoint;
import com.amazon.ensembledetection.testutils.ExampleDataSets;
import com.amazon.ensembledetection.util.Deadline;

public class TimeSeriesDetectorTest {

    private TimeSeriesDetector detector;
    private DetectionContext context;

    @BeforeEach
    public void setUp() {
        detector = new TimeSeriesDetector();
        context = new DetectionContext(DataProfile.builder().build(), 0.7, Deadline.none());
    }

    @Test
    public void testShortSeries() {
        DetectionMethodResult result = detector.detect(Collections.singletonList(3.0), context);
        assertFalse(result.isAnomaly());
        assertEquals(0.0, result.getScore(), 0);
        assertThat(result.getExplanations(), contains("Series too short for temporal analysis"));
    }

    @Test
    public void testSeasonalPeriod() {
        double[] values = ExampleDataSets.seasonalSeries(200, 10, 5, 0, 1L);
        assertEquals(10, TimeSeriesDetector.detectPeriod(values, Deadline.none()));

        List<Object> payload = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            payload.add(new TimeSeriesPoint(1000L * i, values[i]));
        }
        DetectionMethodResult result = detector.detect(payload, context);
        assertEquals(10.0, result.getDiagnostics().get("period"), 0);
        assertThat(result.getExplanations(), hasItem("Seasonal period of 10 detected"));
    }

    @Test
    public void testNoPeriodInConstantSeries() {
        assertEquals(0, TimeSeriesDetector.detectPeriod(new double[30], Deadline.none()));
    }

    @Test
    public void testLevelShiftRaisesChangePoints() {
        double[] values = ExampleDataSets.levelShiftSeries(100, 50, 10, 0.1, 3L);
        List<Object> payload = new ArrayList<>();
        for (double value : values) {
            payload.add(value);
        }
        DetectionMethodResult result = detector.detect(payload, context);
        assertTrue(result.isAnomaly());
        assertTrue(result.getDiagnostics().get("changePoints") > 0);
        assertThat(result.getExplanations(), hasItem(startsWith("Largest temporal deviation at index")));
        assertTrue(result.getScore() >= TimeSeriesDetector.CHANGE_POINT_SCORE);
    }

    @Test
    public void testMovingAverage() {
        assertArrayEquals(new double[] { 1.5, 2, 3, 4, 4.5 },
                TimeSeriesDetector.movingAverage(new double[] { 1, 2, 3, 4, 5 }, 3), 1e-12);
        // an even window is widened to 3
        assertArrayEquals(new double[] { 1.5, 2, 3, 4, 4.5 },
                TimeSeriesDetector.movingAverage(new double[] { 1, 2, 3, 4, 5 }, 2), 1e-12);
    }

    @Test
    public void testSeasonalComponent() {
        double[] values = new double[] { 1, -1, 1, -1 };
        assertArrayEquals(values, TimeSeriesDetector.seasonal(values, new double[4], 2), 1e-12);
        assertArrayEquals(new double[4], TimeSeriesDetector.seasonal(values, new double[4], 0), 0);
    }

    @Test
    public void testChangePointScoresRestartAfterDetection() {
        double[] values = new double[40];
        for (int i = 20; i < 40; i++) {
            values[i] = 1;
        }
        double[] scores = TimeSeriesDetector.changePointScores(values, Deadline.none());
        int detections = 0;
        for (double score : scores) {
            if (score > 0) {
                ++detections;
                assertEquals(TimeSeriesDetector.CHANGE_POINT_SCORE, score, 1e-12);
            }
        }
        // each half contributes a detection every seven steps
        assertEquals(4, detections);
        assertArrayEquals(new double[5], TimeSeriesDetector.changePointScores(new double[5], Deadline.none()), 0);
    }
}
