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
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.NotTrainedException;
import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.multivariate.MultivariateDetector;
import com.amazon.ensembledetection.orchestration.DataProfile;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.testutils.NormalMixtureTestData;
import com.amazon.ensembledetection.util.Deadline;

public class MultivariateMethodDetectorTest {

    private MultivariateMethodDetector detector;
    private DetectionContext context;
    private List<Object> normal;

    @BeforeEach
    public void setUp() {
        detector = new MultivariateMethodDetector(MultivariateDetector.builder().randomSeed(0L).build(), 0L);
        context = new DetectionContext(DataProfile.builder().build(), 0.7, Deadline.none());
        normal = new ArrayList<>();
        for (double[] row : NormalMixtureTestData.baseOnly(0, 1).generateTestData(100, 3, 42L)) {
            normal.add(MultivariateDataPoint.of(row));
        }
    }

    @Test
    public void testShortPayloadNeedsTrainedModel() {
        List<Object> payload = new ArrayList<>();
        payload.add(MultivariateDataPoint.of(0, 0, 0));
        assertFalse(detector.isTrained());
        assertThrows(NotTrainedException.class, () -> detector.detect(payload, context));

        detector.train(normal);
        assertTrue(detector.isTrained());
        DetectionMethodResult result = detector.detect(payload, context);
        assertFalse(result.isAnomaly());
        assertEquals(1.0, result.getDiagnostics().get(AbstractDetector.POINTS), 0);
    }

    @Test
    public void testLongPayloadFitsItsOwnModel() {
        List<Object> payload = new ArrayList<>(normal);
        payload.add(MultivariateDataPoint.of(50, 50, 50));
        DetectionMethodResult result = detector.detect(payload, context);
        assertTrue(result.isAnomaly());
        assertThat(result.getFlaggedIndices(), hasItem(100));
        assertTrue(result.getScore() > 0.9);
        assertTrue(result.getDiagnostics().get("maxMahalanobisDistance") > 10);
        assertTrue(result.getDiagnostics().containsKey(MultivariateMethodDetector.CONTRIBUTION_PREFIX + "f0"));
        assertThat(result.getExplanations(), hasItem("Model fitted to the first 70 of 101 points"));
        assertFalse(detector.isTrained());
    }

    @Test
    public void testMapsAreNormalizedToFirstPointFeatures() {
        List<Object> payload = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            Map<String, Object> features = new HashMap<>();
            features.put("a", (double) (i % 3));
            if (i % 2 == 0) {
                features.put("b", (double) (i % 4));
            }
            Map<String, Object> point = new HashMap<>();
            point.put("features", features);
            payload.add(point);
        }
        DetectionMethodResult result = detector.detect(payload, context);
        assertEquals(12.0, result.getDiagnostics().get(AbstractDetector.POINTS), 0);
    }
}
