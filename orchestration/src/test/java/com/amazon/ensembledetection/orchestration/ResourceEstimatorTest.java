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

package com.amazon.ensembledetection.orchestration;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

public class ResourceEstimatorTest {

    private final ResourceEstimator estimator = new ResourceEstimator();

    @Test
    public void testEstimates() {
        DataProfile series = DataProfile.builder().length(1000).build();
        long base = ResourceEstimator.BASE_BYTES_PER_METHOD;
        assertEquals(base + 1000 * 8 * 4, estimator.estimate(DetectionMethod.ENSEMBLE, series));
        assertEquals(base + 1000 * 8 * 8, estimator.estimate(DetectionMethod.TIME_SERIES, series));
        assertEquals(base + 1000 * 8 * 16, estimator.estimate(DetectionMethod.PATTERN_RECOGNITION, series));

        DataProfile points = DataProfile.builder().length(1000).featureCount(5).build();
        assertEquals(base + 1000 * 5 * 8 * 13, estimator.estimate(DetectionMethod.MULTIVARIATE, points));
        assertEquals(2 * base + 1000 * 5 * 8 * (4 + 13),
                estimator.estimate(Arrays.asList(DetectionMethod.ENSEMBLE, DetectionMethod.MULTIVARIATE), points));
    }
}
