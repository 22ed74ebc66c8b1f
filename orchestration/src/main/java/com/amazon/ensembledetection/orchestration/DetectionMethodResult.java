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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * The verdict of one detection method over a whole payload.
 */
@Getter
@Builder
public class DetectionMethodResult {

    private final DetectionMethod method;

    private final boolean anomaly;

    // in [0,1]
    private final double score;

    @Getter(AccessLevel.NONE)
    private final Double confidence;

    // method specific values such as the mean point score or the largest
    // Mahalanobis distance
    private final Map<String, Double> diagnostics;

    // positions of the flagged points within the payload
    private final List<Integer> flaggedIndices;

    private final List<String> explanations;

    private final long executionTimeMillis;

    public Optional<Double> getConfidence() {
        return Optional.ofNullable(confidence);
    }

    /**
     * @param executionTimeMillis the measured wall clock time
     * @return a copy of this result carrying the execution time
     */
    public DetectionMethodResult withExecutionTime(long executionTimeMillis) {
        return new DetectionMethodResult(method, anomaly, score, confidence, diagnostics, flaggedIndices,
                explanations, executionTimeMillis);
    }
}
