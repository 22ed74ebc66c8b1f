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

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.fusion.FusedAnomalyResult;

@Getter
@Builder
public class DetectionResult {

    private final String requestId;

    private final RequestState state;

    private final DataProfile profile;

    private final List<DetectionMethod> selectedMethods;

    // successful methods only, in selection order
    private final List<DetectionMethodResult> methodResults;

    // failure message of each method that was excluded from fusion
    private final Map<DetectionMethod, String> failures;

    private final FusedAnomalyResult fusedResult;

    private final PerformanceMetrics performance;

    // epoch milliseconds at completion
    private final long timestamp;

    private final long totalProcessingMillis;
}
