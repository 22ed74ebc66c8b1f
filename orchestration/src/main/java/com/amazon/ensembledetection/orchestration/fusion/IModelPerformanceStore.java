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

package com.amazon.ensembledetection.orchestration.fusion;

import java.util.Optional;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * Historical performance of the detection methods. The stacking strategy
 * weights methods by their accuracy.
 */
public interface IModelPerformanceStore {

    /**
     * @param method a detection method
     * @return the fraction of correct verdicts, or empty without feedback
     */
    Optional<Double> getAccuracy(DetectionMethod method);

    void recordOutcome(DetectionMethod method, boolean correct);

    void recordExecution(DetectionMethod method, long elapsedMillis);

    Optional<Double> getAverageExecutionMillis(DetectionMethod method);
}
