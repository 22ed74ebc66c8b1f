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

import java.util.List;

import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * A detection method that can score a whole request payload. Implementations
 * must not keep references to the results they return and must tolerate
 * concurrent calls to {@link #detect}.
 */
public interface IDetector {

    /**
     * @return the registry tag of this detector
     */
    DetectionMethod getMethod();

    /**
     * Fits whatever model the detector keeps between requests. Stateless
     * detectors ignore the call.
     *
     * @param payload training payload in any form accepted by the orchestrator
     */
    default void train(List<?> payload) {
    }

    /**
     * @param payload the request payload
     * @param context the profile, threshold and deadline of the request
     * @return the verdict of this method over the payload
     */
    DetectionMethodResult detect(List<?> payload, DetectionContext context);
}
