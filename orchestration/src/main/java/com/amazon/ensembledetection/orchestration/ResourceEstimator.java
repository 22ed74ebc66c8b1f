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

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * A rough upper bound of the working memory a request needs, checked against
 * the memory budget before any method runs.
 */
public class ResourceEstimator {

    public static final long BASE_BYTES_PER_METHOD = 100L * 1024L;

    public static final int BYTES_PER_VALUE = Double.BYTES;

    /**
     * @param method  a detection method
     * @param profile the profile of the payload
     * @return estimated bytes: a fixed overhead plus the payload size times a
     *         method specific factor
     */
    public long estimate(DetectionMethod method, DataProfile profile) {
        long width = Math.max(1, profile.getFeatureCount());
        long factor;
        switch (method) {
        case ENSEMBLE:
            factor = 4;
            break;
        case TIME_SERIES:
            factor = 8;
            break;
        case MULTIVARIATE:
            // covariance, components and the stored reference rows grow with the width
            factor = width + 8;
            break;
        default:
            factor = 16;
        }
        return BASE_BYTES_PER_METHOD + profile.getLength() * width * BYTES_PER_VALUE * factor;
    }

    public long estimate(List<DetectionMethod> methods, DataProfile profile) {
        long total = 0;
        for (DetectionMethod method : methods) {
            total += estimate(method, profile);
        }
        return total;
    }
}
