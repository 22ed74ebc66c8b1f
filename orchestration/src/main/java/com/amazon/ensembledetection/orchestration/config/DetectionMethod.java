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

package com.amazon.ensembledetection.orchestration.config;

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

/**
 * The closed set of detection methods the orchestrator can run. Each method is
 * backed by one {@code IDetector} in the detector registry.
 */
public enum DetectionMethod {
    /**
     * Lightweight statistical baseline: z-score, median absolute deviation and
     * interquartile fence detectors with a soft vote.
     */
    ENSEMBLE("ensemble"),
    /**
     * Seasonal decomposition residuals combined with CUSUM change points.
     */
    TIME_SERIES("time_series"),
    /**
     * PCA, ICA, Mahalanobis and correlation scoring. This is the heavyweight
     * method.
     */
    MULTIVARIATE("multivariate"),
    /**
     * Graph centrality or sliding window sequence analysis.
     */
    PATTERN_RECOGNITION("pattern_recognition");

    private final String wireName;

    DetectionMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * @param name a wire name such as {@code time_series}, or a constant name;
     *             case is ignored
     * @return the matching method
     * @throws IllegalArgumentException if no method matches
     */
    public static DetectionMethod fromName(String name) {
        checkNotNull(name, "method name must not be null");
        String trimmed = name.trim();
        for (DetectionMethod method : values()) {
            if (method.wireName.equalsIgnoreCase(trimmed) || method.name().equalsIgnoreCase(trimmed)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown detection method: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
