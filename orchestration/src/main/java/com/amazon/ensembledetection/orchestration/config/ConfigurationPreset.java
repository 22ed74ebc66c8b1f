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

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Named configurations: the default methods, the per-point score threshold
 * handed to the detectors, the fusion strategy and the resource limits of a
 * request.
 */
public enum ConfigurationPreset {

    LIGHTWEIGHT(0.8, FusionStrategy.VOTING, Duration.ofSeconds(5), 256L << 20,
            DetectionMethod.ENSEMBLE),
    STANDARD(0.7, FusionStrategy.ADAPTIVE, Duration.ofSeconds(30), 1024L << 20,
            DetectionMethod.ENSEMBLE),
    COMPREHENSIVE(0.6, FusionStrategy.STACKING, Duration.ofSeconds(120), 4096L << 20,
            DetectionMethod.ENSEMBLE, DetectionMethod.TIME_SERIES, DetectionMethod.MULTIVARIATE,
            DetectionMethod.PATTERN_RECOGNITION),
    HIGH_PRECISION(0.85, FusionStrategy.WEIGHTED, Duration.ofSeconds(60), 2048L << 20,
            DetectionMethod.ENSEMBLE, DetectionMethod.MULTIVARIATE);

    public static final long MEGABYTE = 1024L * 1024L;

    private final List<DetectionMethod> defaultMethods;

    private final double threshold;

    private final FusionStrategy fusionStrategy;

    private final Duration maxProcessingTime;

    private final long maxMemoryBytes;

    ConfigurationPreset(double threshold, FusionStrategy fusionStrategy, Duration maxProcessingTime,
            long maxMemoryBytes, DetectionMethod... defaultMethods) {
        this.defaultMethods = Collections.unmodifiableList(Arrays.asList(defaultMethods));
        this.threshold = threshold;
        this.fusionStrategy = fusionStrategy;
        this.maxProcessingTime = maxProcessingTime;
        this.maxMemoryBytes = maxMemoryBytes;
    }

    public List<DetectionMethod> getDefaultMethods() {
        return defaultMethods;
    }

    public double getThreshold() {
        return threshold;
    }

    public FusionStrategy getFusionStrategy() {
        return fusionStrategy;
    }

    public Duration getMaxProcessingTime() {
        return maxProcessingTime;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    /**
     * @param name a preset name such as {@code high-precision} or
     *             {@code HIGH_PRECISION}
     * @return the matching preset
     */
    public static ConfigurationPreset fromName(String name) {
        checkNotNull(name, "preset name must not be null");
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
