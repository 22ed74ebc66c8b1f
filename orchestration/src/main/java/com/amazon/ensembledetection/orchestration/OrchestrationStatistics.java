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

import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.ConfigurationPreset;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.config.FusionStrategy;

@Getter
@Builder
public class OrchestrationStatistics {

    private final ConfigurationPreset preset;

    private final FusionStrategy fusionStrategy;

    private final boolean parallelExecutionEnabled;

    private final Set<DetectionMethod> registeredMethods;

    private final long requestsProcessed;

    private final long requestsFailed;

    private final long resourceLimitBreaches;

    // methods without recorded feedback are absent
    private final Map<DetectionMethod, Double> methodAccuracy;

    private final Map<DetectionMethod, Double> averageExecutionMillis;
}
