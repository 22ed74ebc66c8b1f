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

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.FusionStrategy;
import com.amazon.ensembledetection.returntypes.Severity;

/**
 * The final verdict of a request, derived only from the method results that
 * were fused.
 */
@Getter
@Builder
public class FusedAnomalyResult {

    private final boolean anomaly;

    private final double confidenceScore;

    // agreement of the fused methods, in [0,1]
    private final double consensusScore;

    // the strategy's final score, which determines the severity
    private final double fusedScore;

    private final Severity severity;

    private final List<String> explanations;

    // wire names of the fused methods
    private final List<String> contributingMethods;

    // score of every method result handed to fusion, in insertion order
    private final Map<String, Double> methodScores;

    private final List<String> recommendations;

    private final FusionStrategy strategy;
}
