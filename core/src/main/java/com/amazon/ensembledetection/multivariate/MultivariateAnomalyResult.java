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

package com.amazon.ensembledetection.multivariate;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.config.MultivariateMethod;
import com.amazon.ensembledetection.returntypes.Severity;

/**
 * The verdict for one point scored by a {@link MultivariateDetector}.
 */
@Getter
@Builder
public class MultivariateAnomalyResult {

    // identifier of the scored point, if it had one
    private final String pointId;

    private final boolean anomaly;

    // mean of the enabled sub-scores, in [0,1]
    private final double anomalyScore;

    // distance of the score from the undecided value 0.5, scaled to [0,1]
    private final double confidence;

    private final Severity severity;

    // the individual sub-scores, in evaluation order
    private final Map<MultivariateMethod, Double> methodScores;

    // per-feature absolute z-scores against the training distribution
    private final Map<String, Double> contributingFeatures;

    private final List<String> explanations;

    private final double mahalanobisDistance;

    private final double reconstructionError;

    // squared Mahalanobis distance
    private final double hotellingsT2;

    // smallest RBF dissimilarity to the stored training rows
    private final double kernelDistance;
}
