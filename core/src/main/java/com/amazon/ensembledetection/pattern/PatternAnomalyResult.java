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

package com.amazon.ensembledetection.pattern;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.returntypes.Severity;

/**
 * The verdict for one graph node or one sequence index.
 */
@Getter
@Builder
public class PatternAnomalyResult {

    private final PatternType patternType;

    // node identifier for graph results
    private final String nodeId;

    // position for sequence results, -1 for graph results
    private final int index;

    private final boolean anomaly;

    private final double anomalyScore;

    // neighborhood z-score of a sequence value; equals the anomaly score for graph
    // results
    private final double localScore;

    private final double confidence;

    private final Severity severity;

    // graph results only
    private final GraphMetrics graphMetrics;

    private final Map<String, Double> structuralFeatures;

    private final List<Motif> motifs;

    private final List<String> explanations;

    /**
     * @return the larger of the anomaly score and the local score
     */
    public double combinedScore() {
        return Math.max(anomalyScore, localScore);
    }
}
