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

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ensembledetection.orchestration.DataType;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.GraphPayload;
import com.amazon.ensembledetection.orchestration.PayloadAdapter;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.pattern.PatternAnomalyResult;
import com.amazon.ensembledetection.pattern.PatternRecognitionEngine;

/**
 * The structural method, backed by a shared {@link PatternRecognitionEngine}.
 * Graph payloads are scored node by node; any other payload is scored as the
 * sequence of its numeric projection. The engine applies its own thresholds to
 * flag points.
 */
public class PatternRecognitionDetector extends AbstractDetector {

    private final PatternRecognitionEngine engine;

    public PatternRecognitionDetector(PatternRecognitionEngine engine) {
        super(DetectionMethod.PATTERN_RECOGNITION);
        this.engine = checkNotNull(engine, "engine must not be null");
    }

    public PatternRecognitionEngine getEngine() {
        return engine;
    }

    @Override
    public DetectionMethodResult detect(List<?> payload, DetectionContext context) {
        PayloadAdapter adapter = PayloadAdapter.of(payload);
        boolean graph = adapter.getDataType() == DataType.GRAPH;
        List<PatternAnomalyResult> results;
        if (graph) {
            GraphPayload structure = adapter.graph();
            results = engine.analyzeGraph(structure.getNodes(), structure.getEdges(), context.getDeadline());
        } else {
            results = engine.analyzeSequence(adapter.numericProjection(), context.getDeadline());
        }

        int n = results.size();
        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        double[] confidences = new double[n];
        int top = -1;
        for (int i = 0; i < n; i++) {
            PatternAnomalyResult result = results.get(i);
            scores[i] = result.combinedScore();
            flags[i] = result.isAnomaly();
            confidences[i] = result.getConfidence();
            if (top < 0 || scores[i] > scores[top]) {
                top = i;
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("motifs", (n == 0) ? 0.0 : (double) results.get(0).getMotifs().size());
        List<String> explanations = new ArrayList<>();
        if (top >= 0) {
            PatternAnomalyResult strongest = results.get(top);
            if (graph) {
                diagnostics.put("maxDegree", maxStructural(results, "degree"));
                explanations.add("Most anomalous node: " + strongest.getNodeId());
            } else {
                explanations.add("Most anomalous index: " + strongest.getIndex());
            }
            explanations.addAll(strongest.getExplanations());
        } else {
            explanations.add("Too few elements for pattern analysis");
        }
        return aggregate(scores, flags, confidences, diagnostics, explanations);
    }

    private static double maxStructural(List<PatternAnomalyResult> results, String feature) {
        double max = 0;
        for (PatternAnomalyResult result : results) {
            Double value = result.getStructuralFeatures().get(feature);
            if (value != null) {
                max = Math.max(max, value);
            }
        }
        return max;
    }
}
