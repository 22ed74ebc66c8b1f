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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * Base class of the detectors that score every point of a payload and reduce
 * the point verdicts to one payload verdict.
 */
public abstract class AbstractDetector implements IDetector {

    public static final String MEAN_SCORE = "meanScore";

    public static final String POINTS = "points";

    public static final String FLAGGED_POINTS = "flaggedPoints";

    private final DetectionMethod method;

    protected AbstractDetector(DetectionMethod method) {
        this.method = method;
    }

    @Override
    public DetectionMethod getMethod() {
        return method;
    }

    /**
     * Reduces point verdicts: the payload score is the largest point score, the
     * payload is anomalous if any point is, and the confidence is the mean point
     * confidence. An empty payload yields a non-anomalous result with score and
     * confidence 0.
     *
     * @param scores      point scores in [0,1]
     * @param flags       point verdicts
     * @param confidences point confidences
     * @param diagnostics method specific values, added to the result
     * @param explanations free text, added to the result
     * @return the payload verdict
     */
    protected DetectionMethodResult aggregate(double[] scores, boolean[] flags, double[] confidences,
            Map<String, Double> diagnostics, List<String> explanations) {
        double max = 0;
        List<Integer> flagged = new ArrayList<>();
        for (int i = 0; i < scores.length; i++) {
            max = Math.max(max, scores[i]);
            if (flags[i]) {
                flagged.add(i);
            }
        }
        Map<String, Double> allDiagnostics = new LinkedHashMap<>();
        allDiagnostics.put(POINTS, (double) scores.length);
        allDiagnostics.put(FLAGGED_POINTS, (double) flagged.size());
        allDiagnostics.put(MEAN_SCORE, StatMath.mean(scores));
        allDiagnostics.putAll(diagnostics);
        return DetectionMethodResult.builder().method(method).anomaly(!flagged.isEmpty()).score(max)
                .confidence(StatMath.mean(confidences)).diagnostics(Collections.unmodifiableMap(allDiagnostics))
                .flaggedIndices(Collections.unmodifiableList(flagged))
                .explanations(Collections.unmodifiableList(new ArrayList<>(explanations))).build();
    }

    /**
     * distance of a score from the undecided value 0.5, scaled to [0,1]
     */
    protected static double confidenceOf(double score) {
        return Math.abs(score - 0.5) * 2;
    }
}
