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

import com.amazon.ensembledetection.NotTrainedException;
import com.amazon.ensembledetection.multivariate.MultivariateAnomalyResult;
import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.multivariate.MultivariateDetector;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.PayloadAdapter;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * The heavyweight method, backed by a {@link MultivariateDetector}. A payload
 * with more than {@link #SELF_TRAINING_MIN_POINTS} points is scored by a fresh
 * model fitted to its leading {@link #TRAINING_FRACTION}; a shorter payload is
 * scored by the shared model fitted through {@link #train(List)}.
 */
public class MultivariateMethodDetector extends AbstractDetector {

    public static final int SELF_TRAINING_MIN_POINTS = 10;

    public static final double TRAINING_FRACTION = 0.7;

    public static final String CONTRIBUTION_PREFIX = "contribution.";

    private final MultivariateDetector sharedDetector;

    private final long randomSeed;

    /**
     * @param sharedDetector the model used for short payloads
     * @param randomSeed     seed of the models fitted per request
     */
    public MultivariateMethodDetector(MultivariateDetector sharedDetector, long randomSeed) {
        super(DetectionMethod.MULTIVARIATE);
        this.sharedDetector = checkNotNull(sharedDetector, "detector must not be null");
        this.randomSeed = randomSeed;
    }

    /**
     * fits the shared model; on failure the previous shared model stays in effect
     */
    @Override
    public void train(List<?> payload) {
        sharedDetector.train(PayloadAdapter.of(payload).multivariate());
    }

    public boolean isTrained() {
        return sharedDetector.isTrained();
    }

    @Override
    public DetectionMethodResult detect(List<?> payload, DetectionContext context) {
        List<MultivariateDataPoint> points = PayloadAdapter.of(payload).multivariate();
        List<MultivariateAnomalyResult> results;
        List<String> explanations = new ArrayList<>();
        if (points.size() > SELF_TRAINING_MIN_POINTS) {
            MultivariateDetector detector = MultivariateDetector.builder().threshold(context.getThreshold())
                    .randomSeed(randomSeed).build();
            int training = (int) Math.floor(points.size() * TRAINING_FRACTION);
            detector.train(new ArrayList<>(points.subList(0, training)), context.getDeadline());
            results = detector.detect(points, context.getDeadline());
            explanations.add("Model fitted to the first " + training + " of " + points.size() + " points");
        } else {
            if (!sharedDetector.isTrained()) {
                throw new NotTrainedException("payload of " + points.size()
                        + " points is too short to fit a model and no shared model has been trained");
            }
            results = sharedDetector.detect(points, context.getDeadline());
        }

        int n = results.size();
        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        double[] confidences = new double[n];
        double maxDistance = 0;
        double maxReconstruction = 0;
        double maxT2 = 0;
        int top = -1;
        for (int i = 0; i < n; i++) {
            MultivariateAnomalyResult result = results.get(i);
            scores[i] = result.getAnomalyScore();
            flags[i] = scores[i] > context.getThreshold();
            confidences[i] = result.getConfidence();
            maxDistance = Math.max(maxDistance, result.getMahalanobisDistance());
            maxReconstruction = Math.max(maxReconstruction, result.getReconstructionError());
            maxT2 = Math.max(maxT2, result.getHotellingsT2());
            if (top < 0 || scores[i] > scores[top]) {
                top = i;
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("maxMahalanobisDistance", maxDistance);
        diagnostics.put("maxReconstructionError", maxReconstruction);
        diagnostics.put("maxHotellingsT2", maxT2);
        if (top >= 0) {
            for (Map.Entry<String, Double> entry : results.get(top).getContributingFeatures().entrySet()) {
                diagnostics.put(CONTRIBUTION_PREFIX + entry.getKey(), entry.getValue());
            }
            explanations.addAll(results.get(top).getExplanations());
        }
        return aggregate(scores, flags, confidences, diagnostics, explanations);
    }
}
