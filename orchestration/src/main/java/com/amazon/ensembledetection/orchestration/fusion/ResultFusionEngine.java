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

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.config.FusionStrategy;
import com.amazon.ensembledetection.returntypes.Severity;

/**
 * Combines the results of several detection methods into one verdict.
 * <ul>
 * <li>voting: the score is the fraction of methods that flagged an anomaly and
 * the verdict is a strict majority</li>
 * <li>weighted: methods are weighted by confidence, with a bonus for the
 * ensemble baseline, and the verdict requires a weighted score above 0.6</li>
 * <li>stacking: methods are weighted by their historical accuracy and the
 * verdict requires a weighted score above 0.7</li>
 * <li>adaptive: weighted fusion of the high confidence methods if there are
 * any, voting over all methods otherwise</li>
 * </ul>
 * A method without a confidence counts as 0.5. Fusion is a pure function of its
 * inputs and the accuracy history.
 */
public class ResultFusionEngine {

    private static final Logger logger = LoggerFactory.getLogger(ResultFusionEngine.class);

    public static final double DEFAULT_CONFIDENCE = 0.5;

    public static final double VOTING_MAJORITY = 0.5;

    public static final double WEIGHTED_THRESHOLD = 0.6;

    public static final double STACKING_THRESHOLD = 0.7;

    public static final double HIGH_CONFIDENCE = 0.8;

    public static final double ENSEMBLE_WEIGHT_BONUS = 1.2;

    public static final double DEFAULT_ACCURACY = 0.8;

    public static final double BORDERLINE_LOW = 0.4;

    public static final double BORDERLINE_HIGH = 0.6;

    public static final int MAX_KEY_FINDINGS = 3;

    public static final String NO_RESULTS = "No detection results available";

    public static final String UNABLE_TO_PROCESS = "Unable to process - check data quality";

    private final IModelPerformanceStore performanceStore;

    public ResultFusionEngine(IModelPerformanceStore performanceStore) {
        this.performanceStore = checkNotNull(performanceStore, "performance store must not be null");
    }

    /**
     * @param results  the results of the methods that succeeded, possibly empty
     * @param strategy the fusion strategy
     * @return the fused verdict; a neutral result when there is nothing to fuse
     */
    public FusedAnomalyResult fuse(List<DetectionMethodResult> results, FusionStrategy strategy) {
        checkNotNull(results, "results must not be null");
        checkNotNull(strategy, "strategy must not be null");
        if (results.isEmpty()) {
            return emptyResult(strategy);
        }
        switch (strategy) {
        case VOTING:
            return voting(results, results, strategy, "voting");
        case WEIGHTED:
            return weighted(results, results, strategy, "weighted");
        case STACKING:
            return stacking(results, strategy);
        default:
            List<DetectionMethodResult> confident = new ArrayList<>();
            for (DetectionMethodResult result : results) {
                if (confidenceOf(result) > HIGH_CONFIDENCE) {
                    confident.add(result);
                }
            }
            if (!confident.isEmpty()) {
                logger.debug("adaptive fusion of {} high confidence results out of {}", confident.size(),
                        results.size());
                return weighted(results, confident, strategy, "adaptive (weighted)");
            }
            logger.debug("adaptive fusion falls back to voting over {} results", results.size());
            return voting(results, results, strategy, "adaptive (voting)");
        }
    }

    private FusedAnomalyResult voting(List<DetectionMethodResult> all, List<DetectionMethodResult> fused,
            FusionStrategy strategy, String label) {
        int votes = 0;
        double confidence = 0;
        for (DetectionMethodResult result : fused) {
            votes += result.isAnomaly() ? 1 : 0;
            confidence += confidenceOf(result);
        }
        double fraction = votes / (double) fused.size();
        return build(all, fused, strategy, label, fraction, fraction > VOTING_MAJORITY,
                confidence / fused.size());
    }

    private FusedAnomalyResult weighted(List<DetectionMethodResult> all, List<DetectionMethodResult> fused,
            FusionStrategy strategy, String label) {
        double[] weights = new double[fused.size()];
        for (int i = 0; i < weights.length; i++) {
            DetectionMethodResult result = fused.get(i);
            double bonus = (result.getMethod() == DetectionMethod.ENSEMBLE) ? ENSEMBLE_WEIGHT_BONUS : 1.0;
            weights[i] = confidenceOf(result) * bonus;
        }
        double[] combined = weightedMeans(fused, weights);
        return build(all, fused, strategy, label, combined[0], combined[0] > WEIGHTED_THRESHOLD, combined[1]);
    }

    private FusedAnomalyResult stacking(List<DetectionMethodResult> results, FusionStrategy strategy) {
        double[] weights = new double[results.size()];
        for (int i = 0; i < weights.length; i++) {
            weights[i] = performanceStore.getAccuracy(results.get(i).getMethod()).orElse(DEFAULT_ACCURACY);
        }
        double[] combined = weightedMeans(results, weights);
        return build(results, results, strategy, "stacking", combined[0], combined[0] > STACKING_THRESHOLD,
                combined[1]);
    }

    /**
     * @return the weighted mean score and the weighted mean confidence; plain
     *         means when every weight is 0
     */
    private static double[] weightedMeans(List<DetectionMethodResult> results, double[] weights) {
        double total = 0;
        for (double weight : weights) {
            total += weight;
        }
        double score = 0;
        double confidence = 0;
        for (int i = 0; i < weights.length; i++) {
            double weight = (total > 0) ? weights[i] / total : 1.0 / weights.length;
            score += weight * results.get(i).getScore();
            confidence += weight * confidenceOf(results.get(i));
        }
        return new double[] { score, confidence };
    }

    private FusedAnomalyResult build(List<DetectionMethodResult> all, List<DetectionMethodResult> fused,
            FusionStrategy strategy, String label, double score, boolean anomaly, double confidence) {
        int votes = 0;
        List<String> contributing = new ArrayList<>(fused.size());
        Set<String> findings = new LinkedHashSet<>();
        for (DetectionMethodResult result : fused) {
            votes += result.isAnomaly() ? 1 : 0;
            contributing.add(result.getMethod().getWireName());
            findings.addAll(result.getExplanations());
        }
        Map<String, Double> methodScores = new LinkedHashMap<>();
        for (DetectionMethodResult result : all) {
            methodScores.put(result.getMethod().getWireName(), result.getScore());
        }

        List<String> explanations = new ArrayList<>();
        explanations.add("Fusion strategy: " + label);
        explanations.add(votes + "/" + fused.size() + " methods detected anomaly");
        if (!findings.isEmpty()) {
            List<String> key = new ArrayList<>(findings);
            explanations.add(
                    "Key findings: " + String.join(", ", key.subList(0, Math.min(MAX_KEY_FINDINGS, key.size()))));
        }

        return FusedAnomalyResult.builder().anomaly(anomaly).confidenceScore(confidence)
                .consensusScore(consensus(fused)).fusedScore(score).severity(Severity.fromScore(score))
                .explanations(Collections.unmodifiableList(explanations))
                .contributingMethods(Collections.unmodifiableList(contributing))
                .methodScores(Collections.unmodifiableMap(methodScores))
                .recommendations(recommendations(all, anomaly)).strategy(strategy).build();
    }

    /**
     * one minus the standard deviation of the binary decisions
     */
    static double consensus(List<DetectionMethodResult> results) {
        double mean = 0;
        for (DetectionMethodResult result : results) {
            mean += result.isAnomaly() ? 1 : 0;
        }
        mean /= results.size();
        double variance = 0;
        for (DetectionMethodResult result : results) {
            double decision = result.isAnomaly() ? 1 : 0;
            variance += (decision - mean) * (decision - mean);
        }
        return 1 - Math.sqrt(variance / results.size());
    }

    static List<String> recommendations(List<DetectionMethodResult> results, boolean anomaly) {
        boolean confident = false;
        boolean borderline = false;
        for (DetectionMethodResult result : results) {
            confident |= confidenceOf(result) > HIGH_CONFIDENCE;
            borderline |= result.getScore() > BORDERLINE_LOW && result.getScore() < BORDERLINE_HIGH;
        }
        List<String> recommendations = new ArrayList<>();
        if (anomaly) {
            recommendations.add("Immediate investigation recommended");
            recommendations.add("Review data sources and context");
            if (confident) {
                recommendations.add("High confidence detection - prioritize response");
            }
        } else {
            recommendations.add("Continue normal monitoring");
        }
        if (borderline) {
            recommendations.add("Monitor closely for pattern changes");
        }
        return Collections.unmodifiableList(recommendations);
    }

    private static FusedAnomalyResult emptyResult(FusionStrategy strategy) {
        List<String> explanations = new ArrayList<>();
        explanations.add(NO_RESULTS);
        explanations.add("0 detection methods available");
        return FusedAnomalyResult.builder().anomaly(false).confidenceScore(0).consensusScore(0).fusedScore(0)
                .severity(Severity.LOW).explanations(Collections.unmodifiableList(explanations))
                .contributingMethods(Collections.emptyList()).methodScores(Collections.emptyMap())
                .recommendations(Collections.singletonList(UNABLE_TO_PROCESS)).strategy(strategy).build();
    }

    private static double confidenceOf(DetectionMethodResult result) {
        return result.getConfidence().orElse(DEFAULT_CONFIDENCE);
    }
}
