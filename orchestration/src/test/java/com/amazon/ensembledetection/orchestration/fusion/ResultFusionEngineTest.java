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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.ensembledetection.returntypes.Severity;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.config.FusionStrategy;

public class ResultFusionEngineTest {

    private IModelPerformanceStore store;
    private ResultFusionEngine engine;

    @BeforeEach
    public void setUp() {
        store = new InMemoryModelPerformanceStore();
        engine = new ResultFusionEngine(store);
    }

    static DetectionMethodResult result(DetectionMethod method, boolean anomaly, double score, Double confidence,
            String... explanations) {
        return DetectionMethodResult.builder().method(method).anomaly(anomaly).score(score).confidence(confidence)
                .diagnostics(Collections.emptyMap()).flaggedIndices(Collections.emptyList())
                .explanations(Arrays.asList(explanations)).build();
    }

    @ParameterizedTest
    @EnumSource(FusionStrategy.class)
    public void testEmptyResultsAreNeutral(FusionStrategy strategy) {
        FusedAnomalyResult fused = engine.fuse(Collections.emptyList(), strategy);
        assertFalse(fused.isAnomaly());
        assertEquals(0.0, fused.getFusedScore(), 0);
        assertEquals(0.0, fused.getConfidenceScore(), 0);
        assertEquals(0.0, fused.getConsensusScore(), 0);
        assertEquals(Severity.LOW, fused.getSeverity());
        assertThat(fused.getExplanations(), hasItem("0 detection methods available"));
        assertEquals(Collections.singletonList(ResultFusionEngine.UNABLE_TO_PROCESS), fused.getRecommendations());
        assertTrue(fused.getContributingMethods().isEmpty());
        assertEquals(strategy, fused.getStrategy());
    }

    @ParameterizedTest
    @EnumSource(FusionStrategy.class)
    public void testFusionIsRepeatable(FusionStrategy strategy) {
        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.9, 0.85, "spike"));
        results.add(result(DetectionMethod.TIME_SERIES, false, 0.45, 0.4, "level"));
        results.add(result(DetectionMethod.PATTERN_RECOGNITION, true, 0.75, null));

        FusedAnomalyResult first = engine.fuse(results, strategy);
        FusedAnomalyResult second = engine.fuse(results, strategy);
        assertEquals(first.isAnomaly(), second.isAnomaly());
        assertEquals(first.getFusedScore(), second.getFusedScore(), 0);
        assertEquals(first.getConfidenceScore(), second.getConfidenceScore(), 0);
        assertEquals(first.getConsensusScore(), second.getConsensusScore(), 0);
        assertEquals(first.getSeverity(), second.getSeverity());
        assertEquals(first.getExplanations(), second.getExplanations());
        assertEquals(first.getRecommendations(), second.getRecommendations());
        assertEquals(first.getMethodScores(), second.getMethodScores());
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 5, 7, 10 })
    public void testVotingNeedsStrictMajority(int methods) {
        DetectionMethod[] all = DetectionMethod.values();
        for (int votes = 0; votes <= methods; votes++) {
            List<DetectionMethodResult> results = new ArrayList<>();
            for (int i = 0; i < methods; i++) {
                results.add(result(all[i % all.length], i < votes, (i < votes) ? 0.9 : 0.1, 0.8));
            }
            FusedAnomalyResult fused = engine.fuse(results, FusionStrategy.VOTING);
            assertEquals(2 * votes > methods, fused.isAnomaly(), votes + " of " + methods);
            assertEquals(votes / (double) methods, fused.getFusedScore(), 1e-12);
        }
    }

    @Test
    public void testVoting() {
        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.9, 0.8, "first", "second"));
        results.add(result(DetectionMethod.TIME_SERIES, true, 0.8, 0.6, "second", "third"));
        results.add(result(DetectionMethod.MULTIVARIATE, false, 0.2, null, "fourth"));

        FusedAnomalyResult fused = engine.fuse(results, FusionStrategy.VOTING);
        assertTrue(fused.isAnomaly());
        assertEquals(2.0 / 3, fused.getFusedScore(), 1e-12);
        assertEquals((0.8 + 0.6 + 0.5) / 3, fused.getConfidenceScore(), 1e-12);
        assertEquals(1 - Math.sqrt(2.0 / 9), fused.getConsensusScore(), 1e-12);
        assertEquals(Severity.HIGH, fused.getSeverity());
        assertEquals(Arrays.asList("Fusion strategy: voting", "2/3 methods detected anomaly",
                "Key findings: first, second, third"), fused.getExplanations());
        assertThat(fused.getContributingMethods(), contains("ensemble", "time_series", "multivariate"));
        assertEquals(Arrays.asList("Immediate investigation recommended", "Review data sources and context"),
                fused.getRecommendations());
    }

    @Test
    public void testWeightedFavorsConfidentResults() {
        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.9, 0.5));
        results.add(result(DetectionMethod.MULTIVARIATE, false, 0.3, 0.9));

        FusedAnomalyResult fused = engine.fuse(results, FusionStrategy.WEIGHTED);
        // weights 0.5 * 1.2 and 0.9
        assertEquals((0.6 * 0.9 + 0.9 * 0.3) / 1.5, fused.getFusedScore(), 1e-12);
        assertEquals((0.6 * 0.5 + 0.9 * 0.9) / 1.5, fused.getConfidenceScore(), 1e-12);
        assertFalse(fused.isAnomaly());
        assertEquals(Severity.MEDIUM, fused.getSeverity());
        assertEquals(0.5, fused.getConsensusScore(), 1e-12);
        assertEquals(Arrays.asList("Continue normal monitoring"), fused.getRecommendations());
    }

    @Test
    public void testWeightedWithoutConfidenceUsesPlainMean() {
        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.9, 0.0));
        results.add(result(DetectionMethod.TIME_SERIES, true, 0.5, 0.0));

        FusedAnomalyResult fused = engine.fuse(results, FusionStrategy.WEIGHTED);
        assertEquals(0.7, fused.getFusedScore(), 1e-12);
        assertTrue(fused.isAnomaly());
        assertEquals(1.0, fused.getConsensusScore(), 1e-12);
        assertThat(fused.getRecommendations(), hasItem("Monitor closely for pattern changes"));
    }

    @Test
    public void testStackingUsesRecordedAccuracy() {
        IModelPerformanceStore mockStore = mock(IModelPerformanceStore.class);
        when(mockStore.getAccuracy(DetectionMethod.ENSEMBLE)).thenReturn(Optional.of(1.0));
        when(mockStore.getAccuracy(DetectionMethod.TIME_SERIES)).thenReturn(Optional.empty());
        ResultFusionEngine stacking = new ResultFusionEngine(mockStore);

        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.9, 0.7));
        results.add(result(DetectionMethod.TIME_SERIES, false, 0.5, 0.7));

        FusedAnomalyResult fused = stacking.fuse(results, FusionStrategy.STACKING);
        assertEquals((0.9 + 0.8 * 0.5) / 1.8, fused.getFusedScore(), 1e-12);
        assertTrue(fused.isAnomaly());
        assertEquals(0.7, fused.getConfidenceScore(), 1e-12);
        assertEquals(Arrays.asList("Immediate investigation recommended", "Review data sources and context",
                "Monitor closely for pattern changes"), fused.getRecommendations());

        results.set(1, result(DetectionMethod.TIME_SERIES, false, 0.4, 0.7));
        assertFalse(stacking.fuse(results, FusionStrategy.STACKING).isAnomaly());
    }

    @Test
    public void testAdaptiveFusesConfidentSubset() {
        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.95, 0.9, "ensemble finding"));
        results.add(result(DetectionMethod.TIME_SERIES, false, 0.1, 0.3, "temporal finding"));

        FusedAnomalyResult fused = engine.fuse(results, FusionStrategy.ADAPTIVE);
        assertTrue(fused.isAnomaly());
        assertEquals(0.95, fused.getFusedScore(), 1e-12);
        assertEquals(1.0, fused.getConsensusScore(), 1e-12);
        assertEquals(Severity.CRITICAL, fused.getSeverity());
        assertEquals(Arrays.asList("Fusion strategy: adaptive (weighted)", "1/1 methods detected anomaly",
                "Key findings: ensemble finding"), fused.getExplanations());
        assertEquals(Collections.singletonList("ensemble"), fused.getContributingMethods());
        assertEquals(2, fused.getMethodScores().size());
        assertEquals(0.1, fused.getMethodScores().get("time_series"), 0);
        assertThat(fused.getRecommendations(), hasItem("High confidence detection - prioritize response"));
    }

    @Test
    public void testAdaptiveFallsBackToVoting() {
        List<DetectionMethodResult> results = new ArrayList<>();
        results.add(result(DetectionMethod.ENSEMBLE, true, 0.9, 0.6));
        results.add(result(DetectionMethod.TIME_SERIES, false, 0.45, 0.7));

        FusedAnomalyResult fused = engine.fuse(results, FusionStrategy.ADAPTIVE);
        assertFalse(fused.isAnomaly());
        assertEquals(0.5, fused.getFusedScore(), 1e-12);
        assertEquals("Fusion strategy: adaptive (voting)", fused.getExplanations().get(0));
        assertEquals(0.5, fused.getConsensusScore(), 1e-12);
        assertEquals(Arrays.asList("Continue normal monitoring", "Monitor closely for pattern changes"),
                fused.getRecommendations());
    }

    @Test
    public void testConsensus() {
        List<DetectionMethodResult> agreeing = new ArrayList<>();
        agreeing.add(result(DetectionMethod.ENSEMBLE, false, 0.1, 0.9));
        agreeing.add(result(DetectionMethod.TIME_SERIES, false, 0.2, 0.9));
        assertEquals(1.0, ResultFusionEngine.consensus(agreeing), 0);

        agreeing.add(result(DetectionMethod.MULTIVARIATE, true, 0.9, 0.9));
        agreeing.add(result(DetectionMethod.PATTERN_RECOGNITION, true, 0.9, 0.9));
        assertEquals(0.5, ResultFusionEngine.consensus(agreeing), 1e-12);
    }
}
