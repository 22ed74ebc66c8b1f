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

import static com.amazon.ensembledetection.pattern.GraphTest.edges;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.returntypes.Severity;
import com.amazon.ensembledetection.testutils.ExampleDataSets;
import com.amazon.ensembledetection.util.Deadline;

public class PatternRecognitionEngineTest {

    private PatternRecognitionEngine engine;

    @BeforeEach
    public void setUp() {
        engine = PatternRecognitionEngine.builder().windowSize(10).build();
    }

    @Test
    public void testSpikeMarksOnlyItsWindow() {
        double[] values = ExampleDataSets.spikeSeries(20, 19, 1, 100);
        List<Subsequence> windows = engine.subsequences(values);
        assertEquals(SubsequenceType.ANOMALOUS, windows.get(windows.size() - 1).getType());
        for (Subsequence window : windows) {
            if (!window.contains(19)) {
                assertEquals(SubsequenceType.NORMAL, window.getType());
            }
        }

        List<PatternAnomalyResult> results = engine.analyzeSequence(values);
        assertEquals(20, results.size());
        for (int i = 0; i < 20; i++) {
            PatternAnomalyResult result = results.get(i);
            assertEquals(PatternType.SEQUENCE, result.getPatternType());
            assertEquals(i, result.getIndex());
            assertEquals(i >= 10, result.isAnomaly());
        }
        PatternAnomalyResult spike = results.get(19);
        assertEquals(1.0, spike.getAnomalyScore(), 1e-12);
        assertEquals(Severity.CRITICAL, spike.getSeverity());
        assertThat(spike.getExplanations(), hasItem("Part of anomalous subsequence [10, 20) with score 1.000"));
        assertThat(spike.getExplanations(), not(hasItem(startsWith("Local deviation score"))));
        assertEquals(Severity.LOW, results.get(0).getSeverity());
        assertEquals(0.0, results.get(0).combinedScore(), 0);
    }

    @Test
    public void testStarCenterIsMostAnomalous() {
        List<PatternAnomalyResult> results = engine.analyzeGraph(Collections.emptyList(),
                edges(ExampleDataSets.starGraph(10)));
        assertEquals(11, results.size());
        PatternAnomalyResult center = results.get(0);
        assertEquals("center", center.getNodeId());
        assertEquals(-1, center.getIndex());
        assertTrue(center.isAnomaly());
        assertEquals(1.0, center.getAnomalyScore(), 1e-12);
        assertEquals(10, center.getGraphMetrics().getDegree());
        assertEquals(1.0, center.getStructuralFeatures().get("localDensity"), 1e-12);
        assertThat(center.getExplanations(), hasItem("Node anomaly score: 1.000"));
        assertThat(center.getExplanations(), hasItem("Low clustering coefficient: 0.000"));
        assertThat(center.getExplanations(), hasItem("Involved in 1 structural motifs"));

        for (PatternAnomalyResult leaf : results.subList(1, results.size())) {
            assertFalse(leaf.isAnomaly());
            assertTrue(leaf.getAnomalyScore() < center.getAnomalyScore());
            assertThat(leaf.getExplanations(), hasItem("Low connectivity: 1 connections"));
        }

        boolean starWithCenter = false;
        for (Motif motif : center.getMotifs()) {
            if (motif.getType() == MotifType.STAR) {
                for (List<String> instance : motif.getInstances()) {
                    starWithCenter |= instance.contains("center");
                }
            }
        }
        assertTrue(starWithCenter);
    }

    @Test
    public void testRegularGraphIsNormal() {
        List<PatternAnomalyResult> results = engine.analyzeGraph(Collections.emptyList(),
                edges(ExampleDataSets.completeGraph(5)));
        for (PatternAnomalyResult result : results) {
            assertFalse(result.isAnomaly());
            assertEquals(0.0, result.getAnomalyScore(), 0);
            assertEquals(6.0, result.getStructuralFeatures().get("triangleCount"), 0);
        }
    }

    @Test
    public void testDegenerateInputs() {
        assertTrue(engine.analyzeGraph(Collections.singletonList(new GraphNode("only")), Collections.emptyList())
                .isEmpty());
        assertTrue(engine.analyzeGraph(Collections.emptyList(), Collections.emptyList()).isEmpty());
        assertTrue(engine.analyzeSequence(new double[] { 3 }).isEmpty());
        assertTrue(engine.analyzeSequence(new double[0]).isEmpty());
        assertThrows(NullPointerException.class, () -> engine.analyzeSequence(null));
    }

    @Test
    public void testIsolatedNodes() {
        List<GraphNode> nodes = new ArrayList<>();
        nodes.add(new GraphNode("a"));
        nodes.add(new GraphNode("b"));
        List<PatternAnomalyResult> results = engine.analyzeGraph(nodes, Collections.emptyList());
        assertEquals(2, results.size());
        for (PatternAnomalyResult result : results) {
            assertFalse(result.isAnomaly());
            assertEquals(0.0, result.getGraphMetrics().getCloseness(), 0);
        }
    }

    @Test
    public void testPeriodicSequenceIsNormal() {
        double[] values = ExampleDataSets.seasonalSeries(200, 10, 5, 0.0, 1L);
        for (PatternAnomalyResult result : engine.analyzeSequence(values)) {
            assertFalse(result.isAnomaly());
        }
    }

    @Test
    public void testHistoryIsTrimmed() {
        PatternRecognitionEngine small = PatternRecognitionEngine.builder().historyCapacity(10, 5).build();
        small.analyzeSequence(new double[] { 0, 1, 2, 3, 4, 5 });
        assertEquals(6, small.getHistory().length);
        small.analyzeSequence(new double[] { 6, 7, 8, 9, 10, 11 });
        assertArrayEquals(new double[] { 7, 8, 9, 10, 11 }, small.getHistory(), 0);
        assertEquals(5, small.getPatternStatistics().getHistorySize());
        assertThrows(IllegalArgumentException.class,
                () -> PatternRecognitionEngine.builder().historyCapacity(5, 10).build());
    }

    @Test
    public void testRecentGraphsAreCapped() {
        PatternRecognitionEngine small = PatternRecognitionEngine.builder().recentGraphCapacity(2).build();
        for (int size = 3; size < 6; size++) {
            small.analyzeGraph(Collections.emptyList(), edges(ExampleDataSets.ringGraph(size)));
        }
        List<Graph> recent = small.getRecentGraphs();
        assertEquals(2, recent.size());
        assertEquals(4, recent.get(0).size());
        assertEquals(5, recent.get(1).size());

        PatternStatistics statistics = small.getPatternStatistics();
        assertEquals(3, statistics.getGraphsAnalyzed());
        assertEquals(0, statistics.getSequencesAnalyzed());
        assertEquals(2, statistics.getRecentGraphs());
        assertEquals(PatternRecognitionEngine.DEFAULT_WINDOW_SIZE, statistics.getWindowSize());
    }

    @Test
    public void testNormalExplanation() {
        List<PatternAnomalyResult> results = engine.analyzeGraph(Collections.emptyList(),
                edges(ExampleDataSets.ringGraph(5)));
        assertThat(results.get(0).getExplanations(), contains("Low clustering coefficient: 0.000"));
        List<PatternAnomalyResult> triangle = engine.analyzeGraph(Collections.emptyList(),
                edges(ExampleDataSets.completeGraph(3)));
        assertThat(triangle.get(0).getExplanations(), contains("Involved in 1 structural motifs"));
    }

    @Test
    public void testDeadline() {
        double[] values = ExampleDataSets.seasonalSeries(500, 12, 3, 0.5, 4L);
        assertThrows(ResourceLimitExceededException.class,
                () -> engine.analyzeSequence(values, Deadline.after(Duration.ZERO)));
    }

    @Test
    public void testConcurrentAnalysis() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                final int seed = t;
                futures.add(executor.submit(() -> {
                    double[] values = ExampleDataSets.seasonalSeries(100, 10, 2, 0.3, seed);
                    engine.analyzeGraph(Collections.emptyList(), edges(ExampleDataSets.starGraph(5 + seed)));
                    return engine.analyzeSequence(values).size();
                }));
            }
            for (Future<Integer> future : futures) {
                assertEquals(100, future.get(60, TimeUnit.SECONDS).intValue());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(800, engine.getHistory().length);
        assertEquals(8, engine.getPatternStatistics().getSequencesAnalyzed());
        assertEquals(8, engine.getRecentGraphs().size());
    }
}
