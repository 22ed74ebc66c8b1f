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

import static com.amazon.ensembledetection.pattern.GraphTest.graphOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.testutils.ExampleDataSets;
import com.amazon.ensembledetection.util.Deadline;

public class GraphAnalyzerTest {

    @Test
    public void testPath() {
        Graph path = graphOf(new String[][] { { "a", "b" }, { "b", "c" } });
        double[] betweenness = GraphAnalyzer.betweenness(path, Deadline.none());
        assertArrayEquals(new double[] { 0, 1, 0 }, betweenness, 1e-12);

        double[] closeness = GraphAnalyzer.closeness(path, Deadline.none());
        assertEquals(2.0 / 3, closeness[path.indexOf("a")], 1e-12);
        assertEquals(1.0, closeness[path.indexOf("b")], 1e-12);
        assertEquals(0.0, GraphAnalyzer.clustering(path, path.indexOf("b")), 0);
    }

    @Test
    public void testCycleSharesShortestPaths() {
        Graph cycle = graphOf(ExampleDataSets.ringGraph(4));
        double[] betweenness = GraphAnalyzer.betweenness(cycle, Deadline.none());
        for (double value : betweenness) {
            assertEquals(1.0 / 6, value, 1e-12);
        }
    }

    @Test
    public void testStarCenter() {
        Graph star = graphOf(ExampleDataSets.starGraph(10));
        int center = star.indexOf("center");
        double[] betweenness = GraphAnalyzer.betweenness(star, Deadline.none());
        assertEquals(1.0, betweenness[center], 1e-12);
        double[] closeness = GraphAnalyzer.closeness(star, Deadline.none());
        assertEquals(1.0, closeness[center], 1e-12);
        int[] triangles = GraphAnalyzer.triangleCounts(star);
        for (int count : triangles) {
            assertEquals(0, count);
        }
    }

    @Test
    public void testTriangle() {
        Graph triangle = graphOf(new String[][] { { "a", "b" }, { "b", "c" }, { "c", "a" } });
        for (int v = 0; v < 3; v++) {
            assertEquals(1.0, GraphAnalyzer.clustering(triangle, v), 1e-12);
        }
        assertArrayEquals(new int[] { 1, 1, 1 }, GraphAnalyzer.triangleCounts(triangle));
        assertArrayEquals(new double[3], GraphAnalyzer.betweenness(triangle, Deadline.none()), 1e-12);
    }

    @Test
    public void testTooSmallForBetweenness() {
        Graph pair = graphOf(new String[][] { { "a", "b" } });
        assertArrayEquals(new double[2], GraphAnalyzer.betweenness(pair, Deadline.none()), 0);
    }

    @ParameterizedTest
    @ValueSource(ints = { 3, 7, 12 })
    public void testPageRankIsADistribution(int size) {
        Graph[] graphs = new Graph[] { graphOf(ExampleDataSets.starGraph(size)),
                graphOf(ExampleDataSets.ringGraph(size)), graphOf(ExampleDataSets.completeGraph(size)) };
        for (Graph graph : graphs) {
            double total = 0;
            for (double rank : GraphAnalyzer.pageRank(graph, Deadline.none())) {
                assertTrue(rank > 0);
                total += rank;
            }
            assertEquals(1.0, total, 1e-6);
        }
    }

    @Test
    public void testPageRankWithIsolatedNode() {
        Graph graph = Graph.build(Collections.singletonList(new GraphNode("alone")),
                GraphTest.edges(new String[][] { { "a", "b" } }));
        double total = 0;
        for (double rank : GraphAnalyzer.pageRank(graph, Deadline.none())) {
            total += rank;
        }
        assertEquals(1.0, total, 1e-6);
        assertEquals(0.0, GraphAnalyzer.closeness(graph, Deadline.none())[graph.indexOf("alone")], 0);
    }

    @Test
    public void testComputeMetrics() {
        Graph star = graphOf(ExampleDataSets.starGraph(4));
        GraphMetrics[] metrics = GraphAnalyzer.computeMetrics(star, Deadline.none());
        assertEquals(5, metrics.length);
        GraphMetrics center = metrics[star.indexOf("center")];
        assertEquals(4, center.getDegree());
        assertEquals(1.0, center.getBetweenness(), 1e-12);
        assertEquals(0.0, center.getClusteringCoefficient(), 0);
        assertTrue(center.getPageRank() > metrics[star.indexOf("leaf0")].getPageRank());
    }

    @Test
    public void testDeadline() {
        Graph ring = graphOf(ExampleDataSets.ringGraph(50));
        assertThrows(ResourceLimitExceededException.class,
                () -> GraphAnalyzer.betweenness(ring, Deadline.after(Duration.ZERO)));
    }
}
