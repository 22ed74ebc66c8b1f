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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.amazon.ensembledetection.util.Deadline;

/**
 * Centrality computations over an unweighted undirected {@link Graph}.
 */
public class GraphAnalyzer {

    public static final double PAGE_RANK_DAMPING = 0.85;

    public static final double PAGE_RANK_TOLERANCE = 1e-6;

    public static final int PAGE_RANK_ITERATIONS = 100;

    private GraphAnalyzer() {
    }

    public static GraphMetrics[] computeMetrics(Graph graph, Deadline deadline) {
        int n = graph.size();
        double[] betweenness = betweenness(graph, deadline);
        double[] closeness = closeness(graph, deadline);
        double[] pageRank = pageRank(graph, deadline);
        GraphMetrics[] metrics = new GraphMetrics[n];
        for (int v = 0; v < n; v++) {
            metrics[v] = new GraphMetrics(graph.degree(v), betweenness[v], closeness[v], clustering(graph, v),
                    pageRank[v]);
        }
        return metrics;
    }

    /**
     * Brandes accumulation of pair dependencies. For each unordered pair s, t the
     * node v receives sigma_st(v) / sigma_st, so ties between shortest paths are
     * shared equally. The totals are normalized by (n-1)(n-2)/2.
     */
    public static double[] betweenness(Graph graph, Deadline deadline) {
        int n = graph.size();
        double[] result = new double[n];
        if (n < 3) {
            return result;
        }
        int[] distance = new int[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        List<List<Integer>> predecessors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            predecessors.add(new ArrayList<>());
        }
        int[] order = new int[n];
        for (int s = 0; s < n; s++) {
            deadline.checkEvery(s);
            Arrays.fill(distance, -1);
            Arrays.fill(sigma, 0);
            Arrays.fill(delta, 0);
            for (List<Integer> list : predecessors) {
                list.clear();
            }
            distance[s] = 0;
            sigma[s] = 1;
            int visited = 0;
            ArrayDeque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                order[visited++] = v;
                for (int w : graph.neighbors(v)) {
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors.get(w).add(v);
                    }
                }
            }
            for (int i = visited - 1; i >= 0; i--) {
                int w = order[i];
                for (int v : predecessors.get(w)) {
                    delta[v] += sigma[v] / sigma[w] * (1 + delta[w]);
                }
                if (w != s) {
                    result[w] += delta[w];
                }
            }
        }
        // every unordered pair was counted from both endpoints
        double normalizer = (n - 1) * (n - 2) / 2.0;
        for (int v = 0; v < n; v++) {
            result[v] = result[v] / 2 / normalizer;
        }
        return result;
    }

    /**
     * (n-1) divided by the sum of hop distances to the reachable nodes; 0 for an
     * isolated node
     */
    public static double[] closeness(Graph graph, Deadline deadline) {
        int n = graph.size();
        double[] result = new double[n];
        int[] distance = new int[n];
        for (int s = 0; s < n; s++) {
            deadline.checkEvery(s);
            Arrays.fill(distance, -1);
            distance[s] = 0;
            ArrayDeque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            long total = 0;
            while (!queue.isEmpty()) {
                int v = queue.poll();
                total += distance[v];
                for (int w : graph.neighbors(v)) {
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                }
            }
            result[s] = (total == 0) ? 0 : (n - 1) / (double) total;
        }
        return result;
    }

    /**
     * edges among the neighbors over k(k-1)/2; 0 when the degree k is below 2
     */
    public static double clustering(Graph graph, int v) {
        int[] neighbors = graph.neighbors(v);
        int k = neighbors.length;
        if (k < 2) {
            return 0;
        }
        int links = 0;
        for (int i = 0; i < k; i++) {
            for (int j = i + 1; j < k; j++) {
                if (graph.isAdjacent(neighbors[i], neighbors[j])) {
                    ++links;
                }
            }
        }
        return links / (k * (k - 1) / 2.0);
    }

    /**
     * power iteration; rank held by isolated nodes is spread uniformly
     */
    public static double[] pageRank(Graph graph, Deadline deadline) {
        int n = graph.size();
        double[] rank = new double[n];
        if (n == 0) {
            return rank;
        }
        Arrays.fill(rank, 1.0 / n);
        for (int iteration = 0; iteration < PAGE_RANK_ITERATIONS; iteration++) {
            deadline.checkEvery(iteration);
            double dangling = 0;
            for (int v = 0; v < n; v++) {
                if (graph.degree(v) == 0) {
                    dangling += rank[v];
                }
            }
            double[] next = new double[n];
            for (int v = 0; v < n; v++) {
                double incoming = 0;
                for (int u : graph.neighbors(v)) {
                    incoming += rank[u] / graph.degree(u);
                }
                next[v] = (1 - PAGE_RANK_DAMPING) / n + PAGE_RANK_DAMPING * (incoming + dangling / n);
            }
            double change = 0;
            for (int v = 0; v < n; v++) {
                change += Math.abs(next[v] - rank[v]);
            }
            rank = next;
            if (change < PAGE_RANK_TOLERANCE) {
                break;
            }
        }
        return rank;
    }

    /**
     * @return the number of triangles each node belongs to
     */
    public static int[] triangleCounts(Graph graph) {
        int n = graph.size();
        int[] counts = new int[n];
        for (int i = 0; i < n; i++) {
            for (int j : graph.neighbors(i)) {
                if (j > i) {
                    for (int k : graph.neighbors(j)) {
                        if (k > j && graph.isAdjacent(i, k)) {
                            ++counts[i];
                            ++counts[j];
                            ++counts[k];
                        }
                    }
                }
            }
        }
        return counts;
    }
}
