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

import static com.amazon.ensembledetection.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ensembledetection.util.Deadline;

/**
 * Discovers recurring patterns: symbolic substrings of a discretized sequence,
 * and triangles and stars of a graph.
 */
public class MotifDiscovery {

    // graph motifs keep at most this many explicit instances
    public static final int MAX_INSTANCES = 1000;

    public static final int MIN_STAR_DEGREE = 3;

    private final int alphabetSize;

    private final int minLength;

    private final int maxLength;

    private final int minSupport;

    private final int maxMotifs;

    public MotifDiscovery(int alphabetSize, int minLength, int maxLength, int minSupport, int maxMotifs) {
        checkArgument(alphabetSize >= 2 && alphabetSize <= 26, "alphabet size must be in [2,26]");
        checkArgument(minLength > 0 && minLength <= maxLength, "invalid motif length range");
        checkArgument(minSupport >= 2, "a motif must occur at least twice");
        checkArgument(maxMotifs > 0, "maximum number of motifs must be positive");
        this.alphabetSize = alphabetSize;
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.minSupport = minSupport;
        this.maxMotifs = maxMotifs;
    }

    /**
     * equal width binning of the values over [min, max]; a constant input maps
     * to the first symbol
     */
    public String discretize(double[] values) {
        if (values.length == 0) {
            return "";
        }
        double min = values[0];
        double max = values[0];
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        double range = max - min;
        StringBuilder symbols = new StringBuilder(values.length);
        for (double value : values) {
            int bin = (range == 0) ? 0 : (int) Math.floor((value - min) / range * alphabetSize);
            symbols.append((char) ('A' + Math.min(bin, alphabetSize - 1)));
        }
        return symbols.toString();
    }

    /**
     * Counts every symbolic substring of each length in the configured range and
     * keeps those with enough support. Significance is the z-score of the count
     * against a uniform random symbol model, floored at 0.
     *
     * @return motifs in decreasing order of significance
     */
    public List<Motif> sequenceMotifs(double[] values, Deadline deadline) {
        String symbols = discretize(values);
        int n = symbols.length();
        List<Motif> motifs = new ArrayList<>();
        for (int length = minLength; length <= Math.min(maxLength, n); length++) {
            deadline.check();
            Map<String, List<Integer>> occurrences = new LinkedHashMap<>();
            for (int start = 0; start + length <= n; start++) {
                occurrences.computeIfAbsent(symbols.substring(start, start + length), k -> new ArrayList<>())
                        .add(start);
            }
            double probability = Math.pow(alphabetSize, -length);
            double expected = (n - length + 1) * probability;
            double deviation = Math.sqrt(expected * (1 - probability));
            for (Map.Entry<String, List<Integer>> entry : occurrences.entrySet()) {
                int frequency = entry.getValue().size();
                if (frequency >= minSupport) {
                    double significance = (deviation > 0) ? Math.max(0, (frequency - expected) / deviation) : 0;
                    motifs.add(new Motif(MotifType.SEQUENCE, entry.getKey(), frequency, significance,
                            Collections.unmodifiableList(entry.getValue()), Collections.emptyList()));
                }
            }
        }
        motifs.sort(Comparator.comparingDouble(Motif::getSignificance).reversed());
        return Collections.unmodifiableList(
                (motifs.size() > maxMotifs) ? new ArrayList<>(motifs.subList(0, maxMotifs)) : motifs);
    }

    /**
     * @return the triangle motif and the star motif of the graph, each present
     *         only if it has at least one instance
     */
    public List<Motif> graphMotifs(Graph graph, Deadline deadline) {
        int n = graph.size();
        List<Motif> motifs = new ArrayList<>();

        List<List<String>> triangles = new ArrayList<>();
        int triangleCount = 0;
        for (int i = 0; i < n; i++) {
            deadline.checkEvery(i);
            for (int j : graph.neighbors(i)) {
                if (j > i) {
                    for (int k : graph.neighbors(j)) {
                        if (k > j && graph.isAdjacent(i, k)) {
                            ++triangleCount;
                            if (triangles.size() < MAX_INSTANCES) {
                                List<String> instance = new ArrayList<>(3);
                                instance.add(graph.nodeId(i));
                                instance.add(graph.nodeId(j));
                                instance.add(graph.nodeId(k));
                                triangles.add(Collections.unmodifiableList(instance));
                            }
                        }
                    }
                }
            }
        }
        if (triangleCount > 0) {
            double possible = n * (n - 1.0) * (n - 2.0) / 6.0;
            motifs.add(new Motif(MotifType.TRIANGLE, MotifType.TRIANGLE.name(), triangleCount,
                    triangleCount / possible, Collections.emptyList(), Collections.unmodifiableList(triangles)));
        }

        List<List<String>> stars = new ArrayList<>();
        int starCount = 0;
        for (int i = 0; i < n; i++) {
            if (graph.degree(i) >= MIN_STAR_DEGREE) {
                ++starCount;
                if (stars.size() < MAX_INSTANCES) {
                    List<String> instance = new ArrayList<>();
                    instance.add(graph.nodeId(i));
                    for (int neighbor : graph.neighbors(i)) {
                        instance.add(graph.nodeId(neighbor));
                    }
                    stars.add(Collections.unmodifiableList(instance));
                }
            }
        }
        if (starCount > 0) {
            motifs.add(new Motif(MotifType.STAR, MotifType.STAR.name(), starCount, starCount / (double) n,
                    Collections.emptyList(), Collections.unmodifiableList(stars)));
        }
        return Collections.unmodifiableList(motifs);
    }
}
