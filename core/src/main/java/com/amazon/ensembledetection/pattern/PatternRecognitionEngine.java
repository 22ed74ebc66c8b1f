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
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;
import static com.amazon.ensembledetection.CommonUtils.clipToUnit;
import static java.lang.Math.abs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.returntypes.Severity;
import com.amazon.ensembledetection.util.Deadline;

/**
 * Structural anomaly detection over graphs and sequences. Graph nodes are
 * scored by how far their degree and clustering coefficient sit from the rest
 * of the graph; sequence indices are scored by the anomalous sliding windows
 * containing them and by a local neighborhood z-score. Motifs are reported as
 * diagnostics on every result.
 *
 * Apart from two bounded bookkeeping caches (recently analyzed graphs and a
 * history of sequence values) each call is independent; the caches are guarded
 * by a lock so concurrent calls may append to them.
 */
public class PatternRecognitionEngine {

    private static final Logger logger = LoggerFactory.getLogger(PatternRecognitionEngine.class);

    public static final double DEFAULT_GRAPH_THRESHOLD = 0.7;

    public static final double DEFAULT_SUBSEQUENCE_THRESHOLD = 0.7;

    public static final double DEFAULT_PERIODICITY_THRESHOLD = 0.8;

    public static final int DEFAULT_WINDOW_SIZE = 20;

    public static final int DEFAULT_ALPHABET_SIZE = 5;

    public static final int DEFAULT_MIN_MOTIF_LENGTH = 3;

    public static final int DEFAULT_MAX_MOTIF_LENGTH = 10;

    public static final int DEFAULT_MIN_MOTIF_SUPPORT = 2;

    public static final int DEFAULT_MAX_MOTIFS = 50;

    public static final int DEFAULT_HISTORY_CAPACITY = 10000;

    public static final int DEFAULT_HISTORY_RETAINED = 5000;

    public static final int DEFAULT_RECENT_GRAPHS = 10;

    // node degree above which connectivity is called out as high
    public static final int HIGH_DEGREE = 10;

    public static final int LOW_DEGREE = 2;

    public static final double LOW_CLUSTERING = 0.1;

    private final double graphThreshold;

    private final double subsequenceThreshold;

    private final SubsequenceAnalyzer subsequenceAnalyzer;

    private final MotifDiscovery motifDiscovery;

    private final int historyCapacity;

    private final int historyRetained;

    private final int recentGraphCapacity;

    private final ReentrantLock cacheLock = new ReentrantLock();

    private final ArrayDeque<Double> history = new ArrayDeque<>();

    private final ArrayDeque<Graph> recentGraphs = new ArrayDeque<>();

    private final AtomicLong graphsAnalyzed = new AtomicLong();

    private final AtomicLong sequencesAnalyzed = new AtomicLong();

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected PatternRecognitionEngine(Builder<?> builder) {
        checkArgument(builder.graphThreshold > 0 && builder.graphThreshold < 1, "graph threshold must be in (0,1)");
        checkArgument(builder.historyRetained > 0 && builder.historyRetained <= builder.historyCapacity,
                "retained history must be positive and at most the capacity");
        checkArgument(builder.recentGraphCapacity > 0, "recent graph capacity must be positive");
        graphThreshold = builder.graphThreshold;
        subsequenceThreshold = builder.subsequenceThreshold;
        subsequenceAnalyzer = new SubsequenceAnalyzer(builder.windowSize, builder.subsequenceThreshold,
                builder.periodicityThreshold);
        motifDiscovery = new MotifDiscovery(builder.alphabetSize, builder.minMotifLength, builder.maxMotifLength,
                builder.minMotifSupport, builder.maxMotifs);
        historyCapacity = builder.historyCapacity;
        historyRetained = builder.historyRetained;
        recentGraphCapacity = builder.recentGraphCapacity;
    }

    public List<PatternAnomalyResult> analyzeGraph(List<GraphNode> nodes, List<GraphEdge> edges) {
        return analyzeGraph(nodes, edges, Deadline.none());
    }

    /**
     * Scores every node of the graph.
     *
     * @param nodes    the nodes
     * @param edges    the edges, treated as undirected
     * @param deadline cooperative cancellation token
     * @return one result per node in node order, empty for fewer than two nodes
     */
    public List<PatternAnomalyResult> analyzeGraph(List<GraphNode> nodes, List<GraphEdge> edges,
            Deadline deadline) {
        Graph graph = Graph.build(nodes, edges);
        graphsAnalyzed.incrementAndGet();
        remember(graph);
        int n = graph.size();
        if (n < 2) {
            return Collections.emptyList();
        }

        GraphMetrics[] metrics = GraphAnalyzer.computeMetrics(graph, deadline);
        List<Motif> motifs = motifDiscovery.graphMotifs(graph, deadline);
        int[] triangles = GraphAnalyzer.triangleCounts(graph);

        double[] degrees = new double[n];
        double[] clustering = new double[n];
        for (int v = 0; v < n; v++) {
            degrees[v] = metrics[v].getDegree();
            clustering[v] = metrics[v].getClusteringCoefficient();
        }
        double degreeMean = StatMath.mean(degrees);
        double degreeDeviation = StatMath.standardDeviation(degrees);
        double clusteringMean = StatMath.mean(clustering);
        double clusteringDeviation = StatMath.standardDeviation(clustering);

        List<PatternAnomalyResult> results = new ArrayList<>(n);
        for (int v = 0; v < n; v++) {
            double degreeZ = zScore(degrees[v], degreeMean, degreeDeviation);
            double clusteringZ = zScore(clustering[v], clusteringMean, clusteringDeviation);
            double score = clipToUnit((degreeZ + clusteringZ) / 2);
            boolean anomaly = score > graphThreshold;

            Map<String, Double> structural = new LinkedHashMap<>();
            structural.put("degree", degrees[v]);
            structural.put("weight", graph.weight(v));
            structural.put("localDensity", degrees[v] / (n - 1));
            structural.put("triangleCount", (double) triangles[v]);

            String id = graph.nodeId(v);
            int involvement = 0;
            for (Motif motif : motifs) {
                for (List<String> instance : motif.getInstances()) {
                    if (instance.contains(id)) {
                        ++involvement;
                    }
                }
            }
            List<String> explanations = new ArrayList<>();
            if (anomaly) {
                explanations.add(String.format("Node anomaly score: %.3f", score));
            }
            if (metrics[v].getDegree() > HIGH_DEGREE) {
                explanations.add("High degree connectivity: " + metrics[v].getDegree() + " connections");
            } else if (metrics[v].getDegree() < LOW_DEGREE) {
                explanations.add("Low connectivity: " + metrics[v].getDegree() + " connections");
            }
            if (metrics[v].getDegree() >= LOW_DEGREE && clustering[v] < LOW_CLUSTERING) {
                explanations.add(String.format("Low clustering coefficient: %.3f", clustering[v]));
            }
            if (involvement > 0) {
                explanations.add("Involved in " + involvement + " structural motifs");
            }
            if (explanations.isEmpty()) {
                explanations.add("Normal graph structure");
            }

            results.add(PatternAnomalyResult.builder().patternType(PatternType.GRAPH).nodeId(id).index(-1)
                    .anomaly(anomaly).anomalyScore(score).localScore(score).confidence(abs(score - 0.5) * 2)
                    .severity(Severity.fromScore(score)).graphMetrics(metrics[v])
                    .structuralFeatures(Collections.unmodifiableMap(structural)).motifs(motifs)
                    .explanations(Collections.unmodifiableList(explanations)).build());
        }
        logger.debug("analyzed graph with {} nodes and {} edges", n, graph.getEdgeCount());
        return Collections.unmodifiableList(results);
    }

    public List<PatternAnomalyResult> analyzeSequence(double[] values) {
        return analyzeSequence(values, Deadline.none());
    }

    /**
     * Scores every index of the sequence. An index scores the maximum score of
     * the anomalous windows containing it, 0 if there are none, and is flagged if
     * such a window exists or its local score exceeds the threshold.
     *
     * @param values   the sequence
     * @param deadline cooperative cancellation token
     * @return one result per index, empty for fewer than two values
     */
    public List<PatternAnomalyResult> analyzeSequence(double[] values, Deadline deadline) {
        checkNotNull(values, "values must not be null");
        sequencesAnalyzed.incrementAndGet();
        remember(values);
        int n = values.length;
        if (n < 2) {
            return Collections.emptyList();
        }

        List<Motif> motifs = motifDiscovery.sequenceMotifs(values, deadline);
        List<Subsequence> windows = subsequenceAnalyzer.analyze(values, deadline);
        double[] localScores = SubsequenceAnalyzer.localScores(values);

        double[] windowScores = new double[n];
        int[] windowStart = new int[n];
        int[] windowEnd = new int[n];
        for (Subsequence window : windows) {
            if (window.getType() == SubsequenceType.ANOMALOUS) {
                for (int i = window.getStart(); i < window.getEnd(); i++) {
                    if (window.getScore() > windowScores[i]) {
                        windowScores[i] = window.getScore();
                        windowStart[i] = window.getStart();
                        windowEnd[i] = window.getEnd();
                    }
                }
            }
        }
        int[] motifCoverage = new int[n];
        for (Motif motif : motifs) {
            for (int position : motif.getPositions()) {
                for (int i = position; i < Math.min(n, position + motif.length()); i++) {
                    ++motifCoverage[i];
                }
            }
        }

        List<PatternAnomalyResult> results = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            deadline.checkEvery(i);
            boolean inAnomalousWindow = windowScores[i] > 0;
            boolean anomaly = inAnomalousWindow || localScores[i] > subsequenceThreshold;
            double combined = Math.max(windowScores[i], localScores[i]);
            List<String> explanations = new ArrayList<>();
            if (inAnomalousWindow) {
                explanations.add(String.format("Part of anomalous subsequence [%d, %d) with score %.3f",
                        windowStart[i], windowEnd[i], windowScores[i]));
            }
            if (localScores[i] > subsequenceThreshold) {
                explanations.add(String.format("Local deviation score: %.3f", localScores[i]));
            }
            if (motifCoverage[i] > 0 && !anomaly) {
                explanations.add("Covered by " + motifCoverage[i] + " recurring motif occurrences");
            }
            if (explanations.isEmpty()) {
                explanations.add("Normal sequence pattern");
            }
            results.add(PatternAnomalyResult.builder().patternType(PatternType.SEQUENCE).index(i).anomaly(anomaly)
                    .anomalyScore(windowScores[i]).localScore(localScores[i]).confidence(abs(combined - 0.5) * 2)
                    .severity(Severity.fromScore(combined)).structuralFeatures(Collections.emptyMap())
                    .motifs(motifs).explanations(Collections.unmodifiableList(explanations)).build());
        }
        logger.debug("analyzed sequence of {} values: {} windows, {} motifs", n, windows.size(), motifs.size());
        return Collections.unmodifiableList(results);
    }

    /**
     * @return the sliding windows of the sequence, for diagnostics
     */
    public List<Subsequence> subsequences(double[] values) {
        return subsequenceAnalyzer.analyze(checkNotNull(values, "values must not be null"), Deadline.none());
    }

    static double zScore(double value, double mean, double deviation) {
        return (deviation > 0) ? abs(value - mean) / deviation : 0;
    }

    void remember(Graph graph) {
        cacheLock.lock();
        try {
            recentGraphs.addLast(graph);
            while (recentGraphs.size() > recentGraphCapacity) {
                recentGraphs.removeFirst();
            }
        } finally {
            cacheLock.unlock();
        }
    }

    void remember(double[] values) {
        cacheLock.lock();
        try {
            for (double value : values) {
                history.addLast(value);
            }
            if (history.size() > historyCapacity) {
                while (history.size() > historyRetained) {
                    history.removeFirst();
                }
            }
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * @return a copy of the retained sequence history, oldest first
     */
    public double[] getHistory() {
        cacheLock.lock();
        try {
            return history.stream().mapToDouble(Double::doubleValue).toArray();
        } finally {
            cacheLock.unlock();
        }
    }

    public List<Graph> getRecentGraphs() {
        cacheLock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(recentGraphs));
        } finally {
            cacheLock.unlock();
        }
    }

    public PatternStatistics getPatternStatistics() {
        cacheLock.lock();
        try {
            return PatternStatistics.builder().graphsAnalyzed(graphsAnalyzed.get())
                    .sequencesAnalyzed(sequencesAnalyzed.get()).historySize(history.size())
                    .recentGraphs(recentGraphs.size()).windowSize(subsequenceAnalyzer.getWindowSize())
                    .graphThreshold(graphThreshold).subsequenceThreshold(subsequenceThreshold).build();
        } finally {
            cacheLock.unlock();
        }
    }

    public double getGraphThreshold() {
        return graphThreshold;
    }

    public double getSubsequenceThreshold() {
        return subsequenceThreshold;
    }

    public static class Builder<T extends Builder<T>> {

        private double graphThreshold = DEFAULT_GRAPH_THRESHOLD;
        private double subsequenceThreshold = DEFAULT_SUBSEQUENCE_THRESHOLD;
        private double periodicityThreshold = DEFAULT_PERIODICITY_THRESHOLD;
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private int alphabetSize = DEFAULT_ALPHABET_SIZE;
        private int minMotifLength = DEFAULT_MIN_MOTIF_LENGTH;
        private int maxMotifLength = DEFAULT_MAX_MOTIF_LENGTH;
        private int minMotifSupport = DEFAULT_MIN_MOTIF_SUPPORT;
        private int maxMotifs = DEFAULT_MAX_MOTIFS;
        private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
        private int historyRetained = DEFAULT_HISTORY_RETAINED;
        private int recentGraphCapacity = DEFAULT_RECENT_GRAPHS;

        public T graphThreshold(double graphThreshold) {
            this.graphThreshold = graphThreshold;
            return (T) this;
        }

        public T subsequenceThreshold(double subsequenceThreshold) {
            this.subsequenceThreshold = subsequenceThreshold;
            return (T) this;
        }

        public T periodicityThreshold(double periodicityThreshold) {
            this.periodicityThreshold = periodicityThreshold;
            return (T) this;
        }

        public T windowSize(int windowSize) {
            this.windowSize = windowSize;
            return (T) this;
        }

        public T alphabetSize(int alphabetSize) {
            this.alphabetSize = alphabetSize;
            return (T) this;
        }

        public T motifLengths(int minMotifLength, int maxMotifLength) {
            this.minMotifLength = minMotifLength;
            this.maxMotifLength = maxMotifLength;
            return (T) this;
        }

        public T minMotifSupport(int minMotifSupport) {
            this.minMotifSupport = minMotifSupport;
            return (T) this;
        }

        public T maxMotifs(int maxMotifs) {
            this.maxMotifs = maxMotifs;
            return (T) this;
        }

        public T historyCapacity(int historyCapacity, int historyRetained) {
            this.historyCapacity = historyCapacity;
            this.historyRetained = historyRetained;
            return (T) this;
        }

        public T recentGraphCapacity(int recentGraphCapacity) {
            this.recentGraphCapacity = recentGraphCapacity;
            return (T) this;
        }

        public PatternRecognitionEngine build() {
            return new PatternRecognitionEngine(this);
        }
    }
}
