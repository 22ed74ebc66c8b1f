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

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * An immutable undirected simple graph built for one analysis call. Adjacency
 * is derived from the edge list and from the connection lists of the nodes;
 * duplicate edges and self loops are dropped, and edge endpoints that are not
 * among the nodes are added as nodes of weight 1.
 */
public class Graph {

    private final List<String> nodeIds;

    private final Map<String, Integer> indexOf;

    private final double[] weights;

    // sorted neighbor indices per node
    private final int[][] adjacency;

    private final int edgeCount;

    private Graph(List<String> nodeIds, Map<String, Integer> indexOf, double[] weights, int[][] adjacency,
            int edgeCount) {
        this.nodeIds = nodeIds;
        this.indexOf = indexOf;
        this.weights = weights;
        this.adjacency = adjacency;
        this.edgeCount = edgeCount;
    }

    public static Graph build(List<GraphNode> nodes, List<GraphEdge> edges) {
        checkNotNull(nodes, "nodes must not be null");
        checkNotNull(edges, "edges must not be null");
        Map<String, Integer> indexOf = new LinkedHashMap<>();
        List<Double> weightList = new ArrayList<>();
        for (GraphNode node : nodes) {
            if (!indexOf.containsKey(node.getId())) {
                indexOf.put(node.getId(), indexOf.size());
                weightList.add(node.getWeight());
            }
        }
        List<String[]> links = new ArrayList<>();
        for (GraphEdge edge : edges) {
            links.add(new String[] { edge.getSource(), edge.getTarget() });
        }
        for (GraphNode node : nodes) {
            for (String neighbor : node.getConnections()) {
                links.add(new String[] { node.getId(), neighbor });
            }
        }
        for (String[] link : links) {
            for (String id : link) {
                if (!indexOf.containsKey(id)) {
                    indexOf.put(id, indexOf.size());
                    weightList.add(1.0);
                }
            }
        }

        int n = indexOf.size();
        List<TreeSet<Integer>> neighbors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            neighbors.add(new TreeSet<>());
        }
        int edgeCount = 0;
        for (String[] link : links) {
            int a = indexOf.get(link[0]);
            int b = indexOf.get(link[1]);
            if (a != b && neighbors.get(a).add(b)) {
                neighbors.get(b).add(a);
                ++edgeCount;
            }
        }
        int[][] adjacency = new int[n][];
        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            adjacency[i] = neighbors.get(i).stream().mapToInt(Integer::intValue).toArray();
            weights[i] = weightList.get(i);
        }
        return new Graph(Collections.unmodifiableList(new ArrayList<>(indexOf.keySet())),
                Collections.unmodifiableMap(indexOf), weights, adjacency, edgeCount);
    }

    public int size() {
        return nodeIds.size();
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    public List<String> getNodeIds() {
        return nodeIds;
    }

    public String nodeId(int index) {
        return nodeIds.get(index);
    }

    public int indexOf(String id) {
        Integer index = indexOf.get(id);
        return (index == null) ? -1 : index;
    }

    public int degree(int index) {
        return adjacency[index].length;
    }

    public double weight(int index) {
        return weights[index];
    }

    /**
     * @return the sorted neighbor indices; callers must not modify the array
     */
    int[] neighbors(int index) {
        return adjacency[index];
    }

    public boolean isAdjacent(int a, int b) {
        return Arrays.binarySearch(adjacency[a], b) >= 0;
    }

    /**
     * @return 2|E| / (|V| (|V| - 1)), or 0 for fewer than two nodes
     */
    public double density() {
        int n = size();
        return (n < 2) ? 0 : 2.0 * edgeCount / ((double) n * (n - 1));
    }
}
