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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * A node of a graph payload: an identifier, numeric features, the identifiers
 * of nodes it declares itself connected to, and a weight.
 */
@Getter
public class GraphNode {

    private final String id;

    private final Map<String, Double> features;

    private final List<String> connections;

    private final double weight;

    public GraphNode(String id) {
        this(id, Collections.emptyMap(), Collections.emptyList(), 1.0);
    }

    public GraphNode(String id, Map<String, Double> features, List<String> connections, double weight) {
        this.id = checkNotNull(id, "node id must not be null");
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(checkNotNull(features, "features")));
        this.connections = Collections.unmodifiableList(new ArrayList<>(checkNotNull(connections, "connections")));
        this.weight = weight;
    }
}
