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

import lombok.Getter;

/**
 * An edge of a graph payload. Edges are treated as undirected for connectivity.
 */
@Getter
public class GraphEdge {

    public static final String DEFAULT_TYPE = "link";

    private final String source;

    private final String target;

    private final double weight;

    private final String type;

    public GraphEdge(String source, String target) {
        this(source, target, 1.0, DEFAULT_TYPE);
    }

    public GraphEdge(String source, String target, double weight, String type) {
        this.source = checkNotNull(source, "edge source must not be null");
        this.target = checkNotNull(target, "edge target must not be null");
        this.weight = weight;
        this.type = (type == null) ? DEFAULT_TYPE : type;
    }
}
