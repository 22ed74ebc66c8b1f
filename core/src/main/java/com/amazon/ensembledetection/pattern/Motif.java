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

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A recurring sub-pattern. Sequence motifs carry the symbolic pattern and the
 * start positions of its occurrences; graph motifs carry the node identifiers
 * of each instance.
 */
@Getter
@AllArgsConstructor
public class Motif {

    private final MotifType type;

    // symbolic pattern for sequence motifs, the motif type name for graph motifs
    private final String pattern;

    private final int frequency;

    private final double significance;

    private final List<Integer> positions;

    private final List<List<String>> instances;

    public int length() {
        return (type == MotifType.SEQUENCE) ? pattern.length() : (instances.isEmpty() ? 0 : instances.get(0).size());
    }
}
