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

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A scored sliding window; {@code end} is exclusive.
 */
@Getter
@AllArgsConstructor
public class Subsequence {

    private final int start;

    private final int end;

    private final double score;

    private final SubsequenceType type;

    private final double mean;

    private final double standardDeviation;

    private final double trend;

    public boolean contains(int index) {
        return index >= start && index < end;
    }
}
