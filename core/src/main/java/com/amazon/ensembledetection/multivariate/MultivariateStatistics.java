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

package com.amazon.ensembledetection.multivariate;

import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.config.MultivariateMethod;

@Getter
@Builder
public class MultivariateStatistics {

    private final boolean trained;

    private final int trainingSize;

    private final List<String> featureNames;

    private final int principalComponents;

    private final int independentComponents;

    private final boolean pseudoInverseUsed;

    private final Set<MultivariateMethod> methods;

    private final double threshold;
}
