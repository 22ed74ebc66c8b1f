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

package com.amazon.ensembledetection.orchestration;

import java.util.List;

import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * A read-only description of a payload. The sequence statistics are computed
 * over the numeric projection of the payload; the remaining groups are only
 * filled in for the matching {@link DataType}.
 */
@Getter
@Builder
public class DataProfile {

    private final DataType dataType;

    private final int length;

    private final double mean;

    private final double variance;

    private final double standardDeviation;

    // least squares slope per element
    private final double trend;

    // maximum absolute autocorrelation over the candidate lags
    private final double seasonality;

    private final boolean outliers;

    private final boolean stationary;

    // time series only

    private final boolean regular;

    private final double averageInterval;

    private final boolean gaps;

    private final double volatility;

    // multivariate only

    private final int featureCount;

    private final List<String> featureNames;

    // absolute Pearson correlation of each feature pair, in pair order
    private final List<Double> featureCorrelations;

    private final double maxCorrelation;

    private final boolean highlyCorrelated;

    // fraction of zero feature values
    private final double sparsity;

    // graph only

    private final int nodeCount;

    private final int edgeCount;

    private final double density;

    private final boolean connected;

    private final boolean sparse;

    private final List<DetectionMethod> recommendedMethods;
}
