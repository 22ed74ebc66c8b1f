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

package com.amazon.ensembledetection.serialize;

import java.util.List;

import lombok.Data;

/**
 * The JSON shape of a data profile. Groups that do not apply to the profiled
 * data type are left out.
 */
@Data
public class DataProfileState {

    private String dataType;

    private int length;

    private double mean;

    private double variance;

    private double standardDeviation;

    private double trend;

    private double seasonality;

    private boolean outliers;

    private boolean stationary;

    private Boolean regular;

    private Double averageInterval;

    private Boolean gaps;

    private Double volatility;

    private Integer featureCount;

    private List<String> featureNames;

    private List<Double> featureCorrelations;

    private Double maxCorrelation;

    private Boolean highlyCorrelated;

    private Double sparsity;

    private Integer nodeCount;

    private Integer edgeCount;

    private Double density;

    private Boolean connected;

    private Boolean sparse;

    private List<String> recommendedMethods;
}
