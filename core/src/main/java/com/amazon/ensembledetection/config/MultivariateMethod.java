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

package com.amazon.ensembledetection.config;

/**
 * The sub-scorers that a multivariate detector averages into its ensemble
 * score.
 */
public enum MultivariateMethod {
    /**
     * reconstruction error of the point after projecting onto the retained
     * principal components
     */
    PCA,
    /**
     * covariance aware distance from the training mean
     */
    MAHALANOBIS,
    /**
     * magnitude of the independent component projections of the whitened point
     */
    ICA,
    /**
     * largest per-feature z-score against the training distribution
     */
    CORRELATION;
}
