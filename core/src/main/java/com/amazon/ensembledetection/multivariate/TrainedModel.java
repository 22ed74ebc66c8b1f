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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * An immutable snapshot of everything a {@link MultivariateDetector} learned
 * from one training batch. The detector swaps whole snapshots, so a detection
 * call always scores against one consistent model.
 */
@Getter
public class TrainedModel {

    // the order used to vectorize points at train and detect time
    private final List<String> featureNames;

    // principal components used for reconstruction scoring
    private final PrincipalComponents principalComponents;

    private final IndependentComponents independentComponents;

    private final MahalanobisModel mahalanobis;

    private final double[] featureMeans;

    // population standard deviations
    private final double[] featureStandardDeviations;

    // training rows used for the kernel distance diagnostic
    @Getter(AccessLevel.NONE)
    private final double[][] referencePoints;

    private final int trainingSize;

    private final long trainedAtMillis;

    TrainedModel(List<String> featureNames, PrincipalComponents principalComponents,
            IndependentComponents independentComponents, MahalanobisModel mahalanobis, double[] featureMeans,
            double[] featureStandardDeviations, double[][] referencePoints, int trainingSize, long trainedAtMillis) {
        this.featureNames = Collections.unmodifiableList(featureNames);
        this.principalComponents = principalComponents;
        this.independentComponents = independentComponents;
        this.mahalanobis = mahalanobis;
        this.featureMeans = featureMeans;
        this.featureStandardDeviations = featureStandardDeviations;
        this.referencePoints = referencePoints;
        this.trainingSize = trainingSize;
        this.trainedAtMillis = trainedAtMillis;
    }

    public int getDimensions() {
        return featureNames.size();
    }

    public double[] getFeatureMeans() {
        return Arrays.copyOf(featureMeans, featureMeans.length);
    }

    public double[] getFeatureStandardDeviations() {
        return Arrays.copyOf(featureStandardDeviations, featureStandardDeviations.length);
    }

    double featureMean(int i) {
        return featureMeans[i];
    }

    double featureStandardDeviation(int i) {
        return featureStandardDeviations[i];
    }

    double[][] referencePoints() {
        return referencePoints;
    }
}
