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

import static com.amazon.ensembledetection.CommonUtils.checkArgument;

import java.util.Arrays;
import java.util.Optional;

import com.amazon.ensembledetection.math.StatMath;

/**
 * Training mean and inverse covariance. A near singular covariance is inverted
 * with the regularized pseudo-inverse instead of failing.
 */
public class MahalanobisModel {

    private final double[] mean;

    private final double[][] inverseCovariance;

    private final boolean pseudoInverse;

    private MahalanobisModel(double[] mean, double[][] inverseCovariance, boolean pseudoInverse) {
        this.mean = mean;
        this.inverseCovariance = inverseCovariance;
        this.pseudoInverse = pseudoInverse;
    }

    public static MahalanobisModel fit(double[][] data) {
        checkArgument(data.length > 0, "no data to fit");
        double[] mean = StatMath.columnMeans(data);
        double[][] covariance = StatMath.covarianceMatrix(data, mean);
        Optional<double[][]> inverse = StatMath.tryInverse(covariance);
        if (inverse.isPresent()) {
            return new MahalanobisModel(mean, inverse.get(), false);
        }
        return new MahalanobisModel(mean, StatMath.pseudoInverse(covariance), true);
    }

    public double distance(double[] point) {
        checkArgument(point.length == mean.length, "incorrect dimensions");
        double[] difference = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            difference[i] = point[i] - mean[i];
        }
        double quadratic = StatMath.dot(difference, StatMath.multiply(inverseCovariance, difference));
        return Math.sqrt(Math.max(0, quadratic));
    }

    public boolean isPseudoInverse() {
        return pseudoInverse;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }
}
