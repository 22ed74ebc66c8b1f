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

import com.amazon.ensembledetection.math.EigenPair;
import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.util.Deadline;

/**
 * An immutable principal component model: the training mean and up to d unit
 * principal directions, extracted one at a time by power iteration with
 * deflation of the covariance matrix. Rows of {@code components} are the
 * directions in decreasing order of explained variance.
 */
public class PrincipalComponents {

    private final double[] mean;

    private final double[][] components;

    private final double[] explainedVariance;

    PrincipalComponents(double[] mean, double[][] components, double[] explainedVariance) {
        this.mean = mean;
        this.components = components;
        this.explainedVariance = explainedVariance;
    }

    /**
     * fits the model
     *
     * @param data          rows of observations, all of the same length
     * @param maxComponents the number of directions to extract, capped at the
     *                      number of columns
     * @param deadline      cooperative cancellation token
     * @return the fitted model
     */
    public static PrincipalComponents fit(double[][] data, int maxComponents, Deadline deadline) {
        checkArgument(data.length > 0, "no data to fit");
        checkArgument(maxComponents > 0, "at least one component is required");
        double[] mean = StatMath.columnMeans(data);
        int dimensions = mean.length;
        int count = Math.min(dimensions, maxComponents);
        double[][] work = StatMath.covarianceMatrix(data, mean);
        // deflation leaves round-off behind; directions below this share of the largest
        // covariance entry carry no variance
        double vanishing = StatMath.PIVOT_TOLERANCE * StatMath.maxAbsEntry(work);

        double[][] components = new double[count][];
        double[] explained = new double[count];
        for (int k = 0; k < count; k++) {
            deadline.check();
            EigenPair pair = StatMath.dominantEigenPair(work, components, k, StatMath.DEFAULT_POWER_ITERATIONS,
                    StatMath.DEFAULT_EIGEN_TOLERANCE, deadline);
            double[] vector = pair.getEigenvector();
            double lambda = (pair.getEigenvalue() > vanishing) ? pair.getEigenvalue() : 0;
            components[k] = vector;
            explained[k] = Math.max(0, lambda);
            for (int i = 0; i < dimensions; i++) {
                for (int j = 0; j < dimensions; j++) {
                    work[i][j] -= lambda * vector[i] * vector[j];
                }
            }
        }
        return new PrincipalComponents(mean, components, explained);
    }

    /**
     * @param count the number of leading components to keep
     * @return a model using only the leading components
     */
    public PrincipalComponents truncate(int count) {
        checkArgument(count > 0 && count <= components.length, "invalid number of components");
        return new PrincipalComponents(mean, Arrays.copyOf(components, count),
                Arrays.copyOf(explainedVariance, count));
    }

    public double[] transform(double[] point) {
        checkArgument(point.length == mean.length, "incorrect dimensions");
        double[] centered = new double[point.length];
        for (int i = 0; i < point.length; i++) {
            centered[i] = point[i] - mean[i];
        }
        double[] result = new double[components.length];
        for (int k = 0; k < components.length; k++) {
            result[k] = StatMath.dot(centered, components[k]);
        }
        return result;
    }

    public double[] inverseTransform(double[] projected) {
        checkArgument(projected.length == components.length, "incorrect number of components");
        double[] result = Arrays.copyOf(mean, mean.length);
        for (int k = 0; k < components.length; k++) {
            for (int i = 0; i < result.length; i++) {
                result[i] += projected[k] * components[k][i];
            }
        }
        return result;
    }

    /**
     * Euclidean distance between the point and its reconstruction from the
     * retained components
     */
    public double reconstructionError(double[] point) {
        return StatMath.euclideanDistance(point, inverseTransform(transform(point)));
    }

    public double totalExplainedVariance() {
        double sum = 0;
        for (double value : explainedVariance) {
            sum += value;
        }
        return sum;
    }

    public int getNumberOfComponents() {
        return components.length;
    }

    public int getDimensions() {
        return mean.length;
    }

    public double[] getMean() {
        return Arrays.copyOf(mean, mean.length);
    }

    public double[] getExplainedVariance() {
        return Arrays.copyOf(explainedVariance, explainedVariance.length);
    }

    public double[][] getComponents() {
        double[][] copy = new double[components.length][];
        for (int k = 0; k < components.length; k++) {
            copy[k] = Arrays.copyOf(components[k], components[k].length);
        }
        return copy;
    }

    double[] component(int k) {
        return components[k];
    }
}
