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
import static java.lang.Math.abs;
import static java.lang.Math.exp;
import static java.lang.Math.sqrt;

import java.util.Arrays;
import java.util.Random;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.util.Deadline;

/**
 * FastICA unmixing vectors found by fixed point iteration over whitened data
 * with the Gaussian nonlinearity {@code g(u) = u exp(-u^2/2)}. Each new vector
 * is orthogonalized against the vectors found before it. Whitening reuses the
 * principal component model of the training data, so detection never refits
 * it.
 */
public class IndependentComponents {

    public static final double CONVERGENCE_THRESHOLD = 0.9999;

    // principal directions with a smaller share of the leading variance are not whitened
    static final double MIN_RELATIVE_WHITENING_VARIANCE = 1e-10;

    private final PrincipalComponents whitening;

    // number of whitened coordinates
    private final int whitenedDimensions;

    // rows are unmixing vectors in the whitened space
    private final double[][] unmixing;

    private IndependentComponents(PrincipalComponents whitening, int whitenedDimensions, double[][] unmixing) {
        this.whitening = whitening;
        this.whitenedDimensions = whitenedDimensions;
        this.unmixing = unmixing;
    }

    /**
     * @param whitening      the principal component model of the training data
     * @param data           the training rows
     * @param maxComponents  requested number of independent components
     * @param maxIterations  fixed point iteration cap per component
     * @param random         source of the initial vectors
     * @param deadline       cooperative cancellation token
     * @return the fitted unmixing model; it has no components if the training
     *         data has no variance
     */
    public static IndependentComponents fit(PrincipalComponents whitening, double[][] data, int maxComponents,
            int maxIterations, Random random, Deadline deadline) {
        checkArgument(maxComponents > 0, "at least one component is required");
        int whitened = 0;
        double[] explained = whitening.getExplainedVariance();
        double floor = (explained.length == 0) ? 0 : MIN_RELATIVE_WHITENING_VARIANCE * explained[0];
        while (whitened < explained.length && explained[whitened] > floor) {
            ++whitened;
        }
        int count = Math.min(maxComponents, whitened);
        IndependentComponents partial = new IndependentComponents(whitening, whitened, new double[0][]);
        double[][] samples = new double[data.length][];
        for (int i = 0; i < data.length; i++) {
            samples[i] = partial.whiten(data[i]);
        }

        double[][] unmixing = new double[count][];
        for (int c = 0; c < count; c++) {
            double[] w = new double[whitened];
            for (int j = 0; j < whitened; j++) {
                w[j] = random.nextDouble() - 0.5;
            }
            StatMath.orthogonalize(w, unmixing, c);
            if (StatMath.normalize(w) == 0) {
                w[c] = 1.0;
            }
            for (int iteration = 0; iteration < maxIterations; iteration++) {
                deadline.checkEvery(iteration);
                double[] next = fixedPointStep(w, samples);
                StatMath.orthogonalize(next, unmixing, c);
                if (StatMath.normalize(next) == 0) {
                    break;
                }
                boolean converged = abs(StatMath.dot(next, w)) > CONVERGENCE_THRESHOLD;
                w = next;
                if (converged) {
                    break;
                }
            }
            unmixing[c] = w;
        }
        return new IndependentComponents(whitening, whitened, unmixing);
    }

    // w+ = E[z g(w.z)] - E[g'(w.z)] w
    static double[] fixedPointStep(double[] w, double[][] samples) {
        double[] next = new double[w.length];
        double derivativeSum = 0;
        for (double[] z : samples) {
            double u = StatMath.dot(w, z);
            double gaussian = exp(-u * u / 2);
            double g = u * gaussian;
            derivativeSum += (1 - u * u) * gaussian;
            for (int j = 0; j < next.length; j++) {
                next[j] += g * z[j];
            }
        }
        for (int j = 0; j < next.length; j++) {
            next[j] = next[j] / samples.length - derivativeSum / samples.length * w[j];
        }
        return next;
    }

    /**
     * projects onto the principal directions and scales each coordinate to unit
     * variance
     */
    public double[] whiten(double[] point) {
        double[] projected = whitening.transform(point);
        double[] explained = whitening.getExplainedVariance();
        double[] result = new double[whitenedDimensions];
        for (int j = 0; j < whitenedDimensions; j++) {
            result[j] = projected[j] / sqrt(explained[j]);
        }
        return result;
    }

    /**
     * @return the independent component projections of the point
     */
    public double[] transform(double[] point) {
        double[] whitened = whiten(point);
        double[] sources = new double[unmixing.length];
        for (int c = 0; c < unmixing.length; c++) {
            sources[c] = StatMath.dot(unmixing[c], whitened);
        }
        return sources;
    }

    public int getNumberOfComponents() {
        return unmixing.length;
    }

    public double[][] getUnmixing() {
        double[][] copy = new double[unmixing.length][];
        for (int c = 0; c < unmixing.length; c++) {
            copy[c] = Arrays.copyOf(unmixing[c], unmixing[c].length);
        }
        return copy;
    }
}
