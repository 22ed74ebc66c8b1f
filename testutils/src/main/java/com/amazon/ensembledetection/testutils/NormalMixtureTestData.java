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

package com.amazon.ensembledetection.testutils;

import java.util.Random;

/**
 * This class samples points from a mixture of 2 multi-variate normal
 * distributions with covariance matrices of the form sigma * I. One of the
 * normal distributions is considered the base distribution, the second is
 * considered the anomaly distribution, and there are random transitions between
 * the two. All randomness comes from the seed, so the same seed always yields
 * the same rows and labels.
 */
public class NormalMixtureTestData {

    private final double baseMu;
    private final double baseSigma;
    private final double anomalyMu;
    private final double anomalySigma;
    private final double transitionToAnomalyProbability;
    private final double transitionToBaseProbability;

    public NormalMixtureTestData(double baseMu, double baseSigma, double anomalyMu, double anomalySigma,
            double transitionToAnomalyProbability, double transitionToBaseProbability) {
        this.baseMu = baseMu;
        this.baseSigma = baseSigma;
        this.anomalyMu = anomalyMu;
        this.anomalySigma = anomalySigma;
        this.transitionToAnomalyProbability = transitionToAnomalyProbability;
        this.transitionToBaseProbability = transitionToBaseProbability;
    }

    public NormalMixtureTestData() {
        this(0.0, 1.0, 4.0, 2.0, 0.01, 0.3);
    }

    /**
     * a generator that never leaves the base distribution
     */
    public static NormalMixtureTestData baseOnly(double mu, double sigma) {
        return new NormalMixtureTestData(mu, sigma, mu, sigma, 0.0, 1.0);
    }

    public double[][] generateTestData(int numberOfRows, int numberOfColumns, long seed) {
        return generateLabeledTestData(numberOfRows, numberOfColumns, seed).getData();
    }

    public LabeledData generateLabeledTestData(int numberOfRows, int numberOfColumns, long seed) {
        double[][] result = new double[numberOfRows][numberOfColumns];
        boolean[] labels = new boolean[numberOfRows];
        Random random = new Random(seed);
        NormalDistribution dist = new NormalDistribution(random);
        boolean anomaly = false;

        for (int i = 0; i < numberOfRows; i++) {
            labels[i] = anomaly;
            if (!anomaly) {
                fillRow(result[i], dist, baseMu, baseSigma);
                if (random.nextDouble() < transitionToAnomalyProbability) {
                    anomaly = true;
                }
            } else {
                fillRow(result[i], dist, anomalyMu, anomalySigma);
                if (random.nextDouble() < transitionToBaseProbability) {
                    anomaly = false;
                }
            }
        }
        return new LabeledData(result, labels);
    }

    private void fillRow(double[] row, NormalDistribution dist, double mu, double sigma) {
        for (int j = 0; j < row.length; j++) {
            row[j] = dist.nextDouble(mu, sigma);
        }
    }

    public static class LabeledData {
        private final double[][] data;
        private final boolean[] anomalous;

        LabeledData(double[][] data, boolean[] anomalous) {
            this.data = data;
            this.anomalous = anomalous;
        }

        public double[][] getData() {
            return data;
        }

        public boolean[] getAnomalous() {
            return anomalous;
        }
    }

    static class NormalDistribution {
        private final Random rng;
        private final double[] buffer;
        private int index;

        NormalDistribution(Random rng) {
            this.rng = rng;
            buffer = new double[2];
            index = 0;
        }

        double nextDouble() {
            if (index == 0) {
                // Box-Muller; 1 - u keeps the logarithm finite
                double u = 1 - rng.nextDouble();
                double v = rng.nextDouble();
                double r = Math.sqrt(-2 * Math.log(u));
                buffer[0] = r * Math.cos(2 * Math.PI * v);
                buffer[1] = r * Math.sin(2 * Math.PI * v);
            }

            double result = buffer[index];
            index = (index + 1) % 2;

            return result;
        }

        double nextDouble(double mu, double sigma) {
            return mu + sigma * nextDouble();
        }
    }
}
