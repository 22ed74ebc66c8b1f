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

package com.amazon.ensembledetection.math;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.util.Deadline;

public class StatMathTest {

    private static final double EPSILON = 1e-9;

    @Test
    public void testMeanAndVariance() {
        double[] values = { 2, 4, 4, 4, 5, 5, 7, 9 };
        assertEquals(5.0, StatMath.mean(values), EPSILON);
        assertEquals(4.0, StatMath.variance(values), EPSILON);
        assertEquals(2.0, StatMath.standardDeviation(values), EPSILON);
        assertEquals(0.0, StatMath.mean(new double[0]));
        assertEquals(0.0, StatMath.variance(new double[0]));
    }

    @Test
    public void testCovarianceUsesSampleDivisor() {
        double[] x = { 1, 2, 3, 4 };
        double[] y = { 2, 4, 6, 8 };
        // sum of products of deviations is 10, divided by n - 1
        assertEquals(10.0 / 3, StatMath.covariance(x, y), EPSILON);
        assertEquals(0.0, StatMath.covariance(new double[] { 1 }, new double[] { 5 }), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> StatMath.covariance(x, new double[] { 1 }));
    }

    @Test
    public void testCorrelation() {
        double[] x = { 1, 2, 3, 4, 5 };
        assertEquals(1.0, StatMath.correlation(x, new double[] { 3, 5, 7, 9, 11 }), EPSILON);
        assertEquals(-1.0, StatMath.correlation(x, new double[] { 5, 4, 3, 2, 1 }), EPSILON);
        assertEquals(0.0, StatMath.correlation(x, new double[] { 7, 7, 7, 7, 7 }), EPSILON);
    }

    @Test
    public void testMedianAndQuantile() {
        assertEquals(3.0, StatMath.median(new double[] { 5, 1, 3 }), EPSILON);
        assertEquals(2.5, StatMath.median(new double[] { 4, 1, 3, 2 }), EPSILON);
        double[] values = { 8, 1, 6, 3, 5, 2, 7, 4 };
        assertEquals(3.0, StatMath.quantile(values, 0.25), EPSILON);
        assertEquals(7.0, StatMath.quantile(values, 0.75), EPSILON);
        assertEquals(8.0, StatMath.quantile(values, 1.0), EPSILON);
    }

    @Test
    public void testLinearTrendAndAutocorrelation() {
        assertEquals(2.0, StatMath.linearTrend(new double[] { 1, 3, 5, 7, 9 }), EPSILON);
        assertEquals(0.0, StatMath.linearTrend(new double[] { 4 }), EPSILON);
        double[] alternating = new double[20];
        for (int i = 0; i < alternating.length; i++) {
            alternating[i] = (i % 2 == 0) ? 1 : -1;
        }
        assertTrue(StatMath.autocorrelation(alternating, 2) > 0.8);
        assertTrue(StatMath.autocorrelation(alternating, 1) < -0.8);
        assertEquals(0.0, StatMath.autocorrelation(new double[] { 3, 3, 3 }, 1), EPSILON);
        assertEquals(0.0, StatMath.autocorrelation(alternating, 25), EPSILON);
    }

    @Test
    public void testInverse() {
        double[][] matrix = { { 4, 7 }, { 2, 6 } };
        double[][] inverse = StatMath.inverse(matrix);
        assertArrayEquals(new double[] { 0.6, -0.7 }, inverse[0], EPSILON);
        assertArrayEquals(new double[] { -0.2, 0.4 }, inverse[1], EPSILON);
        double[][] product = StatMath.multiply(matrix, inverse);
        assertArrayEquals(new double[] { 1, 0 }, product[0], EPSILON);
        assertArrayEquals(new double[] { 0, 1 }, product[1], EPSILON);
    }

    @Test
    public void testInverseNeedsPivoting() {
        double[][] matrix = { { 0, 1 }, { 1, 0 } };
        Optional<double[][]> inverse = StatMath.tryInverse(matrix);
        assertTrue(inverse.isPresent());
        assertArrayEquals(new double[] { 0, 1 }, inverse.get()[0], EPSILON);
    }

    @Test
    public void testSingularMatrixFallsBackToPseudoInverse() {
        double[][] singular = { { 1, 2 }, { 2, 4 } };
        assertFalse(StatMath.tryInverse(singular).isPresent());
        double[][] pseudo = StatMath.inverse(singular);
        // A A+ A should recover A
        double[][] recovered = StatMath.multiply(StatMath.multiply(singular, pseudo), singular);
        assertArrayEquals(singular[0], recovered[0], 1e-4);
        assertArrayEquals(singular[1], recovered[1], 1e-4);
        double[][] zero = StatMath.inverse(new double[][] { { 0 } });
        assertEquals(0.0, zero[0][0], EPSILON);
    }

    @Test
    public void testToleranceFollowsMatrixScale() {
        double scale = 1e-12;
        double[][] small = { { 2 * scale, scale }, { scale, 2 * scale } };
        Optional<double[][]> inverse = StatMath.tryInverse(small);
        assertTrue(inverse.isPresent());
        assertArrayEquals(new double[] { 2.0 / 3 / scale, -1.0 / 3 / scale }, inverse.get()[0], 1e-6 / scale);
        assertEquals(3 * scale, StatMath.dominantEigenPair(small, Deadline.none()).getEigenvalue(), 1e-8 * scale);

        double[][] singular = { { scale, 2 * scale }, { 2 * scale, 4 * scale } };
        assertFalse(StatMath.tryInverse(singular).isPresent());
        double[][] recovered = StatMath.multiply(StatMath.multiply(singular, StatMath.pseudoInverse(singular)),
                singular);
        assertArrayEquals(singular[0], recovered[0], 1e-4 * scale);
        assertArrayEquals(singular[1], recovered[1], 1e-4 * scale);

        double[][] large = { { 1e6, 0 }, { 0, 1e-6 } };
        assertFalse(StatMath.tryInverse(large).isPresent());
        assertEquals(1e6, StatMath.maxAbsEntry(large), 0.0);
    }

    @Test
    public void testTransposeAndMultiply() {
        double[][] matrix = { { 1, 2, 3 }, { 4, 5, 6 } };
        double[][] transposed = StatMath.transpose(matrix);
        assertEquals(3, transposed.length);
        assertArrayEquals(new double[] { 3, 6 }, transposed[2], EPSILON);
        assertArrayEquals(new double[] { 14, 32 }, StatMath.multiply(matrix, new double[] { 1, 2, 3 }), EPSILON);
        assertThrows(IllegalArgumentException.class, () -> StatMath.multiply(matrix, matrix));
    }

    @Test
    public void testDominantEigenPair() {
        double[][] matrix = { { 2, 1 }, { 1, 2 } };
        EigenPair pair = StatMath.dominantEigenPair(matrix, Deadline.none());
        assertEquals(3.0, pair.getEigenvalue(), 1e-8);
        double[] vector = pair.getEigenvector();
        assertEquals(1.0, StatMath.norm(vector), 1e-8);
        assertEquals(Math.abs(vector[0]), Math.abs(vector[1]), 1e-6);

        // restricted to the complement of the dominant direction
        EigenPair second = StatMath.dominantEigenPair(matrix, new double[][] { vector }, 1, 1000, 1e-12,
                Deadline.none());
        assertEquals(1.0, second.getEigenvalue(), 1e-8);
        assertEquals(0.0, StatMath.dot(vector, second.getEigenvector()), 1e-8);
    }

    @Test
    public void testEigenPairWhenStartIsOrthogonal() {
        // the all ones start vector is orthogonal to the dominant direction
        double[][] matrix = { { 5, -5 }, { -5, 5 } };
        EigenPair pair = StatMath.dominantEigenPair(matrix, Deadline.none());
        assertEquals(10.0, pair.getEigenvalue(), 1e-8);
    }
}
