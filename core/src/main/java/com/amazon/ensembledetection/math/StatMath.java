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

import static com.amazon.ensembledetection.CommonUtils.checkArgument;
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;
import static java.lang.Math.abs;
import static java.lang.Math.sqrt;

import java.util.Arrays;
import java.util.Optional;

import com.amazon.ensembledetection.util.Deadline;

/**
 * Numerical primitives shared by the multivariate detector, the pattern
 * recognition engine and the data characteristics analyzer. All methods are
 * static and side effect free; matrices are row major {@code double[][]}.
 */
public class StatMath {

    // relative to the largest entry of the matrix; smaller pivots mark it as near singular
    public static final double PIVOT_TOLERANCE = 1e-10;

    // Tikhonov regularization of the pseudo-inverse, relative to the mean diagonal of A^T A
    public static final double PSEUDO_INVERSE_REGULARIZATION = 1e-6;

    public static final int DEFAULT_POWER_ITERATIONS = 1000;

    public static final double DEFAULT_EIGEN_TOLERANCE = 1e-12;

    private StatMath() {
    }

    public static double mean(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * population variance, dividing by n
     */
    public static double variance(double[] values) {
        checkNotNull(values, "values must not be null");
        if (values.length == 0) {
            return 0;
        }
        double mean = mean(values);
        double sum = 0;
        for (double value : values) {
            sum += (value - mean) * (value - mean);
        }
        return sum / values.length;
    }

    public static double standardDeviation(double[] values) {
        return sqrt(variance(values));
    }

    /**
     * sample covariance, dividing by n-1 (by 1 for a single observation)
     */
    public static double covariance(double[] x, double[] y) {
        checkArgument(x.length == y.length, "incorrect lengths");
        if (x.length == 0) {
            return 0;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sum = 0;
        for (int i = 0; i < x.length; i++) {
            sum += (x[i] - meanX) * (y[i] - meanY);
        }
        return sum / Math.max(1, x.length - 1);
    }

    /**
     * Pearson correlation; 0 when either input has no variation
     */
    public static double correlation(double[] x, double[] y) {
        checkArgument(x.length == y.length, "incorrect lengths");
        if (x.length < 2) {
            return 0;
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0;
        double sxx = 0;
        double syy = 0;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            sxy += dx * dy;
            sxx += dx * dx;
            syy += dy * dy;
        }
        if (sxx == 0 || syy == 0) {
            return 0;
        }
        return Math.max(-1.0, Math.min(1.0, sxy / sqrt(sxx * syy)));
    }

    public static double median(double[] values) {
        checkArgument(values.length > 0, "no values");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        return (sorted.length % 2 == 1) ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2;
    }

    /**
     * the value at index floor(n * fraction) of the sorted input
     */
    public static double quantile(double[] values, double fraction) {
        checkArgument(values.length > 0, "no values");
        checkArgument(fraction >= 0 && fraction <= 1, "fraction must be in [0,1]");
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted[Math.min(sorted.length - 1, (int) Math.floor(sorted.length * fraction))];
    }

    /**
     * slope of the least squares line through (i, values[i])
     */
    public static double linearTrend(double[] values) {
        int n = values.length;
        if (n < 2) {
            return 0;
        }
        double meanX = (n - 1) / 2.0;
        double meanY = mean(values);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - meanX) * (values[i] - meanY);
            denominator += (i - meanX) * (i - meanX);
        }
        return numerator / denominator;
    }

    /**
     * sample autocorrelation at the given lag; 0 when the series is constant or
     * shorter than the lag
     */
    public static double autocorrelation(double[] values, int lag) {
        checkArgument(lag >= 0, "lag must be non-negative");
        int n = values.length;
        if (lag >= n) {
            return 0;
        }
        double mean = mean(values);
        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            denominator += (values[i] - mean) * (values[i] - mean);
            if (i < n - lag) {
                numerator += (values[i] - mean) * (values[i + lag] - mean);
            }
        }
        return (denominator == 0) ? 0 : numerator / denominator;
    }

    public static double[] columnMeans(double[][] data) {
        checkArgument(data.length > 0, "no rows");
        int dimensions = data[0].length;
        double[] means = new double[dimensions];
        for (double[] row : data) {
            checkArgument(row.length == dimensions, "ragged matrix");
            for (int j = 0; j < dimensions; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < dimensions; j++) {
            means[j] /= data.length;
        }
        return means;
    }

    /**
     * sample covariance matrix of the rows of data about the supplied mean,
     * dividing by n-1 (by 1 for a single row)
     */
    public static double[][] covarianceMatrix(double[][] data, double[] mean) {
        int dimensions = mean.length;
        double[][] covariance = new double[dimensions][dimensions];
        for (double[] row : data) {
            for (int i = 0; i < dimensions; i++) {
                double di = row[i] - mean[i];
                for (int j = i; j < dimensions; j++) {
                    covariance[i][j] += di * (row[j] - mean[j]);
                }
            }
        }
        double divisor = Math.max(1, data.length - 1);
        for (int i = 0; i < dimensions; i++) {
            for (int j = i; j < dimensions; j++) {
                covariance[i][j] /= divisor;
                covariance[j][i] = covariance[i][j];
            }
        }
        return covariance;
    }

    public static double[][] transpose(double[][] matrix) {
        if (matrix.length == 0) {
            return new double[0][0];
        }
        double[][] result = new double[matrix[0].length][matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[i].length; j++) {
                result[j][i] = matrix[i][j];
            }
        }
        return result;
    }

    public static double[][] multiply(double[][] a, double[][] b) {
        checkArgument(a.length > 0 && b.length > 0, "empty matrix");
        checkArgument(a[0].length == b.length, "incompatible dimensions");
        int rows = a.length;
        int inner = b.length;
        int columns = b[0].length;
        double[][] result = new double[rows][columns];
        for (int i = 0; i < rows; i++) {
            for (int k = 0; k < inner; k++) {
                double aik = a[i][k];
                if (aik != 0) {
                    for (int j = 0; j < columns; j++) {
                        result[i][j] += aik * b[k][j];
                    }
                }
            }
        }
        return result;
    }

    public static double[] multiply(double[][] matrix, double[] vector) {
        double[] result = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            checkArgument(matrix[i].length == vector.length, "incompatible dimensions");
            result[i] = dot(matrix[i], vector);
        }
        return result;
    }

    public static double[][] identity(int dimensions) {
        double[][] result = new double[dimensions][dimensions];
        for (int i = 0; i < dimensions; i++) {
            result[i][i] = 1.0;
        }
        return result;
    }

    /**
     * Gauss-Jordan elimination with partial pivoting.
     *
     * @param matrix a square matrix, not modified
     * @return the inverse, or empty if some pivot is not larger than
     *         {@link #PIVOT_TOLERANCE} times the largest entry
     */
    public static Optional<double[][]> tryInverse(double[][] matrix) {
        int n = matrix.length;
        double tolerance = PIVOT_TOLERANCE * maxAbsEntry(matrix);
        double[][] work = new double[n][2 * n];
        for (int i = 0; i < n; i++) {
            checkArgument(matrix[i].length == n, "matrix must be square");
            System.arraycopy(matrix[i], 0, work[i], 0, n);
            work[i][n + i] = 1.0;
        }
        for (int column = 0; column < n; column++) {
            int pivotRow = column;
            for (int row = column + 1; row < n; row++) {
                if (abs(work[row][column]) > abs(work[pivotRow][column])) {
                    pivotRow = row;
                }
            }
            if (abs(work[pivotRow][column]) <= tolerance) {
                return Optional.empty();
            }
            double[] swap = work[column];
            work[column] = work[pivotRow];
            work[pivotRow] = swap;

            double pivot = work[column][column];
            for (int j = 0; j < 2 * n; j++) {
                work[column][j] /= pivot;
            }
            for (int row = 0; row < n; row++) {
                if (row != column) {
                    double factor = work[row][column];
                    if (factor != 0) {
                        for (int j = 0; j < 2 * n; j++) {
                            work[row][j] -= factor * work[column][j];
                        }
                    }
                }
            }
        }
        double[][] inverse = new double[n][n];
        for (int i = 0; i < n; i++) {
            System.arraycopy(work[i], n, inverse[i], 0, n);
        }
        return Optional.of(inverse);
    }

    /**
     * inverse of a square matrix, falling back to {@link #pseudoInverse} when the
     * matrix is near singular
     */
    public static double[][] inverse(double[][] matrix) {
        return tryInverse(matrix).orElseGet(() -> pseudoInverse(matrix));
    }

    /**
     * Regularized Moore-Penrose style pseudo-inverse
     * {@code (A^T A + lambda I)^-1 A^T}, with {@code lambda} proportional to
     * {@code trace(A^T A) / n} so that the result does not depend on the units of
     * A. The pseudo-inverse of a zero matrix is zero.
     */
    public static double[][] pseudoInverse(double[][] matrix) {
        double[][] transposed = transpose(matrix);
        double[][] gram = multiply(transposed, matrix);
        double trace = 0;
        for (int i = 0; i < gram.length; i++) {
            trace += gram[i][i];
        }
        if (trace == 0) {
            return new double[transposed.length][matrix.length];
        }
        double lambda = PSEUDO_INVERSE_REGULARIZATION * trace / gram.length;
        for (int i = 0; i < gram.length; i++) {
            gram[i][i] += lambda;
        }
        double[][] regularizedInverse = tryInverse(gram)
                .orElseThrow(() -> new ArithmeticException("regularized matrix is singular"));
        return multiply(regularizedInverse, transposed);
    }

    /**
     * @return the largest absolute value of any entry, 0 for an empty matrix
     */
    public static double maxAbsEntry(double[][] matrix) {
        double max = 0;
        for (double[] row : matrix) {
            for (double value : row) {
                max = Math.max(max, abs(value));
            }
        }
        return max;
    }

    public static double dot(double[] a, double[] b) {
        checkArgument(a.length == b.length, "incorrect lengths");
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] vector) {
        return sqrt(dot(vector, vector));
    }

    public static double euclideanDistance(double[] a, double[] b) {
        checkArgument(a.length == b.length, "incorrect lengths");
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += (a[i] - b[i]) * (a[i] - b[i]);
        }
        return sqrt(sum);
    }

    /**
     * normalizes in place
     *
     * @return the norm before normalization
     */
    public static double normalize(double[] vector) {
        double norm = norm(vector);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= norm;
            }
        }
        return norm;
    }

    /**
     * removes, in place, the components of vector along each of the (unit)
     * directions
     */
    public static void orthogonalize(double[] vector, double[][] directions, int count) {
        for (int k = 0; k < count; k++) {
            double projection = dot(vector, directions[k]);
            for (int i = 0; i < vector.length; i++) {
                vector[i] -= projection * directions[k][i];
            }
        }
    }

    /**
     * Power iteration for the dominant eigenpair of a symmetric matrix, restricted
     * to the orthogonal complement of the first {@code excludedCount} rows of
     * {@code excluded}. Iteration starts from a slightly tilted all ones vector;
     * if the matrix annihilates that start, coordinate vectors are tried in turn.
     *
     * @param matrix        a symmetric matrix
     * @param excluded      unit directions already extracted (may be null when
     *                      excludedCount is 0)
     * @param excludedCount number of rows of excluded to use
     * @param maxIterations iteration cap
     * @param tolerance     convergence tolerance on the Rayleigh quotient
     * @param deadline      cooperative cancellation token
     * @return the eigenpair; the vector is zero only if the allowed subspace is
     *         empty, and the eigenvalue is 0 if the matrix vanishes on it
     *         (relative to its largest entry)
     */
    public static EigenPair dominantEigenPair(double[][] matrix, double[][] excluded, int excludedCount,
            int maxIterations, double tolerance, Deadline deadline) {
        int n = matrix.length;
        double vanishing = PIVOT_TOLERANCE * maxAbsEntry(matrix);
        double[] fallback = null;
        double[] vector = null;
        for (int candidate = -1; candidate < n && vector == null; candidate++) {
            double[] start = startVector(n, candidate);
            orthogonalize(start, excluded, excludedCount);
            if (normalize(start) < PIVOT_TOLERANCE) {
                continue;
            }
            if (fallback == null) {
                fallback = start;
            }
            double[] image = multiply(matrix, start);
            orthogonalize(image, excluded, excludedCount);
            if (norm(image) > vanishing) {
                vector = start;
            }
        }
        if (vector == null) {
            // the allowed subspace is empty or carries no variance
            return new EigenPair(0, (fallback == null) ? new double[n] : fallback);
        }

        double eigenvalue = dot(vector, multiply(matrix, vector));
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            deadline.checkEvery(iteration);
            double[] next = multiply(matrix, vector);
            orthogonalize(next, excluded, excludedCount);
            if (normalize(next) <= vanishing) {
                return new EigenPair(0, vector);
            }
            double updated = dot(next, multiply(matrix, next));
            vector = next;
            boolean converged = abs(updated - eigenvalue) <= tolerance * Math.max(1.0, abs(updated));
            eigenvalue = updated;
            if (converged) {
                break;
            }
        }
        return new EigenPair(eigenvalue, vector);
    }

    // candidate -1 is the tilted all ones vector, otherwise a coordinate vector
    private static double[] startVector(int n, int candidate) {
        double[] start = new double[n];
        if (candidate < 0) {
            for (int i = 0; i < n; i++) {
                start[i] = 1.0 + 0.01 * (i + 1) / n;
            }
        } else {
            start[candidate] = 1.0;
        }
        return start;
    }

    public static EigenPair dominantEigenPair(double[][] matrix, Deadline deadline) {
        return dominantEigenPair(matrix, null, 0, DEFAULT_POWER_ITERATIONS, DEFAULT_EIGEN_TOLERANCE, deadline);
    }
}
