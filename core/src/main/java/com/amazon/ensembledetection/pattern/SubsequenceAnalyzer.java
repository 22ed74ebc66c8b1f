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

package com.amazon.ensembledetection.pattern;

import static com.amazon.ensembledetection.CommonUtils.checkArgument;
import static com.amazon.ensembledetection.CommonUtils.clipToUnit;
import static java.lang.Math.abs;
import static java.lang.Math.log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.util.Deadline;

/**
 * Sliding window analysis of a sequence. Every window is compared with the
 * whole series on three statistics: the shift of its mean from the global
 * mean, the log ratio of its variance to the global variance, and the
 * difference of its trend from the global trend. Each deviation is
 * standardized against the same deviation across all windows, divided by 3 and
 * clipped to [0,1]; the window score is the average of the three.
 */
public class SubsequenceAnalyzer {

    public static final int MAX_AUTOCORRELATION_LAG = 9;

    public static final int MAX_LOCAL_HALF_WIDTH = 10;

    // keeps the log variance ratio finite for flat windows
    static final double VARIANCE_FLOOR = 1e-12;

    // relative spread below which deviations are rounding noise
    static final double SPREAD_TOLERANCE = 1e-9;

    private final int windowSize;

    private final double anomalyThreshold;

    private final double periodicityThreshold;

    public SubsequenceAnalyzer(int windowSize, double anomalyThreshold, double periodicityThreshold) {
        checkArgument(windowSize >= 2, "window size must be at least 2");
        checkArgument(anomalyThreshold > 0 && anomalyThreshold < 1, "threshold must be in (0,1)");
        this.windowSize = windowSize;
        this.anomalyThreshold = anomalyThreshold;
        this.periodicityThreshold = periodicityThreshold;
    }

    /**
     * @param values   the series, at least 2 values
     * @param deadline cooperative cancellation token
     * @return one entry per window start, in order; a series shorter than the
     *         window is treated as a single window
     */
    public List<Subsequence> analyze(double[] values, Deadline deadline) {
        int n = values.length;
        if (n < 2) {
            return Collections.emptyList();
        }
        int width = Math.min(windowSize, n);
        int count = n - width + 1;
        double globalMean = StatMath.mean(values);
        double globalVariance = StatMath.variance(values);
        double globalTrend = StatMath.linearTrend(values);

        double[][] windows = new double[count][];
        double[] means = new double[count];
        double[] deviations = new double[count];
        double[] trends = new double[count];
        double[] meanShift = new double[count];
        double[] varianceRatio = new double[count];
        double[] trendDifference = new double[count];
        for (int start = 0; start < count; start++) {
            deadline.checkEvery(start);
            windows[start] = Arrays.copyOfRange(values, start, start + width);
            means[start] = StatMath.mean(windows[start]);
            double variance = StatMath.variance(windows[start]);
            deviations[start] = Math.sqrt(variance);
            trends[start] = StatMath.linearTrend(windows[start]);
            meanShift[start] = means[start] - globalMean;
            varianceRatio[start] = log((variance + VARIANCE_FLOOR) / (globalVariance + VARIANCE_FLOOR));
            trendDifference[start] = trends[start] - globalTrend;
        }
        double[] meanScores = standardize(meanShift);
        double[] varianceScores = standardize(varianceRatio);
        double[] trendScores = standardize(trendDifference);

        List<Subsequence> result = new ArrayList<>(count);
        for (int start = 0; start < count; start++) {
            double score = (meanScores[start] + varianceScores[start] + trendScores[start]) / 3;
            SubsequenceType type;
            if (score > anomalyThreshold) {
                type = SubsequenceType.ANOMALOUS;
            } else if (maxAutocorrelation(windows[start]) > periodicityThreshold) {
                type = SubsequenceType.PERIODIC;
            } else {
                type = SubsequenceType.NORMAL;
            }
            result.add(new Subsequence(start, start + width, score, type, means[start], deviations[start],
                    trends[start]));
        }
        return Collections.unmodifiableList(result);
    }

    // absolute z-score of each entry among all entries, over 3, clipped
    static double[] standardize(double[] deviations) {
        double mean = StatMath.mean(deviations);
        double spread = StatMath.standardDeviation(deviations);
        double scale = 1.0;
        for (double deviation : deviations) {
            scale = Math.max(scale, abs(deviation));
        }
        double[] scores = new double[deviations.length];
        if (spread <= SPREAD_TOLERANCE * scale) {
            return scores;
        }
        for (int i = 0; i < deviations.length; i++) {
            scores[i] = clipToUnit(abs(deviations[i] - mean) / spread / 3);
        }
        return scores;
    }

    static double maxAutocorrelation(double[] window) {
        double max = 0;
        for (int lag = 1; lag <= Math.min(MAX_AUTOCORRELATION_LAG, window.length - 1); lag++) {
            max = Math.max(max, StatMath.autocorrelation(window, lag));
        }
        return max;
    }

    /**
     * z-score of each value against its neighborhood of half width min(10, n/10)
     * (at least 1), over 3 and clipped to [0,1]
     */
    public static double[] localScores(double[] values) {
        int n = values.length;
        int halfWidth = Math.max(1, Math.min(MAX_LOCAL_HALF_WIDTH, n / 10));
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            double[] neighborhood = Arrays.copyOfRange(values, Math.max(0, i - halfWidth),
                    Math.min(n, i + halfWidth + 1));
            double deviation = StatMath.standardDeviation(neighborhood);
            scores[i] = (deviation > 0)
                    ? clipToUnit(abs(values[i] - StatMath.mean(neighborhood)) / deviation / 3)
                    : 0;
        }
        return scores;
    }

    public int getWindowSize() {
        return windowSize;
    }
}
