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

package com.amazon.ensembledetection.orchestration.detector;

import static com.amazon.ensembledetection.CommonUtils.clipToUnit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.PayloadAdapter;
import com.amazon.ensembledetection.orchestration.TimeSeriesPoint;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.util.Deadline;

/**
 * The temporal method. The series is decomposed into a centered moving average
 * trend, a seasonal component and a residual; the residual is scored by its
 * z-score and the standardized series is scanned with a two sided CUSUM for
 * level changes. An index scores the larger of the two.
 */
public class TimeSeriesDetector extends AbstractDetector {

    public static final int MAX_PERIOD = 168;

    public static final double MIN_SEASONAL_AUTOCORRELATION = 0.3;

    public static final int DEFAULT_TREND_WINDOW = 5;

    public static final double CUSUM_SLACK = 0.5;

    public static final double CUSUM_THRESHOLD = 3.0;

    public static final double CHANGE_POINT_SCORE = 0.9;

    public TimeSeriesDetector() {
        super(DetectionMethod.TIME_SERIES);
    }

    @Override
    public DetectionMethodResult detect(List<?> payload, DetectionContext context) {
        List<TimeSeriesPoint> points = PayloadAdapter.of(payload).timeSeries();
        int n = points.size();
        if (n < 2) {
            return aggregate(new double[0], new boolean[0], new double[0], Collections.emptyMap(),
                    Collections.singletonList("Series too short for temporal analysis"));
        }
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = points.get(i).getValue();
        }
        Deadline deadline = context.getDeadline();

        int period = detectPeriod(values, deadline);
        double[] trend = movingAverage(values, (period > 0) ? period : DEFAULT_TREND_WINDOW);
        double[] seasonal = seasonal(values, trend, period);
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        double residualMean = StatMath.mean(residual);
        double residualDeviation = StatMath.standardDeviation(residual);
        double[] changeScores = changePointScores(values, deadline);

        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        double[] confidences = new double[n];
        int changePoints = 0;
        int firstChange = -1;
        int top = 0;
        for (int i = 0; i < n; i++) {
            double residualScore = (residualDeviation > 0)
                    ? clipToUnit(Math.abs(residual[i] - residualMean) / residualDeviation / 3)
                    : 0;
            scores[i] = Math.max(residualScore, changeScores[i]);
            flags[i] = scores[i] > context.getThreshold();
            confidences[i] = confidenceOf(scores[i]);
            if (changeScores[i] > 0) {
                ++changePoints;
                if (firstChange < 0) {
                    firstChange = i;
                }
            }
            if (scores[i] > scores[top]) {
                top = i;
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("period", (double) period);
        diagnostics.put("changePoints", (double) changePoints);
        diagnostics.put("residualStandardDeviation", residualDeviation);
        List<String> explanations = new ArrayList<>();
        explanations.add((period > 0) ? "Seasonal period of " + period + " detected" : "No seasonal period detected");
        if (changePoints > 0) {
            explanations.add(changePoints + " change points detected, first at index " + firstChange);
        }
        if (flags[top]) {
            explanations.add(String.format("Largest temporal deviation at index %d with score %.3f", top, scores[top]));
        }
        return aggregate(scores, flags, confidences, diagnostics, explanations);
    }

    /**
     * @return the lag in 2..min(n/3, 168) with the largest autocorrelation, or 0
     *         if no lag exceeds 0.3
     */
    static int detectPeriod(double[] values, Deadline deadline) {
        int best = 0;
        double bestCorrelation = MIN_SEASONAL_AUTOCORRELATION;
        for (int lag = 2; lag <= Math.min(values.length / 3, MAX_PERIOD); lag++) {
            deadline.checkEvery(lag);
            double correlation = StatMath.autocorrelation(values, lag);
            if (correlation > bestCorrelation) {
                bestCorrelation = correlation;
                best = lag;
            }
        }
        return best;
    }

    /**
     * centered moving average; an even window is widened by one and the window
     * shrinks near the ends of the series
     */
    static double[] movingAverage(double[] values, int window) {
        int n = values.length;
        int width = Math.min((window % 2 == 0) ? window + 1 : window, n);
        int half = width / 2;
        double[] result = new double[n];
        for (int i = 0; i < n; i++) {
            int from = Math.max(0, i - half);
            int to = Math.min(n, i + half + 1);
            double sum = 0;
            for (int j = from; j < to; j++) {
                sum += values[j];
            }
            result[i] = sum / (to - from);
        }
        return result;
    }

    /**
     * per-phase means of the detrended series, centered to sum to zero over a
     * period; all zero without a period
     */
    static double[] seasonal(double[] values, double[] trend, int period) {
        int n = values.length;
        double[] result = new double[n];
        if (period <= 0) {
            return result;
        }
        double[] phaseSum = new double[period];
        int[] phaseCount = new int[period];
        for (int i = 0; i < n; i++) {
            phaseSum[i % period] += values[i] - trend[i];
            ++phaseCount[i % period];
        }
        double[] phaseMean = new double[period];
        for (int p = 0; p < period; p++) {
            phaseMean[p] = (phaseCount[p] > 0) ? phaseSum[p] / phaseCount[p] : 0;
        }
        double center = StatMath.mean(phaseMean);
        for (int i = 0; i < n; i++) {
            result[i] = phaseMean[i % period] - center;
        }
        return result;
    }

    /**
     * Two sided CUSUM over the standardized series. When either sum exceeds the
     * threshold a change point is recorded at that index with score 0.9 times the
     * confidence min(sum / 3, 1), and both sums restart.
     */
    static double[] changePointScores(double[] values, Deadline deadline) {
        int n = values.length;
        double[] scores = new double[n];
        double mean = StatMath.mean(values);
        double deviation = StatMath.standardDeviation(values);
        if (deviation == 0) {
            return scores;
        }
        double upper = 0;
        double lower = 0;
        for (int i = 0; i < n; i++) {
            deadline.checkEvery(i);
            double z = (values[i] - mean) / deviation;
            upper = Math.max(0, upper + z - CUSUM_SLACK);
            lower = Math.max(0, lower - z - CUSUM_SLACK);
            if (upper > CUSUM_THRESHOLD || lower > CUSUM_THRESHOLD) {
                double confidence = Math.min(Math.max(upper, lower) / 3, 1);
                scores[i] = CHANGE_POINT_SCORE * confidence;
                upper = 0;
                lower = 0;
            }
        }
        return scores;
    }
}
