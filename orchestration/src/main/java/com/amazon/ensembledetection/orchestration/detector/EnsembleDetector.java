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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.PayloadAdapter;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * The lightweight baseline. Each value of the numeric projection is scored by
 * three robust univariate rules and the value score is their mean:
 * <ul>
 * <li>the absolute z-score over 3</li>
 * <li>the modified z-score 0.6745 |x - median| / MAD over 3.5</li>
 * <li>the excess beyond the 1.5 IQR fences, 0.5 at the fence rising to 1 one
 * IQR further out</li>
 * </ul>
 */
public class EnsembleDetector extends AbstractDetector {

    public static final double Z_SCALE = 3.0;

    public static final double MAD_CONSTANT = 0.6745;

    public static final double MAD_SCALE = 3.5;

    public static final double FENCE = 1.5;

    public EnsembleDetector() {
        super(DetectionMethod.ENSEMBLE);
    }

    @Override
    public DetectionMethodResult detect(List<?> payload, DetectionContext context) {
        double[] values = PayloadAdapter.of(payload).numericProjection();
        double[] z = zScores(values);
        double[] mad = madScores(values);
        double[] iqr = iqrScores(values);
        int n = values.length;
        double[] scores = new double[n];
        boolean[] flags = new boolean[n];
        double[] confidences = new double[n];
        int top = -1;
        for (int i = 0; i < n; i++) {
            context.getDeadline().checkEvery(i);
            scores[i] = (z[i] + mad[i] + iqr[i]) / 3;
            flags[i] = scores[i] > context.getThreshold();
            confidences[i] = confidenceOf(scores[i]);
            if (top < 0 || scores[i] > scores[top]) {
                top = i;
            }
        }

        Map<String, Double> diagnostics = new LinkedHashMap<>();
        diagnostics.put("maxZScore", max(z));
        diagnostics.put("maxMadScore", max(mad));
        diagnostics.put("maxIqrScore", max(iqr));
        List<String> explanations = new ArrayList<>();
        int flagged = 0;
        for (boolean flag : flags) {
            flagged += flag ? 1 : 0;
        }
        if (flagged > 0) {
            explanations.add(flagged + " of " + n + " values exceed the ensemble threshold");
            explanations.add(String.format("Largest ensemble score %.3f at index %d", scores[top], top));
        } else {
            explanations.add("All values within normal range");
        }
        return aggregate(scores, flags, confidences, diagnostics, explanations);
    }

    static double[] zScores(double[] values) {
        double[] scores = new double[values.length];
        double mean = StatMath.mean(values);
        double deviation = StatMath.standardDeviation(values);
        if (deviation > 0) {
            for (int i = 0; i < values.length; i++) {
                scores[i] = clipToUnit(Math.abs(values[i] - mean) / deviation / Z_SCALE);
            }
        }
        return scores;
    }

    /**
     * a zero MAD flags every value away from the median with score 1
     */
    static double[] madScores(double[] values) {
        double[] scores = new double[values.length];
        if (values.length == 0) {
            return scores;
        }
        double median = StatMath.median(values);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = StatMath.median(deviations);
        for (int i = 0; i < values.length; i++) {
            if (mad > 0) {
                scores[i] = clipToUnit(MAD_CONSTANT * deviations[i] / mad / MAD_SCALE);
            } else {
                scores[i] = (deviations[i] > 0) ? 1 : 0;
            }
        }
        return scores;
    }

    static double[] iqrScores(double[] values) {
        double[] scores = new double[values.length];
        if (values.length == 0) {
            return scores;
        }
        double q1 = StatMath.quantile(values, 0.25);
        double q3 = StatMath.quantile(values, 0.75);
        double range = q3 - q1;
        double lower = q1 - FENCE * range;
        double upper = q3 + FENCE * range;
        for (int i = 0; i < values.length; i++) {
            double excess = Math.max(lower - values[i], values[i] - upper);
            if (excess > 0) {
                scores[i] = (range > 0) ? Math.min(1, 0.5 + 0.5 * excess / range) : 1;
            }
        }
        return scores;
    }

    private static double max(double[] values) {
        double max = 0;
        for (double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }
}
