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

package com.amazon.ensembledetection.orchestration;

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.pattern.Graph;

/**
 * Classifies a payload and summarizes it in a {@link DataProfile}. The analyzer
 * is stateless; a payload it cannot make sense of is reported as
 * {@link DataType#MIXED} rather than rejected.
 */
public class DataCharacteristicsAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(DataCharacteristicsAnalyzer.class);

    public static final int MAX_SEASONALITY_LAG = 50;

    public static final double OUTLIER_FENCE = 1.5;

    public static final int STATIONARITY_WINDOWS = 4;

    public static final int MIN_STATIONARITY_WINDOW = 10;

    public static final double STATIONARITY_RATIO = 0.5;

    public static final double TEMPORAL_SEASONALITY = 0.3;

    public static final double STRONG_SEASONALITY = 0.5;

    // payloads longer than this may use the multivariate method
    public static final int HEAVYWEIGHT_LENGTH = 100;

    public static final double REGULAR_INTERVAL_TOLERANCE = 0.1;

    public static final double GAP_FACTOR = 3.0;

    public static final double HIGH_CORRELATION = 0.8;

    public static final double CONNECTED_DENSITY = 0.1;

    public static final double SPARSE_DENSITY = 0.3;

    /**
     * @param payload the raw request payload
     * @return the profile of the payload
     */
    public DataProfile classify(List<?> payload) {
        checkNotNull(payload, "payload must not be null");
        try {
            return classify(PayloadAdapter.of(payload));
        } catch (RuntimeException e) {
            logger.warn("could not characterize payload of {} elements, treating it as mixed: {}", payload.size(),
                    e.getMessage());
            List<DetectionMethod> methods = new ArrayList<>();
            methods.add(DetectionMethod.ENSEMBLE);
            methods.add(DetectionMethod.PATTERN_RECOGNITION);
            return DataProfile.builder().dataType(DataType.MIXED).length(payload.size()).stationary(true)
                    .featureNames(Collections.emptyList()).featureCorrelations(Collections.emptyList())
                    .recommendedMethods(Collections.unmodifiableList(methods)).build();
        }
    }

    DataProfile classify(PayloadAdapter adapter) {
        DataType type = adapter.getDataType();
        double[] values = adapter.numericProjection();
        DataProfile.DataProfileBuilder profile = DataProfile.builder().dataType(type).length(adapter.size())
                .featureNames(Collections.emptyList()).featureCorrelations(Collections.emptyList());

        double trend = StatMath.linearTrend(values);
        double seasonality = seasonality(values);
        boolean outliers = hasOutliers(values);
        if (values.length > 0) {
            double variance = StatMath.variance(values);
            profile.mean(StatMath.mean(values)).variance(variance).standardDeviation(Math.sqrt(variance));
        }
        profile.trend(trend).seasonality(seasonality).outliers(outliers).stationary(isStationary(values));

        if (type == DataType.TIMESERIES) {
            describeTimeSeries(adapter.timeSeries(), profile);
        } else if (type == DataType.MULTIVARIATE) {
            describeFeatures(adapter.multivariate(), profile);
        } else if (type == DataType.GRAPH) {
            Graph graph = adapter.graph().toGraph();
            double density = graph.density();
            profile.nodeCount(graph.size()).edgeCount(graph.getEdgeCount()).density(density)
                    .connected(density > CONNECTED_DENSITY).sparse(density < SPARSE_DENSITY);
        }

        profile.recommendedMethods(recommend(type, adapter.size(), trend, seasonality, outliers));
        DataProfile result = profile.build();
        logger.debug("classified payload of {} elements as {}, recommended {}", result.getLength(), type,
                result.getRecommendedMethods());
        return result;
    }

    static List<DetectionMethod> recommend(DataType type, int length, double trend, double seasonality,
            boolean outliers) {
        Set<DetectionMethod> methods = new LinkedHashSet<>();
        methods.add(DetectionMethod.ENSEMBLE);
        switch (type) {
        case UNIVARIATE:
            if (trend != 0 || seasonality > TEMPORAL_SEASONALITY) {
                methods.add(DetectionMethod.TIME_SERIES);
            }
            if (outliers) {
                methods.add(DetectionMethod.PATTERN_RECOGNITION);
            }
            break;
        case TIMESERIES:
            methods.add(DetectionMethod.TIME_SERIES);
            if (seasonality > STRONG_SEASONALITY || outliers) {
                methods.add(DetectionMethod.PATTERN_RECOGNITION);
            }
            break;
        case MULTIVARIATE:
            methods.add(DetectionMethod.MULTIVARIATE);
            break;
        case GRAPH:
            methods.add(DetectionMethod.PATTERN_RECOGNITION);
            break;
        default:
            methods.add(DetectionMethod.PATTERN_RECOGNITION);
        }
        if (length > HEAVYWEIGHT_LENGTH && type != DataType.GRAPH) {
            methods.add(DetectionMethod.MULTIVARIATE);
        }
        return Collections.unmodifiableList(new ArrayList<>(methods));
    }

    /**
     * maximum absolute autocorrelation over the lags 1..min(n/3, 50)
     */
    static double seasonality(double[] values) {
        double max = 0;
        for (int lag = 1; lag <= Math.min(values.length / 3, MAX_SEASONALITY_LAG); lag++) {
            max = Math.max(max, Math.abs(StatMath.autocorrelation(values, lag)));
        }
        return max;
    }

    static boolean hasOutliers(double[] values) {
        if (values.length == 0) {
            return false;
        }
        double q1 = StatMath.quantile(values, 0.25);
        double q3 = StatMath.quantile(values, 0.75);
        double fence = OUTLIER_FENCE * (q3 - q1);
        for (double value : values) {
            if (value < q1 - fence || value > q3 + fence) {
                return true;
            }
        }
        return false;
    }

    /**
     * Compares the variances of four equal windows. Series too short for windows
     * of at least 10 values, and series whose windows are all flat, count as
     * stationary.
     */
    static boolean isStationary(double[] values) {
        int window = values.length / STATIONARITY_WINDOWS;
        if (window < MIN_STATIONARITY_WINDOW) {
            return true;
        }
        double[] variances = new double[STATIONARITY_WINDOWS];
        for (int i = 0; i < STATIONARITY_WINDOWS; i++) {
            variances[i] = StatMath.variance(Arrays.copyOfRange(values, i * window, (i + 1) * window));
        }
        double meanVariance = StatMath.mean(variances);
        if (meanVariance == 0) {
            return true;
        }
        return StatMath.variance(variances) / meanVariance < STATIONARITY_RATIO;
    }

    static void describeTimeSeries(List<TimeSeriesPoint> points, DataProfile.DataProfileBuilder profile) {
        int n = points.size();
        if (n < 2) {
            profile.regular(true);
            return;
        }
        double[] intervals = new double[n - 1];
        double[] values = new double[n];
        values[0] = points.get(0).getValue();
        for (int i = 1; i < n; i++) {
            intervals[i - 1] = points.get(i).getTimestamp() - points.get(i - 1).getTimestamp();
            values[i] = points.get(i).getValue();
        }
        double average = StatMath.mean(intervals);
        boolean regular = true;
        boolean gaps = false;
        for (double interval : intervals) {
            regular &= Math.abs(interval - average) < Math.abs(average) * REGULAR_INTERVAL_TOLERANCE;
            gaps |= interval > average * GAP_FACTOR;
        }
        profile.regular(regular).averageInterval(average).gaps(gaps).volatility(volatility(values));
    }

    /**
     * standard deviation of the relative changes between consecutive values,
     * skipping changes from 0
     */
    static double volatility(double[] values) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < values.length; i++) {
            if (values[i - 1] != 0) {
                returns.add((values[i] - values[i - 1]) / values[i - 1]);
            }
        }
        if (returns.isEmpty()) {
            return 0;
        }
        double[] array = new double[returns.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = returns.get(i);
        }
        return StatMath.standardDeviation(array);
    }

    static void describeFeatures(List<MultivariateDataPoint> points, DataProfile.DataProfileBuilder profile) {
        if (points.isEmpty()) {
            return;
        }
        List<String> names = new ArrayList<>(points.get(0).getFeatures().keySet());
        int d = names.size();
        double[][] columns = new double[d][points.size()];
        int zeros = 0;
        for (int i = 0; i < points.size(); i++) {
            double[] vector = points.get(i).toVector(names);
            for (int j = 0; j < d; j++) {
                columns[j][i] = vector[j];
                if (vector[j] == 0) {
                    ++zeros;
                }
            }
        }
        List<Double> correlations = new ArrayList<>();
        double max = 0;
        for (int a = 0; a < d; a++) {
            for (int b = a + 1; b < d; b++) {
                double r = Math.abs(StatMath.correlation(columns[a], columns[b]));
                correlations.add(r);
                max = Math.max(max, r);
            }
        }
        int total = d * points.size();
        profile.featureCount(d).featureNames(Collections.unmodifiableList(names))
                .featureCorrelations(Collections.unmodifiableList(correlations)).maxCorrelation(max)
                .highlyCorrelated(max > HIGH_CORRELATION).sparsity((total == 0) ? 0 : zeros / (double) total);
    }
}
