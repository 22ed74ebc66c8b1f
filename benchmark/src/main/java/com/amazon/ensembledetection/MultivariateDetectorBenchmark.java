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

package com.amazon.ensembledetection;

import java.util.ArrayList;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.amazon.ensembledetection.multivariate.MultivariateAnomalyResult;
import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.multivariate.MultivariateDetector;
import com.amazon.ensembledetection.testutils.NormalMixtureTestData;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class MultivariateDetectorBenchmark {

    public final static int TRAINING_SIZE = 1000;

    public final static int DETECTION_SIZE = 500;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "3", "16" })
        int dimensions;

        List<MultivariateDataPoint> training;
        List<MultivariateDataPoint> queries;
        MultivariateDetector detector;

        @Setup(Level.Trial)
        public void setUpData() {
            NormalMixtureTestData testData = new NormalMixtureTestData();
            training = toPoints(testData.generateTestData(TRAINING_SIZE, dimensions, 17L));
            queries = toPoints(testData.generateTestData(DETECTION_SIZE, dimensions, 23L));
        }

        @Setup(Level.Invocation)
        public void setUpDetector() {
            detector = MultivariateDetector.builder().randomSeed(99L).build();
        }
    }

    static List<MultivariateDataPoint> toPoints(double[][] rows) {
        List<MultivariateDataPoint> points = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            points.add(MultivariateDataPoint.of(row));
        }
        return points;
    }

    @Benchmark
    public MultivariateDetector trainOnly(BenchmarkState state) {
        MultivariateDetector detector = state.detector;
        detector.train(state.training);
        return detector;
    }

    @Benchmark
    @OperationsPerInvocation(DETECTION_SIZE)
    public MultivariateDetector trainAndDetect(BenchmarkState state, Blackhole blackhole) {
        MultivariateDetector detector = state.detector;
        detector.train(state.training);
        for (MultivariateDataPoint point : state.queries) {
            MultivariateAnomalyResult result = detector.detect(point);
            blackhole.consume(result);
        }
        return detector;
    }
}
