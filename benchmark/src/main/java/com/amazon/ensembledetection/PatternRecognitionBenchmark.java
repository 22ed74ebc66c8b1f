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
import java.util.Collections;
import java.util.List;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.ensembledetection.pattern.GraphEdge;
import com.amazon.ensembledetection.pattern.GraphNode;
import com.amazon.ensembledetection.pattern.PatternAnomalyResult;
import com.amazon.ensembledetection.pattern.PatternRecognitionEngine;
import com.amazon.ensembledetection.testutils.ExampleDataSets;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class PatternRecognitionBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "500", "5000" })
        int length;

        @Param({ "20", "50" })
        int windowSize;

        double[] series;
        List<GraphEdge> ring;
        PatternRecognitionEngine engine;

        @Setup(Level.Trial)
        public void setUpData() {
            series = ExampleDataSets.seasonalSeries(length, 24, 10, 1, 42L);
            ring = new ArrayList<>();
            for (String[] edge : ExampleDataSets.ringGraph(length / 10)) {
                ring.add(new GraphEdge(edge[0], edge[1]));
            }
        }

        @Setup(Level.Invocation)
        public void setUpEngine() {
            engine = PatternRecognitionEngine.builder().windowSize(windowSize).build();
        }
    }

    @Benchmark
    public List<PatternAnomalyResult> analyzeSequence(BenchmarkState state) {
        return state.engine.analyzeSequence(state.series);
    }

    @Benchmark
    public List<PatternAnomalyResult> analyzeGraph(BenchmarkState state) {
        return state.engine.analyzeGraph(Collections.<GraphNode>emptyList(), state.ring);
    }
}
