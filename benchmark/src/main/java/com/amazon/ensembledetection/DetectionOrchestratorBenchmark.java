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
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;

import com.amazon.ensembledetection.orchestration.DetectionOrchestrator;
import com.amazon.ensembledetection.orchestration.DetectionRequest;
import com.amazon.ensembledetection.orchestration.DetectionResult;
import com.amazon.ensembledetection.orchestration.config.ConfigurationPreset;
import com.amazon.ensembledetection.testutils.ExampleDataSets;

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@Fork(value = 1)
@State(Scope.Thread)
public class DetectionOrchestratorBenchmark {

    public final static int DATA_SIZE = 2000;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "STANDARD", "COMPREHENSIVE" })
        ConfigurationPreset preset;

        @Param({ "false", "true" })
        boolean parallelExecutionEnabled;

        List<Object> payload;
        DetectionOrchestrator orchestrator;
        int requests;

        @Setup(Level.Trial)
        public void setUp() {
            payload = new ArrayList<>(DATA_SIZE);
            for (double value : ExampleDataSets.seasonalSeries(DATA_SIZE, 24, 10, 1, 42L)) {
                payload.add(value);
            }
            orchestrator = DetectionOrchestrator.builder().preset(preset)
                    .parallelExecutionEnabled(parallelExecutionEnabled).randomSeed(99L).build();
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            orchestrator.shutdown();
        }
    }

    @Benchmark
    public DetectionResult detect(BenchmarkState state) {
        DetectionRequest request = DetectionRequest.builder().id("benchmark-" + state.requests++)
                .payload(state.payload).build();
        return state.orchestrator.detect(request);
    }
}
