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

package com.amazon.ensembledetection.orchestration.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.DetectionOrchestrator;
import com.amazon.ensembledetection.orchestration.DetectionRequest;
import com.amazon.ensembledetection.orchestration.DetectionResult;
import com.amazon.ensembledetection.orchestration.RunConfiguration;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.fusion.FusedAnomalyResult;

/**
 * Reads delimited numeric rows, runs them through a
 * {@link DetectionOrchestrator} as one request and writes the verdict as
 * {@code key: value} lines. A single column is read as a univariate series;
 * several columns are read as multivariate points named by the header row, or
 * {@code f0, f1, ...} without one.
 */
public class DetectionRunner {

    public static final String REQUEST_ID = "stdin";

    protected final ArgumentParser argumentParser;
    protected int lineNumber;
    protected int columns;
    protected List<String> featureNames;

    public DetectionRunner() {
        this(new ArgumentParser(DetectionRunner.class.getName(),
                "Detect anomalies in the input rows and print the fused verdict."));
    }

    public DetectionRunner(ArgumentParser argumentParser) {
        this.argumentParser = argumentParser;
    }

    public static void main(String... args) throws IOException {
        DetectionRunner runner = new DetectionRunner();
        runner.parse(args);
        System.out.println("Reading from stdin... (Ctrl-d to finish)");
        runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        System.out.println("Done.");
    }

    public void parse(String... arguments) {
        argumentParser.parse(arguments);
    }

    public void run(BufferedReader in, PrintWriter out) throws IOException {
        List<Object> payload = new ArrayList<>();
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            String[] values = line.split(argumentParser.getDelimiter());
            if (featureNames == null) {
                prepareColumns(values);
                if (argumentParser.getHeaderRow()) {
                    continue;
                }
            }
            payload.add(processLine(values));
        }

        DetectionResult result = buildOrchestrator().detect(buildRequest(payload));
        writeResult(result, out);
        out.flush();
    }

    protected void prepareColumns(String[] values) {
        columns = values.length;
        featureNames = new ArrayList<>(columns);
        for (int i = 0; i < columns; i++) {
            featureNames.add(argumentParser.getHeaderRow() ? values[i].trim() : "f" + i);
        }
    }

    protected Object processLine(String[] values) {
        if (values.length != columns) {
            throw new IllegalArgumentException(String.format(
                    "Wrong number of values on line %d. Expected %d but found %d.", lineNumber, columns,
                    values.length));
        }
        if (columns == 1) {
            return Double.parseDouble(values[0].trim());
        }
        Map<String, Double> features = new LinkedHashMap<>();
        for (int i = 0; i < columns; i++) {
            features.put(featureNames.get(i), Double.parseDouble(values[i].trim()));
        }
        return new MultivariateDataPoint(features);
    }

    protected DetectionOrchestrator buildOrchestrator() {
        DetectionOrchestrator.Builder<?> builder = DetectionOrchestrator.builder().preset(argumentParser.getPreset())
                .parallelExecutionEnabled(argumentParser.getParallel()).randomSeed(argumentParser.getRandomSeed());
        argumentParser.getFusionStrategy().ifPresent(builder::fusionStrategy);
        return builder.build();
    }

    protected DetectionRequest buildRequest(List<Object> payload) {
        RunConfiguration.Builder<?> configuration = RunConfiguration.builder();
        argumentParser.getThreshold().ifPresent(configuration::threshold);
        return DetectionRequest.builder().id(REQUEST_ID).payload(payload).priority(argumentParser.getPriority())
                .methods(argumentParser.getMethods()).configuration(configuration.build()).source("runner").build();
    }

    protected void writeResult(DetectionResult result, PrintWriter out) {
        FusedAnomalyResult fused = result.getFusedResult();
        out.println("requestId: " + result.getRequestId());
        out.println("state: " + result.getState());
        out.println("dataType: " + result.getProfile().getDataType());
        out.println("anomaly: " + fused.isAnomaly());
        out.println("severity: " + fused.getSeverity());
        out.println(String.format("score: %.3f", fused.getFusedScore()));
        out.println(String.format("confidence: %.3f", fused.getConfidenceScore()));
        out.println(String.format("consensus: %.3f", fused.getConsensusScore()));
        StringJoiner methods = new StringJoiner(",");
        for (DetectionMethod method : result.getSelectedMethods()) {
            methods.add(method.getWireName());
        }
        out.println("methods: " + methods.toString());
        for (DetectionMethodResult methodResult : result.getMethodResults()) {
            out.println(String.format("score.%s: %.3f", methodResult.getMethod().getWireName(),
                    methodResult.getScore()));
        }
        for (Map.Entry<DetectionMethod, String> failure : result.getFailures().entrySet()) {
            out.println("failed." + failure.getKey().getWireName() + ": " + failure.getValue());
        }
        for (String explanation : fused.getExplanations()) {
            out.println("explanation: " + explanation);
        }
        for (String recommendation : fused.getRecommendations()) {
            out.println("recommendation: " + recommendation);
        }
    }
}
