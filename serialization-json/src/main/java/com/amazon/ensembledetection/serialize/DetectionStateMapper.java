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

package com.amazon.ensembledetection.serialize;

import static com.amazon.ensembledetection.CommonUtils.checkArgument;
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.Getter;
import lombok.Setter;

import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.orchestration.DataProfile;
import com.amazon.ensembledetection.orchestration.DataType;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.DetectionRequest;
import com.amazon.ensembledetection.orchestration.DetectionResult;
import com.amazon.ensembledetection.orchestration.PayloadAdapter;
import com.amazon.ensembledetection.orchestration.PerformanceMetrics;
import com.amazon.ensembledetection.orchestration.Priority;
import com.amazon.ensembledetection.orchestration.RunConfiguration;
import com.amazon.ensembledetection.orchestration.TimeSeriesPoint;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.config.FusionStrategy;
import com.amazon.ensembledetection.orchestration.fusion.FusedAnomalyResult;
import com.amazon.ensembledetection.pattern.GraphEdge;
import com.amazon.ensembledetection.pattern.GraphNode;

/**
 * A utility class for creating state objects from requests, results and
 * profiles, and for creating a {@link DetectionRequest} from its state.
 * Methods are written by wire name, other enumerated values by lower case
 * name.
 */
@Getter
@Setter
public class DetectionStateMapper {

    public static final String VERSION = "1.0";

    /**
     * If true, the per method results are written along with the fused
     * verdict. They are written by default.
     */
    private boolean saveMethodResultsEnabled = true;

    /**
     * If true, the data profile is written along with the verdict. It is
     * written by default.
     */
    private boolean saveProfileEnabled = true;

    public DetectionRequestState toState(DetectionRequest request) {
        checkNotNull(request, "request must not be null");
        DetectionRequestState state = new DetectionRequestState();
        state.setId(request.getId());
        List<Object> payload = new ArrayList<>(request.getPayload().size());
        for (Object element : request.getPayload()) {
            payload.add(toWire(element));
        }
        state.setPayload(payload);
        state.setPriority(lowerCase(request.getPriority().name()));
        List<String> methods = new ArrayList<>();
        for (DetectionMethod method : request.getMethods()) {
            methods.add(method.getWireName());
        }
        state.setMethods(methods);
        state.setSubmittedAt(request.getSubmittedAt());
        state.setSource(request.getSource().orElse(null));
        request.getConfiguration().ifPresent(configuration -> {
            configuration.getFusionStrategy().ifPresent(strategy -> state.setFusionStrategy(strategy.getWireName()));
            configuration.getThreshold().ifPresent(state::setThreshold);
            configuration.getMaxProcessingTime().ifPresent(time -> state.setMaxProcessingTimeMillis(time.toMillis()));
            configuration.getMaxMemoryBytes().ifPresent(state::setMaxMemoryBytes);
        });
        return state;
    }

    /**
     * @param state a request state, typically read from JSON
     * @return the request it describes
     * @throws IllegalArgumentException if the version is unknown, the id is
     *                                  missing or a name does not match any
     *                                  method, strategy or priority
     * @throws NullPointerException     if the payload is missing
     */
    public DetectionRequest toModel(DetectionRequestState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getVersion() == null || VERSION.equals(state.getVersion()),
                "unsupported request version: " + state.getVersion());

        List<DetectionMethod> methods = new ArrayList<>();
        if (state.getMethods() != null) {
            for (String name : state.getMethods()) {
                methods.add(DetectionMethod.fromName(name));
            }
        }

        RunConfiguration configuration = null;
        if (state.getFusionStrategy() != null || state.getThreshold() != null
                || state.getMaxProcessingTimeMillis() != null || state.getMaxMemoryBytes() != null) {
            RunConfiguration.Builder<?> builder = RunConfiguration.builder();
            if (state.getFusionStrategy() != null) {
                builder.fusionStrategy(FusionStrategy.fromName(state.getFusionStrategy()));
            }
            if (state.getThreshold() != null) {
                builder.threshold(state.getThreshold());
            }
            if (state.getMaxProcessingTimeMillis() != null) {
                builder.maxProcessingTime(Duration.ofMillis(state.getMaxProcessingTimeMillis()));
            }
            if (state.getMaxMemoryBytes() != null) {
                builder.maxMemoryBytes(state.getMaxMemoryBytes());
            }
            configuration = builder.build();
        }

        return DetectionRequest.builder().id(state.getId()).payload(state.getPayload())
                .priority((state.getPriority() == null) ? null : Priority.fromName(state.getPriority()))
                .methods(methods).configuration(configuration).submittedAt(state.getSubmittedAt())
                .source(state.getSource()).build();
    }

    public DetectionResultState toState(DetectionResult result) {
        checkNotNull(result, "result must not be null");
        DetectionResultState state = new DetectionResultState();
        state.setRequestId(result.getRequestId());
        state.setState(lowerCase(result.getState().name()));
        if (saveProfileEnabled && result.getProfile() != null) {
            state.setProfile(toState(result.getProfile()));
        }
        state.setSelectedMethods(wireNames(result.getSelectedMethods()));
        if (saveMethodResultsEnabled && result.getMethodResults() != null) {
            List<MethodResultState> methodResults = new ArrayList<>();
            for (DetectionMethodResult methodResult : result.getMethodResults()) {
                methodResults.add(toState(methodResult));
            }
            state.setMethodResults(methodResults);
        }
        if (result.getFailures() != null) {
            Map<String, String> failures = new LinkedHashMap<>();
            result.getFailures().forEach((method, message) -> failures.put(method.getWireName(), message));
            state.setFailures(failures);
        }
        if (result.getFusedResult() != null) {
            state.setFusedResult(toState(result.getFusedResult()));
        }
        PerformanceMetrics performance = result.getPerformance();
        if (performance != null) {
            Map<String, Long> executionMillis = new LinkedHashMap<>();
            if (performance.getMethodExecutionMillis() != null) {
                performance.getMethodExecutionMillis()
                        .forEach((method, millis) -> executionMillis.put(method.getWireName(), millis));
            }
            state.setMethodExecutionMillis(executionMillis);
            state.setEstimatedMemoryBytes(performance.getEstimatedMemoryBytes());
            state.setSucceededMethods(performance.getSucceededMethods());
            state.setFailedMethods(performance.getFailedMethods());
        }
        state.setTotalProcessingMillis(result.getTotalProcessingMillis());
        state.setTimestamp(result.getTimestamp());
        return state;
    }

    public DataProfileState toState(DataProfile profile) {
        checkNotNull(profile, "profile must not be null");
        DataProfileState state = new DataProfileState();
        DataType type = profile.getDataType();
        state.setDataType((type == null) ? null : lowerCase(type.name()));
        state.setLength(profile.getLength());
        state.setMean(profile.getMean());
        state.setVariance(profile.getVariance());
        state.setStandardDeviation(profile.getStandardDeviation());
        state.setTrend(profile.getTrend());
        state.setSeasonality(profile.getSeasonality());
        state.setOutliers(profile.isOutliers());
        state.setStationary(profile.isStationary());
        if (type == DataType.TIMESERIES) {
            state.setRegular(profile.isRegular());
            state.setAverageInterval(profile.getAverageInterval());
            state.setGaps(profile.isGaps());
            state.setVolatility(profile.getVolatility());
        } else if (type == DataType.MULTIVARIATE) {
            state.setFeatureCount(profile.getFeatureCount());
            state.setFeatureNames(profile.getFeatureNames());
            state.setFeatureCorrelations(profile.getFeatureCorrelations());
            state.setMaxCorrelation(profile.getMaxCorrelation());
            state.setHighlyCorrelated(profile.isHighlyCorrelated());
            state.setSparsity(profile.getSparsity());
        } else if (type == DataType.GRAPH) {
            state.setNodeCount(profile.getNodeCount());
            state.setEdgeCount(profile.getEdgeCount());
            state.setDensity(profile.getDensity());
            state.setConnected(profile.isConnected());
            state.setSparse(profile.isSparse());
        }
        state.setRecommendedMethods(wireNames(profile.getRecommendedMethods()));
        return state;
    }

    MethodResultState toState(DetectionMethodResult result) {
        MethodResultState state = new MethodResultState();
        state.setMethod(result.getMethod().getWireName());
        state.setAnomaly(result.isAnomaly());
        state.setScore(result.getScore());
        state.setConfidence(result.getConfidence().orElse(null));
        state.setDiagnostics(result.getDiagnostics());
        state.setFlaggedIndices(result.getFlaggedIndices());
        state.setExplanations(result.getExplanations());
        state.setExecutionTimeMillis(result.getExecutionTimeMillis());
        return state;
    }

    FusedResultState toState(FusedAnomalyResult result) {
        FusedResultState state = new FusedResultState();
        state.setStrategy((result.getStrategy() == null) ? null : result.getStrategy().getWireName());
        state.setAnomaly(result.isAnomaly());
        state.setFusedScore(result.getFusedScore());
        state.setConfidenceScore(result.getConfidenceScore());
        state.setConsensusScore(result.getConsensusScore());
        state.setSeverity((result.getSeverity() == null) ? null : lowerCase(result.getSeverity().name()));
        state.setContributingMethods(result.getContributingMethods());
        state.setMethodScores(result.getMethodScores());
        state.setExplanations(result.getExplanations());
        state.setRecommendations(result.getRecommendations());
        return state;
    }

    /**
     * Writes a typed payload element as the map form the payload adapter reads
     * back. Graph nodes always carry their connections so that a node with
     * features is not read back as a multivariate point.
     */
    static Object toWire(Object element) {
        if (element instanceof TimeSeriesPoint) {
            TimeSeriesPoint point = (TimeSeriesPoint) element;
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(PayloadAdapter.TIMESTAMP, point.getTimestamp());
            map.put(PayloadAdapter.VALUE, point.getValue());
            return map;
        } else if (element instanceof MultivariateDataPoint) {
            MultivariateDataPoint point = (MultivariateDataPoint) element;
            Map<String, Object> map = new LinkedHashMap<>();
            if (point.getId() != null) {
                map.put(PayloadAdapter.ID, point.getId());
            }
            map.put(PayloadAdapter.TIMESTAMP, point.getTimestamp());
            map.put(PayloadAdapter.FEATURES, point.getFeatures());
            return map;
        } else if (element instanceof GraphEdge) {
            GraphEdge edge = (GraphEdge) element;
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(PayloadAdapter.SOURCE, edge.getSource());
            map.put(PayloadAdapter.TARGET, edge.getTarget());
            map.put(PayloadAdapter.WEIGHT, edge.getWeight());
            map.put(PayloadAdapter.TYPE, edge.getType());
            return map;
        } else if (element instanceof GraphNode) {
            GraphNode node = (GraphNode) element;
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(PayloadAdapter.ID, node.getId());
            map.put(PayloadAdapter.FEATURES, node.getFeatures());
            map.put(PayloadAdapter.CONNECTIONS, node.getConnections());
            map.put(PayloadAdapter.WEIGHT, node.getWeight());
            return map;
        }
        return element;
    }

    private static List<String> wireNames(List<DetectionMethod> methods) {
        if (methods == null) {
            return null;
        }
        List<String> names = new ArrayList<>(methods.size());
        for (DetectionMethod method : methods) {
            names.add(method.getWireName());
        }
        return names;
    }

    private static String lowerCase(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
