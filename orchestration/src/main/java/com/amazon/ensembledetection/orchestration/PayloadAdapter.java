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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.pattern.Graph;
import com.amazon.ensembledetection.pattern.GraphEdge;
import com.amazon.ensembledetection.pattern.GraphNode;

/**
 * Converts a raw request payload into typed elements and offers the views the
 * detectors consume. Elements may be numbers, {@link TimeSeriesPoint}s,
 * {@link MultivariateDataPoint}s, {@link GraphNode}s, {@link GraphEdge}s or
 * string keyed maps describing one of these:
 * <ul>
 * <li>a map with {@code timestamp} and {@code value} is a time series point</li>
 * <li>a map with a {@code features} map and no {@code connections} is a
 * multivariate point</li>
 * <li>a map with {@code source} and {@code target} is a graph edge</li>
 * <li>a map with an {@code id} is a graph node</li>
 * </ul>
 * Anything else is kept as is and makes the payload {@link DataType#MIXED}.
 */
public class PayloadAdapter {

    public static final String TIMESTAMP = "timestamp";
    public static final String VALUE = "value";
    public static final String FEATURES = "features";
    public static final String SOURCE = "source";
    public static final String TARGET = "target";
    public static final String ID = "id";
    public static final String CONNECTIONS = "connections";
    public static final String WEIGHT = "weight";
    public static final String TYPE = "type";

    private final List<Object> elements;

    private final DataType dataType;

    private PayloadAdapter(List<Object> elements, DataType dataType) {
        this.elements = elements;
        this.dataType = dataType;
    }

    public static PayloadAdapter of(List<?> payload) {
        checkNotNull(payload, "payload must not be null");
        List<Object> elements = new ArrayList<>(payload.size());
        DataType common = null;
        boolean mixed = false;
        for (Object raw : payload) {
            Object element = toElement(raw);
            elements.add(element);
            DataType type = typeOf(element);
            if (common == null) {
                common = type;
            } else if (common != type) {
                mixed = true;
            }
        }
        DataType dataType = (common == null) ? DataType.UNIVARIATE : mixed ? DataType.MIXED : common;
        return new PayloadAdapter(Collections.unmodifiableList(elements), dataType);
    }

    static Object toElement(Object raw) {
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        if (!(raw instanceof Map)) {
            return raw;
        }
        Map<?, ?> map = (Map<?, ?>) raw;
        if (map.get(TIMESTAMP) instanceof Number && map.get(VALUE) instanceof Number) {
            return new TimeSeriesPoint(((Number) map.get(TIMESTAMP)).longValue(),
                    ((Number) map.get(VALUE)).doubleValue());
        }
        if (map.get(FEATURES) instanceof Map && !map.containsKey(CONNECTIONS)) {
            Map<String, Double> features = numericMap((Map<?, ?>) map.get(FEATURES));
            String id = (map.get(ID) == null) ? null : map.get(ID).toString();
            long timestamp = (map.get(TIMESTAMP) instanceof Number) ? ((Number) map.get(TIMESTAMP)).longValue() : 0L;
            return new MultivariateDataPoint(id, timestamp, features);
        }
        if (map.get(SOURCE) != null && map.get(TARGET) != null) {
            double weight = (map.get(WEIGHT) instanceof Number) ? ((Number) map.get(WEIGHT)).doubleValue() : 1.0;
            String type = (map.get(TYPE) == null) ? GraphEdge.DEFAULT_TYPE : map.get(TYPE).toString();
            return new GraphEdge(map.get(SOURCE).toString(), map.get(TARGET).toString(), weight, type);
        }
        if (map.get(ID) != null) {
            Map<String, Double> features = (map.get(FEATURES) instanceof Map)
                    ? numericMap((Map<?, ?>) map.get(FEATURES))
                    : Collections.emptyMap();
            List<String> connections = new ArrayList<>();
            if (map.get(CONNECTIONS) instanceof List) {
                for (Object connection : (List<?>) map.get(CONNECTIONS)) {
                    if (connection != null) {
                        connections.add(connection.toString());
                    }
                }
            }
            double weight = (map.get(WEIGHT) instanceof Number) ? ((Number) map.get(WEIGHT)).doubleValue() : 1.0;
            return new GraphNode(map.get(ID).toString(), features, connections, weight);
        }
        return raw;
    }

    private static Map<String, Double> numericMap(Map<?, ?> raw) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (entry.getValue() instanceof Number) {
                result.put(String.valueOf(entry.getKey()), ((Number) entry.getValue()).doubleValue());
            }
        }
        return result;
    }

    private static DataType typeOf(Object element) {
        if (element instanceof Double) {
            return DataType.UNIVARIATE;
        } else if (element instanceof TimeSeriesPoint) {
            return DataType.TIMESERIES;
        } else if (element instanceof MultivariateDataPoint) {
            return DataType.MULTIVARIATE;
        } else if (element instanceof GraphNode || element instanceof GraphEdge) {
            return DataType.GRAPH;
        }
        return DataType.MIXED;
    }

    public DataType getDataType() {
        return dataType;
    }

    public List<Object> getElements() {
        return elements;
    }

    public int size() {
        return elements.size();
    }

    /**
     * One number per element: numbers as is, time series points by value,
     * multivariate points by the sum of their features and other maps by a
     * numeric {@code value}; elements without a numeric reading are skipped. A
     * graph payload projects to the degree of each node in graph order.
     *
     * @return the numeric projection of the payload
     */
    public double[] numericProjection() {
        if (dataType == DataType.GRAPH) {
            Graph graph = graph().toGraph();
            double[] degrees = new double[graph.size()];
            for (int v = 0; v < degrees.length; v++) {
                degrees[v] = graph.degree(v);
            }
            return degrees;
        }
        List<Double> values = new ArrayList<>(elements.size());
        for (Object element : elements) {
            if (element instanceof Double) {
                values.add((Double) element);
            } else if (element instanceof TimeSeriesPoint) {
                values.add(((TimeSeriesPoint) element).getValue());
            } else if (element instanceof MultivariateDataPoint) {
                values.add(((MultivariateDataPoint) element).sumOfFeatures());
            } else if (element instanceof Map && ((Map<?, ?>) element).get(VALUE) instanceof Number) {
                values.add(((Number) ((Map<?, ?>) element).get(VALUE)).doubleValue());
            }
        }
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = values.get(i);
        }
        return result;
    }

    /**
     * @return time series points; elements without a timestamp are placed at
     *         their position in the payload
     */
    public List<TimeSeriesPoint> timeSeries() {
        if (dataType == DataType.TIMESERIES) {
            List<TimeSeriesPoint> points = new ArrayList<>(elements.size());
            for (Object element : elements) {
                points.add((TimeSeriesPoint) element);
            }
            return points;
        }
        double[] values = numericProjection();
        List<TimeSeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new TimeSeriesPoint(i, values[i]));
        }
        return points;
    }

    /**
     * Multivariate view of the payload. Every point is expressed in the feature
     * set of the first multivariate point, with absent features set to 0; a
     * payload without multivariate points yields single feature points named
     * {@code value} from the numeric projection.
     *
     * @return the points in payload order
     */
    public List<MultivariateDataPoint> multivariate() {
        List<String> featureNames = null;
        for (Object element : elements) {
            if (element instanceof MultivariateDataPoint) {
                featureNames = new ArrayList<>(((MultivariateDataPoint) element).getFeatures().keySet());
                break;
            }
        }
        List<MultivariateDataPoint> points = new ArrayList<>();
        if (featureNames == null) {
            for (double value : numericProjection()) {
                points.add(new MultivariateDataPoint(Collections.singletonMap(VALUE, value)));
            }
            return points;
        }
        for (Object element : elements) {
            if (element instanceof MultivariateDataPoint) {
                MultivariateDataPoint point = (MultivariateDataPoint) element;
                double[] vector = point.toVector(featureNames);
                Map<String, Double> features = new LinkedHashMap<>();
                for (int i = 0; i < vector.length; i++) {
                    features.put(featureNames.get(i), vector[i]);
                }
                points.add(new MultivariateDataPoint(point.getId(), point.getTimestamp(), features));
            }
        }
        return points;
    }

    public GraphPayload graph() {
        List<GraphNode> nodes = new ArrayList<>();
        List<GraphEdge> edges = new ArrayList<>();
        for (Object element : elements) {
            if (element instanceof GraphNode) {
                nodes.add((GraphNode) element);
            } else if (element instanceof GraphEdge) {
                edges.add((GraphEdge) element);
            }
        }
        return new GraphPayload(nodes, edges);
    }
}
