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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;
import com.amazon.ensembledetection.pattern.GraphEdge;
import com.amazon.ensembledetection.pattern.GraphNode;

public class PayloadAdapterTest {

    static Map<String, Object> map(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    @Test
    public void testEmptyPayloadIsUnivariate() {
        PayloadAdapter adapter = PayloadAdapter.of(Collections.emptyList());
        assertEquals(DataType.UNIVARIATE, adapter.getDataType());
        assertEquals(0, adapter.size());
        assertEquals(0, adapter.numericProjection().length);
    }

    @Test
    public void testNumbers() {
        PayloadAdapter adapter = PayloadAdapter.of(Arrays.asList(1, 2.5f, 3L));
        assertEquals(DataType.UNIVARIATE, adapter.getDataType());
        assertArrayEquals(new double[] { 1, 2.5, 3 }, adapter.numericProjection(), 0);
        List<TimeSeriesPoint> series = adapter.timeSeries();
        assertEquals(2L, series.get(2).getTimestamp());
        assertEquals(3.0, series.get(2).getValue(), 0);
        MultivariateDataPoint point = adapter.multivariate().get(1);
        assertEquals(2.5, point.getFeature(PayloadAdapter.VALUE), 0);
    }

    @Test
    public void testTimeSeriesMaps() {
        PayloadAdapter adapter = PayloadAdapter
                .of(Arrays.asList(map("timestamp", 1000L, "value", 4.0), map("timestamp", 2000, "value", 6)));
        assertEquals(DataType.TIMESERIES, adapter.getDataType());
        assertThat(adapter.getElements().get(0), instanceOf(TimeSeriesPoint.class));
        assertEquals(2000L, adapter.timeSeries().get(1).getTimestamp());
        assertArrayEquals(new double[] { 4, 6 }, adapter.numericProjection(), 0);
    }

    @Test
    public void testMultivariateMaps() {
        Map<String, Object> first = new HashMap<>();
        first.put("a", 1.0);
        first.put("b", 2.0);
        Map<String, Object> second = new HashMap<>();
        second.put("a", 3);
        second.put("label", "not a number");
        PayloadAdapter adapter = PayloadAdapter
                .of(Arrays.asList(map("id", "p1", "features", first), map("features", second)));
        assertEquals(DataType.MULTIVARIATE, adapter.getDataType());
        assertArrayEquals(new double[] { 3, 3 }, adapter.numericProjection(), 0);

        List<MultivariateDataPoint> points = adapter.multivariate();
        assertEquals("p1", points.get(0).getId());
        assertEquals(first.keySet(), points.get(1).getFeatures().keySet());
        assertEquals(0.0, points.get(1).getFeature("b"), 0);
        assertEquals(3.0, points.get(1).getFeature("a"), 0);
    }

    @Test
    public void testGraphElements() {
        List<Object> payload = new ArrayList<>();
        payload.add(map("id", "hub", "connections", Arrays.asList("x", "y"), "weight", 2.0));
        payload.add(map("source", "hub", "target", "z"));
        payload.add(new GraphEdge("x", "y"));
        PayloadAdapter adapter = PayloadAdapter.of(payload);
        assertEquals(DataType.GRAPH, adapter.getDataType());
        assertThat(adapter.getElements().get(0), instanceOf(GraphNode.class));
        assertThat(adapter.getElements().get(1), instanceOf(GraphEdge.class));

        GraphPayload graph = adapter.graph();
        assertEquals(1, graph.getNodes().size());
        assertEquals(2, graph.getEdges().size());
        assertEquals(GraphEdge.DEFAULT_TYPE, graph.getEdges().get(0).getType());
        // hub links x, y and z
        double[] degrees = adapter.numericProjection();
        assertEquals(3.0, degrees[0], 0);
        assertEquals(graph.toGraph().size(), degrees.length);
    }

    @Test
    public void testMixedPayloadKeepsUnknownElements() {
        Object marker = new Object();
        PayloadAdapter adapter = PayloadAdapter.of(Arrays.asList(1.0, marker, map("value", 7)));
        assertEquals(DataType.MIXED, adapter.getDataType());
        assertSame(marker, adapter.getElements().get(1));
        assertArrayEquals(new double[] { 1, 7 }, adapter.numericProjection(), 0);
        assertEquals(7.0, adapter.timeSeries().get(1).getValue(), 0);
    }

    @Test
    public void testNodeWithFeaturesAndConnections() {
        Map<String, Object> features = new HashMap<>();
        features.put("load", 0.5);
        Map<String, Object> node = new HashMap<>();
        node.put("id", "a");
        node.put("features", features);
        node.put("connections", Collections.singletonList("b"));
        Map<String, Object> point = new HashMap<>();
        point.put("id", "p");
        point.put("features", features);

        PayloadAdapter adapter = PayloadAdapter.of(Arrays.asList(node, point));
        assertEquals(DataType.MIXED, adapter.getDataType());
        assertThat(adapter.getElements().get(0), instanceOf(GraphNode.class));
        assertEquals(0.5, ((GraphNode) adapter.getElements().get(0)).getFeatures().get("load"), 0);
        assertThat(adapter.getElements().get(1), instanceOf(MultivariateDataPoint.class));
    }
}
