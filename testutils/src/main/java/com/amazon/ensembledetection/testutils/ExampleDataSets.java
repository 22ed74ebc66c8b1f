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

package com.amazon.ensembledetection.testutils;

import static java.lang.Math.PI;
import static java.lang.Math.sin;

import java.util.Arrays;
import java.util.Random;

/**
 * Small deterministic sequences and graphs with known structure. Graphs are
 * returned as arrays of {source, target} identifier pairs.
 */
public class ExampleDataSets {

    private ExampleDataSets() {
    }

    /**
     * a constant series with a single spike
     */
    public static double[] spikeSeries(int length, int spikeIndex, double base, double spike) {
        double[] values = new double[length];
        Arrays.fill(values, base);
        values[spikeIndex] = spike;
        return values;
    }

    /**
     * a sine wave with gaussian noise
     */
    public static double[] seasonalSeries(int length, int period, double amplitude, double noise, long seed) {
        Random random = new Random(seed);
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = amplitude * sin(2 * PI * i / period) + noise * random.nextGaussian();
        }
        return values;
    }

    /**
     * a level series that shifts upward at the given index
     */
    public static double[] levelShiftSeries(int length, int shiftIndex, double shift, double noise, long seed) {
        Random random = new Random(seed);
        double[] values = new double[length];
        for (int i = 0; i < length; i++) {
            values[i] = ((i >= shiftIndex) ? shift : 0) + noise * random.nextGaussian();
        }
        return values;
    }

    /**
     * a center node "center" linked to leaves "leaf0" .. "leaf{n-1}"
     */
    public static String[][] starGraph(int leaves) {
        String[][] edges = new String[leaves][];
        for (int i = 0; i < leaves; i++) {
            edges[i] = new String[] { "center", "leaf" + i };
        }
        return edges;
    }

    /**
     * a cycle n0 - n1 - ... - n{n-1} - n0
     */
    public static String[][] ringGraph(int nodes) {
        String[][] edges = new String[nodes][];
        for (int i = 0; i < nodes; i++) {
            edges[i] = new String[] { "n" + i, "n" + ((i + 1) % nodes) };
        }
        return edges;
    }

    /**
     * every pair of nodes k0 .. k{n-1} linked
     */
    public static String[][] completeGraph(int nodes) {
        String[][] edges = new String[nodes * (nodes - 1) / 2][];
        int next = 0;
        for (int i = 0; i < nodes; i++) {
            for (int j = i + 1; j < nodes; j++) {
                edges[next++] = new String[] { "k" + i, "k" + j };
            }
        }
        return edges;
    }
}
