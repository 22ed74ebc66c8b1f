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

package com.amazon.ensembledetection.pattern;

import static com.amazon.ensembledetection.pattern.GraphTest.graphOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.testutils.ExampleDataSets;
import com.amazon.ensembledetection.util.Deadline;

public class MotifDiscoveryTest {

    private MotifDiscovery discovery;

    @BeforeEach
    public void setUp() {
        discovery = new MotifDiscovery(5, 3, 10, 2, 50);
    }

    @Test
    public void testDiscretize() {
        assertEquals("ABCDE", discovery.discretize(new double[] { 0, 1, 2, 3, 4 }));
        assertEquals("AAAA", discovery.discretize(new double[] { 7, 7, 7, 7 }));
        assertEquals("", discovery.discretize(new double[0]));
        assertEquals("EA", discovery.discretize(new double[] { 10, -10 }));
    }

    @Test
    public void testRepeatingSequence() {
        double[] values = new double[24];
        for (int i = 0; i < values.length; i++) {
            values[i] = (i % 2 == 0) ? 0 : 4;
        }
        List<Motif> motifs = discovery.sequenceMotifs(values, Deadline.none());
        assertTrue(motifs.size() > 0);
        for (int i = 0; i < motifs.size(); i++) {
            Motif motif = motifs.get(i);
            assertEquals(MotifType.SEQUENCE, motif.getType());
            assertTrue(motif.getFrequency() >= 2);
            assertEquals(motif.getFrequency(), motif.getPositions().size());
            assertTrue(motif.length() >= 3 && motif.length() <= 10);
            if (i > 0) {
                assertTrue(motifs.get(i - 1).getSignificance() >= motif.getSignificance());
            }
        }
        Motif top = motifs.get(0);
        assertTrue(top.getSignificance() > 0);
        for (int position : top.getPositions()) {
            assertEquals(top.getPattern(), discovery.discretize(values).substring(position, position + top.length()));
        }
    }

    @Test
    public void testMotifCap() {
        MotifDiscovery capped = new MotifDiscovery(5, 3, 10, 2, 2);
        double[] values = ExampleDataSets.seasonalSeries(200, 8, 5, 0.1, 3L);
        assertTrue(capped.sequenceMotifs(values, Deadline.none()).size() <= 2);
    }

    @Test
    public void testNoRepeats() {
        assertTrue(discovery.sequenceMotifs(new double[] { 0, 1, 2, 3, 4 }, Deadline.none()).isEmpty());
    }

    @Test
    public void testStarMotif() {
        List<Motif> motifs = discovery.graphMotifs(graphOf(ExampleDataSets.starGraph(10)), Deadline.none());
        assertEquals(1, motifs.size());
        Motif star = motifs.get(0);
        assertEquals(MotifType.STAR, star.getType());
        assertEquals(1, star.getFrequency());
        assertEquals(1.0 / 11, star.getSignificance(), 1e-12);
        assertEquals("center", star.getInstances().get(0).get(0));
        assertEquals(11, star.getInstances().get(0).size());
    }

    @Test
    public void testCompleteGraphMotifs() {
        List<Motif> motifs = discovery.graphMotifs(graphOf(ExampleDataSets.completeGraph(4)), Deadline.none());
        assertEquals(2, motifs.size());
        Motif triangles = motifs.get(0);
        assertEquals(MotifType.TRIANGLE, triangles.getType());
        assertEquals(4, triangles.getFrequency());
        assertEquals(1.0, triangles.getSignificance(), 1e-12);
        assertEquals(4, triangles.getInstances().size());
        Motif stars = motifs.get(1);
        assertEquals(MotifType.STAR, stars.getType());
        assertEquals(4, stars.getFrequency());
        assertEquals(1.0, stars.getSignificance(), 1e-12);
    }

    @Test
    public void testRingHasNoMotifs() {
        assertTrue(discovery.graphMotifs(graphOf(ExampleDataSets.ringGraph(6)), Deadline.none()).isEmpty());
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new MotifDiscovery(1, 3, 10, 2, 50));
        assertThrows(IllegalArgumentException.class, () -> new MotifDiscovery(5, 4, 3, 2, 50));
        assertThrows(IllegalArgumentException.class, () -> new MotifDiscovery(5, 3, 10, 1, 50));
        assertThrows(IllegalArgumentException.class, () -> new MotifDiscovery(5, 3, 10, 2, 0));
    }
}
