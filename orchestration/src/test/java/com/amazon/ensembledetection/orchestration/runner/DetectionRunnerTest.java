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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.amazon.ensembledetection.multivariate.MultivariateDataPoint;

public class DetectionRunnerTest {

    private DetectionRunner runner;

    private BufferedReader in;
    private PrintWriter out;

    @BeforeEach
    public void setUp() {
        runner = new DetectionRunner();
        runner.parse("--parallel", "false", "--random-seed", "0");

        in = mock(BufferedReader.class);
        out = mock(PrintWriter.class);
    }

    @Test
    public void testRunUnivariate() throws IOException {
        when(in.readLine()).thenReturn("5").thenReturn("5").thenReturn("").thenReturn("5").thenReturn("5")
                .thenReturn("5").thenReturn(null);
        runner.run(in, out);
        verify(out).println("requestId: " + DetectionRunner.REQUEST_ID);
        verify(out).println("state: COMPLETED");
        verify(out).println("dataType: UNIVARIATE");
        verify(out).println("anomaly: false");
        verify(out).println("severity: LOW");
        verify(out).println("methods: ensemble");
        verify(out).println("explanation: Fusion strategy: adaptive (weighted)");
        verify(out).println("recommendation: Continue normal monitoring");
        verify(out).flush();
    }

    @Test
    public void testRunMultivariateWithHeader() throws IOException {
        DetectionRunner withHeader = new DetectionRunner();
        withHeader.parse("--header-row", "true", "--methods", "ensemble", "--parallel", "false");
        when(in.readLine()).thenReturn("a,b").thenReturn("1.0,2.0").thenReturn("2.0,1.0").thenReturn("1.5,1.5")
                .thenReturn(null);
        withHeader.run(in, out);
        assertThat(withHeader.featureNames, contains("a", "b"));
        verify(out).println("dataType: MULTIVARIATE");
        verify(out).println("methods: ensemble");
    }

    @Test
    public void testProcessLine() {
        runner.prepareColumns(new String[] { "1.0", "2.0" });
        Object point = runner.processLine(new String[] { "1.0", " 2.5" });
        assertThat(point, instanceOf(MultivariateDataPoint.class));
        assertEquals(2.5, ((MultivariateDataPoint) point).getFeature("f1"), 0);

        runner.prepareColumns(new String[] { "3.0" });
        assertEquals(3.0, runner.processLine(new String[] { "3.0" }));
    }

    @Test
    public void testWrongNumberOfValues() throws IOException {
        when(in.readLine()).thenReturn("1,2").thenReturn("3").thenReturn(null);
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> runner.run(in, out));
        assertEquals("Wrong number of values on line 2. Expected 2 but found 1.", exception.getMessage());
    }
}
