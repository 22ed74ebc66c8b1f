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

import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * The JSON shape of a completed detection, including its performance figures.
 */
@Data
public class DetectionResultState {

    private String version = DetectionStateMapper.VERSION;

    private String requestId;

    private String state;

    private DataProfileState profile;

    private List<String> selectedMethods;

    private List<MethodResultState> methodResults;

    private Map<String, String> failures;

    private FusedResultState fusedResult;

    private long totalProcessingMillis;

    private Map<String, Long> methodExecutionMillis;

    private long estimatedMemoryBytes;

    private int succeededMethods;

    private int failedMethods;

    private long timestamp;
}
