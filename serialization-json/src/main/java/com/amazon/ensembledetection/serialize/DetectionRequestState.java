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

import lombok.Data;

/**
 * The JSON shape of a detection request. Enumerated values are carried by
 * name, durations in milliseconds. Payload elements are numbers or objects in
 * the forms the orchestrator's payload adapter recognizes.
 */
@Data
public class DetectionRequestState {

    private String version = DetectionStateMapper.VERSION;

    private String id;

    private List<Object> payload;

    private String priority;

    private List<String> methods;

    private String fusionStrategy;

    private Double threshold;

    private Long maxProcessingTimeMillis;

    private Long maxMemoryBytes;

    private Long submittedAt;

    private String source;
}
