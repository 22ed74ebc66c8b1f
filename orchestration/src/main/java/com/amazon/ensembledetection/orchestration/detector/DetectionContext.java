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

package com.amazon.ensembledetection.orchestration.detector;

import lombok.AllArgsConstructor;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.DataProfile;
import com.amazon.ensembledetection.util.Deadline;

/**
 * What a detector knows about the request it is scoring.
 */
@Getter
@AllArgsConstructor
public class DetectionContext {

    private final DataProfile profile;

    // per-point anomaly threshold in (0,1)
    private final double threshold;

    private final Deadline deadline;
}
