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

import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * Wraps the failure of a single detection method. The orchestrator excludes
 * the method from fusion and never lets this exception escape.
 */
@Getter
public class MethodExecutionException extends RuntimeException {

    private final DetectionMethod method;

    public MethodExecutionException(DetectionMethod method, Throwable cause) {
        super("method " + method.getWireName() + " failed: " + cause.getMessage(), cause);
        this.method = method;
    }
}
