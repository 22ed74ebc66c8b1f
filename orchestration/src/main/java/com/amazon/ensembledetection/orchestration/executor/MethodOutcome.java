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

package com.amazon.ensembledetection.orchestration.executor;

import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * The settled state of one method task: either a result or a failure.
 */
@Getter
public class MethodOutcome {

    private final DetectionMethod method;

    @Getter(AccessLevel.NONE)
    private final DetectionMethodResult result;

    @Getter(AccessLevel.NONE)
    private final RuntimeException failure;

    private final long elapsedMillis;

    private MethodOutcome(DetectionMethod method, DetectionMethodResult result, RuntimeException failure,
            long elapsedMillis) {
        this.method = method;
        this.result = result;
        this.failure = failure;
        this.elapsedMillis = elapsedMillis;
    }

    public static MethodOutcome success(DetectionMethod method, DetectionMethodResult result, long elapsedMillis) {
        return new MethodOutcome(method, result, null, elapsedMillis);
    }

    public static MethodOutcome failure(DetectionMethod method, RuntimeException failure, long elapsedMillis) {
        return new MethodOutcome(method, null, failure, elapsedMillis);
    }

    public Optional<DetectionMethodResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
