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

import java.util.ArrayList;
import java.util.List;

import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.detector.DetectionContext;
import com.amazon.ensembledetection.orchestration.detector.DetectorRegistry;

/**
 * Runs the methods one after another on the calling thread. Execution stops at
 * the first resource limit breach.
 */
public class SequentialMethodExecutor extends AbstractMethodExecutor {

    public SequentialMethodExecutor(DetectorRegistry registry) {
        super(registry);
    }

    @Override
    public List<MethodOutcome> execute(List<DetectionMethod> methods, List<?> payload, DetectionContext context) {
        List<MethodOutcome> outcomes = new ArrayList<>(methods.size());
        for (DetectionMethod method : methods) {
            MethodOutcome outcome = run(method, payload, context);
            outcomes.add(outcome);
            if (outcome.getFailure().filter(e -> e instanceof ResourceLimitExceededException).isPresent()) {
                break;
            }
        }
        return outcomes;
    }
}
