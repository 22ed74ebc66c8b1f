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

package com.amazon.ensembledetection.orchestration.fusion;

import static com.amazon.ensembledetection.CommonUtils.checkArgument;
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * Keeps the most recent outcomes and execution times of each method in bounded
 * windows.
 */
public class InMemoryModelPerformanceStore implements IModelPerformanceStore {

    public static final int DEFAULT_WINDOW = 100;

    private final int window;

    private final Map<DetectionMethod, ArrayDeque<Boolean>> outcomes = new EnumMap<>(DetectionMethod.class);

    private final Map<DetectionMethod, ArrayDeque<Long>> executions = new EnumMap<>(DetectionMethod.class);

    public InMemoryModelPerformanceStore() {
        this(DEFAULT_WINDOW);
    }

    public InMemoryModelPerformanceStore(int window) {
        checkArgument(window > 0, "window must be positive");
        this.window = window;
    }

    @Override
    public synchronized Optional<Double> getAccuracy(DetectionMethod method) {
        ArrayDeque<Boolean> history = outcomes.get(checkNotNull(method, "method must not be null"));
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        int correct = 0;
        for (boolean outcome : history) {
            correct += outcome ? 1 : 0;
        }
        return Optional.of(correct / (double) history.size());
    }

    @Override
    public synchronized void recordOutcome(DetectionMethod method, boolean correct) {
        append(outcomes.computeIfAbsent(checkNotNull(method, "method must not be null"), m -> new ArrayDeque<>()),
                correct);
    }

    @Override
    public synchronized void recordExecution(DetectionMethod method, long elapsedMillis) {
        append(executions.computeIfAbsent(checkNotNull(method, "method must not be null"), m -> new ArrayDeque<>()),
                elapsedMillis);
    }

    @Override
    public synchronized Optional<Double> getAverageExecutionMillis(DetectionMethod method) {
        ArrayDeque<Long> history = executions.get(checkNotNull(method, "method must not be null"));
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        long total = 0;
        for (long elapsed : history) {
            total += elapsed;
        }
        return Optional.of(total / (double) history.size());
    }

    private <T> void append(ArrayDeque<T> history, T value) {
        history.addLast(value);
        while (history.size() > window) {
            history.removeFirst();
        }
    }
}
