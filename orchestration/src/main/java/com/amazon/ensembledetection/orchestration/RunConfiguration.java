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

import static com.amazon.ensembledetection.CommonUtils.checkArgument;

import java.time.Duration;
import java.util.Optional;

import com.amazon.ensembledetection.orchestration.config.FusionStrategy;

/**
 * Per-request overrides of the orchestrator configuration. Every setting is
 * optional; an absent setting falls back to the orchestrator's preset.
 */
public class RunConfiguration {

    private final Optional<FusionStrategy> fusionStrategy;

    private final Optional<Double> threshold;

    private final Optional<Duration> maxProcessingTime;

    private final Optional<Long> maxMemoryBytes;

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected RunConfiguration(Builder<?> builder) {
        builder.threshold.ifPresent(t -> checkArgument(t > 0 && t < 1, "threshold must be in (0,1)"));
        builder.maxProcessingTime
                .ifPresent(d -> checkArgument(!d.isNegative() && !d.isZero(), "processing time must be positive"));
        builder.maxMemoryBytes.ifPresent(m -> checkArgument(m > 0, "memory budget must be positive"));
        fusionStrategy = builder.fusionStrategy;
        threshold = builder.threshold;
        maxProcessingTime = builder.maxProcessingTime;
        maxMemoryBytes = builder.maxMemoryBytes;
    }

    public Optional<FusionStrategy> getFusionStrategy() {
        return fusionStrategy;
    }

    public Optional<Double> getThreshold() {
        return threshold;
    }

    public Optional<Duration> getMaxProcessingTime() {
        return maxProcessingTime;
    }

    public Optional<Long> getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    public static class Builder<T extends Builder<T>> {

        private Optional<FusionStrategy> fusionStrategy = Optional.empty();
        private Optional<Double> threshold = Optional.empty();
        private Optional<Duration> maxProcessingTime = Optional.empty();
        private Optional<Long> maxMemoryBytes = Optional.empty();

        public T fusionStrategy(FusionStrategy fusionStrategy) {
            this.fusionStrategy = Optional.of(fusionStrategy);
            return (T) this;
        }

        public T threshold(double threshold) {
            this.threshold = Optional.of(threshold);
            return (T) this;
        }

        public T maxProcessingTime(Duration maxProcessingTime) {
            this.maxProcessingTime = Optional.of(maxProcessingTime);
            return (T) this;
        }

        public T maxMemoryBytes(long maxMemoryBytes) {
            this.maxMemoryBytes = Optional.of(maxMemoryBytes);
            return (T) this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(this);
        }
    }
}
