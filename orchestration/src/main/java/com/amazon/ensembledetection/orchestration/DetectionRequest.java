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
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * An immutable detection request. The payload is a list whose elements are
 * numbers, {@link TimeSeriesPoint}s, multivariate data points, graph nodes and
 * edges, or string keyed maps describing one of these.
 */
@Getter
public class DetectionRequest {

    private final String id;

    private final List<Object> payload;

    private final Priority priority;

    // empty when the orchestrator should choose
    private final List<DetectionMethod> methods;

    @Getter(AccessLevel.NONE)
    private final RunConfiguration configuration;

    // epoch milliseconds
    private final long submittedAt;

    @Getter(AccessLevel.NONE)
    private final String source;

    @Builder
    private DetectionRequest(String id, List<?> payload, Priority priority, List<DetectionMethod> methods,
            RunConfiguration configuration, Long submittedAt, String source) {
        checkArgument(id != null && !id.isEmpty(), "request id must not be empty");
        checkNotNull(payload, "payload must not be null");
        this.id = id;
        this.payload = Collections.unmodifiableList(new ArrayList<Object>(payload));
        this.priority = (priority == null) ? Priority.MEDIUM : priority;
        this.methods = (methods == null) ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(methods));
        this.configuration = configuration;
        this.submittedAt = (submittedAt == null) ? System.currentTimeMillis() : submittedAt;
        this.source = source;
    }

    public Optional<RunConfiguration> getConfiguration() {
        return Optional.ofNullable(configuration);
    }

    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }
}
