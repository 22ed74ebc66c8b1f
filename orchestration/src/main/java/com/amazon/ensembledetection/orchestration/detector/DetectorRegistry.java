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

import static com.amazon.ensembledetection.CommonUtils.checkArgument;
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.amazon.ensembledetection.orchestration.config.DetectionMethod;

/**
 * The closed set of detection methods, one detector per tag.
 */
public class DetectorRegistry {

    private final Map<DetectionMethod, IDetector> detectors;

    /**
     * @param detectors a detector for every {@link DetectionMethod}
     */
    public DetectorRegistry(Map<DetectionMethod, IDetector> detectors) {
        checkNotNull(detectors, "detectors must not be null");
        EnumMap<DetectionMethod, IDetector> copy = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : DetectionMethod.values()) {
            IDetector detector = detectors.get(method);
            checkArgument(detector != null, "no detector registered for " + method);
            copy.put(method, detector);
        }
        this.detectors = Collections.unmodifiableMap(copy);
    }

    public IDetector get(DetectionMethod method) {
        return detectors.get(checkNotNull(method, "method must not be null"));
    }

    public Set<DetectionMethod> getMethods() {
        return detectors.keySet();
    }
}
