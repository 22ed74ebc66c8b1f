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

package com.amazon.ensembledetection.orchestration.config;

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.Locale;

/**
 * Policies for combining the verdicts of several detection methods.
 */
public enum FusionStrategy {
    /**
     * Majority vote on the anomaly flags.
     */
    VOTING,
    /**
     * Confidence weighted mean of the scores, with a bonus for the ensemble
     * baseline.
     */
    WEIGHTED,
    /**
     * Mean of the scores weighted by each method's historical accuracy.
     */
    STACKING,
    /**
     * Weighted fusion over the high confidence methods when there are any,
     * voting otherwise.
     */
    ADAPTIVE;

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static FusionStrategy fromName(String name) {
        checkNotNull(name, "strategy name must not be null");
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
