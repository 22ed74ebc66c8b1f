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

package com.amazon.ensembledetection.returntypes;

/**
 * Severity tiers shared by every detector and by the fused verdict. Scores map
 * onto tiers at the 0.3, 0.6 and 0.9 breakpoints.
 */
public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL;

    public static final double MEDIUM_BREAKPOINT = 0.3;
    public static final double HIGH_BREAKPOINT = 0.6;
    public static final double CRITICAL_BREAKPOINT = 0.9;

    /**
     * maps a score to its tier; NaN maps to LOW
     *
     * @param score a score, nominally in [0,1]
     * @return the severity tier
     */
    public static Severity fromScore(double score) {
        if (Double.isNaN(score) || score < MEDIUM_BREAKPOINT) {
            return LOW;
        } else if (score < HIGH_BREAKPOINT) {
            return MEDIUM;
        } else if (score < CRITICAL_BREAKPOINT) {
            return HIGH;
        }
        return CRITICAL;
    }
}
