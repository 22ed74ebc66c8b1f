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

package com.amazon.ensembledetection.util;

import static com.amazon.ensembledetection.CommonUtils.checkArgument;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import com.amazon.ensembledetection.ResourceLimitExceededException;

/**
 * A cooperative cancellation token. Iterative numerical routines call
 * {@link #check()} every few iterations; once the deadline has passed, or the
 * token has been cancelled, the check throws a
 * {@link ResourceLimitExceededException} and the routine unwinds.
 */
public class Deadline {

    // the number of loop iterations between two checks in the iterative routines
    public static final int CHECK_INTERVAL = 16;

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    private static final Duration MAX_BUDGET = Duration.ofNanos(Long.MAX_VALUE);

    private final long expiresAtNanos;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    /**
     * @return a deadline that never expires and cannot be cancelled
     */
    public static Deadline none() {
        return NONE;
    }

    public static Deadline after(Duration budget) {
        checkArgument(budget != null && !budget.isNegative(), "budget must be non-negative");
        // budgets beyond the nanosecond range never expire
        if (budget.compareTo(MAX_BUDGET) >= 0) {
            return new Deadline(Long.MAX_VALUE);
        }
        long now = System.nanoTime();
        long nanos = budget.toNanos();
        long expiry = (now > 0 && Long.MAX_VALUE - now <= nanos) ? Long.MAX_VALUE : now + nanos;
        return new Deadline(expiry);
    }

    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isExpired() {
        return cancelled.get() || (expiresAtNanos != Long.MAX_VALUE && System.nanoTime() - expiresAtNanos >= 0);
    }

    public Duration remaining() {
        if (expiresAtNanos == Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0, expiresAtNanos - System.nanoTime()));
    }

    public void check() {
        if (isExpired()) {
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.TIME,
                    cancelled.get() ? "processing cancelled" : "processing time budget exceeded");
        }
    }

    /**
     * checks the deadline only when the iteration counter is a multiple of
     * {@link #CHECK_INTERVAL}
     *
     * @param iteration the current loop iteration
     */
    public void checkEvery(int iteration) {
        if (iteration % CHECK_INTERVAL == 0) {
            check();
        }
    }
}
