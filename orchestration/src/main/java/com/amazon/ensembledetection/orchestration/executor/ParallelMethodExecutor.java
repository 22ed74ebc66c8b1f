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

import static com.amazon.ensembledetection.CommonUtils.checkArgument;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.detector.DetectionContext;
import com.amazon.ensembledetection.orchestration.detector.DetectorRegistry;

/**
 * Runs the methods of a request concurrently on a private thread pool and joins
 * them within the remaining processing time. When the budget runs out the
 * request deadline is cancelled, which makes the running numerical loops
 * unwind at their next check.
 * <p>
 * The pool is created on first use and released by {@link #shutdown()}; a
 * later call to {@code execute} starts a new pool.
 */
public class ParallelMethodExecutor extends AbstractMethodExecutor {

    private ForkJoinPool forkJoinPool;
    private final int threadPoolSize;

    public ParallelMethodExecutor(DetectorRegistry registry, int threadPoolSize) {
        super(registry);
        checkArgument(threadPoolSize > 0, "thread pool size must be positive");
        this.threadPoolSize = threadPoolSize;
    }

    @Override
    public List<MethodOutcome> execute(List<DetectionMethod> methods, List<?> payload, DetectionContext context) {
        ForkJoinPool pool = getPool();
        List<ForkJoinTask<MethodOutcome>> tasks = new ArrayList<>(methods.size());
        for (DetectionMethod method : methods) {
            tasks.add(pool.submit(() -> run(method, payload, context)));
        }
        List<MethodOutcome> outcomes = new ArrayList<>(methods.size());
        try {
            for (ForkJoinTask<MethodOutcome> task : tasks) {
                long remaining = context.getDeadline().remaining().toNanos();
                outcomes.add(task.get(remaining, TimeUnit.NANOSECONDS));
            }
        } catch (TimeoutException e) {
            abandon(tasks, context);
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.TIME,
                    "detection methods did not finish within the processing time budget");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(tasks, context);
            throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.TIME,
                    "interrupted while waiting for detection methods");
        } catch (ExecutionException e) {
            // run() isolates runtime exceptions, so only errors get here
            abandon(tasks, context);
            throw new IllegalStateException("detection method task terminated abnormally", e.getCause());
        }
        return outcomes;
    }

    private static void abandon(List<ForkJoinTask<MethodOutcome>> tasks, DetectionContext context) {
        context.getDeadline().cancel();
        for (ForkJoinTask<MethodOutcome> task : tasks) {
            task.cancel(true);
        }
    }

    private synchronized ForkJoinPool getPool() {
        if (forkJoinPool == null) {
            forkJoinPool = new ForkJoinPool(threadPoolSize);
        }
        return forkJoinPool;
    }

    @Override
    public synchronized void shutdown() {
        if (forkJoinPool != null) {
            forkJoinPool.shutdown();
            forkJoinPool = null;
        }
    }

    synchronized boolean isPoolActive() {
        return forkJoinPool != null && !forkJoinPool.isShutdown();
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }
}
