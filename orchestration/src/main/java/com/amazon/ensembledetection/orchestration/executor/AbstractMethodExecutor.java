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

import static com.amazon.ensembledetection.CommonUtils.checkNotNull;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.orchestration.DetectionMethodResult;
import com.amazon.ensembledetection.orchestration.MethodExecutionException;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.detector.DetectionContext;
import com.amazon.ensembledetection.orchestration.detector.DetectorRegistry;

/**
 * Runs the selected detection methods of a request and reports how each one
 * settled. A method that throws is isolated: its exception is wrapped in a
 * {@link MethodExecutionException} outcome and the other methods are
 * unaffected. Resource limit breaches are reported unwrapped so that the caller
 * can abort the request.
 */
public abstract class AbstractMethodExecutor {

    private static final Logger logger = LoggerFactory.getLogger(AbstractMethodExecutor.class);

    protected final DetectorRegistry registry;

    protected AbstractMethodExecutor(DetectorRegistry registry) {
        this.registry = checkNotNull(registry, "registry must not be null");
    }

    /**
     * @param methods the methods to run, without duplicates
     * @param payload the request payload
     * @param context the request context shared by all methods
     * @return one outcome per method, in the order of {@code methods}
     * @throws ResourceLimitExceededException if the processing time budget runs
     *                                        out while waiting for the methods
     */
    public abstract List<MethodOutcome> execute(List<DetectionMethod> methods, List<?> payload,
            DetectionContext context);

    /**
     * Releases the threads held by this executor. Executors that run on the
     * calling thread hold none.
     */
    public void shutdown() {
        logger.debug("{} holds no threads to release", getClass().getSimpleName());
    }

    protected MethodOutcome run(DetectionMethod method, List<?> payload, DetectionContext context) {
        long start = System.nanoTime();
        try {
            DetectionMethodResult result = registry.get(method).detect(payload, context);
            long elapsed = elapsedMillis(start);
            if (result == null) {
                throw new IllegalStateException("detector returned no result");
            }
            logger.debug("method {} finished in {} ms", method, elapsed);
            return MethodOutcome.success(method, result.withExecutionTime(elapsed), elapsed);
        } catch (ResourceLimitExceededException e) {
            return MethodOutcome.failure(method, e, elapsedMillis(start));
        } catch (RuntimeException e) {
            MethodExecutionException failure = new MethodExecutionException(method, e);
            logger.warn(failure.getMessage());
            return MethodOutcome.failure(method, failure, elapsedMillis(start));
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
