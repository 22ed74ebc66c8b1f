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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.TrainingFailedException;
import com.amazon.ensembledetection.multivariate.MultivariateDetector;
import com.amazon.ensembledetection.orchestration.config.ConfigurationPreset;
import com.amazon.ensembledetection.orchestration.config.DetectionMethod;
import com.amazon.ensembledetection.orchestration.config.FusionStrategy;
import com.amazon.ensembledetection.orchestration.detector.DetectionContext;
import com.amazon.ensembledetection.orchestration.detector.DetectorRegistry;
import com.amazon.ensembledetection.orchestration.detector.EnsembleDetector;
import com.amazon.ensembledetection.orchestration.detector.IDetector;
import com.amazon.ensembledetection.orchestration.detector.MultivariateMethodDetector;
import com.amazon.ensembledetection.orchestration.detector.PatternRecognitionDetector;
import com.amazon.ensembledetection.orchestration.detector.TimeSeriesDetector;
import com.amazon.ensembledetection.orchestration.executor.AbstractMethodExecutor;
import com.amazon.ensembledetection.orchestration.executor.MethodOutcome;
import com.amazon.ensembledetection.orchestration.executor.ParallelMethodExecutor;
import com.amazon.ensembledetection.orchestration.executor.SequentialMethodExecutor;
import com.amazon.ensembledetection.orchestration.fusion.FusedAnomalyResult;
import com.amazon.ensembledetection.orchestration.fusion.IModelPerformanceStore;
import com.amazon.ensembledetection.orchestration.fusion.InMemoryModelPerformanceStore;
import com.amazon.ensembledetection.orchestration.fusion.ResultFusionEngine;
import com.amazon.ensembledetection.pattern.PatternRecognitionEngine;
import com.amazon.ensembledetection.util.Deadline;

/**
 * The entry point of the library. A request is classified, a set of detection
 * methods is selected for it, the methods run independently and their results
 * are fused into one verdict.
 * <p>
 * A method that fails is left out of the fusion; when every method fails the
 * result is the neutral verdict of the fusion engine and the request ends in
 * {@link RequestState#FAILED}. A request that exceeds its time or memory budget
 * is aborted with a {@link ResourceLimitExceededException} and its partial
 * results are discarded.
 * <p>
 * The orchestrator is safe for concurrent use.
 */
public class DetectionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DetectionOrchestrator.class);

    public static final int PREDICTION_HISTORY = 100;

    // a low priority request runs at most this many methods
    public static final int LOW_PRIORITY_METHODS = 2;

    private final ConfigurationPreset preset;

    private final FusionStrategy fusionStrategy;

    private final Duration maxProcessingTime;

    private final long maxMemoryBytes;

    private final boolean parallelExecutionEnabled;

    private final DetectorRegistry registry;

    private final AbstractMethodExecutor executor;

    private final DataCharacteristicsAnalyzer analyzer;

    private final IModelPerformanceStore performanceStore;

    private final ResultFusionEngine fusionEngine;

    private final ResourceEstimator resourceEstimator = new ResourceEstimator();

    // method verdicts of the most recent requests, for feedback
    private final Map<String, Map<DetectionMethod, Boolean>> predictions = new LinkedHashMap<String,
            Map<DetectionMethod, Boolean>>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Map<DetectionMethod, Boolean>> eldest) {
            return size() > PREDICTION_HISTORY;
        }
    };

    private final AtomicLong requestsProcessed = new AtomicLong();

    private final AtomicLong requestsFailed = new AtomicLong();

    private final AtomicLong resourceLimitBreaches = new AtomicLong();

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected DetectionOrchestrator(Builder<?> builder) {
        preset = checkNotNull(builder.preset, "preset must not be null");
        fusionStrategy = builder.fusionStrategy.orElse(preset.getFusionStrategy());
        maxProcessingTime = builder.maxProcessingTime.orElse(preset.getMaxProcessingTime());
        maxMemoryBytes = builder.maxMemoryBytes.orElse(preset.getMaxMemoryBytes());
        checkArgument(!maxProcessingTime.isNegative() && !maxProcessingTime.isZero(),
                "processing time must be positive");
        checkArgument(maxMemoryBytes > 0, "memory budget must be positive");
        checkArgument(builder.threadPoolSize > 0, "thread pool size must be positive");
        parallelExecutionEnabled = builder.parallelExecutionEnabled;
        long seed = builder.randomSeed.orElse(new Random().nextLong());

        Map<DetectionMethod, IDetector> detectors = new EnumMap<>(DetectionMethod.class);
        detectors.put(DetectionMethod.ENSEMBLE, new EnsembleDetector());
        detectors.put(DetectionMethod.TIME_SERIES, new TimeSeriesDetector());
        detectors.put(DetectionMethod.MULTIVARIATE, new MultivariateMethodDetector(
                MultivariateDetector.builder().threshold(preset.getThreshold()).randomSeed(seed).build(), seed));
        detectors.put(DetectionMethod.PATTERN_RECOGNITION,
                new PatternRecognitionDetector(PatternRecognitionEngine.builder().build()));
        detectors.putAll(builder.detectors);
        registry = new DetectorRegistry(detectors);

        executor = parallelExecutionEnabled ? new ParallelMethodExecutor(registry, builder.threadPoolSize)
                : new SequentialMethodExecutor(registry);
        analyzer = builder.analyzer.orElse(new DataCharacteristicsAnalyzer());
        performanceStore = builder.performanceStore.orElse(new InMemoryModelPerformanceStore());
        fusionEngine = new ResultFusionEngine(performanceStore);
    }

    /**
     * Runs a request to completion.
     *
     * @param request the request
     * @return the verdict with the per-method results and performance figures
     * @throws ResourceLimitExceededException if the request exceeds its time or
     *                                        memory budget
     */
    public DetectionResult detect(DetectionRequest request) {
        checkNotNull(request, "request must not be null");
        long start = System.nanoTime();
        Optional<RunConfiguration> configuration = request.getConfiguration();
        FusionStrategy strategy = configuration.flatMap(RunConfiguration::getFusionStrategy).orElse(fusionStrategy);
        double threshold = configuration.flatMap(RunConfiguration::getThreshold).orElse(preset.getThreshold());
        Duration budget = configuration.flatMap(RunConfiguration::getMaxProcessingTime).orElse(maxProcessingTime);
        long memoryBudget = configuration.flatMap(RunConfiguration::getMaxMemoryBytes).orElse(maxMemoryBytes);
        Deadline deadline = Deadline.after(budget);
        String id = request.getId();
        logger.debug("request {} {} with {} payload elements", id, RequestState.RECEIVED, request.getPayload().size());

        try {
            DataProfile profile = analyzer.classify(request.getPayload());
            logger.debug("request {} {} as {}", id, RequestState.CLASSIFIED, profile.getDataType());

            List<DetectionMethod> methods = selectMethods(request, profile);
            logger.debug("request {} {}: {}", id, RequestState.METHODS_SELECTED, methods);
            long estimatedMemory = resourceEstimator.estimate(methods, profile);
            if (estimatedMemory > memoryBudget) {
                throw new ResourceLimitExceededException(ResourceLimitExceededException.Limit.MEMORY,
                        "estimated memory of " + estimatedMemory + " bytes exceeds the budget of " + memoryBudget);
            }
            deadline.check();

            logger.debug("request {} {}", id, RequestState.EXECUTING);
            List<MethodOutcome> outcomes = executor.execute(methods, request.getPayload(),
                    new DetectionContext(profile, threshold, deadline));
            for (MethodOutcome outcome : outcomes) {
                Optional<RuntimeException> failure = outcome.getFailure();
                if (failure.isPresent() && failure.get() instanceof ResourceLimitExceededException) {
                    throw (ResourceLimitExceededException) failure.get();
                }
            }
            deadline.check();

            List<DetectionMethodResult> results = new ArrayList<>();
            Map<DetectionMethod, String> failures = new EnumMap<>(DetectionMethod.class);
            Map<DetectionMethod, Long> timings = new EnumMap<>(DetectionMethod.class);
            for (MethodOutcome outcome : outcomes) {
                timings.put(outcome.getMethod(), outcome.getElapsedMillis());
                performanceStore.recordExecution(outcome.getMethod(), outcome.getElapsedMillis());
                if (outcome.isSuccess()) {
                    results.add(outcome.getResult().get());
                } else {
                    failures.put(outcome.getMethod(), outcome.getFailure().map(Throwable::getMessage).orElse(""));
                }
            }

            logger.debug("request {} {} {} results with strategy {}", id, RequestState.FUSING, results.size(),
                    strategy);
            FusedAnomalyResult fused = fusionEngine.fuse(results, strategy);
            RequestState state = results.isEmpty() ? RequestState.FAILED : RequestState.COMPLETED;
            remember(id, results);
            requestsProcessed.incrementAndGet();
            if (state == RequestState.FAILED) {
                requestsFailed.incrementAndGet();
            }

            long elapsed = (System.nanoTime() - start) / 1_000_000L;
            PerformanceMetrics performance = PerformanceMetrics.builder().totalProcessingMillis(elapsed)
                    .methodExecutionMillis(Collections.unmodifiableMap(timings)).estimatedMemoryBytes(estimatedMemory)
                    .succeededMethods(results.size()).failedMethods(failures.size()).build();
            logger.info("request {} {} in {} ms: anomaly={}, severity={}, {} of {} methods succeeded", id, state,
                    elapsed, fused.isAnomaly(), fused.getSeverity(), results.size(), methods.size());
            return DetectionResult.builder().requestId(id).state(state).profile(profile)
                    .selectedMethods(Collections.unmodifiableList(methods))
                    .methodResults(Collections.unmodifiableList(results))
                    .failures(Collections.unmodifiableMap(failures)).fusedResult(fused).performance(performance)
                    .timestamp(System.currentTimeMillis()).totalProcessingMillis(elapsed).build();
        } catch (ResourceLimitExceededException e) {
            deadline.cancel();
            resourceLimitBreaches.incrementAndGet();
            requestsFailed.incrementAndGet();
            logger.error("request {} aborted, {} limit exceeded: {}", id, e.getLimit(), e.getMessage());
            throw e;
        }
    }

    /**
     * Explicit methods are used as given. Otherwise the recommendations of the
     * analyzer are joined with the preset defaults; a critical request always
     * runs the multivariate and ensemble methods and a low priority request runs
     * at most two methods.
     */
    List<DetectionMethod> selectMethods(DetectionRequest request, DataProfile profile) {
        if (!request.getMethods().isEmpty()) {
            return new ArrayList<>(new LinkedHashSet<>(request.getMethods()));
        }
        Set<DetectionMethod> selected = new LinkedHashSet<>(profile.getRecommendedMethods());
        selected.addAll(preset.getDefaultMethods());
        if (request.getPriority() == Priority.CRITICAL) {
            selected.add(DetectionMethod.MULTIVARIATE);
            selected.add(DetectionMethod.ENSEMBLE);
        }
        List<DetectionMethod> methods = new ArrayList<>(selected);
        if (request.getPriority() == Priority.LOW && methods.size() > LOW_PRIORITY_METHODS) {
            methods = new ArrayList<>(methods.subList(0, LOW_PRIORITY_METHODS));
        }
        return methods;
    }

    private void remember(String requestId, List<DetectionMethodResult> results) {
        Map<DetectionMethod, Boolean> verdicts = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethodResult result : results) {
            verdicts.put(result.getMethod(), result.isAnomaly());
        }
        synchronized (predictions) {
            predictions.put(requestId, verdicts);
        }
    }

    /**
     * Records whether each method of a recent request judged it correctly. Only
     * the most recent {@link #PREDICTION_HISTORY} requests can receive feedback.
     *
     * @param requestId     the identifier of a processed request
     * @param actualAnomaly whether the payload really was anomalous
     * @return false if the request is unknown or too old
     */
    public boolean provideFeedback(String requestId, boolean actualAnomaly) {
        Map<DetectionMethod, Boolean> verdicts;
        synchronized (predictions) {
            verdicts = predictions.get(requestId);
        }
        if (verdicts == null) {
            return false;
        }
        for (Map.Entry<DetectionMethod, Boolean> entry : verdicts.entrySet()) {
            performanceStore.recordOutcome(entry.getKey(), entry.getValue() == actualAnomaly);
        }
        return true;
    }

    /**
     * Fits the detectors that keep a model between requests, which makes the
     * multivariate method usable on short payloads.
     *
     * @param payload training payload in any accepted form
     * @throws TrainingFailedException if a model cannot be fitted
     */
    public void train(List<?> payload) {
        checkNotNull(payload, "payload must not be null");
        for (DetectionMethod method : registry.getMethods()) {
            registry.get(method).train(payload);
        }
        logger.info("trained detectors on {} payload elements", payload.size());
    }

    /**
     * Releases the worker threads of parallel execution. The orchestrator stays
     * usable; the next request starts a new pool.
     */
    public void shutdown() {
        executor.shutdown();
    }

    public OrchestrationStatistics getOrchestrationStatistics() {
        Map<DetectionMethod, Double> accuracy = new EnumMap<>(DetectionMethod.class);
        Map<DetectionMethod, Double> executionMillis = new EnumMap<>(DetectionMethod.class);
        for (DetectionMethod method : registry.getMethods()) {
            performanceStore.getAccuracy(method).ifPresent(a -> accuracy.put(method, a));
            performanceStore.getAverageExecutionMillis(method).ifPresent(t -> executionMillis.put(method, t));
        }
        return OrchestrationStatistics.builder().preset(preset).fusionStrategy(fusionStrategy)
                .parallelExecutionEnabled(parallelExecutionEnabled).registeredMethods(registry.getMethods())
                .requestsProcessed(requestsProcessed.get()).requestsFailed(requestsFailed.get())
                .resourceLimitBreaches(resourceLimitBreaches.get())
                .methodAccuracy(Collections.unmodifiableMap(accuracy))
                .averageExecutionMillis(Collections.unmodifiableMap(executionMillis)).build();
    }

    public IDetector getDetector(DetectionMethod method) {
        return registry.get(method);
    }

    public ConfigurationPreset getPreset() {
        return preset;
    }

    public FusionStrategy getFusionStrategy() {
        return fusionStrategy;
    }

    public Duration getMaxProcessingTime() {
        return maxProcessingTime;
    }

    public long getMaxMemoryBytes() {
        return maxMemoryBytes;
    }

    public boolean isParallelExecutionEnabled() {
        return parallelExecutionEnabled;
    }

    public static class Builder<T extends Builder<T>> {

        private ConfigurationPreset preset = ConfigurationPreset.STANDARD;
        private Optional<FusionStrategy> fusionStrategy = Optional.empty();
        private Optional<Duration> maxProcessingTime = Optional.empty();
        private Optional<Long> maxMemoryBytes = Optional.empty();
        private boolean parallelExecutionEnabled = true;
        private int threadPoolSize = Runtime.getRuntime().availableProcessors();
        private final Map<DetectionMethod, IDetector> detectors = new EnumMap<>(DetectionMethod.class);
        private Optional<IModelPerformanceStore> performanceStore = Optional.empty();
        private Optional<DataCharacteristicsAnalyzer> analyzer = Optional.empty();
        private Optional<Long> randomSeed = Optional.empty();

        public T preset(ConfigurationPreset preset) {
            this.preset = preset;
            return (T) this;
        }

        public T fusionStrategy(FusionStrategy fusionStrategy) {
            this.fusionStrategy = Optional.of(fusionStrategy);
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

        public T parallelExecutionEnabled(boolean parallelExecutionEnabled) {
            this.parallelExecutionEnabled = parallelExecutionEnabled;
            return (T) this;
        }

        public T threadPoolSize(int threadPoolSize) {
            this.threadPoolSize = threadPoolSize;
            return (T) this;
        }

        /**
         * replaces the built-in detector of a method
         */
        public T detector(DetectionMethod method, IDetector detector) {
            checkNotNull(method, "method must not be null");
            this.detectors.put(method, checkNotNull(detector, "detector must not be null"));
            return (T) this;
        }

        public T performanceStore(IModelPerformanceStore performanceStore) {
            this.performanceStore = Optional.of(performanceStore);
            return (T) this;
        }

        public T analyzer(DataCharacteristicsAnalyzer analyzer) {
            this.analyzer = Optional.of(analyzer);
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public DetectionOrchestrator build() {
            return new DetectionOrchestrator(this);
        }
    }
}
