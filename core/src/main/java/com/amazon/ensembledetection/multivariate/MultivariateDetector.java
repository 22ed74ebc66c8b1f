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

package com.amazon.ensembledetection.multivariate;

import static com.amazon.ensembledetection.CommonUtils.checkArgument;
import static com.amazon.ensembledetection.CommonUtils.checkNotNull;
import static com.amazon.ensembledetection.CommonUtils.clipToUnit;
import static java.lang.Math.abs;
import static java.lang.Math.exp;
import static java.lang.Math.sqrt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazon.ensembledetection.NotTrainedException;
import com.amazon.ensembledetection.ResourceLimitExceededException;
import com.amazon.ensembledetection.TrainingFailedException;
import com.amazon.ensembledetection.config.MultivariateMethod;
import com.amazon.ensembledetection.math.StatMath;
import com.amazon.ensembledetection.returntypes.Severity;
import com.amazon.ensembledetection.util.Deadline;

/**
 * Scores labeled multivariate points against a model fitted on a training
 * batch. Four sub-scorers each produce a score in [0,1]:
 * <ul>
 * <li>PCA: reconstruction error over the square root of the retained explained
 * variance</li>
 * <li>Mahalanobis: distance over sqrt(2d)</li>
 * <li>ICA: mean absolute independent component projection, in whitened units,
 * over 3</li>
 * <li>correlation: largest per-feature z-score over 3</li>
 * </ul>
 * and the ensemble score is their mean. With a single feature the PCA score is
 * still reported but left out of the mean unless it is the only method. The
 * trained state is an immutable {@link TrainedModel} held in an atomic
 * reference; {@code train} replaces it only on success and {@code detect} reads
 * a single snapshot per call.
 */
public class MultivariateDetector {

    private static final Logger logger = LoggerFactory.getLogger(MultivariateDetector.class);

    public static final double DEFAULT_THRESHOLD = 0.7;

    public static final int DEFAULT_MAX_PRINCIPAL_COMPONENTS = 10;

    public static final int DEFAULT_INDEPENDENT_COMPONENTS = 5;

    public static final int DEFAULT_ICA_ITERATIONS = 100;

    // RBF bandwidth of the kernel distance diagnostic
    public static final double KERNEL_GAMMA = 0.1;

    public static final int MAX_KERNEL_REFERENCE_POINTS = 100;

    // sub-scores above this value are named in the explanations
    public static final double EXPLANATION_THRESHOLD = 0.5;

    private final double threshold;

    private final int maxPrincipalComponents;

    private final int independentComponents;

    private final int icaIterations;

    private final Set<MultivariateMethod> methods;

    private final long randomSeed;

    private final AtomicReference<TrainedModel> model = new AtomicReference<>();

    public static Builder<?> builder() {
        return new Builder<>();
    }

    protected MultivariateDetector(Builder<?> builder) {
        checkArgument(builder.threshold > 0 && builder.threshold < 1, "threshold must be in (0,1)");
        checkArgument(builder.maxPrincipalComponents > 0, "number of principal components must be positive");
        checkArgument(builder.independentComponents > 0, "number of independent components must be positive");
        checkArgument(builder.icaIterations > 0, "number of ICA iterations must be positive");
        checkArgument(!builder.methods.isEmpty(), "at least one method is required");
        threshold = builder.threshold;
        maxPrincipalComponents = builder.maxPrincipalComponents;
        independentComponents = builder.independentComponents;
        icaIterations = builder.icaIterations;
        methods = Collections.unmodifiableSet(EnumSet.copyOf(builder.methods));
        randomSeed = builder.randomSeed.orElse(new Random().nextLong());
    }

    public void train(List<MultivariateDataPoint> points) {
        train(points, Deadline.none());
    }

    /**
     * Fits a new model and installs it. On failure the previous model, if any,
     * stays in effect.
     *
     * @param points   the training batch; every point must carry the same
     *                 non-empty set of finite features
     * @param deadline cooperative cancellation token
     * @throws TrainingFailedException        if the model cannot be fitted
     * @throws ResourceLimitExceededException if the deadline expires
     */
    public void train(List<MultivariateDataPoint> points, Deadline deadline) {
        if (points == null || points.isEmpty()) {
            throw new TrainingFailedException("training requires at least one point");
        }
        List<String> featureNames = new ArrayList<>(points.get(0).getFeatures().keySet());
        if (featureNames.isEmpty()) {
            throw new TrainingFailedException("training points have no features");
        }
        double[][] data = new double[points.size()][];
        for (int i = 0; i < points.size(); i++) {
            MultivariateDataPoint point = points.get(i);
            if (!point.getFeatures().keySet().equals(points.get(0).getFeatures().keySet())) {
                throw new TrainingFailedException("inconsistent feature set at training point " + i);
            }
            data[i] = point.toVector(featureNames);
            for (double value : data[i]) {
                if (!Double.isFinite(value)) {
                    throw new TrainingFailedException("non-finite feature value at training point " + i);
                }
            }
        }

        TrainedModel fitted;
        try {
            fitted = fit(featureNames, data, deadline);
        } catch (ResourceLimitExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrainingFailedException("model fit failed: " + e.getMessage(), e);
        }
        model.set(fitted);
        if (fitted.getMahalanobis().isPseudoInverse()) {
            logger.warn("covariance of {} features is near singular, using the regularized pseudo-inverse",
                    featureNames.size());
        }
        logger.info("trained on {} points with {} features, {} principal and {} independent components",
                data.length, featureNames.size(), fitted.getPrincipalComponents().getNumberOfComponents(),
                fitted.getIndependentComponents().getNumberOfComponents());
    }

    TrainedModel fit(List<String> featureNames, double[][] data, Deadline deadline) {
        int dimensions = featureNames.size();
        PrincipalComponents full = PrincipalComponents.fit(data, maxPrincipalComponents, deadline);
        // with every direction retained the reconstruction error is identically 0,
        // so scoring keeps at most d - 1 directions
        int retained = (dimensions > 1) ? Math.min(full.getNumberOfComponents(), dimensions - 1) : 1;
        PrincipalComponents scoring = full.truncate(retained);
        IndependentComponents ica = IndependentComponents.fit(full, data, independentComponents, icaIterations,
                new Random(randomSeed), deadline);
        MahalanobisModel mahalanobis = MahalanobisModel.fit(data);

        double[] means = new double[dimensions];
        double[] deviations = new double[dimensions];
        double[] column = new double[data.length];
        for (int j = 0; j < dimensions; j++) {
            for (int i = 0; i < data.length; i++) {
                column[i] = data[i][j];
            }
            means[j] = StatMath.mean(column);
            deviations[j] = StatMath.standardDeviation(column);
        }
        int references = Math.min(MAX_KERNEL_REFERENCE_POINTS, data.length);
        double[][] referencePoints = new double[references][];
        for (int i = 0; i < references; i++) {
            referencePoints[i] = data[i].clone();
        }
        return new TrainedModel(new ArrayList<>(featureNames), scoring, ica, mahalanobis, means, deviations,
                referencePoints, data.length, System.currentTimeMillis());
    }

    public List<MultivariateAnomalyResult> detect(List<MultivariateDataPoint> points) {
        return detect(points, Deadline.none());
    }

    /**
     * Scores each point against the current model snapshot.
     *
     * @param points   the points to score; each must carry exactly the trained
     *                 feature set
     * @param deadline cooperative cancellation token
     * @return one result per point, in input order
     * @throws NotTrainedException      if no model has been trained
     * @throws IllegalArgumentException if a point's feature set differs from the
     *                                  trained one
     */
    public List<MultivariateAnomalyResult> detect(List<MultivariateDataPoint> points, Deadline deadline) {
        checkNotNull(points, "points must not be null");
        TrainedModel snapshot = currentModel();
        List<MultivariateAnomalyResult> results = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            deadline.checkEvery(i);
            results.add(score(snapshot, points.get(i)));
        }
        return results;
    }

    public MultivariateAnomalyResult detect(MultivariateDataPoint point) {
        return score(currentModel(), checkNotNull(point, "point must not be null"));
    }

    private TrainedModel currentModel() {
        TrainedModel snapshot = model.get();
        if (snapshot == null) {
            throw new NotTrainedException("multivariate detector must be trained before detection");
        }
        return snapshot;
    }

    MultivariateAnomalyResult score(TrainedModel snapshot, MultivariateDataPoint point) {
        Set<String> expected = new HashSet<>(snapshot.getFeatureNames());
        checkArgument(point.getFeatures().keySet().equals(expected),
                "feature set " + point.getFeatures().keySet() + " does not match trained features "
                        + snapshot.getFeatureNames());
        double[] vector = point.toVector(snapshot.getFeatureNames());
        int dimensions = vector.length;

        double reconstructionError = snapshot.getPrincipalComponents().reconstructionError(vector);
        double mahalanobisDistance = snapshot.getMahalanobis().distance(vector);

        Map<String, Double> contributions = new LinkedHashMap<>();
        double maxZ = 0;
        for (int j = 0; j < dimensions; j++) {
            double deviation = snapshot.featureStandardDeviation(j);
            double z = abs(vector[j] - snapshot.featureMean(j)) / ((deviation > 0) ? deviation : 1.0);
            contributions.put(snapshot.getFeatureNames().get(j), z);
            maxZ = Math.max(maxZ, z);
        }

        Map<MultivariateMethod, Double> scores = new EnumMap<>(MultivariateMethod.class);
        List<String> explanations = new ArrayList<>();
        for (MultivariateMethod method : methods) {
            double value;
            switch (method) {
            case PCA:
                double totalVariance = snapshot.getPrincipalComponents().totalExplainedVariance();
                value = (totalVariance > 0) ? clipToUnit(reconstructionError / sqrt(totalVariance))
                        : (reconstructionError > 0 ? 1.0 : 0.0);
                if (value > EXPLANATION_THRESHOLD) {
                    explanations.add(String.format("PCA reconstruction error: %.3f", reconstructionError));
                }
                break;
            case MAHALANOBIS:
                value = clipToUnit(mahalanobisDistance / sqrt(2.0 * dimensions));
                if (value > EXPLANATION_THRESHOLD) {
                    explanations.add(String.format("High Mahalanobis distance: %.3f", mahalanobisDistance));
                }
                break;
            case ICA:
                double[] sources = snapshot.getIndependentComponents().transform(vector);
                double total = 0;
                for (double source : sources) {
                    total += abs(source);
                }
                value = (sources.length == 0) ? 0 : clipToUnit(total / sources.length / 3.0);
                if (value > EXPLANATION_THRESHOLD) {
                    explanations.add("ICA detected non-Gaussian patterns");
                }
                break;
            case CORRELATION:
            default:
                value = clipToUnit(maxZ / 3.0);
                if (value > EXPLANATION_THRESHOLD) {
                    explanations.add("Correlation analysis detected anomaly");
                    topContributor(contributions).ifPresent(name -> explanations
                            .add(String.format("Largest deviation in %s (z = %.2f)", name, contributions.get(name))));
                }
            }
            scores.put(method, value);
        }
        if (explanations.isEmpty()) {
            explanations.add("Normal multivariate pattern");
        }

        double ensemble = 0;
        int averaged = 0;
        for (Map.Entry<MultivariateMethod, Double> entry : scores.entrySet()) {
            // a single feature keeps its only direction, so the reconstruction error is always 0
            if (entry.getKey() == MultivariateMethod.PCA && dimensions == 1 && scores.size() > 1) {
                continue;
            }
            ensemble += entry.getValue();
            ++averaged;
        }
        ensemble /= averaged;

        return MultivariateAnomalyResult.builder().pointId(point.getId()).anomaly(ensemble > threshold)
                .anomalyScore(ensemble).confidence(abs(ensemble - 0.5) * 2).severity(Severity.fromScore(ensemble))
                .methodScores(Collections.unmodifiableMap(scores))
                .contributingFeatures(Collections.unmodifiableMap(contributions))
                .explanations(Collections.unmodifiableList(explanations)).mahalanobisDistance(mahalanobisDistance)
                .reconstructionError(reconstructionError).hotellingsT2(mahalanobisDistance * mahalanobisDistance)
                .kernelDistance(kernelDistance(snapshot.referencePoints(), vector)).build();
    }

    static Optional<String> topContributor(Map<String, Double> contributions) {
        return contributions.entrySet().stream().max(Map.Entry.comparingByValue()).map(Map.Entry::getKey);
    }

    static double kernelDistance(double[][] references, double[] vector) {
        double minimum = 1.0;
        for (double[] reference : references) {
            double squared = 0;
            for (int j = 0; j < vector.length; j++) {
                squared += (vector[j] - reference[j]) * (vector[j] - reference[j]);
            }
            minimum = Math.min(minimum, 1 - exp(-KERNEL_GAMMA * squared));
        }
        return minimum;
    }

    /**
     * Pearson correlations between the features of the supplied points. Does not
     * read or modify the trained model.
     */
    public CorrelationMatrix correlationMatrix(List<MultivariateDataPoint> points) {
        checkArgument(points != null && !points.isEmpty(), "points must not be empty");
        List<String> variables = new ArrayList<>(points.get(0).getFeatures().keySet());
        double[][] columns = new double[variables.size()][points.size()];
        for (int i = 0; i < points.size(); i++) {
            double[] vector = points.get(i).toVector(variables);
            for (int j = 0; j < variables.size(); j++) {
                columns[j][i] = vector[j];
            }
        }
        int d = variables.size();
        double[][] matrix = new double[d][d];
        double[][] significance = new double[d][d];
        for (int i = 0; i < d; i++) {
            matrix[i][i] = (StatMath.variance(columns[i]) > 0) ? 1.0 : 0.0;
            significance[i][i] = matrix[i][i];
            for (int j = i + 1; j < d; j++) {
                double r = StatMath.correlation(columns[i], columns[j]);
                matrix[i][j] = matrix[j][i] = r;
                significance[i][j] = significance[j][i] = abs(r);
            }
        }
        return new CorrelationMatrix(Collections.unmodifiableList(variables), matrix, significance);
    }

    public PCAResult performPCA(List<MultivariateDataPoint> points) {
        return performPCA(points, maxPrincipalComponents);
    }

    /**
     * A principal component decomposition of the supplied points. Does not read
     * or modify the trained model.
     */
    public PCAResult performPCA(List<MultivariateDataPoint> points, int numberOfComponents) {
        checkArgument(points != null && !points.isEmpty(), "points must not be empty");
        List<String> variables = new ArrayList<>(points.get(0).getFeatures().keySet());
        double[][] data = new double[points.size()][];
        for (int i = 0; i < points.size(); i++) {
            data[i] = points.get(i).toVector(variables);
        }
        PrincipalComponents pca = PrincipalComponents.fit(data, numberOfComponents, Deadline.none());
        double[] explained = pca.getExplainedVariance();
        double totalVariance = 0;
        for (int j = 0; j < variables.size(); j++) {
            double[] column = new double[data.length];
            for (int i = 0; i < data.length; i++) {
                column[i] = data[i][j];
            }
            totalVariance += StatMath.covariance(column, column);
        }
        double[] cumulative = new double[explained.length];
        double running = 0;
        for (int k = 0; k < explained.length; k++) {
            running += explained[k];
            cumulative[k] = (totalVariance > 0) ? Math.min(1.0, running / totalVariance) : 0;
        }
        double[][] transformed = new double[data.length][];
        double[] errors = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            transformed[i] = pca.transform(data[i]);
            errors[i] = StatMath.euclideanDistance(data[i], pca.inverseTransform(transformed[i]));
        }
        logger.debug("decomposed {} points with {} features into {} components", data.length, variables.size(),
                explained.length);
        return new PCAResult(pca.getComponents(), explained, cumulative, transformed, errors);
    }

    public MultivariateStatistics getDetectionStatistics() {
        TrainedModel snapshot = model.get();
        MultivariateStatistics.MultivariateStatisticsBuilder builder = MultivariateStatistics.builder()
                .trained(snapshot != null).methods(methods).threshold(threshold);
        if (snapshot == null) {
            return builder.featureNames(Collections.emptyList()).build();
        }
        return builder.trainingSize(snapshot.getTrainingSize()).featureNames(snapshot.getFeatureNames())
                .principalComponents(snapshot.getPrincipalComponents().getNumberOfComponents())
                .independentComponents(snapshot.getIndependentComponents().getNumberOfComponents())
                .pseudoInverseUsed(snapshot.getMahalanobis().isPseudoInverse()).build();
    }

    public boolean isTrained() {
        return model.get() != null;
    }

    public Optional<TrainedModel> getModel() {
        return Optional.ofNullable(model.get());
    }

    public double getThreshold() {
        return threshold;
    }

    public Set<MultivariateMethod> getMethods() {
        return methods;
    }

    public static class Builder<T extends Builder<T>> {

        private double threshold = DEFAULT_THRESHOLD;
        private int maxPrincipalComponents = DEFAULT_MAX_PRINCIPAL_COMPONENTS;
        private int independentComponents = DEFAULT_INDEPENDENT_COMPONENTS;
        private int icaIterations = DEFAULT_ICA_ITERATIONS;
        private Set<MultivariateMethod> methods = EnumSet.allOf(MultivariateMethod.class);
        private Optional<Long> randomSeed = Optional.empty();

        public T threshold(double threshold) {
            this.threshold = threshold;
            return (T) this;
        }

        public T maxPrincipalComponents(int maxPrincipalComponents) {
            this.maxPrincipalComponents = maxPrincipalComponents;
            return (T) this;
        }

        public T independentComponents(int independentComponents) {
            this.independentComponents = independentComponents;
            return (T) this;
        }

        public T icaIterations(int icaIterations) {
            this.icaIterations = icaIterations;
            return (T) this;
        }

        public T methods(Set<MultivariateMethod> methods) {
            this.methods = checkNotNull(methods, "methods must not be null");
            return (T) this;
        }

        public T randomSeed(long randomSeed) {
            this.randomSeed = Optional.of(randomSeed);
            return (T) this;
        }

        public MultivariateDetector build() {
            return new MultivariateDetector(this);
        }
    }
}
