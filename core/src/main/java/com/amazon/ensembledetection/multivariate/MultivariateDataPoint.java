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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;

/**
 * A labeled observation: an ordered map from feature name to value, with an
 * optional identifier and timestamp.
 */
@Getter
public class MultivariateDataPoint {

    private final String id;

    private final long timestamp;

    private final Map<String, Double> features;

    public MultivariateDataPoint(Map<String, Double> features) {
        this(null, 0L, features);
    }

    public MultivariateDataPoint(String id, long timestamp, Map<String, Double> features) {
        checkNotNull(features, "features must not be null");
        this.id = id;
        this.timestamp = timestamp;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    /**
     * convenience constructor naming the features f0, f1, ...
     */
    public static MultivariateDataPoint of(double... values) {
        LinkedHashMap<String, Double> features = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            features.put("f" + i, values[i]);
        }
        return new MultivariateDataPoint(features);
    }

    /**
     * vectorizes the point in the supplied feature order; absent features are 0
     *
     * @param featureNames the ordered feature names
     * @return the values in that order
     */
    public double[] toVector(List<String> featureNames) {
        double[] vector = new double[featureNames.size()];
        for (int i = 0; i < vector.length; i++) {
            Double value = features.get(featureNames.get(i));
            vector[i] = (value == null) ? 0 : value;
        }
        return vector;
    }

    public double sumOfFeatures() {
        double sum = 0;
        for (Double value : features.values()) {
            sum += (value == null) ? 0 : value;
        }
        return sum;
    }

    public double getFeature(String name) {
        Double value = features.get(name);
        checkArgument(value != null, "unknown feature " + name);
        return value;
    }
}
