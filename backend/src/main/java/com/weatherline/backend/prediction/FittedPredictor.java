package com.weatherline.backend.prediction;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Map;

/**
 * Linear predictor with in-sample fit metrics and feature-importance metadata.
 */
public record FittedPredictor(
        String targetName,
        List<String> featureNames,
        @JsonIgnore double[] coefficients,
        @JsonIgnore double intercept,
        int sampleSize,
        double meanAbsoluteError,
        double rootMeanSquaredError,
        double rSquared,
        Map<String, Double> featureImportance,
        String mostImportantFeature) {

    public double predict(double[] features) {
        if (features.length != coefficients.length) {
            throw new IllegalArgumentException("Expected " + coefficients.length + " features, got " + features.length);
        }
        double value = intercept;
        for (int i = 0; i < features.length; i++) {
            value += coefficients[i] * features[i];
        }
        return value;
    }
}
