package com.weatherline.backend.prediction;

import java.util.List;

/**
 * Fits a predictor of one production metric from weather features.
 */
public interface PredictorFitter {

    /**
     * @param targetName   name of the predicted metric
     * @param featureNames one name per feature column
     * @param features     one row per sample, columns in {@code featureNames} order
     * @param targets      one value per sample
     * @throws IllegalArgumentException if the sample is too small or the shapes disagree
     */
    FittedPredictor fit(String targetName, List<String> featureNames, double[][] features, double[] targets);
}
