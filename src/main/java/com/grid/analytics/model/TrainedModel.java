package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.grid.analytics.engine.tree.TreeEnsemble;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * A fitted regression model together with the exact input layout it was trained on.
 * Never mutated; a later training run produces a new instance with a new id.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrainedModel {

    String modelId;

    ModelAlgorithm algorithm;

    Map<String, Double> hyperparameters;

    // Model inputs, in order: the matrix features minus the target.
    List<String> inputFeatures;

    FeatureSchema featureSchema;

    long trainedAt;

    int trainingRows;

    long seed;

    TreeEnsemble ensemble;

    public double predict(double[] inputs) {
        return ensemble.predict(inputs);
    }

    /**
     * Predict every row of a matrix.
     *
     * @throws IllegalArgumentException if the matrix layout differs from the training layout
     */
    public double[] predict(FeatureMatrix matrix) {
        requireCompatible(matrix);
        return ensemble.predict(matrix.select(inputFeatures));
    }

    public void requireCompatible(FeatureMatrix matrix) {
        if (!featureSchema.getFeatureNames().equals(matrix.getFeatureNames())) {
            throw new IllegalArgumentException("Matrix features " + matrix.getFeatureNames()
                    + " do not match the model's training features " + featureSchema.getFeatureNames());
        }
    }
}
