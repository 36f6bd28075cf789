package com.grid.analytics.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.grid.analytics.engine.tree.TreeEnsemble;
import com.grid.analytics.model.FeatureSchema;
import com.grid.analytics.model.ModelAlgorithm;
import com.grid.analytics.model.TrainedModel;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/** On-disk form of a {@link TrainedModel}: the model plus the artifact version it was written with. */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelArtifact {

    int artifactSchemaVersion;

    String modelId;

    ModelAlgorithm algorithm;

    Map<String, Double> hyperparameters;

    List<String> inputFeatures;

    FeatureSchema featureSchema;

    long trainedAt;

    int trainingRows;

    long seed;

    TreeEnsemble ensemble;

    static ModelArtifact of(TrainedModel model, int artifactSchemaVersion) {
        return ModelArtifact.builder()
                .artifactSchemaVersion(artifactSchemaVersion)
                .modelId(model.getModelId())
                .algorithm(model.getAlgorithm())
                .hyperparameters(model.getHyperparameters())
                .inputFeatures(model.getInputFeatures())
                .featureSchema(model.getFeatureSchema())
                .trainedAt(model.getTrainedAt())
                .trainingRows(model.getTrainingRows())
                .seed(model.getSeed())
                .ensemble(model.getEnsemble())
                .build();
    }

    TrainedModel toModel() {
        return TrainedModel.builder()
                .modelId(modelId)
                .algorithm(algorithm)
                .hyperparameters(hyperparameters)
                .inputFeatures(inputFeatures)
                .featureSchema(featureSchema)
                .trainedAt(trainedAt)
                .trainingRows(trainingRows)
                .seed(seed)
                .ensemble(ensemble)
                .build();
    }
}
