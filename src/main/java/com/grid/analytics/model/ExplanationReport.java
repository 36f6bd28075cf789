package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Additive feature attributions (TreeSHAP) for one trained model")
public class ExplanationReport {

    long generatedAt;

    @Schema(description = "Model the attributions belong to; stale once that model is superseded")
    String modelId;

    ModelAlgorithm algorithm;

    long modelTrainedAt;

    @Schema(description = "Mean model output over the training data (MW)", example = "35120.4")
    double expectedValue;

    int explainedRows;

    @Schema(description = "Features ranked by mean absolute attribution")
    List<FeatureImportance> globalImportance;

    List<RecordAttribution> records;

    List<String> summary;

    public boolean isStaleFor(TrainedModel current) {
        return current == null || !current.getModelId().equals(modelId);
    }
}
