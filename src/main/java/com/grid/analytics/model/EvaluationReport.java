package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Evaluation of all regression families against the moving-average baseline")
public class EvaluationReport {

    long generatedAt;

    @Schema(description = "Regression target", example = "load_mw")
    String target;

    int trainRows;

    int evaluationRows;

    @Schema(description = "Timestamp of the first evaluation row; every training row is earlier or equal")
    long splitTimestamp;

    @Schema(description = "Moving-average window of the baseline, in rows per region", example = "24")
    int baselineWindow;

    @Schema(description = "Baseline RMSE on the evaluation partition (MW)", example = "2150.4")
    double baselineRmse;

    double baselineMae;

    double overfitThreshold;

    List<ModelEvaluation> models;

    @Schema(description = "Family with the lowest evaluation RMSE", example = "gradient-boosted-trees")
    ModelAlgorithm bestAlgorithm;

    String bestModelId;

    @Schema(description = "Families that failed to train, with the reason")
    Map<String, String> failedAlgorithms;

    public ModelEvaluation evaluationOf(ModelAlgorithm algorithm) {
        return models.stream().filter(m -> m.getAlgorithm() == algorithm).findFirst().orElse(null);
    }
}
