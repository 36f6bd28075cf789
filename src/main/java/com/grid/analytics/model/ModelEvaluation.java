package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Held-out and cross-validated performance of one model family")
public class ModelEvaluation {

    @Schema(description = "Model family", example = "random-forest")
    ModelAlgorithm algorithm;

    String modelId;

    @Schema(description = "Root mean squared error on the evaluation partition (MW)", example = "412.7")
    double rmse;

    @Schema(description = "Mean absolute error on the evaluation partition (MW)", example = "318.2")
    double mae;

    @Schema(description = "Coefficient of determination on the evaluation partition", example = "0.94")
    double r2;

    @Schema(description = "RMSE on the training partition (MW)", example = "180.3")
    double trainRmse;

    @Schema(description = "(evalRmse - trainRmse) / evalRmse", example = "0.56")
    double overfitGap;

    @Schema(description = "True when the overfit gap exceeds the configured threshold; the model is kept")
    boolean overfitFlagged;

    @Schema(description = "Mean RMSE across temporal cross-validation folds (MW)", example = "455.0")
    double cvRmseMean;

    @Schema(description = "Standard deviation of RMSE across folds (MW)", example = "61.2")
    double cvRmseStd;

    int cvFolds;

    @Schema(description = "True when the model's RMSE is below the moving-average baseline RMSE")
    boolean beatsBaseline;

    @Schema(description = "Split-gain importance per input feature, descending, summing to 1")
    Map<String, Double> featureImportance;
}
