package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-run analysis settings. Cluster count and contamination rate have no defaults:
 * they depend on the dataset and must be supplied by the caller.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Per-run analysis configuration")
public class PipelineConfig {

    @Schema(description = "Number of consumption clusters (required, >= 2)", example = "4")
    Integer clusterCount;

    @Schema(description = "Expected anomalous fraction (required, in (0, 0.5])", example = "0.1")
    Double contaminationRate;

    @Builder.Default
    @Schema(description = "Share of rows (oldest first) used for training", example = "0.8")
    Double trainRatio = 0.8;

    @Builder.Default
    @Schema(description = "Temporal cross-validation folds", example = "5")
    Integer cvFolds = 5;

    @Builder.Default
    @Schema(description = "Seed for every randomized algorithm in the run", example = "42")
    Long seed = 42L;

    /**
     * @throws IllegalArgumentException listing every invalid or missing setting
     */
    public PipelineConfig validate() {
        List<String> problems = new ArrayList<>();
        if (clusterCount == null) {
            problems.add("clusterCount is required");
        } else if (clusterCount < 2) {
            problems.add("clusterCount must be at least 2");
        }
        if (contaminationRate == null) {
            problems.add("contaminationRate is required");
        } else if (!(contaminationRate > 0.0 && contaminationRate <= 0.5)) {
            problems.add("contaminationRate must be in (0, 0.5]");
        }
        if (trainRatio == null || !(trainRatio > 0.0 && trainRatio < 1.0)) {
            problems.add("trainRatio must be in (0, 1)");
        }
        if (cvFolds == null || cvFolds < 2) {
            problems.add("cvFolds must be at least 2");
        }
        if (seed == null) {
            problems.add("seed must not be null");
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("Invalid pipeline configuration: " + String.join("; ", problems));
        }
        return this;
    }
}
