package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline invocation. Built once by the orchestrator and never changed;
 * a re-run produces a new instance with a new run id.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Outcome of one pipeline run: per-stage status and all reports")
public class PipelineRun {

    @Schema(description = "Run id, sortable by creation time", example = "20240101T000000Z-3f9a1c2b")
    String runId;

    @Schema(description = "Run this one was derived from by a stage re-run, if any")
    String parentRunId;

    long createdAt;

    long completedAt;

    RunStatus status;

    @Schema(description = "Error code of the fatal failure, when status is failed", example = "DataQualityError")
    String failureReason;

    PipelineConfig config;

    @Schema(description = "Per-stage status keyed by stage id, in execution order")
    Map<String, StageStatus> stages;

    FeatureBuildSummary featureSummary;

    EvaluationReport evaluation;

    ClusterAssignment clusters;

    AnomalyReport anomalies;

    ExplanationReport explanation;

    // Persisted as separate model artifacts, not inline.
    @JsonIgnore
    @Singular
    List<TrainedModel> models;

    /** {@code succeeded}, {@code partially_succeeded} or {@code failed:<code>}. */
    @JsonProperty("statusLine")
    public String getStatusLine() {
        return failureReason == null ? status.label() : status.label() + ":" + failureReason;
    }

    public StageStatus stage(StageName name) {
        return stages.get(name.getId());
    }

    @JsonIgnore
    public TrainedModel getBestModel() {
        return bestModel(models, evaluation);
    }

    /** The model the evaluation ranked best, or {@code null} if none was trained. */
    public static TrainedModel bestModel(List<TrainedModel> models, EvaluationReport evaluation) {
        if (evaluation == null || evaluation.getBestModelId() == null || models == null) {
            return null;
        }
        return models.stream()
                .filter(m -> m.getModelId().equals(evaluation.getBestModelId()))
                .findFirst()
                .orElse(null);
    }

    public static class PipelineRunBuilder {

        // Copied so later changes to the caller's map cannot reach the run.
        public PipelineRunBuilder stages(Map<String, StageStatus> stages) {
            this.stages = stages == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(stages));
            return this;
        }
    }
}
