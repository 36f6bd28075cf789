package com.grid.analytics.controller;

import com.grid.analytics.exception.PipelineErrorCode;
import com.grid.analytics.model.PipelineRun;
import com.grid.analytics.model.PipelineRunRequest;
import com.grid.analytics.model.RunStatus;
import com.grid.analytics.model.StageName;
import com.grid.analytics.repository.PipelineArtifactRepository;
import com.grid.analytics.service.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline", description = "Run the analysis pipeline and read the published results")
public class PipelineController {

    private final PipelineOrchestrator orchestrator;
    private final PipelineArtifactRepository artifactRepository;

    public PipelineController(PipelineOrchestrator orchestrator,
                              PipelineArtifactRepository artifactRepository) {
        this.orchestrator = orchestrator;
        this.artifactRepository = artifactRepository;
    }

    @Operation(summary = "Run the pipeline",
            description = "Builds features from the submitted measurements, then trains and evaluates the demand models, " +
                    "clusters consumption patterns and flags anomalies in parallel, explains the best model and publishes " +
                    "the bundle. Returns 200 for succeeded and partially succeeded runs, 422 when the input fails data " +
                    "quality checks and 500 when the bundle cannot be published.")
    @PostMapping("/runs")
    public ResponseEntity<?> run(@RequestBody PipelineRunRequest request) {
        if (request.getRecords() == null || request.getConfig() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "Both 'records' and 'config' are required"));
        }
        PipelineRun run = orchestrator.run(request.getRecords(), request.getConfig());
        return ResponseEntity.status(statusOf(run)).body(run);
    }

    @Operation(summary = "Re-run selected stages of a published run",
            description = "Rebuilds the features from the submitted measurements and re-executes only the named analytic " +
                    "stages (regression, clustering, anomaly-detection, explanation); the other stages' results are " +
                    "carried over. Re-running regression also re-runs explanation. The result is a new run.")
    @PostMapping("/runs/{runId}/rerun")
    public ResponseEntity<?> rerun(
            @Parameter(description = "Run to derive from", example = "20240101T000000Z-3f9a1c2b")
            @PathVariable String runId,
            @Parameter(description = "Stages to re-execute", example = "clustering,anomaly-detection")
            @RequestParam List<String> stages,
            @RequestBody PipelineRunRequest request) {
        if (request.getRecords() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "'records' is required"));
        }
        Optional<PipelineRun> previous = artifactRepository.loadRun(runId);
        if (previous.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        List<StageName> selected = stages.stream().map(StageName::fromId).toList();
        PipelineRun run = orchestrator.rerun(previous.get(), selected, request.getRecords(), request.getConfig());
        return ResponseEntity.status(statusOf(run)).body(run);
    }

    @Operation(summary = "Get the latest published run",
            description = "Returns the most recently published run with per-stage status and all reports.")
    @GetMapping("/runs/latest")
    public ResponseEntity<PipelineRun> getLatestRun() {
        return ResponseEntity.of(artifactRepository.loadLatest());
    }

    @Operation(summary = "Get a published run by ID")
    @GetMapping("/runs/{runId}")
    public ResponseEntity<PipelineRun> getRun(
            @Parameter(description = "Run ID", example = "20240101T000000Z-3f9a1c2b")
            @PathVariable String runId) {
        return ResponseEntity.of(artifactRepository.loadRun(runId));
    }

    @Operation(summary = "Get the latest model evaluation",
            description = "RMSE, MAE and R² per model family on the temporal hold-out, cross-validation scores, overfit " +
                    "flags and the moving-average baseline.")
    @GetMapping("/runs/latest/evaluation")
    public ResponseEntity<?> getLatestEvaluation() {
        return latestReport(PipelineRun::getEvaluation);
    }

    @Operation(summary = "Get the latest feature attributions",
            description = "Global feature ranking and per-row TreeSHAP attributions of the best model.")
    @GetMapping("/runs/latest/explanation")
    public ResponseEntity<?> getLatestExplanation() {
        return latestReport(PipelineRun::getExplanation);
    }

    @Operation(summary = "Get the latest consumption clusters",
            description = "Cluster id per row, centroids, sizes and silhouette score.")
    @GetMapping("/runs/latest/clusters")
    public ResponseEntity<?> getLatestClusters() {
        return latestReport(PipelineRun::getClusters);
    }

    @Operation(summary = "Get the latest anomaly report",
            description = "Isolation score and flag per row, top contributing features of flagged rows, and the " +
                    "observed contamination.")
    @GetMapping("/runs/latest/anomalies")
    public ResponseEntity<?> getLatestAnomalies() {
        return latestReport(PipelineRun::getAnomalies);
    }

    private ResponseEntity<?> latestReport(Function<PipelineRun, ?> report) {
        return ResponseEntity.of(artifactRepository.loadLatest().map(report));
    }

    private static HttpStatus statusOf(PipelineRun run) {
        if (run.getStatus() != RunStatus.FAILED) {
            return HttpStatus.OK;
        }
        if (PipelineErrorCode.DATA_QUALITY.getLabel().equals(run.getFailureReason())) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
