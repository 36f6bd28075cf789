package com.grid.analytics.controller;

import com.grid.analytics.repository.PipelineArtifactRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Metadata of the demand models trained by a run")
public class ModelController {

    private final PipelineArtifactRepository artifactRepository;

    public ModelController(PipelineArtifactRepository artifactRepository) {
        this.artifactRepository = artifactRepository;
    }

    @Operation(summary = "Get model metadata for a run",
            description = "Returns one entry per trained model family: model id, hyperparameters, tree count, " +
                    "input feature count, training rows, training timestamp and whether it is the run's best model.")
    @GetMapping("/{runId}")
    public ResponseEntity<?> getModelMetadata(
            @Parameter(description = "Run ID, or 'latest'", example = "20240101T000000Z-3f9a1c2b")
            @PathVariable String runId) {
        String resolved = "latest".equals(runId)
                ? artifactRepository.latestRunId().orElse(null)
                : runId;
        if (resolved == null) {
            return ResponseEntity.notFound().build();
        }
        List<Map<String, Object>> metadata = artifactRepository.getModelMetadata(resolved);
        if (metadata.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(metadata);
    }
}
