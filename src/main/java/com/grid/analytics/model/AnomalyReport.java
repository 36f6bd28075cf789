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
@Schema(description = "Anomaly flags for every feature row plus the observed contamination")
public class AnomalyReport {

    long generatedAt;

    @Schema(description = "Configured expected contamination fraction", example = "0.1")
    double configuredContamination;

    @Schema(description = "Fraction of rows actually flagged", example = "0.1")
    double observedContamination;

    @Schema(description = "Score at or above which a row is flagged", example = "0.61")
    double scoreThreshold;

    int flaggedCount;

    int totalRows;

    Double meanLoadAnomalous;

    Double meanLoadNormal;

    List<AnomalyFlag> flags;

    List<String> summary;
}
