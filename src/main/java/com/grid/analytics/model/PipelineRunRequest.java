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
@Schema(description = "Measurements to analyse and the per-run configuration")
public class PipelineRunRequest {

    @Schema(description = "Raw grid measurements, in any order")
    List<RawRecord> records;

    @Schema(description = "Run configuration; on a re-run, omitted means the original run's configuration")
    PipelineConfig config;
}
