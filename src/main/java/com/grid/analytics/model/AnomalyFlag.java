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
@Schema(description = "Isolation-forest verdict for one feature row")
public class AnomalyFlag {

    int rowIndex;

    long timestamp;

    String region;

    @Schema(description = "Isolation score in (0, 1); higher is more anomalous", example = "0.68")
    double score;

    boolean anomalous;

    @Schema(description = "Top contributing features (score drop when reset to the mean), flagged rows only")
    Map<String, Double> topFactors;
}
