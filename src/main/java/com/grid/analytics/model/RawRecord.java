package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "A time-stamped grid measurement for one region")
public class RawRecord {

    @Schema(description = "Measurement time in epoch milliseconds (UTC)", example = "1704067200000")
    Long timestamp;

    @Schema(description = "Grid subsystem / region code", example = "SE/CO")
    String region;

    @Schema(description = "Load in MW; null when the measurement is missing", example = "38250.5")
    Double loadMw;

    @Schema(description = "Marginal operating cost / spot price in R$/MWh", example = "112.4")
    Double priceRsMwh;

    @Schema(description = "Ambient temperature in degrees Celsius", example = "27.3")
    Double temperatureC;

    @Schema(description = "Optional originating dataset / source system", example = "ONS")
    String source;

    @Schema(description = "Optional holiday flag", example = "false")
    Boolean holiday;
}
