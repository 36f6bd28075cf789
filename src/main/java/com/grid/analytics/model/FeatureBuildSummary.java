package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureBuildSummary {

    int inputRows;

    int rowsWithoutTimestamp;

    int imputedValues;

    int outliersRemoved;

    // Leading rows per region dropped because the largest lag was not yet available.
    int rowsWithoutHistory;

    int outputRows;

    int featureCount;

    List<String> regions;

    Long periodStart;

    Long periodEnd;
}
