package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordAttribution {

    int rowIndex;

    long timestamp;

    String region;

    double prediction;

    // expectedValue + sum(attributions) == prediction
    Map<String, Double> attributions;
}
