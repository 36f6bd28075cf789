package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to turn raw records into the exact feature layout a model was trained on:
 * column order, categorical encodings, imputation medians and scaling parameters.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class FeatureSchema {

    int schemaVersion;

    List<String> featureNames;

    List<String> scaledFeatures;

    Map<String, ScalingParameter> scaling;

    Map<String, Integer> regionEncoding;

    Map<String, Integer> sourceEncoding;

    // column -> region -> median
    Map<String, Map<String, Double>> regionMedians;

    Map<String, Double> globalMedians;

    List<Integer> lagSteps;

    int rollingWindow;

    String zoneId;

    public boolean hasFeature(String name) {
        return featureNames.contains(name);
    }
}
