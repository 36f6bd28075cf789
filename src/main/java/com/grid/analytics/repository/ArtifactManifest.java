package com.grid.analytics.repository;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArtifactManifest {

    int artifactSchemaVersion;

    int featureSchemaVersion;

    String runId;

    long createdAt;

    // Paths relative to the run directory.
    List<String> files;
}
