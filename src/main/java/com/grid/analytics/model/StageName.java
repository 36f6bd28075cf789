package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StageName {

    FEATURE_BUILD("feature-build"),
    REGRESSION("regression"),
    CLUSTERING("clustering"),
    ANOMALY_DETECTION("anomaly-detection"),
    EXPLANATION("explanation"),
    PERSISTENCE("persistence");

    private final String id;

    StageName(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /** Analytic stages that can be re-executed on their own. */
    public boolean isRerunnable() {
        return this == REGRESSION || this == CLUSTERING || this == ANOMALY_DETECTION || this == EXPLANATION;
    }

    @JsonCreator
    public static StageName fromId(String id) {
        for (StageName stage : values()) {
            if (stage.id.equalsIgnoreCase(id) || stage.name().equalsIgnoreCase(id)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown stage: " + id);
    }
}
