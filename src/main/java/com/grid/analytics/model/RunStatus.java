package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {

    SUCCEEDED,
    PARTIALLY_SUCCEEDED,
    FAILED;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
