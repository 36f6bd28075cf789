package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stage lifecycle: {@code PENDING -> RUNNING -> SUCCEEDED | FAILED | SKIPPED}, or
 * {@code PENDING -> SKIPPED} when a prerequisite is missing.
 */
public enum StageState {

    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED;
    }

    public Set<StageState> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, SKIPPED);
            case RUNNING -> EnumSet.of(SUCCEEDED, FAILED, SKIPPED);
            default -> EnumSet.noneOf(StageState.class);
        };
    }

    public boolean canTransitionTo(StageState next) {
        return allowedNext().contains(next);
    }

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
