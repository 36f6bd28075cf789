package com.grid.analytics.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class StageStatus {

    StageState state;

    // Error code label for failures (e.g. TrainingError), short cause for skips.
    String reason;

    String message;

    Long startedAt;

    Long finishedAt;

    /** Compact form: {@code succeeded}, {@code failed:<reason>} or {@code skipped:<reason>}. */
    @JsonProperty("status")
    public String getStatus() {
        return reason == null ? state.label() : state.label() + ":" + reason;
    }

    public static StageStatus pending() {
        return StageStatus.builder().state(StageState.PENDING).build();
    }
}
