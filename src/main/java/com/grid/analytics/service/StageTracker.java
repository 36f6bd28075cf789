package com.grid.analytics.service;

import com.grid.analytics.exception.PipelineErrorCode;
import com.grid.analytics.model.StageName;
import com.grid.analytics.model.StageState;
import com.grid.analytics.model.StageStatus;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run stage bookkeeping. Every stage starts {@code PENDING}; transitions outside
 * {@link StageState#allowedNext()} are rejected with {@link IllegalStateException}.
 * Safe to update from the stage threads of one run.
 */
public class StageTracker {

    private final Map<StageName, StageStatus> stages = new EnumMap<>(StageName.class);

    public StageTracker() {
        for (StageName stage : StageName.values()) {
            stages.put(stage, StageStatus.pending());
        }
    }

    public synchronized void start(StageName stage) {
        transition(stage, current(stage).toBuilder()
                .state(StageState.RUNNING)
                .startedAt(System.currentTimeMillis())
                .build());
    }

    public synchronized void succeed(StageName stage) {
        transition(stage, finished(stage, StageState.SUCCEEDED, null, null));
    }

    public synchronized void fail(StageName stage, PipelineErrorCode code, String message) {
        transition(stage, finished(stage, StageState.FAILED, code.getLabel(), message));
    }

    public synchronized void skip(StageName stage, String reason, String message) {
        transition(stage, finished(stage, StageState.SKIPPED, reason, message));
    }

    /** Skip every stage that has not started yet. */
    public synchronized void skipPending(String reason, String message) {
        for (StageName stage : StageName.values()) {
            if (current(stage).getState() == StageState.PENDING) {
                skip(stage, reason, message);
            }
        }
    }

    /** Adopt the terminal status a stage reached in an earlier run. */
    public synchronized void carryOver(StageName stage, StageStatus previous) {
        if (current(stage).getState() != StageState.PENDING) {
            throw new IllegalStateException("Stage " + stage.getId() + " already " + current(stage).getState().label());
        }
        if (previous == null || !previous.getState().isTerminal()) {
            throw new IllegalStateException("Stage " + stage.getId() + " has no finished status to carry over");
        }
        stages.put(stage, previous);
    }

    public synchronized StageState state(StageName stage) {
        return current(stage).getState();
    }

    public synchronized boolean anyFailed() {
        return stages.values().stream().anyMatch(s -> s.getState() == StageState.FAILED);
    }

    /** Statuses keyed by stage id, in pipeline order. */
    public synchronized Map<String, StageStatus> snapshot() {
        Map<String, StageStatus> copy = new LinkedHashMap<>();
        stages.forEach((stage, status) -> copy.put(stage.getId(), status));
        return copy;
    }

    private StageStatus current(StageName stage) {
        return stages.get(stage);
    }

    private StageStatus finished(StageName stage, StageState state, String reason, String message) {
        return current(stage).toBuilder()
                .state(state)
                .reason(reason)
                .message(message)
                .finishedAt(System.currentTimeMillis())
                .build();
    }

    private void transition(StageName stage, StageStatus next) {
        StageState from = current(stage).getState();
        if (!from.canTransitionTo(next.getState())) {
            throw new IllegalStateException("Illegal transition for stage " + stage.getId()
                    + ": " + from.label() + " -> " + next.getState().label());
        }
        stages.put(stage, next);
    }
}
