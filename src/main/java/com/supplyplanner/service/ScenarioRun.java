package com.supplyplanner.service;

import com.supplyplanner.dto.RunStage;
import com.supplyplanner.dto.ScenarioResult;
import com.supplyplanner.dto.ScenarioRunStatus;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Mutable progress record of one scenario run. Stage changes are serialized and must
 * follow {@link RunStage} order; a pending cancellation aborts the next stage change.
 */
final class ScenarioRun {
    private final UUID runId;
    private final String scenarioName;
    private final String baselineFingerprint;
    private final Instant createdAt;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile RunStage stage;
    private volatile RunStage failedStage;
    private volatile boolean cancelRequested;
    private volatile String message;
    private volatile ScenarioResult result;

    ScenarioRun(UUID runId, String scenarioName, String baselineFingerprint) {
        this.runId = runId;
        this.scenarioName = scenarioName;
        this.baselineFingerprint = baselineFingerprint;
        this.createdAt = Instant.now();
        this.stage = RunStage.RECEIVED;
        this.message = "Received";
    }

    UUID runId() {
        return runId;
    }

    RunStage stage() {
        return stage;
    }

    Instant createdAt() {
        return createdAt;
    }

    ScenarioResult result() {
        return result;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    boolean isTerminal() {
        return stage.isTerminal();
    }

    synchronized void markStarted() {
        this.startedAt = Instant.now();
        this.message = "Running";
    }

    synchronized void advance(RunStage next) {
        if (cancelRequested) {
            throw new CancellationException("Scenario run " + runId + " cancelled");
        }
        transition(next);
        this.message = "Entered " + next;
    }

    synchronized void markCompleted(ScenarioResult result) {
        if (cancelRequested) {
            throw new CancellationException("Scenario run " + runId + " cancelled");
        }
        transition(RunStage.COMPLETED);
        this.result = result;
        this.completedAt = Instant.now();
        this.message = "Completed";
    }

    synchronized void markFailed(RunStage at, String reason) {
        if (stage.isTerminal()) {
            return;
        }
        this.failedStage = at;
        this.stage = RunStage.FAILED;
        this.completedAt = Instant.now();
        this.message = reason;
    }

    /** Returns false when the run already finished. */
    synchronized boolean requestCancel() {
        if (stage.isTerminal()) {
            return false;
        }
        this.cancelRequested = true;
        return true;
    }

    ScenarioRunStatus toStatus() {
        return ScenarioRunStatus.builder()
                .runId(runId)
                .scenarioName(scenarioName)
                .baselineFingerprint(baselineFingerprint)
                .stage(stage)
                .failedStage(failedStage)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .cancelRequested(cancelRequested)
                .message(message)
                .result(result)
                .build();
    }

    private void transition(RunStage next) {
        if (!stage.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal run transition " + stage + " -> " + next + " for run " + runId);
        }
        this.stage = next;
    }
}
