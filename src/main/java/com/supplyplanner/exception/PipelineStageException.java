package com.supplyplanner.exception;

import com.supplyplanner.dto.RunStage;
import lombok.Getter;

/**
 * A pipeline stage failed. The stage and the fingerprint of the snapshot being
 * optimized travel with the error; the original failure is the cause.
 */
@Getter
public class PipelineStageException extends SupplyPlannerException {
    private final RunStage stage;
    private final String fingerprint;

    public PipelineStageException(RunStage stage, String fingerprint, Throwable cause) {
        super("PIPELINE_STAGE_FAILED",
              "Stage " + stage + " failed for snapshot " + abbreviate(fingerprint) + ": " + reason(cause),
              cause);
        this.stage = stage;
        this.fingerprint = fingerprint;
    }

    private static String reason(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String abbreviate(String fingerprint) {
        if (fingerprint == null) return "<unknown>";
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
