package com.supplyplanner.dto;

/**
 * Lifecycle of a scenario run. Stages advance strictly in declaration order;
 * any stage may drop to {@link #FAILED}.
 */
public enum RunStage {
    RECEIVED,
    TRANSFORMING,
    FORECASTING,
    ALLOCATING,
    ROUTING,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canAdvanceTo(RunStage next) {
        if (isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() == ordinal() + 1;
    }
}
