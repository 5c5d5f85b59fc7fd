package com.supplyplanner.dto;

public enum SolveStatus {
    OPTIMAL,
    INFEASIBLE,
    TIME_LIMIT_REACHED,
    SKIPPED
}
