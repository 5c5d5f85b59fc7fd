package com.supplyplanner.exception;

public class InternalSolverException extends SupplyPlannerException {
    public InternalSolverException(String message) {
        super("INTERNAL_SOLVER_ERROR", message);
    }
    public InternalSolverException(String message, Throwable cause) {
        super("INTERNAL_SOLVER_ERROR", message, cause);
    }
}
