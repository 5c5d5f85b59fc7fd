package com.supplyplanner.exception;

import lombok.Getter;

@Getter
public abstract class SupplyPlannerException extends RuntimeException {
    private final String errorCode;
    protected SupplyPlannerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected SupplyPlannerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
