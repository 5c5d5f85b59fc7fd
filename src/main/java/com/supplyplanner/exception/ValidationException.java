package com.supplyplanner.exception;

import lombok.Getter;

import java.util.List;

/**
 * Input snapshot or scenario spec failed structural or referential checks.
 * Carries every problem found, not just the first.
 */
@Getter
public class ValidationException extends SupplyPlannerException {
    private final List<String> problems;

    public ValidationException(String problem) {
        this(List.of(problem));
    }

    public ValidationException(List<String> problems) {
        super("VALIDATION_ERROR", "Invalid input: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }
}
