package com.supplyplanner.exception;

import java.util.UUID;

public class ScenarioRunNotFoundException extends SupplyPlannerException {
    public ScenarioRunNotFoundException(UUID runId) {
        super("SCENARIO_RUN_NOT_FOUND", "Scenario run with id '" + runId + "' not found.");
    }
}
