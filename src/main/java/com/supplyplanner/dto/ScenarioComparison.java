package com.supplyplanner.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Scenario minus baseline for each headline metric.
 */
@Value
@Builder
public class ScenarioComparison {
    double costDelta;
    double capacityUtilizationDelta;
    double demandFulfillmentDelta;
    double routeDistanceDelta;
    int constraintViolationDelta;
    boolean improvement;

    public static ScenarioComparison between(MetricsResult baseline, MetricsResult scenario) {
        double costDelta = scenario.getTotalCost() - baseline.getTotalCost();
        return ScenarioComparison.builder()
                .costDelta(costDelta)
                .capacityUtilizationDelta(scenario.getCapacityUtilization() - baseline.getCapacityUtilization())
                .demandFulfillmentDelta(scenario.getDemandFulfillment() - baseline.getDemandFulfillment())
                .routeDistanceDelta(scenario.getTotalDistance() - baseline.getTotalDistance())
                .constraintViolationDelta(scenario.getConstraintViolations().size()
                        - baseline.getConstraintViolations().size())
                .improvement(costDelta < 0)
                .build();
    }
}
