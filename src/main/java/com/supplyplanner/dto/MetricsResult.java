package com.supplyplanner.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
public class MetricsResult {
    double totalCost;
    double allocationCost;
    double routingCost;
    double capacityUtilization;
    double demandFulfillment;
    double costPerUnit;
    double vehicleUtilization;
    double totalDistance;
    List<ConstraintViolation> constraintViolations;

    @Builder
    private MetricsResult(double totalCost, double allocationCost, double routingCost, double capacityUtilization,
                          double demandFulfillment, double costPerUnit, double vehicleUtilization,
                          double totalDistance, List<ConstraintViolation> constraintViolations) {
        this.totalCost = totalCost;
        this.allocationCost = allocationCost;
        this.routingCost = routingCost;
        this.capacityUtilization = capacityUtilization;
        this.demandFulfillment = demandFulfillment;
        this.costPerUnit = costPerUnit;
        this.vehicleUtilization = vehicleUtilization;
        this.totalDistance = totalDistance;
        this.constraintViolations = ResultCollections.list(constraintViolations);
    }

    public enum ViolationType {
        DEMAND_SHORTFALL,
        CAPACITY_EXCEEDED,
        ROUTE_INFEASIBLE,
        VEHICLE_OVERLOAD
    }

    @Value
    @Builder
    public static class ConstraintViolation {
        ViolationType type;
        String locationId;
        String detail;
    }
}
