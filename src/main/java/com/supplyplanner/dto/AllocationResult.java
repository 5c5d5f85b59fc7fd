package com.supplyplanner.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Warehouse-to-store assignment. {@code allocations} is keyed warehouse, then store;
 * it is empty whenever the status is {@link SolveStatus#INFEASIBLE}. All maps are read-only.
 */
@Value
public class AllocationResult {
    SolveStatus status;
    Map<String, Map<String, Double>> allocations;
    double objectiveValue;
    double capacityUtilization;
    Map<String, Double> warehouseUtilization;
    Map<String, Double> storeFulfillment;
    Map<String, Double> requiredDemand;
    Map<String, Double> warehouseCapacity;
    int edgesUsed;
    int iterations;
    String message;

    @Builder
    private AllocationResult(SolveStatus status, Map<String, Map<String, Double>> allocations,
                             double objectiveValue, double capacityUtilization,
                             Map<String, Double> warehouseUtilization, Map<String, Double> storeFulfillment,
                             Map<String, Double> requiredDemand, Map<String, Double> warehouseCapacity,
                             int edgesUsed, int iterations, String message) {
        this.status = status;
        this.allocations = ResultCollections.nestedMap(allocations);
        this.objectiveValue = objectiveValue;
        this.capacityUtilization = capacityUtilization;
        this.warehouseUtilization = ResultCollections.map(warehouseUtilization);
        this.storeFulfillment = ResultCollections.map(storeFulfillment);
        this.requiredDemand = ResultCollections.map(requiredDemand);
        this.warehouseCapacity = ResultCollections.map(warehouseCapacity);
        this.edgesUsed = edgesUsed;
        this.iterations = iterations;
        this.message = message;
    }

    public double totalAllocated() {
        return allocations.values().stream()
                .flatMap(m -> m.values().stream())
                .mapToDouble(Double::doubleValue)
                .sum();
    }

    public double receivedBy(String storeId) {
        return allocations.values().stream()
                .mapToDouble(m -> m.getOrDefault(storeId, 0.0))
                .sum();
    }

    public double shippedFrom(String warehouseId) {
        return allocations.getOrDefault(warehouseId, Map.of()).values().stream()
                .mapToDouble(Double::doubleValue)
                .sum();
    }
}
