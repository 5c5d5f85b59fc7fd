package com.supplyplanner.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Delivery routes per warehouse. Distances are kilometres, times minutes,
 * costs in the currency of the configured rates.
 */
@Value
public class RoutingResult {
    SolveStatus status;
    List<Route> routes;
    double totalDistance;
    double totalTime;
    double totalCost;
    double vehicleUtilization;
    double vehicleCapacity;
    int vehiclesUsed;
    int iterations;
    String message;

    @Builder
    private RoutingResult(SolveStatus status, List<Route> routes, double totalDistance, double totalTime,
                          double totalCost, double vehicleUtilization, double vehicleCapacity,
                          int vehiclesUsed, int iterations, String message) {
        this.status = status;
        this.routes = ResultCollections.list(routes);
        this.totalDistance = totalDistance;
        this.totalTime = totalTime;
        this.totalCost = totalCost;
        this.vehicleUtilization = vehicleUtilization;
        this.vehicleCapacity = vehicleCapacity;
        this.vehiclesUsed = vehiclesUsed;
        this.iterations = iterations;
        this.message = message;
    }

    public static RoutingResult skipped(String reason) {
        return RoutingResult.builder()
                .status(SolveStatus.SKIPPED)
                .message(reason)
                .build();
    }

    @Value
    public static class Route {
        String vehicleId;
        String warehouseId;
        int trip;
        List<Stop> stops;
        double load;
        double totalDistance;
        double totalTime;
        double fuelCost;
        double driverCost;
        double totalCost;
        SolveStatus status;

        @Builder
        private Route(String vehicleId, String warehouseId, int trip, List<Stop> stops, double load,
                      double totalDistance, double totalTime, double fuelCost, double driverCost,
                      double totalCost, SolveStatus status) {
            this.vehicleId = vehicleId;
            this.warehouseId = warehouseId;
            this.trip = trip;
            this.stops = ResultCollections.list(stops);
            this.load = load;
            this.totalDistance = totalDistance;
            this.totalTime = totalTime;
            this.fuelCost = fuelCost;
            this.driverCost = driverCost;
            this.totalCost = totalCost;
            this.status = status;
        }
    }

    @Value
    @Builder
    public static class Stop {
        String locationId;
        double quantity;
        double arrivalTime;
        double serviceTime;
    }
}
