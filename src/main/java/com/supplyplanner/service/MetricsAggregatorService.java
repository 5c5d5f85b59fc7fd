package com.supplyplanner.service;

import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.dto.AllocationResult;
import com.supplyplanner.dto.ForecastResult;
import com.supplyplanner.dto.MetricsResult;
import com.supplyplanner.dto.RoutingResult;
import com.supplyplanner.dto.SolveStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Folds forecast, allocation and routing into headline metrics and constraint violations.
 * Any missing input counts as empty; aggregation itself never fails.
 */
@Service
@RequiredArgsConstructor
public class MetricsAggregatorService {

    private static final double EPS = 1e-9;

    private final OptimizerProperties properties;

    public MetricsResult aggregate(ForecastResult forecast, AllocationResult allocation, RoutingResult routing) {
        double tolerance = properties.getMetrics().getTolerance();
        double allocationCost = allocation != null ? allocation.getObjectiveValue() : 0.0;
        double routingCost = routing != null ? routing.getTotalCost() : 0.0;
        double allocated = allocation != null ? allocation.totalAllocated() : 0.0;
        double demanded = forecast != null ? forecast.totalStoreDemand() : 0.0;
        double totalCost = allocationCost + routingCost;

        double fulfillment;
        if (forecast == null) {
            fulfillment = 0.0;
        } else if (demanded <= EPS) {
            fulfillment = 100.0;
        } else {
            fulfillment = Math.min(100.0, allocated / demanded * 100.0);
        }

        List<MetricsResult.ConstraintViolation> violations = new ArrayList<>();
        checkDemand(forecast, allocation, tolerance, violations);
        checkCapacity(allocation, tolerance, violations);
        checkRoutes(routing, tolerance, violations);

        return MetricsResult.builder()
                .totalCost(totalCost)
                .allocationCost(allocationCost)
                .routingCost(routingCost)
                .capacityUtilization(allocation != null ? allocation.getCapacityUtilization() : 0.0)
                .demandFulfillment(fulfillment)
                .costPerUnit(allocated > EPS ? totalCost / allocated : 0.0)
                .vehicleUtilization(routing != null ? routing.getVehicleUtilization() : 0.0)
                .totalDistance(routing != null ? routing.getTotalDistance() : 0.0)
                .constraintViolations(violations)
                .build();
    }

    private void checkDemand(ForecastResult forecast, AllocationResult allocation, double tolerance,
                             List<MetricsResult.ConstraintViolation> violations) {
        Map<String, Double> required;
        if (allocation != null && !allocation.getRequiredDemand().isEmpty()) {
            required = allocation.getRequiredDemand();
        } else if (forecast != null) {
            required = forecast.getStoreDemand();
        } else {
            return;
        }
        for (Map.Entry<String, Double> store : required.entrySet()) {
            double received = allocation != null ? allocation.receivedBy(store.getKey()) : 0.0;
            if (received < store.getValue() * (1.0 - tolerance) - EPS) {
                violations.add(violation(MetricsResult.ViolationType.DEMAND_SHORTFALL, store.getKey(),
                        String.format("received %.4f of required %.4f", received, store.getValue())));
            }
        }
    }

    private void checkCapacity(AllocationResult allocation, double tolerance,
                               List<MetricsResult.ConstraintViolation> violations) {
        if (allocation == null) {
            return;
        }
        for (Map.Entry<String, Double> warehouse : allocation.getWarehouseCapacity().entrySet()) {
            double shipped = allocation.shippedFrom(warehouse.getKey());
            if (shipped > warehouse.getValue() * (1.0 + tolerance) + EPS) {
                violations.add(violation(MetricsResult.ViolationType.CAPACITY_EXCEEDED, warehouse.getKey(),
                        String.format("shipped %.4f against capacity %.4f", shipped, warehouse.getValue())));
            }
        }
    }

    private void checkRoutes(RoutingResult routing, double tolerance,
                             List<MetricsResult.ConstraintViolation> violations) {
        if (routing == null) {
            return;
        }
        for (RoutingResult.Route route : routing.getRoutes()) {
            if (route.getStatus() == SolveStatus.INFEASIBLE) {
                for (RoutingResult.Stop stop : route.getStops()) {
                    violations.add(violation(MetricsResult.ViolationType.ROUTE_INFEASIBLE, stop.getLocationId(),
                            "no finite route from " + route.getWarehouseId()));
                }
            } else if (routing.getVehicleCapacity() > 0
                    && route.getLoad() > routing.getVehicleCapacity() * (1.0 + tolerance) + EPS) {
                violations.add(violation(MetricsResult.ViolationType.VEHICLE_OVERLOAD, route.getWarehouseId(),
                        String.format("%s trip %d carries %.4f over capacity %.4f", route.getVehicleId(),
                                route.getTrip(), route.getLoad(), routing.getVehicleCapacity())));
            }
        }
    }

    private static MetricsResult.ConstraintViolation violation(MetricsResult.ViolationType type, String locationId,
                                                               String detail) {
        return MetricsResult.ConstraintViolation.builder()
                .type(type)
                .locationId(locationId)
                .detail(detail)
                .build();
    }
}
