package com.supplyplanner.service;

import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.TravelMatrix;
import com.supplyplanner.dto.AllocationResult;
import com.supplyplanner.dto.RoutingResult;
import com.supplyplanner.dto.SolveStatus;
import com.supplyplanner.solver.DeliveryStop;
import com.supplyplanner.solver.RouteImprover;
import com.supplyplanner.solver.SavingsRouteBuilder;
import com.supplyplanner.solver.SolveBudget;
import com.supplyplanner.solver.TravelMatrices;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds delivery routes from each warehouse to the stores it supplies.
 * <p>
 * Quantities larger than a truck are split: each full truckload goes out and back on its own,
 * the remainders are routed with Clarke-Wright savings and then improved by 2-opt and relocate
 * moves. Routes are handed to the warehouse's vehicles round-robin, so a vehicle may run several trips.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingOptimizerService {

    private static final double EPS = 1e-9;

    private final OptimizerProperties properties;
    private final SavingsRouteBuilder savingsRouteBuilder = new SavingsRouteBuilder();
    private final RouteImprover routeImprover = new RouteImprover();

    private record PlannedRoute(List<DeliveryStop> stops, boolean feasible) {
    }

    public RoutingResult route(InputSnapshot snapshot, AllocationResult allocation) {
        if (allocation == null || allocation.getStatus() == SolveStatus.INFEASIBLE) {
            return RoutingResult.skipped("Allocation is infeasible; nothing to route");
        }
        OptimizerProperties.Routing config = properties.getRouting();
        double capacity = config.getVehicleCapacity();

        TravelMatrix distanceMatrix = snapshot.getDistanceMatrix() != null
                ? snapshot.getDistanceMatrix()
                : TravelMatrices.haversine(snapshot.getLocations());
        TravelMatrix timeMatrix = snapshot.getTimeMatrix() != null
                ? snapshot.getTimeMatrix()
                : TravelMatrices.minutesAtSpeed(distanceMatrix, config.getAverageSpeedKmh());
        double[][] distance = alignedRows(distanceMatrix, distanceMatrix);
        double[][] time = alignedRows(timeMatrix, distanceMatrix);

        SolveBudget budget = SolveBudget.of(config.getMaxIterations(), config.getTimeLimit());
        List<RoutingResult.Route> routes = new ArrayList<>();
        boolean budgetHit = false;
        Map<String, Map<String, Double>> byWarehouse = new TreeMap<>(allocation.getAllocations());

        for (Map.Entry<String, Map<String, Double>> entry : byWarehouse.entrySet()) {
            String warehouseId = entry.getKey();
            int depot = distanceMatrix.indexOf(warehouseId);
            List<PlannedRoute> planned = new ArrayList<>();
            List<DeliveryStop> pooled = new ArrayList<>();

            for (Map.Entry<String, Double> delivery : new TreeMap<>(entry.getValue()).entrySet()) {
                int node = distanceMatrix.indexOf(delivery.getKey());
                double remaining = delivery.getValue();
                boolean reachable = Double.isFinite(distance[depot][node]) && Double.isFinite(distance[node][depot])
                        && Double.isFinite(time[depot][node]) && Double.isFinite(time[node][depot]);
                if (!reachable) {
                    log.warn("Store unreachable from warehouse | warehouseId={} | storeId={}", warehouseId, delivery.getKey());
                    planned.add(new PlannedRoute(List.of(new DeliveryStop(node, delivery.getKey(), remaining)), false));
                    continue;
                }
                while (remaining > capacity + EPS) {
                    planned.add(new PlannedRoute(List.of(new DeliveryStop(node, delivery.getKey(), capacity)), true));
                    remaining -= capacity;
                }
                if (remaining > EPS) {
                    pooled.add(new DeliveryStop(node, delivery.getKey(), remaining));
                }
            }

            List<List<DeliveryStop>> merged = savingsRouteBuilder.build(depot, pooled, distance, time, capacity);
            RouteImprover.Outcome improved = routeImprover.improve(merged, depot, distance, time, capacity, budget);
            budgetHit |= improved.budgetHit();
            for (List<DeliveryStop> stops : improved.routes()) {
                planned.add(new PlannedRoute(stops, true));
            }

            for (int k = 0; k < planned.size(); k++) {
                int vehicle = k % config.getVehiclesPerWarehouse() + 1;
                int trip = k / config.getVehiclesPerWarehouse() + 1;
                routes.add(toRoute(warehouseId, vehicle, trip, planned.get(k), depot, distance, time, config));
            }
        }

        return summarize(routes, budgetHit, budget.iterations(), capacity);
    }

    private RoutingResult.Route toRoute(String warehouseId, int vehicle, int trip, PlannedRoute planned, int depot,
                                        double[][] distance, double[][] time, OptimizerProperties.Routing config) {
        RoutingResult.Route.RouteBuilder route = RoutingResult.Route.builder()
                .vehicleId(warehouseId + "-V" + vehicle)
                .warehouseId(warehouseId)
                .trip(trip);
        List<RoutingResult.Stop> stops = new ArrayList<>();
        double load = 0.0;
        if (!planned.feasible()) {
            for (DeliveryStop stop : planned.stops()) {
                load += stop.quantity();
                stops.add(RoutingResult.Stop.builder()
                        .locationId(stop.locationId())
                        .quantity(stop.quantity())
                        .build());
            }
            return route.stops(stops).load(load).status(SolveStatus.INFEASIBLE).build();
        }

        double clock = 0.0;
        double travelled = 0.0;
        int previous = depot;
        for (DeliveryStop stop : planned.stops()) {
            clock += time[previous][stop.node()];
            travelled += distance[previous][stop.node()];
            double service = config.getServiceTimeMinutes() + stop.quantity() * config.getServiceMinutesPerUnit();
            stops.add(RoutingResult.Stop.builder()
                    .locationId(stop.locationId())
                    .quantity(stop.quantity())
                    .arrivalTime(clock)
                    .serviceTime(service)
                    .build());
            clock += service;
            load += stop.quantity();
            previous = stop.node();
        }
        clock += time[previous][depot];
        travelled += distance[previous][depot];

        double fuelCost = travelled * config.getFuelCostPerKm();
        double driverCost = clock / 60.0 * config.getDriverCostPerHour();
        return route
                .stops(stops)
                .load(load)
                .totalDistance(travelled)
                .totalTime(clock)
                .fuelCost(fuelCost)
                .driverCost(driverCost)
                .totalCost(fuelCost + driverCost)
                .status(SolveStatus.OPTIMAL)
                .build();
    }

    private RoutingResult summarize(List<RoutingResult.Route> routes, boolean budgetHit, int iterations, double capacity) {
        double distance = 0.0;
        double time = 0.0;
        double cost = 0.0;
        double delivered = 0.0;
        int feasibleRoutes = 0;
        boolean anyInfeasible = false;
        for (RoutingResult.Route route : routes) {
            if (route.getStatus() == SolveStatus.INFEASIBLE) {
                anyInfeasible = true;
                continue;
            }
            distance += route.getTotalDistance();
            time += route.getTotalTime();
            cost += route.getTotalCost();
            delivered += route.getLoad();
            feasibleRoutes++;
        }
        int vehiclesUsed = (int) routes.stream().map(RoutingResult.Route::getVehicleId).distinct().count();
        SolveStatus status = anyInfeasible ? SolveStatus.INFEASIBLE
                : budgetHit ? SolveStatus.TIME_LIMIT_REACHED
                : SolveStatus.OPTIMAL;
        String message = anyInfeasible ? "One or more stops cannot be reached from their warehouse"
                : budgetHit ? "Route improvement stopped by the solve budget"
                : "No improving move remains";

        log.info("Routing solved | status={} | routes={} | distance={} | cost={}", status, routes.size(), distance, cost);

        return RoutingResult.builder()
                .status(status)
                .routes(routes)
                .totalDistance(distance)
                .totalTime(time)
                .totalCost(cost)
                .vehicleUtilization(feasibleRoutes > 0 ? delivered / (feasibleRoutes * capacity) : 0.0)
                .vehicleCapacity(capacity)
                .vehiclesUsed(vehiclesUsed)
                .iterations(iterations)
                .message(message)
                .build();
    }

    /** Rows of {@code matrix} re-indexed to the order of {@code reference}. */
    private static double[][] alignedRows(TravelMatrix matrix, TravelMatrix reference) {
        List<String> ids = reference.getLocationIds();
        double[][] rows = new double[ids.size()][ids.size()];
        for (int i = 0; i < ids.size(); i++) {
            for (int j = 0; j < ids.size(); j++) {
                rows[i][j] = matrix.get(ids.get(i), ids.get(j));
            }
        }
        return rows;
    }
}
