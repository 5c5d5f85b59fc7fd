package com.supplyplanner.service;

import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.domain.CapacityRecord;
import com.supplyplanner.domain.CostRecord;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.Location;
import com.supplyplanner.dto.AllocationResult;
import com.supplyplanner.dto.ForecastResult;
import com.supplyplanner.dto.SolveStatus;
import com.supplyplanner.solver.SolveBudget;
import com.supplyplanner.solver.TransportationSolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assigns forecast store demand to warehouse capacity at minimum shipping cost.
 * Never returns a partial allocation: either every store's requirement is met or the
 * result is {@link SolveStatus#INFEASIBLE} with an empty allocation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AllocationOptimizerService {

    private static final double EPS = 1e-9;
    private static final double MIN_QUANTITY = 1e-6;

    private final OptimizerProperties properties;
    private final TransportationSolver solver = new TransportationSolver();

    public AllocationResult allocate(InputSnapshot snapshot, ForecastResult forecast) {
        OptimizerProperties.Allocation config = properties.getAllocation();
        List<String> warehouses = snapshot.warehouses().stream().map(Location::getId).toList();
        List<String> stores = snapshot.stores().stream().map(Location::getId).toList();

        Map<String, Double> capacityById = new LinkedHashMap<>();
        for (String warehouse : warehouses) {
            capacityById.put(warehouse, 0.0);
        }
        for (CapacityRecord record : snapshot.getCapacities()) {
            capacityById.computeIfPresent(record.getWarehouseId(), (k, v) -> record.getCapacity());
        }
        Map<String, Double> required = new LinkedHashMap<>();
        for (String store : stores) {
            required.put(store, forecast.getStoreDemand().getOrDefault(store, 0.0) * config.getFulfillmentFloor());
        }

        double[] supply = warehouses.stream().mapToDouble(capacityById::get).toArray();
        double[] demand = stores.stream().mapToDouble(required::get).toArray();
        double[][] cost = new double[warehouses.size()][stores.size()];
        for (double[] row : cost) {
            Arrays.fill(row, Double.POSITIVE_INFINITY);
        }
        for (CostRecord record : snapshot.getCosts()) {
            int w = warehouses.indexOf(record.getFromLocationId());
            int s = stores.indexOf(record.getToLocationId());
            if (w >= 0 && s >= 0) {
                cost[w][s] = record.getCost();
            }
        }

        double totalCapacity = Arrays.stream(supply).sum();
        double totalRequired = Arrays.stream(demand).sum();
        AllocationResult.AllocationResultBuilder result = AllocationResult.builder()
                .requiredDemand(required)
                .warehouseCapacity(capacityById);

        String unreachable = firstUnreachableStore(stores, demand, cost);
        if (unreachable != null) {
            return infeasible(result, "Store '" + unreachable + "' has demand but no warehouse can supply it", 0);
        }
        if (totalCapacity < totalRequired - EPS) {
            return infeasible(result, String.format(
                    "Total capacity %.4f is below required demand %.4f", totalCapacity, totalRequired), 0);
        }

        SolveBudget budget = SolveBudget.of(config.getMaxIterations(), config.getTimeLimit());
        TransportationSolver.Solution solution = solver.solve(supply, demand, cost, budget);
        if (solution.outcome() == TransportationSolver.Outcome.INFEASIBLE) {
            return infeasible(result, solution.message(), solution.iterations());
        }

        Map<String, Map<String, Double>> allocations = new LinkedHashMap<>();
        Map<String, Double> shipped = new LinkedHashMap<>();
        Map<String, Double> received = new LinkedHashMap<>();
        double objective = 0.0;
        int edgesUsed = 0;
        for (int w = 0; w < warehouses.size(); w++) {
            for (int s = 0; s < stores.size(); s++) {
                double quantity = solution.flow()[w][s];
                if (quantity < MIN_QUANTITY) continue;
                allocations.computeIfAbsent(warehouses.get(w), k -> new LinkedHashMap<>()).put(stores.get(s), quantity);
                shipped.merge(warehouses.get(w), quantity, Double::sum);
                received.merge(stores.get(s), quantity, Double::sum);
                objective += quantity * cost[w][s];
                edgesUsed++;
            }
        }

        Map<String, Double> warehouseUtilization = new LinkedHashMap<>();
        for (String warehouse : warehouses) {
            double capacity = capacityById.get(warehouse);
            warehouseUtilization.put(warehouse,
                    capacity > EPS ? shipped.getOrDefault(warehouse, 0.0) / capacity * 100.0 : 0.0);
        }
        Map<String, Double> storeFulfillment = new LinkedHashMap<>();
        for (String store : stores) {
            double need = required.get(store);
            storeFulfillment.put(store, need > EPS ? received.getOrDefault(store, 0.0) / need * 100.0 : 100.0);
        }
        double totalShipped = shipped.values().stream().mapToDouble(Double::doubleValue).sum();
        SolveStatus status = solution.outcome() == TransportationSolver.Outcome.OPTIMAL
                ? SolveStatus.OPTIMAL : SolveStatus.TIME_LIMIT_REACHED;

        log.info("Allocation solved | status={} | objective={} | edgesUsed={} | iterations={}",
                status, objective, edgesUsed, solution.iterations());

        return result
                .status(status)
                .allocations(allocations)
                .objectiveValue(objective)
                .capacityUtilization(totalCapacity > EPS ? totalShipped / totalCapacity * 100.0 : 0.0)
                .warehouseUtilization(warehouseUtilization)
                .storeFulfillment(storeFulfillment)
                .edgesUsed(edgesUsed)
                .iterations(solution.iterations())
                .message(solution.message())
                .build();
    }

    private AllocationResult infeasible(AllocationResult.AllocationResultBuilder result, String reason, int iterations) {
        log.warn("Allocation infeasible | reason={}", reason);
        return result
                .status(SolveStatus.INFEASIBLE)
                .iterations(iterations)
                .message(reason)
                .build();
    }

    private static String firstUnreachableStore(List<String> stores, double[] demand, double[][] cost) {
        for (int s = 0; s < stores.size(); s++) {
            if (demand[s] <= EPS) continue;
            boolean reachable = false;
            for (double[] row : cost) {
                if (Double.isFinite(row[s])) {
                    reachable = true;
                    break;
                }
            }
            if (!reachable) {
                return stores.get(s);
            }
        }
        return null;
    }
}
