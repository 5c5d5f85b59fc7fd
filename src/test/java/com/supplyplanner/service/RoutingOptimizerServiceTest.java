package com.supplyplanner.service;

import com.supplyplanner.SupplyChainFixtures;
import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.dto.AllocationResult;
import com.supplyplanner.dto.RoutingResult;
import com.supplyplanner.dto.SolveStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RoutingOptimizerServiceTest {

    private OptimizerProperties properties;
    private RoutingOptimizerService service;

    @BeforeEach
    void setUp() {
        properties = new OptimizerProperties();
        service = new RoutingOptimizerService(properties);
    }

    private static AllocationResult allocation(Map<String, Map<String, Double>> allocations) {
        return AllocationResult.builder()
                .status(SolveStatus.OPTIMAL)
                .allocations(allocations)
                .build();
    }

    /** Every store served by its cheapest warehouse. */
    private static AllocationResult referenceAllocation() {
        return allocation(Map.of(
                "warehouse_1", Map.of("store_1", 850.0),
                "warehouse_2", Map.of("store_2", 650.0, "store_3", 980.0, "store_4", 720.0),
                "warehouse_3", Map.of("store_5", 1100.0)));
    }

    private static Map<String, Double> deliveredPerStore(RoutingResult result) {
        Map<String, Double> delivered = new HashMap<>();
        for (RoutingResult.Route route : result.getRoutes()) {
            for (RoutingResult.Stop stop : route.getStops()) {
                delivered.merge(stop.getLocationId(), stop.getQuantity(), Double::sum);
            }
        }
        return delivered;
    }

    @Test
    void route_referenceAllocation_deliversEverythingWithinCapacity() {
        RoutingResult result = service.route(SupplyChainFixtures.baseline(), referenceAllocation());

        assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.getRoutes()).allSatisfy(route -> {
            assertThat(route.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
            assertThat(route.getLoad()).isLessThanOrEqualTo(1000.0 + 1e-9);
        });
        Map<String, Double> delivered = deliveredPerStore(result);
        for (int s = 0; s < SupplyChainFixtures.STORES.size(); s++) {
            assertThat(delivered.get(SupplyChainFixtures.STORES.get(s)))
                    .isCloseTo(SupplyChainFixtures.DEMANDS[s], within(1e-9));
        }
        assertThat(result.getTotalDistance()).isPositive();
        assertThat(result.getTotalCost()).isCloseTo(
                result.getRoutes().stream().mapToDouble(RoutingResult.Route::getTotalCost).sum(), within(1e-9));
        assertThat(result.getVehicleUtilization()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0);
    }

    @Test
    void route_quantityAboveTruckCapacity_splitIntoFullLoadAndRemainder() {
        RoutingResult result = service.route(SupplyChainFixtures.baseline(), referenceAllocation());

        List<Double> store5Loads = result.getRoutes().stream()
                .filter(r -> r.getWarehouseId().equals("warehouse_3"))
                .map(RoutingResult.Route::getLoad)
                .sorted()
                .toList();
        assertThat(store5Loads).hasSize(2);
        assertThat(store5Loads.get(0)).isCloseTo(100.0, within(1e-9));
        assertThat(store5Loads.get(1)).isCloseTo(1000.0, within(1e-9));
    }

    @Test
    void route_singleStop_costsFromMatrices() {
        AllocationResult allocation = allocation(Map.of("warehouse_1", Map.of("store_1", 500.0)));

        RoutingResult result = service.route(SupplyChainFixtures.baseline(), allocation);

        RoutingResult.Route route = result.getRoutes().get(0);
        assertThat(route.getVehicleId()).isEqualTo("warehouse_1-V1");
        assertThat(route.getTotalDistance()).isCloseTo(30.4, within(1e-9));
        // 25 out, 15 service, 25 back
        assertThat(route.getTotalTime()).isCloseTo(65.0, within(1e-9));
        assertThat(route.getFuelCost()).isCloseTo(15.2, within(1e-9));
        assertThat(route.getDriverCost()).isCloseTo(65.0 / 60.0 * 25.0, within(1e-9));
        assertThat(route.getStops().get(0).getArrivalTime()).isCloseTo(25.0, within(1e-9));
        assertThat(result.getVehicleUtilization()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void route_costRecordRateAttributes_configuredRatesApply() {
        InputSnapshot baseline = SupplyChainFixtures.baseline();
        InputSnapshot snapshot = baseline.toBuilder()
                .clearCosts()
                .costs(baseline.getCosts().stream()
                        .map(c -> c.toBuilder().attribute("fuel_cost", 99.0).attribute("driver_cost", 99.0).build())
                        .toList())
                .build();
        AllocationResult allocation = allocation(Map.of("warehouse_1", Map.of("store_1", 500.0)));

        RoutingResult.Route route = service.route(snapshot, allocation).getRoutes().get(0);

        assertThat(route.getFuelCost()).isCloseTo(30.4 * 0.5, within(1e-9));
        assertThat(route.getDriverCost()).isCloseTo(65.0 / 60.0 * 25.0, within(1e-9));
    }

    @Test
    void route_blockedOutboundEdge_routeInfeasible() {
        InputSnapshot snapshot = SupplyChainFixtures.baselineBuilder()
                .distanceMatrix(SupplyChainFixtures.baseline().getDistanceMatrix()
                        .withEdge("warehouse_1", "store_1", Double.POSITIVE_INFINITY))
                .build();

        RoutingResult result = service.route(snapshot, referenceAllocation());

        assertThat(result.getStatus()).isEqualTo(SolveStatus.INFEASIBLE);
        assertThat(result.getRoutes())
                .filteredOn(r -> r.getStatus() == SolveStatus.INFEASIBLE)
                .singleElement()
                .satisfies(r -> assertThat(r.getStops()).extracting(RoutingResult.Stop::getLocationId)
                        .containsExactly("store_1"));
        assertThat(result.getTotalDistance()).isFinite();
    }

    @Test
    void route_infeasibleAllocation_skipped() {
        AllocationResult infeasible = AllocationResult.builder().status(SolveStatus.INFEASIBLE).build();

        RoutingResult result = service.route(SupplyChainFixtures.baseline(), infeasible);

        assertThat(result.getStatus()).isEqualTo(SolveStatus.SKIPPED);
        assertThat(result.getRoutes()).isEmpty();
    }

    @Test
    void route_emptyAllocation_noRoutes() {
        RoutingResult result = service.route(SupplyChainFixtures.baseline(), allocation(Map.of()));

        assertThat(result.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(result.getRoutes()).isEmpty();
        assertThat(result.getVehicleUtilization()).isZero();
        assertThat(result.getVehiclesUsed()).isZero();
    }

    @Test
    void route_withoutMatrices_fallsBackToCoordinates() {
        InputSnapshot snapshot = SupplyChainFixtures.baselineBuilder()
                .distanceMatrix(null)
                .timeMatrix(null)
                .build();
        AllocationResult allocation = allocation(Map.of("warehouse_1", Map.of("store_1", 500.0)));

        RoutingResult result = service.route(snapshot, allocation);

        RoutingResult.Route route = result.getRoutes().get(0);
        assertThat(route.getStatus()).isEqualTo(SolveStatus.OPTIMAL);
        assertThat(route.getTotalDistance()).isPositive();
        assertThat(route.getTotalTime()).isCloseTo(route.getTotalDistance() / 50.0 * 60.0 + 15.0, within(1e-9));
    }

    @Test
    void route_moreTripsThanVehicles_assignsRoundRobin() {
        properties.getRouting().setVehiclesPerWarehouse(2);
        AllocationResult allocation = allocation(Map.of("warehouse_1", Map.of("store_1", 3000.0)));

        RoutingResult result = service.route(SupplyChainFixtures.baseline(), allocation);

        assertThat(result.getRoutes()).hasSize(3);
        assertThat(result.getRoutes()).extracting(RoutingResult.Route::getVehicleId)
                .containsExactly("warehouse_1-V1", "warehouse_1-V2", "warehouse_1-V1");
        assertThat(result.getRoutes()).extracting(RoutingResult.Route::getTrip)
                .containsExactly(1, 1, 2);
        assertThat(result.getVehiclesUsed()).isEqualTo(2);
    }
}
