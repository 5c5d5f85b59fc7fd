package com.supplyplanner.service;

import com.supplyplanner.SupplyChainFixtures;
import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.domain.CapacityRecord;
import com.supplyplanner.domain.CostRecord;
import com.supplyplanner.domain.DemandRecord;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.Location;
import com.supplyplanner.domain.RouteEdge;
import com.supplyplanner.domain.ScenarioSpec;
import com.supplyplanner.exception.ValidationException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScenarioTransformerTest {

    private OptimizerProperties properties;
    private ScenarioTransformer transformer;
    private InputSnapshot baseline;

    @BeforeEach
    void setUp() {
        properties = new OptimizerProperties();
        transformer = new ScenarioTransformer(properties, Validation.buildDefaultValidatorFactory().getValidator());
        baseline = SupplyChainFixtures.baseline();
    }

    private static double demandOf(InputSnapshot snapshot, String storeId) {
        return snapshot.getDemands().stream()
                .filter(d -> d.getStoreId().equals(storeId))
                .mapToDouble(DemandRecord::getQuantity)
                .sum();
    }

    private static double capacityOf(InputSnapshot snapshot, String warehouseId) {
        return snapshot.getCapacities().stream()
                .filter(c -> c.getWarehouseId().equals(warehouseId))
                .mapToDouble(CapacityRecord::getCapacity)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void apply_identity_equalsBaseline() {
        InputSnapshot result = transformer.apply(baseline, ScenarioSpec.identity("noop"));

        assertThat(result).isEqualTo(baseline);
    }

    @Test
    void apply_demandMultiplier_scalesAllStoresAndLeavesBaselineUntouched() {
        InputSnapshot result = transformer.apply(baseline,
                ScenarioSpec.builder().name("surge").demandMultiplier(1.4).build());

        assertThat(demandOf(result, "store_1")).isCloseTo(3 * 850 * 1.4, within(1e-9));
        assertThat(demandOf(baseline, "store_1")).isCloseTo(3 * 850, within(1e-9));
    }

    @Test
    void apply_demandScope_limitsScaling() {
        InputSnapshot result = transformer.apply(baseline, ScenarioSpec.builder()
                .name("local")
                .demandMultiplier(2.0)
                .scopedStore("store_2")
                .build());

        assertThat(demandOf(result, "store_2")).isCloseTo(3 * 650 * 2.0, within(1e-9));
        assertThat(demandOf(result, "store_1")).isCloseTo(3 * 850, within(1e-9));
    }

    @Test
    void apply_capacityOverrideWinsOverMultiplier() {
        InputSnapshot result = transformer.apply(baseline, ScenarioSpec.builder()
                .name("constrained")
                .capacityMultiplier(0.5)
                .capacityOverride("warehouse_2", 100.0)
                .build());

        assertThat(capacityOf(result, "warehouse_1")).isCloseTo(1750.0, within(1e-9));
        assertThat(capacityOf(result, "warehouse_2")).isCloseTo(100.0, within(1e-9));
        assertThat(capacityOf(result, "warehouse_3")).isCloseTo(1400.0, within(1e-9));
    }

    @Test
    void apply_costMultiplier_scalesUnitCostsOnly() {
        InputSnapshot result = transformer.apply(baseline,
                ScenarioSpec.builder().name("fuel").costMultiplier(1.1).build());

        assertThat(result.getCosts()).extracting(CostRecord::getCost)
                .first().satisfies(c -> assertThat(c).isCloseTo(8.50 * 1.1, within(1e-9)));
        assertThat(result.getDistanceMatrix()).isEqualTo(baseline.getDistanceMatrix());
    }

    @Test
    void apply_removedLocation_dropsEverythingThatReferencesIt() {
        InputSnapshot result = transformer.apply(baseline, ScenarioSpec.builder()
                .name("closure")
                .removedLocation("warehouse_1")
                .build());

        assertThat(result.getLocations()).extracting(Location::getId).doesNotContain("warehouse_1");
        assertThat(result.getCapacities()).extracting(CapacityRecord::getWarehouseId).doesNotContain("warehouse_1");
        assertThat(result.getCosts()).extracting(CostRecord::getFromLocationId).doesNotContain("warehouse_1");
        assertThat(result.getDistanceMatrix().contains("warehouse_1")).isFalse();
        assertThat(result.getTimeMatrix().size()).isEqualTo(7);
    }

    @Test
    void apply_routeBlockage_blocksBothDirectionsInBothMatrices() {
        InputSnapshot result = transformer.apply(baseline, ScenarioSpec.builder()
                .name("bridge out")
                .routeBlockage(true)
                .blockedRoute(RouteEdge.of("warehouse_2", "store_3"))
                .build());

        assertThat(result.getDistanceMatrix().get("warehouse_2", "store_3")).isInfinite();
        assertThat(result.getDistanceMatrix().get("store_3", "warehouse_2")).isInfinite();
        assertThat(result.getTimeMatrix().get("warehouse_2", "store_3")).isInfinite();
        assertThat(result.getDistanceMatrix().get("warehouse_1", "store_1")).isEqualTo(15.2);
    }

    @Test
    void apply_routeBlockageWithoutEdges_usesConfiguredDefaults() {
        OptimizerProperties.BlockedRoute configured = new OptimizerProperties.BlockedRoute();
        configured.setFrom("warehouse_1");
        configured.setTo("store_1");
        properties.getScenario().setBlockedRoutes(List.of(configured));

        InputSnapshot result = transformer.apply(baseline,
                ScenarioSpec.builder().name("default blockage").routeBlockage(true).build());

        assertThat(result.getDistanceMatrix().get("warehouse_1", "store_1")).isInfinite();
    }

    @Test
    void apply_penaltyFactor_multipliesInsteadOfRemoving() {
        properties.getScenario().setBlockagePenaltyFactor(3.0);

        InputSnapshot result = transformer.apply(baseline, ScenarioSpec.builder()
                .name("detour")
                .routeBlockage(true)
                .blockedRoute(RouteEdge.of("warehouse_1", "store_1"))
                .build());

        assertThat(result.getDistanceMatrix().get("warehouse_1", "store_1")).isCloseTo(45.6, within(1e-9));
        assertThat(result.getTimeMatrix().get("store_1", "warehouse_1")).isCloseTo(75.0, within(1e-9));
    }

    @Test
    void apply_blockageWithoutDistanceMatrix_derivesOneFromCoordinates() {
        InputSnapshot noMatrices = SupplyChainFixtures.baselineBuilder().distanceMatrix(null).timeMatrix(null).build();

        InputSnapshot result = transformer.apply(noMatrices, ScenarioSpec.builder()
                .name("bridge out")
                .routeBlockage(true)
                .blockedRoute(RouteEdge.of("warehouse_1", "store_1"))
                .build());

        assertThat(result.getDistanceMatrix()).isNotNull();
        assertThat(result.getDistanceMatrix().get("warehouse_1", "store_1")).isInfinite();
        assertThat(result.getDistanceMatrix().get("warehouse_1", "store_2")).isFinite().isPositive();
        assertThat(result.getTimeMatrix()).isNull();
    }

    @Test
    void apply_negativeMultiplier_throwsValidationException() {
        ScenarioSpec spec = ScenarioSpec.builder().name("bad").demandMultiplier(-1.0).build();

        assertThatThrownBy(() -> transformer.apply(baseline, spec))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getProblems())
                        .anySatisfy(p -> assertThat(p).contains("demandMultiplier")));
    }

    @Test
    void apply_nonFiniteMultiplier_throwsValidationException() {
        ScenarioSpec spec = ScenarioSpec.builder().name("bad").costMultiplier(Double.POSITIVE_INFINITY).build();

        assertThatThrownBy(() -> transformer.apply(baseline, spec))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void apply_unknownIds_listsEveryProblem() {
        ScenarioSpec spec = ScenarioSpec.builder()
                .name("typos")
                .scopedStore("store_9")
                .capacityOverride("warehouse_9", 10.0)
                .removedLocation("nowhere")
                .routeBlockage(true)
                .blockedRoute(RouteEdge.of("store_1", "store_1"))
                .build();

        assertThatThrownBy(() -> transformer.apply(baseline, spec))
                .isInstanceOf(ValidationException.class)
                .satisfies(ex -> assertThat(((ValidationException) ex).getProblems()).hasSize(4));
    }

    @Test
    void apply_blankName_throwsValidationException() {
        ScenarioSpec spec = ScenarioSpec.builder().name(" ").build();

        assertThatThrownBy(() -> transformer.apply(baseline, spec))
                .isInstanceOf(ValidationException.class);
    }
}
