package com.supplyplanner.dto;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AllocationResultTest {

    @Test
    void builder_copiesNestedAllocations() {
        Map<String, Double> shipments = new LinkedHashMap<>();
        shipments.put("store_1", 300.0);
        Map<String, Map<String, Double>> allocations = new LinkedHashMap<>();
        allocations.put("warehouse_1", shipments);

        AllocationResult result = AllocationResult.builder()
                .status(SolveStatus.OPTIMAL)
                .allocations(allocations)
                .build();
        shipments.put("store_1", 999_999.0);
        allocations.put("warehouse_2", Map.of("store_2", 1.0));

        assertThat(result.getAllocations()).containsOnlyKeys("warehouse_1");
        assertThat(result.getAllocations().get("warehouse_1")).containsEntry("store_1", 300.0);
        assertThat(result.totalAllocated()).isEqualTo(300.0);
    }

    @Test
    void builder_unsetMapsAreEmptyAndReadOnly() {
        AllocationResult result = AllocationResult.builder().status(SolveStatus.INFEASIBLE).build();

        assertThat(result.getAllocations()).isEmpty();
        assertThat(result.getStoreFulfillment()).isEmpty();
        assertThatThrownBy(() -> result.getWarehouseUtilization().put("warehouse_1", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
