package com.supplyplanner.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;

/**
 * A named what-if perturbation of a baseline snapshot.
 * <ul>
 *   <li>{@code demandMultiplier} scales demand of the stores in {@code demandScope} (all stores when empty)</li>
 *   <li>{@code capacityMultiplier} scales every warehouse, then {@code capacityOverrides} set absolute values</li>
 *   <li>{@code costMultiplier} scales every warehouse-to-store unit cost</li>
 *   <li>{@code routeBlockage} blocks {@code blockedRoutes} (or the configured default edges) in both directions</li>
 *   <li>{@code removedLocationIds} drops locations with their capacities, demand and edges</li>
 * </ul>
 * Two specs are the same scenario exactly when they are {@code equals}.
 */
@Value
@Builder(toBuilder = true)
public class ScenarioSpec {
    @NotBlank
    String name;

    @Builder.Default
    @DecimalMin("0.0")
    double demandMultiplier = 1.0;

    @Singular("scopedStore")
    SortedSet<String> demandScope;

    @Builder.Default
    @DecimalMin("0.0")
    double capacityMultiplier = 1.0;

    @Singular
    SortedMap<String, Double> capacityOverrides;

    @Builder.Default
    @DecimalMin("0.0")
    double costMultiplier = 1.0;

    boolean routeBlockage;

    @Singular
    List<RouteEdge> blockedRoutes;

    @Singular("removedLocation")
    SortedSet<String> removedLocationIds;

    /** Spec that leaves the baseline untouched. */
    public static ScenarioSpec identity(String name) {
        return ScenarioSpec.builder().name(name).build();
    }
}
