package com.supplyplanner.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Immutable supply chain input: the network, warehouse capacities, demand history,
 * warehouse-to-store unit costs and optional travel matrices. Scenario transforms
 * derive new snapshots through {@link #toBuilder()}, never by mutation.
 */
@Value
@Builder(toBuilder = true)
public class InputSnapshot {
    String label;
    @Singular
    List<Location> locations;
    @Singular
    List<CapacityRecord> capacities;
    @Singular
    List<DemandRecord> demands;
    @Singular
    List<CostRecord> costs;
    TravelMatrix distanceMatrix;
    TravelMatrix timeMatrix;

    public List<Location> warehouses() {
        return locations.stream()
                .filter(Location::isWarehouse)
                .sorted(Comparator.comparing(Location::getId))
                .toList();
    }

    public List<Location> stores() {
        return locations.stream()
                .filter(Location::isStore)
                .sorted(Comparator.comparing(Location::getId))
                .toList();
    }

    public Optional<Location> location(String id) {
        return locations.stream().filter(l -> l.getId().equals(id)).findFirst();
    }
}
