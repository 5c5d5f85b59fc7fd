package com.supplyplanner.service;

import com.supplyplanner.domain.CapacityRecord;
import com.supplyplanner.domain.CostRecord;
import com.supplyplanner.domain.DemandRecord;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.Location;
import com.supplyplanner.domain.TravelMatrix;
import com.supplyplanner.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Referential and structural checks on an input snapshot. Collects every problem
 * and raises a single {@link ValidationException} before any solver runs.
 */
@Slf4j
@Component
public class SnapshotValidator {

    public void validate(InputSnapshot snapshot) {
        if (snapshot == null) {
            throw new ValidationException("snapshot is required");
        }
        List<String> problems = new ArrayList<>();
        Map<String, Location> locations = checkLocations(snapshot, problems);
        checkCapacities(snapshot, locations, problems);
        checkDemands(snapshot, locations, problems);
        checkCosts(snapshot, locations, problems);
        checkMatrix("distance", snapshot.getDistanceMatrix(), locations, problems);
        checkMatrix("time", snapshot.getTimeMatrix(), locations, problems);
        if (snapshot.getDistanceMatrix() == null) {
            locations.values().stream()
                    .filter(l -> !l.hasCoordinates())
                    .forEach(l -> problems.add("location '" + l.getId()
                            + "' needs coordinates when no distance matrix is supplied"));
        }
        if (!problems.isEmpty()) {
            log.warn("Snapshot rejected | label={} | problems={}", snapshot.getLabel(), problems.size());
            throw new ValidationException(problems);
        }
    }

    private Map<String, Location> checkLocations(InputSnapshot snapshot, List<String> problems) {
        Map<String, Location> byId = new LinkedHashMap<>();
        if (snapshot.getLocations().isEmpty()) {
            problems.add("snapshot has no locations");
        }
        for (Location location : snapshot.getLocations()) {
            if (location.getId() == null || location.getId().isBlank()) {
                problems.add("location with blank id");
                continue;
            }
            if (byId.putIfAbsent(location.getId(), location) != null) {
                problems.add("duplicate location id '" + location.getId() + "'");
            }
            if (location.getKind() == null) {
                problems.add("location '" + location.getId() + "' has no kind");
            }
            Double lat = location.getLatitude();
            Double lon = location.getLongitude();
            if ((lat == null) != (lon == null)) {
                problems.add("location '" + location.getId() + "' has only one of latitude/longitude");
            } else if (lat != null && (lat < -90 || lat > 90 || lon < -180 || lon > 180)) {
                problems.add("location '" + location.getId() + "' has out-of-range coordinates");
            }
        }
        return byId;
    }

    private void checkCapacities(InputSnapshot snapshot, Map<String, Location> locations, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (CapacityRecord record : snapshot.getCapacities()) {
            Location warehouse = locations.get(record.getWarehouseId());
            if (warehouse == null || !warehouse.isWarehouse()) {
                problems.add("capacity record references unknown warehouse '" + record.getWarehouseId() + "'");
            }
            if (!seen.add(String.valueOf(record.getWarehouseId()))) {
                problems.add("duplicate capacity record for warehouse '" + record.getWarehouseId() + "'");
            }
            if (!Double.isFinite(record.getCapacity()) || record.getCapacity() < 0) {
                problems.add("warehouse '" + record.getWarehouseId() + "' has invalid capacity " + record.getCapacity());
            }
        }
        locations.values().stream()
                .filter(Location::isWarehouse)
                .filter(w -> !seen.contains(w.getId()))
                .forEach(w -> problems.add("warehouse '" + w.getId() + "' has no capacity record"));
    }

    private void checkDemands(InputSnapshot snapshot, Map<String, Location> locations, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (DemandRecord record : snapshot.getDemands()) {
            Location store = locations.get(record.getStoreId());
            if (store == null || !store.isStore()) {
                problems.add("demand record references unknown store '" + record.getStoreId() + "'");
            }
            if (record.getPeriod() == null || record.getPeriod().isBlank()) {
                problems.add("demand record for store '" + record.getStoreId() + "' has no period");
            } else if (!seen.add(record.getStoreId() + "\u0000" + record.getPeriod())) {
                problems.add("duplicate demand for store '" + record.getStoreId()
                        + "' in period '" + record.getPeriod() + "'");
            }
            if (!Double.isFinite(record.getQuantity()) || record.getQuantity() < 0) {
                problems.add("store '" + record.getStoreId() + "' has invalid demand " + record.getQuantity());
            }
        }
    }

    private void checkCosts(InputSnapshot snapshot, Map<String, Location> locations, List<String> problems) {
        Set<String> seen = new HashSet<>();
        for (CostRecord record : snapshot.getCosts()) {
            Location from = locations.get(record.getFromLocationId());
            Location to = locations.get(record.getToLocationId());
            if (from == null || !from.isWarehouse()) {
                problems.add("cost record starts at unknown warehouse '" + record.getFromLocationId() + "'");
            }
            if (to == null || !to.isStore()) {
                problems.add("cost record ends at unknown store '" + record.getToLocationId() + "'");
            }
            if (!seen.add(record.getFromLocationId() + "\u0000" + record.getToLocationId())) {
                problems.add("duplicate cost record " + record.getFromLocationId() + " -> " + record.getToLocationId());
            }
            if (!Double.isFinite(record.getCost()) || record.getCost() < 0) {
                problems.add("cost " + record.getFromLocationId() + " -> " + record.getToLocationId()
                        + " is invalid: " + record.getCost());
            }
        }
    }

    private void checkMatrix(String name, TravelMatrix matrix, Map<String, Location> locations, List<String> problems) {
        if (matrix == null) {
            return;
        }
        for (String id : matrix.getLocationIds()) {
            if (!locations.containsKey(id)) {
                problems.add(name + " matrix references unknown location '" + id + "'");
            }
        }
        for (String id : locations.keySet()) {
            if (!matrix.contains(id)) {
                problems.add(name + " matrix has no entry for location '" + id + "'");
            }
        }
    }
}
