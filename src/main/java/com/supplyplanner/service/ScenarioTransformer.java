package com.supplyplanner.service;

import com.supplyplanner.config.OptimizerProperties;
import com.supplyplanner.domain.CapacityRecord;
import com.supplyplanner.domain.CostRecord;
import com.supplyplanner.domain.DemandRecord;
import com.supplyplanner.domain.InputSnapshot;
import com.supplyplanner.domain.Location;
import com.supplyplanner.domain.RouteEdge;
import com.supplyplanner.domain.ScenarioSpec;
import com.supplyplanner.domain.TravelMatrix;
import com.supplyplanner.exception.ValidationException;
import com.supplyplanner.solver.TravelMatrices;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives a perturbed snapshot from a baseline and a scenario spec. The baseline is
 * never modified. Perturbations apply in a fixed order: demand, capacity (multiplier,
 * then overrides), cost, location removal, route blockage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScenarioTransformer {

    private final OptimizerProperties properties;
    private final Validator validator;

    public InputSnapshot apply(InputSnapshot baseline, ScenarioSpec spec) {
        checkSpec(baseline, spec);
        Set<String> removed = spec.getRemovedLocationIds();

        List<Location> locations = baseline.getLocations().stream()
                .filter(l -> !removed.contains(l.getId()))
                .toList();

        List<DemandRecord> demands = baseline.getDemands().stream()
                .filter(d -> !removed.contains(d.getStoreId()))
                .map(d -> inScope(spec, d.getStoreId())
                        ? d.toBuilder().quantity(d.getQuantity() * spec.getDemandMultiplier()).build()
                        : d)
                .toList();

        List<CapacityRecord> capacities = baseline.getCapacities().stream()
                .filter(c -> !removed.contains(c.getWarehouseId()))
                .map(c -> c.toBuilder()
                        .capacity(spec.getCapacityOverrides().getOrDefault(c.getWarehouseId(),
                                c.getCapacity() * spec.getCapacityMultiplier()))
                        .build())
                .toList();

        List<CostRecord> costs = baseline.getCosts().stream()
                .filter(c -> !removed.contains(c.getFromLocationId()) && !removed.contains(c.getToLocationId()))
                .map(c -> c.toBuilder().cost(c.getCost() * spec.getCostMultiplier()).build())
                .toList();

        TravelMatrix distance = baseline.getDistanceMatrix();
        TravelMatrix time = baseline.getTimeMatrix();
        List<RouteEdge> blocked = spec.isRouteBlockage() ? blockedEdges(spec) : List.of();
        if (!blocked.isEmpty() && distance == null) {
            // blockage needs an explicit matrix to write into
            distance = TravelMatrices.haversine(baseline.getLocations());
        }
        if (distance != null) {
            distance = block(distance.without(removed), blocked);
        }
        if (time != null) {
            time = block(time.without(removed), blocked);
        }

        log.debug("Scenario applied | name={} | removed={} | blockedEdges={}", spec.getName(), removed.size(), blocked.size());

        return baseline.toBuilder()
                .clearLocations().locations(locations)
                .clearDemands().demands(demands)
                .clearCapacities().capacities(capacities)
                .clearCosts().costs(costs)
                .distanceMatrix(distance)
                .timeMatrix(time)
                .build();
    }

    private void checkSpec(InputSnapshot baseline, ScenarioSpec spec) {
        if (spec == null) {
            throw new ValidationException("scenario spec is required");
        }
        List<String> problems = new ArrayList<>();
        for (ConstraintViolation<ScenarioSpec> violation : validator.validate(spec)) {
            problems.add("scenario " + violation.getPropertyPath() + " " + violation.getMessage());
        }
        checkFinite("demandMultiplier", spec.getDemandMultiplier(), problems);
        checkFinite("capacityMultiplier", spec.getCapacityMultiplier(), problems);
        checkFinite("costMultiplier", spec.getCostMultiplier(), problems);

        Set<String> known = baseline.getLocations().stream().map(Location::getId).collect(Collectors.toSet());
        Set<String> warehouses = baseline.warehouses().stream().map(Location::getId).collect(Collectors.toSet());
        Set<String> stores = baseline.stores().stream().map(Location::getId).collect(Collectors.toSet());
        spec.getDemandScope().stream()
                .filter(id -> !stores.contains(id))
                .forEach(id -> problems.add("scenario demand scope names unknown store '" + id + "'"));
        for (Map.Entry<String, Double> override : spec.getCapacityOverrides().entrySet()) {
            if (!warehouses.contains(override.getKey())) {
                problems.add("scenario capacity override names unknown warehouse '" + override.getKey() + "'");
            }
            if (override.getValue() == null || !Double.isFinite(override.getValue()) || override.getValue() < 0) {
                problems.add("scenario capacity override for '" + override.getKey() + "' is invalid: " + override.getValue());
            }
        }
        spec.getRemovedLocationIds().stream()
                .filter(id -> !known.contains(id))
                .forEach(id -> problems.add("scenario removes unknown location '" + id + "'"));
        if (spec.isRouteBlockage()) {
            for (RouteEdge edge : blockedEdges(spec)) {
                if (!known.contains(edge.getFromLocationId()) || !known.contains(edge.getToLocationId())) {
                    problems.add("scenario blocks unknown edge " + edge.getFromLocationId() + " -> " + edge.getToLocationId());
                } else if (edge.getFromLocationId().equals(edge.getToLocationId())) {
                    problems.add("scenario blocks self edge at '" + edge.getFromLocationId() + "'");
                }
            }
        }
        if (!problems.isEmpty()) {
            problems.sort(Comparator.naturalOrder());
            throw new ValidationException(problems);
        }
    }

    private List<RouteEdge> blockedEdges(ScenarioSpec spec) {
        return spec.getBlockedRoutes().isEmpty()
                ? properties.getScenario().defaultBlockedEdges()
                : spec.getBlockedRoutes();
    }

    private TravelMatrix block(TravelMatrix matrix, List<RouteEdge> edges) {
        double penalty = properties.getScenario().getBlockagePenaltyFactor();
        TravelMatrix result = matrix;
        for (RouteEdge edge : edges) {
            String from = edge.getFromLocationId();
            String to = edge.getToLocationId();
            if (!result.contains(from) || !result.contains(to)) {
                // an endpoint was removed by the same scenario
                continue;
            }
            result = result.withEdge(from, to, penalty > 0 ? result.get(from, to) * penalty : Double.POSITIVE_INFINITY);
            result = result.withEdge(to, from, penalty > 0 ? result.get(to, from) * penalty : Double.POSITIVE_INFINITY);
        }
        return result;
    }

    private static boolean inScope(ScenarioSpec spec, String storeId) {
        return spec.getDemandScope().isEmpty() || spec.getDemandScope().contains(storeId);
    }

    private static void checkFinite(String field, double value, List<String> problems) {
        if (!Double.isFinite(value)) {
            problems.add("scenario " + field + " must be finite");
        }
    }
}
